package com.ryuqq.resilience.core.spi.noop;

import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.model.SystemEvent;
import com.ryuqq.resilience.core.spi.ResilienceMetrics;

/**
 * ResilienceMetrics NoOp 구현.
 *
 * <p>메트릭이 비활성화된 경우 사용되며, 아무것도 기록하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpResilienceMetrics implements ResilienceMetrics {

    @Override
    public void recordOperationSuccess(String dependency, long durationMs) {
        // NoOp
    }

    @Override
    public void recordOperationFailure(String dependency, ErrorKind kind) {
        // NoOp
    }

    @Override
    public void recordSystemEvent(SystemEvent event) {
        // NoOp
    }
}
