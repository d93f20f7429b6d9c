package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.model.SystemEvent;

/**
 * 호출 결과 및 시스템 이벤트 기록 SPI.
 *
 * <p>구현체는 호출 스레드에서 직접 실행되므로 빠르게 반환해야 하며, 예외를 던지지 않아야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResilienceMetrics {

    /**
     * 성공한 호출 기록 (Fallback 응답 포함).
     *
     * @param dependency 의존성 이름
     * @param durationMs 소요 시간 (밀리초)
     */
    void recordOperationSuccess(String dependency, long durationMs);

    /**
     * 실패한 호출 기록.
     *
     * @param dependency 의존성 이름
     * @param kind 오류 종류
     */
    void recordOperationFailure(String dependency, ErrorKind kind);

    /**
     * 시스템 이벤트 기록 (성능 저하, 복구, 종료 등).
     *
     * @param event 이벤트
     */
    void recordSystemEvent(SystemEvent event);
}
