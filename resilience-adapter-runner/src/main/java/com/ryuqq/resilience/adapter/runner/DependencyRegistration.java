package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.model.DependencyConfig;
import com.ryuqq.resilience.core.protection.FallbackStrategy;
import com.ryuqq.resilience.core.protection.HealthProbe;

import java.util.List;

/**
 * Orchestrator 초기화 시 등록할 의존성 정의.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param config 의존성 설정
 * @param fallbackChain Fallback 체인
 * @param probe 헬스 프로브 (null이면 헬스 체크 대상 아님)
 */
public record DependencyRegistration(
    DependencyConfig config,
    List<FallbackStrategy<?>> fallbackChain,
    HealthProbe probe
) {

    public DependencyRegistration {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        fallbackChain = fallbackChain == null ? List.of() : List.copyOf(fallbackChain);
    }

    public static DependencyRegistration of(DependencyConfig config) {
        return new DependencyRegistration(config, List.of(), null);
    }

    public DependencyRegistration withFallbackChain(List<FallbackStrategy<?>> fallbackChain) {
        return new DependencyRegistration(config, fallbackChain, probe);
    }

    public DependencyRegistration withProbe(HealthProbe probe) {
        return new DependencyRegistration(config, fallbackChain, probe);
    }

    /**
     * 프로브 타임아웃 (의존성 타임아웃의 절반).
     *
     * @return 타임아웃 (밀리초)
     */
    public long probeTimeoutMs() {
        return config.timeoutMs() / 2;
    }
}
