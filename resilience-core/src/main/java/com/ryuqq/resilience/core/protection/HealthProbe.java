package com.ryuqq.resilience.core.protection;

/**
 * 의존성 헬스 프로브.
 *
 * <p>가벼운 확인 호출을 수행합니다. 정상 반환은 성공, 예외는 실패로 집계됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * 프로브 실행.
     *
     * @return 프로브 보고 (null이면 상세 정보 없음)
     * @throws Exception 의존성에 도달할 수 없는 경우
     */
    ProbeReport check() throws Exception;
}
