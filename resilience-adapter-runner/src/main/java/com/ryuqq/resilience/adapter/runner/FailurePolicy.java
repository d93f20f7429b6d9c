package com.ryuqq.resilience.adapter.runner;

/**
 * 최상위 경계에서 잡힌 오류 처리 정책.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailurePolicy {

    /**
     * 기록 후 프로세스 유지.
     */
    CONTINUE,

    /**
     * 기록 후 종료 코드 1로 프로세스 종료.
     */
    EXIT
}
