package com.ryuqq.resilience.core.model;

import java.time.Instant;

/**
 * 진행 중인 호출 추적 레코드.
 *
 * <p>Orchestrator가 호출 진입 시 생성하고, 성공/실패/예외 여부와 관계없이 종료 시 반드시 제거합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param operationId 호출 식별자
 * @param dependencyName 의존성 이름
 * @param startTime 시작 시각
 */
public record OperationRecord(
    OperationId operationId,
    String dependencyName,
    Instant startTime
) {

    public OperationRecord {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (dependencyName == null || dependencyName.isBlank()) {
            throw new IllegalArgumentException("dependencyName cannot be null or blank");
        }
        if (startTime == null) {
            throw new IllegalArgumentException("startTime cannot be null");
        }
    }
}
