package com.ryuqq.resilience.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 관측용 시스템 이벤트 (degradation, recovery, uncaught_exception 등).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param type 이벤트 유형
 * @param occurredAt 발생 시각
 * @param attributes 부가 정보
 */
public record SystemEvent(
    String type,
    Instant occurredAt,
    Map<String, Object> attributes
) {

    public static final String DEGRADATION = "degradation";
    public static final String RECOVERY = "recovery";
    public static final String SHUTDOWN = "shutdown";
    public static final String UNCAUGHT_EXCEPTION = "uncaught_exception";

    public SystemEvent {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static SystemEvent of(String type, Instant occurredAt, Map<String, Object> attributes) {
        return new SystemEvent(type, occurredAt, attributes);
    }
}
