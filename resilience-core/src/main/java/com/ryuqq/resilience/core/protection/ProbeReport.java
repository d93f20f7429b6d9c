package com.ryuqq.resilience.core.protection;

/**
 * 헬스 프로브 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param detail 상세 메시지 (null 허용)
 */
public record ProbeReport(String detail) {

    public static ProbeReport ok() {
        return new ProbeReport(null);
    }

    public static ProbeReport of(String detail) {
        return new ProbeReport(detail);
    }
}
