package com.ryuqq.resilience.core.model;

import java.util.Locale;

/**
 * 시스템 성능 저하 단계.
 *
 * <p>단계 전환은 호출자가 명시적으로 요청합니다. 각 단계는 기준선 설정으로부터 절대적으로 적용되며
 * 이전 단계와 누적되지 않습니다.</p>
 *
 * <table>
 *   <caption>단계별 적용 내용</caption>
 *   <tr><th>단계</th><th>타임아웃 배수</th><th>동시 작업 한도</th><th>헬스 체크</th><th>Circuit Breaker</th></tr>
 *   <tr><td>NORMAL</td><td>1.0</td><td>기준선</td><td>설정값</td><td>설정값</td></tr>
 *   <tr><td>LIGHT</td><td>0.9</td><td>기준선</td><td>설정값</td><td>설정값</td></tr>
 *   <tr><td>MODERATE</td><td>0.7</td><td>기준선의 70%</td><td>중지</td><td>설정값</td></tr>
 *   <tr><td>SEVERE</td><td>0.5</td><td>비상 한도 (기본 10)</td><td>중지</td><td>비활성 + 강제 리셋</td></tr>
 * </table>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DegradationLevel {

    NORMAL(1.0),

    LIGHT(0.9),

    MODERATE(0.7),

    SEVERE(0.5);

    private static final double MODERATE_CAPACITY_FACTOR = 0.7;

    private final double timeoutMultiplier;

    DegradationLevel(double timeoutMultiplier) {
        this.timeoutMultiplier = timeoutMultiplier;
    }

    public double timeoutMultiplier() {
        return timeoutMultiplier;
    }

    /**
     * 단계별 동시 작업 한도 계산.
     *
     * @param baseline 기준선 한도
     * @param emergencyFloor SEVERE 단계 비상 한도 (기준선보다 크면 기준선 유지)
     * @return 적용할 한도 (최소 1)
     */
    public int maxConcurrentOperations(int baseline, int emergencyFloor) {
        return switch (this) {
            case NORMAL, LIGHT -> baseline;
            case MODERATE -> Math.max(1, (int) Math.floor(baseline * MODERATE_CAPACITY_FACTOR));
            case SEVERE -> Math.max(1, Math.min(baseline, emergencyFloor));
        };
    }

    /**
     * 헬스 체크를 중지하는 단계인지 여부.
     */
    public boolean suspendsHealthChecks() {
        return this == MODERATE || this == SEVERE;
    }

    /**
     * Circuit Breaker를 비활성화하고 강제 리셋하는 단계인지 여부.
     */
    public boolean disablesCircuitBreakers() {
        return this == SEVERE;
    }

    /**
     * 문자열 표현으로부터 단계 조회 ("light", "moderate", "severe", "normal").
     *
     * @param value 단계 이름 (대소문자 무시)
     * @return 단계
     * @throws IllegalArgumentException 알 수 없는 단계인 경우
     */
    public static DegradationLevel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("degradation level cannot be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown degradation level: " + value, e);
        }
    }
}
