package com.ryuqq.resilience.core.model;

/**
 * 개별 호출(Operation)의 고유 식별자.
 *
 * <p>Orchestrator가 호출 진입 시점에 발급하며, 활성 작업 추적과 로그 상관관계에 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationId {

    private final String value;

    private OperationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OperationId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("OperationId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("OperationId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * OperationId 생성.
     *
     * @param value 식별자 값
     * @return OperationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OperationId of(String value) {
        return new OperationId(value);
    }

    /**
     * Orchestrator 규칙에 따른 식별자 생성.
     *
     * <p>형식: {@code <dependency>_<sequence>_<epochMillis>}</p>
     *
     * @param dependencyName 의존성 이름
     * @param sequence 단조 증가 카운터 값
     * @param epochMillis 발급 시각
     * @return OperationId 인스턴스
     */
    public static OperationId forCall(String dependencyName, long sequence, long epochMillis) {
        return new OperationId(dependencyName + "_" + sequence + "_" + epochMillis);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationId that = (OperationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OperationId{" + value + '}';
    }
}
