package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.model.DependencyConfig;
import com.ryuqq.resilience.core.protection.HealthProbe;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 플랫폼 기본 의존성 목록.
 *
 * <table>
 *   <caption>기준 설정 (resetTimeout은 모두 60000ms)</caption>
 *   <tr><th>이름</th><th>timeout</th><th>maxRetries</th><th>threshold</th><th>healthCheckInterval</th></tr>
 *   <tr><td>documentGenerator</td><td>30000</td><td>3</td><td>5</td><td>60000</td></tr>
 *   <tr><td>blockchain</td><td>45000</td><td>2</td><td>3</td><td>120000</td></tr>
 *   <tr><td>collaborative</td><td>20000</td><td>2</td><td>4</td><td>90000</td></tr>
 *   <tr><td>translation</td><td>15000</td><td>3</td><td>5</td><td>60000</td></tr>
 *   <tr><td>clauseAnalyzer</td><td>25000</td><td>2</td><td>4</td><td>90000</td></tr>
 *   <tr><td>database</td><td>10000</td><td>3</td><td>5</td><td>30000</td></tr>
 * </table>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultDependencies {

    public static final String DOCUMENT_GENERATOR = "documentGenerator";
    public static final String BLOCKCHAIN = "blockchain";
    public static final String COLLABORATIVE = "collaborative";
    public static final String TRANSLATION = "translation";
    public static final String CLAUSE_ANALYZER = "clauseAnalyzer";
    public static final String DATABASE = "database";

    // Utility class - prevent instantiation
    private DefaultDependencies() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 의존성 설정 목록 (등록 순서).
     *
     * @return 의존성 설정
     */
    public static List<DependencyConfig> configs() {
        return List.of(
            DependencyConfig.of(DOCUMENT_GENERATOR, 30000, 3, 5, 60000),
            DependencyConfig.of(BLOCKCHAIN, 45000, 2, 3, 120000),
            DependencyConfig.of(COLLABORATIVE, 20000, 2, 4, 90000),
            DependencyConfig.of(TRANSLATION, 15000, 3, 5, 60000),
            DependencyConfig.of(CLAUSE_ANALYZER, 25000, 2, 4, 90000),
            DependencyConfig.of(DATABASE, 10000, 3, 5, 30000)
        );
    }

    /**
     * 프로브 없이 기본 의존성 등록 정보 생성.
     *
     * @return 등록 정보
     */
    public static List<DependencyRegistration> registrations() {
        return registrations(Map.of());
    }

    /**
     * 기본 의존성 등록 정보 생성.
     *
     * @param probes 의존성 이름별 헬스 프로브 (없는 의존성은 헬스 체크 대상 아님)
     * @return 등록 정보
     */
    public static List<DependencyRegistration> registrations(Map<String, HealthProbe> probes) {
        List<DependencyRegistration> registrations = new ArrayList<>();
        for (DependencyConfig config : configs()) {
            registrations.add(DependencyRegistration.of(config).withProbe(probes.get(config.name())));
        }
        return registrations;
    }
}
