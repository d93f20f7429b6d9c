package com.ryuqq.resilience.application.orchestrator;

import com.ryuqq.resilience.application.service.ResilientService;
import com.ryuqq.resilience.core.error.CapacityExceededException;
import com.ryuqq.resilience.core.error.OperationFailedException;
import com.ryuqq.resilience.core.model.DegradationLevel;
import com.ryuqq.resilience.core.model.DependencyConfig;
import com.ryuqq.resilience.core.model.GlobalSettings;
import com.ryuqq.resilience.core.model.OperationOptions;
import com.ryuqq.resilience.core.model.OperationRecord;
import com.ryuqq.resilience.core.model.OperationResult;
import com.ryuqq.resilience.core.protection.FallbackStrategy;
import com.ryuqq.resilience.core.protection.HealthProbe;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * 외부 의존성 호출 조정자.
 *
 * <p>등록된 의존성마다 하나의 {@link ResilientService}를 소유하고, 모든 호출에 대해
 * 동시 실행 한도 검사, 실행 중 호출 추적, 전역 성능 저하 단계 관리를 수행합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * orchestrator.initialize();
 *
 * OperationResult&lt;Document&gt; result = orchestrator.executeOperation(
 *     "documentGenerator",
 *     () -&gt; aiClient.generate(request),
 *     OperationOptions.defaults().withOperationName("generateContract")
 * );
 *
 * // 외부 모니터링이 장애를 감지한 경우
 * orchestrator.handleSystemDegradation(DegradationLevel.MODERATE);
 * ...
 * orchestrator.recoverFromDegradation();
 * </pre>
 *
 * <p><strong>성능 저하 단계:</strong></p>
 * <ul>
 *   <li>LIGHT: 모든 의존성 타임아웃 × 0.9</li>
 *   <li>MODERATE: 타임아웃 × 0.7, 헬스 프로브 중단, 동시 실행 한도 30% 축소</li>
 *   <li>SEVERE: 타임아웃 × 0.5, 헬스 프로브 중단, 동시 실행 한도를 비상값으로 고정,
 *       Circuit Breaker 비활성화 및 강제 리셋</li>
 * </ul>
 * <p>각 단계는 기준 설정으로부터 절대적으로 계산되며, 이전 호출과 누적되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResilienceOrchestrator {

    /**
     * 기본 의존성 등록 및 헬스 프로브 시작.
     *
     * <p>두 번 호출해도 한 번만 초기화됩니다.</p>
     */
    void initialize();

    /**
     * 의존성 호출 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>의존성 조회 (없으면 IllegalArgumentException)</li>
     *   <li>동시 실행 한도 검사 후 실행 중 호출로 등록 (원자적)</li>
     *   <li>ResilientService에 위임</li>
     *   <li>성공/실패 메트릭 기록</li>
     *   <li>실행 중 호출에서 제거 (모든 종료 경로)</li>
     * </ol>
     *
     * @param dependencyName 의존성 이름
     * @param operation 실행할 작업
     * @param options 호출 옵션 (null이면 기본값)
     * @param <T> 결과 타입
     * @return 실행 결과
     * @throws IllegalStateException 초기화 전 또는 종료 후 호출된 경우
     * @throws IllegalArgumentException 등록되지 않은 의존성인 경우
     * @throws CapacityExceededException 동시 실행 한도를 초과한 경우 (작업은 실행되지 않음)
     * @throws OperationFailedException 주 경로와 모든 Fallback이 실패한 경우
     */
    <T> OperationResult<T> executeOperation(String dependencyName, Callable<T> operation, OperationOptions options);

    /**
     * 시스템 전체 헬스 조회.
     *
     * @return 헬스 스냅샷
     */
    SystemHealth getSystemHealth();

    /**
     * 성능 저하 단계 적용.
     *
     * <p>{@link DegradationLevel#NORMAL}은 {@link #recoverFromDegradation()}과 같습니다.</p>
     *
     * @param level 성능 저하 단계
     */
    void handleSystemDegradation(DegradationLevel level);

    /**
     * 문자열로 성능 저하 단계 적용 ("light", "moderate", "severe").
     *
     * @param level 단계 이름 (대소문자 무시)
     * @throws IllegalArgumentException 알 수 없는 단계인 경우
     */
    default void handleSystemDegradation(String level) {
        handleSystemDegradation(DegradationLevel.parse(level));
    }

    /**
     * 성능 저하 해제 (기준 설정으로 절대 복원).
     */
    void recoverFromDegradation();

    /**
     * 의존성 등록.
     *
     * <p>같은 이름으로 다시 등록하면 기존 의존성을 대체합니다.</p>
     *
     * @param config 의존성 설정
     * @param fallbackChain Fallback 체인 (비어 있을 수 있음)
     * @return 등록된 서비스
     */
    ResilientService registerService(DependencyConfig config, List<FallbackStrategy<?>> fallbackChain);

    /**
     * 헬스 프로브와 함께 의존성 등록.
     *
     * @param config 의존성 설정
     * @param fallbackChain Fallback 체인 (비어 있을 수 있음)
     * @param probe 헬스 프로브
     * @return 등록된 서비스
     */
    ResilientService registerService(DependencyConfig config, List<FallbackStrategy<?>> fallbackChain, HealthProbe probe);

    /**
     * 의존성 서비스 조회.
     *
     * @param name 의존성 이름
     * @return 서비스 (없으면 empty)
     */
    Optional<ResilientService> getService(String name);

    /**
     * 등록된 의존성 이름 목록 (등록 순서).
     *
     * @return 이름 집합
     */
    Set<String> getAllServices();

    /**
     * 현재 전역 설정 스냅샷.
     *
     * @return 전역 설정
     */
    GlobalSettings getGlobalSettings();

    /**
     * 실행 중인 호출 스냅샷.
     *
     * @return 실행 중 호출 목록
     */
    Collection<OperationRecord> getActiveOperations();

    /**
     * 종료.
     *
     * <p>헬스 프로브를 중단하고, 실행 중인 호출이 모두 끝날 때까지 제한 시간 동안 대기합니다.
     * 제한 시간이 지나면 경고를 남기고 종료를 계속합니다.</p>
     */
    void shutdown();
}
