package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.protection.FallbackStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 의존성별 Fallback 체인 실행기.
 *
 * <p>주 경로가 실패하면 등록된 Fallback을 등록 순서대로 시도합니다.
 * 처음으로 성공한 Fallback의 결과를 반환하며, 나머지는 시도하지 않습니다.</p>
 *
 * <p>모든 Fallback이 실패하면 <strong>주 경로의 오류</strong>를 던집니다.
 * Fallback 오류는 로그로 남기고 주 경로 오류의 suppressed 예외로만 첨부합니다.</p>
 *
 * <p>등록된 체인은 결과 타입을 알 수 없으므로, 호출자가 체인의 결과 타입이
 * 주 경로와 같음을 보장해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FallbackChainExecutor {

    private static final Logger log = LoggerFactory.getLogger(FallbackChainExecutor.class);

    private final Map<String, List<FallbackStrategy<?>>> chains = new ConcurrentHashMap<>();

    /**
     * Fallback 체인 등록 (같은 이름의 기존 체인은 대체).
     *
     * @param dependencyName 의존성 이름
     * @param chain Fallback 목록 (null 요소 불가)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public void registerFallbackChain(String dependencyName, List<FallbackStrategy<?>> chain) {
        if (dependencyName == null || dependencyName.isBlank()) {
            throw new IllegalArgumentException("dependencyName cannot be null or blank");
        }
        if (chain == null) {
            throw new IllegalArgumentException("chain cannot be null");
        }
        for (FallbackStrategy<?> strategy : chain) {
            if (strategy == null) {
                throw new IllegalArgumentException("chain cannot contain null elements");
            }
        }
        chains.put(dependencyName, List.copyOf(chain));
        log.debug("Registered {} fallback(s) for {}", chain.size(), dependencyName);
    }

    /**
     * 등록된 Fallback 체인 조회.
     *
     * @param dependencyName 의존성 이름
     * @return Fallback 목록 (없으면 빈 목록)
     */
    public List<FallbackStrategy<?>> getFallbackChain(String dependencyName) {
        return chains.getOrDefault(dependencyName, List.of());
    }

    /**
     * 주 경로 실행 후 실패 시 Fallback 체인 실행.
     *
     * @param dependencyName 의존성 이름
     * @param primary 주 경로 작업
     * @param context Fallback에 전달할 컨텍스트
     * @param <T> 결과 타입
     * @return 주 경로 또는 Fallback 결과
     * @throws Exception 주 경로와 모든 Fallback이 실패한 경우 주 경로의 오류
     */
    public <T> T runWithFallback(String dependencyName, Callable<T> primary, Map<String, Object> context)
        throws Exception {
        return execute(dependencyName, primary, context, null).value();
    }

    /**
     * 주 경로 실행 후 실패 시 등록된 체인, 그다음 호출별 Fallback 순으로 실행.
     *
     * @param dependencyName 의존성 이름
     * @param primary 주 경로 작업
     * @param context Fallback에 전달할 컨텍스트
     * @param adHoc 호출별 Fallback (null 허용, 등록된 체인 뒤에 시도)
     * @param <T> 결과 타입
     * @return 실행 결과 (Fallback 사용 여부 포함)
     * @throws Exception 주 경로와 모든 Fallback이 실패한 경우 주 경로의 오류
     */
    public <T> FallbackExecution<T> execute(String dependencyName, Callable<T> primary,
                                            Map<String, Object> context,
                                            FallbackStrategy<?> adHoc) throws Exception {
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        try {
            return FallbackExecution.primary(primary.call());
        } catch (Exception primaryError) {
            return recover(dependencyName, primaryError, context, adHoc);
        }
    }

    private <T> FallbackExecution<T> recover(String dependencyName, Exception primaryError,
                                             Map<String, Object> context,
                                             FallbackStrategy<?> adHoc) throws Exception {
        List<FallbackStrategy<?>> candidates = new ArrayList<>(getFallbackChain(dependencyName));
        if (adHoc != null) {
            candidates.add(adHoc);
        }
        if (candidates.isEmpty()) {
            throw primaryError;
        }

        Map<String, Object> readOnlyContext = context == null ? Map.of() : Collections.unmodifiableMap(context);
        for (int i = 0; i < candidates.size(); i++) {
            try {
                T value = cast(candidates.get(i).recover(readOnlyContext, primaryError));
                log.info("Fallback {} succeeded for {}", i + 1, dependencyName);
                return FallbackExecution.fallback(value, i, primaryError);
            } catch (Exception fallbackError) {
                log.warn("Fallback {} failed for {}: {}", i + 1, dependencyName, fallbackError.getMessage());
                if (fallbackError != primaryError) {
                    primaryError.addSuppressed(fallbackError);
                }
            }
        }

        log.warn("All {} fallback(s) failed for {}", candidates.size(), dependencyName);
        throw primaryError;
    }

    /**
     * Fallback 결과를 주 경로 결과 타입으로 변환하는 유일한 지점.
     *
     * <p>체인의 결과 타입은 등록 시점에 알 수 없으므로, 호출자가 주 경로와 같은 타입을 보장합니다.</p>
     */
    @SuppressWarnings("unchecked")
    private static <T> T cast(Object value) {
        return (T) value;
    }
}
