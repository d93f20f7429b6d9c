package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.error.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * 재시도 조정자.
 *
 * <p>작업을 최대 {@code maxRetries + 1}회 시도합니다. 실패할 때마다 오류를 분류하여
 * 재시도 가능한 오류일 때만 백오프 후 다시 시도합니다.</p>
 *
 * <p><strong>재시도 규칙:</strong></p>
 * <ul>
 *   <li>재시도 불가 오류 → 즉시 중단 (1회 시도)</li>
 *   <li>마지막 시도의 오류 → 분류와 관계없이 전파</li>
 *   <li>첫 시도 전에는 대기하지 않음</li>
 *   <li>{@link Exception}만 재시도 대상이며 {@link Error}는 그대로 전파</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RetryCoordinator.class);

    private final BackoffCalculator backoffCalculator;

    public RetryCoordinator() {
        this(new BackoffCalculator());
    }

    /**
     * 생성자.
     *
     * @param backoffCalculator 백오프 계산기
     * @throws IllegalArgumentException backoffCalculator가 null인 경우
     */
    public RetryCoordinator(BackoffCalculator backoffCalculator) {
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * 기본 분류기({@link ErrorClassifier#isRetryable(Throwable)})로 재시도.
     *
     * @param operation 실행할 작업
     * @param maxRetries 최대 재시도 횟수 (0 이상)
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 마지막 시도의 오류 또는 재시도 불가 오류
     */
    public <T> T retry(Callable<T> operation, int maxRetries) throws Exception {
        return retry(operation, maxRetries, ErrorClassifier::isRetryable);
    }

    /**
     * 호출자가 지정한 분류기로 재시도.
     *
     * @param operation 실행할 작업
     * @param maxRetries 최대 재시도 횟수 (0 이상)
     * @param retryable 재시도 가능 여부 판정
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 마지막 시도의 오류 또는 재시도 불가 오류
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public <T> T retry(Callable<T> operation, int maxRetries, Predicate<Throwable> retryable) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        if (retryable == null) {
            throw new IllegalArgumentException("retryable cannot be null");
        }

        Exception lastError = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                lastError = e;

                if (attempt == maxRetries) {
                    break;
                }
                if (!retryable.test(e)) {
                    log.debug("Non-retryable error on attempt {}: {}", attempt + 1, e.getMessage());
                    break;
                }

                long delay = backoffCalculator.calculate(attempt);
                log.warn("Operation failed (attempt {}/{}), retrying in {}ms: {}",
                    attempt + 1, maxRetries + 1, delay, e.getMessage());
                sleep(delay);
            }
        }

        throw lastError;
    }

    public BackoffCalculator getBackoffCalculator() {
        return backoffCalculator;
    }

    /**
     * Sleep (재시도 간격 대기).
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * RuntimeException으로 래핑하여 던집니다.</p>
     *
     * @param millis 대기 시간 (밀리초)
     * @throws RuntimeException sleep 중 인터럽트 발생 시
     */
    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Retry backoff interrupted", e);
        }
    }
}
