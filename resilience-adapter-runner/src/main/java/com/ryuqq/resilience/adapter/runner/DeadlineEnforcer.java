package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.error.DeadlineExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 시도당 타임아웃 적용기.
 *
 * <p>작업을 내부 스레드 풀에서 실행하고, 호출 스레드는 최대 {@code timeoutMs} 동안만 기다립니다.
 * 작업이 먼저 끝나면 결과나 오류가 그대로 전파되고, 타이머가 먼저 끝나면
 * {@link DeadlineExceededException}이 발생합니다.</p>
 *
 * <p><strong>주의:</strong> 타임아웃이 발생해도 작업은 취소되지 않습니다.
 * 작업은 계속 실행될 수 있으며, 그 결과는 버려집니다.</p>
 *
 * <p>{@code timeoutMs <= 0}이면 타임아웃 없이 호출 스레드에서 직접 실행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeadlineEnforcer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeadlineEnforcer.class);

    private final ExecutorService workers;

    /**
     * 데몬 스레드 기반 캐시 풀로 생성.
     */
    public DeadlineEnforcer() {
        this(Executors.newCachedThreadPool(new DaemonThreadFactory("resilience-deadline")));
    }

    /**
     * 생성자.
     *
     * @param workers 작업 실행 풀
     * @throws IllegalArgumentException workers가 null인 경우
     */
    public DeadlineEnforcer(ExecutorService workers) {
        if (workers == null) {
            throw new IllegalArgumentException("workers cannot be null");
        }
        this.workers = workers;
    }

    /**
     * 타임아웃을 적용하여 작업 실행.
     *
     * @param operation 실행할 작업
     * @param timeoutMs 타임아웃 (밀리초, 0 이하이면 타임아웃 없음)
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws DeadlineExceededException 타임아웃이 먼저 끝난 경우
     * @throws Exception 작업이 던진 오류 (래핑 해제됨)
     */
    public <T> T withDeadline(Callable<T> operation, long timeoutMs) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (timeoutMs <= 0) {
            return operation.call();
        }

        Future<T> future = workers.submit(operation);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Operation exceeded deadline of {}ms, abandoning result", timeoutMs);
            throw new DeadlineExceededException(timeoutMs);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    /**
     * 타임아웃 시에만 대체 작업을 실행.
     *
     * <p>타임아웃이 아닌 오류는 그대로 전파됩니다.</p>
     *
     * @param operation 실행할 작업
     * @param fallback 타임아웃 시 실행할 작업
     * @param timeoutMs 타임아웃 (밀리초)
     * @param <T> 결과 타입
     * @return 작업 또는 대체 작업 결과
     * @throws Exception 작업 오류 또는 대체 작업 오류
     */
    public <T> T withDeadlineOrFallback(Callable<T> operation, Callable<T> fallback, long timeoutMs) throws Exception {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        try {
            return withDeadline(operation, timeoutMs);
        } catch (DeadlineExceededException e) {
            log.warn("Operation timed out after {}ms, using fallback", timeoutMs);
            return fallback.call();
        }
    }

    /**
     * 작업 풀 종료.
     *
     * <p>아직 실행 중인 작업에는 인터럽트가 전달됩니다.</p>
     */
    public void shutdown() {
        workers.shutdownNow();
    }

    public boolean isShutdown() {
        return workers.isShutdown();
    }

    @Override
    public void close() {
        shutdown();
    }

    private static Exception unwrap(ExecutionException wrapper) {
        Throwable cause = wrapper.getCause();
        if (cause instanceof Exception exception) {
            return exception;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return wrapper;
    }
}
