package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.error.ErrorClassifier;
import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.model.SystemEvent;
import com.ryuqq.resilience.core.outcome.Fail;
import com.ryuqq.resilience.core.outcome.Ok;
import com.ryuqq.resilience.core.outcome.Outcome;
import com.ryuqq.resilience.core.spi.ResilienceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.IntConsumer;

/**
 * 최상위 오류 경계.
 *
 * <p>어떤 보호 계층에서도 처리되지 않은 오류를 마지막으로 받아 기록합니다.
 * {@link #run(Callable)}은 예외를 던지지 않고 {@link Outcome}으로 결과를 돌려주며,
 * {@link #install()}은 JVM 기본 {@link Thread.UncaughtExceptionHandler}로 등록합니다.</p>
 *
 * <p>{@link FailurePolicy#EXIT}이면 기록 후 종료 훅을 코드 1로 호출합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TopLevelErrorBoundary {

    private static final Logger log = LoggerFactory.getLogger(TopLevelErrorBoundary.class);

    private static final int EXIT_CODE = 1;

    private final FailurePolicy policy;
    private final ResilienceMetrics metrics;
    private final IntConsumer exitHook;
    private final Clock clock;

    public TopLevelErrorBoundary(FailurePolicy policy, ResilienceMetrics metrics) {
        this(policy, metrics, System::exit, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param policy 오류 처리 정책
     * @param metrics 시스템 이벤트 기록 대상
     * @param exitHook 종료 훅 (EXIT 정책에서 호출)
     * @param clock 시간 소스
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public TopLevelErrorBoundary(FailurePolicy policy, ResilienceMetrics metrics, IntConsumer exitHook, Clock clock) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (exitHook == null) {
            throw new IllegalArgumentException("exitHook cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.policy = policy;
        this.metrics = metrics;
        this.exitHook = exitHook;
        this.clock = clock;
    }

    /**
     * 작업을 경계 안에서 실행.
     *
     * @param work 실행할 작업
     * @param <T> 결과 타입
     * @return 성공 시 {@link Ok}, 실패 시 분류된 {@link Fail}
     */
    public <T> Outcome<T> run(Callable<T> work) {
        try {
            return Ok.of(work.call());
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            handle(Thread.currentThread(), t);
            return Fail.of(ErrorClassifier.classify(t), t);
        }
    }

    /**
     * 경계를 {@link Thread.UncaughtExceptionHandler}로 사용.
     *
     * @return 핸들러
     */
    public Thread.UncaughtExceptionHandler asUncaughtExceptionHandler() {
        return this::handle;
    }

    /**
     * JVM 기본 UncaughtExceptionHandler로 등록.
     */
    public void install() {
        Thread.setDefaultUncaughtExceptionHandler(asUncaughtExceptionHandler());
        log.info("Top-level error boundary installed (policy: {})", policy);
    }

    public FailurePolicy getPolicy() {
        return policy;
    }

    private void handle(Thread thread, Throwable error) {
        ErrorKind kind = ErrorClassifier.classify(error);
        log.error("Uncaught exception in thread {} (kind: {})", thread.getName(), kind, error);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("thread", thread.getName());
        attributes.put("kind", kind.name());
        attributes.put("errorType", error.getClass().getName());
        attributes.put("message", String.valueOf(error.getMessage()));
        metrics.recordSystemEvent(SystemEvent.of(SystemEvent.UNCAUGHT_EXCEPTION, clock.instant(), attributes));

        if (policy == FailurePolicy.EXIT) {
            exitHook.accept(EXIT_CODE);
        }
    }
}
