package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.application.service.ResilientService;
import com.ryuqq.resilience.application.service.ServiceHealth;
import com.ryuqq.resilience.core.error.ErrorClassifier;
import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.error.OperationFailedException;
import com.ryuqq.resilience.core.model.DependencyConfig;
import com.ryuqq.resilience.core.model.GlobalSettings;
import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.model.OperationOptions;
import com.ryuqq.resilience.core.model.OperationResult;
import com.ryuqq.resilience.core.model.UserMessage;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.resilience.core.spi.MessageCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * {@link ResilientService} 기본 구현.
 *
 * <p>의존성 하나에 대해 {@link DeadlineEnforcer}, {@link RetryCoordinator},
 * {@link CountingCircuitBreaker}, {@link FallbackChainExecutor}를 조립합니다.
 * 전역 설정에서 재시도, Circuit Breaker, Fallback이 꺼져 있으면 해당 계층을 건너뜁니다.</p>
 *
 * <p>성능 저하 시 Orchestrator가 {@link #applyTimeoutMultiplier(double)}로 현재 설정의 타임아웃을 줄이고,
 * {@link #restoreBaseline()}으로 기준 설정을 복원합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultResilientService implements ResilientService {

    private static final Logger log = LoggerFactory.getLogger(DefaultResilientService.class);

    private final DependencyConfig baselineConfig;
    private volatile DependencyConfig workingConfig;

    private final CountingCircuitBreaker circuitBreaker;
    private final CircuitBreaker bypassBreaker;
    private final RetryCoordinator retryCoordinator;
    private final DeadlineEnforcer deadlineEnforcer;
    private final FallbackChainExecutor fallbackChainExecutor;
    private final MessageCatalog messageCatalog;
    private final Supplier<GlobalSettings> globalSettings;
    private final String defaultLanguage;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    /**
     * 생성자.
     *
     * @param config 기준 설정
     * @param deadlineEnforcer 공유 타임아웃 적용기
     * @param fallbackChainExecutor Fallback 체인 실행기 (이 의존성의 체인이 등록되어 있어야 함)
     * @param messageCatalog 사용자 메시지 카탈로그
     * @param globalSettings 현재 전역 설정 공급자
     * @param defaultLanguage 옵션에 언어가 없을 때 사용할 언어
     * @param clock 시간 소스
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public DefaultResilientService(
        DependencyConfig config,
        DeadlineEnforcer deadlineEnforcer,
        FallbackChainExecutor fallbackChainExecutor,
        MessageCatalog messageCatalog,
        Supplier<GlobalSettings> globalSettings,
        String defaultLanguage,
        Clock clock
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (deadlineEnforcer == null) {
            throw new IllegalArgumentException("deadlineEnforcer cannot be null");
        }
        if (fallbackChainExecutor == null) {
            throw new IllegalArgumentException("fallbackChainExecutor cannot be null");
        }
        if (messageCatalog == null) {
            throw new IllegalArgumentException("messageCatalog cannot be null");
        }
        if (globalSettings == null) {
            throw new IllegalArgumentException("globalSettings cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.baselineConfig = config;
        this.workingConfig = config;
        this.circuitBreaker = CountingCircuitBreaker.of(config, clock);
        this.bypassBreaker = new NoOpCircuitBreaker(config.name());
        this.retryCoordinator = new RetryCoordinator(BackoffCalculator.from(config));
        this.deadlineEnforcer = deadlineEnforcer;
        this.fallbackChainExecutor = fallbackChainExecutor;
        this.messageCatalog = messageCatalog;
        this.globalSettings = globalSettings;
        this.defaultLanguage = defaultLanguage == null ? messageCatalog.defaultLanguage() : defaultLanguage;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return baselineConfig.name();
    }

    @Override
    public <T> OperationResult<T> execute(Callable<T> operation, OperationOptions options) {
        return execute(null, operation, options);
    }

    @Override
    public <T> OperationResult<T> execute(OperationId operationId, Callable<T> operation, OperationOptions options) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        OperationOptions effective = options == null ? OperationOptions.defaults() : options;
        OperationId opId = operationId != null
            ? operationId
            : OperationId.forCall(getName(), sequence.incrementAndGet(), clock.millis());

        GlobalSettings settings = globalSettings.get();
        DependencyConfig config = workingConfig;
        long timeoutMs = effective.timeoutMs() != null ? effective.timeoutMs() : config.timeoutMs();

        Callable<T> deadlined = () -> deadlineEnforcer.withDeadline(operation, timeoutMs);
        Callable<T> retried = effective.retryable() && settings.retriesEnabled()
            ? () -> retryCoordinator.retry(deadlined, config.maxRetries())
            : deadlined;
        CircuitBreaker breaker = settings.circuitBreakersEnabled() ? circuitBreaker : bypassBreaker;
        Callable<T> guarded = () -> breaker.execute(opId, retried, null);

        try {
            FallbackExecution<T> execution;
            if (settings.fallbacksEnabled()) {
                execution = fallbackChainExecutor.execute(
                    getName(), guarded, effective.context(), effective.fallback()
                );
            } else {
                execution = FallbackExecution.primary(guarded.call());
            }

            if (execution.fallbackUsed()) {
                return OperationResult.fallback(
                    execution.value(), getName(), opId, clock.instant(), describe(execution.primaryError())
                );
            }
            return OperationResult.primary(execution.value(), getName(), opId, clock.instant());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw toFailure(e, opId, effective);
        } catch (Exception e) {
            throw toFailure(e, opId, effective);
        }
    }

    @Override
    public ServiceHealth getHealthStatus() {
        return new ServiceHealth(getName(), circuitBreaker.snapshot(), workingConfig, clock.instant());
    }

    @Override
    public void resetCircuitBreaker() {
        circuitBreaker.reset();
    }

    @Override
    public DependencyConfig getWorkingConfig() {
        return workingConfig;
    }

    @Override
    public DependencyConfig getBaselineConfig() {
        return baselineConfig;
    }

    /**
     * 기준 타임아웃에 배수를 적용한 설정으로 교체 (누적되지 않음).
     *
     * @param multiplier 배수 (0 초과 1 이하)
     */
    public void applyTimeoutMultiplier(double multiplier) {
        this.workingConfig = baselineConfig.scaleTimeout(multiplier);
    }

    /**
     * 기준 설정 복원.
     */
    public void restoreBaseline() {
        this.workingConfig = baselineConfig;
    }

    public CountingCircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    private OperationFailedException toFailure(Exception error, OperationId opId, OperationOptions options) {
        ErrorKind kind = ErrorClassifier.classify(error);
        String language = options.language() != null ? options.language() : defaultLanguage;
        UserMessage userMessage = messageCatalog.lookup(kind, language);

        log.error("Operation {} failed for {} (operationId: {}, kind: {}): {}",
            options.operationName(), getName(), opId.getValue(), kind, error.getMessage());

        return new OperationFailedException(
            kind, getName(), opId, circuitBreaker.snapshot(), userMessage, language, options.context(), error
        );
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
