package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.application.orchestrator.OverallStatus;
import com.ryuqq.resilience.application.orchestrator.ResilienceOrchestrator;
import com.ryuqq.resilience.application.orchestrator.SystemHealth;
import com.ryuqq.resilience.application.service.ResilientService;
import com.ryuqq.resilience.application.service.ServiceHealth;
import com.ryuqq.resilience.core.error.CapacityExceededException;
import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.error.OperationFailedException;
import com.ryuqq.resilience.core.model.DegradationLevel;
import com.ryuqq.resilience.core.model.DependencyConfig;
import com.ryuqq.resilience.core.model.GlobalSettings;
import com.ryuqq.resilience.core.model.HealthStatus;
import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.model.OperationOptions;
import com.ryuqq.resilience.core.model.OperationRecord;
import com.ryuqq.resilience.core.model.OperationResult;
import com.ryuqq.resilience.core.model.SystemEvent;
import com.ryuqq.resilience.core.protection.FallbackStrategy;
import com.ryuqq.resilience.core.protection.HealthProbe;
import com.ryuqq.resilience.core.spi.MessageCatalog;
import com.ryuqq.resilience.core.spi.ResilienceMetrics;
import com.ryuqq.resilience.core.spi.noop.NoOpMessageCatalog;
import com.ryuqq.resilience.core.spi.noop.NoOpResilienceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ResilienceOrchestrator} 기본 구현.
 *
 * <p>의존성마다 {@link DefaultResilientService}를 하나씩 소유하고, 모든 Façade가
 * {@link DeadlineEnforcer}, {@link FallbackChainExecutor}, {@link HealthProber}를 공유합니다.</p>
 *
 * <p><strong>호출 처리 순서:</strong></p>
 * <ol>
 *   <li>실행 상태 확인 (initialize 전, shutdown 후에는 거부)</li>
 *   <li>동시 실행 한도 검사 후 실행 중 목록에 등록 (한도 초과 시 {@link CapacityExceededException})</li>
 *   <li>Façade 실행</li>
 *   <li>성공/실패 메트릭 기록</li>
 *   <li>결과와 무관하게 실행 중 목록에서 제거</li>
 * </ol>
 *
 * <p>성능 저하 단계는 항상 기준 설정({@link OrchestratorConfig#baselineSettings()})으로부터 계산됩니다.
 * NORMAL 단계 요청은 복구와 동일하게 처리됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultResilienceOrchestrator implements ResilienceOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultResilienceOrchestrator.class);

    private static final long SHUTDOWN_POLL_INTERVAL_MS = 100;

    private final OrchestratorConfig config;
    private final List<DependencyRegistration> initialRegistrations;
    private final MessageCatalog messageCatalog;
    private final ResilienceMetrics metrics;
    private final Clock clock;

    private final DeadlineEnforcer deadlineEnforcer;
    private final FallbackChainExecutor fallbackChainExecutor;
    private final HealthProber healthProber;

    private final Map<String, DefaultResilientService> services = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<OperationId, OperationRecord> activeOperations = new ConcurrentHashMap<>();
    private final Object admissionLock = new Object();
    private final AtomicLong sequence = new AtomicLong();

    private volatile GlobalSettings settings;
    private volatile boolean initialized;
    private volatile boolean shutdown;

    /**
     * 기본 설정과 기본 의존성 목록으로 생성 (헬스 프로브 없음).
     */
    public DefaultResilienceOrchestrator() {
        this(new OrchestratorConfig(), DefaultDependencies.registrations(),
            new NoOpMessageCatalog(), new NoOpResilienceMetrics());
    }

    public DefaultResilienceOrchestrator(
        OrchestratorConfig config,
        List<DependencyRegistration> registrations,
        MessageCatalog messageCatalog,
        ResilienceMetrics metrics
    ) {
        this(config, registrations, messageCatalog, metrics, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 전역 설정
     * @param registrations {@link #initialize()} 시 등록할 의존성 목록
     * @param messageCatalog 사용자 메시지 카탈로그
     * @param metrics 메트릭 수집기
     * @param clock 시간 소스
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public DefaultResilienceOrchestrator(
        OrchestratorConfig config,
        List<DependencyRegistration> registrations,
        MessageCatalog messageCatalog,
        ResilienceMetrics metrics,
        Clock clock
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (messageCatalog == null) {
            throw new IllegalArgumentException("messageCatalog cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.initialRegistrations = registrations == null ? List.of() : List.copyOf(registrations);
        this.messageCatalog = messageCatalog;
        this.metrics = metrics;
        this.clock = clock;
        this.deadlineEnforcer = new DeadlineEnforcer();
        this.fallbackChainExecutor = new FallbackChainExecutor();
        this.healthProber = new HealthProber(deadlineEnforcer, clock);
        this.settings = config.baselineSettings();
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        if (shutdown) {
            throw new IllegalStateException("Orchestrator has been shut down");
        }

        for (DependencyRegistration registration : initialRegistrations) {
            register(registration);
        }
        if (settings.healthChecksEnabled()) {
            healthProber.start(config.healthCheckIntervalMs());
        }
        initialized = true;
        log.info("Resilience orchestrator initialized with {} services", services.size());
    }

    @Override
    public <T> OperationResult<T> executeOperation(String dependencyName, Callable<T> operation,
                                                   OperationOptions options) {
        ensureRunning();
        DefaultResilientService service = services.get(dependencyName);
        if (service == null) {
            throw new IllegalArgumentException("Service " + dependencyName + " not registered");
        }

        OperationId opId = OperationId.forCall(dependencyName, sequence.incrementAndGet(), clock.millis());
        admit(dependencyName, opId, options);

        long startMillis = clock.millis();
        try {
            OperationResult<T> result = service.execute(opId, operation, options);
            if (config.enableMetrics()) {
                metrics.recordOperationSuccess(dependencyName, clock.millis() - startMillis);
            }
            return result;
        } catch (OperationFailedException e) {
            if (config.enableMetrics()) {
                metrics.recordOperationFailure(dependencyName, e.getKind());
            }
            throw e;
        } finally {
            activeOperations.remove(opId);
        }
    }

    @Override
    public SystemHealth getSystemHealth() {
        Map<String, HealthStatus> statuses = healthProber.getAllStatuses();
        int healthy = 0;
        for (HealthStatus status : statuses.values()) {
            if (status.isHealthy()) {
                healthy++;
            }
        }
        int percentage = OverallStatus.percentage(healthy, statuses.size());

        Map<String, ServiceHealth> circuitBreakers = new LinkedHashMap<>();
        for (DefaultResilientService service : snapshotServices()) {
            circuitBreakers.put(service.getName(), service.getHealthStatus());
        }

        GlobalSettings current = settings;
        SystemHealth.Overall overall = new SystemHealth.Overall(
            OverallStatus.fromPercentage(percentage),
            percentage,
            activeOperations.size(),
            current.maxConcurrentOperations()
        );
        return new SystemHealth(overall, statuses, circuitBreakers, clock.instant());
    }

    @Override
    public synchronized void handleSystemDegradation(DegradationLevel level) {
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        if (level == DegradationLevel.NORMAL) {
            recoverFromDegradation();
            return;
        }

        GlobalSettings baseline = config.baselineSettings();
        GlobalSettings degraded = new GlobalSettings(
            level,
            level.maxConcurrentOperations(config.maxConcurrentOperations(), config.emergencyMaxConcurrentOperations()),
            level.timeoutMultiplier(),
            baseline.circuitBreakersEnabled() && !level.disablesCircuitBreakers(),
            baseline.healthChecksEnabled() && !level.suspendsHealthChecks(),
            baseline.retriesEnabled(),
            baseline.fallbacksEnabled()
        );
        this.settings = degraded;

        for (DefaultResilientService service : snapshotServices()) {
            service.applyTimeoutMultiplier(level.timeoutMultiplier());
            if (level.disablesCircuitBreakers()) {
                service.resetCircuitBreaker();
            }
        }
        applyHealthCheckSetting(degraded);

        log.warn("System degradation handled: {} (maxConcurrentOperations: {}, timeoutMultiplier: {})",
            level, degraded.maxConcurrentOperations(), degraded.timeoutMultiplier());

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("level", level.name());
        attributes.put("maxConcurrentOperations", degraded.maxConcurrentOperations());
        attributes.put("timeoutMultiplier", degraded.timeoutMultiplier());
        recordEvent(SystemEvent.DEGRADATION, attributes);
    }

    @Override
    public synchronized void recoverFromDegradation() {
        DegradationLevel previous = settings.level();
        GlobalSettings baseline = config.baselineSettings();
        this.settings = baseline;

        for (DefaultResilientService service : snapshotServices()) {
            service.restoreBaseline();
        }
        applyHealthCheckSetting(baseline);

        log.info("System recovered from degradation: {}", previous);
        recordEvent(SystemEvent.RECOVERY, Map.of("previousLevel", previous.name()));
    }

    @Override
    public ResilientService registerService(DependencyConfig config, List<FallbackStrategy<?>> fallbackChain) {
        return registerService(config, fallbackChain, null);
    }

    @Override
    public ResilientService registerService(DependencyConfig config, List<FallbackStrategy<?>> fallbackChain,
                                            HealthProbe probe) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return register(new DependencyRegistration(config, fallbackChain, probe));
    }

    @Override
    public Optional<ResilientService> getService(String name) {
        return Optional.ofNullable(services.get(name));
    }

    @Override
    public Set<String> getAllServices() {
        synchronized (services) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(services.keySet()));
        }
    }

    @Override
    public GlobalSettings getGlobalSettings() {
        return settings;
    }

    @Override
    public Collection<OperationRecord> getActiveOperations() {
        return List.copyOf(activeOperations.values());
    }

    @Override
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        log.info("Shutting down resilience orchestrator ({} active operations)", activeOperations.size());

        healthProber.stop();
        awaitActiveOperations();

        int remaining = activeOperations.size();
        if (remaining > 0) {
            log.warn("Forced shutdown with {} active operations", remaining);
        }
        recordEvent(SystemEvent.SHUTDOWN, Map.of("remainingOperations", remaining));

        healthProber.close();
        deadlineEnforcer.shutdown();
        log.info("Resilience orchestrator shut down");
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * 헬스 프로버 조회 (수동 점검 및 상태 확인용).
     *
     * @return 헬스 프로버
     */
    public HealthProber getHealthProber() {
        return healthProber;
    }

    private ResilientService register(DependencyRegistration registration) {
        DependencyConfig dependency = registration.config();
        fallbackChainExecutor.registerFallbackChain(dependency.name(), registration.fallbackChain());

        DefaultResilientService service = new DefaultResilientService(
            dependency,
            deadlineEnforcer,
            fallbackChainExecutor,
            messageCatalog,
            this::getGlobalSettings,
            config.defaultLanguage(),
            clock
        );
        GlobalSettings current = settings;
        if (current.level() != DegradationLevel.NORMAL) {
            service.applyTimeoutMultiplier(current.timeoutMultiplier());
        }
        services.put(dependency.name(), service);

        if (registration.probe() != null) {
            healthProber.registerProbe(
                dependency.name(),
                registration.probe(),
                registration.probeTimeoutMs(),
                HealthProber.DEFAULT_MAX_FAILURES
            );
        } else {
            healthProber.unregisterProbe(dependency.name());
        }

        log.info("Registered resilient service: {}", dependency.name());
        return service;
    }

    private void admit(String dependencyName, OperationId opId, OperationOptions options) {
        synchronized (admissionLock) {
            int max = settings.maxConcurrentOperations();
            int active = activeOperations.size();
            if (active >= max) {
                String language = options != null && options.language() != null
                    ? options.language()
                    : config.defaultLanguage();
                log.warn("Capacity exceeded for {} ({}/{})", dependencyName, active, max);
                throw new CapacityExceededException(
                    dependencyName, active, max, messageCatalog.lookup(ErrorKind.CAPACITY_EXCEEDED, language)
                );
            }
            activeOperations.put(opId, new OperationRecord(opId, dependencyName, clock.instant()));
        }
    }

    private void ensureRunning() {
        if (shutdown) {
            throw new IllegalStateException("Orchestrator has been shut down");
        }
        if (!initialized) {
            throw new IllegalStateException("Orchestrator has not been initialized");
        }
    }

    private void applyHealthCheckSetting(GlobalSettings current) {
        if (current.healthChecksEnabled() && initialized && !shutdown) {
            healthProber.start(config.healthCheckIntervalMs());
        } else {
            healthProber.stop();
        }
    }

    private void awaitActiveOperations() {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.shutdownTimeoutMs());
        while (!activeOperations.isEmpty()) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return;
            }
            try {
                Thread.sleep(Math.min(SHUTDOWN_POLL_INTERVAL_MS, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private List<DefaultResilientService> snapshotServices() {
        synchronized (services) {
            return new ArrayList<>(services.values());
        }
    }

    private void recordEvent(String type, Map<String, Object> attributes) {
        if (config.enableMetrics()) {
            metrics.recordSystemEvent(SystemEvent.of(type, clock.instant(), attributes));
        }
    }
}
