package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.model.HealthState;
import com.ryuqq.resilience.core.model.HealthStatus;
import com.ryuqq.resilience.core.protection.HealthProbe;
import com.ryuqq.resilience.core.protection.ProbeReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 의존성 헬스 프로버.
 *
 * <p>등록된 프로브를 수동({@link #checkOne}, {@link #checkAll}) 또는 주기적({@link #start})으로 실행하고,
 * 의존성별 {@link HealthStatus}를 유지합니다. 각 프로브 호출에는 등록 시 지정한 타임아웃이 적용됩니다.</p>
 *
 * <p><strong>상태 갱신 규칙:</strong></p>
 * <ul>
 *   <li>프로브 성공 → HEALTHY, 연속 실패 0</li>
 *   <li>프로브 실패 (예외 또는 타임아웃) → 연속 실패 증가,
 *       maxFailures 이상이면 UNHEALTHY, 그 외 DEGRADED</li>
 * </ul>
 *
 * <p>주기 실행은 단일 데몬 스레드에서 등록 순서대로 순차 실행되며, 첫 라운드는 한 주기 뒤에 시작합니다.
 * 라운드 중 발생한 예외는 로그로 남기고 스케줄은 유지됩니다.
 * {@link #start}/{@link #stop}은 멱등이며, 중단 후 다시 시작할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HealthProber implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthProber.class);

    /**
     * 등록 시 타임아웃을 지정하지 않은 경우의 기본값.
     */
    public static final long DEFAULT_PROBE_TIMEOUT_MS = 5000;

    /**
     * 등록 시 최대 실패 횟수를 지정하지 않은 경우의 기본값.
     */
    public static final int DEFAULT_MAX_FAILURES = 3;

    private final DeadlineEnforcer deadlineEnforcer;
    private final Clock clock;
    private final Map<String, ProbeRegistration> probes = Collections.synchronizedMap(new LinkedHashMap<>());

    private ScheduledExecutorService scheduler;
    private long intervalMs;

    public HealthProber(DeadlineEnforcer deadlineEnforcer) {
        this(deadlineEnforcer, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param deadlineEnforcer 프로브 타임아웃 적용기
     * @param clock 시간 소스
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public HealthProber(DeadlineEnforcer deadlineEnforcer, Clock clock) {
        if (deadlineEnforcer == null) {
            throw new IllegalArgumentException("deadlineEnforcer cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.deadlineEnforcer = deadlineEnforcer;
        this.clock = clock;
    }

    /**
     * 기본 타임아웃과 최대 실패 횟수로 프로브 등록.
     *
     * @param name 의존성 이름
     * @param probe 프로브
     */
    public void registerProbe(String name, HealthProbe probe) {
        registerProbe(name, probe, DEFAULT_PROBE_TIMEOUT_MS, DEFAULT_MAX_FAILURES);
    }

    /**
     * 프로브 등록 (같은 이름의 기존 프로브는 대체되며 상태는 UNKNOWN으로 초기화).
     *
     * @param name 의존성 이름
     * @param probe 프로브
     * @param timeoutMs 프로브 타임아웃 (밀리초, 0이면 타임아웃 없음)
     * @param maxFailures UNHEALTHY 판정 연속 실패 횟수 (1 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public void registerProbe(String name, HealthProbe probe, long timeoutMs, int maxFailures) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (probe == null) {
            throw new IllegalArgumentException("probe cannot be null");
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be non-negative (current: " + timeoutMs + ")"
            );
        }
        if (maxFailures < 1) {
            throw new IllegalArgumentException(
                "maxFailures must be positive (current: " + maxFailures + ")"
            );
        }
        probes.put(name, new ProbeRegistration(name, probe, timeoutMs, maxFailures));
    }

    /**
     * 프로브 등록 해제.
     *
     * @param name 의존성 이름
     * @return 등록되어 있었으면 true
     */
    public boolean unregisterProbe(String name) {
        return probes.remove(name) != null;
    }

    /**
     * 프로브 하나 실행.
     *
     * <p>대기 중 인터럽트되면 결과를 기록하지 않고 기존 상태를 반환합니다.</p>
     *
     * @param name 의존성 이름
     * @return 갱신된 상태
     * @throws IllegalArgumentException 등록되지 않은 이름인 경우
     */
    public HealthStatus checkOne(String name) {
        ProbeRegistration registration = probes.get(name);
        if (registration == null) {
            throw new IllegalArgumentException("Service " + name + " not registered");
        }

        try {
            ProbeReport report = deadlineEnforcer.withDeadline(registration.probe::check, registration.timeoutMs);
            return registration.recordSuccess(clock.instant(), report == null ? null : report.detail());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Health check for {} interrupted, status unchanged", name);
            return registration.snapshot();
        } catch (Exception e) {
            HealthStatus status = registration.recordFailure(clock.instant(), e.getMessage());
            log.warn("Health check failed for {} ({} consecutive): {}",
                name, status.consecutiveFailures(), e.getMessage());
            return status;
        }
    }

    /**
     * 등록된 모든 프로브를 등록 순서대로 실행.
     *
     * @return 의존성별 갱신된 상태
     */
    public Map<String, HealthStatus> checkAll() {
        Map<String, HealthStatus> results = new LinkedHashMap<>();
        for (String name : registeredNames()) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            if (probes.containsKey(name)) {
                results.put(name, checkOne(name));
            }
        }
        return results;
    }

    /**
     * 주기적 헬스 체크 시작 (이미 실행 중이면 무시).
     *
     * @param intervalMs 주기 (밀리초, 양수)
     * @throws IllegalArgumentException intervalMs가 양수가 아닌 경우
     */
    public synchronized void start(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException(
                "intervalMs must be positive (current: " + intervalMs + ")"
            );
        }
        if (scheduler != null) {
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("resilience-health-prober"));
        scheduler.scheduleAtFixedRate(this::runRound, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        this.intervalMs = intervalMs;
        log.info("Health prober started with interval: {}ms", intervalMs);
    }

    /**
     * 주기적 헬스 체크 중단 (이미 중단되어 있으면 무시).
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        log.info("Health prober stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    /**
     * 현재 주기 (실행 중이 아니면 0).
     *
     * @return 주기 (밀리초)
     */
    public synchronized long getIntervalMs() {
        return scheduler == null ? 0 : intervalMs;
    }

    /**
     * 의존성 상태 조회.
     *
     * @param name 의존성 이름
     * @return 상태 (등록되지 않았으면 empty)
     */
    public Optional<HealthStatus> getStatus(String name) {
        ProbeRegistration registration = probes.get(name);
        return registration == null ? Optional.empty() : Optional.of(registration.snapshot());
    }

    /**
     * 모든 의존성 상태 조회 (등록 순서).
     *
     * @return 의존성별 상태
     */
    public Map<String, HealthStatus> getAllStatuses() {
        Map<String, HealthStatus> statuses = new LinkedHashMap<>();
        synchronized (probes) {
            for (ProbeRegistration registration : probes.values()) {
                statuses.put(registration.name, registration.snapshot());
            }
        }
        return statuses;
    }

    @Override
    public void close() {
        stop();
    }

    private List<String> registeredNames() {
        synchronized (probes) {
            return new ArrayList<>(probes.keySet());
        }
    }

    private void runRound() {
        try {
            checkAll();
        } catch (RuntimeException e) {
            log.error("Error during periodic health checks", e);
        }
    }

    /**
     * 프로브 하나의 등록 정보와 가변 상태.
     */
    private static final class ProbeRegistration {

        private final String name;
        private final HealthProbe probe;
        private final long timeoutMs;
        private final int maxFailures;

        private HealthState state = HealthState.UNKNOWN;
        private Instant lastCheck;
        private int consecutiveFailures;
        private String lastDetail;

        private ProbeRegistration(String name, HealthProbe probe, long timeoutMs, int maxFailures) {
            this.name = name;
            this.probe = probe;
            this.timeoutMs = timeoutMs;
            this.maxFailures = maxFailures;
        }

        synchronized HealthStatus recordSuccess(Instant now, String detail) {
            consecutiveFailures = 0;
            state = HealthState.HEALTHY;
            lastCheck = now;
            lastDetail = detail;
            return snapshot();
        }

        synchronized HealthStatus recordFailure(Instant now, String detail) {
            consecutiveFailures++;
            state = HealthState.fromFailures(consecutiveFailures, maxFailures);
            lastCheck = now;
            lastDetail = detail;
            return snapshot();
        }

        synchronized HealthStatus snapshot() {
            return new HealthStatus(name, state, lastCheck, consecutiveFailures, maxFailures, lastDetail);
        }
    }
}
