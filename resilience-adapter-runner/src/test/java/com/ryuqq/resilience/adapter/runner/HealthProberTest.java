package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.model.HealthState;
import com.ryuqq.resilience.core.model.HealthStatus;
import com.ryuqq.resilience.core.protection.ProbeReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HealthProber 테스트.
 *
 * <p>상태 갱신 규칙과 주기 실행 시작/중단을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class HealthProberTest {

    private DeadlineEnforcer enforcer;
    private MutableClock clock;
    private HealthProber prober;

    @BeforeEach
    void setUp() {
        enforcer = new DeadlineEnforcer();
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        prober = new HealthProber(enforcer, clock);
    }

    @AfterEach
    void tearDown() {
        prober.close();
        enforcer.shutdown();
    }

    // ============================================================
    // 상태 갱신
    // ============================================================

    @Test
    void 등록_직후_상태는_UNKNOWN() {
        prober.registerProbe("database", ProbeReport::ok, 1000, 3);

        HealthStatus status = prober.getStatus("database").orElseThrow();

        assertThat(status.state()).isEqualTo(HealthState.UNKNOWN);
        assertThat(status.lastCheck()).isNull();
        assertThat(status.consecutiveFailures()).isZero();
    }

    @Test
    void 프로브_성공시_HEALTHY() {
        // given
        prober.registerProbe("database", () -> ProbeReport.of("pool: 4/10"), 1000, 3);

        // when
        HealthStatus status = prober.checkOne("database");

        // then
        assertThat(status.state()).isEqualTo(HealthState.HEALTHY);
        assertThat(status.lastCheck()).isEqualTo(clock.instant());
        assertThat(status.lastDetail()).isEqualTo("pool: 4/10");
        assertThat(status.isHealthy()).isTrue();
    }

    @Test
    void 연속_실패가_maxFailures에_도달하면_UNHEALTHY() {
        // given
        prober.registerProbe("blockchain", () -> {
            throw new IllegalStateException("node not synced");
        }, 1000, 3);

        // when
        HealthStatus first = prober.checkOne("blockchain");
        HealthStatus second = prober.checkOne("blockchain");
        HealthStatus third = prober.checkOne("blockchain");

        // then
        assertThat(first.state()).isEqualTo(HealthState.DEGRADED);
        assertThat(second.state()).isEqualTo(HealthState.DEGRADED);
        assertThat(third.state()).isEqualTo(HealthState.UNHEALTHY);
        assertThat(third.consecutiveFailures()).isEqualTo(3);
        assertThat(third.lastDetail()).isEqualTo("node not synced");
    }

    @Test
    void 실패_후_성공하면_연속_실패_초기화() {
        AtomicBoolean healthy = new AtomicBoolean(false);
        prober.registerProbe("translation", () -> {
            if (!healthy.get()) {
                throw new IllegalStateException("model loading");
            }
            return ProbeReport.ok();
        }, 1000, 3);

        prober.checkOne("translation");
        prober.checkOne("translation");
        healthy.set(true);
        HealthStatus status = prober.checkOne("translation");

        assertThat(status.state()).isEqualTo(HealthState.HEALTHY);
        assertThat(status.consecutiveFailures()).isZero();
    }

    @Test
    void 프로브_타임아웃은_실패로_기록() {
        CountDownLatch release = new CountDownLatch(1);
        prober.registerProbe("collaborative", () -> {
            release.await(5, TimeUnit.SECONDS);
            return ProbeReport.ok();
        }, 30, 1);

        HealthStatus status = prober.checkOne("collaborative");
        release.countDown();

        assertThat(status.state()).isEqualTo(HealthState.UNHEALTHY);
        assertThat(status.consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void 등록되지_않은_이름은_거부() {
        assertThatThrownBy(() -> prober.checkOne("missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void checkAll_등록_순서대로_모든_프로브_실행() {
        prober.registerProbe("database", ProbeReport::ok, 1000, 3);
        prober.registerProbe("translation", () -> {
            throw new IllegalStateException("down");
        }, 1000, 3);

        Map<String, HealthStatus> results = prober.checkAll();

        assertThat(results).containsOnlyKeys("database", "translation");
        assertThat(results.keySet()).containsExactly("database", "translation");
        assertThat(results.get("database").state()).isEqualTo(HealthState.HEALTHY);
        assertThat(results.get("translation").state()).isEqualTo(HealthState.DEGRADED);
    }

    @Test
    void unregisterProbe_이후_상태_조회_불가() {
        prober.registerProbe("database", ProbeReport::ok, 1000, 3);

        assertThat(prober.unregisterProbe("database")).isTrue();
        assertThat(prober.getStatus("database")).isEmpty();
        assertThat(prober.getAllStatuses()).isEmpty();
    }

    // ============================================================
    // 주기 실행
    // ============================================================

    @Test
    void start_주기적으로_프로브_실행() throws InterruptedException {
        // given
        CountDownLatch rounds = new CountDownLatch(2);
        prober.registerProbe("database", () -> {
            rounds.countDown();
            return ProbeReport.ok();
        }, 1000, 3);

        // when
        prober.start(20);

        // then
        assertThat(rounds.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(prober.isRunning()).isTrue();
        assertThat(prober.getIntervalMs()).isEqualTo(20);
    }

    @Test
    void 라운드_중_예외가_발생해도_스케줄_유지() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch rounds = new CountDownLatch(3);
        prober.registerProbe("translation", () -> {
            calls.incrementAndGet();
            rounds.countDown();
            throw new IllegalStateException("still down");
        }, 1000, 3);

        prober.start(20);

        assertThat(rounds.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(calls.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void 진행_중인_라운드를_stop해도_실패로_기록하지_않음() throws InterruptedException {
        // given
        CountDownLatch probing = new CountDownLatch(1);
        prober.registerProbe("database", () -> {
            probing.countDown();
            Thread.sleep(300);
            return ProbeReport.ok();
        }, 1000, 3);
        prober.start(20);
        assertThat(probing.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        prober.stop();
        Thread.sleep(50);

        // then
        HealthStatus status = prober.getStatus("database").orElseThrow();
        assertThat(status.consecutiveFailures()).isZero();
        assertThat(status.state()).isEqualTo(HealthState.UNKNOWN);
    }

    @Test
    void 인터럽트된_checkOne은_상태를_유지하고_인터럽트_플래그_복원() {
        // given
        prober.registerProbe("database", () -> {
            Thread.sleep(300);
            return ProbeReport.ok();
        }, 1000, 3);

        // when
        Thread.currentThread().interrupt();
        HealthStatus status = prober.checkOne("database");

        // then
        assertThat(Thread.interrupted()).isTrue();
        assertThat(status.consecutiveFailures()).isZero();
        assertThat(status.state()).isEqualTo(HealthState.UNKNOWN);
        assertThat(status.lastDetail()).isNull();
    }

    @Test
    void start_stop은_멱등이고_재시작_가능() {
        prober.start(1000);
        prober.start(1000);
        assertThat(prober.isRunning()).isTrue();

        prober.stop();
        prober.stop();
        assertThat(prober.isRunning()).isFalse();
        assertThat(prober.getIntervalMs()).isZero();

        prober.start(500);
        assertThat(prober.isRunning()).isTrue();
        assertThat(prober.getIntervalMs()).isEqualTo(500);
    }

    @Test
    void 잘못된_파라미터는_거부() {
        assertThatThrownBy(() -> prober.start(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> prober.registerProbe("database", null, 1000, 3))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> prober.registerProbe("database", ProbeReport::ok, 1000, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
