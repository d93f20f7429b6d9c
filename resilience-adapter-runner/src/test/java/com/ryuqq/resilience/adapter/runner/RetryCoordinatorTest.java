package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.error.DeadlineExceededException;
import com.ryuqq.resilience.core.error.DependencyException;
import com.ryuqq.resilience.core.error.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryCoordinator 테스트.
 *
 * <p>시도 횟수, 재시도 불가 오류의 즉시 전파, 마지막 오류 전파를 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RetryCoordinatorTest {

    private RetryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new RetryCoordinator(new BackoffCalculator(1, 10, 2.0));
    }

    // ============================================================
    // 성공 경로
    // ============================================================

    @Test
    void 첫_시도_성공시_한번만_실행() throws Exception {
        // given
        AtomicInteger attempts = new AtomicInteger();

        // when
        String result = coordinator.retry(() -> {
            attempts.incrementAndGet();
            return "ok";
        }, 3);

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("일시적 오류 두 번 후 성공하면 세 번 실행")
    void transientFailuresThenSuccess() throws Exception {
        // given
        AtomicInteger attempts = new AtomicInteger();
        Callable<String> flaky = () -> {
            if (attempts.incrementAndGet() <= 2) {
                throw new DependencyException(ErrorKind.SERVICE_UNAVAILABLE, "upstream 503");
            }
            return "recovered";
        };

        // when
        String result = coordinator.retry(flaky, 3);

        // then
        assertThat(result).isEqualTo("recovered");
        assertThat(attempts.get()).isEqualTo(3);
    }

    // ============================================================
    // 실패 경로
    // ============================================================

    @Test
    void 재시도_모두_실패시_maxRetries_더하기_1회_실행후_마지막_오류_전파() {
        // given
        AtomicInteger attempts = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> coordinator.retry(() -> {
            int n = attempts.incrementAndGet();
            throw new DeadlineExceededException(100, "attempt " + n + " exceeded deadline");
        }, 2))
            .isInstanceOf(DeadlineExceededException.class)
            .hasMessage("attempt 3 exceeded deadline");
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void 재시도_불가_오류는_즉시_전파() {
        // given
        AtomicInteger attempts = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> coordinator.retry(() -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("invalid clause id");
        }, 5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("invalid clause id");
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void 분류되지_않은_오류는_재시도하지_않음() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> coordinator.retry(() -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("corrupted payload");
        }, 3)).isInstanceOf(IllegalStateException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void maxRetries_0이면_한번만_실행() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> coordinator.retry(() -> {
            attempts.incrementAndGet();
            throw new DependencyException(ErrorKind.TRANSIENT_NETWORK, "reset by peer");
        }, 0)).isInstanceOf(DependencyException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void 사용자_분류기로_재시도_여부_결정() throws Exception {
        // given
        AtomicInteger attempts = new AtomicInteger();

        // when
        String result = coordinator.retry(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("first call fails");
            }
            return "second";
        }, 1, e -> e instanceof IllegalStateException);

        // then
        assertThat(result).isEqualTo("second");
        assertThat(attempts.get()).isEqualTo(2);
    }

    // ============================================================
    // 검증
    // ============================================================

    @Test
    void 잘못된_파라미터는_거부() {
        assertThatThrownBy(() -> coordinator.retry(null, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> coordinator.retry(() -> "x", -1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> coordinator.retry(() -> "x", 1, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
