package com.ryuqq.resilience.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Manually advanced clock for time-dependent contract tests.
 *
 * <p>Circuit breaker reset timeouts and health-check timestamps read time from the injected
 * {@link Clock}, so tests can move time forward without sleeping.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private volatile Instant now;

    public MutableClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount to advance (non-negative)
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative");
        }
        now = now.plus(duration);
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return now;
    }
}
