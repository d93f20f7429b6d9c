package com.ryuqq.resilience.testkit.contract;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted operation that counts its invocations.
 *
 * <p>Fails with the configured error for the first {@code failures} calls, then returns the
 * configured value. A negative {@code failures} means it never succeeds.</p>
 *
 * <pre>
 * CountingOperation&lt;String&gt; op = CountingOperation.failingTimes(2, retryableError(), "success");
 * orchestrator.executeOperation("translation", op, OperationOptions.defaults());
 * assertEquals(3, op.invocations());
 * </pre>
 *
 * @param <T> result type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CountingOperation<T> implements Callable<T> {

    private final int failures;
    private final Exception error;
    private final T value;
    private final AtomicInteger invocations = new AtomicInteger();

    private CountingOperation(int failures, Exception error, T value) {
        this.failures = failures;
        this.error = error;
        this.value = value;
    }

    public static <T> CountingOperation<T> succeeding(T value) {
        return new CountingOperation<>(0, null, value);
    }

    public static <T> CountingOperation<T> failingTimes(int failures, Exception error, T value) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new CountingOperation<>(failures, error, value);
    }

    public static <T> CountingOperation<T> alwaysFailing(Exception error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new CountingOperation<>(-1, error, null);
    }

    @Override
    public T call() throws Exception {
        int call = invocations.incrementAndGet();
        if (failures < 0 || call <= failures) {
            throw error;
        }
        return value;
    }

    public int invocations() {
        return invocations.get();
    }
}
