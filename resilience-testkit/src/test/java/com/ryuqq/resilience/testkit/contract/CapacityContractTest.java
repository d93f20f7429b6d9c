package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.adapter.runner.DependencyRegistration;
import com.ryuqq.resilience.adapter.runner.OrchestratorConfig;
import com.ryuqq.resilience.core.error.CapacityExceededException;
import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.model.OperationOptions;
import com.ryuqq.resilience.core.model.OperationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract tests for the global concurrency cap.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CapacityContractTest extends AbstractContractTest {

    private static final String DEPENDENCY = "collaborative";

    private final ExecutorService callers = Executors.newFixedThreadPool(2);

    @AfterEach
    void stopCallers() {
        callers.shutdownNow();
    }

    private Future<OperationResult<String>> submitBlocking(CountDownLatch release) {
        return callers.submit(() -> orchestrator.executeOperation(DEPENDENCY, () -> {
            release.await(5, TimeUnit.SECONDS);
            return "done";
        }, OperationOptions.defaults()));
    }

    private void awaitActive(int expected) {
        long deadline = System.currentTimeMillis() + 2000;
        while (orchestrator.getActiveOperations().size() < expected) {
            if (System.currentTimeMillis() > deadline) {
                fail("Expected " + expected + " active operations but was "
                        + orchestrator.getActiveOperations().size());
            }
            sleep(5);
        }
    }

    // ===== ADMISSION =====

    @Test
    void testCapacity_LimitReached_RejectsImmediately() throws Exception {
        // Given
        startOrchestrator(new OrchestratorConfig().withMaxConcurrentOperations(2),
                List.of(DependencyRegistration.of(fastConfig(DEPENDENCY, 5))));
        CountDownLatch release = new CountDownLatch(1);
        Future<OperationResult<String>> first = submitBlocking(release);
        Future<OperationResult<String>> second = submitBlocking(release);
        awaitActive(2);
        CountingOperation<String> third = CountingOperation.succeeding("never");

        // When
        long started = System.nanoTime();
        CapacityExceededException e = assertThrows(CapacityExceededException.class,
                () -> orchestrator.executeOperation(DEPENDENCY, third, OperationOptions.defaults()));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        // Then
        assertEquals(ErrorKind.CAPACITY_EXCEEDED, e.getKind());
        assertEquals(0, third.invocations(), "Rejected operation must not run");
        assertTrue(elapsedMs < 100, "Rejection should not wait (was " + elapsedMs + "ms)");

        release.countDown();
        assertEquals("done", first.get(2, TimeUnit.SECONDS).data());
        assertEquals("done", second.get(2, TimeUnit.SECONDS).data());
    }

    @Test
    void testCapacity_SlotsFreed_AdmitsAgain() throws Exception {
        // Given
        startOrchestrator(new OrchestratorConfig().withMaxConcurrentOperations(2),
                List.of(DependencyRegistration.of(fastConfig(DEPENDENCY, 5))));
        CountDownLatch release = new CountDownLatch(1);
        Future<OperationResult<String>> first = submitBlocking(release);
        Future<OperationResult<String>> second = submitBlocking(release);
        awaitActive(2);

        // When
        release.countDown();
        first.get(2, TimeUnit.SECONDS);
        second.get(2, TimeUnit.SECONDS);
        OperationResult<String> result = orchestrator.executeOperation(
                DEPENDENCY, () -> "admitted", OperationOptions.defaults());

        // Then
        assertEquals("admitted", result.data());
        assertTrue(orchestrator.getActiveOperations().isEmpty());
        assertEquals(0, orchestrator.getSystemHealth().overall().activeOperations());
    }

    @Test
    void testCapacity_ActiveOperation_VisibleWhileRunning() throws Exception {
        // Given
        startOrchestrator(new OrchestratorConfig(),
                List.of(DependencyRegistration.of(fastConfig(DEPENDENCY, 5))));
        CountDownLatch release = new CountDownLatch(1);
        Future<OperationResult<String>> running = submitBlocking(release);
        awaitActive(1);

        // When
        String dependency = orchestrator.getActiveOperations().iterator().next().dependencyName();

        // Then
        assertEquals(DEPENDENCY, dependency);
        assertEquals(1, orchestrator.getSystemHealth().overall().activeOperations());

        release.countDown();
        running.get(2, TimeUnit.SECONDS);
    }
}
