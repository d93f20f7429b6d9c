package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.adapter.runner.DependencyRegistration;
import com.ryuqq.resilience.adapter.runner.OrchestratorConfig;
import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.error.OperationFailedException;
import com.ryuqq.resilience.core.model.DependencyConfig;
import com.ryuqq.resilience.core.model.OperationOptions;
import com.ryuqq.resilience.core.model.OperationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract tests for retry behavior through the orchestrator.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RetryContractTest extends AbstractContractTest {

    private static final String DEPENDENCY = "database";

    private void start(DependencyConfig config, OrchestratorConfig orchestratorConfig) {
        startOrchestrator(orchestratorConfig, List.of(DependencyRegistration.of(config)));
    }

    // ===== RETRYABLE ERRORS =====

    @Test
    void testRetry_TransientFailures_SucceedsOnThirdAttempt() {
        // Given
        start(DependencyConfig.of(DEPENDENCY, 2000, 2, 5, 60000).withBackoff(10, 100, 2.0),
                new OrchestratorConfig());
        CountingOperation<String> flaky = CountingOperation.failingTimes(
                2, retryableError("service temporarily down"), "success");

        // When
        long started = System.nanoTime();
        OperationResult<String> result = orchestrator.executeOperation(DEPENDENCY, flaky, OperationOptions.defaults());
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        // Then
        assertEquals("success", result.data());
        assertFalse(result.fallbackUsed());
        assertEquals(3, flaky.invocations(), "Expected initial attempt plus two retries");
        assertTrue(elapsedMs >= 14, "Jittered backoff should wait at least 15ms in total (was " + elapsedMs + "ms)");
        assertEquals(1, metrics.getSuccessCount(DEPENDENCY));
    }

    @Test
    void testRetry_ExhaustedAttempts_FailsWithOriginalKind() {
        // Given
        start(fastConfig(DEPENDENCY, 5), new OrchestratorConfig());
        CountingOperation<String> failing = CountingOperation.alwaysFailing(retryableError("service unavailable"));

        // When
        OperationFailedException e = assertThrows(OperationFailedException.class,
                () -> orchestrator.executeOperation(DEPENDENCY, failing, OperationOptions.defaults()));

        // Then
        assertEquals(3, failing.invocations(), "maxRetries 2 allows three attempts");
        assertEquals(ErrorKind.SERVICE_UNAVAILABLE, e.getKind());
        assertEquals(1, service(DEPENDENCY).getCircuitBreaker().snapshot().failureCount(),
                "A retried call counts as one breaker failure");
    }

    // ===== NON-RETRYABLE =====

    @Test
    void testRetry_NonRetryableError_SingleAttempt() {
        // Given
        start(fastConfig(DEPENDENCY, 5), new OrchestratorConfig());
        CountingOperation<String> failing = CountingOperation.alwaysFailing(new IllegalArgumentException("bad input"));

        // When
        OperationFailedException e = assertThrows(OperationFailedException.class,
                () -> orchestrator.executeOperation(DEPENDENCY, failing, OperationOptions.defaults()));

        // Then
        assertEquals(1, failing.invocations());
        assertEquals(ErrorKind.CLIENT_VALIDATION, e.getKind());
    }

    @Test
    void testRetry_OptionWithoutRetry_SingleAttempt() {
        // Given
        start(fastConfig(DEPENDENCY, 5), new OrchestratorConfig());
        CountingOperation<String> failing = CountingOperation.alwaysFailing(retryableError("service unavailable"));

        // When
        assertThrows(OperationFailedException.class,
                () -> orchestrator.executeOperation(DEPENDENCY, failing, OperationOptions.defaults().withoutRetry()));

        // Then
        assertEquals(1, failing.invocations());
    }

    @Test
    void testRetry_GloballyDisabled_SingleAttempt() {
        // Given
        start(fastConfig(DEPENDENCY, 5), new OrchestratorConfig().withRetries(false));
        CountingOperation<String> failing = CountingOperation.alwaysFailing(retryableError("service unavailable"));

        // When
        assertThrows(OperationFailedException.class,
                () -> orchestrator.executeOperation(DEPENDENCY, failing, OperationOptions.defaults()));

        // Then
        assertEquals(1, failing.invocations());
        assertFalse(orchestrator.getGlobalSettings().retriesEnabled());
    }
}
