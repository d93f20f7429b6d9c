package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.adapter.runner.DependencyRegistration;
import com.ryuqq.resilience.adapter.runner.OrchestratorConfig;
import com.ryuqq.resilience.core.error.OperationFailedException;
import com.ryuqq.resilience.core.model.OperationOptions;
import com.ryuqq.resilience.core.model.OperationResult;
import com.ryuqq.resilience.core.protection.FallbackStrategy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract tests for fallback chains through the orchestrator.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FallbackContractTest extends AbstractContractTest {

    private static final String DEPENDENCY = "documentGenerator";

    private void start(List<FallbackStrategy<?>> chain, OrchestratorConfig config) {
        startOrchestrator(config,
                List.of(DependencyRegistration.of(fastConfig(DEPENDENCY, 5)).withFallbackChain(chain)));
    }

    // ===== CHAIN ORDER =====

    @Test
    void testFallback_FirstFallbackFails_SecondProvidesValue() {
        // Given
        List<String> calls = new ArrayList<>();
        start(List.of(
                (context, error) -> {
                    calls.add("first");
                    throw new IllegalStateException("template cache empty");
                },
                (context, error) -> {
                    calls.add("second");
                    return "ok";
                }
        ), new OrchestratorConfig());

        // When
        OperationResult<Object> result = orchestrator.executeOperation(DEPENDENCY,
                CountingOperation.alwaysFailing(permanentError("render failed")), OperationOptions.defaults());

        // Then
        assertEquals("ok", result.data());
        assertTrue(result.fallbackUsed());
        assertEquals("render failed", result.originalError());
        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void testFallback_ReceivesContextAndPrimaryError() {
        // Given
        List<Object> seen = new ArrayList<>();
        start(List.of((context, error) -> {
            seen.add(context.get("documentId"));
            seen.add(error.getMessage());
            return "cached";
        }), new OrchestratorConfig());

        // When
        orchestrator.executeOperation(DEPENDENCY,
                CountingOperation.alwaysFailing(permanentError("render failed")),
                OperationOptions.defaults().withContext(Map.of("documentId", "doc-42")));

        // Then
        assertEquals(List.of("doc-42", "render failed"), seen);
    }

    @Test
    void testFallback_AdHocFallback_RunsAfterRegisteredChain() {
        // Given
        List<String> calls = new ArrayList<>();
        start(List.of((context, error) -> {
            calls.add("registered");
            throw new IllegalStateException("no copy");
        }), new OrchestratorConfig());
        FallbackStrategy<String> adHoc = (context, error) -> {
            calls.add("adHoc");
            return "per-call";
        };

        // When
        OperationResult<String> result = orchestrator.executeOperation(DEPENDENCY,
                CountingOperation.alwaysFailing(permanentError("render failed")),
                OperationOptions.defaults().withFallback(adHoc));

        // Then
        assertEquals("per-call", result.data());
        assertEquals(List.of("registered", "adHoc"), calls);
    }

    // ===== EXHAUSTION =====

    @Test
    void testFallback_AllFail_ThrowsPrimaryWithSuppressedFallbackErrors() {
        // Given
        start(List.of(
                (context, error) -> {
                    throw new IllegalStateException("fallback one");
                },
                (context, error) -> {
                    throw new IllegalStateException("fallback two");
                }
        ), new OrchestratorConfig());

        // When
        OperationFailedException e = assertThrows(OperationFailedException.class,
                () -> orchestrator.executeOperation(DEPENDENCY,
                        CountingOperation.alwaysFailing(permanentError("render failed")), OperationOptions.defaults()));

        // Then
        assertEquals("render failed", e.getCause().getMessage(), "Primary error must be reported");
        assertEquals(2, e.getCause().getSuppressed().length);
        assertFalse(e.isFallbackUsed());
    }

    @Test
    void testFallback_GloballyDisabled_PrimaryErrorPropagates() {
        // Given
        List<String> calls = new ArrayList<>();
        start(List.of((context, error) -> {
            calls.add("registered");
            return "cached";
        }), new OrchestratorConfig().withFallbacks(false));

        // When
        assertThrows(OperationFailedException.class,
                () -> orchestrator.executeOperation(DEPENDENCY,
                        CountingOperation.alwaysFailing(permanentError("render failed")), OperationOptions.defaults()));

        // Then
        assertTrue(calls.isEmpty(), "Disabled fallbacks must not be invoked");
    }
}
