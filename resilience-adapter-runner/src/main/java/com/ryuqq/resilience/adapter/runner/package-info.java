/**
 * 보호 계층 런타임 구현.
 *
 * <p>{@link com.ryuqq.resilience.adapter.runner.DeadlineEnforcer},
 * {@link com.ryuqq.resilience.adapter.runner.RetryCoordinator},
 * {@link com.ryuqq.resilience.adapter.runner.CountingCircuitBreaker},
 * {@link com.ryuqq.resilience.adapter.runner.FallbackChainExecutor},
 * {@link com.ryuqq.resilience.adapter.runner.HealthProber}를 제공하고,
 * 이를 {@link com.ryuqq.resilience.adapter.runner.DefaultResilientService}와
 * {@link com.ryuqq.resilience.adapter.runner.DefaultResilienceOrchestrator}로 조립합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner;
