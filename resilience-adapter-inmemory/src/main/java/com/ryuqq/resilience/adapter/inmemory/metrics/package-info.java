/**
 * In-memory metrics sink.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.metrics;
