/**
 * In-memory user message catalog.
 *
 * <p>Provides {@link com.ryuqq.resilience.adapter.inmemory.message.InMemoryMessageCatalog},
 * a French/Malagasy implementation of {@link com.ryuqq.resilience.core.spi.MessageCatalog}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.message;
