/**
 * In-memory CommandChannel adapter implementation package.
 *
 * <p>Synchronous, single-process message delivery with a published-message log.
 * Intended for tests and for wiring the engine to in-process step handlers.</p>
 *
 * @see com.ryuqq.saga.core.spi.CommandChannel
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.saga.adapter.inmemory.channel;
