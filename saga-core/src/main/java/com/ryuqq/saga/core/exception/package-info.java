/**
 * Saga error taxonomy.
 *
 * <p>All exceptions extend {@link com.ryuqq.saga.core.exception.SagaException} (unchecked).
 * Argument validation still uses {@link java.lang.IllegalArgumentException} and illegal
 * state machine transitions use {@link java.lang.IllegalStateException}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.saga.core.exception;
