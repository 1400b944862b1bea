/**
 * Saga and attempt state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.saga.core.statemachine.SagaStatus} - Saga instance lifecycle states</li>
 *   <li>{@link com.ryuqq.saga.core.statemachine.AttemptStatus} - Per-step attempt states</li>
 *   <li>{@link com.ryuqq.saga.core.statemachine.SagaTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * CREATED → RUNNING
 * RUNNING → SUCCEEDED | COMPENSATING
 * COMPENSATING → FAILED_ACTION | FAILED_COMPENSATION
 *
 * Forbidden:
 * - SUCCEEDED, FAILED_ACTION, FAILED_COMPENSATION → * (terminal)
 * - COMPENSATING → RUNNING
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Invariants:</strong> Terminal states are never mutated again</li>
 *   <li><strong>Fail-Fast:</strong> Invalid transitions throw IllegalStateException immediately</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.saga.core.statemachine;
