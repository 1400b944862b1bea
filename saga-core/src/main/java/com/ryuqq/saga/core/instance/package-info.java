/**
 * Saga instance state package.
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.saga.core.instance.SagaInstance} - Durable state of one saga instance</li>
 *   <li>{@link com.ryuqq.saga.core.instance.Attempt} - One entry of the append-only attempt log</li>
 * </ul>
 *
 * <p>Every mutator returns a new record; the persistence store is the system of record.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.saga.core.instance;
