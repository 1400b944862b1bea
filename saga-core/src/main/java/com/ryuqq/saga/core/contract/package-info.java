/**
 * Saga message contract package.
 *
 * <p>Field-exact shapes of every message exchanged over the command channel:</p>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.saga.core.contract.StepCommand} - {saga_id, step_index, step_name, payload, reply_destination, correlation_id}</li>
 *   <li>{@link com.ryuqq.saga.core.contract.ActionReply} - {saga_id, step_index, success, output?, error?, updated_shared_payload?}</li>
 *   <li>{@link com.ryuqq.saga.core.contract.CompensationReply} - {saga_id, step_index_to_compensate, success, error?}</li>
 *   <li>{@link com.ryuqq.saga.core.contract.SagaCompletedEvent} - {saga_id, final_shared_payload}</li>
 *   <li>{@link com.ryuqq.saga.core.contract.SagaFailedEvent} - {saga_id, reason}</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records are immutable by default</li>
 *   <li><strong>Validation:</strong> Compact constructors enforce invariants</li>
 *   <li><strong>Closed set:</strong> {@link com.ryuqq.saga.core.contract.SagaMessage} is sealed</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.saga.core.contract;
