/**
 * Core value objects.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.saga.core.model.SagaId} - Globally unique saga instance identifier</li>
 *   <li>{@link com.ryuqq.saga.core.model.Payload} - Immutable key/value business data passed between steps</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Fail-fast validation at construction</li>
 *   <li><strong>Equality:</strong> Value-based equality (equals/hashCode)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.saga.core.model;
