/**
 * Saga definition package.
 *
 * <p>An immutable, ordered catalog of steps. Each step pairs a forward action with a
 * compensating action and may carry payload-building strategies.</p>
 *
 * <h2>Step Invokers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.saga.core.definition.StepInvoker.Direct} - direct call, used by the inline executor</li>
 *   <li>{@link com.ryuqq.saga.core.definition.StepInvoker.Dispatch} - command dispatch, used by the asynchronous engine</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.saga.core.definition;
