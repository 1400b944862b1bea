/**
 * SPI contract tests shared by every adapter.
 *
 * <p>Adapter modules depend on this module in test scope and extend
 * {@link com.ryuqq.saga.testkit.contract.AbstractSagaStoreContractTest}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.saga.testkit.contract;
