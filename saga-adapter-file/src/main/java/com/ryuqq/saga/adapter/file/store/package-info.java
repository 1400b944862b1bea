/**
 * JSON file SagaStore adapter package.
 *
 * <p>Durable single-node persistence: one JSON document per saga instance,
 * written through a temp file and an atomic move. Serialization uses Jackson.</p>
 *
 * @see com.ryuqq.saga.core.spi.SagaStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.saga.adapter.file.store;
