/**
 * In-memory SagaStore adapter implementation package.
 *
 * <p>This package provides a reference implementation of the
 * {@link com.ryuqq.saga.core.spi.SagaStore} SPI for testing and educational purposes.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and single-process demos</li>
 * </ul>
 *
 * @see com.ryuqq.saga.core.spi.SagaStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.saga.adapter.inmemory.store;
