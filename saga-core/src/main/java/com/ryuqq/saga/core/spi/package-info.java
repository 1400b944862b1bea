/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide concrete functionality for the saga engine.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.saga.core.spi.SagaStore} - Durable saga instance persistence</li>
 *   <li>{@link com.ryuqq.saga.core.spi.CommandChannel} - Command dispatch and reply subscription</li>
 *   <li>{@link com.ryuqq.saga.core.spi.MessageHandler} - Subscription callback</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., saga-adapter-inmemory, saga-adapter-file)
 * are responsible for providing concrete implementations of these SPIs.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> Multiple implementations can coexist (e.g., InMemory for tests, file-backed for single-node use)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.saga.core.spi;
