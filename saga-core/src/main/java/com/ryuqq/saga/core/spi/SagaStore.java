package com.ryuqq.saga.core.spi;

import com.ryuqq.saga.core.instance.SagaInstance;
import com.ryuqq.saga.core.model.SagaId;

import java.util.List;
import java.util.Optional;

/**
 * Persistent Storage SPI for saga instances.
 *
 * <p>The engine persists the full instance record before every outbound dispatch,
 * so a crash between the two can always be recovered by {@code resume}.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Durable save (insert or replace) of a complete {@link SagaInstance}</li>
 *   <li>Lookup by saga id</li>
 *   <li>Idempotent deletion</li>
 *   <li>Stale instance discovery for the Reaper</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic replace: a reader observes either the previous or the new record, never a mix</li>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Round-trip fidelity: {@code load(save(x))} returns a value equal to {@code x}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SagaStore {

    /**
     * Saves the instance, replacing any previous record with the same id.
     *
     * @param instance the instance to persist
     * @throws IllegalArgumentException if instance is null
     * @throws com.ryuqq.saga.core.exception.SagaPersistenceException if the write fails
     */
    void save(SagaInstance instance);

    /**
     * Loads an instance by id.
     *
     * @param sagaId the saga id
     * @return the stored instance, or empty if none exists
     * @throws IllegalArgumentException if sagaId is null
     * @throws com.ryuqq.saga.core.exception.SagaPersistenceException if the read fails or the record is corrupt
     */
    Optional<SagaInstance> load(SagaId sagaId);

    /**
     * Deletes an instance. Deleting an absent id is a no-op.
     *
     * @param sagaId the saga id
     * @throws IllegalArgumentException if sagaId is null
     * @throws com.ryuqq.saga.core.exception.SagaPersistenceException if the delete fails
     */
    void delete(SagaId sagaId);

    /**
     * Scans for non-terminal instances that have not been updated since the given instant.
     *
     * <p>This method is used by the Reaper to find sagas whose reply was lost.</p>
     *
     * <p><strong>Query Example:</strong></p>
     * <pre>
     * SELECT saga_id FROM saga_instances
     * WHERE status IN ('CREATED', 'RUNNING', 'COMPENSATING')
     *   AND updated_at &lt; ?
     * ORDER BY updated_at ASC
     * LIMIT ?;
     * </pre>
     *
     * @param updatedBefore epoch millis; instances with {@code updatedAt < updatedBefore} qualify
     * @param batchSize maximum number of ids to return
     * @return saga ids ordered oldest first (may be empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<SagaId> scanStale(long updatedBefore, int batchSize);
}
