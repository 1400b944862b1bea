package com.ryuqq.saga.adapter.inmemory.store;

import com.ryuqq.saga.core.instance.SagaInstance;
import com.ryuqq.saga.core.model.SagaId;
import com.ryuqq.saga.core.spi.SagaStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link SagaStore} SPI for testing and reference purposes.
 *
 * <p>Instances are immutable records, so storing the reference in a
 * {@link ConcurrentHashMap} gives atomic replace semantics for free.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>save/load/delete:</strong> O(1) - ConcurrentHashMap operations</li>
 *   <li><strong>scanStale:</strong> O(N log N) - full scan, filtered and sorted by updatedAt</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySagaStore implements SagaStore {

    private final ConcurrentHashMap<SagaId, SagaInstance> instances = new ConcurrentHashMap<>();

    /**
     * Number of successful save calls, for assertions on "nothing persisted".
     */
    private final AtomicInteger saveCount = new AtomicInteger();

    @Override
    public void save(SagaInstance instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        instances.put(instance.id(), instance);
        saveCount.incrementAndGet();
    }

    @Override
    public Optional<SagaInstance> load(SagaId sagaId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        return Optional.ofNullable(instances.get(sagaId));
    }

    @Override
    public void delete(SagaId sagaId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        instances.remove(sagaId);
    }

    @Override
    public List<SagaId> scanStale(long updatedBefore, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        return instances.values().stream()
            .filter(instance -> !instance.isTerminal())
            .filter(instance -> instance.updatedAt() < updatedBefore)
            .sorted(Comparator.comparingLong(SagaInstance::updatedAt))
            .limit(batchSize)
            .map(SagaInstance::id)
            .collect(Collectors.toList());
    }

    /**
     * Returns the number of successful saves since creation or the last {@link #clear()}.
     *
     * @return save count
     */
    public int saveCount() {
        return saveCount.get();
    }

    /**
     * Returns the number of stored instances.
     *
     * @return instance count
     */
    public int size() {
        return instances.size();
    }

    /**
     * Removes all instances and resets the save counter (for testing).
     */
    public void clear() {
        instances.clear();
        saveCount.set(0);
    }
}
