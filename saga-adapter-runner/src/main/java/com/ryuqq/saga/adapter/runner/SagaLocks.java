package com.ryuqq.saga.adapter.runner;

import com.ryuqq.saga.core.model.SagaId;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Saga ID별 임계 구역 (striped lock).
 *
 * <p>같은 Saga에 대한 응답 처리/재개는 직렬화되고, 다른 Saga는 (stripe가 겹치지 않는 한)
 * 독립적으로 진행됩니다. 락은 재진입 가능하므로 동기식 채널에서 핸들러가 같은 스레드로
 * 다시 엔진을 호출해도 교착되지 않습니다.</p>
 *
 * <p>단일 프로세스 안에서만 유효합니다.</p>
 *
 * <h3>Stripe 공유 주의</h3>
 * <p>서로 다른 Saga ID도 같은 stripe(해시 버킷)에 배정될 수 있습니다. 동기식 채널
 * ({@code InMemoryCommandChannel})에서 한 Saga의 핸들러가 락을 쥔 채로 다른 스레드를 통해
 * 다른 Saga의 응답을 동기적으로 기다리면, 두 Saga가 같은 stripe일 때 교착될 수 있습니다.
 * 같은 스레드 안의 재진입은 안전합니다. 여러 Saga를 교차 호출하는 핸들러는 엔진을 분리하거나
 * 비동기 채널을 사용하세요.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SagaLocks {

    public static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public SagaLocks() {
        this(DEFAULT_STRIPES);
    }

    /**
     * 생성자.
     *
     * @param stripeCount stripe 수 (1 이상)
     */
    public SagaLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive (current: " + stripeCount + ")");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Saga 락을 잡은 상태로 작업 실행.
     *
     * @param sagaId Saga ID
     * @param action 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     */
    public <T> T withLock(SagaId sagaId, Supplier<T> action) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        ReentrantLock lock = lockFor(sagaId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Saga 락을 잡은 상태로 작업 실행 (결과 없음).
     *
     * @param sagaId Saga ID
     * @param action 실행할 작업
     */
    public void withLock(SagaId sagaId, Runnable action) {
        withLock(sagaId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * 현재 스레드가 해당 Saga의 락을 보유 중인지 확인.
     *
     * @param sagaId Saga ID
     * @return 보유 중이면 true
     */
    public boolean isHeldByCurrentThread(SagaId sagaId) {
        return lockFor(sagaId).isHeldByCurrentThread();
    }

    private ReentrantLock lockFor(SagaId sagaId) {
        return stripes[Math.floorMod(sagaId.hashCode(), stripes.length)];
    }
}
