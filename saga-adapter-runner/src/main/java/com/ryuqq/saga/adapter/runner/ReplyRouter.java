package com.ryuqq.saga.adapter.runner;

import com.ryuqq.saga.application.engine.SagaEngine;
import com.ryuqq.saga.core.contract.ActionReply;
import com.ryuqq.saga.core.contract.CompensationReply;
import com.ryuqq.saga.core.contract.Destinations;
import com.ryuqq.saga.core.contract.SagaMessage;
import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;
import com.ryuqq.saga.core.spi.CommandChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Saga별 응답 목적지를 엔진의 응답 핸들러에 연결합니다.
 *
 * <p>{@link #register(SagaId)}는 다음 네 개의 구독을 만듭니다:</p>
 * <ul>
 *   <li>{@code saga.<id>.action_result} → {@link SagaEngine#handleActionReply(ActionReply)}</li>
 *   <li>{@code saga.<id>.compensation_result} → {@link SagaEngine#handleCompensationReply(CompensationReply)}</li>
 *   <li>{@code saga_events.<id>.completed}, {@code saga_events.<id>.failed} → 구독 해제</li>
 * </ul>
 *
 * <p>종료 이벤트가 발행되면 해당 Saga의 구독은 모두 해제됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReplyRouter {

    private static final Logger log = LoggerFactory.getLogger(ReplyRouter.class);

    private final SagaEngine engine;
    private final CommandChannel channel;
    private final Map<SagaId, List<String>> subscriptions = new HashMap<>();

    /**
     * 생성자.
     *
     * @param engine Saga 엔진
     * @param channel 명령 채널
     */
    public ReplyRouter(SagaEngine engine, CommandChannel channel) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        this.engine = engine;
        this.channel = channel;
    }

    /**
     * 응답 구독을 먼저 등록한 뒤 Saga 시작.
     *
     * <p>첫 응답이 구독보다 먼저 도착하는 경합을 막기 위해 ID를 미리 발급받아 등록합니다.
     * 시작이 실패하면 등록을 되돌립니다.</p>
     *
     * @param initialPayload 초기 공유 페이로드
     * @param correlationId 상관 ID (null 허용)
     * @return 시작된 Saga ID
     */
    public SagaId start(Payload initialPayload, String correlationId) {
        SagaId sagaId = engine.nextSagaId();
        register(sagaId);
        try {
            return engine.start(sagaId, initialPayload, correlationId);
        } catch (RuntimeException e) {
            unregister(sagaId);
            throw e;
        }
    }

    /**
     * Saga 응답 구독 등록. 이미 등록된 경우 아무것도 하지 않습니다.
     *
     * <p>재시작 후 {@code resume} 전에 비종료 Saga를 다시 등록할 때도 사용합니다.</p>
     *
     * @param sagaId Saga ID
     */
    public synchronized void register(SagaId sagaId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        if (subscriptions.containsKey(sagaId)) {
            return;
        }
        List<String> ids = List.of(
            channel.subscribe(Destinations.actionResult(sagaId), this::onActionReply),
            channel.subscribe(Destinations.compensationResult(sagaId), this::onCompensationReply),
            channel.subscribe(Destinations.completed(sagaId), (message, headers) -> unregister(sagaId)),
            channel.subscribe(Destinations.failed(sagaId), (message, headers) -> unregister(sagaId))
        );
        subscriptions.put(sagaId, ids);
        log.debug("Registered reply routes for saga {}", sagaId.getValue());
    }

    /**
     * Saga 응답 구독 해제. 등록되지 않은 경우 아무것도 하지 않습니다.
     *
     * @param sagaId Saga ID
     */
    public synchronized void unregister(SagaId sagaId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        List<String> ids = subscriptions.remove(sagaId);
        if (ids == null) {
            return;
        }
        ids.forEach(channel::unsubscribe);
        log.debug("Unregistered reply routes for saga {}", sagaId.getValue());
    }

    public synchronized boolean isRegistered(SagaId sagaId) {
        return subscriptions.containsKey(sagaId);
    }

    public synchronized int registeredCount() {
        return subscriptions.size();
    }

    private void onActionReply(SagaMessage message, Map<String, String> headers) {
        if (message instanceof ActionReply reply) {
            engine.handleActionReply(reply);
            return;
        }
        log.warn("Ignoring {} on action reply destination of saga {}",
            message.getClass().getSimpleName(), message.sagaId().getValue());
    }

    private void onCompensationReply(SagaMessage message, Map<String, String> headers) {
        if (message instanceof CompensationReply reply) {
            engine.handleCompensationReply(reply);
            return;
        }
        log.warn("Ignoring {} on compensation reply destination of saga {}",
            message.getClass().getSimpleName(), message.sagaId().getValue());
    }
}
