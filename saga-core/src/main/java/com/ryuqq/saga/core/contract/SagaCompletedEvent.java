package com.ryuqq.saga.core.contract;

import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;

/**
 * Saga 성공 종료 이벤트 ({@code saga_events.<id>.completed}).
 *
 * @param sagaId Saga ID
 * @param finalSharedPayload 최종 공유 페이로드
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SagaCompletedEvent(SagaId sagaId, Payload finalSharedPayload) implements SagaMessage {

    public SagaCompletedEvent {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        if (finalSharedPayload == null) {
            throw new IllegalArgumentException("finalSharedPayload cannot be null");
        }
    }
}
