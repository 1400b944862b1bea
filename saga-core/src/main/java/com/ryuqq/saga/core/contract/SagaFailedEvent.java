package com.ryuqq.saga.core.contract;

import com.ryuqq.saga.core.model.SagaId;

/**
 * Saga 실패 종료 이벤트 ({@code saga_events.<id>.failed}).
 *
 * @param sagaId Saga ID
 * @param reason 실패 사유
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SagaFailedEvent(SagaId sagaId, String reason) implements SagaMessage {

    public SagaFailedEvent {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
