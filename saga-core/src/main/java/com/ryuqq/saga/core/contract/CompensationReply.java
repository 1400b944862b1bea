package com.ryuqq.saga.core.contract;

import com.ryuqq.saga.core.model.SagaId;

/**
 * 보상 결과 응답.
 *
 * @param sagaId Saga ID
 * @param stepIndexToCompensate 보상한 Attempt 인덱스
 * @param success 성공 여부
 * @param error 오류 메시지 (실패 시, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CompensationReply(
    SagaId sagaId,
    int stepIndexToCompensate,
    boolean success,
    String error
) implements SagaMessage {

    public CompensationReply {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        if (stepIndexToCompensate < 0) {
            throw new IllegalArgumentException(
                "stepIndexToCompensate must be non-negative (current: " + stepIndexToCompensate + ")");
        }
    }

    public static CompensationReply success(SagaId sagaId, int stepIndexToCompensate) {
        return new CompensationReply(sagaId, stepIndexToCompensate, true, null);
    }

    public static CompensationReply failure(SagaId sagaId, int stepIndexToCompensate, String error) {
        return new CompensationReply(sagaId, stepIndexToCompensate, false, error);
    }
}
