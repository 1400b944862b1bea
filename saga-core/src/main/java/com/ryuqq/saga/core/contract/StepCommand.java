package com.ryuqq.saga.core.contract;

import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;

/**
 * Step 명령 디스패치 메시지.
 *
 * <p>Action 명령과 보상 명령이 같은 형태를 사용합니다. 보상 명령의 {@code stepIndex}는
 * 보상 대상 Attempt의 인덱스입니다.</p>
 *
 * @param sagaId Saga ID
 * @param stepIndex Step 인덱스
 * @param stepName Step 이름
 * @param payload 요청 페이로드
 * @param replyDestination 응답을 보낼 목적지
 * @param correlationId 상관 ID (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StepCommand(
    SagaId sagaId,
    int stepIndex,
    String stepName,
    Payload payload,
    String replyDestination,
    String correlationId
) implements SagaMessage {

    public StepCommand {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        if (stepIndex < 0) {
            throw new IllegalArgumentException("stepIndex must be non-negative (current: " + stepIndex + ")");
        }
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("stepName cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (replyDestination == null || replyDestination.isBlank()) {
            throw new IllegalArgumentException("replyDestination cannot be null or blank");
        }
        // correlationId는 null 허용
    }
}
