package com.ryuqq.saga.core.contract;

import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;

/**
 * Action 결과 응답.
 *
 * @param sagaId Saga ID
 * @param stepIndex 완료된 Step 인덱스
 * @param success 성공 여부
 * @param output Action 결과 (null 가능)
 * @param error 오류 메시지 (실패 시, null 가능)
 * @param updatedSharedPayload 공유 페이로드에 병합할 갱신값 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActionReply(
    SagaId sagaId,
    int stepIndex,
    boolean success,
    Payload output,
    String error,
    Payload updatedSharedPayload
) implements SagaMessage {

    public ActionReply {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        if (stepIndex < 0) {
            throw new IllegalArgumentException("stepIndex must be non-negative (current: " + stepIndex + ")");
        }
    }

    /**
     * 성공 응답 생성.
     *
     * @param sagaId Saga ID
     * @param stepIndex Step 인덱스
     * @param output Action 결과
     * @param updatedSharedPayload 공유 페이로드 갱신값
     * @return 성공 응답
     */
    public static ActionReply success(SagaId sagaId, int stepIndex, Payload output, Payload updatedSharedPayload) {
        return new ActionReply(sagaId, stepIndex, true, output, null, updatedSharedPayload);
    }

    /**
     * 실패 응답 생성.
     *
     * @param sagaId Saga ID
     * @param stepIndex Step 인덱스
     * @param error 오류 메시지
     * @return 실패 응답
     */
    public static ActionReply failure(SagaId sagaId, int stepIndex, String error) {
        return new ActionReply(sagaId, stepIndex, false, null, error, null);
    }
}
