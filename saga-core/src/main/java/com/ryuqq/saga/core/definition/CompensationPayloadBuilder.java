package com.ryuqq.saga.core.definition;

import com.ryuqq.saga.core.model.Payload;

/**
 * Action 결과와 공유 페이로드로부터 보상 요청 페이로드를 만드는 전략.
 *
 * <p>지정하지 않으면 {@code {action_result: <결과>, shared_payload: <공유 페이로드>}}가 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CompensationPayloadBuilder {

    /**
     * 보상 페이로드 생성.
     *
     * @param actionResult 원본 Action 결과 (Action이 실패한 경우 빈 Payload)
     * @param sharedPayload 현재 공유 페이로드
     * @return 보상 요청 페이로드
     */
    Payload build(Payload actionResult, Payload sharedPayload);
}
