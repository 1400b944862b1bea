package com.ryuqq.saga.core.definition;

import com.ryuqq.saga.core.model.Payload;

/**
 * 공유 페이로드로부터 Action 요청 페이로드를 만드는 전략.
 *
 * <p>지정하지 않으면 공유 페이로드 전체가 그대로 요청 페이로드가 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ActionPayloadBuilder {

    /**
     * 요청 페이로드 생성.
     *
     * @param sharedPayload 현재 공유 페이로드
     * @return Action 요청 페이로드
     */
    Payload build(Payload sharedPayload);
}
