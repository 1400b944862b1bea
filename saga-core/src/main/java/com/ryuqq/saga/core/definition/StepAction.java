package com.ryuqq.saga.core.definition;

import com.ryuqq.saga.core.model.Payload;

/**
 * 인라인 모드의 정방향 Action (직접 호출).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StepAction {

    /**
     * Action 실행.
     *
     * @param request Step 요청 페이로드
     * @return Action 결과. 공유 페이로드에 병합되어 다음 Step에 전달됨 (null이면 빈 Payload로 취급)
     * @throws Exception Action 실패 시 (보상 트리거)
     */
    Payload execute(Payload request) throws Exception;
}
