package com.ryuqq.saga.core.definition;

import com.ryuqq.saga.core.model.Payload;

/**
 * 인라인 모드의 보상 (직접 호출).
 *
 * <p>보상은 해당 Step 자신의 Action 결과를 받아 효과를 되돌립니다.
 * 아무것도 되돌릴 것이 없는 Step은 {@link #noOp()}을 명시적으로 지정해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StepCompensation {

    /**
     * 보상 실행.
     *
     * @param actionResult 보상 대상 Step의 Action 결과
     * @throws Exception 보상 실패 시
     */
    void compensate(Payload actionResult) throws Exception;

    /**
     * 아무 동작도 하지 않는 보상.
     *
     * @return no-op 보상
     */
    static StepCompensation noOp() {
        return actionResult -> { };
    }
}
