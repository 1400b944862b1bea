package com.ryuqq.saga.core.exception;

import com.ryuqq.saga.core.model.SagaId;

/**
 * Action 실패.
 *
 * <p>인라인 실행에서 Action이 실패했고 완료된 Step들의 보상이 모두 성공한 경우 던져집니다.
 * 원본 Action 예외는 {@link #getCause()}로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SagaExecutionException extends SagaException {

    private final String failedStepName;

    public SagaExecutionException(String message, SagaId sagaId, String failedStepName, Throwable cause) {
        super(message, sagaId, cause);
        this.failedStepName = failedStepName;
    }

    /**
     * 실패한 Step 이름.
     *
     * @return Step 이름
     */
    public String getFailedStepName() {
        return failedStepName;
    }
}
