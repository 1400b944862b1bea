package com.ryuqq.saga.core.exception;

import com.ryuqq.saga.core.model.SagaId;

import java.util.List;

/**
 * 보상 실패 (집계).
 *
 * <p>원본 Action 실패({@link #getCause()})와 보상 중 발생한 모든 실패 목록을 함께 담습니다.
 * 보상 실패는 자동 재시도되지 않으며 수동 조치가 필요합니다.</p>
 *
 * <p>각 보상 실패의 예외는 {@link #getSuppressed()}에도 추가됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SagaCompensationException extends SagaException {

    private final String failedStepName;
    private final List<CompensationFailure> compensationFailures;

    public SagaCompensationException(
        String message,
        SagaId sagaId,
        String failedStepName,
        Throwable actionFailure,
        List<CompensationFailure> compensationFailures
    ) {
        super(message, sagaId, actionFailure);
        if (compensationFailures == null || compensationFailures.isEmpty()) {
            throw new IllegalArgumentException("compensationFailures cannot be null or empty");
        }
        this.failedStepName = failedStepName;
        this.compensationFailures = List.copyOf(compensationFailures);
        for (CompensationFailure failure : this.compensationFailures) {
            addSuppressed(failure.cause());
        }
    }

    /**
     * 원래 실패한 Action의 Step 이름.
     *
     * @return Step 이름
     */
    public String getFailedStepName() {
        return failedStepName;
    }

    /**
     * 보상 실패 목록 (보상 시도 순서).
     *
     * @return 수정 불가능한 목록
     */
    public List<CompensationFailure> getCompensationFailures() {
        return compensationFailures;
    }

    /**
     * Step 하나의 보상 실패.
     *
     * @param stepName 보상에 실패한 Step 이름
     * @param cause 보상 예외
     */
    public record CompensationFailure(String stepName, Throwable cause) {

        public CompensationFailure {
            if (stepName == null || stepName.isBlank()) {
                throw new IllegalArgumentException("stepName cannot be null or blank");
            }
            if (cause == null) {
                throw new IllegalArgumentException("cause cannot be null");
            }
        }
    }
}
