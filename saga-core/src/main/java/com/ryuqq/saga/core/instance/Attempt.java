package com.ryuqq.saga.core.instance;

import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.statemachine.AttemptStatus;
import com.ryuqq.saga.core.statemachine.SagaTransition;

/**
 * Step 실행 시도 기록 (Attempt 로그의 한 항목).
 *
 * <p>Attempt 로그에서 i번째 항목은 항상 i번째 Step에 대한 기록입니다.
 * 상태 변경은 새 Attempt를 반환하며, 전이 규칙은 {@link SagaTransition}이 검증합니다.</p>
 *
 * @param stepName Step 이름
 * @param requestPayload 디스패치한 Action 요청 페이로드 (재개 시 그대로 재전송)
 * @param result Action 결과 (성공 시, null 가능)
 * @param error Action 실패 오류 메시지 (null 가능, 보상 이후에도 유지)
 * @param status 현재 상태
 * @param compensationPayload 디스패치한 보상 페이로드 (보상 시작 전 null)
 * @param compensationError 보상 실패 오류 메시지 (COMPENSATION_FAILED일 때만)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Attempt(
    String stepName,
    Payload requestPayload,
    Payload result,
    String error,
    AttemptStatus status,
    Payload compensationPayload,
    String compensationError
) {

    public Attempt {
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("stepName cannot be null or blank");
        }
        if (requestPayload == null) {
            throw new IllegalArgumentException("requestPayload cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status == AttemptStatus.PENDING_COMPENSATION && compensationPayload == null) {
            throw new IllegalArgumentException("compensationPayload is required once compensation is dispatched");
        }
        // result, error, compensationError는 null 허용
    }

    /**
     * 디스패치 직후의 PENDING Attempt 생성.
     *
     * @param stepName Step 이름
     * @param requestPayload 요청 페이로드
     * @return PENDING Attempt
     */
    public static Attempt pending(String stepName, Payload requestPayload) {
        return new Attempt(stepName, requestPayload, null, null, AttemptStatus.PENDING, null, null);
    }

    /**
     * Action 성공 (PENDING → COMPLETED).
     *
     * @param output Action 결과 (null이면 빈 Payload)
     * @return COMPLETED Attempt
     */
    public Attempt complete(Payload output) {
        SagaTransition.validate(status, AttemptStatus.COMPLETED);
        return new Attempt(stepName, requestPayload, output == null ? Payload.empty() : output,
            null, AttemptStatus.COMPLETED, null, null);
    }

    /**
     * Action 실패 (PENDING → FAILED).
     *
     * @param error 오류 메시지
     * @return FAILED Attempt
     */
    public Attempt fail(String error) {
        SagaTransition.validate(status, AttemptStatus.FAILED);
        return new Attempt(stepName, requestPayload, null, error, AttemptStatus.FAILED, null, null);
    }

    /**
     * 보상 디스패치 (COMPLETED/FAILED → PENDING_COMPENSATION).
     *
     * @param payload 디스패치할 보상 페이로드
     * @return PENDING_COMPENSATION Attempt
     */
    public Attempt awaitCompensation(Payload payload) {
        SagaTransition.validate(status, AttemptStatus.PENDING_COMPENSATION);
        return new Attempt(stepName, requestPayload, result, error, AttemptStatus.PENDING_COMPENSATION, payload,
            null);
    }

    /**
     * 보상 성공 (PENDING_COMPENSATION → COMPENSATED).
     *
     * @return COMPENSATED Attempt
     */
    public Attempt compensate() {
        SagaTransition.validate(status, AttemptStatus.COMPENSATED);
        return new Attempt(stepName, requestPayload, result, error, AttemptStatus.COMPENSATED, compensationPayload,
            null);
    }

    /**
     * 보상 실패 (PENDING_COMPENSATION → COMPENSATION_FAILED).
     *
     * <p>Action 오류({@link #error()})는 그대로 남습니다.</p>
     *
     * @param compensationError 보상 오류 메시지
     * @return COMPENSATION_FAILED Attempt
     */
    public Attempt failCompensation(String compensationError) {
        SagaTransition.validate(status, AttemptStatus.COMPENSATION_FAILED);
        return new Attempt(stepName, requestPayload, result, error,
            AttemptStatus.COMPENSATION_FAILED, compensationPayload, compensationError);
    }
}
