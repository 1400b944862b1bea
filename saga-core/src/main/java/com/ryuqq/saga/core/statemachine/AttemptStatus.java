package com.ryuqq.saga.core.statemachine;

/**
 * Step 실행 시도(Attempt)의 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * PENDING ──► COMPLETED ──┐
 *    │                    ├──► PENDING_COMPENSATION ──► COMPENSATED
 *    └──────► FAILED ─────┘                        └──► COMPENSATION_FAILED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AttemptStatus {

    /**
     * Action 디스패치됨, 응답 대기.
     */
    PENDING,

    /**
     * Action 성공.
     */
    COMPLETED,

    /**
     * Action 실패 (부분 적용 정리를 위해 보상 대상).
     */
    FAILED,

    /**
     * 보상 디스패치됨, 응답 대기.
     */
    PENDING_COMPENSATION,

    /**
     * 보상 성공.
     */
    COMPENSATED,

    /**
     * 보상 실패.
     */
    COMPENSATION_FAILED;

    /**
     * 역방향 보상 스캔 대상인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isCompensable() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 응답 대기 상태인지 확인.
     *
     * @return PENDING 또는 PENDING_COMPENSATION인 경우 true
     */
    public boolean isAwaitingReply() {
        return this == PENDING || this == PENDING_COMPENSATION;
    }
}
