package com.ryuqq.saga.core.statemachine;

/**
 * Saga 인스턴스의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED
 *    │
 *    ▼ (start)
 * RUNNING ───────────► SUCCEEDED (모든 Step 성공)
 *    │
 *    ▼ (Action 실패)
 * COMPENSATING
 *    │
 *    ├─► FAILED_ACTION (모든 보상 성공)
 *    │
 *    └─► FAILED_COMPENSATION (보상 실패 또는 정의 불일치)
 *
 * 금지된 전이:
 * - 종료 상태 → * ❌
 * - COMPENSATING → RUNNING ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SagaStatus {

    /**
     * 생성됨 (아직 첫 Step 디스패치 전).
     */
    CREATED,

    /**
     * 정방향 Step 실행 중.
     */
    RUNNING,

    /**
     * 역방향 보상 진행 중.
     */
    COMPENSATING,

    /**
     * 모든 Step 성공 (종료).
     */
    SUCCEEDED,

    /**
     * Action 실패 후 보상 완료 (종료).
     */
    FAILED_ACTION,

    /**
     * 보상 실패 (종료, 수동 조치 필요).
     */
    FAILED_COMPENSATION;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태에서는 더 이상 어떤 변경도 허용되지 않습니다.</p>
     *
     * @return SUCCEEDED, FAILED_ACTION, FAILED_COMPENSATION인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_ACTION || this == FAILED_COMPENSATION;
    }
}
