package com.ryuqq.saga.adapter.runner;

/**
 * 보상 실패 시 나머지 보상의 진행 여부.
 *
 * <p><strong>모드별 기본값:</strong></p>
 * <ul>
 *   <li>비동기 엔진: {@link #HALT_ON_FAILURE} (운영자 개입 전까지 추가 롤백 없음)</li>
 *   <li>인라인 실행기: {@link #CONTINUE_ON_FAILURE} (모든 보상 시도 후 실패 집계)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CompensationPolicy {

    /**
     * 보상 하나가 실패하면 즉시 FAILED_COMPENSATION으로 종료.
     */
    HALT_ON_FAILURE,

    /**
     * 실패한 보상을 기록하고 이전 Step 보상을 계속 진행.
     */
    CONTINUE_ON_FAILURE
}
