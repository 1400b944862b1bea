package com.ryuqq.saga.core.contract;

/**
 * 명령 단계 (정방향 Action 또는 보상).
 *
 * <p>다운스트림 소비자는 {@code (sagaId, stepIndex, phase)}로 중복을 제거해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Phase {

    ACTION,

    COMPENSATION
}
