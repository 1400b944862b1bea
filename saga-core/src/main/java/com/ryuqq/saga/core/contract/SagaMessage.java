package com.ryuqq.saga.core.contract;

import com.ryuqq.saga.core.model.SagaId;

/**
 * 명령 채널로 오가는 모든 Saga 메시지.
 *
 * <p>Sealed interface로 정의되어 메시지 종류가 고정됩니다:</p>
 * <ul>
 *   <li>{@link StepCommand}: Action/보상 명령 디스패치</li>
 *   <li>{@link ActionReply}: Action 결과 응답</li>
 *   <li>{@link CompensationReply}: 보상 결과 응답</li>
 *   <li>{@link SagaCompletedEvent}: 성공 종료 이벤트</li>
 *   <li>{@link SagaFailedEvent}: 실패 종료 이벤트</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface SagaMessage
    permits StepCommand, ActionReply, CompensationReply, SagaCompletedEvent, SagaFailedEvent {

    /**
     * 메시지가 속한 Saga ID.
     *
     * @return Saga ID
     */
    SagaId sagaId();
}
