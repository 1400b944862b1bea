package com.ryuqq.saga.application.engine;

import com.ryuqq.saga.core.contract.ActionReply;
import com.ryuqq.saga.core.contract.CompensationReply;
import com.ryuqq.saga.core.definition.SagaDefinition;
import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;

/**
 * 비동기 Saga 실행 엔진.
 *
 * <p>하나의 {@link SagaDefinition}에 대해 인스턴스를 시작하고, 명령 채널로 들어오는 응답을
 * 받아 상태를 전이시킵니다. 모든 전이는 영속화된 후에야 다음 명령을 디스패치합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SagaId sagaId = engine.start(Payload.of("order_id", "123"), "corr-1");
 *
 * // 다운스트림 서비스의 응답 수신 시
 * engine.handleActionReply(ActionReply.success(sagaId, 0, output, updates));
 *
 * // 장애 복구 시
 * engine.resume(sagaId);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SagaEngine {

    /**
     * 이 엔진이 실행하는 Saga 정의.
     *
     * @return Saga 정의
     */
    SagaDefinition definition();

    /**
     * 새 Saga ID 발급 ({@code saga-<definitionId>-<uuid>}).
     *
     * <p>응답 구독을 먼저 등록해야 하는 호출자가 ID를 미리 확보할 때 사용합니다.</p>
     *
     * @return 새 Saga ID
     */
    SagaId nextSagaId();

    /**
     * 새 ID로 Saga 시작.
     *
     * @param initialPayload 초기 공유 페이로드
     * @param correlationId 상관 ID (null 허용)
     * @return 시작된 Saga ID
     * @throws com.ryuqq.saga.core.exception.SagaPersistenceException 저장 실패 시
     */
    SagaId start(Payload initialPayload, String correlationId);

    /**
     * 지정한 ID로 Saga 시작.
     *
     * @param sagaId Saga ID
     * @param initialPayload 초기 공유 페이로드
     * @param correlationId 상관 ID (null 허용)
     * @return 시작된 Saga ID
     * @throws com.ryuqq.saga.core.exception.DuplicateSagaException 같은 ID가 이미 존재하는 경우
     */
    SagaId start(SagaId sagaId, Payload initialPayload, String correlationId);

    /**
     * Action 응답 처리.
     *
     * <p>현재 정방향 커서와 일치하지 않거나, 이미 종료된 Saga의 응답은 경고 로그만 남기고
     * 아무것도 저장하지 않습니다.</p>
     *
     * @param reply Action 응답
     * @return 응답이 수락되어 상태가 전이되었으면 true, 폐기되었으면 false
     * @throws com.ryuqq.saga.core.exception.SagaPersistenceException 저장 실패 시
     */
    boolean handleActionReply(ActionReply reply);

    /**
     * 보상 응답 처리.
     *
     * @param reply 보상 응답
     * @return 응답이 수락되었으면 true, 폐기되었으면 false
     * @throws com.ryuqq.saga.core.exception.SagaPersistenceException 저장 실패 시
     */
    boolean handleCompensationReply(CompensationReply reply);

    /**
     * 저장된 상태에서 Saga 재개.
     *
     * <p>응답을 기다리던 Attempt가 있으면 저장된 페이로드를 그대로 재디스패치합니다.
     * 종료된 Saga는 아무 것도 하지 않습니다.</p>
     *
     * @param sagaId Saga ID
     * @throws com.ryuqq.saga.core.exception.SagaNotFoundException 저장된 인스턴스가 없는 경우
     * @throws com.ryuqq.saga.core.exception.SagaDefinitionException 정의가 일치하지 않는 경우
     */
    void resume(SagaId sagaId);
}
