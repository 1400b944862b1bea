package com.ryuqq.saga.core.definition;

import com.ryuqq.saga.core.exception.SagaDefinitionException;
import com.ryuqq.saga.core.model.Payload;

/**
 * Saga 정의의 Step 하나 (정방향 Action + 보상).
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * // 비동기 모드
 * Step charge = Step.dispatch("charge_payment", "payments.charge", "payments.refund")
 *     .withActionPayload(shared -&gt; Payload.of("order_id", shared.get("order_id")));
 *
 * // 인라인 모드
 * Step reserve = Step.direct("reserve_inventory", inventory::reserve, inventory::release);
 * </pre>
 *
 * @param name Step 이름 (정의 내 고유)
 * @param invoker 호출 방식 (Direct 또는 Dispatch)
 * @param actionPayloadBuilder Action 페이로드 생성 전략 (null이면 공유 페이로드 복사)
 * @param compensationPayloadBuilder 보상 페이로드 생성 전략 (null이면 기본 형태)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Step(
    String name,
    StepInvoker invoker,
    ActionPayloadBuilder actionPayloadBuilder,
    CompensationPayloadBuilder compensationPayloadBuilder
) {

    /**
     * 기본 보상 페이로드의 Action 결과 키.
     */
    public static final String ACTION_RESULT_KEY = "action_result";

    /**
     * 기본 보상 페이로드의 공유 페이로드 키.
     */
    public static final String SHARED_PAYLOAD_KEY = "shared_payload";

    public Step {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        // payload builder는 null 허용 (기본 전략 사용)
    }

    /**
     * 디스패치 변형 Step 생성.
     *
     * @param name Step 이름
     * @param actionDestination 정방향 명령 목적지
     * @param compensationDestination 보상 명령 목적지
     * @return Step
     */
    public static Step dispatch(String name, String actionDestination, String compensationDestination) {
        return new Step(name, new StepInvoker.Dispatch(actionDestination, compensationDestination), null, null);
    }

    /**
     * 직접 호출 변형 Step 생성.
     *
     * @param name Step 이름
     * @param action 정방향 Action
     * @param compensation 보상
     * @return Step
     */
    public static Step direct(String name, StepAction action, StepCompensation compensation) {
        return new Step(name, new StepInvoker.Direct(action, compensation), null, null);
    }

    /**
     * Action 페이로드 전략만 변경한 새 Step.
     */
    public Step withActionPayload(ActionPayloadBuilder builder) {
        return new Step(name, invoker, builder, compensationPayloadBuilder);
    }

    /**
     * 보상 페이로드 전략만 변경한 새 Step.
     */
    public Step withCompensationPayload(CompensationPayloadBuilder builder) {
        return new Step(name, invoker, actionPayloadBuilder, builder);
    }

    /**
     * Action 요청 페이로드 생성.
     *
     * @param sharedPayload 현재 공유 페이로드
     * @return 요청 페이로드 (전략 미지정 시 공유 페이로드 그대로)
     */
    public Payload buildActionPayload(Payload sharedPayload) {
        Payload shared = sharedPayload == null ? Payload.empty() : sharedPayload;
        if (actionPayloadBuilder == null) {
            return shared;
        }
        Payload built = actionPayloadBuilder.build(shared);
        return built == null ? Payload.empty() : built;
    }

    /**
     * 보상 요청 페이로드 생성.
     *
     * @param actionResult 원본 Action 결과 (null 허용)
     * @param sharedPayload 현재 공유 페이로드
     * @return 보상 페이로드
     */
    public Payload buildCompensationPayload(Payload actionResult, Payload sharedPayload) {
        Payload result = actionResult == null ? Payload.empty() : actionResult;
        Payload shared = sharedPayload == null ? Payload.empty() : sharedPayload;
        if (compensationPayloadBuilder == null) {
            return Payload.of(ACTION_RESULT_KEY, result.asMap())
                .with(SHARED_PAYLOAD_KEY, shared.asMap());
        }
        Payload built = compensationPayloadBuilder.build(result, shared);
        return built == null ? Payload.empty() : built;
    }

    /**
     * 디스패치 변형으로 조회.
     *
     * @return Dispatch 변형
     * @throws SagaDefinitionException Direct 변형인 경우
     */
    public StepInvoker.Dispatch dispatchInvoker() {
        if (invoker instanceof StepInvoker.Dispatch dispatch) {
            return dispatch;
        }
        throw new SagaDefinitionException("Step '" + name + "' is not a dispatch step");
    }

    /**
     * 직접 호출 변형으로 조회.
     *
     * @return Direct 변형
     * @throws SagaDefinitionException Dispatch 변형인 경우
     */
    public StepInvoker.Direct directInvoker() {
        if (invoker instanceof StepInvoker.Direct direct) {
            return direct;
        }
        throw new SagaDefinitionException("Step '" + name + "' is not a direct step");
    }
}
