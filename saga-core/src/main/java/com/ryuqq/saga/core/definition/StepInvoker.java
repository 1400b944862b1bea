package com.ryuqq.saga.core.definition;

/**
 * Step 호출 방식.
 *
 * <p>두 가지 변형만 존재합니다 (sealed):</p>
 * <ul>
 *   <li>{@link Direct}: 인라인 모드. Action/보상을 같은 호출 스택에서 직접 실행하고 결과를 즉시 받음</li>
 *   <li>{@link Dispatch}: 비동기 모드. 명령을 목적지로 발행하고 즉시 반환하며,
 *       결과는 나중에 별도의 응답 처리 진입점으로 도착함</li>
 * </ul>
 *
 * <p>실행기는 자신이 처리할 수 있는 변형만 받아들이며, 다른 변형이 섞인 정의는
 * 생성 시점에 {@link com.ryuqq.saga.core.exception.SagaDefinitionException}으로 거부합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface StepInvoker {

    /**
     * 직접 호출 변형.
     *
     * @param action 정방향 Action
     * @param compensation 보상 (no-op도 명시적으로 지정)
     */
    record Direct(StepAction action, StepCompensation compensation) implements StepInvoker {

        public Direct {
            if (action == null) {
                throw new IllegalArgumentException("action cannot be null");
            }
            if (compensation == null) {
                throw new IllegalArgumentException("compensation cannot be null (use StepCompensation.noOp())");
            }
        }
    }

    /**
     * 디스패치 후 재개 변형.
     *
     * @param actionDestination 정방향 명령 목적지
     * @param compensationDestination 보상 명령 목적지
     */
    record Dispatch(String actionDestination, String compensationDestination) implements StepInvoker {

        public Dispatch {
            if (actionDestination == null || actionDestination.isBlank()) {
                throw new IllegalArgumentException("actionDestination cannot be null or blank");
            }
            if (compensationDestination == null || compensationDestination.isBlank()) {
                throw new IllegalArgumentException("compensationDestination cannot be null or blank");
            }
        }
    }
}
