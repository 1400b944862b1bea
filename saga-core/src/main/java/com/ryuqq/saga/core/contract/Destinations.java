package com.ryuqq.saga.core.contract;

import com.ryuqq.saga.core.model.SagaId;

/**
 * 응답 및 생명주기 이벤트 목적지 이름 규칙.
 *
 * <ul>
 *   <li>Action 응답: {@code saga.<id>.action_result}</li>
 *   <li>보상 응답: {@code saga.<id>.compensation_result}</li>
 *   <li>성공 이벤트: {@code saga_events.<id>.completed}</li>
 *   <li>실패 이벤트: {@code saga_events.<id>.failed}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Destinations {

    // Utility class - prevent instantiation
    private Destinations() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String actionResult(SagaId sagaId) {
        return "saga." + requireId(sagaId) + ".action_result";
    }

    public static String compensationResult(SagaId sagaId) {
        return "saga." + requireId(sagaId) + ".compensation_result";
    }

    public static String completed(SagaId sagaId) {
        return "saga_events." + requireId(sagaId) + ".completed";
    }

    public static String failed(SagaId sagaId) {
        return "saga_events." + requireId(sagaId) + ".failed";
    }

    /**
     * 단계에 맞는 응답 목적지.
     *
     * @param sagaId Saga ID
     * @param phase 명령 단계
     * @return 응답 목적지
     */
    public static String replyFor(SagaId sagaId, Phase phase) {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        return phase == Phase.ACTION ? actionResult(sagaId) : compensationResult(sagaId);
    }

    private static String requireId(SagaId sagaId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        return sagaId.getValue();
    }
}
