package com.ryuqq.saga.core.contract;

import com.ryuqq.saga.core.model.SagaId;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 명령 메시지 헤더 키.
 *
 * <p>헤더는 다운스트림 소비자가 본문을 역직렬화하지 않고도
 * {@code (sagaId, stepIndex, phase)} 중복 제거 키를 얻을 수 있도록 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Headers {

    public static final String SAGA_ID = "saga-id";
    public static final String PHASE = "saga-phase";
    public static final String STEP_INDEX = "step-index";
    public static final String CORRELATION_ID = "correlation-id";

    // Utility class - prevent instantiation
    private Headers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 명령 헤더 생성.
     *
     * @param sagaId Saga ID
     * @param phase 단계
     * @param stepIndex Step 인덱스
     * @param correlationId 상관 ID (null이면 생략)
     * @return 수정 불가능한 헤더 맵
     */
    public static Map<String, String> forCommand(SagaId sagaId, Phase phase, int stepIndex, String correlationId) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(SAGA_ID, sagaId.getValue());
        headers.put(PHASE, phase.name());
        headers.put(STEP_INDEX, Integer.toString(stepIndex));
        if (correlationId != null) {
            headers.put(CORRELATION_ID, correlationId);
        }
        return Map.copyOf(headers);
    }
}
