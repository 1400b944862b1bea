package com.ryuqq.saga.application.inline;

import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 인라인 실행 성공 결과.
 *
 * @param sagaId Saga ID
 * @param results Step 이름별 Action 결과 (실행 순서 유지)
 * @param sharedPayload 최종 공유 페이로드
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InlineResult(SagaId sagaId, Map<String, Payload> results, Payload sharedPayload) {

    public InlineResult {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        if (sharedPayload == null) {
            throw new IllegalArgumentException("sharedPayload cannot be null");
        }
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /**
     * Step 결과 조회.
     *
     * @param stepName Step 이름
     * @return Action 결과 (없으면 null)
     */
    public Payload result(String stepName) {
        return results.get(stepName);
    }
}
