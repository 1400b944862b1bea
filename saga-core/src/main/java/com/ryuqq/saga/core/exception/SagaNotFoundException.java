package com.ryuqq.saga.core.exception;

import com.ryuqq.saga.core.model.SagaId;

/**
 * 저장소에 존재하지 않는 Saga를 재개하려는 경우 발생.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SagaNotFoundException extends SagaException {

    public SagaNotFoundException(SagaId sagaId) {
        super("Saga not found: " + sagaId.getValue(), sagaId);
    }
}
