package com.ryuqq.saga.core.exception;

import com.ryuqq.saga.core.model.SagaId;

/**
 * 동일한 ID의 Saga 인스턴스가 이미 저장소에 존재하는 경우 start()에서 발생.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DuplicateSagaException extends SagaException {

    public DuplicateSagaException(SagaId sagaId) {
        super("Saga already exists: " + sagaId.getValue(), sagaId);
    }
}
