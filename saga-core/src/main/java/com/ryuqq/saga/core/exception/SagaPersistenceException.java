package com.ryuqq.saga.core.exception;

import com.ryuqq.saga.core.model.SagaId;

/**
 * 저장소 I/O 실패.
 *
 * <p>발생 시 현재 응답 처리는 즉시 중단되며, 저장에 성공하지 못한 전이는 적용된 것으로 보지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SagaPersistenceException extends SagaException {

    public SagaPersistenceException(String message, SagaId sagaId, Throwable cause) {
        super(message, sagaId, cause);
    }
}
