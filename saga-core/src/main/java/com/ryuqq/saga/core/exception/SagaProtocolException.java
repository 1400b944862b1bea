package com.ryuqq.saga.core.exception;

import com.ryuqq.saga.core.model.SagaId;

/**
 * 인스턴스의 현재 단계/커서와 일치하지 않는 응답.
 *
 * <p>치명적이지 않습니다. 중복 또는 지연 재전달(at-least-once)의 결과이며,
 * 엔진은 경고 로그를 남기고 응답을 폐기합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SagaProtocolException extends SagaException {

    public SagaProtocolException(String message, SagaId sagaId) {
        super(message, sagaId);
    }
}
