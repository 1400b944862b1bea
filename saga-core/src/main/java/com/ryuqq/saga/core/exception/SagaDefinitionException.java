package com.ryuqq.saga.core.exception;

import com.ryuqq.saga.core.model.SagaId;

/**
 * Saga 정의 오류.
 *
 * <p>Step 이름 중복, 실행 모드와 맞지 않는 Step 변형, 또는 저장된 Attempt 로그가
 * 정의에 없는 Step을 참조하는 경우(정의/버전 불일치) 발생합니다.
 * 해당 인스턴스에는 치명적입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SagaDefinitionException extends SagaException {

    public SagaDefinitionException(String message) {
        super(message, null);
    }

    public SagaDefinitionException(String message, SagaId sagaId) {
        super(message, sagaId);
    }
}
