package com.ryuqq.saga.core.exception;

import com.ryuqq.saga.core.model.SagaId;

/**
 * Saga 처리 오류의 최상위 예외.
 *
 * <p>모든 Saga 예외는 unchecked이며, 알려진 경우 대상 Saga 인스턴스의 ID를 함께 전달합니다.</p>
 *
 * <p><strong>예외 분류:</strong></p>
 * <ul>
 *   <li>{@link SagaDefinitionException}: 정의 오류 (Step 이름 중복, 로그와 정의 불일치)</li>
 *   <li>{@link DuplicateSagaException}: 동일 ID 인스턴스가 이미 존재</li>
 *   <li>{@link SagaNotFoundException}: 인스턴스가 존재하지 않음</li>
 *   <li>{@link SagaExecutionException}: Action 실패 (보상으로 복구됨)</li>
 *   <li>{@link SagaCompensationException}: 보상 실패 (수동 조치 필요)</li>
 *   <li>{@link SagaPersistenceException}: 저장소 I/O 실패</li>
 *   <li>{@link SagaProtocolException}: 현재 커서와 맞지 않는 응답 (폐기 대상)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SagaException extends RuntimeException {

    private final SagaId sagaId;

    public SagaException(String message, SagaId sagaId) {
        super(message);
        this.sagaId = sagaId;
    }

    public SagaException(String message, SagaId sagaId, Throwable cause) {
        super(message, cause);
        this.sagaId = sagaId;
    }

    /**
     * 대상 Saga ID.
     *
     * @return Saga ID (알 수 없는 경우 null)
     */
    public SagaId getSagaId() {
        return sagaId;
    }
}
