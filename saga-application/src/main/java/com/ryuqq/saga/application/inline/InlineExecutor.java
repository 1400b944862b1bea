package com.ryuqq.saga.application.inline;

import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;

/**
 * 인라인(동기) Saga 실행기.
 *
 * <p>모든 Step을 직접 호출로 순서대로 실행합니다. 영속화와 재개는 없습니다.</p>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>Action 실패 후 보상이 모두 성공 → {@link com.ryuqq.saga.core.exception.SagaExecutionException}</li>
 *   <li>보상 중 하나 이상 실패 → {@link com.ryuqq.saga.core.exception.SagaCompensationException}
 *       (원래 Action 실패와 모든 보상 실패를 함께 보유)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface InlineExecutor {

    /**
     * 새 ID로 실행.
     *
     * @param initialPayload 초기 페이로드
     * @return 실행 결과
     */
    InlineResult execute(Payload initialPayload);

    /**
     * 지정한 ID로 실행.
     *
     * @param sagaId Saga ID
     * @param initialPayload 초기 페이로드
     * @return 실행 결과
     */
    InlineResult execute(SagaId sagaId, Payload initialPayload);
}
