package com.ryuqq.saga.adapter.runner;

/**
 * 비동기 Saga 엔진 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>compensationPolicy: 보상 실패 시 동작 (기본 HALT_ON_FAILURE)</li>
 *   <li>compensateFailedStep: 실패한 Step 자신도 보상할지 여부 (기본 true)</li>
 * </ul>
 *
 * <p><strong>compensateFailedStep:</strong> Action이 실패를 응답하기 전에 부분적인 부수효과를
 * 남겼을 수 있으므로, 기본적으로 실패한 Step의 보상을 먼저 디스패치한 뒤 이전 Step들을 롤백합니다.
 * 다운스트림이 실패 시 스스로 정리하는 경우 false로 설정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param compensationPolicy 보상 실패 정책 (null이 아니어야 함)
 * @param compensateFailedStep 실패한 Step 보상 여부
 */
public record SagaEngineConfig(
    CompensationPolicy compensationPolicy,
    boolean compensateFailedStep
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: compensationPolicy=HALT_ON_FAILURE, compensateFailedStep=true</p>
     */
    public SagaEngineConfig() {
        this(CompensationPolicy.HALT_ON_FAILURE, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SagaEngineConfig {
        if (compensationPolicy == null) {
            throw new IllegalArgumentException("compensationPolicy cannot be null");
        }
    }

    /**
     * compensationPolicy만 변경한 새 인스턴스 생성.
     */
    public SagaEngineConfig withCompensationPolicy(CompensationPolicy compensationPolicy) {
        return new SagaEngineConfig(compensationPolicy, compensateFailedStep);
    }

    /**
     * compensateFailedStep만 변경한 새 인스턴스 생성.
     */
    public SagaEngineConfig withCompensateFailedStep(boolean compensateFailedStep) {
        return new SagaEngineConfig(compensationPolicy, compensateFailedStep);
    }
}
