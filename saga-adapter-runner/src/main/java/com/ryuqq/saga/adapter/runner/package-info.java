/**
 * Runner Adapter Layer - Saga 엔진 구현체.
 *
 * <p>이 패키지는 application 레이어 인터페이스의 구체적인 구현체와 운영 컴포넌트를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.saga.adapter.runner.AsyncSagaEngine} - 영속화 기반 비동기 엔진</li>
 *   <li>{@link com.ryuqq.saga.adapter.runner.InlineSagaExecutor} - 직접 호출 기반 인라인 실행기</li>
 * </ul>
 *
 * <h2>운영 컴포넌트</h2>
 * <ul>
 *   <li>{@link com.ryuqq.saga.adapter.runner.SagaReaper} - 정체된 Saga 주기적 재개</li>
 *   <li>{@link com.ryuqq.saga.adapter.runner.ReplyRouter} - Saga별 응답 목적지 구독 관리</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (AsyncSagaEngine, InlineSagaExecutor)
 *   ↓ implements
 * application (SagaEngine, InlineExecutor)
 *   ↓ depends on
 * core (SagaDefinition, SagaInstance, contract, SagaTransition)
 *   ↓ depends on
 * core/spi (SagaStore, CommandChannel)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.saga.adapter.runner;
