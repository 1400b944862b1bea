/**
 * Saga Application Layer - 비동기 Saga 엔진 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.saga.application.engine.SagaEngine} - 시작, 응답 처리, 재개</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 saga-adapter-runner 모듈에 위치</li>
 *   <li><strong>영속화 우선:</strong> 모든 전이는 저장 후 디스패치</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.saga.application.engine;
