/**
 * Saga Application Layer - 인라인 실행 API.
 *
 * <p>단일 프로세스에서 직접 호출 가능한 Step들을 동기적으로 실행하고,
 * 실패 시 완료된 Step을 역순으로 보상합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.saga.application.inline;
