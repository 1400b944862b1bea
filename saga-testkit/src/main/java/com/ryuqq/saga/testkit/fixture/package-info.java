/**
 * 테스트 픽스처 패키지.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.saga.testkit.fixture;
