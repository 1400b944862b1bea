package com.ryuqq.saga.adapter.runner;

import com.ryuqq.saga.application.engine.SagaEngine;
import com.ryuqq.saga.core.model.SagaId;
import com.ryuqq.saga.core.spi.SagaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 정체된 Saga 재개 컴포넌트.
 *
 * <p>엔진에는 자체 타임아웃이 없으므로, 응답이 유실되어 멈춘 Saga는 이 컴포넌트가
 * 주기적으로 찾아 {@link SagaEngine#resume(SagaId)}를 호출해 복구합니다.</p>
 *
 * <p><strong>재개 시나리오:</strong></p>
 * <pre>
 * 1. 엔진이 Step 명령 디스패치 → RUNNING, Attempt PENDING 저장
 * 2. 다운스트림 장애/메시지 유실 → 응답 없음
 * 3. SagaReaper 주기적 스캔 (예: 1분마다)
 * 4. staleThreshold 이상 갱신되지 않은 비종료 Saga 발견 (예: 5분 이상)
 * 5. resume(sagaId) → 저장된 요청 페이로드 그대로 재디스패치
 * </pre>
 *
 * <p><strong>멱등성:</strong></p>
 * <ul>
 *   <li>재디스패치는 상태를 바꾸지 않으므로 응답이 올 때까지 매 스캔마다 반복될 수 있음</li>
 *   <li>다운스트림은 (saga-id, step-index, saga-phase) 헤더로 중복을 제거해야 함</li>
 *   <li>개별 Saga 재개 실패는 로그만 남기고 다음 Saga를 계속 처리</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SagaReaper {

    private static final Logger log = LoggerFactory.getLogger(SagaReaper.class);

    private final SagaEngine engine;
    private final SagaStore store;
    private final SagaReaperConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param engine Saga 엔진
     * @param store 저장소
     * @param config 설정
     */
    public SagaReaper(SagaEngine engine, SagaStore store, SagaReaperConfig config) {
        this(engine, store, config, Clock.systemUTC());
    }

    /**
     * 시계 지정 생성자.
     *
     * @param engine Saga 엔진
     * @param store 저장소
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SagaReaper(SagaEngine engine, SagaStore store, SagaReaperConfig config, Clock clock) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.engine = engine;
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 정체된 Saga 스캔 및 재개.
     *
     * <p><strong>처리 흐름:</strong></p>
     * <pre>
     * 1. scanStale(now - staleThreshold, batchSize) → [SagaId1, SagaId2, ...]
     * 2. For each SagaId: engine.resume(sagaId)
     * 3. 성공/실패 카운트 로깅
     * </pre>
     *
     * @return 재개에 성공한 Saga 수
     */
    public int scan() {
        long updatedBefore = clock.millis() - config.staleThresholdMs();
        List<SagaId> stale = store.scanStale(updatedBefore, config.batchSize());

        int resumed = 0;
        for (SagaId sagaId : stale) {
            if (tryResume(sagaId)) {
                resumed++;
            }
        }

        if (!stale.isEmpty()) {
            log.info("Saga reaper scan completed: {} resumed out of {} stale", resumed, stale.size());
        }
        return resumed;
    }

    /**
     * 고정 지연으로 주기적 스캔 등록.
     *
     * <p>스캔 중 예외가 발생해도 스케줄이 취소되지 않도록 예외는 로그로 남깁니다.</p>
     *
     * @param scheduler 스케줄러
     * @return 스케줄 핸들 (취소용)
     */
    public ScheduledFuture<?> schedule(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        long interval = config.scanIntervalMs();
        return scheduler.scheduleWithFixedDelay(this::scanSafely, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void scanSafely() {
        try {
            scan();
        } catch (RuntimeException e) {
            log.error("Saga reaper scan failed", e);
        }
    }

    private boolean tryResume(SagaId sagaId) {
        try {
            engine.resume(sagaId);
            return true;
        } catch (Exception e) {
            log.error("Failed to resume saga {} in reaper scan", sagaId.getValue(), e);
            return false;
        }
    }
}
