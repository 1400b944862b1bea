package com.ryuqq.saga.adapter.runner;

/**
 * SagaReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms = 1분)</li>
 *   <li>staleThresholdMs: 응답 없이 이 시간 이상 갱신되지 않은 Saga를 재개 (기본 300000ms = 5분)</li>
 *   <li>batchSize: 한 번에 재개할 Saga 수 (기본 50)</li>
 * </ul>
 *
 * <p><strong>임계값 설정 가이드:</strong> 가장 느린 다운스트림 Step의 정상 응답 시간보다 충분히 커야
 * 합니다. 너무 작으면 정상 진행 중인 Step의 명령이 중복 디스패치됩니다 (소비자 측 중복 제거 필요).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param staleThresholdMs 정체 판단 임계값 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record SagaReaperConfig(
    long scanIntervalMs,
    long staleThresholdMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=60000ms (1분), staleThresholdMs=300000ms (5분), batchSize=50</p>
     */
    public SagaReaperConfig() {
        this(60000, 300000, 50);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SagaReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (staleThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "staleThresholdMs must be positive (current: " + staleThresholdMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public SagaReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new SagaReaperConfig(scanIntervalMs, staleThresholdMs, batchSize);
    }

    /**
     * staleThresholdMs만 변경한 새 인스턴스 생성.
     */
    public SagaReaperConfig withStaleThresholdMs(long staleThresholdMs) {
        return new SagaReaperConfig(scanIntervalMs, staleThresholdMs, batchSize);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public SagaReaperConfig withBatchSize(int batchSize) {
        return new SagaReaperConfig(scanIntervalMs, staleThresholdMs, batchSize);
    }
}
