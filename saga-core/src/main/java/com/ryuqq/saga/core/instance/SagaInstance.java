package com.ryuqq.saga.core.instance;

import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;
import com.ryuqq.saga.core.statemachine.AttemptStatus;
import com.ryuqq.saga.core.statemachine.SagaStatus;
import com.ryuqq.saga.core.statemachine.SagaTransition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Saga 인스턴스의 영속 상태.
 *
 * <p>저장소가 시스템 오브 레코드이며, 엔진은 응답 하나를 처리할 때마다 인스턴스를 다시 읽고
 * 새 인스턴스를 만들어 저장합니다. 이 record는 불변이며 모든 변경 메서드는 새 인스턴스를 반환합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>Attempt 로그는 추가 전용이며 i번째 항목은 i번째 Step에 대한 기록</li>
 *   <li>compensationCursor는 보상 중이 아니면 {@link #NOT_COMPENSATING}</li>
 *   <li>종료 상태 이후의 변경은 {@link IllegalStateException}으로 거부</li>
 * </ul>
 *
 * @param id Saga ID
 * @param definitionId 정의 ID (참조만)
 * @param forwardCursor 다음에 시도할 Step 인덱스
 * @param compensationCursor 현재 보상 중인 Attempt 인덱스 (또는 -1)
 * @param status Saga 상태
 * @param attempts Attempt 로그 (실행 순서)
 * @param sharedPayload 공유 페이로드
 * @param correlationId 호출자가 제공한 상관 ID (null 가능)
 * @param createdAt 생성 시각 (epoch millis)
 * @param updatedAt 마지막 변경 시각 (epoch millis)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SagaInstance(
    SagaId id,
    String definitionId,
    int forwardCursor,
    int compensationCursor,
    SagaStatus status,
    List<Attempt> attempts,
    Payload sharedPayload,
    String correlationId,
    long createdAt,
    long updatedAt
) {

    /**
     * 보상 중이 아님을 나타내는 커서 값.
     */
    public static final int NOT_COMPENSATING = -1;

    public SagaInstance {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (definitionId == null || definitionId.isBlank()) {
            throw new IllegalArgumentException("definitionId cannot be null or blank");
        }
        if (forwardCursor < 0) {
            throw new IllegalArgumentException("forwardCursor must be non-negative (current: " + forwardCursor + ")");
        }
        if (compensationCursor < NOT_COMPENSATING) {
            throw new IllegalArgumentException("compensationCursor must be >= -1 (current: " + compensationCursor + ")");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (attempts == null) {
            throw new IllegalArgumentException("attempts cannot be null");
        }
        if (sharedPayload == null) {
            throw new IllegalArgumentException("sharedPayload cannot be null");
        }
        if (createdAt < 0 || updatedAt < createdAt) {
            throw new IllegalArgumentException(
                "invalid timestamps (createdAt: " + createdAt + ", updatedAt: " + updatedAt + ")");
        }
        attempts = List.copyOf(attempts);
        // correlationId는 null 허용
    }

    /**
     * 신규 인스턴스 생성 (CREATED).
     *
     * @param id Saga ID
     * @param definitionId 정의 ID
     * @param initialPayload 초기 공유 페이로드 (null이면 빈 Payload)
     * @param correlationId 상관 ID (null 가능)
     * @param now 현재 시각 (epoch millis)
     * @return CREATED 인스턴스
     */
    public static SagaInstance create(SagaId id, String definitionId, Payload initialPayload,
                                      String correlationId, long now) {
        return new SagaInstance(id, definitionId, 0, NOT_COMPENSATING, SagaStatus.CREATED, List.of(),
            initialPayload == null ? Payload.empty() : initialPayload, correlationId, now, now);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * 인덱스로 Attempt 조회.
     *
     * @param index Attempt 인덱스
     * @return Attempt (없으면 empty)
     */
    public Optional<Attempt> attempt(int index) {
        if (index < 0 || index >= attempts.size()) {
            return Optional.empty();
        }
        return Optional.of(attempts.get(index));
    }

    /**
     * 마지막 Attempt 조회.
     *
     * @return 마지막 Attempt (로그가 비어있으면 empty)
     */
    public Optional<Attempt> lastAttempt() {
        return attempt(attempts.size() - 1);
    }

    /**
     * 보상 실패 기록이 하나라도 있는지 확인.
     *
     * @return COMPENSATION_FAILED Attempt가 있으면 true
     */
    public boolean hasCompensationFailure() {
        return attempts.stream().anyMatch(a -> a.status() == AttemptStatus.COMPENSATION_FAILED);
    }

    /**
     * 상태 전이 (검증 후).
     *
     * @param next 다음 상태
     * @param now 현재 시각
     * @return 새 인스턴스
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public SagaInstance transitionTo(SagaStatus next, long now) {
        SagaTransition.validate(status, next);
        return new SagaInstance(id, definitionId, forwardCursor, compensationCursor, next, attempts,
            sharedPayload, correlationId, createdAt, now);
    }

    /**
     * Attempt 추가 (forwardCursor 위치여야 함).
     *
     * @param attempt 추가할 Attempt
     * @param now 현재 시각
     * @return 새 인스턴스
     * @throws IllegalStateException 종료 상태이거나 로그 길이가 forwardCursor와 맞지 않는 경우
     */
    public SagaInstance appendAttempt(Attempt attempt, long now) {
        requireMutable();
        if (attempt == null) {
            throw new IllegalArgumentException("attempt cannot be null");
        }
        if (attempts.size() != forwardCursor) {
            throw new IllegalStateException(
                String.format("Cannot append attempt at %d: log already has %d entries", forwardCursor, attempts.size()));
        }
        List<Attempt> log = new ArrayList<>(attempts);
        log.add(attempt);
        return new SagaInstance(id, definitionId, forwardCursor, compensationCursor, status, log,
            sharedPayload, correlationId, createdAt, now);
    }

    /**
     * 기존 Attempt 항목의 상태 갱신.
     *
     * @param index Attempt 인덱스
     * @param updated 갱신된 Attempt (같은 Step이어야 함)
     * @param now 현재 시각
     * @return 새 인스턴스
     */
    public SagaInstance updateAttempt(int index, Attempt updated, long now) {
        requireMutable();
        if (updated == null) {
            throw new IllegalArgumentException("updated cannot be null");
        }
        if (index < 0 || index >= attempts.size()) {
            throw new IllegalArgumentException("attempt index out of range: " + index);
        }
        if (!attempts.get(index).stepName().equals(updated.stepName())) {
            throw new IllegalArgumentException(
                String.format("Attempt %d belongs to '%s', not '%s'", index, attempts.get(index).stepName(), updated.stepName()));
        }
        List<Attempt> log = new ArrayList<>(attempts);
        log.set(index, updated);
        return new SagaInstance(id, definitionId, forwardCursor, compensationCursor, status, log,
            sharedPayload, correlationId, createdAt, now);
    }

    /**
     * 정방향 전진: 공유 페이로드 병합 후 forwardCursor 증가.
     *
     * @param sharedUpdates 병합할 갱신값 (null 허용)
     * @param now 현재 시각
     * @return 새 인스턴스
     */
    public SagaInstance advance(Payload sharedUpdates, long now) {
        requireMutable();
        return new SagaInstance(id, definitionId, forwardCursor + 1, compensationCursor, status, attempts,
            sharedPayload.merge(sharedUpdates), correlationId, createdAt, now);
    }

    /**
     * 보상 커서 이동.
     *
     * @param cursor 새 커서 (-1 이상)
     * @param now 현재 시각
     * @return 새 인스턴스
     */
    public SagaInstance moveCompensationCursor(int cursor, long now) {
        requireMutable();
        return new SagaInstance(id, definitionId, forwardCursor, cursor, status, attempts,
            sharedPayload, correlationId, createdAt, now);
    }

    private void requireMutable() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Saga " + id.getValue() + " is terminal (" + status + ") and cannot be mutated");
        }
    }
}
