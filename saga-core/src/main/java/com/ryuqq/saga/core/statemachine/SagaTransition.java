package com.ryuqq.saga.core.statemachine;

/**
 * 상태 전이 검증.
 *
 * <p>Saga 상태와 Attempt 상태의 전이가 허용된 규칙을 따르는지 검증합니다.</p>
 *
 * <p><strong>허용되는 Saga 전이:</strong></p>
 * <ul>
 *   <li>CREATED → RUNNING</li>
 *   <li>RUNNING → SUCCEEDED, COMPENSATING</li>
 *   <li>COMPENSATING → FAILED_ACTION, FAILED_COMPENSATION</li>
 * </ul>
 *
 * <p><strong>허용되는 Attempt 전이:</strong></p>
 * <ul>
 *   <li>PENDING → COMPLETED, FAILED</li>
 *   <li>COMPLETED, FAILED → PENDING_COMPENSATION</li>
 *   <li>PENDING_COMPENSATION → COMPENSATED, COMPENSATION_FAILED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SagaTransition {

    // Utility class - prevent instantiation
    private SagaTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Saga 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SagaStatus from, SagaStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        // 종료 상태에서는 어디로도 전이 불가
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case CREATED -> to == SagaStatus.RUNNING;
            case RUNNING -> to == SagaStatus.SUCCEEDED || to == SagaStatus.COMPENSATING;
            case COMPENSATING -> to == SagaStatus.FAILED_ACTION || to == SagaStatus.FAILED_COMPENSATION;
            case SUCCEEDED, FAILED_ACTION, FAILED_COMPENSATION -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid saga transition: %s → %s", from, to)
            );
        }
    }

    /**
     * Attempt 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(AttemptStatus from, AttemptStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case PENDING -> to == AttemptStatus.COMPLETED || to == AttemptStatus.FAILED;
            case COMPLETED, FAILED -> to == AttemptStatus.PENDING_COMPENSATION;
            case PENDING_COMPENSATION -> to == AttemptStatus.COMPENSATED || to == AttemptStatus.COMPENSATION_FAILED;
            case COMPENSATED, COMPENSATION_FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid attempt transition: %s → %s", from, to)
            );
        }
    }

    /**
     * Saga 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static SagaStatus transition(SagaStatus current, SagaStatus next) {
        validate(current, next);
        return next;
    }

    /**
     * Attempt 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static AttemptStatus transition(AttemptStatus current, AttemptStatus next) {
        validate(current, next);
        return next;
    }
}
