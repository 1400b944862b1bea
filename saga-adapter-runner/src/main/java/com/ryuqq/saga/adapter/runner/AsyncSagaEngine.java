package com.ryuqq.saga.adapter.runner;

import com.ryuqq.saga.application.engine.SagaEngine;
import com.ryuqq.saga.core.contract.ActionReply;
import com.ryuqq.saga.core.contract.CompensationReply;
import com.ryuqq.saga.core.contract.Destinations;
import com.ryuqq.saga.core.contract.Headers;
import com.ryuqq.saga.core.contract.Phase;
import com.ryuqq.saga.core.contract.SagaCompletedEvent;
import com.ryuqq.saga.core.contract.SagaFailedEvent;
import com.ryuqq.saga.core.contract.StepCommand;
import com.ryuqq.saga.core.definition.SagaDefinition;
import com.ryuqq.saga.core.definition.Step;
import com.ryuqq.saga.core.exception.DuplicateSagaException;
import com.ryuqq.saga.core.exception.SagaNotFoundException;
import com.ryuqq.saga.core.exception.SagaProtocolException;
import com.ryuqq.saga.core.instance.Attempt;
import com.ryuqq.saga.core.instance.SagaInstance;
import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;
import com.ryuqq.saga.core.spi.CommandChannel;
import com.ryuqq.saga.core.spi.SagaStore;
import com.ryuqq.saga.core.statemachine.AttemptStatus;
import com.ryuqq.saga.core.statemachine.SagaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * 비동기 Saga 엔진 구현체.
 *
 * <p>명령을 디스패치한 뒤 응답을 기다리지 않고 반환하며, 응답이 도착하면
 * {@link #handleActionReply(ActionReply)} / {@link #handleCompensationReply(CompensationReply)}로
 * 상태를 전이시킵니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * start        → RUNNING, Attempt 0 PENDING, 저장 → Step 0 Action 디스패치
 * Action 성공  → Attempt COMPLETED, 공유 페이로드 병합, cursor++
 *                ├ 마지막 Step: SUCCEEDED, 저장 → completed 이벤트
 *                └ 그 외: 다음 Attempt PENDING, 저장 → 다음 Action 디스패치
 * Action 실패  → Attempt FAILED, COMPENSATING, 저장 → 보상 walk
 * 보상 walk    → cursor부터 역방향으로 보상 대상 탐색
 *                ├ 대상 없음: FAILED_ACTION 또는 FAILED_COMPENSATION, 저장 → failed 이벤트
 *                └ 대상 있음: PENDING_COMPENSATION, 저장 → 보상 디스패치
 * 보상 성공    → COMPENSATED, cursor--, 보상 walk 반복
 * 보상 실패    → COMPENSATION_FAILED
 *                ├ HALT_ON_FAILURE: FAILED_COMPENSATION, 저장 → failed 이벤트
 *                └ CONTINUE_ON_FAILURE: cursor--, 보상 walk 반복
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>모든 디스패치는 해당 전이가 저장된 이후에만 발생 (디스패치가 항상 마지막 동작)</li>
 *   <li>같은 Saga에 대한 처리는 {@link SagaLocks}로 직렬화</li>
 *   <li>현재 단계/커서와 맞지 않는 응답은 경고 로그 후 폐기, 아무것도 저장하지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SagaDefinition definition = SagaDefinition.builder("order")
 *     .step("charge_payment", "payments.charge", "payments.refund")
 *     .step("reserve_inventory", "inventory.reserve", "inventory.release")
 *     .build();
 *
 * SagaEngine engine = new AsyncSagaEngine(definition, store, channel);
 * ReplyRouter router = new ReplyRouter(engine, channel);
 * SagaId sagaId = router.start(Payload.of("order_id", "123"), "corr-1");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AsyncSagaEngine implements SagaEngine {

    private static final Logger log = LoggerFactory.getLogger(AsyncSagaEngine.class);

    private static final String UNKNOWN_ERROR = "unknown error";

    private final SagaDefinition definition;
    private final SagaStore store;
    private final CommandChannel channel;
    private final SagaEngineConfig config;
    private final Clock clock;
    private final SagaLocks locks;

    /**
     * 기본 설정으로 생성.
     *
     * @param definition Saga 정의 (모든 Step이 dispatch 모드여야 함)
     * @param store 저장소
     * @param channel 명령 채널
     */
    public AsyncSagaEngine(SagaDefinition definition, SagaStore store, CommandChannel channel) {
        this(definition, store, channel, new SagaEngineConfig());
    }

    /**
     * 설정 지정 생성자.
     *
     * @param definition Saga 정의
     * @param store 저장소
     * @param channel 명령 채널
     * @param config 엔진 설정
     */
    public AsyncSagaEngine(SagaDefinition definition, SagaStore store, CommandChannel channel,
                           SagaEngineConfig config) {
        this(definition, store, channel, config, Clock.systemUTC());
    }

    /**
     * 전체 생성자.
     *
     * @param definition Saga 정의
     * @param store 저장소
     * @param channel 명령 채널
     * @param config 엔진 설정
     * @param clock 타임스탬프용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     * @throws com.ryuqq.saga.core.exception.SagaDefinitionException dispatch 모드가 아닌 Step이 있는 경우
     */
    public AsyncSagaEngine(SagaDefinition definition, SagaStore store, CommandChannel channel,
                           SagaEngineConfig config, Clock clock) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        definition.requireDispatchSteps();
        this.definition = definition;
        this.store = store;
        this.channel = channel;
        this.config = config;
        this.clock = clock;
        this.locks = new SagaLocks();
    }

    @Override
    public SagaDefinition definition() {
        return definition;
    }

    @Override
    public SagaId nextSagaId() {
        return SagaId.generate(definition.getId());
    }

    @Override
    public SagaId start(Payload initialPayload, String correlationId) {
        return start(nextSagaId(), initialPayload, correlationId);
    }

    @Override
    public SagaId start(SagaId sagaId, Payload initialPayload, String correlationId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        return locks.withLock(sagaId, () -> {
            if (store.load(sagaId).isPresent()) {
                throw new DuplicateSagaException(sagaId);
            }
            long now = clock.millis();
            SagaInstance instance = SagaInstance
                .create(sagaId, definition.getId(), initialPayload, correlationId, now)
                .transitionTo(SagaStatus.RUNNING, now);
            log.info("Saga {} started (definition: {}, steps: {}, correlationId: {})",
                sagaId.getValue(), definition.getId(), definition.size(), correlationId);
            dispatchAction(instance);
            return sagaId;
        });
    }

    @Override
    public boolean handleActionReply(ActionReply reply) {
        if (reply == null) {
            throw new IllegalArgumentException("reply cannot be null");
        }
        return locks.withLock(reply.sagaId(), () -> {
            try {
                SagaInstance instance = loadForReply(reply.sagaId());
                checkActionReply(instance, reply);
                applyActionReply(instance, reply);
                return true;
            } catch (SagaProtocolException e) {
                log.warn("Discarding action reply for saga {} (stepIndex: {}): {}",
                    reply.sagaId().getValue(), reply.stepIndex(), e.getMessage());
                return false;
            }
        });
    }

    @Override
    public boolean handleCompensationReply(CompensationReply reply) {
        if (reply == null) {
            throw new IllegalArgumentException("reply cannot be null");
        }
        return locks.withLock(reply.sagaId(), () -> {
            try {
                SagaInstance instance = loadForReply(reply.sagaId());
                checkCompensationReply(instance, reply);
                applyCompensationReply(instance, reply);
                return true;
            } catch (SagaProtocolException e) {
                log.warn("Discarding compensation reply for saga {} (stepIndex: {}): {}",
                    reply.sagaId().getValue(), reply.stepIndexToCompensate(), e.getMessage());
                return false;
            }
        });
    }

    @Override
    public void resume(SagaId sagaId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        locks.withLock(sagaId, () -> {
            SagaInstance instance = store.load(sagaId).orElseThrow(() -> new SagaNotFoundException(sagaId));
            definition.verify(instance);

            if (instance.isTerminal()) {
                log.warn("Resume skipped: saga {} is already {}", sagaId.getValue(), instance.status());
                return;
            }

            log.info("Resuming saga {} in {} (forwardCursor: {}, compensationCursor: {})",
                sagaId.getValue(), instance.status(), instance.forwardCursor(), instance.compensationCursor());

            switch (instance.status()) {
                case CREATED -> dispatchAction(instance.transitionTo(SagaStatus.RUNNING, clock.millis()));
                case RUNNING -> resumeForward(instance);
                case COMPENSATING -> resumeCompensation(instance);
                default -> throw new IllegalStateException("Unexpected non-terminal status: " + instance.status());
            }
        });
    }

    // ============================================================
    // Action phase
    // ============================================================

    /**
     * 현재 커서의 Action을 PENDING으로 기록, 저장 후 디스패치.
     */
    private void dispatchAction(SagaInstance instance) {
        int index = instance.forwardCursor();
        Step step = definition.step(index);
        Payload request = step.buildActionPayload(instance.sharedPayload());

        SagaInstance pending = instance.appendAttempt(Attempt.pending(step.name(), request), clock.millis());
        store.save(pending);

        publishCommand(pending, index, step, Phase.ACTION, request);
    }

    private void checkActionReply(SagaInstance instance, ActionReply reply) {
        if (instance.isTerminal()) {
            throw new SagaProtocolException("saga is already " + instance.status(), instance.id());
        }
        if (instance.status() != SagaStatus.RUNNING) {
            throw new SagaProtocolException("saga is " + instance.status() + ", not awaiting an action reply",
                instance.id());
        }
        if (reply.stepIndex() != instance.forwardCursor()) {
            throw new SagaProtocolException(
                "stale step index (expected: " + instance.forwardCursor() + ")", instance.id());
        }
        Optional<Attempt> attempt = instance.attempt(reply.stepIndex());
        if (attempt.isEmpty() || attempt.get().status() != AttemptStatus.PENDING) {
            throw new SagaProtocolException("no pending action at step index " + reply.stepIndex(), instance.id());
        }
    }

    private void applyActionReply(SagaInstance instance, ActionReply reply) {
        int index = reply.stepIndex();
        Attempt attempt = instance.attempts().get(index);
        long now = clock.millis();

        if (reply.success()) {
            SagaInstance advanced = instance
                .updateAttempt(index, attempt.complete(reply.output()), now)
                .advance(reply.updatedSharedPayload(), now);
            log.info("Saga {} step {} '{}' completed", instance.id().getValue(), index, attempt.stepName());

            if (advanced.forwardCursor() >= definition.size()) {
                complete(advanced);
            } else {
                dispatchAction(advanced);
            }
            return;
        }

        String error = reply.error() == null ? UNKNOWN_ERROR : reply.error();
        log.error("Saga {} step {} '{}' failed: {}", instance.id().getValue(), index, attempt.stepName(), error);

        SagaInstance compensating = instance
            .updateAttempt(index, attempt.fail(error), now)
            .transitionTo(SagaStatus.COMPENSATING, now)
            .moveCompensationCursor(index, now);
        store.save(compensating);

        continueCompensation(compensating);
    }

    private void complete(SagaInstance instance) {
        SagaInstance succeeded = instance.transitionTo(SagaStatus.SUCCEEDED, clock.millis());
        store.save(succeeded);
        log.info("Saga {} succeeded", succeeded.id().getValue());
        channel.publish(Destinations.completed(succeeded.id()),
            new SagaCompletedEvent(succeeded.id(), succeeded.sharedPayload()));
    }

    private void resumeForward(SagaInstance instance) {
        Optional<Attempt> current = instance.attempt(instance.forwardCursor());
        if (current.isPresent() && current.get().status() == AttemptStatus.PENDING) {
            // 저장된 요청을 그대로 재전송 (빌더 재실행 없음)
            Step step = definition.step(instance.forwardCursor());
            publishCommand(instance, instance.forwardCursor(), step, Phase.ACTION, current.get().requestPayload());
            return;
        }
        dispatchAction(instance);
    }

    // ============================================================
    // Compensation phase
    // ============================================================

    /**
     * 보상 커서부터 역방향으로 다음 보상 대상을 찾아 디스패치하거나, 없으면 종료.
     */
    private void continueCompensation(SagaInstance instance) {
        int target = findCompensable(instance, instance.compensationCursor());
        long now = clock.millis();

        if (target < 0) {
            SagaStatus terminal = instance.hasCompensationFailure()
                ? SagaStatus.FAILED_COMPENSATION
                : SagaStatus.FAILED_ACTION;
            SagaInstance finished = instance
                .moveCompensationCursor(SagaInstance.NOT_COMPENSATING, now)
                .transitionTo(terminal, now);
            fail(finished, failureReason(finished));
            return;
        }

        Attempt attempt = instance.attempts().get(target);
        Step step = definition.step(target);
        Payload compensationPayload = step.buildCompensationPayload(attempt.result(), instance.sharedPayload());

        SagaInstance pending = instance
            .moveCompensationCursor(target, now)
            .updateAttempt(target, attempt.awaitCompensation(compensationPayload), now);
        store.save(pending);

        publishCommand(pending, target, step, Phase.COMPENSATION, compensationPayload);
    }

    private int findCompensable(SagaInstance instance, int from) {
        for (int i = Math.min(from, instance.attempts().size() - 1); i >= 0; i--) {
            AttemptStatus status = instance.attempts().get(i).status();
            if (status == AttemptStatus.COMPLETED) {
                return i;
            }
            if (status == AttemptStatus.FAILED && config.compensateFailedStep()) {
                return i;
            }
        }
        return -1;
    }

    private void checkCompensationReply(SagaInstance instance, CompensationReply reply) {
        if (instance.isTerminal()) {
            throw new SagaProtocolException("saga is already " + instance.status(), instance.id());
        }
        if (instance.status() != SagaStatus.COMPENSATING) {
            throw new SagaProtocolException("saga is " + instance.status() + ", not compensating", instance.id());
        }
        if (reply.stepIndexToCompensate() != instance.compensationCursor()) {
            throw new SagaProtocolException(
                "stale step index (expected: " + instance.compensationCursor() + ")", instance.id());
        }
        Optional<Attempt> attempt = instance.attempt(reply.stepIndexToCompensate());
        if (attempt.isEmpty() || attempt.get().status() != AttemptStatus.PENDING_COMPENSATION) {
            throw new SagaProtocolException(
                "no pending compensation at step index " + reply.stepIndexToCompensate(), instance.id());
        }
    }

    private void applyCompensationReply(SagaInstance instance, CompensationReply reply) {
        int index = reply.stepIndexToCompensate();
        Attempt attempt = instance.attempts().get(index);
        long now = clock.millis();

        if (reply.success()) {
            SagaInstance compensated = instance
                .updateAttempt(index, attempt.compensate(), now)
                .moveCompensationCursor(index - 1, now);
            log.info("Saga {} step {} '{}' compensated", instance.id().getValue(), index, attempt.stepName());
            continueCompensation(compensated);
            return;
        }

        String error = reply.error() == null ? UNKNOWN_ERROR : reply.error();
        log.error("Saga {} compensation of step {} '{}' failed: {}",
            instance.id().getValue(), index, attempt.stepName(), error);

        SagaInstance failed = instance.updateAttempt(index, attempt.failCompensation(error), now);

        if (config.compensationPolicy() == CompensationPolicy.HALT_ON_FAILURE) {
            SagaInstance halted = failed.transitionTo(SagaStatus.FAILED_COMPENSATION, now);
            fail(halted, "Compensation of step '" + attempt.stepName() + "' failed: " + error);
            return;
        }
        continueCompensation(failed.moveCompensationCursor(index - 1, now));
    }

    private void resumeCompensation(SagaInstance instance) {
        Optional<Attempt> current = instance.attempt(instance.compensationCursor());
        if (current.isPresent() && current.get().status() == AttemptStatus.PENDING_COMPENSATION) {
            Step step = definition.step(instance.compensationCursor());
            publishCommand(instance, instance.compensationCursor(), step, Phase.COMPENSATION,
                current.get().compensationPayload());
            return;
        }
        continueCompensation(instance);
    }

    private void fail(SagaInstance terminal, String reason) {
        store.save(terminal);
        log.error("Saga {} ended in {}: {}", terminal.id().getValue(), terminal.status(), reason);
        channel.publish(Destinations.failed(terminal.id()), new SagaFailedEvent(terminal.id(), reason));
    }

    private String failureReason(SagaInstance instance) {
        for (int i = instance.attempts().size() - 1; i >= 0; i--) {
            Attempt attempt = instance.attempts().get(i);
            if (attempt.status() == AttemptStatus.COMPENSATION_FAILED) {
                return "Compensation of step '" + attempt.stepName() + "' failed: " + attempt.compensationError();
            }
        }
        Attempt failedAttempt = instance.attempts().get(instance.forwardCursor());
        String error = failedAttempt.error() == null ? UNKNOWN_ERROR : failedAttempt.error();
        return "Step '" + failedAttempt.stepName() + "' failed: " + error;
    }

    // ============================================================
    // Shared
    // ============================================================

    private SagaInstance loadForReply(SagaId sagaId) {
        SagaInstance instance = store.load(sagaId)
            .orElseThrow(() -> new SagaProtocolException("unknown saga", sagaId));
        definition.verify(instance);
        return instance;
    }

    private void publishCommand(SagaInstance instance, int index, Step step, Phase phase, Payload payload) {
        SagaId sagaId = instance.id();
        String destination = phase == Phase.ACTION
            ? step.dispatchInvoker().actionDestination()
            : step.dispatchInvoker().compensationDestination();
        StepCommand command = new StepCommand(sagaId, index, step.name(), payload,
            Destinations.replyFor(sagaId, phase), instance.correlationId());

        log.info("Saga {} dispatching {} for step {} '{}' to {}",
            sagaId.getValue(), phase, index, step.name(), destination);
        channel.publish(destination, command, Headers.forCommand(sagaId, phase, index, instance.correlationId()));
    }
}
