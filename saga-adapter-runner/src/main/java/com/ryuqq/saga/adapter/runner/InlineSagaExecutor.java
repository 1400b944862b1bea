package com.ryuqq.saga.adapter.runner;

import com.ryuqq.saga.application.inline.InlineExecutor;
import com.ryuqq.saga.application.inline.InlineResult;
import com.ryuqq.saga.core.definition.SagaDefinition;
import com.ryuqq.saga.core.definition.Step;
import com.ryuqq.saga.core.exception.SagaCompensationException;
import com.ryuqq.saga.core.exception.SagaCompensationException.CompensationFailure;
import com.ryuqq.saga.core.exception.SagaException;
import com.ryuqq.saga.core.exception.SagaExecutionException;
import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 인라인 Saga 실행기.
 *
 * <p>모든 Step을 호출 스레드에서 순서대로 직접 호출합니다. 각 Action의 결과는 공유 페이로드에
 * 병합되어 다음 Step의 요청 페이로드를 만드는 데 쓰입니다 (비동기 모드의
 * {@code updatedSharedPayload}에 해당). 성공한 Step은 {@code (step, result)}로 스택에 쌓이고, Action이 실패하면 스택을 역순으로 꺼내며
 * 각 Step의 보상을 해당 Step 자신의 결과로 호출합니다.</p>
 *
 * <p><strong>실패 결과:</strong></p>
 * <ul>
 *   <li>보상 전부 성공 → {@link SagaExecutionException} (cause: 원래 Action 예외)</li>
 *   <li>보상 실패 존재 → {@link SagaCompensationException} (cause: 원래 Action 예외,
 *       보상 실패 목록 + suppressed)</li>
 * </ul>
 *
 * <p>기본 정책은 {@link CompensationPolicy#CONTINUE_ON_FAILURE}로, 보상 하나가 실패해도
 * 나머지 보상을 모두 시도합니다. 영속화와 재개는 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InlineSagaExecutor implements InlineExecutor {

    private static final Logger log = LoggerFactory.getLogger(InlineSagaExecutor.class);

    private final SagaDefinition definition;
    private final CompensationPolicy compensationPolicy;

    /**
     * 기본 정책(CONTINUE_ON_FAILURE)으로 생성.
     *
     * @param definition Saga 정의 (모든 Step이 direct 모드여야 함)
     */
    public InlineSagaExecutor(SagaDefinition definition) {
        this(definition, CompensationPolicy.CONTINUE_ON_FAILURE);
    }

    /**
     * 생성자.
     *
     * @param definition Saga 정의 (모든 Step이 direct 모드여야 함)
     * @param compensationPolicy 보상 실패 정책
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws com.ryuqq.saga.core.exception.SagaDefinitionException direct 모드가 아닌 Step이 있는 경우
     */
    public InlineSagaExecutor(SagaDefinition definition, CompensationPolicy compensationPolicy) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (compensationPolicy == null) {
            throw new IllegalArgumentException("compensationPolicy cannot be null");
        }
        definition.requireDirectSteps();
        this.definition = definition;
        this.compensationPolicy = compensationPolicy;
    }

    @Override
    public InlineResult execute(Payload initialPayload) {
        return execute(SagaId.generate(definition.getId()), initialPayload);
    }

    @Override
    public InlineResult execute(SagaId sagaId, Payload initialPayload) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        Payload shared = initialPayload == null ? Payload.empty() : initialPayload;
        Deque<CompletedStep> completed = new ArrayDeque<>();
        Map<String, Payload> results = new LinkedHashMap<>();

        for (int i = 0; i < definition.size(); i++) {
            Step step = definition.step(i);
            Payload request = step.buildActionPayload(shared);
            log.info("Saga {}: executing step '{}' ({}/{})", sagaId.getValue(), step.name(), i + 1, definition.size());

            Payload result;
            try {
                result = step.directInvoker().action().execute(request);
            } catch (Exception e) {
                restoreInterrupt(e);
                log.error("Saga {}: step '{}' failed, compensating {} completed step(s)",
                    sagaId.getValue(), step.name(), completed.size(), e);
                throw compensate(sagaId, step, e, completed);
            }

            Payload output = result == null ? Payload.empty() : result;
            completed.push(new CompletedStep(step, output));
            results.put(step.name(), output);
            shared = shared.merge(output);
            log.info("Saga {}: step '{}' completed", sagaId.getValue(), step.name());
        }

        log.info("Saga {}: all {} step(s) completed", sagaId.getValue(), definition.size());
        return new InlineResult(sagaId, results, shared);
    }

    /**
     * 완료된 Step을 역순으로 보상하고, 던질 예외를 만들어 반환.
     */
    private SagaException compensate(SagaId sagaId, Step failedStep, Exception actionFailure,
                                     Deque<CompletedStep> completed) {
        List<CompensationFailure> failures = new ArrayList<>();

        while (!completed.isEmpty()) {
            CompletedStep entry = completed.pop();
            String stepName = entry.step().name();
            try {
                entry.step().directInvoker().compensation().compensate(entry.result());
                log.info("Saga {}: step '{}' compensated", sagaId.getValue(), stepName);
            } catch (Exception e) {
                restoreInterrupt(e);
                log.error("Saga {}: compensation of step '{}' failed", sagaId.getValue(), stepName, e);
                failures.add(new CompensationFailure(stepName, e));
                if (compensationPolicy == CompensationPolicy.HALT_ON_FAILURE) {
                    break;
                }
            }
        }

        if (failures.isEmpty()) {
            log.info("Saga {}: compensation finished successfully", sagaId.getValue());
            return new SagaExecutionException(
                String.format("Saga %s failed at step '%s'; compensation completed", sagaId.getValue(), failedStep.name()),
                sagaId, failedStep.name(), actionFailure);
        }
        return new SagaCompensationException(
            String.format("Saga %s failed at step '%s'; %d compensation(s) failed",
                sagaId.getValue(), failedStep.name(), failures.size()),
            sagaId, failedStep.name(), actionFailure, failures);
    }

    private static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    private record CompletedStep(Step step, Payload result) {
    }
}
