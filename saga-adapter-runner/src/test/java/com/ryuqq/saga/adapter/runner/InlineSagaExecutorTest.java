package com.ryuqq.saga.adapter.runner;

import com.ryuqq.saga.application.inline.InlineResult;
import com.ryuqq.saga.core.definition.SagaDefinition;
import com.ryuqq.saga.core.definition.Step;
import com.ryuqq.saga.core.definition.StepCompensation;
import com.ryuqq.saga.core.exception.SagaCompensationException;
import com.ryuqq.saga.core.exception.SagaDefinitionException;
import com.ryuqq.saga.core.exception.SagaExecutionException;
import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;
import com.ryuqq.saga.testkit.fixture.SagaFixtures;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * InlineSagaExecutor 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InlineSagaExecutorTest {

    private final List<String> calls = new ArrayList<>();

    @Test
    void execute_모든_Step_성공하면_Step별_결과를_반환함() {
        // given
        SagaDefinition definition = SagaDefinition.builder("order")
            .step(recording("charge_payment", Payload.of("payment_id", "PAY-1")))
            .step(recording("reserve_inventory", null))
            .build();
        InlineSagaExecutor executor = new InlineSagaExecutor(definition);

        // when
        InlineResult result = executor.execute(SagaId.of("saga-inline-1"), SagaFixtures.orderPayload());

        // then
        assertThat(result.sagaId()).isEqualTo(SagaId.of("saga-inline-1"));
        assertThat(result.results()).containsOnlyKeys("charge_payment", "reserve_inventory");
        assertThat(result.result("charge_payment")).isEqualTo(Payload.of("payment_id", "PAY-1"));
        assertThat(result.result("reserve_inventory")).isEqualTo(Payload.empty());
        assertThat(result.sharedPayload()).isEqualTo(SagaFixtures.orderPayload().with("payment_id", "PAY-1"));
        assertThat(calls).containsExactly("charge_payment", "reserve_inventory");
    }

    @Test
    void execute_Action은_요청_페이로드_빌더의_결과를_받음() {
        // given
        List<Payload> requests = new ArrayList<>();
        SagaDefinition definition = SagaDefinition.builder("order")
            .step(Step.direct("charge_payment", request -> {
                requests.add(request);
                return Payload.empty();
            }, StepCompensation.noOp()).withActionPayload(shared -> Payload.of("amount", 100)))
            .build();

        // when
        new InlineSagaExecutor(definition).execute(SagaFixtures.orderPayload());

        // then
        assertThat(requests).containsExactly(Payload.of("amount", 100));
    }

    @Test
    void execute_앞선_Action_결과가_공유_페이로드에_병합되어_다음_Step에_전달됨() {
        // given
        List<Payload> shippingRequests = new ArrayList<>();
        SagaDefinition definition = SagaDefinition.builder("order")
            .step(Step.direct("charge_payment", request -> Payload.of("payment_id", "PAY-1"),
                StepCompensation.noOp()))
            .step(Step.direct("ship_order", request -> {
                shippingRequests.add(request);
                return Payload.of("tracking", "TRK-1");
            }, StepCompensation.noOp()).withActionPayload(shared -> Payload.of("order_id", shared.get("order_id"))
                .with("payment_id", shared.get("payment_id"))))
            .build();

        // when
        InlineResult result = new InlineSagaExecutor(definition).execute(SagaFixtures.orderPayload());

        // then
        assertThat(shippingRequests).hasSize(1);
        assertThat(shippingRequests.get(0).asMap())
            .containsEntry("order_id", "123")
            .containsEntry("payment_id", "PAY-1");
        assertThat(result.sharedPayload().asMap())
            .containsEntry("order_id", "123")
            .containsEntry("payment_id", "PAY-1")
            .containsEntry("tracking", "TRK-1");
    }

    @Test
    void execute_Action_실패하면_완료된_Step만_역순으로_자기_결과로_보상함() {
        // given
        IllegalStateException boom = new IllegalStateException("out_of_stock");
        List<Payload> compensatedWith = new ArrayList<>();
        SagaDefinition definition = SagaDefinition.builder("order")
            .step(Step.direct("a", request -> Payload.of("r", "A"), result -> {
                calls.add("undo-a");
                compensatedWith.add(result);
            }))
            .step(Step.direct("b", request -> Payload.of("r", "B"), result -> {
                calls.add("undo-b");
                compensatedWith.add(result);
            }))
            .step(Step.direct("c", request -> {
                throw boom;
            }, result -> calls.add("undo-c")))
            .step(Step.direct("d", request -> {
                calls.add("d");
                return Payload.empty();
            }, result -> calls.add("undo-d")))
            .build();

        // when
        SagaExecutionException thrown = catchThrowableOfType(
            () -> new InlineSagaExecutor(definition).execute(SagaId.of("saga-inline-2"), Payload.empty()),
            SagaExecutionException.class);

        // then
        assertThat(thrown).isNotInstanceOf(SagaCompensationException.class);
        assertThat(thrown.getSagaId()).isEqualTo(SagaId.of("saga-inline-2"));
        assertThat(thrown.getFailedStepName()).isEqualTo("c");
        assertThat(thrown.getCause()).isSameAs(boom);
        assertThat(calls).containsExactly("undo-b", "undo-a");
        assertThat(compensatedWith).containsExactly(Payload.of("r", "B"), Payload.of("r", "A"));
    }

    @Test
    void execute_보상_실패가_있으면_나머지도_시도하고_SagaCompensationException() {
        // given
        RuntimeException actionFailure = new RuntimeException("ship failed");
        RuntimeException undoFailure = new RuntimeException("refund failed");
        SagaDefinition definition = failingAtThird(undoFailure, actionFailure);

        // when
        SagaCompensationException thrown = catchThrowableOfType(
            () -> new InlineSagaExecutor(definition).execute(Payload.empty()),
            SagaCompensationException.class);

        // then
        assertThat(calls).containsExactly("undo-b", "undo-a");
        assertThat(thrown.getFailedStepName()).isEqualTo("c");
        assertThat(thrown.getCause()).isSameAs(actionFailure);
        assertThat(thrown.getCompensationFailures()).hasSize(1);
        assertThat(thrown.getCompensationFailures().get(0).stepName()).isEqualTo("b");
        assertThat(thrown.getCompensationFailures().get(0).cause()).isSameAs(undoFailure);
    }

    @Test
    void execute_HALT_정책이면_첫_보상_실패에서_멈춤() {
        // given
        RuntimeException undoFailure = new RuntimeException("refund failed");
        SagaDefinition definition = failingAtThird(undoFailure, new RuntimeException("ship failed"));
        InlineSagaExecutor executor = new InlineSagaExecutor(definition, CompensationPolicy.HALT_ON_FAILURE);

        // when & then
        assertThatThrownBy(() -> executor.execute(Payload.empty()))
            .isInstanceOf(SagaCompensationException.class);
        assertThat(calls).containsExactly("undo-b");
    }

    @Test
    void execute_체크_예외도_보상을_트리거함() {
        // given
        SagaDefinition definition = SagaDefinition.builder("order")
            .step(Step.direct("a", request -> Payload.empty(), result -> calls.add("undo-a")))
            .step(Step.direct("b", request -> {
                throw new IOException("io");
            }, StepCompensation.noOp()))
            .build();

        // when & then
        assertThatThrownBy(() -> new InlineSagaExecutor(definition).execute(Payload.empty()))
            .isInstanceOf(SagaExecutionException.class)
            .hasCauseInstanceOf(IOException.class);
        assertThat(calls).containsExactly("undo-a");
    }

    @Test
    void constructor_dispatch_Step이_있으면_SagaDefinitionException() {
        assertThatThrownBy(() -> new InlineSagaExecutor(SagaFixtures.orderDefinition()))
            .isInstanceOf(SagaDefinitionException.class);
    }

    private Step recording(String name, Payload result) {
        return Step.direct(name, request -> {
            calls.add(name);
            return result;
        }, StepCompensation.noOp());
    }

    private SagaDefinition failingAtThird(RuntimeException undoBFailure, RuntimeException actionFailure) {
        return SagaDefinition.builder("order")
            .step(Step.direct("a", request -> Payload.empty(), result -> calls.add("undo-a")))
            .step(Step.direct("b", request -> Payload.empty(), result -> {
                calls.add("undo-b");
                throw undoBFailure;
            }))
            .step(Step.direct("c", request -> {
                throw actionFailure;
            }, StepCompensation.noOp()))
            .build();
    }
}
