package com.ryuqq.saga.adapter.runner;

import com.ryuqq.saga.adapter.inmemory.channel.InMemoryCommandChannel;
import com.ryuqq.saga.adapter.inmemory.store.InMemorySagaStore;
import com.ryuqq.saga.core.contract.ActionReply;
import com.ryuqq.saga.core.contract.CompensationReply;
import com.ryuqq.saga.core.contract.Destinations;
import com.ryuqq.saga.core.contract.Headers;
import com.ryuqq.saga.core.contract.SagaCompletedEvent;
import com.ryuqq.saga.core.contract.SagaFailedEvent;
import com.ryuqq.saga.core.contract.StepCommand;
import com.ryuqq.saga.core.definition.SagaDefinition;
import com.ryuqq.saga.core.definition.Step;
import com.ryuqq.saga.core.definition.StepCompensation;
import com.ryuqq.saga.core.exception.DuplicateSagaException;
import com.ryuqq.saga.core.exception.SagaDefinitionException;
import com.ryuqq.saga.core.instance.SagaInstance;
import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;
import com.ryuqq.saga.core.statemachine.AttemptStatus;
import com.ryuqq.saga.core.statemachine.SagaStatus;
import com.ryuqq.saga.testkit.fixture.SagaFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AsyncSagaEngine 테스트.
 *
 * <p>InMemory 저장소/채널로 정방향 진행, 보상 walk, 응답 가드를 검증합니다:</p>
 * <ul>
 *   <li>시작 시 PENDING Attempt 저장 후 첫 Step 디스패치</li>
 *   <li>성공 응답마다 공유 페이로드 병합 및 다음 Step 디스패치</li>
 *   <li>실패 시 역순 보상 후 failed 이벤트</li>
 *   <li>중복/지연 응답은 폐기되고 아무것도 저장되지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AsyncSagaEngineTest {

    private static final long NOW = 1_000L;
    private static final SagaId SAGA_ID = SagaId.of("saga-order-1");

    private InMemorySagaStore store;
    private InMemoryCommandChannel channel;
    private Clock clock;
    private AsyncSagaEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemorySagaStore();
        channel = new InMemoryCommandChannel();
        clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        engine = newEngine(new SagaEngineConfig());
    }

    // ============================================================
    // 1. 시작
    // ============================================================

    @Test
    void start_첫_Step을_PENDING으로_저장한_뒤_디스패치함() {
        // when
        SagaId sagaId = engine.start(SAGA_ID, SagaFixtures.orderPayload(), "corr-1");

        // then
        SagaInstance instance = load(sagaId);
        assertThat(instance.status()).isEqualTo(SagaStatus.RUNNING);
        assertThat(instance.forwardCursor()).isZero();
        assertThat(instance.attempts()).hasSize(1);
        assertThat(instance.attempts().get(0).status()).isEqualTo(AttemptStatus.PENDING);
        assertThat(instance.correlationId()).isEqualTo("corr-1");

        List<InMemoryCommandChannel.PublishedMessage> commands = channel.published("payments.charge");
        assertThat(commands).hasSize(1);
        StepCommand command = (StepCommand) commands.get(0).message();
        assertThat(command.stepIndex()).isZero();
        assertThat(command.stepName()).isEqualTo("charge_payment");
        assertThat(command.payload()).isEqualTo(SagaFixtures.orderPayload());
        assertThat(command.replyDestination()).isEqualTo(Destinations.actionResult(sagaId));
        assertThat(commands.get(0).headers())
            .containsEntry(Headers.SAGA_ID, sagaId.getValue())
            .containsEntry(Headers.PHASE, "ACTION")
            .containsEntry(Headers.STEP_INDEX, "0")
            .containsEntry(Headers.CORRELATION_ID, "corr-1");
    }

    @Test
    void start_디스패치_시점에_이미_PENDING_상태가_저장되어_있음() {
        // given
        channel.subscribe("payments.charge", (message, headers) -> {
            SagaInstance persisted = load(message.sagaId());
            assertThat(persisted.attempts()).hasSize(1);
            assertThat(persisted.attempts().get(0).status()).isEqualTo(AttemptStatus.PENDING);
        });

        // when
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);

        // then
        assertThat(channel.published("payments.charge")).hasSize(1);
    }

    @Test
    void start_ID_미지정이면_정의_ID를_포함한_ID를_생성함() {
        // when
        SagaId sagaId = engine.start(SagaFixtures.orderPayload(), null);

        // then
        assertThat(sagaId.getValue()).startsWith("saga-order-");
        assertThat(store.load(sagaId)).isPresent();
    }

    @Test
    void start_이미_존재하는_ID면_DuplicateSagaException() {
        // given
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);
        int saves = store.saveCount();

        // when & then
        assertThatThrownBy(() -> engine.start(SAGA_ID, SagaFixtures.orderPayload(), null))
            .isInstanceOf(DuplicateSagaException.class);
        assertThat(store.saveCount()).isEqualTo(saves);
        assertThat(channel.published("payments.charge")).hasSize(1);
    }

    @Test
    void start_요청_페이로드_빌더_예외는_전파되고_아무것도_저장하지_않음() {
        // given
        SagaDefinition definition = SagaDefinition.builder("order")
            .step(Step.dispatch("charge_payment", "payments.charge", "payments.refund")
                .withActionPayload(shared -> {
                    throw new IllegalStateException("missing amount");
                }))
            .build();
        AsyncSagaEngine failing = new AsyncSagaEngine(definition, store, channel);

        // when & then
        assertThatThrownBy(() -> failing.start(SAGA_ID, SagaFixtures.orderPayload(), null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("missing amount");
        assertThat(store.size()).isZero();
        assertThat(channel.published()).isEmpty();
    }

    @Test
    void constructor_direct_Step이_있으면_SagaDefinitionException() {
        SagaDefinition inline = SagaDefinition.builder("local")
            .step(Step.direct("noop", request -> request, StepCompensation.noOp()))
            .build();

        assertThatThrownBy(() -> new AsyncSagaEngine(inline, store, channel))
            .isInstanceOf(SagaDefinitionException.class);
    }

    // ============================================================
    // 2. 정방향 진행
    // ============================================================

    @Test
    void handleActionReply_모든_Step_성공하면_SUCCEEDED와_completed_이벤트() {
        // given
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);

        // when
        assertThat(engine.handleActionReply(ActionReply.success(SAGA_ID, 0,
            Payload.of("payment_id", "PAY-1"), Payload.of("payment_id", "PAY-1")))).isTrue();
        assertThat(engine.handleActionReply(ActionReply.success(SAGA_ID, 1,
            Payload.empty(), Payload.of("reservation_id", "RES-1")))).isTrue();
        assertThat(engine.handleActionReply(ActionReply.success(SAGA_ID, 2,
            Payload.of("tracking", "TRK-1"), null))).isTrue();

        // then
        SagaInstance instance = load(SAGA_ID);
        assertThat(instance.status()).isEqualTo(SagaStatus.SUCCEEDED);
        assertThat(instance.forwardCursor()).isEqualTo(3);
        assertThat(instance.attempts()).extracting(a -> a.status())
            .containsOnly(AttemptStatus.COMPLETED);
        assertThat(instance.attempts().get(2).result()).isEqualTo(Payload.of("tracking", "TRK-1"));

        Payload expectedShared = SagaFixtures.orderPayload()
            .with("payment_id", "PAY-1")
            .with("reservation_id", "RES-1");
        assertThat(instance.sharedPayload()).isEqualTo(expectedShared);

        List<InMemoryCommandChannel.PublishedMessage> completed = channel.published(Destinations.completed(SAGA_ID));
        assertThat(completed).hasSize(1);
        assertThat(((SagaCompletedEvent) completed.get(0).message()).finalSharedPayload()).isEqualTo(expectedShared);
        assertThat(channel.published(Destinations.failed(SAGA_ID))).isEmpty();
    }

    @Test
    void handleActionReply_다음_Step_요청은_병합된_공유_페이로드로_만들어짐() {
        // given
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);

        // when
        engine.handleActionReply(ActionReply.success(SAGA_ID, 0, Payload.empty(), Payload.of("payment_id", "PAY-1")));

        // then
        StepCommand reserve = (StepCommand) channel.published("inventory.reserve").get(0).message();
        assertThat(reserve.stepIndex()).isEqualTo(1);
        assertThat(reserve.payload().asMap())
            .containsEntry("order_id", "123")
            .containsEntry("payment_id", "PAY-1");
    }

    // ============================================================
    // 3. 보상
    // ============================================================

    @Test
    void handleActionReply_실패하면_실패한_Step부터_역순으로_보상함() {
        // given
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);
        engine.handleActionReply(ActionReply.success(SAGA_ID, 0,
            Payload.of("payment_id", "PAY-1"), Payload.of("payment_id", "PAY-1")));

        // when
        engine.handleActionReply(ActionReply.failure(SAGA_ID, 1, "out_of_stock"));

        // then: 실패한 Step 자신의 정리 보상이 먼저 디스패치됨
        SagaInstance compensating = load(SAGA_ID);
        assertThat(compensating.status()).isEqualTo(SagaStatus.COMPENSATING);
        assertThat(compensating.compensationCursor()).isEqualTo(1);
        assertThat(compensating.attempts().get(1).status()).isEqualTo(AttemptStatus.PENDING_COMPENSATION);
        assertThat(compensating.attempts().get(1).error()).isEqualTo("out_of_stock");

        List<InMemoryCommandChannel.PublishedMessage> release = channel.published("inventory.release");
        assertThat(release).hasSize(1);
        assertThat(((StepCommand) release.get(0).message()).replyDestination())
            .isEqualTo(Destinations.compensationResult(SAGA_ID));
        assertThat(release.get(0).headers()).containsEntry(Headers.PHASE, "COMPENSATION");

        // when: 보상 응답
        engine.handleCompensationReply(CompensationReply.success(SAGA_ID, 1));

        // then: 완료된 이전 Step 보상 (기본 보상 페이로드)
        StepCommand refund = (StepCommand) channel.published("payments.refund").get(0).message();
        assertThat(refund.stepIndex()).isZero();
        assertThat(refund.payload().get(Step.ACTION_RESULT_KEY)).isEqualTo(Map.of("payment_id", "PAY-1"));
        assertThat(refund.payload().get(Step.SHARED_PAYLOAD_KEY))
            .isEqualTo(Map.of("order_id", "123", "payment_id", "PAY-1"));

        // when
        engine.handleCompensationReply(CompensationReply.success(SAGA_ID, 0));

        // then
        SagaInstance failed = load(SAGA_ID);
        assertThat(failed.status()).isEqualTo(SagaStatus.FAILED_ACTION);
        assertThat(failed.compensationCursor()).isEqualTo(SagaInstance.NOT_COMPENSATING);
        assertThat(failed.attempts()).extracting(a -> a.status())
            .containsExactly(AttemptStatus.COMPENSATED, AttemptStatus.COMPENSATED);
        assertThat(channel.published("shipping.ship")).isEmpty();
        assertThat(channel.published("shipping.cancel")).isEmpty();

        List<InMemoryCommandChannel.PublishedMessage> events = channel.published(Destinations.failed(SAGA_ID));
        assertThat(events).hasSize(1);
        assertThat(((SagaFailedEvent) events.get(0).message()).reason())
            .contains("reserve_inventory")
            .contains("out_of_stock");
    }

    @Test
    void handleActionReply_실패한_Step_보상을_끄면_완료된_Step만_보상함() {
        // given
        engine = newEngine(new SagaEngineConfig().withCompensateFailedStep(false));
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);
        engine.handleActionReply(ActionReply.success(SAGA_ID, 0, Payload.empty(), null));

        // when
        engine.handleActionReply(ActionReply.failure(SAGA_ID, 1, "out_of_stock"));

        // then
        assertThat(channel.published("inventory.release")).isEmpty();
        assertThat(channel.published("payments.refund")).hasSize(1);
        SagaInstance instance = load(SAGA_ID);
        assertThat(instance.compensationCursor()).isZero();
        assertThat(instance.attempts().get(1).status()).isEqualTo(AttemptStatus.FAILED);
    }

    @Test
    void handleActionReply_첫_Step이_실패하고_보상할_것이_없으면_바로_FAILED_ACTION() {
        // given
        engine = newEngine(new SagaEngineConfig().withCompensateFailedStep(false));
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);

        // when
        engine.handleActionReply(ActionReply.failure(SAGA_ID, 0, null));

        // then
        SagaInstance instance = load(SAGA_ID);
        assertThat(instance.status()).isEqualTo(SagaStatus.FAILED_ACTION);
        assertThat(instance.compensationCursor()).isEqualTo(SagaInstance.NOT_COMPENSATING);
        assertThat(instance.attempts().get(0).error()).isEqualTo("unknown error");
        assertThat(channel.published(Destinations.failed(SAGA_ID))).hasSize(1);
    }

    @Test
    void handleCompensationReply_HALT_정책이면_보상_실패_즉시_FAILED_COMPENSATION() {
        // given
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);
        engine.handleActionReply(ActionReply.success(SAGA_ID, 0, Payload.empty(), null));
        engine.handleActionReply(ActionReply.failure(SAGA_ID, 1, "out_of_stock"));

        // when
        engine.handleCompensationReply(CompensationReply.failure(SAGA_ID, 1, "release_timeout"));

        // then
        SagaInstance instance = load(SAGA_ID);
        assertThat(instance.status()).isEqualTo(SagaStatus.FAILED_COMPENSATION);
        assertThat(instance.attempts().get(1).status()).isEqualTo(AttemptStatus.COMPENSATION_FAILED);
        assertThat(instance.attempts().get(1).compensationError()).isEqualTo("release_timeout");
        assertThat(instance.attempts().get(1).error()).isEqualTo("out_of_stock");
        assertThat(instance.attempts().get(0).status()).isEqualTo(AttemptStatus.COMPLETED);
        assertThat(channel.published("payments.refund")).isEmpty();

        SagaFailedEvent event = (SagaFailedEvent) channel.published(Destinations.failed(SAGA_ID)).get(0).message();
        assertThat(event.reason()).contains("release_timeout");
    }

    @Test
    void handleCompensationReply_CONTINUE_정책이면_나머지_보상을_계속하고_FAILED_COMPENSATION() {
        // given
        engine = newEngine(new SagaEngineConfig().withCompensationPolicy(CompensationPolicy.CONTINUE_ON_FAILURE));
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);
        engine.handleActionReply(ActionReply.success(SAGA_ID, 0, Payload.empty(), null));
        engine.handleActionReply(ActionReply.failure(SAGA_ID, 1, "out_of_stock"));

        // when
        engine.handleCompensationReply(CompensationReply.failure(SAGA_ID, 1, "release_timeout"));

        // then: 이전 Step 보상은 계속 진행
        assertThat(channel.published("payments.refund")).hasSize(1);
        assertThat(load(SAGA_ID).status()).isEqualTo(SagaStatus.COMPENSATING);

        // when
        engine.handleCompensationReply(CompensationReply.success(SAGA_ID, 0));

        // then
        SagaInstance instance = load(SAGA_ID);
        assertThat(instance.status()).isEqualTo(SagaStatus.FAILED_COMPENSATION);
        assertThat(instance.attempts()).extracting(a -> a.status())
            .containsExactly(AttemptStatus.COMPENSATED, AttemptStatus.COMPENSATION_FAILED);
        SagaFailedEvent event = (SagaFailedEvent) channel.published(Destinations.failed(SAGA_ID)).get(0).message();
        assertThat(event.reason()).contains("reserve_inventory").contains("release_timeout");
    }

    @Test
    void handleCompensationReply_보상_페이로드_빌더를_지정하면_그_결과를_디스패치함() {
        // given
        SagaDefinition definition = SagaDefinition.builder("order")
            .step(Step.dispatch("charge_payment", "payments.charge", "payments.refund")
                .withCompensationPayload((result, shared) -> Payload.of("refund_id", result.get("payment_id"))))
            .step("reserve_inventory", "inventory.reserve", "inventory.release")
            .build();
        engine = new AsyncSagaEngine(definition, store, channel,
            new SagaEngineConfig().withCompensateFailedStep(false), clock);
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);
        engine.handleActionReply(ActionReply.success(SAGA_ID, 0, Payload.of("payment_id", "PAY-7"), null));

        // when
        engine.handleActionReply(ActionReply.failure(SAGA_ID, 1, "out_of_stock"));

        // then
        StepCommand refund = (StepCommand) channel.published("payments.refund").get(0).message();
        assertThat(refund.payload()).isEqualTo(Payload.of("refund_id", "PAY-7"));
        assertThat(load(SAGA_ID).attempts().get(0).compensationPayload()).isEqualTo(refund.payload());
    }

    // ============================================================
    // 4. 응답 가드
    // ============================================================

    @Test
    void handleActionReply_중복_응답은_폐기되고_저장하지_않음() {
        // given
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);
        ActionReply reply = ActionReply.success(SAGA_ID, 0, Payload.empty(), Payload.of("payment_id", "PAY-1"));
        engine.handleActionReply(reply);
        int saves = store.saveCount();
        SagaInstance before = load(SAGA_ID);

        // when
        boolean applied = engine.handleActionReply(reply);

        // then
        assertThat(applied).isFalse();
        assertThat(store.saveCount()).isEqualTo(saves);
        assertThat(load(SAGA_ID)).isEqualTo(before);
        assertThat(channel.published("inventory.reserve")).hasSize(1);
    }

    @Test
    void handleActionReply_앞선_Step_인덱스의_응답은_폐기됨() {
        // given
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);
        int saves = store.saveCount();

        // when
        boolean applied = engine.handleActionReply(ActionReply.success(SAGA_ID, 2, Payload.empty(), null));

        // then
        assertThat(applied).isFalse();
        assertThat(store.saveCount()).isEqualTo(saves);
    }

    @Test
    void handleActionReply_보상_중에_도착한_Action_응답은_폐기됨() {
        // given
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);
        engine.handleActionReply(ActionReply.success(SAGA_ID, 0, Payload.empty(), null));
        engine.handleActionReply(ActionReply.failure(SAGA_ID, 1, "out_of_stock"));
        int saves = store.saveCount();

        // when
        boolean applied = engine.handleActionReply(ActionReply.success(SAGA_ID, 1, Payload.empty(), null));

        // then
        assertThat(applied).isFalse();
        assertThat(store.saveCount()).isEqualTo(saves);
        assertThat(load(SAGA_ID).status()).isEqualTo(SagaStatus.COMPENSATING);
    }

    @Test
    void handleCompensationReply_RUNNING_상태거나_커서가_다르면_폐기됨() {
        // given
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);

        // when & then
        assertThat(engine.handleCompensationReply(CompensationReply.success(SAGA_ID, 0))).isFalse();

        engine.handleActionReply(ActionReply.success(SAGA_ID, 0, Payload.empty(), null));
        engine.handleActionReply(ActionReply.failure(SAGA_ID, 1, "out_of_stock"));
        int saves = store.saveCount();

        assertThat(engine.handleCompensationReply(CompensationReply.success(SAGA_ID, 0))).isFalse();
        assertThat(store.saveCount()).isEqualTo(saves);
    }

    @Test
    void handleActionReply_종료된_Saga_응답은_폐기됨() {
        // given
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);
        engine.handleActionReply(ActionReply.failure(SAGA_ID, 0, "declined"));
        engine.handleCompensationReply(CompensationReply.success(SAGA_ID, 0));
        assertThat(load(SAGA_ID).status()).isEqualTo(SagaStatus.FAILED_ACTION);
        int saves = store.saveCount();

        // when & then
        assertThat(engine.handleActionReply(ActionReply.success(SAGA_ID, 0, Payload.empty(), null))).isFalse();
        assertThat(engine.handleCompensationReply(CompensationReply.success(SAGA_ID, 0))).isFalse();
        assertThat(store.saveCount()).isEqualTo(saves);
        assertThat(channel.published(Destinations.failed(SAGA_ID))).hasSize(1);
    }

    @Test
    void handleActionReply_알_수_없는_Saga_응답은_폐기됨() {
        // when
        boolean applied = engine.handleActionReply(
            ActionReply.success(SagaId.of("saga-unknown"), 0, Payload.empty(), null));

        // then
        assertThat(applied).isFalse();
        assertThat(store.saveCount()).isZero();
        assertThat(channel.published()).isEmpty();
    }

    @Test
    void handleActionReply_동시에_도착한_중복_응답은_한_번만_적용됨() throws Exception {
        // given
        engine.start(SAGA_ID, SagaFixtures.orderPayload(), null);
        ActionReply reply = ActionReply.success(SAGA_ID, 0, Payload.empty(), Payload.of("payment_id", "PAY-1"));
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(1);

        try {
            Callable<Boolean> deliver = () -> {
                ready.await();
                return engine.handleActionReply(reply);
            };
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(deliver));
            }

            // when
            ready.countDown();
            int applied = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    applied++;
                }
            }

            // then
            assertThat(applied).isEqualTo(1);
            assertThat(channel.published("inventory.reserve")).hasSize(1);
            assertThat(load(SAGA_ID).attempts()).hasSize(2);
        } finally {
            executor.shutdownNow();
        }
    }

    private AsyncSagaEngine newEngine(SagaEngineConfig config) {
        return new AsyncSagaEngine(SagaFixtures.orderDefinition(), store, channel, config, clock);
    }

    private SagaInstance load(SagaId sagaId) {
        return store.load(sagaId).orElseThrow();
    }
}
