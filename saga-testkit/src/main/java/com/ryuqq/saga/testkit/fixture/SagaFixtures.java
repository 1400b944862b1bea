package com.ryuqq.saga.testkit.fixture;

import com.ryuqq.saga.core.definition.SagaDefinition;
import com.ryuqq.saga.core.instance.Attempt;
import com.ryuqq.saga.core.instance.SagaInstance;
import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;
import com.ryuqq.saga.core.statemachine.SagaStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 테스트용 Saga 정의/인스턴스 생성 헬퍼.
 *
 * <p>주문 처리 예시 ({@code charge_payment → reserve_inventory → ship_order})를 기준으로
 * 다양한 진행 상태의 인스턴스를 만들어 줍니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SagaFixtures {

    public static final String ORDER_DEFINITION_ID = "order";

    // Utility class - prevent instantiation
    private SagaFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 3-Step 주문 Saga 정의 (dispatch 모드).
     *
     * @return Saga 정의
     */
    public static SagaDefinition orderDefinition() {
        return SagaDefinition.builder(ORDER_DEFINITION_ID)
            .step("charge_payment", "payments.charge", "payments.refund")
            .step("reserve_inventory", "inventory.reserve", "inventory.release")
            .step("ship_order", "shipping.ship", "shipping.cancel")
            .build();
    }

    /**
     * 초기 주문 페이로드 {@code {order_id: "123"}}.
     *
     * @return 페이로드
     */
    public static Payload orderPayload() {
        return Payload.of("order_id", "123");
    }

    /**
     * JSON 기본 타입이 아닌 값을 섞은 주문 페이로드.
     *
     * <p>{@code BigDecimal} 금액(스케일 2), {@code Long} 고객 ID, {@code java.time} 값,
     * null 값, 중첩 리스트/맵을 포함합니다.</p>
     *
     * @return 페이로드
     */
    public static Payload typedPayload() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("order_id", "123");
        values.put("amount", new BigDecimal("10.10"));
        values.put("customer_id", 42L);
        values.put("quantity", 3);
        values.put("discount_rate", 0.5);
        values.put("express", true);
        values.put("coupon", null);
        values.put("due_date", LocalDate.of(2024, 1, 31));
        values.put("placed_at", Instant.ofEpochSecond(1_700_000_000L));
        values.put("tags", List.of("gift", "fragile"));
        values.put("dimensions", Map.of("weight", 1_500L, "unit", "g"));
        return Payload.of(values);
    }

    /**
     * {@link #typedPayload()}로 첫 Action을 디스패치한 직후의 인스턴스.
     *
     * @param sagaId Saga ID
     * @param now 기준 시각 (epoch millis)
     * @return 인스턴스
     */
    public static SagaInstance typedRunningInstance(String sagaId, long now) {
        return SagaInstance.create(SagaId.of(sagaId), ORDER_DEFINITION_ID, typedPayload(), "corr-" + sagaId, now)
            .transitionTo(SagaStatus.RUNNING, now)
            .appendAttempt(Attempt.pending("charge_payment", typedPayload()), now);
    }

    /**
     * 첫 Action을 디스패치한 직후의 인스턴스 (RUNNING, Attempt 0 PENDING).
     *
     * @param sagaId Saga ID
     * @param now 기준 시각 (epoch millis)
     * @return 인스턴스
     */
    public static SagaInstance runningInstance(String sagaId, long now) {
        return SagaInstance.create(SagaId.of(sagaId), ORDER_DEFINITION_ID, orderPayload(), "corr-" + sagaId, now)
            .transitionTo(SagaStatus.RUNNING, now)
            .appendAttempt(Attempt.pending("charge_payment", orderPayload()), now);
    }

    /**
     * 두 번째 Step 실패 후 보상 중인 인스턴스.
     *
     * <p>Attempt 0은 COMPLETED, Attempt 1은 PENDING_COMPENSATION 상태입니다.</p>
     *
     * @param sagaId Saga ID
     * @param now 기준 시각 (epoch millis)
     * @return 인스턴스
     */
    public static SagaInstance compensatingInstance(String sagaId, long now) {
        Payload paymentResult = Payload.of("payment_id", "PAY-1");
        Payload compensation = Payload.of(Map.of("action_result", Map.of(), "shared_payload", Map.of("order_id", "123")));
        return runningInstance(sagaId, now)
            .updateAttempt(0, Attempt.pending("charge_payment", orderPayload()).complete(paymentResult), now)
            .advance(Payload.of("payment_id", "PAY-1"), now)
            .appendAttempt(Attempt.pending("reserve_inventory", orderPayload()), now)
            .updateAttempt(1, Attempt.pending("reserve_inventory", orderPayload())
                .fail("out_of_stock").awaitCompensation(compensation), now)
            .transitionTo(SagaStatus.COMPENSATING, now)
            .moveCompensationCursor(1, now);
    }

    /**
     * 성공 종료된 인스턴스.
     *
     * @param sagaId Saga ID
     * @param now 기준 시각 (epoch millis)
     * @return 인스턴스
     */
    public static SagaInstance succeededInstance(String sagaId, long now) {
        SagaInstance instance = runningInstance(sagaId, now)
            .updateAttempt(0, Attempt.pending("charge_payment", orderPayload()).complete(Payload.empty()), now)
            .advance(Payload.empty(), now);
        return instance.transitionTo(SagaStatus.SUCCEEDED, now);
    }
}
