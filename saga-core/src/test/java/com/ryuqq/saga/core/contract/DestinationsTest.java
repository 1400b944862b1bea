package com.ryuqq.saga.core.contract;

import com.ryuqq.saga.core.model.Payload;
import com.ryuqq.saga.core.model.SagaId;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Destinations / Headers / 메시지 레코드 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DestinationsTest {

    private static final SagaId SAGA_ID = SagaId.of("saga-order-1");

    @Test
    void destinations_FollowNamingConvention() {
        assertEquals("saga.saga-order-1.action_result", Destinations.actionResult(SAGA_ID));
        assertEquals("saga.saga-order-1.compensation_result", Destinations.compensationResult(SAGA_ID));
        assertEquals("saga_events.saga-order-1.completed", Destinations.completed(SAGA_ID));
        assertEquals("saga_events.saga-order-1.failed", Destinations.failed(SAGA_ID));
    }

    @Test
    void replyFor_SelectsDestinationByPhase() {
        assertEquals(Destinations.actionResult(SAGA_ID), Destinations.replyFor(SAGA_ID, Phase.ACTION));
        assertEquals(Destinations.compensationResult(SAGA_ID), Destinations.replyFor(SAGA_ID, Phase.COMPENSATION));
    }

    @Test
    void headers_ForCommand_CarryDeduplicationKey() {
        Map<String, String> headers = Headers.forCommand(SAGA_ID, Phase.COMPENSATION, 2, "corr-1");

        assertEquals("saga-order-1", headers.get(Headers.SAGA_ID));
        assertEquals("COMPENSATION", headers.get(Headers.PHASE));
        assertEquals("2", headers.get(Headers.STEP_INDEX));
        assertEquals("corr-1", headers.get(Headers.CORRELATION_ID));
    }

    @Test
    void headers_ForCommand_NullCorrelationId_Omitted() {
        Map<String, String> headers = Headers.forCommand(SAGA_ID, Phase.ACTION, 0, null);

        assertFalse(headers.containsKey(Headers.CORRELATION_ID));
    }

    @Test
    void actionReply_Factories() {
        ActionReply success = ActionReply.success(SAGA_ID, 1, Payload.of("k", "v"), Payload.of("s", 1));
        ActionReply failure = ActionReply.failure(SAGA_ID, 1, "out_of_stock");

        assertTrue(success.success());
        assertNull(success.error());
        assertFalse(failure.success());
        assertEquals("out_of_stock", failure.error());
        assertNull(failure.output());
    }

    @Test
    void stepCommand_InvalidArguments_Throw() {
        assertThrows(IllegalArgumentException.class,
            () -> new StepCommand(SAGA_ID, -1, "s", Payload.empty(), "reply", null));
        assertThrows(IllegalArgumentException.class,
            () -> new StepCommand(SAGA_ID, 0, "s", null, "reply", null));
        assertThrows(IllegalArgumentException.class,
            () -> new StepCommand(SAGA_ID, 0, "s", Payload.empty(), " ", null));
    }

    @Test
    void sagaFailedEvent_RequiresReason() {
        assertThrows(IllegalArgumentException.class, () -> new SagaFailedEvent(SAGA_ID, ""));
    }
}
