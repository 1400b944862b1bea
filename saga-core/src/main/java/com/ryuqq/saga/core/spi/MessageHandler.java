package com.ryuqq.saga.core.spi;

import com.ryuqq.saga.core.contract.SagaMessage;

import java.util.Map;

/**
 * Callback invoked by a {@link CommandChannel} for each message delivered to a subscription.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Handles a delivered message.
     *
     * @param message the message
     * @param headers transport headers (never null, may be empty)
     */
    void onMessage(SagaMessage message, Map<String, String> headers);
}
