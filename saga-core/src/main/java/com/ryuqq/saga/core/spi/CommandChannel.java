package com.ryuqq.saga.core.spi;

import com.ryuqq.saga.core.contract.SagaMessage;

import java.util.Map;

/**
 * Messaging SPI used to dispatch step commands and receive replies.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Publishing messages to a named destination</li>
 *   <li>Subscribing handlers to destinations</li>
 *   <li>Releasing subscriptions</li>
 * </ul>
 *
 * <p><strong>Delivery Semantics:</strong> At-least-once. The engine may publish the same
 * command more than once after {@code resume}; consumers deduplicate on
 * {@code (saga-id, step-index, saga-phase)} carried in the headers.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * String subscriptionId = channel.subscribe(Destinations.actionResult(sagaId),
 *     (message, headers) -&gt; engine.handleActionReply((ActionReply) message));
 * ...
 * channel.unsubscribe(subscriptionId);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CommandChannel {

    /**
     * Publishes a message with headers.
     *
     * @param destination the destination name
     * @param message the message
     * @param headers transport headers
     * @return a transport-assigned message id
     * @throws IllegalArgumentException if destination or message is null
     */
    String publish(String destination, SagaMessage message, Map<String, String> headers);

    /**
     * Publishes a message without headers.
     *
     * @param destination the destination name
     * @param message the message
     * @return a transport-assigned message id
     */
    default String publish(String destination, SagaMessage message) {
        return publish(destination, message, Map.of());
    }

    /**
     * Subscribes a handler to a destination.
     *
     * @param destination the destination name
     * @param handler the handler
     * @return a subscription id for {@link #unsubscribe(String)}
     * @throws IllegalArgumentException if destination or handler is null
     */
    String subscribe(String destination, MessageHandler handler);

    /**
     * Releases a subscription. Unknown ids are ignored.
     *
     * @param subscriptionId the subscription id
     */
    void unsubscribe(String subscriptionId);
}
