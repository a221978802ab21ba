package qrelay.client.api;

import qrelay.core.model.PublishResult;
import qrelay.core.model.SendRequest;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Interface for clients that produce messages to a QRelay queue or exchange.
 */
public interface MessageProducer {
    /**
     * Sends a message to the producer's queue.
     *
     * @param body The message body
     * @return A CompletableFuture that completes with the message ID when the message is sent
     */
    CompletableFuture<String> sendMessage(String body);

    /**
     * Sends a message with attributes to the producer's queue.
     *
     * @param body The message body
     * @param attributes The message attributes
     * @return A CompletableFuture that completes with the message ID when the message is sent
     */
    CompletableFuture<String> sendMessage(String body, Map<String, String> attributes);

    /**
     * Sends a message with priority, delay, deduplication id or ordering group.
     *
     * @param request The send parameters
     * @return A CompletableFuture that completes with the message ID when the message is sent
     */
    CompletableFuture<String> sendMessage(SendRequest request);

    /**
     * Publishes a message to an exchange.
     *
     * @param exchangeId The exchange to publish to
     * @param body The message body
     * @param routingKey The routing key matched against the exchange's bindings
     * @param attributes The message attributes
     * @return A CompletableFuture that completes with the number of queues that accepted the message
     */
    CompletableFuture<Integer> publish(String exchangeId, String body, String routingKey, Map<String, String> attributes);

    /**
     * Publishes a message to an exchange and reports every destination.
     */
    CompletableFuture<PublishResult> publishDetailed(String exchangeId, String body, String routingKey, Map<String, String> attributes);

    /**
     * Closes the producer and releases any resources.
     */
    void close();
}
