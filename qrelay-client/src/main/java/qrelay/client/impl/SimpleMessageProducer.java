package qrelay.client.impl;

import qrelay.client.api.MessageProducer;
import qrelay.core.QRelay;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.model.Message;
import qrelay.core.model.PublishResult;
import qrelay.core.model.SendRequest;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A simple implementation of the MessageProducer interface bound to one queue.
 */
public class SimpleMessageProducer implements MessageProducer {
    private static final Logger logger = LoggerFactory.getLogger(SimpleMessageProducer.class);

    private final QRelay qRelay;
    private final String queueId;
    private final ExecutorService executor;

    /**
     * Creates a new SimpleMessageProducer sending to the given queue.
     *
     * @param qRelay The QRelay instance to use
     * @param queueId The queue sendMessage writes to, may be null for a publish-only producer
     */
    public SimpleMessageProducer(QRelay qRelay, String queueId) {
        this.qRelay = qRelay;
        this.queueId = queueId;
        this.executor = Executors.newSingleThreadExecutor();
        logger.debug("Created SimpleMessageProducer for queue {}", queueId);
    }

    @Override
    public CompletableFuture<String> sendMessage(String body) {
        return sendMessage(SendRequest.of(body));
    }

    @Override
    public CompletableFuture<String> sendMessage(String body, Map<String, String> attributes) {
        return sendMessage(SendRequest.of(body, attributes));
    }

    @Override
    public CompletableFuture<String> sendMessage(SendRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Message message = qRelay.send(queueId, request);
                logger.debug("Message sent successfully with ID: {}", message.messageId());
                return message.messageId();
            } catch (QRelayException e) {
                logger.error("Failed to send message to queue {}: {}", queueId, e.getMessage());
                throw new RuntimeException("Failed to send message", e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Integer> publish(String exchangeId, String body, String routingKey, Map<String, String> attributes) {
        return publishDetailed(exchangeId, body, routingKey, attributes).thenApply(PublishResult::matchedQueues);
    }

    @Override
    public CompletableFuture<PublishResult> publishDetailed(String exchangeId, String body, String routingKey,
                                                            Map<String, String> attributes) {
        logger.debug("Publishing to exchange {} with routing key: {}", exchangeId, routingKey);
        return CompletableFuture.supplyAsync(() -> {
            try {
                return qRelay.publish(exchangeId, body, routingKey, attributes != null ? attributes : Map.of());
            } catch (QRelayException e) {
                logger.error("Failed to publish to exchange {}: {}", exchangeId, e.getMessage());
                throw new RuntimeException("Failed to publish message", e);
            }
        }, executor);
    }

    @Override
    public void close() {
        logger.info("Closing SimpleMessageProducer");
        executor.shutdown();
        // the QRelay instance may be shared, the caller closes it
    }
}
