package qrelay.client.api;

import qrelay.core.model.AckResult;
import qrelay.core.model.Message;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Interface for clients that consume messages from a QRelay queue.
 */
public interface MessageConsumer {
    /**
     * @return The id under which the consumer is registered
     */
    String getConsumerId();

    /**
     * Receives up to the registered batch size of messages from the queue.
     *
     * @return A CompletableFuture that completes with the received messages, empty if none are available
     */
    CompletableFuture<List<Message>> receiveMessages();

    /**
     * Acknowledges that a message has been processed successfully.
     *
     * @param messageId The ID of the message to acknowledge
     * @return A CompletableFuture that completes with {@link AckResult#NOT_FOUND} if the message was not in flight
     */
    CompletableFuture<AckResult> acknowledgeMessage(String messageId);

    /**
     * Rejects a message so it is retried after the queue's backoff, or dead-lettered once
     * its attempts are exhausted.
     *
     * @param messageId The ID of the message to reject
     * @return A CompletableFuture that completes with the outcome of the rejection
     */
    CompletableFuture<AckResult> rejectMessage(String messageId);

    /**
     * Rejects a message, dead-lettering it right away when {@code requeue} is false.
     */
    CompletableFuture<AckResult> rejectMessage(String messageId, boolean requeue);

    /**
     * Starts polling the queue. Each message is acknowledged after the callback returns
     * and rejected if the callback throws.
     *
     * @param callback The callback to invoke
     */
    void onMessage(Consumer<Message> callback);

    /**
     * Stops polling and deregisters the consumer.
     */
    void close();
}
