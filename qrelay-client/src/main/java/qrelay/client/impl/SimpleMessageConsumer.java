package qrelay.client.impl;

import qrelay.client.api.MessageConsumer;
import qrelay.core.QRelay;
import qrelay.core.exceptions.ConsumerNotFoundException;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.model.AckResult;
import qrelay.core.model.Message;
import qrelay.core.model.QueueConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A simple implementation of the MessageConsumer interface. Registers itself on the
 * queue when created and deregisters on close.
 */
public class SimpleMessageConsumer implements MessageConsumer {
    private static final Logger logger = LoggerFactory.getLogger(SimpleMessageConsumer.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final QRelay qRelay;
    private final QueueConsumer registration;
    private final Duration pollInterval;
    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    /**
     * Creates a new SimpleMessageConsumer polling once per second.
     *
     * @param qRelay The QRelay instance to use
     * @param queueId The queue to consume from
     * @param name The consumer name shown in the registry
     * @param batchSize The maximum number of messages per receive
     */
    public SimpleMessageConsumer(QRelay qRelay, String queueId, String name, int batchSize) throws QRelayException {
        this(qRelay, queueId, name, batchSize, DEFAULT_POLL_INTERVAL);
    }

    public SimpleMessageConsumer(QRelay qRelay, String queueId, String name, int batchSize, Duration pollInterval)
            throws QRelayException {
        this.qRelay = qRelay;
        this.registration = qRelay.registerConsumer(queueId, name, batchSize);
        this.pollInterval = pollInterval;
        this.executor = Executors.newSingleThreadExecutor();
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @Override
    public String getConsumerId() {
        return registration.consumerId();
    }

    @Override
    public CompletableFuture<List<Message>> receiveMessages() {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return qRelay.receive(registration.queueId(), registration.batchSize());
            } catch (QRelayException e) {
                throw new RuntimeException("Failed to receive messages", e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<AckResult> acknowledgeMessage(String messageId) {
        return CompletableFuture.supplyAsync(() -> qRelay.ack(messageId), executor);
    }

    @Override
    public CompletableFuture<AckResult> rejectMessage(String messageId) {
        return rejectMessage(messageId, true);
    }

    @Override
    public CompletableFuture<AckResult> rejectMessage(String messageId, boolean requeue) {
        return CompletableFuture.supplyAsync(() -> qRelay.nack(messageId, requeue), executor);
    }

    @Override
    public void onMessage(Consumer<Message> callback) {
        if (callback == null) {
            return;
        }
        if (!isRunning.compareAndSet(false, true)) {
            throw new IllegalStateException("Consumer " + registration.consumerId() + " is already polling");
        }
        scheduler.scheduleWithFixedDelay(() -> poll(callback), 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void poll(Consumer<Message> callback) {
        List<Message> batch;
        try {
            batch = qRelay.receive(registration.queueId(), registration.batchSize());
        } catch (QRelayException e) {
            logger.error("Error polling queue {}: {}", registration.queueId(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            logger.error("Error polling queue {}", registration.queueId(), e);
            return;
        }

        for (Message message : batch) {
            try {
                callback.accept(message);
                qRelay.ack(message.messageId());
            } catch (Exception e) {
                logger.warn("Callback failed for message {} (delivery {}), rejecting: {}",
                        message.messageId(), message.deliveryCount(), e.getMessage());
                qRelay.nack(message.messageId(), true);
            }
        }
    }

    @Override
    public void close() {
        isRunning.set(false);
        scheduler.shutdown();
        executor.shutdown();
        try {
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            qRelay.deregisterConsumer(registration.consumerId());
        } catch (ConsumerNotFoundException e) {
            // already gone with its queue
            logger.debug("Consumer {} was already deregistered", registration.consumerId());
        }
        // the QRelay instance may be shared, the caller closes it
    }
}
