package qrelay.core;

import qrelay.core.events.LifecycleEvent;
import qrelay.core.events.LifecycleEvents;
import qrelay.core.exceptions.QueueNotFoundException;
import qrelay.core.exceptions.ValidationException;
import qrelay.core.model.AckResult;
import qrelay.core.model.Message;
import qrelay.core.model.MessageState;
import qrelay.core.model.Queue;
import qrelay.core.retry.BackoffPolicy;
import qrelay.core.store.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Delivery state machine: {@code PENDING -> PROCESSING -> COMPLETED | PENDING (retry) | DEAD_LETTERED}.
 * <p>
 * Every operation runs under the lock of the queue it touches, so two receives on the
 * same queue never hand out the same message while receives on different queues run in
 * parallel.
 */
public class MessageLifecycleEngine {
    private static final Logger logger = LoggerFactory.getLogger(MessageLifecycleEngine.class);

    private final QueueStore queueStore;
    private final DeadLetterRouter deadLetterRouter;
    private final BackoffPolicy backoffPolicy;
    private final MessageStore messageStore;

    public MessageLifecycleEngine(QueueStore queueStore, DeadLetterRouter deadLetterRouter, BackoffPolicy backoffPolicy) {
        this.queueStore = queueStore;
        this.deadLetterRouter = deadLetterRouter;
        this.backoffPolicy = backoffPolicy;
        this.messageStore = queueStore.messageStore();
    }

    /***************************************************************
     Receive
     ****************************************************************/

    public List<Message> receive(String queueId, int maxMessages) throws QueueNotFoundException, ValidationException {
        return receive(queueId, maxMessages, null);
    }

    /**
     * Hands out up to {@code maxMessages} eligible messages and hides them for the
     * visibility timeout. Returns an empty list immediately when nothing is eligible.
     *
     * @param visibilityTimeoutSeconds overrides the queue's visibility timeout when not null
     */
    public List<Message> receive(String queueId, int maxMessages, Integer visibilityTimeoutSeconds)
            throws QueueNotFoundException, ValidationException {
        if (maxMessages < 1) {
            throw new ValidationException("maxMessages must be at least 1: " + maxMessages, "maxMessages");
        }
        if (visibilityTimeoutSeconds != null && visibilityTimeoutSeconds < 0) {
            throw new ValidationException("visibility timeout must not be negative: " + visibilityTimeoutSeconds,
                    "visibilityTimeoutSeconds");
        }

        QueueState state = queueStore.state(queueId);
        List<LifecycleEvent> events = new ArrayList<>();
        List<Message> received = new ArrayList<>();

        state.lock.lock();
        try {
            queueStore.ensureActive(state);
            final long now = queueStore.clock().millis();
            sweepLocked(state, now, events);

            Queue queue = state.queue;
            int visibilitySeconds = visibilityTimeoutSeconds != null
                    ? visibilityTimeoutSeconds : queue.config().visibilityTimeoutSeconds();
            long visibleUntil = now + visibilitySeconds * 1000L;

            for (Message candidate : selectEligible(queue, now, maxMessages)) {
                received.add(queueStore.markDelivered(state, candidate, now, visibleUntil, events));
            }
        } finally {
            state.lock.unlock();
        }

        LifecycleEvents.fire(queueStore.listener(), events);
        return received;
    }

    // caller holds the queue lock
    private List<Message> selectEligible(Queue queue, long now, int maxMessages) {
        if (!queue.discipline().isGroupOrdered()) {
            return messageStore.scanByVisibleAt(queue.queueId(), now).stream()
                    .filter(m -> m.isVisibleAt(now))
                    .sorted(queue.discipline().selectionOrder())
                    .limit(maxMessages)
                    .collect(Collectors.toList());
        }

        // An ordering group is blocked from its first message that cannot be delivered now
        // (in flight, waiting out a retry backoff or delayed) onwards, and hands out at
        // most one message per receive.
        List<Message> selected = new ArrayList<>();
        Set<String> blockedGroups = new HashSet<>();
        List<Message> inOrder = new ArrayList<>(messageStore.findByQueue(queue.queueId()));
        inOrder.sort(queue.discipline().selectionOrder());
        for (Message message : inOrder) {
            if (selected.size() >= maxMessages) {
                break;
            }
            boolean eligible = message.isVisibleAt(now);
            if (message.hasGroup()) {
                // the first message seen of a group decides for the whole group
                if (!blockedGroups.add(message.groupId()) || !eligible) {
                    continue;
                }
            } else if (!eligible) {
                continue;
            }
            selected.add(message);
        }
        return selected;
    }

    /***************************************************************
     Ack / Nack
     ****************************************************************/

    /**
     * Completes an in-flight message. Unknown, already completed or not in-flight ids
     * return {@link AckResult#NOT_FOUND}; duplicate acks are expected under
     * at-least-once delivery.
     */
    public AckResult ack(String messageId) {
        Optional<QueueState> found = owningQueue(messageId);
        if (found.isEmpty()) {
            logger.debug("Ack for unknown message {}", messageId);
            return AckResult.NOT_FOUND;
        }

        QueueState state = found.get();
        List<LifecycleEvent> events = new ArrayList<>();
        AckResult result = AckResult.NOT_FOUND;
        state.lock.lock();
        try {
            Optional<Message> current = inFlight(state, messageId);
            if (current.isPresent()) {
                queueStore.markCompleted(state, current.get(), events);
                result = AckResult.OK;
            }
        } finally {
            state.lock.unlock();
        }

        if (result == AckResult.NOT_FOUND) {
            logger.debug("Ack for message {} that is not in flight", messageId);
        }
        LifecycleEvents.fire(queueStore.listener(), events);
        return result;
    }

    public AckResult nack(String messageId) {
        return nack(messageId, true);
    }

    /**
     * Rejects an in-flight message. With {@code requeue} and attempts left the message
     * becomes visible again after the backoff delay, otherwise it is dead-lettered.
     */
    public AckResult nack(String messageId, boolean requeue) {
        Optional<QueueState> found = owningQueue(messageId);
        if (found.isEmpty()) {
            logger.debug("Nack for unknown message {}", messageId);
            return AckResult.NOT_FOUND;
        }

        QueueState state = found.get();
        List<LifecycleEvent> events = new ArrayList<>();
        AckResult result = AckResult.NOT_FOUND;
        state.lock.lock();
        try {
            Optional<Message> current = inFlight(state, messageId);
            if (current.isPresent()) {
                reject(state, current.get(), requeue,
                        requeue ? "rejected by consumer" : "rejected by consumer without requeue",
                        queueStore.clock().millis(), events);
                result = AckResult.OK;
            }
        } finally {
            state.lock.unlock();
        }

        if (result == AckResult.NOT_FOUND) {
            logger.debug("Nack for message {} that is not in flight", messageId);
        }
        LifecycleEvents.fire(queueStore.listener(), events);
        return result;
    }

    private Optional<QueueState> owningQueue(String messageId) {
        if (messageId == null) {
            return Optional.empty();
        }
        return messageStore.get(messageId).flatMap(m -> queueStore.findState(m.queueId()));
    }

    // re-read under the lock, the snapshot seen before locking may be stale
    private Optional<Message> inFlight(QueueState state, String messageId) {
        if (state.deleted) {
            return Optional.empty();
        }
        return messageStore.get(messageId).filter(m -> m.state() == MessageState.PROCESSING);
    }

    // caller holds the queue lock
    private void reject(QueueState state, Message message, boolean requeue, String reason, long now,
                        List<LifecycleEvent> events) {
        int maxAttempts = state.queue.maxAttempts();
        if (requeue && message.deliveryCount() < maxAttempts) {
            long visibleAt = now + backoffPolicy.delayMillis(message.deliveryCount());
            queueStore.markRequeued(state, message, visibleAt, events);
            return;
        }

        String why = requeue
                ? reason + ", max delivery attempts (" + maxAttempts + ") exhausted"
                : reason;
        deadLetterRouter.deadLetterLocked(state, message, why, events);
    }

    /***************************************************************
     Visibility-expiry sweep
     ****************************************************************/

    /**
     * Sweeps every queue: in-flight messages whose visibility timeout passed are treated
     * as an implicit {@code nack(requeue=true)} and pending messages past their TTL are
     * removed.
     *
     * @return number of messages requeued, dead-lettered or expired
     */
    public int sweepExpired() {
        int swept = 0;
        for (QueueState state : new ArrayList<>(queueStore.states())) {
            List<LifecycleEvent> events = new ArrayList<>();
            state.lock.lock();
            try {
                if (state.deleted) {
                    continue;
                }
                long now = queueStore.clock().millis();
                swept += sweepLocked(state, now, events);
                swept += expireLocked(state, now, events);
            } catch (RuntimeException e) {
                logger.error("Sweep failed for queue {}: {}", state.queueId(), e.getMessage(), e);
            } finally {
                state.lock.unlock();
            }
            LifecycleEvents.fire(queueStore.listener(), events);
        }
        if (swept > 0) {
            logger.debug("Visibility sweep processed {} message(s)", swept);
        }
        return swept;
    }

    // caller holds the queue lock
    private int sweepLocked(QueueState state, long now, List<LifecycleEvent> events) {
        int swept = 0;
        for (Message message : messageStore.scanByVisibleAt(state.queueId(), now)) {
            try {
                if (message.state() == MessageState.PROCESSING) {
                    reject(state, message, true, "visibility timeout expired", now, events);
                    swept++;
                } else if (message.state() == MessageState.PENDING && message.isExpiredAt(now)) {
                    queueStore.markExpired(state, message, events);
                    swept++;
                }
            } catch (RuntimeException e) {
                logger.error("Sweep failed for message {} on queue {}: {}", message.messageId(), state.queueId(), e.getMessage(), e);
            }
        }
        return swept;
    }

    // TTL pass over messages that are not yet visible, the visible ones are covered by sweepLocked
    private int expireLocked(QueueState state, long now, List<LifecycleEvent> events) {
        int expired = 0;
        for (Message message : messageStore.findByQueue(state.queueId())) {
            if (message.state() != MessageState.PENDING || !message.isExpiredAt(now)) {
                continue;
            }
            try {
                queueStore.markExpired(state, message, events);
                expired++;
            } catch (RuntimeException e) {
                logger.error("Expiry failed for message {} on queue {}: {}", message.messageId(), state.queueId(), e.getMessage(), e);
            }
        }
        return expired;
    }
}
