package qrelay.core;

import qrelay.config.BrokerConfig;
import qrelay.config.QueueConfig;
import qrelay.core.events.LifecycleEvent;
import qrelay.core.events.LifecycleEvents;
import qrelay.core.events.LifecycleListener;
import qrelay.core.exceptions.CapacityExceededException;
import qrelay.core.exceptions.ConflictException;
import qrelay.core.exceptions.NotEmptyException;
import qrelay.core.exceptions.QueueNotFoundException;
import qrelay.core.exceptions.ValidationException;
import qrelay.core.model.DeliveryMode;
import qrelay.core.model.Message;
import qrelay.core.model.MessageState;
import qrelay.core.model.Queue;
import qrelay.core.model.QueueDiscipline;
import qrelay.core.model.QueueStats;
import qrelay.core.model.SendRequest;
import qrelay.core.store.MessageStore;
import qrelay.core.utils.QUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Owns queue definitions and every queue's live messages.
 * <p>
 * All message mutation goes through this class: {@code send} here, the delivery
 * transitions through the package-private {@code mark*} methods called by the lifecycle
 * engine and the dead-letter router. Callers of those methods hold the queue's lock.
 */
public class QueueStore {
    private static final Logger logger = LoggerFactory.getLogger(QueueStore.class);

    public static final String DLQ_SUFFIX = "-dlq";

    private final Map<String, QueueState> queues = new ConcurrentHashMap<>();
    private final Map<String, String> queueIdsByName = new ConcurrentHashMap<>();

    private final MessageStore messageStore;
    private final Clock clock;
    private final long dedupWindowMillis;
    private final LifecycleListener listener;
    private final AtomicLong sequence;

    public QueueStore(MessageStore messageStore, BrokerConfig config) {
        this.messageStore = messageStore;
        this.clock = config.clock();
        this.dedupWindowMillis = config.dedupWindow().toMillis();
        this.listener = config.listener();
        this.sequence = new AtomicLong(messageStore.maxSequence());
        recover();
    }

    // rebuilds queue bookkeeping from a store that outlived the previous broker
    private void recover() {
        for (Queue queue : messageStore.loadQueues()) {
            QueueState state = new QueueState(queue);
            for (Message message : messageStore.findByQueue(queue.queueId())) {
                if (message.state() == MessageState.PENDING) {
                    state.pending++;
                } else if (message.state() == MessageState.PROCESSING) {
                    state.inFlight++;
                }
            }
            queues.put(queue.queueId(), state);
            queueIdsByName.put(queue.name(), queue.queueId());
            logger.info("Recovered {} queue {} ({}) with {} live message(s)",
                    queue.discipline().getValue(), queue.name(), queue.queueId(), state.live());
        }
    }

    /***************************************************************
     Queue administration
     ****************************************************************/

    public Queue createQueue(String name, QueueDiscipline discipline, QueueConfig config)
            throws ValidationException, ConflictException {
        if (QUtils.isBlank(name)) {
            throw new ValidationException("queue name is required", "name");
        }
        if (discipline == null) {
            throw new ValidationException("queue discipline is required", "discipline");
        }
        if (config == null) {
            throw new ValidationException("queue config is required", "config");
        }
        config.validate();

        final String queueId = QUtils.newId("q");
        final long now = clock.millis();

        if (queueIdsByName.putIfAbsent(name, queueId) != null) {
            throw new ConflictException("Queue already exists: " + name, name);
        }

        String dlqId = null;
        if (discipline != QueueDiscipline.DLQ) {
            String dlqName = name + DLQ_SUFFIX;
            dlqId = QUtils.newId("q");
            if (queueIdsByName.putIfAbsent(dlqName, dlqId) != null) {
                queueIdsByName.remove(name, queueId);
                throw new ConflictException("Queue already exists: " + dlqName, dlqName);
            }
            QueueConfig dlqConfig = new QueueConfig.Builder()
                    .MaxSize(config.maxSize())
                    .TtlSeconds(config.ttlSeconds())
                    .VisibilityTimeoutSeconds(config.visibilityTimeoutSeconds())
                    .MaxRetries(config.maxRetries())
                    .DeliveryMode(DeliveryMode.AT_LEAST_ONCE)
                    .build();
            Queue dlq = new Queue(dlqId, dlqName, QueueDiscipline.DLQ, dlqConfig, null, queueId, now);
            messageStore.putQueue(dlq);
            queues.put(dlqId, new QueueState(dlq));
        }

        Queue queue = new Queue(queueId, name, discipline, config, dlqId, null, now);
        messageStore.putQueue(queue);
        queues.put(queueId, new QueueState(queue));

        logger.info("Created {} queue {} ({}) maxSize={} ttl={}s visibility={}s maxRetries={}{}",
                discipline.getValue(), name, queueId, config.maxSize(), config.ttlSeconds(),
                config.visibilityTimeoutSeconds(), config.maxRetries(),
                dlqId != null ? " dlq=" + dlqId : "");
        return queue;
    }

    public Queue getQueue(String queueId) throws QueueNotFoundException {
        return state(queueId).queue;
    }

    public Optional<Queue> findQueue(String queueId) {
        return findState(queueId).map(s -> s.queue);
    }

    public Optional<Queue> findQueueByName(String name) {
        String queueId = queueIdsByName.get(name);
        return queueId != null ? findQueue(queueId) : Optional.empty();
    }

    public List<Queue> listQueues() {
        return queues.values().stream()
                .map(s -> s.queue)
                .sorted(Comparator.comparingLong(Queue::createdAt).thenComparing(Queue::name))
                .collect(Collectors.toList());
    }

    /**
     * Deletes a queue together with its dead-letter queue.
     *
     * @return ids of the deleted queues
     * @throws NotEmptyException if either queue holds live messages and {@code force} is false
     * @throws ConflictException if {@code queueId} is a dead-letter queue whose origin still exists
     */
    public List<String> deleteQueue(String queueId, boolean force)
            throws QueueNotFoundException, NotEmptyException, ConflictException {
        QueueState state = state(queueId);
        Queue queue = state.queue;
        if (queue.isDeadLetterQueue() && queue.originQueueId() != null && queues.containsKey(queue.originQueueId())) {
            throw new ConflictException("Dead-letter queue " + queue.name() + " belongs to queue " + queue.originQueueId(), queueId);
        }

        QueueState dlqState = queue.dlqId() != null ? queues.get(queue.dlqId()) : null;
        List<String> deleted = new ArrayList<>();
        List<LifecycleEvent> events = new ArrayList<>();

        // origin before dead-letter queue, the same order dead-lettering uses
        state.lock.lock();
        try {
            if (dlqState != null) {
                dlqState.lock.lock();
            }
            try {
                ensureActive(state);
                int live = state.live() + (dlqState != null ? dlqState.live() : 0);
                if (live > 0 && !force) {
                    throw new NotEmptyException(queueId, live);
                }
                if (live > 0) {
                    logger.warn("Force-deleting queue {} ({}): purging {} live message(s)", queue.name(), queueId, live);
                }
                deleted.add(removeLocked(state, events));
                if (dlqState != null && !dlqState.deleted) {
                    deleted.add(removeLocked(dlqState, events));
                }
            } finally {
                if (dlqState != null) {
                    dlqState.lock.unlock();
                }
            }
        } finally {
            state.lock.unlock();
        }

        LifecycleEvents.fire(listener, events);
        logger.info("Deleted queue {} ({}){}", queue.name(), queueId,
                deleted.size() > 1 ? " and its dead-letter queue " + deleted.get(1) : "");
        return deleted;
    }

    private String removeLocked(QueueState state, List<LifecycleEvent> events) {
        int purged = purgeLocked(state, events);
        if (purged > 0) {
            logger.debug("Purged {} message(s) from queue {}", purged, state.queueId());
        }
        messageStore.deleteQueue(state.queueId());
        state.deleted = true;
        queues.remove(state.queueId());
        queueIdsByName.remove(state.queue.name(), state.queueId());
        return state.queueId();
    }

    /**
     * Removes every live message of the queue.
     *
     * @return number of messages removed
     */
    public int purgeQueue(String queueId) throws QueueNotFoundException {
        QueueState state = state(queueId);
        List<LifecycleEvent> events = new ArrayList<>();
        int purged;
        state.lock.lock();
        try {
            ensureActive(state);
            purged = purgeLocked(state, events);
        } finally {
            state.lock.unlock();
        }
        LifecycleEvents.fire(listener, events);
        logger.info("Purged {} message(s) from queue {} ({})", purged, state.queue.name(), queueId);
        return purged;
    }

    private int purgeLocked(QueueState state, List<LifecycleEvent> events) {
        int purged = messageStore.deleteByQueue(state.queueId());
        state.clearCounts();
        if (purged > 0) {
            events.add(new LifecycleEvent(LifecycleEvent.Type.PURGED, state.queueId(), null, 0, clock.millis(),
                    purged + " message(s)"));
        }
        return purged;
    }

    public QueueStats stats(String queueId) throws QueueNotFoundException {
        QueueState state = state(queueId);
        long now = clock.millis();
        state.lock.lock();
        try {
            ensureActive(state);
            Queue queue = state.queue;
            int delayed = (int) messageStore.findByQueue(queueId).stream()
                    .filter(m -> m.state() == MessageState.PENDING && m.visibleAt() > now)
                    .count();
            return new QueueStats(queue.queueId(), queue.name(), queue.discipline(), state.pending, state.inFlight,
                    delayed, queue.config().maxSize(), 0, state.totalSent, state.totalDelivered, state.totalAcked,
                    state.totalRejected, state.totalDeadLettered, state.totalExpired);
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Live (pending plus in-flight) message count of a queue.
     */
    public int depth(String queueId) throws QueueNotFoundException {
        QueueState state = state(queueId);
        state.lock.lock();
        try {
            ensureActive(state);
            return state.live();
        } finally {
            state.lock.unlock();
        }
    }

    /***************************************************************
     Send
     ****************************************************************/

    public Message send(String queueId, SendRequest request)
            throws QueueNotFoundException, ValidationException, CapacityExceededException {
        validate(request);
        QueueState state = state(queueId);
        List<LifecycleEvent> events = new ArrayList<>();
        Message message;
        state.lock.lock();
        try {
            ensureActive(state);
            message = admit(state, request, events);
        } finally {
            state.lock.unlock();
        }
        LifecycleEvents.fire(listener, events);
        return message;
    }

    static void validate(SendRequest request) throws ValidationException {
        if (request == null || request.body() == null) {
            throw new ValidationException("message body is required", "body");
        }
        Integer priority = request.priority();
        if (priority != null && (priority < Message.MIN_PRIORITY || priority > Message.MAX_PRIORITY)) {
            throw new ValidationException("priority must be between " + Message.MIN_PRIORITY + " and "
                    + Message.MAX_PRIORITY + ": " + priority, "priority");
        }
        if (request.delaySeconds() != null && request.delaySeconds() < 0) {
            throw new ValidationException("delay must not be negative: " + request.delaySeconds(), "delaySeconds");
        }
        for (Map.Entry<String, String> attribute : request.attributes().entrySet()) {
            if (attribute.getKey() == null || attribute.getValue() == null) {
                throw new ValidationException("attribute names and values must not be null", "attributes");
            }
        }
    }

    // caller holds state.lock
    Message admit(QueueState state, SendRequest request, List<LifecycleEvent> events) throws CapacityExceededException {
        final Queue queue = state.queue;
        final long now = clock.millis();
        final String dedupId = QUtils.isBlank(request.dedupId()) ? null : request.dedupId();

        if (dedupId != null) {
            Message original = state.findDuplicate(dedupId, now, dedupWindowMillis);
            if (original != null) {
                logger.debug("Suppressed duplicate send on queue {} for dedup id {} (original {})",
                        queue.queueId(), dedupId, original.messageId());
                return original;
            }
        }

        if (state.live() >= queue.config().maxSize()) {
            throw new CapacityExceededException(queue.queueId(), queue.config().maxSize());
        }

        final int delaySeconds = request.delaySeconds() != null ? request.delaySeconds() : queue.config().delaySeconds();
        final Message message = new Message(
                QUtils.newId("msg"),
                queue.queueId(),
                request.body(),
                request.attributes(),
                request.priority() != null ? request.priority() : Message.DEFAULT_PRIORITY,
                MessageState.PENDING,
                0,
                null,
                null,
                now + delaySeconds * 1000L,
                now,
                now + queue.config().ttlSeconds() * 1000L,
                dedupId,
                QUtils.isBlank(request.groupId()) ? null : request.groupId(),
                sequence.incrementAndGet());

        messageStore.put(message);
        state.pending++;
        state.totalSent++;
        if (dedupId != null) {
            state.rememberDedup(dedupId, message, now);
        }
        events.add(event(LifecycleEvent.Type.SENT, message, now, null));
        return message;
    }

    /***************************************************************
     Delivery transitions, caller holds state.lock
     ****************************************************************/

    Message markDelivered(QueueState state, Message message, long now, long visibleUntil, List<LifecycleEvent> events) {
        Message delivered = message.delivered(now, visibleUntil);
        state.pending--;
        state.totalDelivered++;

        if (state.queue.config().deliveryMode() == DeliveryMode.AT_MOST_ONCE) {
            // completed on hand-out, a consumer crash loses the message
            messageStore.delete(message.messageId());
            Message completed = delivered.withState(MessageState.COMPLETED);
            events.add(event(LifecycleEvent.Type.DELIVERED, completed, now, "at-most-once"));
            return completed;
        }

        messageStore.put(delivered);
        state.inFlight++;
        events.add(event(LifecycleEvent.Type.DELIVERED, delivered, now, null));
        return delivered;
    }

    Message markCompleted(QueueState state, Message message, List<LifecycleEvent> events) {
        messageStore.delete(message.messageId());
        state.inFlight--;
        state.totalAcked++;
        Message completed = message.withState(MessageState.COMPLETED);
        events.add(event(LifecycleEvent.Type.ACKED, completed, clock.millis(), null));
        return completed;
    }

    Message markRequeued(QueueState state, Message message, long visibleAt, List<LifecycleEvent> events) {
        Message requeued = message.requeued(visibleAt);
        messageStore.put(requeued);
        state.inFlight--;
        state.pending++;
        state.totalRejected++;
        events.add(event(LifecycleEvent.Type.REQUEUED, requeued, clock.millis(), "visible at " + QUtils.millisToDateTime(visibleAt)));
        return requeued;
    }

    Message markDeadLettered(QueueState state, Message message, String reason, List<LifecycleEvent> events) {
        messageStore.delete(message.messageId());
        if (message.state() == MessageState.PROCESSING) {
            state.inFlight--;
            state.totalRejected++;
        } else {
            state.pending--;
        }
        state.totalDeadLettered++;
        Message deadLettered = message.withState(MessageState.DEAD_LETTERED);
        events.add(event(LifecycleEvent.Type.DEAD_LETTERED, deadLettered, clock.millis(), reason));
        return deadLettered;
    }

    void markExpired(QueueState state, Message message, List<LifecycleEvent> events) {
        messageStore.delete(message.messageId());
        state.pending--;
        state.totalExpired++;
        events.add(event(LifecycleEvent.Type.EXPIRED, message, clock.millis(), null));
    }

    private static LifecycleEvent event(LifecycleEvent.Type type, Message message, long now, String detail) {
        return new LifecycleEvent(type, message.queueId(), message.messageId(), message.deliveryCount(), now, detail);
    }

    /***************************************************************
     Internal access for the engine components
     ****************************************************************/

    QueueState state(String queueId) throws QueueNotFoundException {
        QueueState state = queueId != null ? queues.get(queueId) : null;
        if (state == null) {
            throw new QueueNotFoundException(queueId);
        }
        return state;
    }

    Optional<QueueState> findState(String queueId) {
        return Optional.ofNullable(queueId != null ? queues.get(queueId) : null);
    }

    Collection<QueueState> states() {
        return queues.values();
    }

    // caller holds state.lock
    void ensureActive(QueueState state) throws QueueNotFoundException {
        if (state.deleted) {
            throw new QueueNotFoundException(state.queueId());
        }
    }

    MessageStore messageStore() {
        return messageStore;
    }

    Clock clock() {
        return clock;
    }

    LifecycleListener listener() {
        return listener;
    }
}
