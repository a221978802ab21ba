package qrelay.core;

import qrelay.core.exceptions.ConsumerNotFoundException;
import qrelay.core.exceptions.QueueNotFoundException;
import qrelay.core.exceptions.ValidationException;
import qrelay.core.model.Queue;
import qrelay.core.model.QueueConsumer;
import qrelay.core.utils.QUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Bookkeeping of registered consumers. Delivery does not depend on registration.
 */
public class ConsumerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConsumerRegistry.class);

    private final QueueStore queueStore;
    private final Map<String, QueueConsumer> consumers = new ConcurrentHashMap<>();

    public ConsumerRegistry(QueueStore queueStore) {
        this.queueStore = queueStore;
    }

    public QueueConsumer register(String queueId, String name, int batchSize)
            throws QueueNotFoundException, ValidationException {
        if (batchSize < 1) {
            throw new ValidationException("batchSize must be at least 1: " + batchSize, "batchSize");
        }
        Queue queue = queueStore.getQueue(queueId);
        String consumerName = QUtils.isBlank(name) ? "consumer" : name;

        QueueConsumer consumer = new QueueConsumer(QUtils.newId("cons"), queue.queueId(), consumerName, batchSize,
                queueStore.clock().millis());
        consumers.put(consumer.consumerId(), consumer);

        logger.info("Registered consumer {} ({}) on queue {} with batch size {}",
                consumerName, consumer.consumerId(), queue.name(), batchSize);
        return consumer;
    }

    public void deregister(String consumerId) throws ConsumerNotFoundException {
        QueueConsumer removed = consumerId != null ? consumers.remove(consumerId) : null;
        if (removed == null) {
            throw new ConsumerNotFoundException(consumerId);
        }
        logger.info("Deregistered consumer {} ({})", removed.name(), consumerId);
    }

    public QueueConsumer getConsumer(String consumerId) throws ConsumerNotFoundException {
        QueueConsumer consumer = consumerId != null ? consumers.get(consumerId) : null;
        if (consumer == null) {
            throw new ConsumerNotFoundException(consumerId);
        }
        return consumer;
    }

    public List<QueueConsumer> listConsumers() {
        return consumers.values().stream()
                .sorted(Comparator.comparingLong(QueueConsumer::registeredAt).thenComparing(QueueConsumer::consumerId))
                .collect(Collectors.toList());
    }

    public List<QueueConsumer> listConsumers(String queueId) {
        return listConsumers().stream()
                .filter(c -> c.queueId().equals(queueId))
                .collect(Collectors.toList());
    }

    public int countConsumers(String queueId) {
        return (int) consumers.values().stream().filter(c -> c.queueId().equals(queueId)).count();
    }

    public int countConsumers() {
        return consumers.size();
    }

    void removeFor(Collection<String> queueIds) {
        consumers.values().removeIf(c -> {
            boolean bound = queueIds.contains(c.queueId());
            if (bound) {
                logger.debug("Deregistered consumer {} of deleted queue {}", c.consumerId(), c.queueId());
            }
            return bound;
        });
    }
}
