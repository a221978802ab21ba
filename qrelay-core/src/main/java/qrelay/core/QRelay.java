package qrelay.core;

import qrelay.config.BrokerConfig;
import qrelay.config.QueueConfig;
import qrelay.core.exceptions.BindingException;
import qrelay.core.exceptions.CapacityExceededException;
import qrelay.core.exceptions.ConflictException;
import qrelay.core.exceptions.ConsumerNotFoundException;
import qrelay.core.exceptions.ExchangeNotFoundException;
import qrelay.core.exceptions.NotEmptyException;
import qrelay.core.exceptions.QueueNotFoundException;
import qrelay.core.exceptions.ValidationException;
import qrelay.core.model.AckResult;
import qrelay.core.model.BrokerStats;
import qrelay.core.model.DeadLetterEntry;
import qrelay.core.model.Exchange;
import qrelay.core.model.ExchangeType;
import qrelay.core.model.Message;
import qrelay.core.model.PublishResult;
import qrelay.core.model.Queue;
import qrelay.core.model.QueueConsumer;
import qrelay.core.model.QueueDiscipline;
import qrelay.core.model.QueueStats;
import qrelay.core.model.ReplayResult;
import qrelay.core.model.SendRequest;
import qrelay.core.store.InMemoryMessageStore;
import qrelay.core.store.MessageStore;
import qrelay.core.store.SqliteMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One broker instance: the queue store, lifecycle engine, dead-letter router, exchange
 * router and consumer registry wired over a single message store.
 * <p>
 * Thread-safe. Instances are meant to be shared by reference and closed once.
 */
public class QRelay implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(QRelay.class);

    private final BrokerConfig config;
    private final MessageStore messageStore;
    private final QueueStore queueStore;
    private final DeadLetterRouter deadLetterRouter;
    private final MessageLifecycleEngine engine;
    private final ExchangeRouter exchangeRouter;
    private final ConsumerRegistry consumerRegistry;
    private final VisibilitySweeper sweeper;

    public QRelay() throws ValidationException {
        this(BrokerConfig.defaults());
    }

    public QRelay(BrokerConfig config) throws ValidationException {
        this(config, openStore(config));
    }

    /**
     * Wires a broker over a caller-supplied store. The store is closed with the broker.
     */
    public QRelay(BrokerConfig config, MessageStore messageStore) throws ValidationException {
        config.validate();
        this.config = config;
        this.messageStore = messageStore;
        this.queueStore = new QueueStore(messageStore, config);
        this.deadLetterRouter = new DeadLetterRouter(queueStore);
        this.engine = new MessageLifecycleEngine(queueStore, deadLetterRouter, config.backoffPolicy());
        this.exchangeRouter = new ExchangeRouter(queueStore);
        this.consumerRegistry = new ConsumerRegistry(queueStore);

        if (config.sweepInterval().isZero()) {
            this.sweeper = null;
        } else {
            this.sweeper = new VisibilitySweeper(engine, config.sweepInterval());
            this.sweeper.start();
        }
        logger.info("QRelay started with {} message store", config.storeType());
    }

    private static MessageStore openStore(BrokerConfig config) throws ValidationException {
        config.validate();
        return switch (config.storeType()) {
            case MEMORY -> new InMemoryMessageStore();
            case SQLITE -> new SqliteMessageStore(config.dbPath(), config.sqliteCacheSize());
        };
    }

    /***************************************************************
     Queues
     ****************************************************************/

    public Queue createQueue(String name, QueueDiscipline discipline) throws ValidationException, ConflictException {
        return queueStore.createQueue(name, discipline, QueueConfig.defaults());
    }

    public Queue createQueue(String name, QueueDiscipline discipline, QueueConfig queueConfig)
            throws ValidationException, ConflictException {
        return queueStore.createQueue(name, discipline, queueConfig);
    }

    public Queue getQueue(String queueId) throws QueueNotFoundException {
        return queueStore.getQueue(queueId);
    }

    public Optional<Queue> findQueueByName(String name) {
        return queueStore.findQueueByName(name);
    }

    public List<Queue> listQueues() {
        return queueStore.listQueues();
    }

    /**
     * Deletes a queue and its dead-letter queue, then drops every binding, consumer and
     * dead-letter entry that referenced them.
     *
     * @return ids of the deleted queues
     */
    public List<String> deleteQueue(String queueId, boolean force)
            throws QueueNotFoundException, NotEmptyException, ConflictException {
        List<String> deleted = queueStore.deleteQueue(queueId, force);
        exchangeRouter.removeBindingsFor(deleted);
        consumerRegistry.removeFor(deleted);
        deadLetterRouter.dropEntries(deleted);
        return deleted;
    }

    public int purgeQueue(String queueId) throws QueueNotFoundException {
        return queueStore.purgeQueue(queueId);
    }

    public QueueStats queueStats(String queueId) throws QueueNotFoundException {
        return queueStore.stats(queueId).withConsumers(consumerRegistry.countConsumers(queueId));
    }

    public int depth(String queueId) throws QueueNotFoundException {
        return queueStore.depth(queueId);
    }

    /***************************************************************
     Messages
     ****************************************************************/

    public Message send(String queueId, String body) throws QueueNotFoundException, ValidationException, CapacityExceededException {
        return queueStore.send(queueId, SendRequest.of(body));
    }

    public Message send(String queueId, SendRequest request)
            throws QueueNotFoundException, ValidationException, CapacityExceededException {
        return queueStore.send(queueId, request);
    }

    public List<Message> receive(String queueId, int maxMessages) throws QueueNotFoundException, ValidationException {
        return engine.receive(queueId, maxMessages);
    }

    public List<Message> receive(String queueId, int maxMessages, Integer visibilityTimeoutSeconds)
            throws QueueNotFoundException, ValidationException {
        return engine.receive(queueId, maxMessages, visibilityTimeoutSeconds);
    }

    public AckResult ack(String messageId) {
        return engine.ack(messageId);
    }

    public AckResult nack(String messageId) {
        return engine.nack(messageId);
    }

    public AckResult nack(String messageId, boolean requeue) {
        return engine.nack(messageId, requeue);
    }

    public int sweepExpired() {
        return engine.sweepExpired();
    }

    /***************************************************************
     Dead letters
     ****************************************************************/

    public AckResult deadLetter(String messageId, String reason) {
        return deadLetterRouter.deadLetter(messageId, reason);
    }

    public ReplayResult replayDeadLetters(String queueId, int limit) throws QueueNotFoundException, ValidationException {
        return deadLetterRouter.replayDeadLetters(queueId, limit);
    }

    public List<DeadLetterEntry> listDeadLetters(String queueId) throws QueueNotFoundException {
        queueStore.getQueue(queueId);
        return deadLetterRouter.listDeadLetters(queueId);
    }

    public int purgeDeadLetters(String queueId) throws QueueNotFoundException {
        return deadLetterRouter.purgeDeadLetters(queueId);
    }

    /***************************************************************
     Exchanges
     ****************************************************************/

    public Exchange createExchange(String name, ExchangeType type) throws ValidationException, ConflictException {
        return exchangeRouter.createExchange(name, type);
    }

    public Exchange getExchange(String exchangeId) throws ExchangeNotFoundException {
        return exchangeRouter.getExchange(exchangeId);
    }

    public Optional<Exchange> findExchangeByName(String name) {
        return exchangeRouter.findExchangeByName(name);
    }

    public List<Exchange> listExchanges() {
        return exchangeRouter.listExchanges();
    }

    public void deleteExchange(String exchangeId) throws ExchangeNotFoundException {
        exchangeRouter.deleteExchange(exchangeId);
    }

    public Exchange bind(String exchangeId, String queueId, String routingKey)
            throws ExchangeNotFoundException, BindingException {
        return exchangeRouter.bind(exchangeId, queueId, routingKey);
    }

    public boolean unbind(String exchangeId, String queueId, String routingKey) throws ExchangeNotFoundException {
        return exchangeRouter.unbind(exchangeId, queueId, routingKey);
    }

    public PublishResult publish(String exchangeId, String body, String routingKey)
            throws ExchangeNotFoundException, ValidationException {
        return exchangeRouter.publish(exchangeId, body, routingKey);
    }

    public PublishResult publish(String exchangeId, String body, String routingKey, Map<String, String> attributes)
            throws ExchangeNotFoundException, ValidationException {
        return exchangeRouter.publish(exchangeId, body, routingKey, attributes);
    }

    /***************************************************************
     Consumers
     ****************************************************************/

    public QueueConsumer registerConsumer(String queueId, String name, int batchSize)
            throws QueueNotFoundException, ValidationException {
        return consumerRegistry.register(queueId, name, batchSize);
    }

    public void deregisterConsumer(String consumerId) throws ConsumerNotFoundException {
        consumerRegistry.deregister(consumerId);
    }

    public QueueConsumer getConsumer(String consumerId) throws ConsumerNotFoundException {
        return consumerRegistry.getConsumer(consumerId);
    }

    public List<QueueConsumer> listConsumers() {
        return consumerRegistry.listConsumers();
    }

    public List<QueueConsumer> listConsumers(String queueId) {
        return consumerRegistry.listConsumers(queueId);
    }

    /***************************************************************
     Broker
     ****************************************************************/

    public BrokerStats stats() {
        Map<QueueDiscipline, Integer> byDiscipline = new EnumMap<>(QueueDiscipline.class);
        long pending = 0;
        long inFlight = 0;
        int queues = 0;
        for (Queue queue : queueStore.listQueues()) {
            try {
                QueueStats stats = queueStore.stats(queue.queueId());
                pending += stats.pending();
                inFlight += stats.inFlight();
                queues++;
                byDiscipline.merge(queue.discipline(), 1, Integer::sum);
            } catch (QueueNotFoundException e) {
                logger.debug("Queue {} deleted while collecting stats", queue.queueId());
            }
        }
        return new BrokerStats(queues, exchangeRouter.countExchanges(), consumerRegistry.countConsumers(),
                pending, inFlight, deadLetterRouter.countDeadLetters(), byDiscipline);
    }

    public BrokerConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.close();
        }
        messageStore.close();
        logger.info("QRelay closed");
    }
}
