package qrelay.core;

import qrelay.core.exceptions.BindingException;
import qrelay.core.exceptions.ConflictException;
import qrelay.core.exceptions.ExchangeNotFoundException;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.exceptions.ValidationException;
import qrelay.core.model.Binding;
import qrelay.core.model.Exchange;
import qrelay.core.model.ExchangeType;
import qrelay.core.model.PublishResult;
import qrelay.core.model.SendRequest;
import qrelay.core.utils.QUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Routes published messages to the queues bound to an exchange. Every match is an
 * ordinary send on the queue store, so capacity and validation apply per destination.
 */
public class ExchangeRouter {
    private static final Logger logger = LoggerFactory.getLogger(ExchangeRouter.class);

    private final QueueStore queueStore;
    private final Map<String, Exchange> exchanges = new ConcurrentHashMap<>();
    private final Map<String, String> exchangeIdsByName = new ConcurrentHashMap<>();

    public ExchangeRouter(QueueStore queueStore) {
        this.queueStore = queueStore;
    }

    /***************************************************************
     Exchange administration
     ****************************************************************/

    public Exchange createExchange(String name, ExchangeType type) throws ValidationException, ConflictException {
        if (QUtils.isBlank(name)) {
            throw new ValidationException("exchange name is required", "name");
        }
        if (type == null) {
            throw new ValidationException("exchange type is required", "type");
        }

        String exchangeId = QUtils.newId("ex");
        if (exchangeIdsByName.putIfAbsent(name, exchangeId) != null) {
            throw new ConflictException("Exchange already exists: " + name, name);
        }
        Exchange exchange = new Exchange(exchangeId, name, type, List.of(), queueStore.clock().millis());
        exchanges.put(exchangeId, exchange);

        logger.info("Created {} exchange {} ({})", type.getValue(), name, exchangeId);
        return exchange;
    }

    public Exchange getExchange(String exchangeId) throws ExchangeNotFoundException {
        Exchange exchange = exchangeId != null ? exchanges.get(exchangeId) : null;
        if (exchange == null) {
            throw new ExchangeNotFoundException(exchangeId);
        }
        return exchange;
    }

    public Optional<Exchange> findExchangeByName(String name) {
        String exchangeId = name != null ? exchangeIdsByName.get(name) : null;
        return exchangeId != null ? Optional.ofNullable(exchanges.get(exchangeId)) : Optional.empty();
    }

    public List<Exchange> listExchanges() {
        return exchanges.values().stream()
                .sorted(Comparator.comparingLong(Exchange::createdAt).thenComparing(Exchange::name))
                .collect(Collectors.toList());
    }

    public int countExchanges() {
        return exchanges.size();
    }

    public void deleteExchange(String exchangeId) throws ExchangeNotFoundException {
        Exchange removed = exchangeId != null ? exchanges.remove(exchangeId) : null;
        if (removed == null) {
            throw new ExchangeNotFoundException(exchangeId);
        }
        exchangeIdsByName.remove(removed.name(), exchangeId);
        logger.info("Deleted exchange {} ({}) with {} binding(s)", removed.name(), exchangeId, removed.bindings().size());
    }

    /***************************************************************
     Bindings
     ****************************************************************/

    /**
     * Binds a queue to an exchange. Binding the same queue and key twice is a no-op.
     *
     * @throws BindingException if the queue does not exist
     */
    public Exchange bind(String exchangeId, String queueId, String routingKey)
            throws ExchangeNotFoundException, BindingException {
        getExchange(exchangeId);
        if (queueStore.findQueue(queueId).isEmpty()) {
            throw new BindingException("Cannot bind to unknown queue: " + queueId, queueId);
        }

        Binding binding = new Binding(queueId, routingKey);
        Exchange updated = exchanges.computeIfPresent(exchangeId, (id, exchange) -> {
            if (exchange.bindings().contains(binding)) {
                return exchange;
            }
            List<Binding> bindings = new ArrayList<>(exchange.bindings());
            bindings.add(binding);
            return new Exchange(exchange.exchangeId(), exchange.name(), exchange.type(), bindings, exchange.createdAt());
        });
        if (updated == null) {
            throw new ExchangeNotFoundException(exchangeId);
        }

        logger.info("Bound queue {} to exchange {} with key '{}'", queueId, updated.name(), binding.routingKey());
        return updated;
    }

    /**
     * @return true if a binding was removed
     */
    public boolean unbind(String exchangeId, String queueId, String routingKey) throws ExchangeNotFoundException {
        getExchange(exchangeId);
        Binding binding = new Binding(queueId, routingKey);
        boolean[] removed = new boolean[1];
        exchanges.computeIfPresent(exchangeId, (id, exchange) -> {
            List<Binding> bindings = new ArrayList<>(exchange.bindings());
            removed[0] = bindings.remove(binding);
            return removed[0]
                    ? new Exchange(exchange.exchangeId(), exchange.name(), exchange.type(), bindings, exchange.createdAt())
                    : exchange;
        });

        if (removed[0]) {
            logger.info("Unbound queue {} from exchange {} (key '{}')", queueId, exchangeId, binding.routingKey());
        }
        return removed[0];
    }

    // drops every binding that points at one of the given queues
    void removeBindingsFor(Collection<String> queueIds) {
        for (String exchangeId : new ArrayList<>(exchanges.keySet())) {
            exchanges.computeIfPresent(exchangeId, (id, exchange) -> {
                List<Binding> kept = exchange.bindings().stream()
                        .filter(b -> !queueIds.contains(b.queueId()))
                        .collect(Collectors.toList());
                if (kept.size() == exchange.bindings().size()) {
                    return exchange;
                }
                logger.debug("Removed {} binding(s) from exchange {}", exchange.bindings().size() - kept.size(), exchange.name());
                return new Exchange(exchange.exchangeId(), exchange.name(), exchange.type(), kept, exchange.createdAt());
            });
        }
    }

    /***************************************************************
     Publish
     ****************************************************************/

    public PublishResult publish(String exchangeId, String body, String routingKey)
            throws ExchangeNotFoundException, ValidationException {
        return publish(exchangeId, body, routingKey, Map.of());
    }

    /**
     * Sends one copy of the message to every queue whose binding matches the routing key.
     * A queue matched by several bindings receives one copy. A destination that rejects
     * the send is logged and reported in {@link PublishResult#rejectedQueueIds()}.
     */
    public PublishResult publish(String exchangeId, String body, String routingKey, Map<String, String> attributes)
            throws ExchangeNotFoundException, ValidationException {
        Exchange exchange = getExchange(exchangeId);
        SendRequest request = SendRequest.of(body, attributes);
        QueueStore.validate(request);
        String key = routingKey == null ? "" : routingKey;

        Set<String> targets = new LinkedHashSet<>();
        for (Binding binding : exchange.bindings()) {
            if (exchange.type().matches(binding.routingKey(), key)) {
                targets.add(binding.queueId());
            }
        }

        List<String> delivered = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (String queueId : targets) {
            try {
                queueStore.send(queueId, request);
                delivered.add(queueId);
            } catch (QRelayException e) {
                rejected.add(queueId);
                logger.warn("Publish to exchange {} could not deliver to queue {}: {}", exchange.name(), queueId, e.getMessage());
            }
        }

        logger.debug("Published to exchange {} with key '{}': {} matched, {} rejected",
                exchange.name(), key, delivered.size(), rejected.size());
        return new PublishResult(exchangeId, delivered, rejected);
    }
}
