package qrelay.core.store;

import qrelay.core.model.Message;
import qrelay.core.model.Queue;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryMessageStore implements MessageStore {

    private final Map<String, Message> messages = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Message>> messagesByQueue = new ConcurrentHashMap<>();
    private final Map<String, Queue> queues = new ConcurrentHashMap<>();

    @Override
    public Optional<Message> get(String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    @Override
    public void put(Message message) {
        messages.put(message.messageId(), message);
        messagesByQueue.computeIfAbsent(message.queueId(), id -> new ConcurrentHashMap<>())
                .put(message.messageId(), message);
    }

    @Override
    public boolean delete(String messageId) {
        Message removed = messages.remove(messageId);
        if (removed == null) {
            return false;
        }
        Map<String, Message> queueMessages = messagesByQueue.get(removed.queueId());
        if (queueMessages != null) {
            queueMessages.remove(messageId);
        }
        return true;
    }

    @Override
    public List<Message> scanByVisibleAt(String queueId, long visibleAtOrBefore) {
        return queueMessages(queueId).stream()
                .filter(m -> m.visibleAt() <= visibleAtOrBefore)
                .sorted(Comparator.comparingLong(Message::visibleAt).thenComparingLong(Message::sequence))
                .collect(Collectors.toList());
    }

    @Override
    public List<Message> findByQueue(String queueId) {
        return queueMessages(queueId).stream()
                .sorted(Comparator.comparingLong(Message::sequence))
                .collect(Collectors.toList());
    }

    @Override
    public int deleteByQueue(String queueId) {
        Map<String, Message> queueMessages = messagesByQueue.remove(queueId);
        if (queueMessages == null) {
            return 0;
        }
        queueMessages.keySet().forEach(messages::remove);
        return queueMessages.size();
    }

    @Override
    public long maxSequence() {
        return messages.values().stream().mapToLong(Message::sequence).max().orElse(0L);
    }

    @Override
    public void putQueue(Queue queue) {
        queues.put(queue.queueId(), queue);
    }

    @Override
    public boolean deleteQueue(String queueId) {
        return queues.remove(queueId) != null;
    }

    @Override
    public List<Queue> loadQueues() {
        return queues.values().stream()
                .sorted(Comparator.comparingLong(Queue::createdAt).thenComparing(Queue::name))
                .collect(Collectors.toList());
    }

    @Override
    public void close() {
        messages.clear();
        messagesByQueue.clear();
        queues.clear();
    }

    private Collection<Message> queueMessages(String queueId) {
        Map<String, Message> queueMessages = messagesByQueue.get(queueId);
        return queueMessages != null ? queueMessages.values() : List.of();
    }

    @Override
    public String toString() {
        return "InMemoryMessageStore{messages=" + messages.size() + ", queues=" + queues.size() + '}';
    }
}
