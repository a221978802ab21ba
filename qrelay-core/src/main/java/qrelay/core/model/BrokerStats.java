package qrelay.core.model;

import java.util.Map;

public record BrokerStats(
        int queues,
        int exchanges,
        int consumers,
        long messagesPending,
        long messagesInFlight,
        int deadLetterEntries,
        Map<QueueDiscipline, Integer> queuesByDiscipline) {

    public BrokerStats {
        queuesByDiscipline = Map.copyOf(queuesByDiscipline);
    }
}
