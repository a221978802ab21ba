package qrelay.core.model;

/**
 * Point-in-time counters of one queue. {@code pending} includes the {@code delayed}
 * messages that are not visible yet.
 */
public record QueueStats(
        String queueId,
        String name,
        QueueDiscipline discipline,
        int pending,
        int inFlight,
        int delayed,
        int maxSize,
        int consumers,
        long totalSent,
        long totalDelivered,
        long totalAcked,
        long totalRejected,
        long totalDeadLettered,
        long totalExpired) {

    // live messages: pending plus in flight
    public int depth() {
        return pending + inFlight;
    }

    public QueueStats withConsumers(int consumerCount) {
        return new QueueStats(queueId, name, discipline, pending, inFlight, delayed, maxSize, consumerCount,
                totalSent, totalDelivered, totalAcked, totalRejected, totalDeadLettered, totalExpired);
    }
}
