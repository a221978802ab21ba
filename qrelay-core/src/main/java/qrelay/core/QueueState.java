package qrelay.core;

import qrelay.core.model.Message;
import qrelay.core.model.Queue;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable bookkeeping of one queue. Every field except {@code queue} and {@code lock}
 * is guarded by {@code lock}.
 */
final class QueueState {

    record DedupRecord(Message message, long sentAt) {
    }

    final Queue queue;
    final ReentrantLock lock = new ReentrantLock();

    int pending;
    int inFlight;

    long totalSent;
    long totalDelivered;
    long totalAcked;
    long totalRejected;
    long totalDeadLettered;
    long totalExpired;

    // insertion ordered, so the oldest records sit at the head
    private final LinkedHashMap<String, DedupRecord> dedup = new LinkedHashMap<>();

    volatile boolean deleted;

    QueueState(Queue queue) {
        this.queue = queue;
    }

    String queueId() {
        return queue.queueId();
    }

    int live() {
        return pending + inFlight;
    }

    Message findDuplicate(String dedupId, long now, long windowMillis) {
        pruneDedup(now, windowMillis);
        DedupRecord record = dedup.get(dedupId);
        return record != null ? record.message() : null;
    }

    void rememberDedup(String dedupId, Message message, long now) {
        dedup.put(dedupId, new DedupRecord(message, now));
    }

    private void pruneDedup(long now, long windowMillis) {
        Iterator<Map.Entry<String, DedupRecord>> it = dedup.entrySet().iterator();
        while (it.hasNext()) {
            if (now - it.next().getValue().sentAt() < windowMillis) {
                break;
            }
            it.remove();
        }
    }

    void clearCounts() {
        pending = 0;
        inFlight = 0;
    }
}
