package qrelay.core.model;

import java.util.List;

public record PublishResult(String exchangeId, List<String> deliveredQueueIds, List<String> rejectedQueueIds) {

    public PublishResult {
        deliveredQueueIds = List.copyOf(deliveredQueueIds);
        rejectedQueueIds = List.copyOf(rejectedQueueIds);
    }

    public int matchedQueues() {
        return deliveredQueueIds.size();
    }
}
