package qrelay.core.model;

public record ReplayResult(String queueId, int replayed, int rejected) {
}
