package qrelay.core.model;

public record Binding(String queueId, String routingKey) {

    public Binding {
        routingKey = routingKey == null ? "" : routingKey;
    }
}
