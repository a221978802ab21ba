package qrelay.core.model;

import qrelay.core.utils.RoutingKeys;

import java.util.Locale;

public enum ExchangeType {
    FANOUT("fanout"),
    DIRECT("direct"),
    TOPIC("topic");

    private final String value;

    ExchangeType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean matches(String bindingKey, String routingKey) {
        return switch (this) {
            case FANOUT -> true;
            case DIRECT -> bindingKey.equals(routingKey);
            case TOPIC -> RoutingKeys.topicMatches(bindingKey, routingKey);
        };
    }

    public static ExchangeType fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExchangeType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown exchange type: " + value);
    }
}
