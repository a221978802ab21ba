package qrelay.core.model;

import java.util.List;

public record Exchange(String exchangeId, String name, ExchangeType type, List<Binding> bindings, long createdAt) {

    public Exchange {
        bindings = List.copyOf(bindings);
    }
}
