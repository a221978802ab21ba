package qrelay.core.exceptions;

public class ExchangeNotFoundException extends NotFoundException {

    public ExchangeNotFoundException(String exchangeId) {
        super("Exchange not found: " + exchangeId, exchangeId);
    }
}
