package com.tradebot.common.exception;

/**
 * Failure of a call to the exchange, tagged with the operation that failed
 * (for example {@code getAccounts} or {@code placeMarketBuy}).
 */
public class ExchangeCallException extends RuntimeException {
    private final String operation;

    public ExchangeCallException(String operation, String message) {
        super("[" + operation + "] " + message);
        this.operation = operation;
    }

    public ExchangeCallException(String operation, String message, Throwable cause) {
        super("[" + operation + "] " + message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
