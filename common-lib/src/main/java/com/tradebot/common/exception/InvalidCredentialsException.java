package com.tradebot.common.exception;

/** Exchange keys missing, malformed, or refused by the exchange. */
public class InvalidCredentialsException extends ExchangeCallException {

    public InvalidCredentialsException(String operation, String message) {
        super(operation, message);
    }

    public InvalidCredentialsException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}
