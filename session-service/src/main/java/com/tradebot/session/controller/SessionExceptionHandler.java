package com.tradebot.session.controller;

import com.tradebot.common.exception.ExchangeCallException;
import com.tradebot.common.exception.InvalidCredentialsException;
import com.tradebot.common.exception.RateLimitExceededException;
import com.tradebot.session.session.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps session and exchange failures to RFC 7807 responses. */
@RestControllerAdvice
public class SessionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionExceptionHandler.class);

    @ExceptionHandler(InvalidCredentialsException.class)
    public ProblemDetail handleInvalidCredentials(InvalidCredentialsException ex) {
        log.warn("Credentials rejected. operation={} message={}", ex.getOperation(), ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Invalid Credentials", ex.getMessage());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ProblemDetail handleSessionNotFound(SessionNotFoundException ex) {
        log.info("Session not found. userId={}", ex.getUserId());
        return problem(HttpStatus.NOT_FOUND, "Session Not Found", ex.getMessage());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ProblemDetail handleRateLimit(RateLimitExceededException ex) {
        log.warn("Exchange rate limit exhausted. operation={} callClass={} attempts={}",
            ex.getOperation(), ex.getCallClass(), ex.getAttempts());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Exchange Rate Limit", ex.getMessage());
    }

    @ExceptionHandler(ExchangeCallException.class)
    public ProblemDetail handleExchange(ExchangeCallException ex) {
        log.error("Exchange call failed. operation={}", ex.getOperation(), ex);
        return problem(HttpStatus.BAD_GATEWAY, "Exchange Error", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ProblemDetail handleIllegalState(IllegalStateException ex) {
        log.warn("Conflicting session state: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", ex.getMessage());
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
