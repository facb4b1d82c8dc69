package com.tradebot.session.session;

/** No live session for the user; the caller should re-authenticate. */
public class SessionNotFoundException extends RuntimeException {
    private final long userId;

    public SessionNotFoundException(long userId) {
        super("No active session. userId=" + userId);
        this.userId = userId;
    }

    public long getUserId() {
        return userId;
    }
}
