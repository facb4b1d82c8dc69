package com.tradebot.session.session;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * In-memory holder of one session's exchange key pair. Nothing here is ever persisted,
 * logged or serialised; {@link #toString()} reports presence only.
 *
 * <p>The secret key is kept as a {@code char[]} and overwritten with zeros on
 * {@link #clear()} and on every {@link #update}.
 */
public final class CredentialVault {

    private String accessKey;
    private char[] secretKey;

    public synchronized void update(String accessKey, String secretKey) {
        if (accessKey == null || secretKey == null) {
            throw new IllegalArgumentException("access key and secret key are required");
        }
        wipeSecret();
        this.accessKey = accessKey;
        this.secretKey = secretKey.toCharArray();
    }

    public synchronized boolean hasCredentials() {
        return accessKey != null && secretKey != null;
    }

    /** The access key, or {@code null} once cleared. */
    public synchronized String accessKey() {
        return accessKey;
    }

    /**
     * UTF-8 copy of the secret key, or {@code null} once cleared.
     * The caller owns the returned array and should zero it after use.
     */
    public synchronized byte[] secretKeyBytes() {
        if (secretKey == null) {
            return null;
        }
        ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(secretKey));
        byte[] bytes = new byte[encoded.remaining()];
        encoded.get(bytes);
        if (encoded.hasArray()) {
            Arrays.fill(encoded.array(), (byte) 0);
        }
        return bytes;
    }

    public synchronized void clear() {
        wipeSecret();
        accessKey = null;
    }

    @Override
    public synchronized String toString() {
        return "CredentialVault[" + (hasCredentials() ? "present" : "empty") + "]";
    }

    private void wipeSecret() {
        if (secretKey != null) {
            Arrays.fill(secretKey, '\0');
            secretKey = null;
        }
    }
}
