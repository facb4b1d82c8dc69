package com.tradebot.session.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CredentialVaultTest {

    @Test
    @DisplayName("holds the pair until cleared")
    void holdsAndClears() {
        CredentialVault vault = new CredentialVault();
        assertFalse(vault.hasCredentials());

        vault.update("access", "secret");
        assertTrue(vault.hasCredentials());
        assertEquals("access", vault.accessKey());
        assertArrayEquals("secret".getBytes(StandardCharsets.UTF_8), vault.secretKeyBytes());

        vault.clear();
        assertFalse(vault.hasCredentials());
        assertNull(vault.accessKey());
        assertNull(vault.secretKeyBytes());
    }

    @Test
    @DisplayName("update overwrites the previous pair")
    void updateOverwrites() {
        CredentialVault vault = new CredentialVault();
        vault.update("a1", "s1");
        vault.update("a2", "s2");
        assertEquals("a2", vault.accessKey());
        assertArrayEquals("s2".getBytes(StandardCharsets.UTF_8), vault.secretKeyBytes());
    }

    @Test
    @DisplayName("secretKeyBytes hands out an independent copy")
    void secretCopyIsIndependent() {
        CredentialVault vault = new CredentialVault();
        vault.update("access", "secret");
        byte[] copy = vault.secretKeyBytes();
        copy[0] = 'X';
        assertArrayEquals("secret".getBytes(StandardCharsets.UTF_8), vault.secretKeyBytes());
    }

    @Test
    @DisplayName("toString never reveals key material")
    void toStringRedacted() {
        CredentialVault vault = new CredentialVault();
        vault.update("my-access-key", "my-secret-key");
        String text = vault.toString();
        assertFalse(text.contains("my-access-key"));
        assertFalse(text.contains("my-secret-key"));
        assertEquals("CredentialVault[present]", text);
    }

    @Test
    @DisplayName("null keys are rejected")
    void rejectsNull() {
        CredentialVault vault = new CredentialVault();
        assertThrows(IllegalArgumentException.class, () -> vault.update(null, "secret"));
        assertThrows(IllegalArgumentException.class, () -> vault.update("access", null));
    }
}
