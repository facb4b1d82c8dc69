package com.tradebot.session.client;

import com.tradebot.session.session.CredentialVault;

/**
 * Builds a client that signs with whatever {@code credentials} holds at call time,
 * so clearing the vault disables the client too.
 */
@FunctionalInterface
public interface TradingClientFactory {

    TradingClientHandle create(CredentialVault credentials);
}
