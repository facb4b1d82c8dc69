package com.tradebot.session.session;

import com.tradebot.session.client.dto.AccountBalance;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Exchange login state shown to the operator. Display and observability only; it does
 * not decide whether trading is permitted.
 *
 * @param loggedIn  last known login outcome
 * @param accounts  account balances captured at login or at the last sync (never null)
 * @param loginTime set only while {@code loggedIn} is true
 */
public record LoginSnapshot(boolean loggedIn, List<AccountBalance> accounts, Instant loginTime) {

    public LoginSnapshot {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        if (!loggedIn) {
            loginTime = null;
        }
    }

    public static LoginSnapshot loggedOut() {
        return new LoginSnapshot(false, List.of(), null);
    }

    /** Balance for {@code currency}, zero when the account does not hold it. */
    public BigDecimal balanceOf(String currency) {
        return accounts.stream()
            .filter(a -> currency.equals(a.currency()))
            .map(AccountBalance::balance)
            .filter(b -> b != null)
            .findFirst()
            .orElse(BigDecimal.ZERO);
    }
}
