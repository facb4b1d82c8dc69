package com.tradebot.session.client;

import com.tradebot.session.client.dto.AccountBalance;
import com.tradebot.session.client.dto.MinuteCandle;
import com.tradebot.session.client.dto.OrderResult;
import com.tradebot.session.client.dto.Ticker;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;

/**
 * One session's connection to the exchange. Every call passes admission control for
 * its call class before it is sent: account, market data and order queries are REST
 * calls, order placement and cancellation are ORDER calls.
 */
public interface TradingClientHandle extends AutoCloseable {

    Mono<List<AccountBalance>> getAccounts();

    Mono<List<Ticker>> getTickers(List<String> markets);

    Mono<List<MinuteCandle>> getMinuteCandles(String market, int count);

    /** Market buy spending {@code price} of the quote currency. */
    Mono<OrderResult> placeMarketBuy(String market, BigDecimal price);

    /** Market sell of {@code volume} units of the base currency. */
    Mono<OrderResult> placeMarketSell(String market, BigDecimal volume);

    Mono<OrderResult> getOrder(String uuid);

    Mono<OrderResult> cancelOrder(String uuid);

    /** Makes every later call fail. Idempotent. */
    @Override
    void close();
}
