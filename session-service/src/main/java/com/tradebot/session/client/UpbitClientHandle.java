package com.tradebot.session.client;

import com.tradebot.common.exception.ExchangeCallException;
import com.tradebot.common.exception.InvalidCredentialsException;
import com.tradebot.common.exception.RateLimitExceededException;
import com.tradebot.common.ratelimit.CallClass;
import com.tradebot.common.ratelimit.RequestAdmission;
import com.tradebot.common.trace.SessionLogContext;
import com.tradebot.session.client.dto.AccountBalance;
import com.tradebot.session.client.dto.MinuteCandle;
import com.tradebot.session.client.dto.OrderResult;
import com.tradebot.session.client.dto.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link TradingClientHandle} against the Upbit REST API.
 *
 * <p>Every request is admitted by the shared {@link RequestAdmission} before it is sent.
 * When the exchange still answers 429, the call waits out
 * {@link RequestAdmission#backOffAfterRejection} and is re-sent, at most
 * {@code maxRateLimitRetries} times, after which it fails with
 * {@link RateLimitExceededException}. A 401 becomes {@link InvalidCredentialsException};
 * any other failure is wrapped in {@link ExchangeCallException}.
 */
public class UpbitClientHandle implements TradingClientHandle {

    private static final Logger log = LoggerFactory.getLogger(UpbitClientHandle.class);

    private static final ParameterizedTypeReference<List<AccountBalance>> ACCOUNTS = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<Ticker>>         TICKERS  = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<MinuteCandle>>   CANDLES  = new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final RequestAdmission admission;
    private final UpbitTokenSigner signer;
    private final int maxRateLimitRetries;
    private final AtomicBoolean closed = new AtomicBoolean();

    public UpbitClientHandle(WebClient webClient, RequestAdmission admission,
                             UpbitTokenSigner signer, int maxRateLimitRetries) {
        this.webClient           = webClient;
        this.admission           = admission;
        this.signer              = signer;
        this.maxRateLimitRetries = maxRateLimitRetries;
    }

    @Override
    public Mono<List<AccountBalance>> getAccounts() {
        return call("getAccounts", CallClass.REST, () -> webClient.get()
            .uri("/v1/accounts")
            .header(HttpHeaders.AUTHORIZATION, signer.authorization(null))
            .retrieve()
            .bodyToMono(ACCOUNTS));
    }

    @Override
    public Mono<List<Ticker>> getTickers(List<String> markets) {
        String joined = String.join(",", markets);
        return call("getTickers", CallClass.REST, () -> webClient.get()
            .uri(uri -> uri.path("/v1/ticker").queryParam("markets", joined).build())
            .retrieve()
            .bodyToMono(TICKERS));
    }

    @Override
    public Mono<List<MinuteCandle>> getMinuteCandles(String market, int count) {
        return call("getMinuteCandles", CallClass.REST, () -> webClient.get()
            .uri(uri -> uri.path("/v1/candles/minutes/1")
                .queryParam("market", market)
                .queryParam("count", count)
                .build())
            .retrieve()
            .bodyToMono(CANDLES));
    }

    @Override
    public Mono<OrderResult> placeMarketBuy(String market, BigDecimal price) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("market", market);
        params.put("side", "bid");
        params.put("price", price.toPlainString());
        params.put("ord_type", "price");
        return placeOrder("placeMarketBuy", params);
    }

    @Override
    public Mono<OrderResult> placeMarketSell(String market, BigDecimal volume) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("market", market);
        params.put("side", "ask");
        params.put("volume", volume.toPlainString());
        params.put("ord_type", "market");
        return placeOrder("placeMarketSell", params);
    }

    @Override
    public Mono<OrderResult> getOrder(String uuid) {
        String query = "uuid=" + uuid;
        return call("getOrder", CallClass.REST, () -> webClient.get()
            .uri(uri -> uri.path("/v1/order").queryParam("uuid", uuid).build())
            .header(HttpHeaders.AUTHORIZATION, signer.authorization(query))
            .retrieve()
            .bodyToMono(OrderResult.class));
    }

    @Override
    public Mono<OrderResult> cancelOrder(String uuid) {
        String query = "uuid=" + uuid;
        return call("cancelOrder", CallClass.ORDER, () -> webClient.delete()
            .uri(uri -> uri.path("/v1/order").queryParam("uuid", uuid).build())
            .header(HttpHeaders.AUTHORIZATION, signer.authorization(query))
            .retrieve()
            .bodyToMono(OrderResult.class))
            .doOnSuccess(o -> log.info("Order cancelled. uuid={} state={}", uuid, o == null ? null : o.state()));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Exchange client closed");
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ── internal ─────────────────────────────────────────────────────────────

    private Mono<OrderResult> placeOrder(String operation, Map<String, String> params) {
        String query = params.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining("&"));
        return call(operation, CallClass.ORDER, () -> webClient.post()
            .uri("/v1/orders")
            .header(HttpHeaders.AUTHORIZATION, signer.authorization(query))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(params)
            .retrieve()
            .bodyToMono(OrderResult.class))
            .doOnSuccess(o -> log.info("Order placed. operation={} market={} uuid={}",
                operation, params.get("market"), o == null ? null : o.uuid()));
    }

    private <T> Mono<T> call(String operation, CallClass callClass, Supplier<Mono<T>> request) {
        return attempt(operation, callClass, request, 1)
            .onErrorMap(WebClientResponseException.Unauthorized.class,
                e -> new InvalidCredentialsException(operation, "exchange rejected the API keys", e))
            .onErrorMap(e -> !(e instanceof ExchangeCallException) && !(e instanceof IllegalStateException),
                e -> new ExchangeCallException(operation, String.valueOf(e.getMessage()), e));
    }

    private <T> Mono<T> attempt(String operation, CallClass callClass, Supplier<Mono<T>> request, int attempt) {
        return Mono.defer(() -> {
                if (closed.get()) {
                    return Mono.error(new IllegalStateException("Exchange client is closed. operation=" + operation));
                }
                return admission.execute(callClass, request);
            })
            .onErrorResume(WebClientResponseException.TooManyRequests.class, e -> {
                if (attempt > maxRateLimitRetries) {
                    return Mono.error(new RateLimitExceededException(operation, callClass, attempt, e));
                }
                return Mono.deferContextual(ctx -> {
                        SessionLogContext.withMdc(SessionLogContext.getUserId(ctx), () ->
                            log.warn("Exchange answered 429 despite local admission. operation={} callClass={} attempt={}",
                                operation, callClass, attempt));
                        return admission.backOffAfterRejection(callClass);
                    })
                    .then(Mono.defer(() -> attempt(operation, callClass, request, attempt + 1)));
            });
    }
}
