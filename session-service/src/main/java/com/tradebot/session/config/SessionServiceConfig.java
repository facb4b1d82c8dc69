package com.tradebot.session.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradebot.common.ratelimit.RequestAdmission;
import com.tradebot.session.client.TradingClientFactory;
import com.tradebot.session.client.UpbitClientHandle;
import com.tradebot.session.client.UpbitTokenSigner;
import com.tradebot.session.engine.AccountSyncEngine;
import com.tradebot.session.engine.TradingEngineFactory;
import com.tradebot.session.service.SessionService;
import com.tradebot.session.session.SessionRegistry;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class SessionServiceConfig {

    @Value("${exchange.base-url:https://api.upbit.com}")
    private String baseUrl;

    @Value("${exchange.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${exchange.response-timeout-seconds:20}")
    private int responseTimeoutSeconds;

    @Value("${exchange.max-rate-limit-retries:3}")
    private int maxRateLimitRetries;

    @Value("${session.engine-stop-timeout:10s}")
    private Duration engineStopTimeout;

    @Value("${engine.account-sync-interval:60s}")
    private Duration accountSyncInterval;

    /** One per process: the exchange limits are per account, shared by every session. */
    @Bean
    public RequestAdmission requestAdmission() {
        return new RequestAdmission();
    }

    @Bean
    public WebClient exchangeWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public TradingClientFactory tradingClientFactory(WebClient exchangeWebClient, RequestAdmission requestAdmission) {
        return credentials -> new UpbitClientHandle(exchangeWebClient, requestAdmission,
            new UpbitTokenSigner(credentials), maxRateLimitRetries);
    }

    @Bean
    public TradingEngineFactory tradingEngineFactory() {
        return (userId, username) -> new AccountSyncEngine(accountSyncInterval, Schedulers.parallel());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public SessionRegistry sessionRegistry(TradingEngineFactory tradingEngineFactory,
                                           RequestAdmission requestAdmission, Clock clock) {
        return new SessionRegistry(tradingEngineFactory, requestAdmission, engineStopTimeout, clock);
    }

    @Bean
    public SessionService sessionService(SessionRegistry sessionRegistry, TradingClientFactory tradingClientFactory) {
        return new SessionService(sessionRegistry, tradingClientFactory, engineStopTimeout);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // Authorization headers carry signed tokens; only method and path are logged.
    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            org.slf4j.LoggerFactory.getLogger(SessionServiceConfig.class)
                .debug("Outbound exchange request: {} {}", clientRequest.method(), clientRequest.url().getPath());
            return Mono.just(clientRequest);
        });
    }
}
