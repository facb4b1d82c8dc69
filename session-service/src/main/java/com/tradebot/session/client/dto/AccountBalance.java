package com.tradebot.session.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/** One currency row of {@code GET /v1/accounts}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountBalance(
    @JsonProperty("currency")               String     currency,
    @JsonProperty("balance")                BigDecimal balance,
    @JsonProperty("locked")                 BigDecimal locked,
    @JsonProperty("avg_buy_price")          BigDecimal avgBuyPrice,
    @JsonProperty("unit_currency")          String     unitCurrency
) {}
