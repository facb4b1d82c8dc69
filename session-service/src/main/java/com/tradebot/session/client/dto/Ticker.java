package com.tradebot.session.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Ticker(
    @JsonProperty("market")             String     market,
    @JsonProperty("trade_price")        BigDecimal tradePrice,
    @JsonProperty("signed_change_rate") BigDecimal signedChangeRate,
    @JsonProperty("acc_trade_volume_24h") BigDecimal accTradeVolume24h,
    @JsonProperty("timestamp")          long       timestamp
) {}
