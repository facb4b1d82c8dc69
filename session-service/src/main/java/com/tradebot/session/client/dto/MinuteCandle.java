package com.tradebot.session.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/** One-minute OHLCV bar. The exchange returns these newest first. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MinuteCandle(
    @JsonProperty("market")                  String     market,
    @JsonProperty("candle_date_time_utc")    String     candleDateTimeUtc,
    @JsonProperty("opening_price")           BigDecimal openingPrice,
    @JsonProperty("high_price")              BigDecimal highPrice,
    @JsonProperty("low_price")               BigDecimal lowPrice,
    @JsonProperty("trade_price")             BigDecimal tradePrice,
    @JsonProperty("candle_acc_trade_volume") BigDecimal candleAccTradeVolume
) {}
