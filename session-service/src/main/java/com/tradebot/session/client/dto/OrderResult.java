package com.tradebot.session.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderResult(
    @JsonProperty("uuid")             String     uuid,
    @JsonProperty("side")             String     side,
    @JsonProperty("ord_type")         String     ordType,
    @JsonProperty("market")           String     market,
    @JsonProperty("state")            String     state,
    @JsonProperty("price")            BigDecimal price,
    @JsonProperty("volume")           BigDecimal volume,
    @JsonProperty("executed_volume")  BigDecimal executedVolume
) {}
