package com.tradebot.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/** API projection of a live session. Carries no credential material. */
public record SessionView(
    @JsonProperty("userId")        long       userId,
    @JsonProperty("username")      String     username,
    @JsonProperty("loggedIn")      boolean    loggedIn,
    @JsonProperty("loginTime")     Instant    loginTime,
    @JsonProperty("krwBalance")    BigDecimal krwBalance,
    @JsonProperty("engineRunning") boolean    engineRunning,
    @JsonProperty("createdAt")     Instant    createdAt,
    @JsonProperty("lastAccess")    Instant    lastAccess
) {}
