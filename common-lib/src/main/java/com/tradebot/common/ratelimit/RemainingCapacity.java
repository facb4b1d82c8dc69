package com.tradebot.common.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time headroom of both call classes. Observability only. It can be stale
 * by the time the caller reads it, so never gate a call on it.
 */
public record RemainingCapacity(
    @JsonProperty("restRemainingPerSecond")  int restRemainingPerSecond,
    @JsonProperty("restRemainingPerMinute")  int restRemainingPerMinute,
    @JsonProperty("orderRemainingPerSecond") int orderRemainingPerSecond,
    @JsonProperty("orderRemainingPerMinute") int orderRemainingPerMinute,
    @JsonProperty("accountCallsLastMinute")  int accountCallsLastMinute
) {}
