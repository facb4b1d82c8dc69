package com.tradebot.session.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LoginRequest(
    @JsonProperty("userId")    long   userId,
    @JsonProperty("username")  String username,
    @JsonProperty("accessKey") String accessKey,
    @JsonProperty("secretKey") String secretKey
) {

    @Override
    public String toString() {
        return "LoginRequest[userId=" + userId + ", username=" + username + "]";
    }
}
