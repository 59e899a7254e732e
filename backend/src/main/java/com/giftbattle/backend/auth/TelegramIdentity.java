package com.giftbattle.backend.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code user} object of Telegram init data.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramIdentity(
        @JsonProperty("id") Long id,
        @JsonProperty("username") String username,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName
) {}
