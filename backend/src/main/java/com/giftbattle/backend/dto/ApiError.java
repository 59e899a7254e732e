package com.giftbattle.backend.dto;

import com.giftbattle.backend.exception.EconomyErrorCode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of every error response: a stable {@code code} for clients and a human-readable message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {
    private String code;
    private String message;

    public static ApiError of(String code, String message) {
        return new ApiError(code, message);
    }

    public static ApiError of(EconomyErrorCode code, String message) {
        return new ApiError(code.getResponseCode(), message);
    }
}
