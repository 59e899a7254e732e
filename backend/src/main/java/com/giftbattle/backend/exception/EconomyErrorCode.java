package com.giftbattle.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure kinds surfaced by the economy core, with the HTTP status and response code each one maps to.
 */
public enum EconomyErrorCode {

    AUTHENTICATION_FAILURE(HttpStatus.UNAUTHORIZED, "AUTH_REQUIRED"),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND),
    CASE_NOT_FOUND(HttpStatus.NOT_FOUND),
    CASE_INACTIVE(HttpStatus.NOT_FOUND),
    INVENTORY_ENTRY_NOT_FOUND(HttpStatus.NOT_FOUND),
    EMPTY_POOL(HttpStatus.SERVICE_UNAVAILABLE),
    INSUFFICIENT_FUNDS(HttpStatus.PAYMENT_REQUIRED),
    CONFLICT(HttpStatus.CONFLICT),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;
    private final String responseCode;

    EconomyErrorCode(HttpStatus status) {
        this.status = status;
        this.responseCode = name();
    }

    EconomyErrorCode(HttpStatus status, String responseCode) {
        this.status = status;
        this.responseCode = responseCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    /**
     * Value of the {@code code} field in error bodies.
     */
    public String getResponseCode() {
        return responseCode;
    }
}
