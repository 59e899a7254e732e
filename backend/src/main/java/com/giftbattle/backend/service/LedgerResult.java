package com.giftbattle.backend.service;

import com.giftbattle.backend.exception.EconomyErrorCode;
import com.giftbattle.backend.exception.EconomyException;

import java.util.Objects;

/**
 * Outcome of a ledger operation: either a value or the business rule that rejected it.
 * Infrastructure faults are not represented here; they propagate as exceptions.
 */
public final class LedgerResult<T> {

    private final T value;
    private final EconomyErrorCode error;
    private final String message;

    private LedgerResult(T value, EconomyErrorCode error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> LedgerResult<T> success(T value) {
        return new LedgerResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> LedgerResult<T> failure(EconomyErrorCode error, String message) {
        return new LedgerResult<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("no value on failed result: " + error);
        }
        return value;
    }

    public EconomyErrorCode getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public T orElseThrow() {
        if (!isSuccess()) {
            throw new EconomyException(error, message);
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess() ? "LedgerResult[success=" + value + "]" : "LedgerResult[" + error + ": " + message + "]";
    }
}
