package com.giftbattle.backend.exception;

public class EconomyException extends RuntimeException {

    private final EconomyErrorCode code;

    public EconomyException(EconomyErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public EconomyErrorCode getCode() {
        return code;
    }
}
