package com.giftbattle.backend.controller;

import com.giftbattle.backend.dto.ApiError;
import com.giftbattle.backend.exception.EconomyErrorCode;
import com.giftbattle.backend.exception.EconomyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(EconomyException.class)
    public ResponseEntity<ApiError> handleEconomyException(EconomyException ex) {
        EconomyErrorCode code = ex.getCode();
        log.debug("Economy request rejected: {} {}", code, ex.getMessage());
        return ResponseEntity.status(code.getStatus())
                .body(ApiError.of(code, ex.getMessage()));
    }

    @ExceptionHandler({PessimisticLockingFailureException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ApiError> handleLockFailure(DataAccessException ex) {
        log.warn("Concurrent modification lost a race: {}", ex.getMessage());
        return ResponseEntity.status(EconomyErrorCode.CONFLICT.getStatus())
                .body(ApiError.of(EconomyErrorCode.CONFLICT, "Concurrent update, please retry"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handleDataAccess(DataAccessException ex) {
        log.error("Store failure", ex);
        return ResponseEntity.status(EconomyErrorCode.STORE_UNAVAILABLE.getStatus())
                .body(ApiError.of(EconomyErrorCode.STORE_UNAVAILABLE, "Storage is temporarily unavailable"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiError.of("INVALID_ARGUMENT", "Invalid value for " + ex.getName()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiError.of("INTERNAL_ERROR", "Internal server error"));
    }
}
