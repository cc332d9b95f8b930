package com.lendpool.api.controller;

import com.lendpool.api.dto.ErrorBody;
import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps LendingException to a status by error category: VALIDATION 400, STATE 409, SAFETY 422 (503 when no usable
 * price is available), AUTHORIZATION 403.
 */
@RestControllerAdvice
@Slf4j
public class LendingExceptionHandler {

    @ExceptionHandler(LendingException.class)
    public ResponseEntity<ErrorBody> handleLending(LendingException ex) {
        HttpStatus status = statusOf(ex.getError());
        if (status.is5xxServerError()) {
            log.warn("Operation aborted: {}", ex.getMessage());
        } else {
            log.debug("Operation rejected: {} {}", ex.getError().code(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getError().code(), ex.getMessage()));
    }

    static HttpStatus statusOf(LendingError error) {
        return switch (error.category()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case STATE -> HttpStatus.CONFLICT;
            case SAFETY -> error == LendingError.PRICE_UNAVAILABLE || error == LendingError.STALE_PRICE
                    ? HttpStatus.SERVICE_UNAVAILABLE
                    : HttpStatus.UNPROCESSABLE_ENTITY;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
        };
    }
}
