package com.lendpool.api.controller;

import com.lendpool.api.dto.ErrorBody;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.MissingRequestValueException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps request validation failures (@Valid) and unreadable bodies to 400 with ErrorBody.
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("INVALID_REQUEST");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + " is missing or invalid")
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(MissingRequestValueException.class)
    public ResponseEntity<ErrorBody> handleMissingValue(MissingRequestValueException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", "Missing " + ex.getLabel() + " " + ex.getName()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleUnreadable(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", "Malformed request: " + ex.getReason()));
    }
}
