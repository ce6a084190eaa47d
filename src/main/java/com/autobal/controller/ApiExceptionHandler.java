package com.autobal.controller;

import com.autobal.model.InvalidContinuumException;
import com.autobal.model.SpectrumShapeException;
import com.autobal.service.AnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps rejected input to error responses. Shape problems and bad continua get distinct statuses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SpectrumShapeException.class)
    public ResponseEntity<ErrorResponse> shapeMismatch(SpectrumShapeException e) {
        log.warn("Shape mismatch: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(e.errorCode(), e.getMessage()));
    }

    @ExceptionHandler(InvalidContinuumException.class)
    public ResponseEntity<ErrorResponse> invalidContinuum(InvalidContinuumException e) {
        log.warn("Invalid continuum: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(e.errorCode(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        log.warn("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(AnalysisService.BAD_REQUEST, e.getMessage()));
    }
}
