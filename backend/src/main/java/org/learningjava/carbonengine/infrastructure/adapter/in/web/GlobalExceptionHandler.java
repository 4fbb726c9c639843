package org.learningjava.carbonengine.infrastructure.adapter.in.web;

import org.learningjava.carbonengine.domain.exception.CalculationCancelledException;
import org.learningjava.carbonengine.domain.exception.ConversionUnsupportedException;
import org.learningjava.carbonengine.domain.exception.ValidationException;
import org.learningjava.carbonengine.domain.model.calculation.CalculationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/** Every error leaves as {@code {success:false, calculation:null, error}}. */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<CalculationResponse> handleValidation(ValidationException e) {
        return ResponseEntity.badRequest().body(CalculationResponse.failed(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CalculationResponse> handleBeanValidation(MethodArgumentNotValidException e) {
        String msg = String.join("; ", e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage()).toList());
        return ResponseEntity.badRequest().body(CalculationResponse.failed(msg));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<CalculationResponse> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(CalculationResponse.failed(e.getMessage()));
    }

    @ExceptionHandler(ConversionUnsupportedException.class)
    public ResponseEntity<CalculationResponse> handleConversion(ConversionUnsupportedException e) {
        return ResponseEntity.badRequest().body(CalculationResponse.failed(e.getMessage()));
    }

    @ExceptionHandler(CalculationCancelledException.class)
    public ResponseEntity<CalculationResponse> handleCancelled(CalculationCancelledException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(CalculationResponse.failed(e.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<CalculationResponse> handleStatus(ResponseStatusException e) {
        return ResponseEntity.status(e.getStatusCode()).body(CalculationResponse.failed(e.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CalculationResponse> handleGeneric(Exception e) {
        log.error("Unhandled error: {}", e.toString(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(CalculationResponse.failed(e.getMessage()));
    }
}
