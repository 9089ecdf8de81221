package com.webhookinbox.gateway.http;

import com.webhookinbox.auth.InvalidSignatureException;
import com.webhookinbox.shared.error.FieldViolation;
import com.webhookinbox.shared.error.ValidationException;
import com.webhookinbox.storage.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<Map<String, Object>> handle401(InvalidSignatureException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("detail", e.getMessage()));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handle422(ValidationException e) {
        return unprocessable(e.violations());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return unprocessable(List.of(new FieldViolation(e.getName(), "must be an integer")));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handle503(StorageUnavailableException e) {
        log.error("Storage unavailable", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("detail", "storage unavailable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handle500(Exception e) {
        if (e instanceof ErrorResponse framework) {
            // routing and protocol errors raised by Spring MVC keep their own status
            return ResponseEntity.status(framework.getStatusCode())
                    .body(Map.of("detail", framework.getBody().getDetail() == null
                            ? "request failed" : framework.getBody().getDetail()));
        }
        log.error("Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("detail", "internal error"));
    }

    private static ResponseEntity<Map<String, Object>> unprocessable(List<FieldViolation> violations) {
        var detail = violations.stream()
                .map(v -> Map.of("field", v.field(), "message", v.message()))
                .toList();
        return ResponseEntity.unprocessableEntity().body(Map.of("detail", detail));
    }
}
