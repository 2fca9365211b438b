package com.example.auditchain.http;

import com.example.auditchain.service.AuditChainException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badReq(IllegalArgumentException ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : "Bad request";
        return ResponseEntity.badRequest().body(Map.of("code", "BAD_REQUEST", "message", message));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidBody(MethodArgumentNotValidException ex) {
        List<String> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest().body(Map.of(
                "code", AuditChainException.Code.INVALID_PAYLOAD.name(),
                "message", "Request body is invalid",
                "violations", violations));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(Map.of(
                "code", AuditChainException.Code.INVALID_PAYLOAD.name(),
                "message", "Request body is not readable JSON",
                "violations", List.of("body must be a well-formed JSON object")));
    }

    @ExceptionHandler(AuditChainException.class)
    public ResponseEntity<Map<String, Object>> domainError(AuditChainException ex) {
        HttpStatus status;
        switch (ex.getCode()) {
            case INVALID_PAYLOAD -> status = HttpStatus.BAD_REQUEST;
            case EVIDENCE_NOT_FOUND -> status = HttpStatus.NOT_FOUND;
            case EVIDENCE_INTEGRITY_FAILED -> status = HttpStatus.UNPROCESSABLE_ENTITY;
            default -> status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (status.is5xxServerError()) {
            log.error("Audit chain failure handling request", ex);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", ex.getCode().name());
        body.put("message", ex.getMessage());
        if (!ex.getViolations().isEmpty()) {
            body.put("violations", ex.getViolations());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        log.error("Unexpected error handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("code", "INTERNAL_ERROR", "message", String.valueOf(ex.getMessage())));
    }
}
