package com.reviewflow.web;

import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps malformed admin requests to a 400 carrying one message per offending field.
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<RequestErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fe ->
                fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage())
        );
        ex.getBindingResult().getGlobalErrors().forEach(ge ->
                fieldErrors.putIfAbsent(ge.getObjectName(), ge.getDefaultMessage())
        );
        return badRequest(fieldErrors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<RequestErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = UUID.class.equals(ex.getRequiredType())
                ? ex.getName() + " must be a valid UUID"
                : ex.getName() + " has an invalid value";
        return badRequest(Map.of(ex.getName(), message));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<RequestErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return badRequest(Map.of(ex.getParameterName(), ex.getParameterName() + " is required"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<RequestErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
                .body(new RequestErrorResponse("Malformed request body", Map.of()));
    }

    private static ResponseEntity<RequestErrorResponse> badRequest(Map<String, String> fieldErrors) {
        String detail = fieldErrors.isEmpty()
                ? "Validation failed"
                : "Validation failed: " + String.join("; ", fieldErrors.values());
        return ResponseEntity.badRequest()
                .body(new RequestErrorResponse(detail, fieldErrors));
    }

    public record RequestErrorResponse(
            String detail,
            Map<String, String> fieldErrors
    ) {
    }
}
