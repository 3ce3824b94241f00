package dao.bmn.escrow.controller;

import dao.bmn.escrow.error.ErrorCategory;
import dao.bmn.escrow.error.ErrorCode;
import dao.bmn.escrow.error.SwapException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns rejected calls into {status:"ERROR", code, category, error}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SwapException.class)
    public ResponseEntity<Map<String, Object>> handleSwapException(SwapException ex) {
        HttpStatus status = statusFor(ex.getCode());
        log.warn("Request rejected: code={}, error={}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(status).body(body(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach((FieldError fe) -> errors.put(fe.getField(), fe.getDefaultMessage()));

        Map<String, Object> response = body(ErrorCode.INVALID_PAYLOAD, "Invalid input parameters");
        response.put("validationErrors", errors);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(body(ErrorCode.INVALID_PAYLOAD, ex.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(body(ErrorCode.INVALID_PAYLOAD, ex.getMessage()));
    }

    static HttpStatus statusFor(ErrorCode code) {
        switch (code) {
            case ESCROW_NOT_FOUND:
            case UNKNOWN_CHAIN:
                return HttpStatus.NOT_FOUND;
            case ESCROW_ALREADY_EXISTS:
            case INVALID_STATE:
            case FACTORY_PAUSED:
                return HttpStatus.CONFLICT;
            default:
                return code.getCategory() == ErrorCategory.AUTHORIZATION ? HttpStatus.FORBIDDEN : HttpStatus.BAD_REQUEST;
        }
    }

    private static Map<String, Object> body(ErrorCode code, String error) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ERROR");
        response.put("code", code.name());
        response.put("category", code.getCategory().name());
        response.put("error", error);
        return response;
    }
}
