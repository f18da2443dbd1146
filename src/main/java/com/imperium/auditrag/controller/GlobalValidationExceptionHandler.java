package com.imperium.auditrag.controller;

import com.imperium.auditrag.config.RequestIdSupport;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局参数异常处理：统一返回 {"error": {code, message, requestId, details}} 结构，HTTP 400。
 */
@RestControllerAdvice
public class GlobalValidationExceptionHandler {

    static final String CODE_INVALID_ARGUMENT = "invalid_argument";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getDefaultMessage())
                .orElse("Validation failed");
        String field = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField())
                .orElse(null);
        return badRequest(message, field);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return badRequest(ex.getParameterName() + " is required", ex.getParameterName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return badRequest("Malformed request body", null);
    }

    /** RagQuery 构造校验与 /api/search 参数校验 */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return badRequest(ex.getMessage(), null);
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message, String field) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", CODE_INVALID_ARGUMENT);
        err.put("message", message);
        err.put("requestId", resolveRequestId());
        if (field != null) {
            err.put("details", Map.of("field", field));
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", err));
    }

    private static String resolveRequestId() {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return RequestIdSupport.newRequestId();
        }
        HttpServletRequest request = attributes.getRequest();
        return RequestIdSupport.resolve(request);
    }
}
