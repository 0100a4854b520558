package com.imperium.identitygate.controller;

import com.imperium.identitygate.config.RequestIdSupport;
import com.imperium.identitygate.service.StoreUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理，统一输出 {"error": {code, message, requestId, details?}}。
 * <ul>
 *   <li>@Valid 失败、请求体无法解析 → 400 invalid_argument</li>
 *   <li>身份库不可用 → 503 store_unavailable</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

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
        return body(HttpStatus.BAD_REQUEST, "invalid_argument", message, field != null ? Map.of("field", field) : null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return body(HttpStatus.BAD_REQUEST, "invalid_argument", "Request body is not valid JSON", null);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(StoreUnavailableException ex) {
        log.warn("Store unavailable: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable",
                "Identity service is temporarily unavailable.", null);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccess(DataAccessException ex) {
        log.error("Store query failed: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable",
                "Identity service is temporarily unavailable.", null);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message,
            Map<String, Object> details) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", code);
        err.put("message", message);
        err.put("requestId", resolveRequestId());
        if (details != null) {
            err.put("details", details);
        }
        return ResponseEntity.status(status).body(Map.of("error", err));
    }

    private static String resolveRequestId() {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return RequestIdSupport.currentOrNew();
        }
        HttpServletRequest request = attributes.getRequest();
        return RequestIdSupport.resolve(request);
    }
}
