package com.aiinpocket.combat.controller;

import com.aiinpocket.combat.exception.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

/**
 * 全域 REST API 異常處理器。
 * 戰鬥例外依類型對應 HTTP 狀態碼，回傳 {@code {"error": 訊息, "code": 錯誤代碼}}。
 * 確保前端永遠收到有效的 JSON 錯誤回應，而非原始堆疊追蹤。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ValidationException e) {
        return body(HttpStatus.BAD_REQUEST, sanitizeMessage(e.getMessage()), e.getCode());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(NotFoundException e) {
        return body(HttpStatus.NOT_FOUND, sanitizeMessage(e.getMessage()), e.getCode());
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<Map<String, String>> handleInvalidState(InvalidStateException e) {
        return body(HttpStatus.CONFLICT, sanitizeMessage(e.getMessage()), e.getCode());
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<Map<String, String>> handleInsufficientFunds(InsufficientFundsException e) {
        return body(HttpStatus.CONFLICT, sanitizeMessage(e.getMessage()), e.getCode());
    }

    @ExceptionHandler(ExternalDependencyException.class)
    public ResponseEntity<Map<String, String>> handleExternalDependency(ExternalDependencyException e) {
        log.warn("[GlobalExceptionHandler] 外部依賴失敗 (retryable={}): {}", e.isRetryable(), e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, sanitizeMessage(e.getMessage()), e.getCode());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidArgument(MethodArgumentNotValidException e) {
        return body(HttpStatus.BAD_REQUEST, "請求欄位不正確", "VALIDATION_ERROR");
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> handleMissingHeader(Exception e) {
        return body(HttpStatus.BAD_REQUEST, "缺少或無效的請求參數", "VALIDATION_ERROR");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(HttpMessageNotReadableException e) {
        return body(HttpStatus.BAD_REQUEST, "請求格式不正確，請檢查欄位型別", "VALIDATION_ERROR");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, String>> handleNoResource(NoResourceFoundException e) {
        log.debug("資源不存在: {}", e.getResourcePath());
        return body(HttpStatus.NOT_FOUND, "資源不存在", "NOT_FOUND");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneral(Exception e) {
        log.error("[GlobalExceptionHandler] 未預期的錯誤", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "系統發生錯誤，請稍後重試", "INTERNAL_ERROR");
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String message, String code) {
        return ResponseEntity.status(status).body(Map.of("error", message, "code", code));
    }

    /** 過濾可能含有敏感資訊的錯誤訊息 */
    static String sanitizeMessage(String msg) {
        if (msg == null || msg.length() > 200) return "操作失敗，請稍後重試";
        String lower = msg.toLowerCase();
        if (lower.contains("sql") || lower.contains("exception") || lower.contains("constraint")
                || lower.contains("connection") || lower.contains("timeout")
                || lower.contains("password") || lower.contains("token")) {
            return "操作失敗，請稍後重試";
        }
        return msg;
    }
}
