package com.market.chat.controller;

import com.market.chat.exception.ChatErrorCode;
import com.market.chat.exception.ChatException;
import com.market.chat.exception.RateLimitedException;
import com.market.chat.model.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps every failure of the REST API onto the {@code {success: false, error}} envelope.
 */
@Slf4j
@RestControllerAdvice
public class ChatExceptionHandler {

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<ApiResponse<Void>> handleChatException(ChatException ex, HttpServletRequest request) {
        ChatErrorCode code = ex.getErrorCode();
        if (code.status().is5xxServerError()) {
            log.error("[{}] {} - {} ({})", request.getMethod(), getFullRequestUrl(request),
                ex.getMessage(), code.code(), ex);
        } else {
            log.info("[{}] {} - {} ({})", request.getMethod(), getFullRequestUrl(request),
                ex.getMessage(), code.code());
        }

        ResponseEntity.BodyBuilder response = ResponseEntity.status(code.status());
        Long retryAfter = null;
        if (ex instanceof RateLimitedException) {
            retryAfter = ((RateLimitedException) ex).getRetryAfterSeconds();
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        }
        return response.body(ApiResponse.failure(ex.getClientMessage(), code.code(), retryAfter));
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.info("[{}] {} - malformed request: {}", request.getMethod(), getFullRequestUrl(request), ex.getMessage());
        return ResponseEntity.status(ChatErrorCode.VALIDATION_FAILED.status())
            .body(ApiResponse.failure("Invalid request data", ChatErrorCode.VALIDATION_FAILED.code(), null));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        log.error("[{}] {} - store failure", request.getMethod(), getFullRequestUrl(request), ex);
        return failure(ChatErrorCode.STORE_FAILED);
    }

    @ExceptionHandler(Throwable.class)
    public ResponseEntity<ApiResponse<Void>> handleThrowable(Throwable throwable, HttpServletRequest request) {
        log.error("[{}] {} - unexpected failure", request.getMethod(), getFullRequestUrl(request), throwable);
        return failure(ChatErrorCode.INTERNAL_ERROR);
    }

    private static ResponseEntity<ApiResponse<Void>> failure(ChatErrorCode code) {
        return ResponseEntity.status(code.status()).body(ApiResponse.failure(code.message(), code.code(), null));
    }

    private String getFullRequestUrl(HttpServletRequest request) {
        String queryString = request.getQueryString();
        return request.getRequestURI() + (queryString != null ? "?" + queryString : "");
    }
}
