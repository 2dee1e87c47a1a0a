package com.chicu.memetrader.web.controller.api;

import com.chicu.memetrader.exchange.client.ExchangeException;
import com.chicu.memetrader.web.controller.api.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;

/**
 * JSON-ошибки для /api/**.
 *
 * Ошибка биржи отдаётся как 502 с кодом провайдера: проблема выше по течению,
 * а не в запросе клиента.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = TraderApiController.class)
@RequiredArgsConstructor
public class ApiErrorHandler {

    private final Clock clock;

    @ExceptionHandler(ExchangeException.class)
    public ResponseEntity<ApiError> handleExchange(ExchangeException e, HttpServletRequest req) {
        log.warn("[API] ⚠ exchange error at {}: code={} {}", req.getRequestURI(), e.getCode(), e.getMessage());
        return build(HttpStatus.BAD_GATEWAY, e.getMessage(), e.getCode(), req);
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiError> handleBadRequest(Exception e, HttpServletRequest req) {
        log.debug("[API] bad request at {}: {}", req.getRequestURI(), e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getMessage(), null, req);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException e, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(e.getStatusCode().value());
        String reason = e.getReason() != null ? e.getReason() : status.getReasonPhrase();
        return build(status, reason, null, req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handle(Exception e, HttpServletRequest req) {
        log.error("[API] ❌ {} failed: {}", req.getRequestURI(), e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getClass().getSimpleName(), null, req);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String message, String providerCode,
                                           HttpServletRequest req) {
        ApiError body = new ApiError(
                "error",
                status.value(),
                message,
                providerCode,
                req.getRequestURI(),
                clock.instant()
        );
        return ResponseEntity.status(status).body(body);
    }
}
