package com.chicu.memetrader.web.controller.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Тело ошибки REST.
 *
 * @param code         HTTP-статус
 * @param providerCode код ошибки биржи, если запрос упал на бирже
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String status,
        int code,
        String message,
        String providerCode,
        String path,
        Instant timestamp
) {
}
