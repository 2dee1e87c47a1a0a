package com.chicu.memetrader.web.controller.api.dto;

import java.time.Instant;

/**
 * Связь с биржей: время сервера и расхождение с локальными часами.
 */
public record ExchangeStatus(
        String exchange,
        Instant serverTime,
        long skewMs
) {
}
