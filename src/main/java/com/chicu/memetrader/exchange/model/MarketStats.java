package com.chicu.memetrader.exchange.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Статистика символа за 24ч (/api/v1/market/stats).
 *
 * @param volumeQuote оборот в валюте котировки (volValue)
 * @param changeRate  изменение за 24ч, доля (0.1 = +10%)
 */
public record MarketStats(
        String symbol,
        BigDecimal lastPrice,
        BigDecimal volumeQuote,
        BigDecimal changeRate,
        Instant capturedAt
) {
}
