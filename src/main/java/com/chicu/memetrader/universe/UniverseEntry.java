package com.chicu.memetrader.universe;

import com.chicu.memetrader.exchange.model.MarketStats;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Закэшированная статистика символа за 24ч.
 *
 * @param volumeQuote   оборот в валюте котировки
 * @param changeRate24h изменение за 24ч, доля (0.1 = +10%)
 */
public record UniverseEntry(
        String symbol,
        BigDecimal lastPrice,
        BigDecimal volumeQuote,
        BigDecimal changeRate24h,
        Instant capturedAt
) {

    public static UniverseEntry of(MarketStats stats, Instant capturedAt) {
        return new UniverseEntry(
                stats.symbol(),
                stats.lastPrice(),
                stats.volumeQuote(),
                stats.changeRate(),
                capturedAt
        );
    }

    /**
     * Устарела, если now - capturedAt > maxAge.
     */
    public boolean isStale(Instant now, Duration maxAge) {
        return capturedAt == null || now.isAfter(capturedAt.plus(maxAge));
    }
}
