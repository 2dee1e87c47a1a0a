package com.chicu.memetrader.exchange.model;

import java.math.BigDecimal;

/**
 * Описание торговой пары из /api/v2/symbols.
 * Только поля, которые нужны движку.
 */
public record SymbolInfo(
        String symbol,
        String baseCurrency,
        String quoteCurrency,
        boolean enableTrading,
        BigDecimal baseIncrement
) {
}
