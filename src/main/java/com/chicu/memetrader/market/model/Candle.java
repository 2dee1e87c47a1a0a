package com.chicu.memetrader.market.model;

import java.math.BigDecimal;

/**
 * OHLC-свеча одного символа.
 *
 * @param time время открытия бара, секунды с 1970 (уникальный ключ в серии)
 */
public record Candle(
        long time,
        BigDecimal open,
        BigDecimal high,
        BigDecimal low,
        BigDecimal close,
        BigDecimal volume
) {
}
