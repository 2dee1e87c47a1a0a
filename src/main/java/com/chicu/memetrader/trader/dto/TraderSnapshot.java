package com.chicu.memetrader.trader.dto;

import com.chicu.memetrader.strategy.signal.SignalType;
import com.chicu.memetrader.trader.AgentState;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Снимок агента для REST / логов. Только данные.
 */
public record TraderSnapshot(
        String symbol,
        AgentState state,
        BigDecimal position,
        SignalType lastSignal,
        boolean running,
        Instant startedAt,
        Instant lastRun,
        String lastOrderId,
        int candles,
        Long lastCandleTime
) {
}
