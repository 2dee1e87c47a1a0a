package com.chicu.memetrader.web.controller.api.dto;

import com.chicu.memetrader.indicator.OscillatorSample;
import com.chicu.memetrader.market.model.Candle;
import com.chicu.memetrader.strategy.signal.SignalType;

import java.util.List;

/**
 * Диагностика агента: свечи, точки осциллятора и текущий вердикт детектора.
 */
public record CandleDump(
        String symbol,
        List<Candle> candles,
        List<OscillatorSample> samples,
        SignalType signal,
        String reason
) {
}
