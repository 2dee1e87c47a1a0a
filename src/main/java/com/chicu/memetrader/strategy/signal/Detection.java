package com.chicu.memetrader.strategy.signal;

import com.chicu.memetrader.indicator.OscillatorSample;

import java.util.List;

/**
 * Результат проверки: сигнал и точки осциллятора, на которых он посчитан.
 */
public record Detection(SignalType signal, List<OscillatorSample> samples, String reason) {
}
