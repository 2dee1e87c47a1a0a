package com.chicu.memetrader.indicator;

import java.math.BigDecimal;
import java.util.List;

/**
 * Импульсный осциллятор как чистая функция: ряд цен закрытия → ряд точек.
 *
 * Контракт: точки выровнены по концу ряда (последняя точка соответствует
 * последней цене); пока истории недостаточно, точек меньше, чем цен.
 */
@FunctionalInterface
public interface Oscillator {

    List<OscillatorSample> compute(List<BigDecimal> closes, OscillatorParams params);
}
