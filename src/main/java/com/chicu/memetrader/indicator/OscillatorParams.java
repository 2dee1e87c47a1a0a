package com.chicu.memetrader.indicator;

/**
 * Периоды осциллятора (MACD: быстрая EMA, медленная EMA, сигнальная линия).
 */
public record OscillatorParams(int fastPeriod, int slowPeriod, int signalPeriod) {

    public OscillatorParams {
        if (fastPeriod <= 0 || slowPeriod <= 0 || signalPeriod <= 0) {
            throw new IllegalArgumentException("periods must be > 0");
        }
        if (fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException("fastPeriod must be < slowPeriod");
        }
    }
}
