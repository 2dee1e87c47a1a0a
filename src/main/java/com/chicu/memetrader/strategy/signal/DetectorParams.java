package com.chicu.memetrader.strategy.signal;

import com.chicu.memetrader.indicator.OscillatorParams;

/**
 * @param upConfirmations   сколько подряд неубывающих шагов гистограммы нужно для BUY
 * @param downConfirmations сколько подряд невозрастающих шагов нужно для SELL
 */
public record DetectorParams(OscillatorParams oscillator, int upConfirmations, int downConfirmations) {

    public DetectorParams {
        if (oscillator == null) {
            throw new IllegalArgumentException("oscillator params are required");
        }
        if (upConfirmations < 0 || downConfirmations < 0) {
            throw new IllegalArgumentException("confirmations must be >= 0");
        }
    }
}
