package com.chicu.memetrader.strategy.signal;

import com.chicu.memetrader.indicator.Oscillator;
import com.chicu.memetrader.indicator.OscillatorSample;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Разворот импульса по гистограмме осциллятора.
 *
 * BUY: последние upConfirmations + 1 значений гистограммы не убывают.
 * SELL: последние downConfirmations + 1 значений не возрастают.
 * BUY проверяется первым и выигрывает, если выполнены оба условия.
 */
@Component
@RequiredArgsConstructor
public class SignalDetector {

    private final Oscillator oscillator;

    public SignalType detect(List<BigDecimal> closes, DetectorParams params) {
        return evaluate(closes, params).signal();
    }

    public Detection evaluate(List<BigDecimal> closes, DetectorParams params) {
        List<OscillatorSample> samples = oscillator.compute(closes, params.oscillator());

        if (samples == null || samples.size() < params.oscillator().slowPeriod()) {
            return new Detection(SignalType.NONE, samples == null ? List.of() : samples, "warming_up");
        }

        double[] histogram = new double[samples.size()];
        for (int i = 0; i < histogram.length; i++) {
            histogram[i] = samples.get(i).histogram();
        }

        if (isRising(histogram, params.upConfirmations())) {
            return new Detection(SignalType.BUY, samples, "histogram_rising");
        }
        if (isFalling(histogram, params.downConfirmations())) {
            return new Detection(SignalType.SELL, samples, "histogram_falling");
        }
        return new Detection(SignalType.NONE, samples, "no_reversal");
    }

    /**
     * Последние confirmations + 1 значений попарно не убывают.
     */
    static boolean isRising(double[] h, int confirmations) {
        int from = h.length - (confirmations + 1);
        if (from < 0) return false;

        for (int i = from; i < h.length - 1; i++) {
            if (h[i + 1] < h[i]) return false;
        }
        return true;
    }

    /**
     * Последние confirmations + 1 значений попарно не возрастают.
     */
    static boolean isFalling(double[] h, int confirmations) {
        int from = h.length - (confirmations + 1);
        if (from < 0) return false;

        for (int i = from; i < h.length - 1; i++) {
            if (h[i + 1] > h[i]) return false;
        }
        return true;
    }
}
