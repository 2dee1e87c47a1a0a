package com.chicu.memetrader.indicator;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * MACD на экспоненциальных средних.
 *
 * Одна точка на каждую цену закрытия. Быстрая и медленная EMA стартуют
 * с первой цены, сигнальная линия: EMA(signalPeriod) от MACD, начиная
 * с первого значения MACD. Прогрев отсекает {@code SignalDetector}.
 */
@Component
public class MacdOscillator implements Oscillator {

    @Override
    public List<OscillatorSample> compute(List<BigDecimal> closes, OscillatorParams params) {
        if (closes == null || closes.isEmpty()) {
            return List.of();
        }

        double kFast = 2.0 / (params.fastPeriod() + 1);
        double kSlow = 2.0 / (params.slowPeriod() + 1);
        double kSignal = 2.0 / (params.signalPeriod() + 1);

        double first = closes.get(0).doubleValue();
        double emaFast = first;
        double emaSlow = first;
        double signal = 0;

        List<OscillatorSample> out = new ArrayList<>(closes.size());

        for (int i = 0; i < closes.size(); i++) {
            double px = closes.get(i).doubleValue();
            emaFast = px * kFast + emaFast * (1 - kFast);
            emaSlow = px * kSlow + emaSlow * (1 - kSlow);

            double macd = emaFast - emaSlow;
            signal = i == 0 ? macd : macd * kSignal + signal * (1 - kSignal);
            out.add(new OscillatorSample(macd, signal, macd - signal));
        }
        return out;
    }
}
