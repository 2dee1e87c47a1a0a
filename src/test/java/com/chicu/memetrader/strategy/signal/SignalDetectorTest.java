package com.chicu.memetrader.strategy.signal;

import com.chicu.memetrader.indicator.Oscillator;
import com.chicu.memetrader.indicator.OscillatorParams;
import com.chicu.memetrader.indicator.OscillatorSample;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SignalDetectorTest {

    private static final OscillatorParams OSC = new OscillatorParams(3, 5, 2);
    private static final List<BigDecimal> CLOSES = List.of(BigDecimal.ONE);

    @Mock
    private Oscillator oscillator;

    private static List<OscillatorSample> histogram(double... values) {
        List<OscillatorSample> out = new ArrayList<>();
        for (double v : values) out.add(new OscillatorSample(v, 0, v));
        return out;
    }

    private SignalType detect(int up, int down, double... values) {
        when(oscillator.compute(any(), any())).thenReturn(histogram(values));
        return new SignalDetector(oscillator).detect(CLOSES, new DetectorParams(OSC, up, down));
    }

    @Test
    void buy_whenLastWindowNonDecreasing() {
        assertEquals(SignalType.BUY, detect(2, 2, 5, 4, 3, 1, 2, 2));
    }

    @Test
    void sell_whenLastWindowNonIncreasing() {
        assertEquals(SignalType.SELL, detect(2, 2, 1, 2, 3, 3, 2, 1));
    }

    @Test
    void oneDecreasingPairInsideWindow_suppressesBuy() {
        assertEquals(SignalType.NONE, detect(3, 5, 0, 0, 1, 3, 2, 4));
    }

    @Test
    void buyWins_whenBothWindowsHold() {
        assertEquals(SignalType.BUY, detect(2, 2, 1, 1, 1, 1, 1, 1));
    }

    @Test
    void fewerSamplesThanSlowPeriod_isNone() {
        when(oscillator.compute(any(), any())).thenReturn(histogram(1, 2, 3, 4));

        Detection d = new SignalDetector(oscillator).evaluate(CLOSES, new DetectorParams(OSC, 1, 1));

        assertEquals(SignalType.NONE, d.signal());
        assertEquals("warming_up", d.reason());
    }

    @Test
    void windowLargerThanSeries_isNotConfirmed() {
        assertFalse(SignalDetector.isRising(new double[]{1, 2, 3}, 3));
        assertFalse(SignalDetector.isFalling(new double[]{3, 2, 1}, 3));
        assertTrue(SignalDetector.isRising(new double[]{1, 2, 3}, 2));
        assertTrue(SignalDetector.isFalling(new double[]{3, 2, 1}, 2));
    }
}
