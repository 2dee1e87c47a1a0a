package com.chicu.memetrader.trader;

import com.chicu.memetrader.common.time.Timeframe;
import com.chicu.memetrader.config.TraderProperties;
import com.chicu.memetrader.engine.TradingModes;
import com.chicu.memetrader.exchange.client.ExchangeClient;
import com.chicu.memetrader.indicator.OscillatorParams;
import com.chicu.memetrader.strategy.signal.DetectorParams;
import com.chicu.memetrader.strategy.signal.SignalDetector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.function.DoubleSupplier;

/**
 * Создаёт агентов с общими для всех символов настройками из {@link TraderProperties}.
 */
@Component
@RequiredArgsConstructor
public class TradingAgentFactory {

    private final TraderProperties props;
    private final ExchangeClient exchange;
    private final SignalDetector detector;
    private final TradingModes modes;
    private final DoubleSupplier jitterSource;
    private final Clock clock;

    /**
     * @param baseIncrement шаг количества базового актива; null, если неизвестен
     */
    public TradingAgent create(String symbol, BigDecimal baseIncrement) {
        TraderProperties.Oscillator osc = props.getOscillator();

        DetectorParams params = new DetectorParams(
                new OscillatorParams(osc.getFastPeriod(), osc.getSlowPeriod(), osc.getSignalPeriod()),
                props.getUpConfirmations(),
                props.getDownConfirmations()
        );

        return TradingAgent.builder()
                .symbol(symbol)
                .exchange(exchange)
                .detector(detector)
                .params(params)
                .timeframe(Timeframe.from(props.getTimeframe()))
                .historyBars(props.getHistoryBars())
                .budget(props.getBudget())
                .baseIncrement(baseIncrement)
                .drainMode(modes::isDrainMode)
                .jitter(jitterSource)
                .clock(clock)
                .build();
    }
}
