package com.chicu.memetrader.trader;

import com.chicu.memetrader.common.time.Timeframe;
import com.chicu.memetrader.exchange.client.ExchangeClient;
import com.chicu.memetrader.exchange.client.ExchangeException;
import com.chicu.memetrader.exchange.model.ExchangeOrder;
import com.chicu.memetrader.exchange.model.OrderAmount;
import com.chicu.memetrader.exchange.model.OrderSide;
import com.chicu.memetrader.indicator.MacdOscillator;
import com.chicu.memetrader.indicator.Oscillator;
import com.chicu.memetrader.indicator.OscillatorParams;
import com.chicu.memetrader.indicator.OscillatorSample;
import com.chicu.memetrader.market.model.Candle;
import com.chicu.memetrader.strategy.signal.DetectorParams;
import com.chicu.memetrader.strategy.signal.SignalDetector;
import com.chicu.memetrader.strategy.signal.SignalType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TradingAgentTest {

    private static final String SYMBOL = "XYZ";
    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_100L);
    private static final long STEP = Timeframe.M5.getStepSeconds();
    private static final DetectorParams PARAMS = new DetectorParams(new OscillatorParams(12, 26, 9), 2, 2);

    @Mock private ExchangeClient exchange;
    @Mock private SignalDetector detector;

    private final AtomicBoolean drain = new AtomicBoolean(false);

    private TradingAgent agent;

    @BeforeEach
    void setUp() {
        agent = newAgent(detector, null);
    }

    private TradingAgent newAgent(SignalDetector d, BigDecimal baseIncrement) {
        return newAgent(d, baseIncrement, () -> 0.5);
    }

    private TradingAgent newAgent(SignalDetector d, BigDecimal baseIncrement, DoubleSupplier jitter) {
        return TradingAgent.builder()
                .symbol(SYMBOL)
                .exchange(exchange)
                .detector(d)
                .params(PARAMS)
                .timeframe(Timeframe.M5)
                .historyBars(100)
                .budget(BigDecimal.TEN)
                .baseIncrement(baseIncrement)
                .drainMode(drain::get)
                .jitter(jitter)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    private static List<Candle> closedCandles(int n) {
        List<Candle> out = new ArrayList<>();
        long first = NOW.getEpochSecond() - (n + 1) * STEP;
        for (int i = 0; i < n; i++) {
            BigDecimal c = BigDecimal.valueOf(1 + i);
            out.add(new Candle(first + i * STEP, c, c, c, c, BigDecimal.ONE));
        }
        return out;
    }

    /** Цены растут на 5% за бар: гистограмма MACD растёт к концу серии. */
    private static List<Candle> acceleratingCandles(int n) {
        List<Candle> out = new ArrayList<>();
        long first = NOW.getEpochSecond() - (n + 1) * STEP;
        for (int i = 0; i < n; i++) {
            BigDecimal c = BigDecimal.valueOf(100 * Math.pow(1.05, i));
            out.add(new Candle(first + i * STEP, c, c, c, c, BigDecimal.ONE));
        }
        return out;
    }

    private static ExchangeOrder order(OrderSide side, boolean active, String dealSize) {
        return ExchangeOrder.builder()
                .id("o-" + side)
                .symbol(SYMBOL)
                .side(side)
                .active(active)
                .dealSize(new BigDecimal(dealSize))
                .createdAt(NOW)
                .build();
    }

    private void signal(SignalType type) {
        when(exchange.getCandles(eq(SYMBOL), eq(Timeframe.M5), any())).thenReturn(List.of());
        when(detector.detect(anyList(), eq(PARAMS))).thenReturn(type);
    }

    // =====================================================
    // CHECK
    // =====================================================

    @Test
    void increasingHistogramOver26Closes_shouldPlaceExactlyOneBuy() {
        Oscillator oscillator = mock(Oscillator.class);
        List<OscillatorSample> samples = new ArrayList<>();
        for (int i = 0; i < 26; i++) samples.add(new OscillatorSample(i, 0, i * 0.1));
        when(oscillator.compute(anyList(), any())).thenReturn(samples);

        when(exchange.getCandles(eq(SYMBOL), eq(Timeframe.M5), any())).thenReturn(closedCandles(26));
        when(exchange.placeMarketOrder(anyString(), eq(OrderSide.BUY), eq(SYMBOL), any())).thenReturn("order-1");

        TradingAgent xyz = newAgent(new SignalDetector(oscillator), null);
        xyz.start();
        xyz.check(NOW);

        ArgumentCaptor<OrderAmount> amount = ArgumentCaptor.forClass(OrderAmount.class);
        verify(exchange, times(1)).placeMarketOrder(startsWith("MMTE-"), eq(OrderSide.BUY), eq(SYMBOL), amount.capture());
        assertEquals(BigDecimal.TEN, amount.getValue().funds());
        assertEquals(AgentState.BUYING, xyz.getState());
        assertEquals(SignalType.BUY, xyz.getLastSignal());
        assertEquals(26, xyz.getSeries().size());
    }

    @Test
    void acceleratingCloses_withShippedMacd_shouldBuyOnceAfter26Bars() {
        when(exchange.getCandles(eq(SYMBOL), eq(Timeframe.M5), any())).thenReturn(acceleratingCandles(26));
        when(exchange.placeMarketOrder(anyString(), eq(OrderSide.BUY), eq(SYMBOL), any())).thenReturn("order-1");

        SignalDetector macdDetector = new SignalDetector(new MacdOscillator());
        TradingAgent xyz = newAgent(macdDetector, null);
        xyz.start();
        xyz.check(NOW);

        assertEquals(SignalType.BUY, xyz.evaluate().signal());
        assertEquals(26, xyz.evaluate().samples().size());

        // тот же сигнал на следующем тике не даёт второго ордера
        xyz.check(NOW.plusSeconds(2 * STEP));

        verify(exchange, times(1)).placeMarketOrder(startsWith("MMTE-"), eq(OrderSide.BUY), eq(SYMBOL), any());
        assertEquals(AgentState.BUYING, xyz.getState());
        assertEquals(SignalType.BUY, xyz.getLastSignal());
    }

    @Test
    void acceleratingCloses_belowSlowPeriod_shouldStayWarmingUp() {
        when(exchange.getCandles(eq(SYMBOL), eq(Timeframe.M5), any())).thenReturn(acceleratingCandles(25));

        TradingAgent xyz = newAgent(new SignalDetector(new MacdOscillator()), null);
        xyz.start();
        xyz.check(NOW);

        assertEquals("warming_up", xyz.evaluate().reason());
        verify(exchange, never()).placeMarketOrder(anyString(), any(), anyString(), any());
        assertEquals(AgentState.IDLE, xyz.getState());
    }

    @Test
    void firstFetch_shouldStartHistoryBarsBeforeNow_andKeepOnlyClosedBars() {
        List<Candle> fetched = new ArrayList<>(closedCandles(3));
        BigDecimal c = BigDecimal.ONE;
        fetched.add(new Candle(NOW.getEpochSecond() - 10, c, c, c, c, c));
        when(exchange.getCandles(eq(SYMBOL), eq(Timeframe.M5), any())).thenReturn(fetched);
        when(detector.detect(anyList(), any())).thenReturn(SignalType.NONE);

        agent.start();
        agent.check(NOW);

        verify(exchange).getCandles(SYMBOL, Timeframe.M5, NOW.minusSeconds(100 * STEP));
        assertEquals(3, agent.getSeries().size());
    }

    @Test
    void secondFetch_shouldStartAtLastKnownCandle() {
        List<Candle> candles = closedCandles(3);
        when(exchange.getCandles(eq(SYMBOL), eq(Timeframe.M5), any())).thenReturn(candles);
        when(detector.detect(anyList(), any())).thenReturn(SignalType.NONE);

        agent.start();
        agent.check(NOW);
        agent.check(NOW.plusSeconds(STEP + 1));

        verify(exchange).getCandles(SYMBOL, Timeframe.M5, Instant.ofEpochSecond(candles.get(2).time()));
    }

    @Test
    void repeatedBuySignal_shouldNotSubmitTwice() {
        signal(SignalType.BUY);
        when(exchange.placeMarketOrder(anyString(), any(), anyString(), any())).thenReturn("order-1");

        agent.start();
        agent.check(NOW);
        agent.check(NOW.plusSeconds(STEP + 1));

        // BUY-ордер исчез без позиции через SELL: состояние IDLE, но lastSignal всё ещё BUY
        agent.setOrder(order(OrderSide.SELL, false, "0"));
        agent.check(NOW.plusSeconds(2 * STEP + 2));

        verify(exchange, times(1)).placeMarketOrder(anyString(), eq(OrderSide.BUY), eq(SYMBOL), any());
        assertEquals(AgentState.IDLE, agent.getState());
    }

    @Test
    void drainMode_shouldSuppressEntryOnly() {
        signal(SignalType.BUY);
        drain.set(true);

        agent.start();
        agent.check(NOW);

        verify(exchange, never()).placeMarketOrder(anyString(), any(), anyString(), any());
        assertEquals(AgentState.IDLE, agent.getState());
        assertEquals(SignalType.NONE, agent.getLastSignal());
    }

    @Test
    void drainMode_shouldStillCloseOpenPosition() {
        signal(SignalType.SELL);
        when(exchange.placeMarketOrder(anyString(), eq(OrderSide.SELL), eq(SYMBOL), any())).thenReturn("order-2");
        drain.set(true);

        agent.setOrder(order(OrderSide.BUY, false, "5"));
        agent.start();
        agent.check(NOW);

        verify(exchange).placeMarketOrder(startsWith("MMTX-"), eq(OrderSide.SELL), eq(SYMBOL), eq(OrderAmount.size(new BigDecimal("5"))));
        assertEquals(AgentState.SELLING, agent.getState());
        assertEquals(SignalType.SELL, agent.getLastSignal());
    }

    @Test
    void sellSize_shouldBeRoundedDownToIncrement() {
        TradingAgent rounded = newAgent(detector, new BigDecimal("0.01"));
        signal(SignalType.SELL);
        when(exchange.placeMarketOrder(anyString(), eq(OrderSide.SELL), eq(SYMBOL), any())).thenReturn("order-3");

        rounded.setOrder(order(OrderSide.BUY, false, "12.3456"));
        rounded.start();
        rounded.check(NOW);

        ArgumentCaptor<OrderAmount> amount = ArgumentCaptor.forClass(OrderAmount.class);
        verify(exchange).placeMarketOrder(anyString(), eq(OrderSide.SELL), eq(SYMBOL), amount.capture());
        assertEquals(0, new BigDecimal("12.34").compareTo(amount.getValue().size()));
    }

    @Test
    void failedPlacement_shouldLeaveStateAndLastSignalUnchanged() {
        signal(SignalType.BUY);
        when(exchange.placeMarketOrder(anyString(), any(), anyString(), any()))
                .thenThrow(new ExchangeException("400100", "balance insufficient"))
                .thenReturn("order-4");

        agent.start();
        assertDoesNotThrow(() -> agent.check(NOW));

        assertEquals(AgentState.IDLE, agent.getState());
        assertEquals(SignalType.NONE, agent.getLastSignal());

        agent.check(NOW.plusSeconds(STEP + 1));
        assertEquals(AgentState.BUYING, agent.getState());
    }

    @Test
    void candleFailure_shouldBeSwallowed() {
        when(exchange.getCandles(anyString(), any(), any()))
                .thenThrow(new ExchangeException("RATE_BUDGET", "no slot"));

        agent.start();
        assertDoesNotThrow(() -> agent.check(NOW));

        assertEquals(AgentState.IDLE, agent.getState());
        verifyNoInteractions(detector);
    }

    @Test
    void jitterGate_shouldSkipChecksInsideTheWindow() {
        signal(SignalType.NONE);

        agent.start();
        agent.check(NOW);
        agent.check(NOW.plusSeconds(STEP / 2));
        agent.check(NOW.plusSeconds(STEP));
        agent.check(NOW.plusSeconds(STEP + 1));

        verify(exchange, times(2)).getCandles(eq(SYMBOL), eq(Timeframe.M5), any());
    }

    @Test
    void jitterGate_minimumFactor_shouldRunAfterHalfABar() {
        signal(SignalType.NONE);
        TradingAgent fast = newAgent(detector, null, () -> 0.0);

        fast.start();
        fast.check(NOW);
        fast.check(NOW.plusSeconds(STEP / 2));
        fast.check(NOW.plusSeconds(STEP / 2 + 1));

        verify(exchange, times(2)).getCandles(eq(SYMBOL), eq(Timeframe.M5), any());
    }

    @Test
    void jitterGate_maximumFactor_shouldWaitOneAndAHalfBars() {
        signal(SignalType.NONE);
        TradingAgent slow = newAgent(detector, null, () -> 1.0);

        slow.start();
        slow.check(NOW);
        slow.check(NOW.plusSeconds(STEP + 1));
        slow.check(NOW.plusSeconds(STEP * 3 / 2));
        slow.check(NOW.plusSeconds(STEP * 3 / 2 + 1));

        verify(exchange, times(2)).getCandles(eq(SYMBOL), eq(Timeframe.M5), any());
    }

    @Test
    void start_shouldTakeStartTimeFromClock() {
        agent.start();

        assertEquals(NOW, agent.snapshot().startedAt());
    }

    @Test
    void stoppedAgent_shouldNotTouchExchange() {
        agent.check(NOW);

        agent.start();
        agent.stop();
        agent.check(NOW);

        verifyNoInteractions(exchange, detector);
        assertFalse(agent.isRunning());
    }

    // =====================================================
    // ORDER FEED
    // =====================================================

    @Test
    void setOrder_activeBuy_isBuying() {
        agent.setOrder(order(OrderSide.BUY, true, "0"));
        assertEquals(AgentState.BUYING, agent.getState());
    }

    @Test
    void setOrder_filledBuy_isPositionWithDealSize() {
        agent.setOrder(order(OrderSide.BUY, false, "42.5"));

        assertEquals(AgentState.POSITION, agent.getState());
        assertEquals(new BigDecimal("42.5"), agent.getPosition());
    }

    @Test
    void setOrder_activeSell_isSelling() {
        agent.setOrder(order(OrderSide.BUY, false, "1"));
        agent.setOrder(order(OrderSide.SELL, true, "0"));

        assertEquals(AgentState.SELLING, agent.getState());
        assertEquals(BigDecimal.ONE, agent.getPosition());
    }

    @Test
    void setOrder_inactiveSellInPosition_isIdleWithZeroPosition() {
        agent.setOrder(order(OrderSide.BUY, false, "7"));
        agent.setOrder(order(OrderSide.SELL, false, "7"));

        assertEquals(AgentState.IDLE, agent.getState());
        assertEquals(0, agent.getPosition().signum());
    }

    @Test
    void setOrder_cancelledBuyWithoutFill_isIdle_andAllowsNewEntry() {
        signal(SignalType.BUY);
        when(exchange.placeMarketOrder(anyString(), any(), anyString(), any())).thenReturn("a", "b");

        agent.start();
        agent.check(NOW);
        agent.setOrder(order(OrderSide.BUY, false, "0"));

        assertEquals(AgentState.IDLE, agent.getState());
        assertEquals(SignalType.NONE, agent.getLastSignal());

        agent.check(NOW.plusSeconds(STEP + 1));
        verify(exchange, times(2)).placeMarketOrder(anyString(), eq(OrderSide.BUY), eq(SYMBOL), any());
    }

    @Test
    void setOrder_otherSymbol_isIgnored() {
        agent.setOrder(ExchangeOrder.builder()
                .id("x").symbol("ABC-USDT").side(OrderSide.BUY).active(false)
                .dealSize(BigDecimal.ONE).createdAt(NOW).build());

        assertEquals(AgentState.IDLE, agent.getState());
        assertEquals(0, agent.getPosition().signum());
    }

    @Test
    void snapshot_shouldReflectAgent() {
        agent.setOrder(order(OrderSide.BUY, false, "3"));
        agent.start();

        var s = agent.snapshot();

        assertEquals(SYMBOL, s.symbol());
        assertEquals(AgentState.POSITION, s.state());
        assertEquals(new BigDecimal("3"), s.position());
        assertTrue(s.running());
        assertEquals(0, s.candles());
        assertNull(s.lastCandleTime());
    }
}
