package com.chicu.memetrader.trader;

import com.chicu.memetrader.common.time.Timeframe;
import com.chicu.memetrader.exchange.client.ExchangeClient;
import com.chicu.memetrader.exchange.model.ExchangeOrder;
import com.chicu.memetrader.exchange.model.OrderAmount;
import com.chicu.memetrader.exchange.model.OrderSide;
import com.chicu.memetrader.market.CandleSeries;
import com.chicu.memetrader.market.model.Candle;
import com.chicu.memetrader.strategy.signal.Detection;
import com.chicu.memetrader.strategy.signal.DetectorParams;
import com.chicu.memetrader.strategy.signal.SignalDetector;
import com.chicu.memetrader.strategy.signal.SignalType;
import com.chicu.memetrader.trader.dto.TraderSnapshot;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleSupplier;

/**
 * 🤖 Агент одного символа: свечи → сигнал → рыночный ордер.
 *
 * <pre>
 * IDLE     --BUY  (не drain, lastSignal != BUY)--> BUYING   : market BUY на бюджет
 * POSITION --SELL (lastSignal != SELL)-----------> SELLING  : market SELL на всю позицию
 * BUYING / SELLING ждут исполнения через {@link #setOrder(ExchangeOrder)}
 * </pre>
 *
 * lastSignal меняется только после успешной отправки ордера, поэтому пока
 * держится один и тот же сигнал, повторный ордер того же направления не уходит.
 */
@Slf4j
public class TradingAgent {

    private final String symbol;
    private final ExchangeClient exchange;
    private final SignalDetector detector;
    private final DetectorParams params;
    private final Timeframe timeframe;
    private final int historyBars;
    private final BigDecimal budget;
    private final BigDecimal baseIncrement;
    private final BooleanSupplier drainMode;
    private final DoubleSupplier jitter;
    private final Clock clock;

    private final CandleSeries series;

    private AgentState state = AgentState.IDLE;
    private BigDecimal position = BigDecimal.ZERO;
    private SignalType lastSignal = SignalType.NONE;

    private volatile boolean running;
    private Instant startedAt;
    private Instant lastRun;
    private String lastOrderId;

    @Builder
    private TradingAgent(String symbol,
                         ExchangeClient exchange,
                         SignalDetector detector,
                         DetectorParams params,
                         Timeframe timeframe,
                         int historyBars,
                         BigDecimal budget,
                         BigDecimal baseIncrement,
                         BooleanSupplier drainMode,
                         DoubleSupplier jitter,
                         Clock clock) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.params = Objects.requireNonNull(params, "params");
        this.timeframe = Objects.requireNonNull(timeframe, "timeframe");
        this.historyBars = historyBars > 0 ? historyBars : 100;
        this.budget = Objects.requireNonNull(budget, "budget");
        this.baseIncrement = baseIncrement;
        this.drainMode = drainMode != null ? drainMode : () -> false;
        this.jitter = jitter != null ? jitter : () -> 0.5;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.series = new CandleSeries(symbol);
    }

    // =====================================================
    // START / STOP
    // =====================================================

    public synchronized void start() {
        if (running) return;
        running = true;
        startedAt = clock.instant();
        log.info("[TRADER] ▶ START symbol={} state={} position={}", symbol, state, position.toPlainString());
    }

    public synchronized void stop() {
        if (!running) return;
        running = false;
        log.info("[TRADER] ⏹ STOP symbol={} state={} position={}", symbol, state, position.toPlainString());
    }

    public boolean isRunning() {
        return running;
    }

    // =====================================================
    // CHECK
    // =====================================================

    /**
     * Один проход агента. Не бросает исключений: при любой ошибке состояние
     * остаётся прежним, следующий тик повторит попытку.
     */
    public synchronized void check(Instant now) {
        if (!running) return;
        if (!isDue(now)) return;

        lastRun = now;

        try {
            int added = refreshCandles(now);
            SignalType signal = detector.detect(series.closes(), params);

            log.debug("[TRADER] tick symbol={} state={} signal={} lastSignal={} +{} candles (total {})",
                    symbol, state, signal, lastSignal, added, series.size());

            apply(signal);

        } catch (Exception e) {
            log.warn("[TRADER] ⚠ check failed symbol={} state={}: {}", symbol, state, e.getMessage());
        }
    }

    /**
     * Джиттер: агент работает, только если прошло больше U(0.5, 1.5) длительностей бара.
     */
    private boolean isDue(Instant now) {
        if (lastRun == null) return true;

        double factor = 0.5 + jitter.getAsDouble();
        long waitMs = (long) (timeframe.getDuration().toMillis() * factor);
        return now.isAfter(lastRun.plus(Duration.ofMillis(waitMs)));
    }

    /**
     * Догружает только закрытые бары: незакрытый бар ещё изменится,
     * а серия не перезаписывает свечи с уже известным временем.
     */
    private int refreshCandles(Instant now) {
        long step = timeframe.getStepSeconds();

        Instant startAt = series.last()
                .map(c -> Instant.ofEpochSecond(c.time()))
                .orElseGet(() -> now.minusSeconds(step * historyBars));

        List<Candle> fetched = exchange.getCandles(symbol, timeframe, startAt);
        long nowSec = now.getEpochSecond();

        List<Candle> closed = fetched.stream()
                .filter(c -> c.time() + step <= nowSec)
                .toList();

        return series.merge(closed);
    }

    private void apply(SignalType signal) {
        switch (state) {
            case IDLE -> {
                if (signal != SignalType.BUY) return;
                if (drainMode.getAsBoolean()) {
                    log.debug("[TRADER] ✋ BUY suppressed (drain) symbol={}", symbol);
                    return;
                }
                if (lastSignal == SignalType.BUY) return;
                placeBuy();
            }
            case POSITION -> {
                if (signal != SignalType.SELL) return;
                if (lastSignal == SignalType.SELL) return;
                placeSell();
            }
            case BUYING, SELLING -> {
                // ждём исполнения ордера через ленту ордеров
            }
        }
    }

    private void placeBuy() {
        String clientOid = OrderCorrelation.clientOrderId("ENTRY");
        log.info("[TRADER] ⚡ BUY try symbol={} funds={}", symbol, budget.toPlainString());

        String orderId = exchange.placeMarketOrder(clientOid, OrderSide.BUY, symbol, OrderAmount.funds(budget));

        state = AgentState.BUYING;
        lastSignal = SignalType.BUY;
        lastOrderId = orderId;
        log.info("[TRADER] ✅ BUY sent symbol={} orderId={}", symbol, orderId);
    }

    private void placeSell() {
        BigDecimal size = roundToIncrement(position);
        if (size.signum() <= 0) {
            log.warn("[TRADER] ⚠ SELL skipped symbol={}: position {} below size increment {}",
                    symbol, position.toPlainString(), baseIncrement);
            return;
        }

        String clientOid = OrderCorrelation.clientOrderId("EXIT");
        log.info("[TRADER] ⚡ SELL try symbol={} size={}", symbol, size.toPlainString());

        String orderId = exchange.placeMarketOrder(clientOid, OrderSide.SELL, symbol, OrderAmount.size(size));

        state = AgentState.SELLING;
        lastSignal = SignalType.SELL;
        lastOrderId = orderId;
        log.info("[TRADER] ✅ SELL sent symbol={} orderId={}", symbol, orderId);
    }

    private BigDecimal roundToIncrement(BigDecimal qty) {
        if (baseIncrement == null || baseIncrement.signum() <= 0) return qty;
        return qty.divide(baseIncrement, 0, RoundingMode.DOWN).multiply(baseIncrement).stripTrailingZeros();
    }

    // =====================================================
    // ORDER FEED
    // =====================================================

    /**
     * Проекция ордера с биржи на состояние агента. Ордер с биржи важнее локального состояния,
     * поэтому локально выведенное состояние перезаписывается.
     */
    public synchronized void setOrder(ExchangeOrder order) {
        if (order == null || !symbol.equals(order.getSymbol())) return;

        AgentState before = state;
        BigDecimal dealSize = order.getDealSizeOrZero();

        switch (order.getSide()) {
            case BUY -> {
                if (order.isActive()) {
                    state = AgentState.BUYING;
                } else if (dealSize.signum() > 0) {
                    state = AgentState.POSITION;
                    position = dealSize;
                } else {
                    // BUY отменён без исполнения: позиции нет, вход снова разрешён
                    state = AgentState.IDLE;
                    position = BigDecimal.ZERO;
                    if (lastSignal == SignalType.BUY) lastSignal = SignalType.NONE;
                }
            }
            case SELL -> {
                if (order.isActive()) {
                    state = AgentState.SELLING;
                } else {
                    state = AgentState.IDLE;
                    position = BigDecimal.ZERO;
                }
            }
        }

        if (before != state) {
            log.info("[TRADER] 🔄 {} {} -> {} (order {} {} active={} dealSize={})",
                    symbol, before, state, order.getSide(), order.getId(), order.isActive(),
                    dealSize.toPlainString());
        }
    }

    // =====================================================
    // INTROSPECTION
    // =====================================================

    public String getSymbol() {
        return symbol;
    }

    public synchronized AgentState getState() {
        return state;
    }

    public synchronized BigDecimal getPosition() {
        return position;
    }

    public synchronized SignalType getLastSignal() {
        return lastSignal;
    }

    public CandleSeries getSeries() {
        return series;
    }

    /**
     * Сигнал по текущей серии без побочных эффектов.
     */
    public Detection evaluate() {
        return detector.evaluate(series.closes(), params);
    }

    public synchronized TraderSnapshot snapshot() {
        return new TraderSnapshot(
                symbol,
                state,
                position,
                lastSignal,
                running,
                startedAt,
                lastRun,
                lastOrderId,
                series.size(),
                series.last().map(Candle::time).orElse(null)
        );
    }

    @Override
    public String toString() {
        return "TradingAgent{" + symbol + " " + state + " pos=" + position.toPlainString()
                + " last=" + lastSignal + " running=" + running + "}";
    }
}
