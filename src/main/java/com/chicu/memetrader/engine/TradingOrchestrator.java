package com.chicu.memetrader.engine;

import com.chicu.memetrader.config.TraderProperties;
import com.chicu.memetrader.exchange.client.ExchangeClient;
import com.chicu.memetrader.exchange.model.ExchangeOrder;
import com.chicu.memetrader.exchange.model.SymbolInfo;
import com.chicu.memetrader.trader.OrderReconciler;
import com.chicu.memetrader.trader.TradingAgent;
import com.chicu.memetrader.trader.TradingAgentFactory;
import com.chicu.memetrader.universe.UniverseEntry;
import com.chicu.memetrader.universe.UniverseFilter;
import com.chicu.memetrader.universe.UniverseScanner;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 🎛 Оркестратор: один тик = вселенная → новые агенты → сверка ордеров → проверка агентов.
 *
 * Шаги строго последовательны и выполняются в единственном потоке планировщика.
 * Реестр агентов изменяется только из тика; REST читает снимки.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingOrchestrator {

    static final String TASK_KEY = "orchestrator";

    private final TraderProperties props;
    private final TradingModes modes;
    private final UniverseScanner scanner;
    private final UniverseFilter filter;
    private final OrderReconciler reconciler;
    private final TradingAgentFactory agentFactory;
    private final ExchangeClient exchange;
    private final SchedulerService scheduler;
    private final Clock clock;

    private final Map<String, TradingAgent> agents = new ConcurrentHashMap<>();

    // =====================================================
    // START / STOP
    // =====================================================

    public void start() {
        scheduler.scheduleAtFixedRate(TASK_KEY, this::tick, props.getTickIntervalSec());
        log.info("[ORCH] ▶ started (tick={}s, market={}, timeframe={})",
                props.getTickIntervalSec(), props.getMarket(), props.getTimeframe());
    }

    /**
     * Останавливает таймер и всех агентов. Запросы, уже ушедшие на биржу, завершаются сами.
     * Вызывается и при остановке контекста.
     */
    @PreDestroy
    public void stop() {
        scheduler.cancel(TASK_KEY);
        agents.values().forEach(TradingAgent::stop);
        log.info("[ORCH] ⏹ stopped, {} agent(s) halted", agents.size());
    }

    public boolean isRunning() {
        return scheduler.isActive(TASK_KEY);
    }

    // =====================================================
    // TICK
    // =====================================================

    public void tick() {
        if (modes.isPauseMode()) {
            log.debug("[ORCH] ⏸ paused, tick skipped");
            return;
        }

        Instant now = clock.instant();

        scanner.refresh(now);
        spawnAgents(now);
        reconcileOrders();
        runAgents(now);
    }

    /**
     * Агенты для символов, прошедших пороги (или из force-списка),
     * только после того как статистика загружена по всей вселенной.
     * Устаревшая статистика агента не порождает.
     */
    void spawnAgents(Instant now) {
        if (!scanner.isUniverseComplete()) {
            log.debug("[ORCH] universe not loaded yet, spawn skipped");
            return;
        }

        Duration maxAge = Duration.ofMinutes(props.getStats().getMaxAgeMinutes());

        for (UniverseEntry entry : scanner.entries()) {
            String symbol = entry.symbol();

            TradingAgent existing = agents.get(symbol);
            if (existing != null && existing.isRunning()) continue;

            if (entry.isStale(now, maxAge)) {
                log.debug("[ORCH] {} stats stale (captured {}), spawn skipped", symbol, entry.capturedAt());
                continue;
            }

            if (!filter.isForced(symbol) && !filter.passesThresholds(entry)) continue;

            TradingAgent agent = agents.computeIfAbsent(symbol, s -> {
                TradingAgent created = agentFactory.create(s, baseIncrement(s));
                log.info("[ORCH] ➕ agent {} created ({} total)", s, agents.size() + 1);
                return created;
            });
            agent.start();
        }
    }

    void reconcileOrders() {
        List<ExchangeOrder> orders;
        try {
            orders = exchange.listOrders();
        } catch (Exception e) {
            log.error("[ORCH] ❌ order list failed: {}", e.getMessage());
            return;
        }

        int created = reconciler.reconcile(orders, agents, this::baseIncrement);
        if (created > 0) {
            log.info("[ORCH] {} agent(s) restored from orders", created);
        }
    }

    void runAgents(Instant now) {
        for (TradingAgent agent : new ArrayList<>(agents.values())) {
            if (!agent.isRunning()) continue;
            try {
                agent.check(now);
            } catch (Exception e) {
                log.error("[ORCH] ❌ agent {} check failed: {}", agent.getSymbol(), e.getMessage(), e);
            }
        }
    }

    private BigDecimal baseIncrement(String symbol) {
        return scanner.symbolInfo(symbol).map(SymbolInfo::baseIncrement).orElse(null);
    }

    // =====================================================
    // READ
    // =====================================================

    public Optional<TradingAgent> agent(String symbol) {
        return Optional.ofNullable(agents.get(symbol));
    }

    public List<String> agentSymbols() {
        List<String> keys = new ArrayList<>(agents.keySet());
        Collections.sort(keys);
        return keys;
    }

    Map<String, TradingAgent> agents() {
        return agents;
    }
}
