package com.chicu.memetrader.web.controller.api;

import com.chicu.memetrader.engine.TradingModes;
import com.chicu.memetrader.engine.TradingOrchestrator;
import com.chicu.memetrader.exchange.client.ExchangeClient;
import com.chicu.memetrader.strategy.signal.Detection;
import com.chicu.memetrader.trader.TradingAgent;
import com.chicu.memetrader.trader.dto.TraderSnapshot;
import com.chicu.memetrader.universe.UniverseEntry;
import com.chicu.memetrader.universe.UniverseScanner;
import com.chicu.memetrader.web.controller.api.dto.CandleDump;
import com.chicu.memetrader.web.controller.api.dto.ExchangeStatus;
import com.chicu.memetrader.web.controller.api.dto.ModeStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Управление и интроспекция движка.
 * Только чтение снимков и переключение флагов, реестр агентов отсюда не меняется.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class TraderApiController {

    private final UniverseScanner scanner;
    private final TradingOrchestrator orchestrator;
    private final TradingModes modes;
    private final ExchangeClient exchange;
    private final Clock clock;

    // ==================== 🔹 SYMBOLS ====================

    @GetMapping("/symbols")
    public List<String> symbols() {
        return scanner.entries().stream().map(UniverseEntry::symbol).toList();
    }

    @GetMapping("/symbols/{symbol}")
    public UniverseEntry symbol(@PathVariable String symbol) {
        return scanner.entry(key(symbol))
                .orElseThrow(() -> notFound("symbol", symbol));
    }

    // ==================== 🔹 TRADERS ====================

    @GetMapping("/traders")
    public List<String> traders() {
        return orchestrator.agentSymbols();
    }

    @GetMapping("/traders/{symbol}")
    public TraderSnapshot trader(@PathVariable String symbol) {
        return agent(symbol).snapshot();
    }

    @GetMapping("/traders/{symbol}/candles")
    public CandleDump candles(@PathVariable String symbol) {
        TradingAgent agent = agent(symbol);
        Detection detection = agent.evaluate();
        return new CandleDump(
                agent.getSymbol(),
                agent.getSeries().snapshot(),
                detection.samples(),
                detection.signal(),
                detection.reason()
        );
    }

    // ==================== 🔹 MODES ====================

    @GetMapping("/mode")
    public ModeStatus mode() {
        return new ModeStatus(
                modes.isDrainMode(),
                modes.isPauseMode(),
                scanner.isUniverseComplete(),
                orchestrator.agentSymbols().size(),
                orchestrator.isRunning()
        );
    }

    @PostMapping("/mode/drain")
    public ModeStatus drain(@RequestParam boolean enabled) {
        modes.setDrainMode(enabled);
        return mode();
    }

    @PostMapping("/mode/pause")
    public ModeStatus pause(@RequestParam boolean enabled) {
        modes.setPauseMode(enabled);
        return mode();
    }

    // ==================== 🔹 EXCHANGE ====================

    /**
     * Живой запрос к бирже. Ошибка биржи уходит в {@link ApiErrorHandler} как 502.
     */
    @GetMapping("/exchange")
    public ExchangeStatus exchange() {
        Instant serverTime = exchange.serverTime();
        long skewMs = Duration.between(clock.instant(), serverTime).toMillis();
        return new ExchangeStatus(exchange.getExchangeName(), serverTime, skewMs);
    }

    // ---------- helpers ----------

    private TradingAgent agent(String symbol) {
        return orchestrator.agent(key(symbol))
                .orElseThrow(() -> notFound("trader", symbol));
    }

    private static String key(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static ResponseStatusException notFound(String what, String symbol) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown " + what + ": " + symbol);
    }
}
