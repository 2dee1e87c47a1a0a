package com.chicu.memetrader.universe;

import com.chicu.memetrader.config.TraderProperties;
import com.chicu.memetrader.exchange.client.ExchangeClient;
import com.chicu.memetrader.exchange.model.MarketStats;
import com.chicu.memetrader.exchange.model.SymbolInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 🌍 Кэш статистики 24ч по торгуемым символам.
 *
 * За тик обновляется только срез устаревших символов размером
 * ceil(universe / maxAgeMinutes) * 2: при тике раз в минуту каждый символ
 * перечитывается примерно дважды за maxAge.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UniverseScanner {

    private final ExchangeClient exchange;
    private final UniverseFilter filter;
    private final TraderProperties props;

    private final Map<String, UniverseEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, SymbolInfo> symbols = new ConcurrentHashMap<>();

    private volatile boolean universeComplete = false;

    /**
     * Один проход обновления.
     *
     * @return записи, обновлённые в этом тике
     */
    public Set<UniverseEntry> refresh(Instant now) {
        List<SymbolInfo> listed;
        try {
            listed = exchange.listSymbols(props.getMarket());
        } catch (Exception e) {
            log.error("[UNIVERSE] ❌ symbol list failed market={}: {}", props.getMarket(), e.getMessage());
            return Collections.emptySet();
        }

        List<SymbolInfo> universe = listed.stream()
                .filter(filter::accepts)
                .sorted(Comparator.comparing(SymbolInfo::symbol))
                .toList();

        universe.forEach(info -> symbols.put(info.symbol(), info));
        prune(universe);

        int maxAgeMinutes = props.getStats().getMaxAgeMinutes();
        Duration maxAge = Duration.ofMinutes(maxAgeMinutes);

        List<SymbolInfo> stale = universe.stream()
                .filter(info -> {
                    UniverseEntry e = entries.get(info.symbol());
                    return e == null || e.isStale(now, maxAge);
                })
                .toList();

        if (!universeComplete && stale.isEmpty()) {
            universeComplete = true;
            log.info("[UNIVERSE] ✅ stats loaded for {} symbols", universe.size());
        }

        int slice = sliceSize(universe.size(), maxAgeMinutes);
        log.debug("[UNIVERSE] universe={} stale={} slice={}", universe.size(), stale.size(), slice);

        Set<UniverseEntry> refreshed = new LinkedHashSet<>();
        for (SymbolInfo info : stale.subList(0, Math.min(slice, stale.size()))) {
            try {
                MarketStats stats = exchange.get24hStats(info.symbol());
                UniverseEntry entry = UniverseEntry.of(stats, now);
                entries.put(info.symbol(), entry);
                refreshed.add(entry);
            } catch (Exception e) {
                log.warn("[UNIVERSE] ⚠ stats failed symbol={}: {}", info.symbol(), e.getMessage());
            }
        }

        return refreshed;
    }

    /**
     * Убирает из кэша символы, которых больше нет во вселенной:
     * торговля выключена, делистинг, другой рынок или котировка.
     */
    private void prune(List<SymbolInfo> universe) {
        Set<String> listed = universe.stream()
                .map(SymbolInfo::symbol)
                .collect(Collectors.toSet());

        symbols.keySet().retainAll(listed);

        List<String> gone = entries.keySet().stream()
                .filter(symbol -> !listed.contains(symbol))
                .toList();
        if (!gone.isEmpty()) {
            gone.forEach(entries::remove);
            log.info("[UNIVERSE] 🧹 dropped {} symbol(s) no longer listed: {}", gone.size(), gone);
        }
    }

    /**
     * ceil(universeSize / maxAgeMinutes) * 2.
     */
    public static int sliceSize(int universeSize, int maxAgeMinutes) {
        if (universeSize <= 0) return 0;
        int age = Math.max(1, maxAgeMinutes);
        return ((universeSize + age - 1) / age) * 2;
    }

    // =====================================================
    // LOOKUPS
    // =====================================================

    public boolean isUniverseComplete() {
        return universeComplete;
    }

    public Optional<UniverseEntry> entry(String symbol) {
        return Optional.ofNullable(entries.get(symbol));
    }

    public List<UniverseEntry> entries() {
        return entries.values().stream()
                .sorted(Comparator.comparing(UniverseEntry::symbol))
                .collect(Collectors.toUnmodifiableList());
    }

    public Optional<SymbolInfo> symbolInfo(String symbol) {
        return Optional.ofNullable(symbols.get(symbol));
    }
}
