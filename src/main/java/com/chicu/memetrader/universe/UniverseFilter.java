package com.chicu.memetrader.universe;

import com.chicu.memetrader.config.TraderProperties;
import com.chicu.memetrader.exchange.model.SymbolInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Фильтры вселенной.
 *
 * Статический: по описанию пары (торгуется, нужная котировка, allow / deny).
 * Пороговый: по статистике 24ч; объёмы в конфиге заданы в миллионах.
 */
@Component
@RequiredArgsConstructor
public class UniverseFilter {

    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000L);

    private final TraderProperties props;

    public boolean accepts(SymbolInfo info) {
        if (info == null || info.symbol() == null) return false;
        if (!info.enableTrading()) return false;

        String quote = props.getQuoteCurrency();
        if (quote != null && !quote.isBlank() && !quote.equalsIgnoreCase(info.quoteCurrency())) {
            return false;
        }

        TraderProperties.Symbols lists = props.getSymbols();
        if (contains(lists.getDeny(), info.symbol())) return false;

        List<String> allow = lists.getAllow();
        return allow == null || allow.isEmpty() || contains(allow, info.symbol());
    }

    public boolean isForced(String symbol) {
        return contains(props.getSymbols().getForce(), symbol);
    }

    /**
     * minVolume <= volume <= maxVolume, lastPrice >= minPrice, changeRate >= minChange.
     */
    public boolean passesThresholds(UniverseEntry e) {
        if (e == null || e.volumeQuote() == null || e.lastPrice() == null || e.changeRate24h() == null) {
            return false;
        }

        TraderProperties.Stats s = props.getStats();

        BigDecimal minVolume = s.getMinVolume().multiply(MILLION);
        if (e.volumeQuote().compareTo(minVolume) < 0) return false;

        if (s.getMaxVolume() != null && s.getMaxVolume().signum() > 0) {
            BigDecimal maxVolume = s.getMaxVolume().multiply(MILLION);
            if (e.volumeQuote().compareTo(maxVolume) > 0) return false;
        }

        if (e.lastPrice().compareTo(s.getMinPrice()) < 0) return false;

        return e.changeRate24h().compareTo(s.getMinChange()) >= 0;
    }

    private static boolean contains(List<String> list, String symbol) {
        if (list == null || list.isEmpty() || symbol == null) return false;
        String key = symbol.trim().toUpperCase(Locale.ROOT);
        for (String s : list) {
            if (s != null && s.trim().toUpperCase(Locale.ROOT).equals(key)) return true;
        }
        return false;
    }
}
