package com.chicu.memetrader.market;

import com.chicu.memetrader.market.model.Candle;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Буфер свечей одного символа: только добавление, без дублей, по возрастанию времени.
 *
 * Свеча с уже известным временем никогда не перезаписывается, поэтому в серию
 * должны попадать только закрытые бары.
 */
public class CandleSeries {

    private final String symbol;
    private final List<Candle> candles = new ArrayList<>();

    public CandleSeries(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Сливает свежие свечи в серию.
     *
     * @return сколько свечей добавлено
     */
    public synchronized int merge(List<Candle> fetched) {
        if (fetched == null || fetched.isEmpty()) return 0;

        int added = 0;
        for (Candle c : fetched) {
            if (c == null) continue;

            int pos = search(c.time());
            if (pos >= 0) continue;

            candles.add(-pos - 1, c);
            added++;
        }
        return added;
    }

    public synchronized int size() {
        return candles.size();
    }

    public synchronized boolean isEmpty() {
        return candles.isEmpty();
    }

    public synchronized Optional<Candle> last() {
        return candles.isEmpty() ? Optional.empty() : Optional.of(candles.get(candles.size() - 1));
    }

    public synchronized List<Candle> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(candles));
    }

    public synchronized List<BigDecimal> closes() {
        List<BigDecimal> out = new ArrayList<>(candles.size());
        for (Candle c : candles) out.add(c.close());
        return out;
    }

    /**
     * Бинарный поиск по времени.
     *
     * @return индекс свечи или (-(точка вставки) - 1), как в Collections.binarySearch
     */
    private int search(long time) {
        int lo = 0;
        int hi = candles.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            long t = candles.get(mid).time();
            if (t < time) lo = mid + 1;
            else if (t > time) hi = mid - 1;
            else return mid;
        }
        return -(lo + 1);
    }
}
