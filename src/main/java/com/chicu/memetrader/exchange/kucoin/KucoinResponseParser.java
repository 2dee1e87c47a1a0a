package com.chicu.memetrader.exchange.kucoin;

import com.chicu.memetrader.exchange.client.ExchangeException;
import com.chicu.memetrader.exchange.model.ExchangeOrder;
import com.chicu.memetrader.exchange.model.MarketStats;
import com.chicu.memetrader.exchange.model.OrderSide;
import com.chicu.memetrader.exchange.model.SymbolInfo;
import com.chicu.memetrader.market.model.Candle;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Нормализация ответов KuCoin REST → модели движка.
 * Все ответы имеют вид {"code":"200000","data":...}; любой другой code считается ошибкой.
 */
public class KucoinResponseParser {

    static final String SUCCESS = "200000";

    // =====================================================================
    // ENVELOPE
    // =====================================================================

    Object data(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ExchangeException("EMPTY", "empty response body");
        }
        JSONObject root;
        try {
            root = new JSONObject(raw);
        } catch (JSONException e) {
            throw new ExchangeException("PARSE", "malformed response: " + e.getMessage(), e);
        }
        String code = root.optString("code", "");
        if (!SUCCESS.equals(code)) {
            throw new ExchangeException(code.isEmpty() ? "UNKNOWN" : code,
                    root.optString("msg", "request failed"));
        }
        return root.opt("data");
    }

    // =====================================================================
    // MARKET DATA
    // =====================================================================

    public Instant serverTime(String raw) {
        Object data = data(raw);
        if (!(data instanceof Number n)) {
            throw new ExchangeException("PARSE", "timestamp is not a number: " + data);
        }
        return Instant.ofEpochMilli(n.longValue());
    }

    public List<SymbolInfo> symbols(String raw) {
        JSONArray arr = array(data(raw));
        List<SymbolInfo> out = new ArrayList<>(arr.length());

        for (int i = 0; i < arr.length(); i++) {
            JSONObject s = arr.getJSONObject(i);
            out.add(new SymbolInfo(
                    s.getString("symbol"),
                    s.optString("baseCurrency", null),
                    s.optString("quoteCurrency", null),
                    s.optBoolean("enableTrading", false),
                    decimalOrNull(s, "baseIncrement")
            ));
        }

        out.sort(Comparator.comparing(SymbolInfo::symbol));
        return out;
    }

    public MarketStats stats(String symbol, String raw) {
        Object data = data(raw);
        if (!(data instanceof JSONObject s)) {
            throw new ExchangeException("PARSE", "no stats for " + symbol);
        }
        long time = s.optLong("time", 0L);
        return new MarketStats(
                s.optString("symbol", symbol),
                decimalOrZero(s, "last"),
                decimalOrZero(s, "volValue"),
                decimalOrZero(s, "changeRate"),
                time > 0 ? Instant.ofEpochMilli(time) : Instant.now()
        );
    }

    /**
     * KuCoin отдаёт бары от новых к старым:
     * [time(s), open, close, high, low, volume, turnover].
     */
    public List<Candle> candles(String raw) {
        JSONArray arr = array(data(raw));
        List<Candle> out = new ArrayList<>(arr.length());

        for (int i = 0; i < arr.length(); i++) {
            JSONArray k = arr.getJSONArray(i);
            out.add(new Candle(
                    Long.parseLong(k.getString(0)),
                    new BigDecimal(k.getString(1)),
                    new BigDecimal(k.getString(3)),
                    new BigDecimal(k.getString(4)),
                    new BigDecimal(k.getString(2)),
                    new BigDecimal(k.getString(5))
            ));
        }

        out.sort(Comparator.comparingLong(Candle::time));
        return out;
    }

    // =====================================================================
    // ORDERS
    // =====================================================================

    public String orderId(String raw) {
        Object data = data(raw);
        if (!(data instanceof JSONObject o) || !o.has("orderId")) {
            throw new ExchangeException("PARSE", "no orderId in response");
        }
        return o.getString("orderId");
    }

    public List<ExchangeOrder> orders(String raw) {
        Object data = data(raw);
        if (!(data instanceof JSONObject page)) {
            return List.of();
        }
        JSONArray items = page.optJSONArray("items");
        if (items == null) {
            return List.of();
        }

        List<ExchangeOrder> out = new ArrayList<>(items.length());
        for (int i = 0; i < items.length(); i++) {
            JSONObject o = items.getJSONObject(i);
            out.add(ExchangeOrder.builder()
                    .id(o.optString("id", null))
                    .clientOid(o.optString("clientOid", null))
                    .symbol(o.getString("symbol"))
                    .side(OrderSide.from(o.getString("side")))
                    .active(o.optBoolean("isActive", false))
                    .dealSize(decimalOrZero(o, "dealSize"))
                    .dealFunds(decimalOrZero(o, "dealFunds"))
                    .createdAt(Instant.ofEpochMilli(o.optLong("createdAt", 0L)))
                    .build());
        }
        return out;
    }

    // =====================================================================
    // helpers
    // =====================================================================

    private static JSONArray array(Object data) {
        if (data instanceof JSONArray a) return a;
        return new JSONArray();
    }

    private static BigDecimal decimalOrNull(JSONObject o, String key) {
        if (!o.has(key) || o.isNull(key)) return null;
        String v = o.optString(key, "").trim();
        return v.isEmpty() ? null : new BigDecimal(v);
    }

    private static BigDecimal decimalOrZero(JSONObject o, String key) {
        BigDecimal v = decimalOrNull(o, key);
        return v != null ? v : BigDecimal.ZERO;
    }
}
