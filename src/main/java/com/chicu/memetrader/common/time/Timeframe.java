package com.chicu.memetrader.common.time;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Таймфрейм свечей с алиасами строк и кодами KuCoin.
 * Парсинг через словарь, без switch-case на строках.
 */
public enum Timeframe {

    M1(60, "1min"),
    M3(180, "3min"),
    M5(300, "5min"),
    M15(900, "15min"),
    M30(1800, "30min"),

    H1(3600, "1hour"),
    H2(7200, "2hour"),
    H4(14400, "4hour"),
    H6(21600, "6hour"),
    H8(28800, "8hour"),
    H12(43200, "12hour"),

    D1(86400, "1day"),
    W1(604800, "1week");

    private final int stepSeconds;
    private final String kucoinCode;

    Timeframe(int stepSeconds, String kucoinCode) {
        this.stepSeconds = stepSeconds;
        this.kucoinCode = kucoinCode;
    }

    /** Кол-во секунд в одном баре. */
    public int getStepSeconds() {
        return stepSeconds;
    }

    public Duration getDuration() {
        return Duration.ofSeconds(stepSeconds);
    }

    /** Код для /api/v1/market/candles (type=...). */
    public String getKucoinCode() {
        return kucoinCode;
    }

    // ---------- Разбор строк ----------

    private static final Map<String, Timeframe> LOOKUP;

    static {
        Map<String, Timeframe> m = new HashMap<>();

        putAll(m, M1, "1m", "1min", "1 minute");
        putAll(m, M3, "3m", "3min", "3 minutes");
        putAll(m, M5, "5m", "5min", "5 minutes");
        putAll(m, M15, "15m", "15min", "15 minutes");
        putAll(m, M30, "30m", "30min", "30 minutes");

        putAll(m, H1, "1h", "1hr", "1 hour");
        putAll(m, H2, "2h", "2hr", "2 hours");
        putAll(m, H4, "4h", "4hr", "4 hours");
        putAll(m, H6, "6h", "6hr", "6 hours");
        putAll(m, H8, "8h", "8hr", "8 hours");
        putAll(m, H12, "12h", "12hr", "12 hours");

        putAll(m, D1, "1d", "1day", "1 day");
        putAll(m, W1, "1w", "1week", "1 week");

        LOOKUP = Collections.unmodifiableMap(m);
    }

    private static String norm(String s) {
        return s == null ? null : s.trim().toLowerCase(Locale.ROOT).replace(" ", "");
    }

    private static void putAll(Map<String, Timeframe> m, Timeframe tf, String... keys) {
        for (String k : keys) {
            String n = norm(k);
            if (n != null && !n.isEmpty()) {
                m.put(n, tf);
            }
        }
        m.put(norm(tf.kucoinCode), tf);
    }

    /**
     * Разбор строки таймфрейма ("5m", "5min", "1hour" ...).
     *
     * @throws IllegalArgumentException если строка не распознана
     */
    public static Timeframe from(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("timeframe is blank");
        }
        Timeframe tf = LOOKUP.get(norm(s));
        if (tf == null) {
            throw new IllegalArgumentException("Unknown timeframe: " + s);
        }
        return tf;
    }
}
