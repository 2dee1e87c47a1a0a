package com.chicu.memetrader.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Настройки движка: тик, фильтры вселенной, параметры сигнала.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "trader")
public class TraderProperties {

    /** Запускать оркестратор при старте приложения */
    private boolean autostart = true;

    /** Период тика оркестратора, сек */
    private long tickIntervalSec = 60;

    /** Рынок для списка символов (KuCoin: USDS, BTC, ALTS ...) */
    private String market = "USDS";

    private String quoteCurrency = "USDT";

    private String timeframe = "5m";

    /** Сколько баров истории грузить при первом обращении агента */
    private int historyBars = 100;

    /** Бюджет одной покупки в валюте котировки */
    private BigDecimal budget = BigDecimal.TEN;

    /** Начальное значение drain-режима (новые BUY не открываются) */
    private boolean drainMode = false;

    /** Начальное значение паузы (тик целиком пропускается) */
    private boolean pauseMode = false;

    private int upConfirmations = 2;
    private int downConfirmations = 2;

    private Oscillator oscillator = new Oscillator();
    private Stats stats = new Stats();
    private Symbols symbols = new Symbols();

    @Getter
    @Setter
    public static class Oscillator {
        private int fastPeriod = 12;
        private int slowPeriod = 26;
        private int signalPeriod = 9;
    }

    @Getter
    @Setter
    public static class Stats {

        /** Допустимый возраст статистики символа, минуты */
        private int maxAgeMinutes = 60;

        /** Мин. объём за 24ч, в миллионах валюты котировки */
        private BigDecimal minVolume = BigDecimal.ONE;

        /** Макс. объём за 24ч, в миллионах; 0 = без ограничения */
        private BigDecimal maxVolume = BigDecimal.ZERO;

        private BigDecimal minPrice = BigDecimal.ZERO;

        /** Мин. изменение за 24ч (0.1 = +10%) */
        private BigDecimal minChange = new BigDecimal("0.1");
    }

    @Getter
    @Setter
    public static class Symbols {

        /** Если не пусто, торгуем только эти символы */
        private List<String> allow = new ArrayList<>();

        private List<String> deny = new ArrayList<>();

        /** Агент создаётся независимо от порогов объёма/цены/изменения */
        private List<String> force = new ArrayList<>();
    }
}
