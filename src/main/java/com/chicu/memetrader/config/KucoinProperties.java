package com.chicu.memetrader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "kucoin")
public class KucoinProperties {

    /**
     * Например: https://api.kucoin.com
     */
    private String baseUrl = "https://api.kucoin.com";

    private String apiKey;
    private String apiSecret;
    private String apiPassphrase;

    /** KC-API-KEY-VERSION; для v2 passphrase подписывается секретом */
    private int apiKeyVersion = 2;

    /** Сколько запросов свечей может выполняться одновременно */
    private int maxConcurrentCandleCalls = 4;

    /** Сколько ждать свободный слот для запроса свечей, мс */
    private long candleCallWaitMs = 500;

    private Http http = new Http();

    @Data
    public static class Http {
        /** Всего соединений в пуле */
        private int maxTotal = 20;
        /** Соединений на один хост; все запросы идут на base-url */
        private int maxPerRoute = 10;

        private long connectTimeoutMs = 5_000;
        /** Сколько ждать свободное соединение из пула */
        private long poolWaitMs = 3_000;
        private long responseTimeoutMs = 15_000;

        /** Простаивающие соединения закрываются через столько секунд */
        private long idleEvictSec = 30;
    }

    public boolean hasCredentials() {
        return notBlank(apiKey) && notBlank(apiSecret) && notBlank(apiPassphrase);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
