package com.chicu.memetrader.engine;

import com.chicu.memetrader.config.KucoinProperties;
import com.chicu.memetrader.exchange.client.ExchangeClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Старт движка после поднятия контекста.
 * Без ключей API или без связи с биржей приложение не стартует.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "trader", name = "autostart", havingValue = "true", matchIfMissing = true)
public class OrchestratorBootstrap implements ApplicationRunner {

    private final KucoinProperties kucoin;
    private final ExchangeClient exchange;
    private final TradingOrchestrator orchestrator;

    @Override
    public void run(ApplicationArguments args) {
        if (!kucoin.hasCredentials()) {
            throw new IllegalStateException(
                    "KuCoin API credentials are missing (kucoin.api-key / api-secret / api-passphrase)");
        }

        Instant serverTime;
        try {
            serverTime = exchange.serverTime();
        } catch (Exception e) {
            throw new IllegalStateException("Exchange " + exchange.getExchangeName() + " is not reachable", e);
        }

        log.info("✅ {} reachable, server time {}", exchange.getExchangeName(), serverTime);
        orchestrator.start();
    }
}
