package com.chicu.memetrader.config.http;

import com.chicu.memetrader.config.KucoinProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP-клиент KuCoin: пул соединений и таймауты из {@code kucoin.http.*}.
 *
 * Пул рассчитан на параллельные запросы свечей агентов плюс
 * статистику вселенной и ленту ордеров из тика оркестратора.
 */
@Slf4j
@Configuration
public class KucoinRestTemplateConfig {

    @Bean(destroyMethod = "close")
    public PoolingHttpClientConnectionManager kucoinConnManager(KucoinProperties props) {
        return connectionManager(props.getHttp());
    }

    @Bean(destroyMethod = "close")
    public CloseableHttpClient kucoinHttpClient(PoolingHttpClientConnectionManager kucoinConnManager,
                                                KucoinProperties props) {
        KucoinProperties.Http http = props.getHttp();

        log.info("🌐 KuCoin HTTP: pool={}/{} connect={}ms response={}ms idle={}s",
                http.getMaxTotal(), http.getMaxPerRoute(),
                http.getConnectTimeoutMs(), http.getResponseTimeoutMs(), http.getIdleEvictSec());

        return HttpClients.custom()
                .setConnectionManager(kucoinConnManager)
                .setDefaultRequestConfig(requestConfig(http))
                .evictExpiredConnections()
                .evictIdleConnections(Timeout.ofSeconds(http.getIdleEvictSec()))
                .build();
    }

    @Bean
    public RestTemplate kucoinRestTemplate(CloseableHttpClient kucoinHttpClient) {
        RestTemplate rest = new RestTemplate(new HttpComponentsClientHttpRequestFactory(kucoinHttpClient));
        rest.getInterceptors().add((request, body, execution) -> {
            request.getHeaders().set(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
            return execution.execute(request, body);
        });
        return rest;
    }

    static PoolingHttpClientConnectionManager connectionManager(KucoinProperties.Http http) {
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(http.getMaxTotal());
        cm.setDefaultMaxPerRoute(http.getMaxPerRoute());
        return cm;
    }

    static RequestConfig requestConfig(KucoinProperties.Http http) {
        return RequestConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(http.getConnectTimeoutMs()))
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(http.getPoolWaitMs()))
                .setResponseTimeout(Timeout.ofMilliseconds(http.getResponseTimeoutMs()))
                .build();
    }
}
