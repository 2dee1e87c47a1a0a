package com.chicu.memetrader.exchange.kucoin;

import com.chicu.memetrader.common.time.Timeframe;
import com.chicu.memetrader.config.KucoinProperties;
import com.chicu.memetrader.exchange.client.ExchangeClient;
import com.chicu.memetrader.exchange.client.ExchangeException;
import com.chicu.memetrader.exchange.model.ExchangeOrder;
import com.chicu.memetrader.exchange.model.MarketStats;
import com.chicu.memetrader.exchange.model.OrderAmount;
import com.chicu.memetrader.exchange.model.OrderSide;
import com.chicu.memetrader.exchange.model.SymbolInfo;
import com.chicu.memetrader.market.model.Candle;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class KucoinExchangeClient implements ExchangeClient {

    private static final int ORDERS_PAGE_SIZE = 100;

    private final RestTemplate rest;
    private final KucoinProperties props;
    private final KucoinResponseParser parser = new KucoinResponseParser();

    /** Бюджет одновременных запросов свечей; лишние проверки пропускаются, а не ждут в очереди */
    private final Semaphore candleBudget;

    public KucoinExchangeClient(RestTemplate kucoinRestTemplate, KucoinProperties props) {
        this.rest = kucoinRestTemplate;
        this.props = props;
        this.candleBudget = new Semaphore(Math.max(1, props.getMaxConcurrentCandleCalls()));
    }

    @Override
    public String getExchangeName() {
        return "KUCOIN";
    }

    // =====================================================================
    // MARKET DATA
    // =====================================================================

    @Override
    public Instant serverTime() {
        return parser.serverTime(publicGet("/api/v1/timestamp"));
    }

    @Override
    public List<SymbolInfo> listSymbols(String market) {
        List<SymbolInfo> symbols = parser.symbols(publicGet("/api/v2/symbols?market=" + encode(market)));
        log.debug("[KUCOIN] listSymbols market={} -> {}", market, symbols.size());
        return symbols;
    }

    @Override
    public MarketStats get24hStats(String symbol) {
        return parser.stats(symbol, publicGet("/api/v1/market/stats?symbol=" + encode(symbol)));
    }

    @Override
    public List<Candle> getCandles(String symbol, Timeframe timeframe, Instant startAt) {

        boolean acquired;
        try {
            acquired = candleBudget.tryAcquire(props.getCandleCallWaitMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeException("INTERRUPTED", "candles request interrupted for " + symbol, e);
        }
        if (!acquired) {
            throw new ExchangeException("RATE_BUDGET", "no candle call slot for " + symbol);
        }

        try {
            String path = "/api/v1/market/candles?type=" + timeframe.getKucoinCode()
                    + "&symbol=" + encode(symbol)
                    + "&startAt=" + startAt.getEpochSecond();
            return parser.candles(publicGet(path));
        } finally {
            candleBudget.release();
        }
    }

    // =====================================================================
    // ORDERS
    // =====================================================================

    @Override
    public String placeMarketOrder(String clientOid, OrderSide side, String symbol, OrderAmount amount) {

        JSONObject body = new JSONObject();
        body.put("clientOid", clientOid);
        body.put("side", side.code());
        body.put("symbol", symbol);
        body.put("type", "market");
        if (amount.isFunds()) {
            body.put("funds", strip(amount.funds()));
        } else {
            body.put("size", strip(amount.size()));
        }

        String orderId = parser.orderId(signedRequest(HttpMethod.POST, "/api/v1/orders", body.toString()));
        log.info("[KUCOIN] 📤 market {} {} {} -> orderId={} clientOid={}",
                side, symbol, amount.isFunds() ? "funds=" + strip(amount.funds()) : "size=" + strip(amount.size()),
                orderId, clientOid);
        return orderId;
    }

    /**
     * Активные и завершённые ордера одним списком, самые свежие первыми.
     * По умолчанию /api/v1/orders отдаёт только завершённые.
     */
    @Override
    public List<ExchangeOrder> listOrders() {
        List<ExchangeOrder> all = new ArrayList<>();
        all.addAll(parser.orders(signedRequest(HttpMethod.GET,
                "/api/v1/orders?status=active&pageSize=" + ORDERS_PAGE_SIZE, null)));
        all.addAll(parser.orders(signedRequest(HttpMethod.GET,
                "/api/v1/orders?status=done&pageSize=" + ORDERS_PAGE_SIZE, null)));
        all.sort(Comparator.comparing(ExchangeOrder::getCreatedAt).reversed());
        return all;
    }

    // =====================================================================
    // TRANSPORT
    // =====================================================================

    private String publicGet(String endpoint) {
        return exchange(endpoint, HttpMethod.GET, new HttpEntity<>(null, new HttpHeaders()));
    }

    private String signedRequest(HttpMethod method, String endpoint, String body) {
        if (!props.hasCredentials()) {
            throw new ExchangeException("NO_CREDENTIALS", "KuCoin API credentials are not configured");
        }

        KucoinSigner signer = new KucoinSigner(props.getApiSecret());
        long ts = System.currentTimeMillis();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("KC-API-KEY", props.getApiKey());
        headers.set("KC-API-SIGN", signer.sign(ts, method.name(), endpoint, body));
        headers.set("KC-API-TIMESTAMP", String.valueOf(ts));
        headers.set("KC-API-PASSPHRASE", signer.passphrase(props.getApiPassphrase(), props.getApiKeyVersion()));
        headers.set("KC-API-KEY-VERSION", String.valueOf(props.getApiKeyVersion()));

        return exchange(endpoint, method, new HttpEntity<>(body, headers));
    }

    private String exchange(String endpoint, HttpMethod method, HttpEntity<String> entity) {
        String url = props.getBaseUrl() + endpoint;
        try {
            return rest.exchange(url, method, entity, String.class).getBody();
        } catch (HttpStatusCodeException e) {
            String code = extractCode(e.getResponseBodyAsString());
            throw new ExchangeException(code != null ? code : String.valueOf(e.getStatusCode().value()),
                    "KuCoin " + method + " " + endpoint + " failed: " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new ExchangeException("NETWORK", "KuCoin " + endpoint + " unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ExchangeException("CLIENT", "KuCoin " + endpoint + ": " + e.getMessage(), e);
        }
    }

    private static String extractCode(String body) {
        try {
            String code = new JSONObject(body).optString("code", "");
            return code.isEmpty() ? null : code;
        } catch (Exception e) {
            return null;
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String strip(BigDecimal v) {
        return v.stripTrailingZeros().toPlainString();
    }
}
