package com.chicu.memetrader.exchange.client;

import com.chicu.memetrader.common.time.Timeframe;
import com.chicu.memetrader.exchange.model.ExchangeOrder;
import com.chicu.memetrader.exchange.model.MarketStats;
import com.chicu.memetrader.exchange.model.OrderAmount;
import com.chicu.memetrader.exchange.model.OrderSide;
import com.chicu.memetrader.exchange.model.SymbolInfo;
import com.chicu.memetrader.market.model.Candle;

import java.time.Instant;
import java.util.List;

/**
 * 🌐 Биржа, как её видит движок.
 *
 * Все методы бросают {@link ExchangeException} при сетевой ошибке
 * или неуспешном ответе провайдера.
 */
public interface ExchangeClient {

    String getExchangeName();

    /**
     * Время сервера биржи. Используется как проверка связи при старте.
     */
    Instant serverTime();

    // ==================== 🔹 MARKET DATA ====================

    /**
     * Список торговых пар рынка.
     *
     * @param market рынок ("USDS", "BTC", "ALTS" ...)
     */
    List<SymbolInfo> listSymbols(String market);

    /**
     * Статистика символа за 24 часа.
     */
    MarketStats get24hStats(String symbol);

    /**
     * Свечи, начиная с startAt, отсортированные по времени по возрастанию.
     * Последняя свеча может быть ещё не закрыта.
     */
    List<Candle> getCandles(String symbol, Timeframe timeframe, Instant startAt);

    // ==================== 🔹 ORDERS ====================

    /**
     * Размещает MARKET ордер.
     *
     * @param clientOid клиентский id (идемпотентность на стороне биржи)
     * @return id ордера на бирже
     */
    String placeMarketOrder(String clientOid, OrderSide side, String symbol, OrderAmount amount);

    /**
     * Ордера аккаунта, самые свежие первыми.
     */
    List<ExchangeOrder> listOrders();
}
