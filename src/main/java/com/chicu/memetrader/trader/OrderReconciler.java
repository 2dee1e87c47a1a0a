package com.chicu.memetrader.trader;

import com.chicu.memetrader.exchange.model.ExchangeOrder;
import com.chicu.memetrader.exchange.model.OrderSide;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 🔁 Сверка ордеров биржи с агентами.
 *
 * На символ берётся один ордер: самый свежий по createdAt
 * (при равенстве побеждает встретившийся первым).
 * BUY создаёт и запускает агента, если его нет. SELL только обновляет существующего.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderReconciler {

    private final TradingAgentFactory factory;

    /**
     * @param increments шаг количества по символу, для новых агентов
     * @return сколько агентов создано
     */
    public int reconcile(List<ExchangeOrder> orders,
                         Map<String, TradingAgent> agents,
                         Function<String, BigDecimal> increments) {

        if (orders == null || orders.isEmpty()) return 0;

        Map<String, ExchangeOrder> latest = latestPerSymbol(orders);
        int created = 0;

        for (ExchangeOrder order : latest.values()) {
            String symbol = order.getSymbol();

            if (order.getSide() == OrderSide.SELL) {
                TradingAgent agent = agents.get(symbol);
                if (agent != null) {
                    agent.setOrder(order);
                } else {
                    log.debug("[RECON] SELL {} without agent, ignored", symbol);
                }
                continue;
            }

            boolean existed = agents.containsKey(symbol);
            TradingAgent agent = agents.computeIfAbsent(symbol,
                    s -> factory.create(s, increments.apply(s)));
            if (!existed) {
                created++;
                log.info("[RECON] ➕ agent created from BUY order symbol={} orderId={} own={}",
                        symbol, order.getId(), OrderCorrelation.isOwn(order.getClientOid()));
            }

            agent.setOrder(order);
            if (!agent.isRunning()) {
                agent.start();
            }
        }

        return created;
    }

    static Map<String, ExchangeOrder> latestPerSymbol(List<ExchangeOrder> orders) {
        Map<String, ExchangeOrder> out = new LinkedHashMap<>();

        for (ExchangeOrder o : orders) {
            if (o == null || o.getSymbol() == null || o.getSide() == null) continue;

            ExchangeOrder seen = out.get(o.getSymbol());
            if (seen == null || isNewer(o, seen)) {
                out.put(o.getSymbol(), o);
            }
        }
        return out;
    }

    private static boolean isNewer(ExchangeOrder candidate, ExchangeOrder current) {
        Instant a = candidate.getCreatedAt();
        Instant b = current.getCreatedAt();
        if (a == null) return false;
        if (b == null) return true;
        return a.isAfter(b);
    }
}
