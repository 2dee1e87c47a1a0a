package com.chicu.memetrader.exchange.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 💹 Ордер в том виде, в каком его отдаёт биржа.
 * ❗ Только чтение: движок не изменяет ордера, лишь проецирует их на агентов.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class ExchangeOrder {

    /** id ордера на бирже */
    private final String id;

    /** clientOid, если ордер ставил бот */
    private final String clientOid;

    private final String symbol;

    private final OrderSide side;

    /** true, пока ордер не исполнен и не отменён */
    private final boolean active;

    /** Фактически исполненное количество базового актива */
    private final BigDecimal dealSize;

    /** Фактически потраченная/полученная сумма в валюте котировки */
    private final BigDecimal dealFunds;

    private final Instant createdAt;

    public BigDecimal getDealSizeOrZero() {
        return dealSize != null ? dealSize : BigDecimal.ZERO;
    }
}
