package com.chicu.memetrader.exchange.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Объём рыночного ордера: либо сумма в валюте котировки (funds),
 * либо количество базового актива (size). Ровно одно из полей задано.
 */
public record OrderAmount(BigDecimal funds, BigDecimal size) {

    public OrderAmount {
        if ((funds == null) == (size == null)) {
            throw new IllegalArgumentException("exactly one of funds/size must be set");
        }
    }

    public static OrderAmount funds(BigDecimal funds) {
        return new OrderAmount(Objects.requireNonNull(funds, "funds"), null);
    }

    public static OrderAmount size(BigDecimal size) {
        return new OrderAmount(null, Objects.requireNonNull(size, "size"));
    }

    public boolean isFunds() {
        return funds != null;
    }
}
