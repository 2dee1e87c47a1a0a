package com.chicu.memetrader.exchange.model;

import java.util.Locale;

public enum OrderSide {

    BUY("buy"),
    SELL("sell");

    private final String code;

    OrderSide(String code) {
        this.code = code;
    }

    /** Значение поля side в API KuCoin */
    public String code() {
        return code;
    }

    public static OrderSide from(String s) {
        if (s == null) {
            throw new IllegalArgumentException("order side is null");
        }
        return OrderSide.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
