package com.chicu.memetrader.trader;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.UUID;

/**
 * clientOid для ордеров бота.
 *
 * Формат: "MMT" + код роли + "-" + 32 hex = 37 символов (KuCoin допускает до 40).
 * По префиксу в списке ордеров видно, какие ордера поставил бот.
 */
@UtilityClass
public class OrderCorrelation {

    public static final String PREFIX = "MMT";

    public static String newCorrelationId() {
        return UUID.randomUUID().toString()
                .replace("-", "")
                .toLowerCase(Locale.ROOT);
    }

    public static String clientOrderId(String role) {
        return PREFIX + roleCode(role) + "-" + newCorrelationId();
    }

    public static boolean isOwn(String clientOid) {
        return clientOid != null && clientOid.startsWith(PREFIX) && clientOid.indexOf('-') == PREFIX.length() + 1;
    }

    private static String roleCode(String role) {
        if (role == null) return "U";
        return switch (role.trim().toUpperCase(Locale.ROOT)) {
            case "ENTRY" -> "E";
            case "EXIT" -> "X";
            default -> "U";
        };
    }
}
