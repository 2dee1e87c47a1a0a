package com.chicu.memetrader.exchange.client;

/**
 * Ошибка вызова биржи: сеть, HTTP-статус или бизнес-код провайдера (code != 200000).
 */
public class ExchangeException extends RuntimeException {

    /** Код, который вернул провайдер, либо HTTP-статус, либо внутренний код клиента */
    private final String code;

    public ExchangeException(String code, String message) {
        super(String.format("[%s] %s", code, message));
        this.code = code;
    }

    public ExchangeException(String code, String message, Throwable cause) {
        super(String.format("[%s] %s", code, message), cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
