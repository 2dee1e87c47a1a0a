package com.chicu.memetrader.trader;

/**
 * Состояние агента одного символа.
 *
 * IDLE → BUYING → POSITION → SELLING → IDLE
 */
public enum AgentState {
    /** Нет позиции и нет ордера в работе */
    IDLE,
    /** BUY отправлен, ждём исполнения */
    BUYING,
    /** Позиция открыта */
    POSITION,
    /** SELL отправлен, ждём исполнения */
    SELLING
}
