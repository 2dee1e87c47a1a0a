package com.chicu.memetrader.strategy.signal;

public enum SignalType {
    NONE,
    BUY,
    SELL
}
