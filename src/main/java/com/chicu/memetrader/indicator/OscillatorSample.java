package com.chicu.memetrader.indicator;

/**
 * Одна точка осциллятора.
 *
 * @param histogram main - signal
 */
public record OscillatorSample(double main, double signal, double histogram) {
}
