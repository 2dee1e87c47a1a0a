package com.chicu.memetrader.web.controller.api.dto;

/**
 * Режимы движка и краткая сводка.
 *
 * @param traders кол-во агентов в реестре
 * @param running крутится ли таймер оркестратора
 */
public record ModeStatus(
        boolean drain,
        boolean pause,
        boolean universeComplete,
        int traders,
        boolean running
) {
}
