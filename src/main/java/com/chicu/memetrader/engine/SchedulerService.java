package com.chicu.memetrader.engine;

import java.util.concurrent.ScheduledFuture;

/**
 * Планировщик периодических задач по строковому ключу.
 *
 * Знает только про Runnable и интервал. Ни символов, ни агентов.
 */
public interface SchedulerService {

    /**
     * Запускает периодическую задачу. Задача с тем же ключом перезапускается.
     *
     * @param key         уникальный ключ задачи (например: "orchestrator")
     * @param intervalSec интервал между тиками, в секундах
     */
    ScheduledFuture<?> scheduleAtFixedRate(String key, Runnable task, long intervalSec);

    void cancel(String key);

    boolean isActive(String key);
}
