package com.chicu.memetrader.engine;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class SchedulerServiceImpl implements SchedulerService {

    /**
     * Один поток: тики никогда не пересекаются, следующий ждёт окончания предыдущего.
     */
    private final ScheduledExecutorService executor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r);
                t.setDaemon(true);
                t.setName("meme-trader-tick");
                return t;
            });

    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(String key, Runnable task, long intervalSec) {
        if (intervalSec <= 0) {
            throw new IllegalArgumentException("intervalSec must be > 0");
        }

        cancel(key);

        // исключение из задачи отменило бы все следующие запуски
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("⏱ Scheduler: task '{}' failed: {}", key, e.getMessage(), e);
            }
        };

        ScheduledFuture<?> future = executor.scheduleAtFixedRate(guarded, 0, intervalSec, TimeUnit.SECONDS);

        tasks.put(key, future);

        log.info("⏱ Scheduler: started '{}' (interval={}s)", key, intervalSec);
        return future;
    }

    @Override
    public void cancel(String key) {
        ScheduledFuture<?> future = tasks.remove(key);
        if (future != null) {
            future.cancel(false);
            log.info("🛑 Scheduler: cancelled task '{}'", key);
        }
    }

    @Override
    public boolean isActive(String key) {
        ScheduledFuture<?> future = tasks.get(key);
        return future != null && !future.isCancelled() && !future.isDone();
    }

    @PreDestroy
    public void shutdown() {
        log.info("💤 Scheduler shutting down…");
        executor.shutdownNow();
    }
}
