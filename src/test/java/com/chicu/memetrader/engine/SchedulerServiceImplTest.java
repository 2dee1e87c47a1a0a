package com.chicu.memetrader.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerServiceImplTest {

    private final SchedulerServiceImpl scheduler = new SchedulerServiceImpl();

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void task_shouldRunImmediately_andCancelByKey() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.scheduleAtFixedRate("t", ran::countDown, 60);

        assertTrue(ran.await(2, TimeUnit.SECONDS));
        assertTrue(scheduler.isActive("t"));

        scheduler.cancel("t");
        assertFalse(scheduler.isActive("t"));
    }

    @Test
    void failingTask_shouldKeepSchedule() throws Exception {
        CountDownLatch runs = new CountDownLatch(2);

        scheduler.scheduleAtFixedRate("boom", () -> {
            runs.countDown();
            throw new IllegalStateException("boom");
        }, 1);

        assertTrue(runs.await(3, TimeUnit.SECONDS));
        assertTrue(scheduler.isActive("boom"));
    }

    @Test
    void nonPositiveInterval_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleAtFixedRate("x", () -> { }, 0));
    }
}
