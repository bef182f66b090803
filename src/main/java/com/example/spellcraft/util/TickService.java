package com.example.spellcraft.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-cadence scheduler for the engine's periodic work (effect decay, cooldown rounds).
 * A single daemon thread runs every task, so ticks never overlap each other.
 */
public class TickService {

    private static final Logger logger = LoggerFactory.getLogger(TickService.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public TickService() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "spellcraft-tick");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register a named task. A task with the same name is cancelled and replaced.
     * Exceptions thrown by the task are logged and do not stop later runs.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(String name, Runnable task, long initialDelayMs, long periodMs) {
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("[TickService] task '{}' failed", name, e);
            }
        };
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(guarded, initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = tasks.put(name, f);
        if (previous != null) {
            previous.cancel(false);
        }
        return f;
    }

    public boolean isScheduled(String name) {
        ScheduledFuture<?> f = tasks.get(name);
        return f != null && !f.isCancelled();
    }

    public boolean cancel(String name) {
        ScheduledFuture<?> f = tasks.remove(name);
        if (f == null) return false;
        return f.cancel(false);
    }

    public void shutdown() {
        for (ScheduledFuture<?> f : tasks.values()) {
            f.cancel(false);
        }
        tasks.clear();
        scheduler.shutdownNow();
    }
}
