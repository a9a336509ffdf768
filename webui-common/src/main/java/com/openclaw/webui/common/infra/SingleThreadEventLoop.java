package com.openclaw.webui.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link EventLoop} backed by a single-thread scheduled executor.
 * A task that throws is logged; the loop keeps running.
 */
@Slf4j
public class SingleThreadEventLoop implements EventLoop, AutoCloseable {

    private final ScheduledExecutorService executor;

    public SingleThreadEventLoop(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        if (executor.isShutdown()) {
            log.debug("loop:rejected task after shutdown");
            return;
        }
        executor.execute(guarded(task));
    }

    @Override
    public Timer schedule(Runnable task, long delayMs) {
        if (executor.isShutdown()) {
            log.debug("loop:rejected timer after shutdown");
            return () -> { };
        }
        ScheduledFuture<?> future = executor.schedule(guarded(task), delayMs, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("loop:task failed: {}", e.getMessage(), e);
            }
        };
    }
}
