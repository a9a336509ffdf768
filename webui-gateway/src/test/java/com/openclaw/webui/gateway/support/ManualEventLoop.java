package com.openclaw.webui.gateway.support;

import com.openclaw.webui.common.infra.EventLoop;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs tasks inline on the calling thread; timers are held until
 * {@link #runDueTimers()} is called.
 */
public class ManualEventLoop implements EventLoop {

    public static final class ScheduledTask implements Timer {
        final Runnable task;
        final long delayMs;
        boolean cancelled;
        boolean ran;

        ScheduledTask(Runnable task, long delayMs) {
            this.task = task;
            this.delayMs = delayMs;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        public long delayMs() {
            return delayMs;
        }

        public boolean isCancelled() {
            return cancelled;
        }
    }

    private final List<ScheduledTask> timers = new ArrayList<>();

    @Override
    public void execute(Runnable task) {
        task.run();
    }

    @Override
    public Timer schedule(Runnable task, long delayMs) {
        ScheduledTask t = new ScheduledTask(task, delayMs);
        timers.add(t);
        return t;
    }

    /** Every timer ever scheduled, in order. */
    public List<ScheduledTask> timers() {
        return timers;
    }

    public List<Long> scheduledDelays() {
        return timers.stream().map(ScheduledTask::delayMs).toList();
    }

    public long pendingTimerCount() {
        return timers.stream().filter(t -> !t.ran && !t.cancelled).count();
    }

    /** Fire all pending timers once. */
    public void runDueTimers() {
        for (ScheduledTask t : new ArrayList<>(timers)) {
            if (!t.ran && !t.cancelled) {
                t.ran = true;
                t.task.run();
            }
        }
    }
}
