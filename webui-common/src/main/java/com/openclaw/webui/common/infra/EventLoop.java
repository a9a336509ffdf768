package com.openclaw.webui.common.infra;

/**
 * Single-threaded executor that owns all relay state.
 * Tasks run to completion one at a time, in submission order.
 */
public interface EventLoop {

    /** Run {@code task} on the loop. */
    void execute(Runnable task);

    /** Run {@code task} on the loop after {@code delayMs}. */
    Timer schedule(Runnable task, long delayMs);

    /** Handle to a scheduled task. */
    interface Timer {
        void cancel();
    }
}
