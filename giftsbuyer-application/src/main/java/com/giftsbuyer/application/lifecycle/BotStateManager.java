package com.giftsbuyer.application.lifecycle;

import java.time.Duration;

/**
 * Run/stop switch shared between the monitor thread and whoever cancels it
 * (shutdown hook, tests). A stop wakes any thread blocked in {@link #awaitStop(Duration)}.
 */
public class BotStateManager {

    private volatile BotState state = BotState.STOPPED;
    private boolean stopRequested;

    public synchronized void start() {
        stopRequested = false;
        state = BotState.RUNNING;
    }

    /**
     * Enters RUNNING unless {@link #stop()} was called before.
     *
     * @return false if a stop was already requested
     */
    public synchronized boolean startUnlessStopRequested() {
        if (stopRequested) return false;
        state = BotState.RUNNING;
        return true;
    }

    public synchronized void stop() {
        stopRequested = true;
        state = BotState.STOPPED;
        notifyAll();
    }

    public synchronized BotState getState() { return state; }

    public boolean isRunning() { return state == BotState.RUNNING; }

    /**
     * Sleeps up to {@code timeout} or until stopped.
     *
     * @return true if the bot is still running when the wait ends
     */
    public synchronized boolean awaitStop(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (state == BotState.RUNNING) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0) break;
            wait(remainingMs);
        }
        return state == BotState.RUNNING;
    }
}
