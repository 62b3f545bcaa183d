package com.flagship.wager_engine.game;

import java.time.Duration;

/**
 * Timer abstraction used by the round drivers. Phase changes happen only when one of these
 * timers fires.
 */
public interface RoundTimer {

    /**
     * Runs {@code task} once after {@code delay}.
     */
    TimerHandle after(Duration delay, Runnable task);

    /**
     * Runs {@code task} repeatedly every {@code period}, first after one period.
     */
    TimerHandle every(Duration period, Runnable task);

    interface TimerHandle {
        void cancel();
    }
}
