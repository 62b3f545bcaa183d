package com.flagship.wager_engine.support;

import com.flagship.wager_engine.game.RoundTimer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Round timer driven by a virtual clock. Nothing fires until {@link #advance(Duration)} is
 * called; due tasks then run on the calling thread in due-time order.
 */
public class ManualRoundTimer implements RoundTimer {

    private final List<Task> tasks = new ArrayList<>();
    private Duration now = Duration.ZERO;
    private long sequence;

    @Override
    public synchronized TimerHandle after(Duration delay, Runnable task) {
        return schedule(now.plus(delay), null, task);
    }

    @Override
    public synchronized TimerHandle every(Duration period, Runnable task) {
        return schedule(now.plus(period), period, task);
    }

    /**
     * Moves the clock forward, running every task that becomes due on the way. Tasks may
     * schedule or cancel other tasks while they run.
     */
    public void advance(Duration duration) {
        Duration target;
        synchronized (this) {
            target = now.plus(duration);
        }
        while (true) {
            Task next;
            synchronized (this) {
                Optional<Task> due = tasks.stream()
                    .filter(t -> t.due.compareTo(target) <= 0)
                    .min(Comparator.comparing((Task t) -> t.due).thenComparingLong(t -> t.sequence));
                if (due.isEmpty()) {
                    now = target;
                    return;
                }
                next = due.get();
                now = next.due;
                if (next.period != null) {
                    next.due = next.due.plus(next.period);
                } else {
                    tasks.remove(next);
                }
            }
            next.runnable.run();
        }
    }

    public synchronized int pendingTasks() {
        return tasks.size();
    }

    /**
     * Drops every scheduled task.
     */
    public synchronized void clear() {
        tasks.clear();
    }

    private TimerHandle schedule(Duration due, Duration period, Runnable runnable) {
        Task task = new Task(due, period, runnable, sequence++);
        tasks.add(task);
        return () -> {
            synchronized (ManualRoundTimer.this) {
                tasks.remove(task);
            }
        };
    }

    private static final class Task {
        private Duration due;
        private final Duration period;
        private final Runnable runnable;
        private final long sequence;

        private Task(Duration due, Duration period, Runnable runnable, long sequence) {
            this.due = due;
            this.period = period;
            this.runnable = runnable;
            this.sequence = sequence;
        }
    }
}
