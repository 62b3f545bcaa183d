package com.flagship.wager_engine.game;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link RoundTimer} backed by the application's {@link TaskScheduler}.
 */
@Component
@Slf4j
public class SchedulerRoundTimer implements RoundTimer {

    private final TaskScheduler taskScheduler;

    public SchedulerRoundTimer(@Qualifier("taskScheduler") TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    @Override
    public TimerHandle after(Duration delay, Runnable task) {
        ScheduledFuture<?> future = taskScheduler.schedule(guarded(task), Instant.now().plus(delay));
        return () -> future.cancel(false);
    }

    @Override
    public TimerHandle every(Duration period, Runnable task) {
        ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(guarded(task), Instant.now().plus(period), period);
        return () -> future.cancel(false);
    }

    // A periodic task that throws is never run again by the scheduler.
    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Round timer task failed", e);
            }
        };
    }
}
