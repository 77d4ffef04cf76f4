package com.autorestake.schedule;

import com.autorestake.config.RunConfig;
import com.autorestake.notify.Notifier;
import com.autorestake.service.KeeperRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fires keeper runs on the configured cron cadence, plus once right after startup.
 * Only one run may be in flight: a tick that finds the previous run still going is skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KeeperScheduler {

    public enum State { STOPPED, SCHEDULED }

    private final KeeperRunService runService;
    private final TaskScheduler taskScheduler;
    private final RunConfig config;
    private final Notifier notifier;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledJob job;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        if (job != null) log.info("[keeper-scheduler] context closing, cancelling schedule");
        stop();
    }

    public synchronized void start() {
        if (job != null) {
            log.warn("[keeper-scheduler] already scheduled with cron {}", job.cron());
            return;
        }
        if (config.runOnStartup()) {
            log.info("[keeper-scheduler] startup run requested");
            taskScheduler.schedule(this::tick, Instant.now(clock));
        }

        ScheduledFuture<?> future = taskScheduler.schedule(this::scheduledTick, new CronTrigger(config.cron()));
        job = new ScheduledJob(config.cron(), Instant.now(clock), future);
        log.info("[keeper-scheduler] Keeper scheduled with cron pattern: {}", config.cron());
        notifier.notify("Restake Keeper started successfully", false);
    }

    public synchronized void stop() {
        ScheduledJob current = job;
        job = null;
        if (current != null) {
            current.cancel();
            log.info("[keeper-scheduler] schedule {} cancelled", current.cron());
        }
    }

    public State state() {
        return job == null ? State.STOPPED : State.SCHEDULED;
    }

    public boolean isRunning() {
        return running.get();
    }

    private void scheduledTick() {
        log.info("[keeper-scheduler] Scheduled keeper run starting...");
        tick();
    }

    /**
     * Runs the keeper unless a run is already in flight.
     *
     * @return false when the tick was skipped
     */
    public boolean tick() {
        if (!running.compareAndSet(false, true)) {
            log.warn("[keeper-scheduler] previous run still in progress, skipping this tick");
            return false;
        }
        try {
            runService.runKeeper();
        } catch (RuntimeException e) {
            log.error("[keeper-scheduler] run crashed: {}", e.toString(), e);
        } finally {
            running.set(false);
        }
        return true;
    }
}
