package com.autorestake.schedule;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Handle of the cron registration. Cancelling never interrupts a run that is already executing.
 */
public record ScheduledJob(String cron, Instant createdAt, ScheduledFuture<?> future) {

    public void cancel() {
        future.cancel(false);
    }

    public boolean isCancelled() {
        return future.isCancelled();
    }
}
