package io.github.byzatic.cronengine.schedulers;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Scheduler-side registration of one job.
 */
final class JobRecord {
    final CronJob job;
    final CronExpr cron;
    final ZoneId zone;

    volatile long generation;
    volatile boolean enabled = true;
    volatile Instant nextRun = null;

    JobRecord(CronJob job, CronExpr cron, ZoneId zone, long generation) {
        this.job = job;
        this.cron = cron;
        this.zone = zone;
        this.generation = generation;
    }
}
