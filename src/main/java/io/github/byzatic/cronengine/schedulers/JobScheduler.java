package io.github.byzatic.cronengine.schedulers;

import io.github.byzatic.cronengine.base_exceptions.OperationTimedOutException;
import io.github.byzatic.cronengine.base_exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Job registry plus timetable.
 * <ul>
 *   <li>One dispatcher thread takes due entries from a {@link DelayQueue}.</li>
 *   <li>A due job is handed to the {@link JobTickHandler} as a task on the execution queue; the dispatcher
 *       never waits for it and immediately computes the next tick.</li>
 *   <li>The scheduler does not guard against overlapping runs and has no failed state: both are the
 *       handler's concern.</li>
 * </ul>
 * Construct one per process and pass it to whoever needs the registry.
 */
public final class JobScheduler implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    private final JobTickHandler handler;
    private final ExecutorService executionQueue;
    private final Clock clock;
    private final Duration drainTimeout;
    private final DelayQueue<ScheduledEntry> queue = new DelayQueue<>();
    private final Map<String, JobRecord> jobs = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Thread dispatcher;

    private JobScheduler(Builder b) {
        this.handler = Objects.requireNonNull(b.handler, "handler");
        this.executionQueue = b.executionQueue != null ? b.executionQueue : defaultExecutionQueue();
        this.clock = b.clock;
        this.drainTimeout = b.drainTimeout;

        this.dispatcher = new Thread(this::dispatchLoop, "cron-dispatcher");
        this.dispatcher.setDaemon(true);
        this.dispatcher.start();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private JobTickHandler handler;
        private ExecutorService executionQueue;
        private Clock clock = Clock.systemUTC();
        private Duration drainTimeout = Duration.ofSeconds(10);

        /**
         * Receives due jobs; typically the executor.
         */
        public Builder handler(JobTickHandler handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Provide your own execution queue for due jobs.
         */
        public Builder executionQueue(ExecutorService executionQueue) {
            this.executionQueue = executionQueue;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /**
         * How long {@link #close()} waits for in-flight runs.
         */
        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = Objects.requireNonNull(drainTimeout);
            return this;
        }

        public JobScheduler build() {
            return new JobScheduler(this);
        }
    }

    // ======== Public API ========

    /**
     * Registers a job, replacing any registration with the same {@code id}. The definition is validated before
     * the existing job is touched, so an invalid update leaves the old schedule running.
     *
     * @param cronId stable id; {@code null} keeps the id of the replaced registration
     * @throws ValidationException invalid schedule, timezone, channel or prompt
     */
    public @NotNull CronJob register(@NotNull String id, @Nullable String threadId, @NotNull String guildId,
                                     @NotNull String name, @NotNull JobDefinition definition,
                                     @Nullable String cronId) throws ValidationException {
        CronExpr expr = definition.parseSchedule();
        ZoneId zone = definition.zoneId();

        JobRecord existing = jobs.get(id);
        String resolvedCronId = cronId != null ? cronId : (existing != null ? existing.job.getCronId() : "");
        CronJob job = new CronJob(id, resolvedCronId, threadId, guildId, name, definition);
        JobRecord rec = new JobRecord(job, expr, zone, generations.incrementAndGet());
        jobs.put(id, rec);
        scheduleNext(rec, clock.instant(), rec.generation);

        logger.info("cron:registered jobId={} cronId={} schedule='{}' timezone={} nextRun={}",
                id, resolvedCronId, definition.getSchedule(), definition.getTimezone(), rec.nextRun);
        return job;
    }

    public boolean unregister(@NotNull String id) {
        JobRecord rec = jobs.remove(id);
        if (rec == null) return false;
        rec.generation = -1;
        logger.info("cron:unregistered jobId={}", id);
        return true;
    }

    /**
     * Stops scheduling a job but keeps it registered.
     */
    public boolean disable(@NotNull String id) {
        JobRecord rec = jobs.get(id);
        if (rec == null) return false;
        rec.enabled = false;
        rec.generation = generations.incrementAndGet();
        rec.nextRun = null;
        logger.info("cron:disabled jobId={}", id);
        return true;
    }

    public boolean enable(@NotNull String id) {
        JobRecord rec = jobs.get(id);
        if (rec == null) return false;
        rec.enabled = true;
        long generation = generations.incrementAndGet();
        rec.generation = generation;
        scheduleNext(rec, clock.instant(), generation);
        logger.info("cron:enabled jobId={} nextRun={}", id, rec.nextRun);
        return true;
    }

    /**
     * Re-registers an existing job with a new definition, keeping its thread, scope, name and cronId.
     *
     * @return the new job, or empty if {@code id} is not registered
     */
    public @NotNull Optional<CronJob> reload(@NotNull String id, @NotNull JobDefinition definition)
            throws ValidationException {
        JobRecord existing = jobs.get(id);
        if (existing == null) return Optional.empty();
        CronJob old = existing.job;
        return Optional.of(register(id, old.getThreadId(), old.getGuildId(), old.getName(), definition, old.getCronId()));
    }

    public @NotNull Optional<CronJob> getJob(@NotNull String id) {
        JobRecord rec = jobs.get(id);
        return rec == null ? Optional.empty() : Optional.of(rec.job);
    }

    /**
     * Snapshot of the live registry.
     */
    public @NotNull List<JobInfo> listJobs() {
        List<JobInfo> out = new ArrayList<>();
        for (JobRecord r : jobs.values()) {
            JobDefinition def = r.job.getDefinition();
            out.add(new JobInfo(r.job.getId(), r.job.getCronId(), r.job.getName(), def.getSchedule(),
                    def.getTimezone(), r.nextRun, r.enabled, r.job.isRunning()));
        }
        return out;
    }

    /**
     * Removes every job. Runs already handed to the execution queue are not affected.
     */
    public void stopAll() {
        for (JobRecord r : jobs.values()) r.generation = -1;
        jobs.clear();
        queue.clear();
        logger.info("cron:stopAll");
    }

    /**
     * Stops admitting ticks. In-flight runs keep going; see {@link #awaitTermination(Duration)}.
     */
    public void shutdown() {
        if (!running.compareAndSet(true, false)) return;
        dispatcher.interrupt();
        stopAll();
        executionQueue.shutdown();
    }

    /**
     * Waits for in-flight runs after {@link #shutdown()}.
     *
     * @throws OperationTimedOutException runs were still active when {@code timeout} expired
     */
    public void awaitTermination(@NotNull Duration timeout) throws OperationTimedOutException, InterruptedException {
        if (!executionQueue.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new OperationTimedOutException("cron execution drain", timeout);
        }
    }

    @Override
    public void close() {
        shutdown();
        try {
            awaitTermination(drainTimeout);
        } catch (OperationTimedOutException e) {
            logger.warn("cron:close {}, interrupting remaining runs", e.getMessage());
            executionQueue.shutdownNow();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executionQueue.shutdownNow();
        }
    }

    // ======== Internal ========

    private void dispatchLoop() {
        while (running.get()) {
            try {
                ScheduledEntry entry = queue.take();
                JobRecord rec = jobs.get(entry.jobId);
                if (!entry.isCurrentFor(rec)) continue;

                submitRun(rec);

                Instant from = Instant.ofEpochMilli(Math.max(entry.triggerAtMillis, clock.millis()));
                scheduleNext(rec, from, entry.generation);
            } catch (InterruptedException ie) {
                if (!running.get()) break;
            } catch (RuntimeException t) {
                logger.error("cron:dispatcher error", t);
            }
        }
    }

    private void submitRun(JobRecord rec) {
        CronJob job = rec.job;
        logger.debug("cron:due jobId={} cronId={}", job.getId(), job.getCronId());
        try {
            executionQueue.execute(() -> {
                try {
                    handler.onTick(job);
                } catch (RuntimeException e) {
                    logger.error("cron:tick handler failed jobId={}", job.getId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("cron:tick rejected jobId={} (shutting down)", job.getId());
        }
    }

    private void scheduleNext(JobRecord rec, Instant from, long generation) {
        // a newer registration, disable or enable owns the timetable now
        if (rec.generation != generation) return;
        Optional<Instant> next = rec.cron.next(from, rec.zone);
        if (next.isPresent()) {
            rec.nextRun = next.get();
            queue.offer(new ScheduledEntry(rec.job.getId(), generation, next.get(), clock));
        } else {
            rec.nextRun = null;
            logger.warn("cron:no future fire time jobId={} schedule='{}'", rec.job.getId(), rec.cron);
        }
    }

    private static ExecutorService defaultExecutionQueue() {
        AtomicInteger seq = new AtomicInteger();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                Math.max(2, Runtime.getRuntime().availableProcessors()),
                Math.max(2, Runtime.getRuntime().availableProcessors()),
                60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "cron-exec-" + seq.incrementAndGet());
                    t.setDaemon(false);
                    t.setUncaughtExceptionHandler((th, ex) ->
                            logger.error("cron:uncaught in {}", th.getName(), ex));
                    return t;
                });
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
