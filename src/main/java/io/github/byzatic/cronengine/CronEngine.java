package io.github.byzatic.cronengine;

import io.github.byzatic.cronengine.actions.ActionCategory;
import io.github.byzatic.cronengine.actions.ActionDispatcher;
import io.github.byzatic.cronengine.base_exceptions.OperationTimedOutException;
import io.github.byzatic.cronengine.concurrency_limiter.ConcurrencyLimitedRuntime;
import io.github.byzatic.cronengine.definition_sync.DefinitionSync;
import io.github.byzatic.cronengine.definition_sync.JobDefinitionWatcher;
import io.github.byzatic.cronengine.executor.CronJobExecutor;
import io.github.byzatic.cronengine.executor.ExecutorContext;
import io.github.byzatic.cronengine.job_lock.JobLockInterface;
import io.github.byzatic.cronengine.platform.PlatformDelivery;
import io.github.byzatic.cronengine.platform.StatusReporter;
import io.github.byzatic.cronengine.run_record.JsonRunRecordStore;
import io.github.byzatic.cronengine.runtime.RuntimeAdapter;
import io.github.byzatic.cronengine.schedulers.JobScheduler;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One process's cron engine: run record store, job lock directory, concurrency-limited runtime, scheduler,
 * executor and, optionally, a watched directory of job definitions.
 * <p>
 * {@link #close()} stops admitting ticks, stops watching definitions, kills active runtime invocations and
 * waits a bounded time for in-flight runs before closing the runtime adapter. Job locks are not released here; a killed process's locks are
 * recovered by the next acquirer once their owner is no longer alive.
 */
public final class CronEngine implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(CronEngine.class);

    private final RuntimeAdapter runtime;
    private final JsonRunRecordStore recordStore;
    private final CronJobExecutor executor;
    private final JobScheduler scheduler;
    private final DefinitionSync definitionSync;
    private final JobDefinitionWatcher watcher;
    private final Duration drainTimeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private CronEngine(Builder b) throws IOException {
        this.runtime = ConcurrencyLimitedRuntime.wrap(Objects.requireNonNull(b.runtime, "runtime"), b.maxConcurrentInvocations);
        this.recordStore = b.recordStorePath != null ? JsonRunRecordStore.load(b.recordStorePath, b.clock) : null;
        if (b.lockDir != null) {
            Files.createDirectories(b.lockDir);
        }
        this.drainTimeout = b.drainTimeout;

        ExecutorContext.Builder ctx = ExecutorContext.builder()
                .runtime(runtime)
                .defaultModel(b.defaultModel)
                .cwd(b.cwd)
                .tools(b.tools)
                .timeout(b.timeout)
                .status(b.status)
                .delivery(b.delivery)
                .allowChannelIds(b.allowChannelIds)
                .actionsEnabled(b.actionsEnabled)
                .enabledCategories(b.enabledCategories)
                .actionDispatcher(b.actionDispatcher)
                .recordStore(recordStore)
                .lockDir(b.lockDir)
                .permissionNote(b.permissionNote);
        if (b.jobLock != null) {
            ctx.jobLock(b.jobLock);
        }
        this.executor = new CronJobExecutor(ctx.build());
        this.scheduler = JobScheduler.builder()
                .handler(executor)
                .clock(b.clock)
                .drainTimeout(b.drainTimeout)
                .build();

        if (b.definitionsDir != null) {
            Files.createDirectories(b.definitionsDir);
            this.definitionSync = new DefinitionSync(scheduler, recordStore, b.definitionsDir);
            this.watcher = JobDefinitionWatcher.builder()
                    .rootPath(b.definitionsDir)
                    .suffix(DefinitionSync.SUFFIX)
                    .listener(definitionSync)
                    .pollingIntervalMillis(b.pollingIntervalMillis)
                    .build();
        } else {
            this.definitionSync = null;
            this.watcher = null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the definition directory, if any, and starts watching it.
     */
    public void start() throws IOException {
        if (closed.get()) {
            throw new IllegalStateException("engine is closed");
        }
        if (definitionSync != null) {
            definitionSync.syncAll();
            watcher.start();
        }
        logger.info("cron:engine started runtime={} jobs={}", runtime.id(), scheduler.listJobs().size());
    }

    public @NotNull JobScheduler getScheduler() {
        return scheduler;
    }

    public @NotNull CronJobExecutor getExecutor() {
        return executor;
    }

    public @NotNull RuntimeAdapter getRuntime() {
        return runtime;
    }

    public @NotNull Optional<JsonRunRecordStore> getRecordStore() {
        return Optional.ofNullable(recordStore);
    }

    public @NotNull Optional<DefinitionSync> getDefinitionSync() {
        return Optional.ofNullable(definitionSync);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        scheduler.shutdown();
        if (watcher != null) {
            watcher.close();
        }
        runtime.killActive();
        try {
            scheduler.awaitTermination(drainTimeout);
        } catch (OperationTimedOutException e) {
            logger.warn("cron:engine {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        runtime.close();
        logger.info("cron:engine stopped {}", executor.getStats());
    }

    public static final class Builder {
        private RuntimeAdapter runtime;
        private int maxConcurrentInvocations = 0;
        private PlatformDelivery delivery;
        private StatusReporter status = StatusReporter.NOOP;
        private String defaultModel;
        private Path cwd;
        private List<String> tools = List.of();
        private Duration timeout;
        private Collection<String> allowChannelIds;
        private boolean actionsEnabled;
        private Collection<ActionCategory> enabledCategories = List.of();
        private ActionDispatcher actionDispatcher;
        private String permissionNote;
        private Path recordStorePath;
        private Path lockDir;
        private JobLockInterface jobLock;
        private Path definitionsDir;
        private long pollingIntervalMillis = 1000;
        private Duration drainTimeout = Duration.ofSeconds(10);
        private Clock clock = Clock.systemUTC();

        /**
         * The engine takes ownership of {@code runtime} and closes it on {@link CronEngine#close()}.
         */
        public Builder runtime(RuntimeAdapter runtime) {
            this.runtime = runtime;
            return this;
        }

        /**
         * Process-wide cap on simultaneous runtime invocations; 0 or less means unlimited.
         */
        public Builder maxConcurrentInvocations(int maxConcurrentInvocations) {
            this.maxConcurrentInvocations = maxConcurrentInvocations;
            return this;
        }

        public Builder delivery(PlatformDelivery delivery) {
            this.delivery = delivery;
            return this;
        }

        public Builder status(StatusReporter status) {
            this.status = Objects.requireNonNull(status, "status");
            return this;
        }

        public Builder defaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
            return this;
        }

        public Builder cwd(Path cwd) {
            this.cwd = cwd;
            return this;
        }

        public Builder tools(List<String> tools) {
            this.tools = Objects.requireNonNull(tools, "tools");
            return this;
        }

        public Builder timeout(@Nullable Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder allowChannelIds(@Nullable Collection<String> allowChannelIds) {
            this.allowChannelIds = allowChannelIds;
            return this;
        }

        public Builder actions(ActionDispatcher dispatcher, Collection<ActionCategory> enabledCategories) {
            this.actionsEnabled = true;
            this.actionDispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
            this.enabledCategories = Objects.requireNonNull(enabledCategories, "enabledCategories");
            return this;
        }

        public Builder permissionNote(@Nullable String permissionNote) {
            this.permissionNote = permissionNote;
            return this;
        }

        public Builder recordStorePath(@Nullable Path recordStorePath) {
            this.recordStorePath = recordStorePath;
            return this;
        }

        public Builder lockDir(@Nullable Path lockDir) {
            this.lockDir = lockDir;
            return this;
        }

        public Builder jobLock(JobLockInterface jobLock) {
            this.jobLock = jobLock;
            return this;
        }

        /**
         * Directory of {@code *.json} job definitions to load on {@link CronEngine#start()} and watch afterwards.
         */
        public Builder definitionsDir(@Nullable Path definitionsDir) {
            this.definitionsDir = definitionsDir;
            return this;
        }

        public Builder pollingIntervalMillis(long pollingIntervalMillis) {
            this.pollingIntervalMillis = pollingIntervalMillis;
            return this;
        }

        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public CronEngine build() throws IOException {
            return new CronEngine(this);
        }
    }
}
