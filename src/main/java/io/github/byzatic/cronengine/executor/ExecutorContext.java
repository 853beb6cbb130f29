package io.github.byzatic.cronengine.executor;

import io.github.byzatic.cronengine.actions.ActionCategory;
import io.github.byzatic.cronengine.actions.ActionDispatcher;
import io.github.byzatic.cronengine.job_lock.DirectoryJobLock;
import io.github.byzatic.cronengine.job_lock.JobLockInterface;
import io.github.byzatic.cronengine.output.OutputFormatter;
import io.github.byzatic.cronengine.platform.PlatformDelivery;
import io.github.byzatic.cronengine.platform.StatusReporter;
import io.github.byzatic.cronengine.run_record.RunRecordStoreInterface;
import io.github.byzatic.cronengine.runtime.RuntimeAdapter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Collaborators and settings shared by every run of a {@link CronJobExecutor}.
 * <p>
 * Optional parts: without a record store nothing is recorded and the default model is always used; without a
 * lock directory no cross-process lock is taken; without an allow-set every resolved channel is accepted.
 */
public final class ExecutorContext {
    private final RuntimeAdapter runtime;
    private final String defaultModel;
    private final Path cwd;
    private final List<String> tools;
    private final Duration timeout;
    private final StatusReporter status;
    private final PlatformDelivery delivery;
    private final Set<String> allowChannelIds;
    private final boolean actionsEnabled;
    private final Set<ActionCategory> enabledCategories;
    private final ActionDispatcher actionDispatcher;
    private final RunRecordStoreInterface recordStore;
    private final Path lockDir;
    private final JobLockInterface jobLock;
    private final String permissionNote;
    private final int chunkLimit;
    private final int codeBlockMaxLines;

    private ExecutorContext(Builder b) {
        this.runtime = Objects.requireNonNull(b.runtime, "runtime");
        this.defaultModel = Objects.requireNonNull(b.defaultModel, "defaultModel");
        this.cwd = Objects.requireNonNull(b.cwd, "cwd");
        this.tools = List.copyOf(b.tools);
        this.timeout = b.timeout;
        this.status = b.status;
        this.delivery = Objects.requireNonNull(b.delivery, "delivery");
        this.allowChannelIds = b.allowChannelIds == null ? null : Set.copyOf(b.allowChannelIds);
        this.actionsEnabled = b.actionsEnabled;
        this.enabledCategories = b.enabledCategories.isEmpty()
                ? Set.of() : Set.copyOf(EnumSet.copyOf(b.enabledCategories));
        this.actionDispatcher = b.actionDispatcher;
        this.recordStore = b.recordStore;
        this.lockDir = b.lockDir;
        this.jobLock = b.jobLock != null ? b.jobLock : new DirectoryJobLock();
        this.permissionNote = b.permissionNote;
        this.chunkLimit = b.chunkLimit;
        this.codeBlockMaxLines = b.codeBlockMaxLines;
        if (actionsEnabled && actionDispatcher == null) {
            throw new IllegalStateException("actionsEnabled requires an actionDispatcher");
        }
        if (chunkLimit <= 0) {
            throw new IllegalArgumentException("chunkLimit must be > 0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public @NotNull RuntimeAdapter getRuntime() {
        return runtime;
    }

    public @NotNull String getDefaultModel() {
        return defaultModel;
    }

    public @NotNull Path getCwd() {
        return cwd;
    }

    public @NotNull List<String> getTools() {
        return tools;
    }

    public @Nullable Duration getTimeout() {
        return timeout;
    }

    public @NotNull StatusReporter getStatus() {
        return status;
    }

    public @NotNull PlatformDelivery getDelivery() {
        return delivery;
    }

    public @Nullable Set<String> getAllowChannelIds() {
        return allowChannelIds;
    }

    public boolean isActionsEnabled() {
        return actionsEnabled;
    }

    public @NotNull Set<ActionCategory> getEnabledCategories() {
        return enabledCategories;
    }

    public @Nullable ActionDispatcher getActionDispatcher() {
        return actionDispatcher;
    }

    public @Nullable RunRecordStoreInterface getRecordStore() {
        return recordStore;
    }

    public @Nullable Path getLockDir() {
        return lockDir;
    }

    public @NotNull JobLockInterface getJobLock() {
        return jobLock;
    }

    public @Nullable String getPermissionNote() {
        return permissionNote;
    }

    public int getChunkLimit() {
        return chunkLimit;
    }

    public int getCodeBlockMaxLines() {
        return codeBlockMaxLines;
    }

    public static final class Builder {
        private RuntimeAdapter runtime;
        private String defaultModel;
        private Path cwd;
        private List<String> tools = List.of();
        private Duration timeout;
        private StatusReporter status = StatusReporter.NOOP;
        private PlatformDelivery delivery;
        private Collection<String> allowChannelIds;
        private boolean actionsEnabled;
        private Collection<ActionCategory> enabledCategories = List.of();
        private ActionDispatcher actionDispatcher;
        private RunRecordStoreInterface recordStore;
        private Path lockDir;
        private JobLockInterface jobLock;
        private String permissionNote;
        private int chunkLimit = OutputFormatter.DEFAULT_CHUNK_LIMIT;
        private int codeBlockMaxLines = OutputFormatter.DEFAULT_CODE_BLOCK_LINES;

        public Builder runtime(RuntimeAdapter runtime) {
            this.runtime = runtime;
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

        public Builder status(StatusReporter status) {
            this.status = Objects.requireNonNull(status, "status");
            return this;
        }

        public Builder delivery(PlatformDelivery delivery) {
            this.delivery = delivery;
            return this;
        }

        /**
         * Restricts delivery to these channel ids. A thread is accepted when its parent channel is listed.
         */
        public Builder allowChannelIds(@Nullable Collection<String> allowChannelIds) {
            this.allowChannelIds = allowChannelIds;
            return this;
        }

        public Builder actionsEnabled(boolean actionsEnabled) {
            this.actionsEnabled = actionsEnabled;
            return this;
        }

        public Builder enabledCategories(Collection<ActionCategory> enabledCategories) {
            this.enabledCategories = Objects.requireNonNull(enabledCategories, "enabledCategories");
            return this;
        }

        public Builder actionDispatcher(@Nullable ActionDispatcher actionDispatcher) {
            this.actionDispatcher = actionDispatcher;
            return this;
        }

        public Builder recordStore(@Nullable RunRecordStoreInterface recordStore) {
            this.recordStore = recordStore;
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
         * Extra text appended to every prompt, e.g. the workspace permission tier.
         */
        public Builder permissionNote(@Nullable String permissionNote) {
            this.permissionNote = permissionNote;
            return this;
        }

        public Builder chunkLimit(int chunkLimit) {
            this.chunkLimit = chunkLimit;
            return this;
        }

        public Builder codeBlockMaxLines(int codeBlockMaxLines) {
            this.codeBlockMaxLines = codeBlockMaxLines;
            return this;
        }

        public ExecutorContext build() {
            return new ExecutorContext(this);
        }
    }
}
