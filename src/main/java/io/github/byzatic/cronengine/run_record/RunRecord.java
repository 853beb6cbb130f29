package io.github.byzatic.cronengine.run_record;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable outcome history of one job, keyed by cronId.
 * Instances handed out by a store are copies; mutating them does not change the store.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RunRecord {
    private String cronId;
    private String threadId;
    private int runCount;
    private Instant lastRunAt;
    private RunStatus lastStatus;
    private String lastError;
    private String model;
    private String modelOverride;
    private String cadence;
    private List<String> purposeTags;
    private boolean disabled;

    public RunRecord() {
    }

    public RunRecord(String cronId, @Nullable String threadId) {
        this.cronId = cronId;
        this.threadId = threadId;
    }

    public RunRecord copy() {
        RunRecord r = new RunRecord(cronId, threadId);
        r.runCount = runCount;
        r.lastRunAt = lastRunAt;
        r.lastStatus = lastStatus;
        r.lastError = lastError;
        r.model = model;
        r.modelOverride = modelOverride;
        r.cadence = cadence;
        r.purposeTags = purposeTags == null ? null : new ArrayList<>(purposeTags);
        r.disabled = disabled;
        return r;
    }

    /**
     * Model used for the next run: an explicit override wins, then the previously classified model,
     * then {@code defaultModel}.
     */
    public String effectiveModel(String defaultModel) {
        if (modelOverride != null) return modelOverride;
        if (model != null) return model;
        return defaultModel;
    }

    public String getCronId() {
        return cronId;
    }

    public void setCronId(String cronId) {
        this.cronId = cronId;
    }

    public @Nullable String getThreadId() {
        return threadId;
    }

    public void setThreadId(String threadId) {
        this.threadId = threadId;
    }

    public int getRunCount() {
        return runCount;
    }

    public void setRunCount(int runCount) {
        this.runCount = runCount;
    }

    public @Nullable Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public @Nullable RunStatus getLastStatus() {
        return lastStatus;
    }

    public void setLastStatus(RunStatus lastStatus) {
        this.lastStatus = lastStatus;
    }

    public @Nullable String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public @Nullable String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public @Nullable String getModelOverride() {
        return modelOverride;
    }

    public void setModelOverride(String modelOverride) {
        this.modelOverride = modelOverride;
    }

    public @Nullable String getCadence() {
        return cadence;
    }

    public void setCadence(String cadence) {
        this.cadence = cadence;
    }

    public @Nullable List<String> getPurposeTags() {
        return purposeTags;
    }

    public void setPurposeTags(List<String> purposeTags) {
        this.purposeTags = purposeTags;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public void setDisabled(boolean disabled) {
        this.disabled = disabled;
    }

    @Override
    public String toString() {
        return "RunRecord{cronId='" + cronId + "', runCount=" + runCount + ", lastStatus=" + lastStatus +
                ", lastRunAt=" + lastRunAt +
                (lastError != null ? ", lastError='" + lastError + '\'' : "") + '}';
    }
}
