package io.github.byzatic.cronengine.run_record;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable per-job outcome history.
 * <p>
 * Precondition, not enforced: {@link #recordRun} for a given cronId is only issued by the holder of that
 * job's lock, so calls for the same cronId never race each other.
 */
public interface RunRecordStoreInterface {

    @NotNull Optional<RunRecord> getRecord(@NotNull String cronId);

    /**
     * Persists the outcome of a run before returning. Creates the record if it does not exist yet.
     *
     * @param error message for {@link RunStatus#ERROR}, ignored otherwise; truncated by the store
     */
    void recordRun(@NotNull String cronId, @NotNull RunStatus status, @Nullable String error) throws IOException;

    default void recordRun(@NotNull String cronId, @NotNull RunStatus status) throws IOException {
        recordRun(cronId, status, null);
    }
}
