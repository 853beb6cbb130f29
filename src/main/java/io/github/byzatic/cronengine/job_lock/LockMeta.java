package io.github.byzatic.cronengine.job_lock;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Content of {@code meta.json} inside a lock directory.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LockMeta {
    private final long pid;
    private final String token;
    private final String acquiredAt;
    private final Long startTime;

    @JsonCreator
    public LockMeta(@JsonProperty("pid") long pid,
                    @JsonProperty("token") @NotNull String token,
                    @JsonProperty("acquiredAt") String acquiredAt,
                    @JsonProperty("startTime") @Nullable Long startTime) {
        this.pid = pid;
        this.token = Objects.requireNonNull(token, "token");
        this.acquiredAt = acquiredAt;
        this.startTime = startTime;
    }

    @JsonProperty("pid")
    public long getPid() {
        return pid;
    }

    @JsonProperty("token")
    public @NotNull String getToken() {
        return token;
    }

    @JsonProperty("acquiredAt")
    public String getAcquiredAt() {
        return acquiredAt;
    }

    /**
     * OS-level start time of the owning process, absent where the platform does not expose it.
     */
    @JsonProperty("startTime")
    public @Nullable Long getStartTime() {
        return startTime;
    }

    @Override
    public String toString() {
        return "LockMeta{pid=" + pid + ", acquiredAt='" + acquiredAt + "', startTime=" + startTime + '}';
    }
}
