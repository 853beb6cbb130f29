package io.github.byzatic.cronengine.schedulers;

import io.github.byzatic.cronengine.base_exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;

/**
 * What a job does and when: schedule expression, IANA timezone, delivery channel and instruction text.
 */
public final class JobDefinition {
    public static final String DEFAULT_TIMEZONE = "UTC";

    private final String schedule;
    private final String timezone;
    private final String channel;
    private final String prompt;

    public JobDefinition(@NotNull String schedule, @Nullable String timezone,
                         @NotNull String channel, @NotNull String prompt) {
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.timezone = (timezone == null || timezone.isBlank()) ? DEFAULT_TIMEZONE : timezone;
        this.channel = Objects.requireNonNull(channel, "channel");
        this.prompt = Objects.requireNonNull(prompt, "prompt");
    }

    public @NotNull String getSchedule() {
        return schedule;
    }

    public @NotNull String getTimezone() {
        return timezone;
    }

    /**
     * Channel name or id the output is delivered to.
     */
    public @NotNull String getChannel() {
        return channel;
    }

    public @NotNull String getPrompt() {
        return prompt;
    }

    /**
     * Parses the schedule and timezone.
     *
     * @throws ValidationException bad schedule, unknown timezone, blank channel or prompt
     */
    public @NotNull CronExpr parseSchedule() throws ValidationException {
        if (channel.isBlank()) throw new ValidationException("channel", "must not be blank");
        if (prompt.isBlank()) throw new ValidationException("prompt", "must not be blank");
        try {
            return CronExpr.parse(schedule);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("schedule", e.getMessage(), e);
        }
    }

    public @NotNull ZoneId zoneId() throws ValidationException {
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ValidationException("timezone", "unknown timezone '" + timezone + "'", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobDefinition)) return false;
        JobDefinition that = (JobDefinition) o;
        return schedule.equals(that.schedule) && timezone.equals(that.timezone)
                && channel.equals(that.channel) && prompt.equals(that.prompt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schedule, timezone, channel, prompt);
    }

    @Override
    public String toString() {
        return "JobDefinition{schedule='" + schedule + "', timezone='" + timezone + "', channel='" + channel + "'}";
    }
}
