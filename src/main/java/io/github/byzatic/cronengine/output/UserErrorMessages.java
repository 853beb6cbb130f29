package io.github.byzatic.cronengine.output;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps raw runtime error text to a message fit for the delivery channel. Raw provider output is never
 * echoed; it goes to the status reporter and the run record instead.
 */
public final class UserErrorMessages {
    static final String RATE_LIMITED =
            "The model provider is rate limiting requests right now. This job will try again on its next scheduled run.";
    static final String TIMED_OUT =
            "This job took too long and was stopped. It will run again on its next schedule.";
    static final String OVERLOADED =
            "The model provider is overloaded at the moment. This job will try again on its next scheduled run.";
    static final String AUTH =
            "The runtime could not authenticate with the model provider. Please check its credentials.";
    static final String RUNTIME_MISSING =
            "The runtime could not be started on the host. Please check the installation.";
    static final String GENERIC =
            "Something went wrong while running this job. Details were sent to the status channel.";

    // status codes count only as whole numbers, not as digits inside durations or ids
    private static final Pattern RATE_LIMIT_STATUS = Pattern.compile("\\b429\\b");
    private static final Pattern OVERLOAD_STATUS = Pattern.compile("\\b(529|503)\\b");
    private static final Pattern AUTH_STATUS = Pattern.compile("\\b(401|403)\\b");

    private UserErrorMessages() {
    }

    public static @NotNull String map(@Nullable String rawMessage) {
        String m = rawMessage == null ? "" : rawMessage.toLowerCase(Locale.ROOT);
        if (m.contains("rate limit") || m.contains("rate_limit") || m.contains("too many requests")
                || RATE_LIMIT_STATUS.matcher(m).find()) {
            return RATE_LIMITED;
        }
        if (m.contains("timed out") || m.contains("timeout")) {
            return TIMED_OUT;
        }
        if (m.contains("overloaded") || OVERLOAD_STATUS.matcher(m).find()) {
            return OVERLOADED;
        }
        if (m.contains("unauthorized") || AUTH_STATUS.matcher(m).find()
                || m.contains("api key") || m.contains("authentication")) {
            return AUTH;
        }
        if (m.contains("enoent") || m.contains("command not found") || m.contains("failed to start")) {
            return RUNTIME_MISSING;
        }
        return GENERIC;
    }
}
