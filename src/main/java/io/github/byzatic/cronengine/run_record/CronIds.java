package io.github.byzatic.cronengine.run_record;

import com.google.common.io.BaseEncoding;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.security.SecureRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stable job identifiers: {@code cron-} followed by 8 lowercase hex chars.
 */
public final class CronIds {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Pattern MARKER = Pattern.compile("\\[cronId:([^\\]\\s]+)]");

    private CronIds() {
    }

    public static @NotNull String generate() {
        byte[] bytes = new byte[4];
        RANDOM.nextBytes(bytes);
        return "cron-" + BaseEncoding.base16().lowerCase().encode(bytes);
    }

    /**
     * Extracts the id from a {@code [cronId:...]} marker, as embedded in status messages.
     */
    public static @Nullable String parseFromContent(@Nullable String content) {
        if (content == null || content.isEmpty()) return null;
        Matcher m = MARKER.matcher(content);
        return m.find() ? m.group(1) : null;
    }

    public static @NotNull String marker(@NotNull String cronId) {
        return "[cronId:" + cronId + "]";
    }
}
