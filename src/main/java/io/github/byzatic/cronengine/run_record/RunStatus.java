package io.github.byzatic.cronengine.run_record;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one job run as persisted in its run record.
 */
public enum RunStatus {
    SUCCESS, ERROR, SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunStatus fromWireName(String value) {
        return RunStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
