package io.github.byzatic.cronengine.actions;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of one executed action.
 */
public final class ActionResult {
    private final boolean ok;
    private final String summary;
    private final String error;

    private ActionResult(boolean ok, String summary, String error) {
        this.ok = ok;
        this.summary = summary;
        this.error = error;
    }

    public static ActionResult ok(String summary) {
        return new ActionResult(true, summary, null);
    }

    public static ActionResult failed(String error) {
        return new ActionResult(false, null, error);
    }

    public boolean isOk() {
        return ok;
    }

    public @Nullable String getSummary() {
        return summary;
    }

    public @Nullable String getError() {
        return error;
    }

    /**
     * Line appended to the visible output: {@code Done: ...} or {@code Failed: ...}.
     */
    public String toResultLine() {
        return ok ? "Done: " + summary : "Failed: " + error;
    }

    @Override
    public String toString() {
        return "ActionResult{" + toResultLine() + '}';
    }
}
