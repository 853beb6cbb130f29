package io.github.byzatic.cronengine.actions;

import java.util.List;

/**
 * Output text with action blocks removed, plus the accepted actions in order of appearance.
 */
public final class ParsedActions {
    private final String cleanText;
    private final List<ActionRequest> actions;

    public ParsedActions(String cleanText, List<ActionRequest> actions) {
        this.cleanText = cleanText;
        this.actions = List.copyOf(actions);
    }

    public String getCleanText() {
        return cleanText;
    }

    public List<ActionRequest> getActions() {
        return actions;
    }
}
