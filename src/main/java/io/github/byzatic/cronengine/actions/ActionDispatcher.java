package io.github.byzatic.cronengine.actions;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Set;

/**
 * Turns runtime output into platform mutations.
 */
public interface ActionDispatcher {

    @NotNull ParsedActions parse(@NotNull String text, @NotNull Set<ActionCategory> enabledCategories);

    /**
     * Executes actions in order. Never throws; a failing action yields a failed result in its slot.
     */
    @NotNull List<ActionResult> execute(@NotNull List<ActionRequest> actions, @NotNull ActionContext context);
}
