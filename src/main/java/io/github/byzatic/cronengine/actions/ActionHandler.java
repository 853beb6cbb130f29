package io.github.byzatic.cronengine.actions;

/**
 * Executes the actions of one category against the platform.
 */
@FunctionalInterface
public interface ActionHandler {
    ActionResult handle(ActionRequest request, ActionContext context) throws Exception;
}
