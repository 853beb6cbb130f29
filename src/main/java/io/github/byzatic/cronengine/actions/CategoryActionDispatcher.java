package io.github.byzatic.cronengine.actions;

import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ActionDispatcher} backed by one {@link ActionHandler} per {@link ActionCategory}.
 * The handler table is fixed at build time.
 */
@ThreadSafe
public class CategoryActionDispatcher implements ActionDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(CategoryActionDispatcher.class);

    private final Map<ActionCategory, ActionHandler> handlers;
    private final ActionBlockParser parser;

    private CategoryActionDispatcher(Builder b) {
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(b.handlers));
        this.parser = b.parser;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Categories with a registered handler.
     */
    public Set<ActionCategory> supportedCategories() {
        return handlers.keySet();
    }

    @Override
    public @NotNull ParsedActions parse(@NotNull String text, @NotNull Set<ActionCategory> enabledCategories) {
        return parser.parse(text, enabledCategories);
    }

    @Override
    public @NotNull List<ActionResult> execute(@NotNull List<ActionRequest> actions, @NotNull ActionContext context) {
        List<ActionResult> results = new ArrayList<>(actions.size());
        for (ActionRequest action : actions) {
            results.add(executeOne(action, context));
        }
        return results;
    }

    private ActionResult executeOne(ActionRequest action, ActionContext context) {
        ActionHandler handler = handlers.get(action.getCategory());
        if (handler == null) {
            return ActionResult.failed("no handler for " + action.getType());
        }
        try {
            ActionResult result = handler.handle(action, context);
            if (result == null) {
                return ActionResult.failed(action.getType() + " returned no result");
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ActionResult.failed(action.getType() + " interrupted");
        } catch (Exception e) {
            logger.warn("actions: {} failed in channel {}", action.getType(), context.getChannel().getId(), e);
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ActionResult.failed(msg);
        }
    }

    public static class Builder {
        private final Map<ActionCategory, ActionHandler> handlers = new EnumMap<>(ActionCategory.class);
        private ActionBlockParser parser = new ActionBlockParser();

        public Builder handler(ActionCategory category, ActionHandler handler) {
            handlers.put(Objects.requireNonNull(category, "category"), Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder parser(ActionBlockParser parser) {
            this.parser = Objects.requireNonNull(parser, "parser");
            return this;
        }

        public CategoryActionDispatcher build() {
            return new CategoryActionDispatcher(this);
        }
    }
}
