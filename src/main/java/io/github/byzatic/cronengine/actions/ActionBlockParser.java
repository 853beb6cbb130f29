package io.github.byzatic.cronengine.actions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code <discord-action>{...}</discord-action>} blocks from runtime output.
 * <p>
 * Every block is removed from the visible text. A block becomes an {@link ActionRequest} only when
 * its body is a JSON object with a known {@code type} whose category is enabled.
 */
public class ActionBlockParser {
    private static final Logger logger = LoggerFactory.getLogger(ActionBlockParser.class);

    public static final String OPEN_TAG = "<discord-action>";
    public static final String CLOSE_TAG = "</discord-action>";

    private static final Pattern BLOCK = Pattern.compile(
            Pattern.quote(OPEN_TAG) + "([\\s\\S]*?)" + Pattern.quote(CLOSE_TAG));
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    private static final Map<String, ActionCategory> CATEGORY_BY_TYPE = buildIndex();

    private final ObjectMapper mapper;

    public ActionBlockParser() {
        this(new ObjectMapper());
    }

    public ActionBlockParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    private static Map<String, ActionCategory> buildIndex() {
        Map<String, ActionCategory> index = new HashMap<>();
        for (ActionCategory category : ActionCategory.values()) {
            for (String type : category.actionTypes()) {
                index.put(type, category);
            }
        }
        return Map.copyOf(index);
    }

    /**
     * @return category owning {@code type}, or {@code null} for unknown types
     */
    public static @Nullable ActionCategory categoryOf(String type) {
        return CATEGORY_BY_TYPE.get(type);
    }

    public @NotNull ParsedActions parse(@NotNull String text, @NotNull Set<ActionCategory> enabledCategories) {
        List<ActionRequest> actions = new ArrayList<>();
        Map<ActionCategory, Integer> rejected = new EnumMap<>(ActionCategory.class);

        Matcher m = BLOCK.matcher(text);
        StringBuilder clean = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(clean, "");
            ActionRequest request = toRequest(m.group(1));
            if (request == null) {
                continue;
            }
            if (enabledCategories.contains(request.getCategory())) {
                actions.add(request);
            } else {
                rejected.merge(request.getCategory(), 1, Integer::sum);
            }
        }
        m.appendTail(clean);

        if (!rejected.isEmpty()) {
            logger.debug("actions: dropped requests for disabled categories {}", rejected);
        }
        String cleanText = EXCESS_NEWLINES.matcher(clean.toString()).replaceAll("\n\n").trim();
        return new ParsedActions(cleanText, actions);
    }

    private @Nullable ActionRequest toRequest(String body) {
        JsonNode node;
        try {
            node = mapper.readTree(body.trim());
        } catch (JsonProcessingException e) {
            logger.debug("actions: malformed action block ignored: {}", e.getOriginalMessage());
            return null;
        }
        if (node == null || !node.isObject()) {
            logger.debug("actions: action block is not a JSON object");
            return null;
        }
        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            logger.debug("actions: action block without a type");
            return null;
        }
        String type = typeNode.asText();
        ActionCategory category = CATEGORY_BY_TYPE.get(type);
        if (category == null) {
            logger.debug("actions: unknown action type '{}'", type);
            return null;
        }
        return new ActionRequest(type, category, (ObjectNode) node);
    }
}
