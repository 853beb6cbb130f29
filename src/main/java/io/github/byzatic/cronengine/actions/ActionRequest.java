package io.github.byzatic.cronengine.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One structured action request embedded in runtime output.
 */
public final class ActionRequest {
    private final String type;
    private final ActionCategory category;
    private final ObjectNode payload;

    public ActionRequest(String type, ActionCategory category, ObjectNode payload) {
        this.type = Objects.requireNonNull(type, "type");
        this.category = Objects.requireNonNull(category, "category");
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public String getType() {
        return type;
    }

    public ActionCategory getCategory() {
        return category;
    }

    /**
     * Full JSON object of the request, including {@code type}.
     */
    public ObjectNode getPayload() {
        return payload;
    }

    public @Nullable String getString(String field) {
        JsonNode n = payload.get(field);
        return n != null && n.isValueNode() && !n.isNull() ? n.asText() : null;
    }

    @Override
    public String toString() {
        return "ActionRequest{type='" + type + "', category=" + category + '}';
    }
}
