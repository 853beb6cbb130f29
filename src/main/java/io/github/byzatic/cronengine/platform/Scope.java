package io.github.byzatic.cronengine.platform;

import java.util.Objects;

/**
 * Owning scope of a job on the chat platform (a guild, workspace or team).
 */
public final class Scope {
    private final String id;
    private final String name;

    public Scope(String id, String name) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "Scope{id='" + id + "', name='" + name + "'}";
    }
}
