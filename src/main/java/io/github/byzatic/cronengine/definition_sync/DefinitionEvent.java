package io.github.byzatic.cronengine.definition_sync;

import java.nio.file.Path;
import java.util.Objects;

final class DefinitionEvent {

    enum Type {
        CREATED, MODIFIED, DELETED
    }

    final Path path;
    final Type type;

    DefinitionEvent(Path path, Type type) {
        this.path = Objects.requireNonNull(path, "path");
        this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * Folds a newer change of the same file into this pending one.
     *
     * @return the combined change, or {@code null} when the two cancel out
     */
    static DefinitionEvent merge(DefinitionEvent pending, DefinitionEvent next) {
        if (pending == null) return next;
        switch (pending.type) {
            case CREATED:
                if (next.type == Type.DELETED) return null;
                return pending;
            case DELETED:
                if (next.type == Type.DELETED) return pending;
                return new DefinitionEvent(next.path, Type.MODIFIED);
            default:
                return next;
        }
    }

    @Override
    public String toString() {
        return "DefinitionEvent{path=" + path + ", type=" + type + '}';
    }
}
