package io.github.byzatic.cronengine.definition_sync;

import java.nio.file.Path;

/**
 * Receives settled changes of job definition files. Called on the watcher's dispatch thread.
 */
public interface DefinitionChangeListener {
    void onDefinitionCreated(Path file);

    void onDefinitionModified(Path file);

    void onDefinitionDeleted(Path file);
}
