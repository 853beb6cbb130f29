package io.github.byzatic.cronengine.definition_sync;

import org.apache.commons.vfs2.FileObject;
import org.apache.commons.vfs2.FileSystemException;

import java.util.Objects;

/**
 * Size and modification time of a definition file, compared between polls.
 */
final class FileSnapshot {
    private final long size;
    private final long lastModified;

    FileSnapshot(long size, long lastModified) {
        this.size = size;
        this.lastModified = lastModified;
    }

    static FileSnapshot of(FileObject fo) throws FileSystemException {
        if (fo == null || !fo.exists() || !fo.isFile()) {
            return new FileSnapshot(-1L, -1L);
        }
        return new FileSnapshot(fo.getContent().getSize(), fo.getContent().getLastModifiedTime());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileSnapshot)) return false;
        FileSnapshot that = (FileSnapshot) o;
        return size == that.size && lastModified == that.lastModified;
    }

    @Override
    public int hashCode() {
        return Objects.hash(size, lastModified);
    }

    @Override
    public String toString() {
        return "FileSnapshot{size=" + size + ", lastModified=" + lastModified + '}';
    }
}
