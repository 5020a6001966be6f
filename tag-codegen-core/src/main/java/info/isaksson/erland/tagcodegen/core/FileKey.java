package info.isaksson.erland.tagcodegen.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;

/**
 * Identity of an IR file on disk: its absolute normalized path (compared with the file system's own
 * case rules) and its last-modified time at full precision. Touching the file yields a different key.
 */
final class FileKey {
    final Path path;
    final FileTime lastModified;

    private FileKey(Path path, FileTime lastModified) {
        this.path = path;
        this.lastModified = lastModified;
    }

    static FileKey of(Path file) throws IOException {
        Path normalized = file.toAbsolutePath().normalize();
        return new FileKey(normalized, Files.getLastModifiedTime(normalized));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileKey)) return false;
        FileKey that = (FileKey) o;
        return path.equals(that.path) && lastModified.equals(that.lastModified);
    }

    @Override public int hashCode() {
        return Objects.hash(path, lastModified);
    }

    @Override public String toString() {
        return path + "@" + lastModified;
    }
}
