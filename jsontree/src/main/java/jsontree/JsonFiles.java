package jsontree;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Whole-file byte I/O used by {@link Json#readFile(Path)} and {@link Json#writeFile(Path, JsonValue)}.
 *
 * <p> Implementations decide about retries; the JSON layer never retries.
 *
 * @since 0.1.0
 */
public interface JsonFiles {

    /**
     * Read the entire content of {@code path}.
     */
    byte[] read(Path path) throws IOException;

    /**
     * Replace the content of {@code path} with {@code bytes}.
     */
    void write(Path path, byte[] bytes) throws IOException;

    /**
     * The default implementation on top of {@link java.nio.file.Files}. Writes go to a temporary sibling file that is
     * then moved over the target, so a failed write leaves the previous content in place.
     */
    static JsonFiles nio() {
        return NioJsonFiles.INSTANCE;
    }
}
