package jsontree;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Exception thrown when JSON parsing, serialization, or file access fails.
 * This is the base exception for all jsontree errors.
 *
 * <p> Type mismatches in {@link JsonAccess} are not errors and never surface as exceptions.
 *
 * @since 0.1.0
 */
public class JsonException extends RuntimeException {

    /**
     * Constructs a new JsonException with the specified detail message.
     *
     * @param message the detail message
     */
    public JsonException(String message) {
        super(message);
    }

    /**
     * Constructs a new JsonException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Exception thrown when JSON parsing fails due to malformed JSON syntax.
     *
     * <p> The offset counts UTF-8 bytes from the start of the input; line and column are 1-based and count chars.
     */
    public static class ParseException extends JsonException {
        private final long offset;
        private final int line;
        private final int column;

        public ParseException(String message, long offset, int line, int column) {
            super(String.format("%s at line %d, column %d (offset %d)", message, line, column, offset));
            this.offset = offset;
            this.line = line;
            this.column = column;
        }

        public long getOffset() {
            return offset;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }

    /**
     * Exception thrown during JSON serialization.
     */
    public static class WriteException extends JsonException {
        public WriteException(String message) {
            super(message);
        }
    }

    /**
     * Exception thrown when the file collaborator fails to read or write a document.
     */
    public static class FileException extends JsonException {
        private final Path path;

        public FileException(String message, Path path, IOException cause) {
            super(String.format("%s (path: %s)", message, path), cause);
            this.path = path;
        }

        public Path getPath() {
            return path;
        }
    }

    /**
     * Exception thrown when a destroyed container is used again.
     */
    public static class ReleasedValueException extends JsonException {
        public ReleasedValueException(String type) {
            super(type + " has been destroyed and can no longer be used");
        }
    }
}
