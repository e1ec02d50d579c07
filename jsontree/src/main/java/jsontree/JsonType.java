package jsontree;

/**
 * The variant tag of a {@link JsonValue}.
 *
 * @since 0.1.0
 */
public enum JsonType {
    BOOLEAN,
    NUMBER,
    STRING,
    OBJECT,
    ARRAY,
    NULL
}
