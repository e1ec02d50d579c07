package jsontree;

import java.util.Objects;

/**
 *
 *
 * @since 0.1.0
 */
public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value");
    }

    public static JsonString of(String value) {
        return new JsonString(value);
    }

    @Override
    public JsonType type() {
        return JsonType.STRING;
    }

    @Override
    public JsonString duplicate() {
        return new JsonString(value);
    }

    @Override
    public String toString() {
        return stringify();
    }
}
