package jsontree;

/**
 *
 *
 * @since 0.1.0
 */
public record JsonNull() implements JsonValue {

    private static final JsonNull INSTANCE = new JsonNull();

    public static JsonNull of() {
        return INSTANCE;
    }

    @Override
    public JsonType type() {
        return JsonType.NULL;
    }

    @Override
    public JsonNull duplicate() {
        return new JsonNull();
    }

    @Override
    public String toString() {
        return "null";
    }
}
