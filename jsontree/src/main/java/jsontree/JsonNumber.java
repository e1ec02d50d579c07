package jsontree;

/**
 * A JSON number, always held as a double.
 *
 * <p> Equality follows {@link Double#compare}, so {@code 0.0} and {@code -0.0} differ and NaN equals itself.
 * Non-finite values can be constructed but are rejected by the writer.
 *
 * @since 0.1.0
 */
public record JsonNumber(double value) implements JsonValue {

    public static JsonNumber of(double value) {
        return new JsonNumber(value);
    }

    @Override
    public JsonType type() {
        return JsonType.NUMBER;
    }

    @Override
    public JsonNumber duplicate() {
        return new JsonNumber(value);
    }

    @Override
    public String toString() {
        return stringify();
    }
}
