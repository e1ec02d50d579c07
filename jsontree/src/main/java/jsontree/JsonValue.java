package jsontree;

import java.util.Map;
import lombok.SneakyThrows;
import org.jspecify.annotations.Nullable;

/**
 * A node of a JSON document tree.
 *
 * <p> Exactly one of six variants is active, see {@link #type()}. Scalars ({@link JsonBoolean}, {@link JsonNumber},
 * {@link JsonString}, {@link JsonNull}) are immutable records. Containers ({@link JsonObject}, {@link JsonArray}) are
 * mutable and own their children: inserting a value hands it over to the container, and a container can have at most
 * one parent.
 *
 * @since 0.1.0
 */
public sealed interface JsonValue permits JsonArray, JsonBoolean, JsonNull, JsonNumber, JsonObject, JsonString {

    JsonType type();

    /**
     * Deep copy of this value. The copy has no parent and shares no mutable storage with this value.
     *
     * @return independent copy
     */
    JsonValue duplicate();

    /**
     * Compact JSON text of this value.
     *
     * @return JSON text
     * @see Json#stringify(JsonValue)
     */
    default String stringify() {
        return Json.stringify(this);
    }

    /**
     * Build a tree from plain Java values.
     *
     * <p> {@code null} becomes {@link JsonNull}, numbers become {@link JsonNumber}, strings and characters become
     * {@link JsonString}, arrays and iterables become {@link JsonArray}, maps and records become {@link JsonObject}.
     * A {@link JsonValue} is returned as is, so ownership rules apply when it ends up inside a new container.
     *
     * @param o plain value, may be {@code null}
     * @return new tree
     * @throws IllegalArgumentException if {@code o} has no JSON counterpart
     */
    @SneakyThrows
    static JsonValue fromJavaObject(@Nullable Object o) {
        if (o == null) return JsonNull.of();
        if (o instanceof JsonValue jsonValue) return jsonValue;
        if (o instanceof Boolean bool) return JsonBoolean.of(bool);
        if (o instanceof Number number) return new JsonNumber(number.doubleValue());
        if (o instanceof CharSequence string) return new JsonString(string.toString());
        if (o instanceof Character c) return new JsonString(String.valueOf(c));
        if (o instanceof Object[] array) {
            var values = new JsonArray();
            for (var e : array) values.append(fromJavaObject(e));
            return values;
        }
        if (o instanceof Iterable<?> iterable) {
            var values = new JsonArray();
            for (var e : iterable) values.append(fromJavaObject(e));
            return values;
        }
        if (o instanceof Map<?, ?> map) {
            var values = new JsonObject();
            for (var en : map.entrySet()) {
                values.set(String.valueOf(en.getKey()), fromJavaObject(en.getValue()));
            }
            return values;
        }
        if (o instanceof Record record) {
            var values = new JsonObject();
            for (var c : record.getClass().getRecordComponents()) {
                var accessor = c.getAccessor();
                accessor.setAccessible(true);
                values.set(c.getName(), fromJavaObject(accessor.invoke(record)));
            }
            return values;
        }
        throw new IllegalArgumentException("No JSON representation for type " + o.getClass().getName());
    }
}
