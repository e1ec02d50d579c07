package jsontree;

import java.nio.CharBuffer;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import org.jspecify.annotations.Nullable;

/**
 * Type-checked reads and writes of scalar fields in objects (by key) and arrays (by index).
 *
 * <p> A getter yields an empty result when the field is absent, the container is not of the expected variant, or
 * the field holds another variant than the one asked for. There is no coercion: a string {@code "1"} is not an int.
 *
 * <p> Integer getters round the stored double with {@link Math#rint} (ties to even, like C {@code lrint}) and then
 * narrow it with plain Java casts, so out-of-range values wrap around instead of saturating:
 * <pre>{@code
 * {"a": 2.5}    getInt(o, "a")   -> 2
 * {"a": 3.5}    getInt(o, "a")   -> 4
 * {"a": 300}    getInt8(o, "a")  -> 44
 * {"a": -1}     getUInt(o, "a")  -> 4294967295
 * }</pre>
 *
 * <p> Setters return {@code false} only when the container variant does not match, or when an array index is past
 * the end. Writing at {@code index == length} appends.
 *
 * @since 0.1.0
 */
public final class JsonAccess {

    private JsonAccess() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Object getters
    // ============================================================

    /**
     * Copy the string under {@code key} into {@code out}. At most {@code out.remaining()} chars are written; a longer
     * string is truncated and the call still succeeds. Truncation stops before a surrogate pair that does not fit
     * whole.
     *
     * @return whether a string was found
     */
    public static boolean getString(@Nullable JsonValue obj, String key, CharBuffer out) {
        return toText(Json.objGet(obj, key), out);
    }

    public static Optional<String> getString(@Nullable JsonValue obj, String key) {
        return toText(Json.objGet(obj, key));
    }

    public static OptionalInt getInt(@Nullable JsonValue obj, String key) {
        return toInt(Json.objGet(obj, key));
    }

    public static OptionalLong getUInt(@Nullable JsonValue obj, String key) {
        return toUInt(Json.objGet(obj, key));
    }

    public static OptionalInt getInt16(@Nullable JsonValue obj, String key) {
        return toInt16(Json.objGet(obj, key));
    }

    public static OptionalInt getUInt16(@Nullable JsonValue obj, String key) {
        return toUInt16(Json.objGet(obj, key));
    }

    public static OptionalInt getInt8(@Nullable JsonValue obj, String key) {
        return toInt8(Json.objGet(obj, key));
    }

    public static OptionalInt getUInt8(@Nullable JsonValue obj, String key) {
        return toUInt8(Json.objGet(obj, key));
    }

    public static Optional<Float> getFloat(@Nullable JsonValue obj, String key) {
        return toFloat(Json.objGet(obj, key));
    }

    public static OptionalDouble getDouble(@Nullable JsonValue obj, String key) {
        return toDouble(Json.objGet(obj, key));
    }

    public static Optional<Boolean> getBool(@Nullable JsonValue obj, String key) {
        return toBool(Json.objGet(obj, key));
    }

    /**
     * @return {@code true} only if {@code key} is present and holds {@code null}
     */
    public static boolean isNull(@Nullable JsonValue obj, String key) {
        return Json.objGet(obj, key) instanceof JsonNull;
    }

    // ============================================================
    // Array getters
    // ============================================================

    public static boolean getString(@Nullable JsonValue arr, int index, CharBuffer out) {
        return toText(Json.arrayGet(arr, index), out);
    }

    public static Optional<String> getString(@Nullable JsonValue arr, int index) {
        return toText(Json.arrayGet(arr, index));
    }

    public static OptionalInt getInt(@Nullable JsonValue arr, int index) {
        return toInt(Json.arrayGet(arr, index));
    }

    public static OptionalLong getUInt(@Nullable JsonValue arr, int index) {
        return toUInt(Json.arrayGet(arr, index));
    }

    public static OptionalInt getInt16(@Nullable JsonValue arr, int index) {
        return toInt16(Json.arrayGet(arr, index));
    }

    public static OptionalInt getUInt16(@Nullable JsonValue arr, int index) {
        return toUInt16(Json.arrayGet(arr, index));
    }

    public static OptionalInt getInt8(@Nullable JsonValue arr, int index) {
        return toInt8(Json.arrayGet(arr, index));
    }

    public static OptionalInt getUInt8(@Nullable JsonValue arr, int index) {
        return toUInt8(Json.arrayGet(arr, index));
    }

    public static Optional<Float> getFloat(@Nullable JsonValue arr, int index) {
        return toFloat(Json.arrayGet(arr, index));
    }

    public static OptionalDouble getDouble(@Nullable JsonValue arr, int index) {
        return toDouble(Json.arrayGet(arr, index));
    }

    public static Optional<Boolean> getBool(@Nullable JsonValue arr, int index) {
        return toBool(Json.arrayGet(arr, index));
    }

    public static boolean isNull(@Nullable JsonValue arr, int index) {
        return Json.arrayGet(arr, index) instanceof JsonNull;
    }

    // ============================================================
    // Object setters
    // ============================================================

    /**
     * @param value text, {@code null} stores an empty string
     */
    public static boolean setString(@Nullable JsonValue obj, String key, @Nullable String value) {
        return put(obj, key, Json.createString(value));
    }

    public static boolean setInt(@Nullable JsonValue obj, String key, int value) {
        return put(obj, key, new JsonNumber(value));
    }

    /**
     * @param value 32 bits read as an unsigned integer, see {@link Integer#toUnsignedLong}
     */
    public static boolean setUInt(@Nullable JsonValue obj, String key, int value) {
        return put(obj, key, new JsonNumber(Integer.toUnsignedLong(value)));
    }

    public static boolean setFloat(@Nullable JsonValue obj, String key, float value) {
        return put(obj, key, new JsonNumber(value));
    }

    public static boolean setDouble(@Nullable JsonValue obj, String key, double value) {
        return put(obj, key, new JsonNumber(value));
    }

    public static boolean setBool(@Nullable JsonValue obj, String key, boolean value) {
        return put(obj, key, JsonBoolean.of(value));
    }

    public static boolean setNull(@Nullable JsonValue obj, String key) {
        return put(obj, key, JsonNull.of());
    }

    // ============================================================
    // Array setters
    // ============================================================

    public static boolean setString(@Nullable JsonValue arr, int index, @Nullable String value) {
        return put(arr, index, Json.createString(value));
    }

    public static boolean setInt(@Nullable JsonValue arr, int index, int value) {
        return put(arr, index, new JsonNumber(value));
    }

    public static boolean setUInt(@Nullable JsonValue arr, int index, int value) {
        return put(arr, index, new JsonNumber(Integer.toUnsignedLong(value)));
    }

    public static boolean setFloat(@Nullable JsonValue arr, int index, float value) {
        return put(arr, index, new JsonNumber(value));
    }

    public static boolean setDouble(@Nullable JsonValue arr, int index, double value) {
        return put(arr, index, new JsonNumber(value));
    }

    public static boolean setBool(@Nullable JsonValue arr, int index, boolean value) {
        return put(arr, index, JsonBoolean.of(value));
    }

    public static boolean setNull(@Nullable JsonValue arr, int index) {
        return put(arr, index, JsonNull.of());
    }

    // ============================================================
    // Conversions
    // ============================================================

    private static boolean put(@Nullable JsonValue obj, String key, JsonValue value) {
        if (!(obj instanceof JsonObject o)) return false;
        o.set(key, value);
        return true;
    }

    private static boolean put(@Nullable JsonValue arr, int index, JsonValue value) {
        return arr instanceof JsonArray a && a.set(index, value);
    }

    private static boolean toText(@Nullable JsonValue v, CharBuffer out) {
        if (!(v instanceof JsonString s)) return false;
        var value = s.value();
        int n = Math.min(value.length(), out.remaining());
        // never split a surrogate pair
        if (n < value.length() && n > 0 && Character.isHighSurrogate(value.charAt(n - 1))) n--;
        out.put(value, 0, n);
        return true;
    }

    private static Optional<String> toText(@Nullable JsonValue v) {
        return v instanceof JsonString s ? Optional.of(s.value()) : Optional.empty();
    }

    /**
     * Round half to even, then convert to long. NaN becomes 0 and out-of-range values clamp, per Java's
     * double-to-long conversion.
     */
    private static OptionalLong toLong(@Nullable JsonValue v) {
        return v instanceof JsonNumber n ? OptionalLong.of((long) Math.rint(n.value())) : OptionalLong.empty();
    }

    private static OptionalInt toInt(@Nullable JsonValue v) {
        var l = toLong(v);
        return l.isPresent() ? OptionalInt.of((int) l.getAsLong()) : OptionalInt.empty();
    }

    private static OptionalLong toUInt(@Nullable JsonValue v) {
        var i = toInt(v);
        return i.isPresent() ? OptionalLong.of(Integer.toUnsignedLong(i.getAsInt())) : OptionalLong.empty();
    }

    private static OptionalInt toInt16(@Nullable JsonValue v) {
        var i = toInt(v);
        return i.isPresent() ? OptionalInt.of((short) i.getAsInt()) : OptionalInt.empty();
    }

    private static OptionalInt toUInt16(@Nullable JsonValue v) {
        var i = toInt(v);
        return i.isPresent() ? OptionalInt.of(Short.toUnsignedInt((short) i.getAsInt())) : OptionalInt.empty();
    }

    private static OptionalInt toInt8(@Nullable JsonValue v) {
        var i = toInt(v);
        return i.isPresent() ? OptionalInt.of((byte) i.getAsInt()) : OptionalInt.empty();
    }

    private static OptionalInt toUInt8(@Nullable JsonValue v) {
        var i = toInt(v);
        return i.isPresent() ? OptionalInt.of(Byte.toUnsignedInt((byte) i.getAsInt())) : OptionalInt.empty();
    }

    private static Optional<Float> toFloat(@Nullable JsonValue v) {
        return v instanceof JsonNumber n ? Optional.of((float) n.value()) : Optional.empty();
    }

    private static OptionalDouble toDouble(@Nullable JsonValue v) {
        return v instanceof JsonNumber n ? OptionalDouble.of(n.value()) : OptionalDouble.empty();
    }

    private static Optional<Boolean> toBool(@Nullable JsonValue v) {
        return v instanceof JsonBoolean b ? Optional.of(b.value()) : Optional.empty();
    }
}
