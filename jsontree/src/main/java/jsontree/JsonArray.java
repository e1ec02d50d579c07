package jsontree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import org.jspecify.annotations.Nullable;

/**
 * A JSON array: an ordered sequence of owned values, addressable by index {@code 0..length-1}.
 *
 * @since 0.1.0
 */
@EqualsAndHashCode(callSuper = false, onlyExplicitlyIncluded = true)
public final class JsonArray extends JsonContainer implements JsonValue {

    @EqualsAndHashCode.Include
    private final List<JsonValue> elements = new ArrayList<>();

    public JsonArray() {}

    @Override
    public JsonType type() {
        return JsonType.ARRAY;
    }

    /**
     * Append {@code value}, taking ownership of it. A {@code null} value is ignored.
     *
     * @throws IllegalArgumentException if {@code value} is a container that already has a parent, or an ancestor of
     *                                  this array
     */
    public void append(@Nullable JsonValue value) {
        checkLive();
        if (value == null) return;
        adopt(value);
        elements.add(value);
    }

    /**
     * Replace the element at {@code index} (destroying the old one), or append when {@code index == length()}.
     *
     * @return {@code false} if {@code value} is {@code null} or {@code index} is outside {@code 0..length()}
     */
    public boolean set(int index, @Nullable JsonValue value) {
        checkLive();
        if (value == null || index < 0 || index > elements.size()) return false;
        if (index == elements.size()) {
            append(value);
            return true;
        }
        var prior = elements.get(index);
        if (prior == value) return true;
        adopt(value);
        elements.set(index, value);
        release(prior);
        return true;
    }

    /**
     * @return the element at {@code index}, or {@code null} if out of range
     */
    @Nullable
    public JsonValue get(int index) {
        checkLive();
        return indexExists(index) ? elements.get(index) : null;
    }

    /**
     * Remove and destroy the element at {@code index}, shifting later elements down.
     *
     * @return whether an element was removed
     */
    public boolean remove(int index) {
        checkLive();
        if (!indexExists(index)) return false;
        release(elements.remove(index));
        return true;
    }

    public int length() {
        checkLive();
        return elements.size();
    }

    public boolean indexExists(int index) {
        checkLive();
        return index >= 0 && index < elements.size();
    }

    /**
     * Read-only live view of the elements. Elements are borrowed.
     */
    public List<JsonValue> asList() {
        checkLive();
        return Collections.unmodifiableList(elements);
    }

    @Override
    public JsonArray duplicate() {
        checkLive();
        var copy = new JsonArray();
        for (var e : elements) copy.append(e.duplicate());
        return copy;
    }

    @Override
    boolean unlink(JsonValue child) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == child) {
                elements.remove(i);
                return true;
            }
        }
        return false;
    }

    @Override
    void releaseChildren() {
        for (var e : elements) release(e);
        elements.clear();
    }

    @Override
    public String toString() {
        return isReleased() ? "JsonArray[released]" : stringify();
    }
}
