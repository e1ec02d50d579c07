package jsontree;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import org.jspecify.annotations.Nullable;

/**
 * A JSON object: unique string keys mapped to owned values.
 *
 * <p> Values returned by {@link #get(String)} are borrowed: they stay owned by this object and are only valid until
 * the entry is replaced or deleted, at which point a container child is released.
 *
 * <p> Iteration order is the order of the backing map (insertion order today), it is not part of the contract.
 *
 * @since 0.1.0
 */
@EqualsAndHashCode(callSuper = false, onlyExplicitlyIncluded = true)
public final class JsonObject extends JsonContainer implements JsonValue {

    @EqualsAndHashCode.Include
    private final Map<String, JsonValue> members = new LinkedHashMap<>();

    public JsonObject() {}

    @Override
    public JsonType type() {
        return JsonType.OBJECT;
    }

    /**
     * Store {@code value} under {@code key}, taking ownership of it. A previous value under the same key is destroyed.
     *
     * <p> A {@code null} value is ignored and nothing changes hands.
     *
     * @param key   key, not {@code null}
     * @param value new owned value
     * @throws IllegalArgumentException if {@code value} is a container that already has a parent, or an ancestor of
     *                                  this object
     */
    public void set(String key, @Nullable JsonValue value) {
        checkLive();
        Objects.requireNonNull(key, "key");
        if (value == null) return;
        var prior = members.get(key);
        if (prior == value) return;
        adopt(value);
        members.put(key, value);
        release(prior);
    }

    @Nullable
    public JsonValue get(String key) {
        checkLive();
        return members.get(key);
    }

    /**
     * Remove and destroy the value under {@code key}.
     *
     * @return whether the key was present
     */
    public boolean delete(String key) {
        checkLive();
        var removed = members.remove(key);
        if (removed == null) return false;
        release(removed);
        return true;
    }

    public boolean containsKey(String key) {
        checkLive();
        return members.containsKey(key);
    }

    public int size() {
        checkLive();
        return members.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Snapshot of the current keys.
     */
    public List<String> keys() {
        checkLive();
        return List.copyOf(members.keySet());
    }

    /**
     * Read-only live view of the entries. Values are borrowed.
     */
    public Map<String, JsonValue> asMap() {
        checkLive();
        return Collections.unmodifiableMap(members);
    }

    /**
     * External cursor over the keys of this object.
     *
     * @return a cursor positioned before the first key
     */
    public KeyCursor cursor() {
        checkLive();
        return new KeyCursor(this, members.keySet().iterator());
    }

    @Override
    public JsonObject duplicate() {
        checkLive();
        var copy = new JsonObject();
        for (var en : members.entrySet()) {
            copy.set(en.getKey(), en.getValue().duplicate());
        }
        return copy;
    }

    @Override
    boolean unlink(JsonValue child) {
        return members.values().removeIf(v -> v == child);
    }

    @Override
    void releaseChildren() {
        for (var v : members.values()) release(v);
        members.clear();
    }

    @Override
    public String toString() {
        return isReleased() ? "JsonObject[released]" : stringify();
    }

    /**
     * Stateless-looking key iteration in the style of {@code nextKey(cursor)}.
     *
     * <p> A structural change of the object (adding or removing a key) after the cursor was created makes the next
     * call to {@link #nextKey()} throw {@link java.util.ConcurrentModificationException}.
     */
    public static final class KeyCursor {
        private final JsonObject owner;
        private final Iterator<String> keys;

        private KeyCursor(JsonObject owner, Iterator<String> keys) {
            this.owner = owner;
            this.keys = keys;
        }

        JsonObject owner() {
            return owner;
        }

        /**
         * @return the next key, or {@code null} once every key has been visited
         */
        @Nullable
        public String nextKey() {
            owner.checkLive();
            return keys.hasNext() ? keys.next() : null;
        }
    }
}
