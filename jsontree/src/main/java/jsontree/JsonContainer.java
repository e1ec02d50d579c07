package jsontree;

import org.jspecify.annotations.Nullable;

/**
 * Ownership bookkeeping shared by {@link JsonObject} and {@link JsonArray}.
 *
 * <p> A container knows its parent so that it can be adopted only once and never by one of its own descendants.
 * Destroying a container releases it and everything below it; a released container rejects further use.
 */
abstract sealed class JsonContainer permits JsonArray, JsonObject {

    @Nullable
    private JsonContainer parent;

    private boolean released;

    @Nullable
    JsonContainer parent() {
        return parent;
    }

    boolean isReleased() {
        return released;
    }

    final void checkLive() {
        if (released) throw new JsonException.ReleasedValueException(getClass().getSimpleName());
    }

    /**
     * Take ownership of {@code child}. Scalars are immutable and need no bookkeeping.
     */
    final void adopt(JsonValue child) {
        if (!(child instanceof JsonContainer c)) return;
        c.checkLive();
        if (c.parent != null) {
            throw new IllegalArgumentException(
                    "Value is already owned by another container, duplicate it or remove it from its parent first");
        }
        for (JsonContainer p = this; p != null; p = p.parent) {
            if (p == c) throw new IllegalArgumentException("Cannot insert a container into itself or its descendants");
        }
        c.parent = this;
    }

    /**
     * Remove {@code child} from this container without releasing it.
     *
     * @return whether the child was found
     */
    abstract boolean unlink(JsonValue child);

    abstract void releaseChildren();

    /**
     * Release {@code value} and all of its descendants. Scalars are left alone.
     */
    static void release(@Nullable JsonValue value) {
        if (!(value instanceof JsonContainer c) || c.released) return;
        c.parent = null;
        c.releaseChildren();
        c.released = true;
    }

    /**
     * Detach {@code value} from its parent (if any) and release it.
     */
    static void destroy(@Nullable JsonValue value) {
        if (!(value instanceof JsonContainer c) || c.released) return;
        var p = c.parent;
        if (p != null) {
            p.unlink((JsonValue) c);
            c.parent = null;
        }
        release((JsonValue) c);
    }
}
