package jsontree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonObjectTest extends JsonTreeLoggingConfig {

    @Nested
    class Mutation {

        @Test
        void setReplacesAndDestroysPriorValue() {
            var obj = Json.createObject();
            var v1 = Json.createArray();
            v1.append(Json.createNumber(1));
            var v2 = Json.createString("second");

            Json.objSet(obj, "k", v1);
            Json.objSet(obj, "k", v2);

            assertThat(Json.objGet(obj, "k")).isSameAs(v2);
            assertThat(obj.keys()).containsExactly("k");
            assertThatCode(v1::length).isInstanceOf(JsonException.ReleasedValueException.class);
        }

        @Test
        void settingTheSameValueAgainKeepsIt() {
            var obj = Json.createObject();
            var child = Json.createObject();
            obj.set("k", child);

            obj.set("k", child);

            assertThat(obj.get("k")).isSameAs(child);
            assertThat(child.isEmpty()).isTrue();
        }

        @Test
        void nullValueIsIgnored() {
            var obj = Json.createObject();

            Json.objSet(obj, "k", null);

            assertThat(Json.objKeyExists(obj, "k")).isFalse();
            assertThat(obj.size()).isZero();
        }

        @Test
        void deleteDestroysRemovedValue() {
            var obj = Json.parse("{\"a\":{\"b\":[1]},\"c\":true}");
            var a = (JsonObject) Json.objGet(obj, "a");

            Json.objDelete(obj, "a");

            assertThat(Json.objKeyExists(obj, "a")).isFalse();
            assertThat(Json.stringify(obj)).isEqualTo("{\"c\":true}");
            assertThatCode(() -> a.get("b")).isInstanceOf(JsonException.ReleasedValueException.class);
            assertThat(((JsonObject) obj).delete("missing")).isFalse();
        }

        @Test
        void nullAndMissingAreDifferent() {
            var obj = Json.parse("{\"present\":null}");

            assertThat(Json.objGet(obj, "present")).isEqualTo(JsonNull.of());
            assertThat(Json.objKeyExists(obj, "present")).isTrue();
            assertThat(Json.objGet(obj, "missing")).isNull();
            assertThat(Json.objKeyExists(obj, "missing")).isFalse();
        }
    }

    @Nested
    class Ownership {

        @Test
        void containerCannotHaveTwoParents() {
            var first = Json.createObject();
            var second = Json.createArray();
            var child = Json.createObject();
            first.set("child", child);

            assertThatCode(() -> second.append(child))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("already owned");
            assertThat(second.length()).isZero();
        }

        @Test
        void duplicateCanBeInsertedElsewhere() {
            var first = Json.createObject();
            var child = Json.createObject();
            first.set("child", child);
            var second = Json.createObject();

            second.set("copy", child.duplicate());

            assertThat(second.get("copy")).isEqualTo(child).isNotSameAs(child);
        }

        @Test
        void cyclesAreRejected() {
            var root = Json.createObject();
            var inner = Json.createObject();
            root.set("inner", inner);

            assertThatCode(() -> inner.set("root", root))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("into itself or its descendants");
            assertThatCode(() -> root.set("self", root)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void scalarsCanBeHandedToSeveralParents() {
            var shared = Json.createString("s");
            var a = Json.createArray();
            var b = Json.createArray();

            a.append(shared);
            b.append(shared);

            assertThat(a).isEqualTo(b);
        }

        @Test
        void destroyedChildIsDetachedFromItsParent() {
            var root = Json.parse("{\"keep\":1,\"drop\":{\"x\":[1,2]}}");
            var drop = Json.objGet(root, "drop");

            Json.destroy(drop);

            assertThat(Json.stringify(root)).isEqualTo("{\"keep\":1}");
            assertThatCode(() -> Json.objKeyExists(drop, "x")).isInstanceOf(JsonException.ReleasedValueException.class);
        }

        @Test
        void destroyAcceptsNullAndReleasedValues() {
            var obj = Json.createObject();

            Json.destroy(obj);

            assertThatCode(() -> Json.destroy(null)).doesNotThrowAnyException();
            assertThatCode(() -> Json.destroy(obj)).doesNotThrowAnyException();
            assertThat(obj.toString()).isEqualTo("JsonObject[released]");
        }
    }

    @Nested
    class Iteration {

        @Test
        void cursorVisitsEveryKeyOnce() {
            var obj = Json.parse("{\"a\":1,\"b\":2,\"c\":3}");
            var cursor = ((JsonObject) obj).cursor();

            var keys = new ArrayList<String>();
            for (String key; (key = Json.objNextKey(obj, cursor)) != null; ) {
                keys.add(key);
            }

            assertThat(keys).containsExactlyInAnyOrder("a", "b", "c");
            assertThat(cursor.nextKey()).isNull();
        }

        @Test
        void cursorIsInvalidatedByStructuralChange() {
            var obj = (JsonObject) Json.parse("{\"a\":1,\"b\":2}");
            var cursor = obj.cursor();
            cursor.nextKey();

            obj.set("c", Json.createNull());

            assertThatCode(cursor::nextKey).isInstanceOf(ConcurrentModificationException.class);
        }

        @Test
        void cursorOfAnotherObjectYieldsNothing() {
            var obj = (JsonObject) Json.parse("{\"a\":1}");
            var other = (JsonObject) Json.parse("{\"b\":1}");

            assertThat(Json.objNextKey(other, obj.cursor())).isNull();
            assertThat(Json.objNextKey(Json.createArray(), obj.cursor())).isNull();
        }
    }

    @Nested
    class VariantMismatch {

        @Test
        void objectOperationsOnOtherVariantsAreNoOps() {
            var arr = Json.createArray();
            var child = Json.createObject();

            Json.objSet(arr, "k", child);
            Json.objDelete(arr, "k");

            assertThat(Json.objGet(arr, "k")).isNull();
            assertThat(Json.objKeyExists(Json.createString("k"), "k")).isFalse();
            assertThat(Json.objGet(null, "k")).isNull();
            // nothing was handed over, so the child can still be adopted
            assertThatCode(() -> Json.createObject().set("k", child)).doesNotThrowAnyException();
        }
    }
}
