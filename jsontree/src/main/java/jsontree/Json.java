package jsontree;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import lombok.Builder;
import org.jspecify.annotations.Nullable;

/**
 * Mutable JSON document trees: parsing, writing, construction and ownership-aware mutation.
 *
 * <p> The value operations in this class accept any {@link JsonValue} and treat a variant mismatch (for example
 * {@link #objGet} on an array) as a normal outcome that yields {@code null}, {@code false} or {@code 0}.
 *
 * @since 0.1.0
 */
public final class Json {

    /**
     * Default limit for nested objects and arrays accepted by the parser.
     */
    public static final int DEFAULT_MAX_DEPTH = 128;

    private static final Logger LOG = Logger.getLogger(Json.class.getName());

    private static final Parser defaultParser = Parser.builder().build();
    private static final Writer defaultWriter = Writer.builder().build();
    private static final Writer prettyWriter = Writer.builder().pretty(true).build();

    private Json() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Parse JSON text into a tree.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * JsonValue root = Json.parse("{\"a\": 1, \"b\": [true, false, null]}");
     * JsonAccess.getInt(root, "a"); // -> OptionalInt[1]
     * }</pre>
     *
     * @param json JSON text, not {@code null}
     * @return the root value, owned by the caller
     * @throws JsonException.ParseException if the text is not exactly one well-formed JSON value
     */
    public static JsonValue parse(String json) {
        return defaultParser.parse(json);
    }

    /**
     * Parse UTF-8 encoded JSON text into a tree.
     *
     * @see #parse(String)
     */
    public static JsonValue parse(byte[] utf8) {
        return defaultParser.parse(utf8);
    }

    /**
     * Serialize a tree to compact JSON text.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * var o = Json.createObject();
     * JsonAccess.setString(o, "x", "hi");
     * Json.stringify(o); // -> {"x":"hi"}
     * }</pre>
     *
     * @param value tree, may be {@code null}
     * @return non-null JSON text, {@code "null"} for a {@code null} reference
     * @throws JsonException.WriteException if the tree holds a NaN or infinite number
     */
    public static String stringify(@Nullable JsonValue value) {
        return defaultWriter.write(value);
    }

    /**
     * Serialize a tree to indented JSON text.
     */
    public static String stringifyPretty(@Nullable JsonValue value) {
        return prettyWriter.write(value);
    }

    public static Parser parser() {
        return defaultParser;
    }

    public static Writer writer() {
        return defaultWriter;
    }

    // ============================================================
    // Files
    // ============================================================

    /**
     * Read and parse a JSON document. The whole file content is the JSON text.
     *
     * @throws JsonException.FileException  if the file cannot be read
     * @throws JsonException.ParseException if the content is not valid JSON
     */
    public static JsonValue readFile(Path path) {
        return readFile(path, JsonFiles.nio());
    }

    public static JsonValue readFile(Path path, JsonFiles files) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(files, "files");
        byte[] bytes;
        try {
            bytes = files.read(path);
        } catch (IOException e) {
            throw new JsonException.FileException("Failed to read JSON document", path, e);
        }
        return parse(bytes);
    }

    /**
     * Write {@code value} as indented JSON text, replacing the file content.
     *
     * @throws JsonException.FileException  if the file cannot be written
     * @throws JsonException.WriteException if the tree cannot be serialized, in which case the file is untouched
     */
    public static void writeFile(Path path, @Nullable JsonValue value) {
        writeFile(path, value, JsonFiles.nio());
    }

    public static void writeFile(Path path, @Nullable JsonValue value, JsonFiles files) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(files, "files");
        var bytes = stringifyPretty(value).getBytes(StandardCharsets.UTF_8);
        try {
            files.write(path, bytes);
        } catch (IOException e) {
            throw new JsonException.FileException("Failed to write JSON document", path, e);
        }
    }

    // ============================================================
    // Construction and lifecycle
    // ============================================================

    public static JsonNull createNull() {
        return JsonNull.of();
    }

    public static JsonBoolean createBoolean(boolean value) {
        return JsonBoolean.of(value);
    }

    public static JsonNumber createNumber(double value) {
        return JsonNumber.of(value);
    }

    /**
     * @param value text, {@code null} yields an empty string
     */
    public static JsonString createString(@Nullable String value) {
        return JsonString.of(value == null ? "" : value);
    }

    public static JsonObject createObject() {
        return new JsonObject();
    }

    public static JsonArray createArray() {
        return new JsonArray();
    }

    /**
     * Destroy a tree: detach it from its parent, if any, and release every container in it. Any later use of a
     * released container throws {@link JsonException.ReleasedValueException}. Scalars are immutable, destroying one
     * is a no-op.
     *
     * @param value tree, {@code null} is a no-op
     */
    public static void destroy(@Nullable JsonValue value) {
        JsonContainer.destroy(value);
    }

    /**
     * Deep copy of {@code value}, see {@link JsonValue#duplicate()}.
     *
     * @param value tree, may be {@code null}
     * @return independent parentless copy, {@code null} for {@code null}
     */
    @Nullable
    public static JsonValue duplicate(@Nullable JsonValue value) {
        return value == null ? null : value.duplicate();
    }

    // ============================================================
    // Object operations
    // ============================================================

    /**
     * Store {@code value} under {@code key}, handing ownership to {@code obj} and destroying any previous value.
     * Does nothing, and transfers nothing, if {@code obj} is not an object or {@code value} is {@code null}.
     */
    public static void objSet(@Nullable JsonValue obj, String key, @Nullable JsonValue value) {
        if (obj instanceof JsonObject o) o.set(key, value);
    }

    /**
     * @return borrowed value under {@code key}, or {@code null} if absent or {@code obj} is not an object
     */
    @Nullable
    public static JsonValue objGet(@Nullable JsonValue obj, String key) {
        return obj instanceof JsonObject o ? o.get(key) : null;
    }

    public static void objDelete(@Nullable JsonValue obj, String key) {
        if (obj instanceof JsonObject o) o.delete(key);
    }

    public static boolean objKeyExists(@Nullable JsonValue obj, String key) {
        return obj instanceof JsonObject o && o.containsKey(key);
    }

    /**
     * Advance {@code cursor} over the keys of {@code obj}.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * var cursor = obj.cursor();
     * for (String key; (key = Json.objNextKey(obj, cursor)) != null; ) {
     *     ...
     * }
     * }</pre>
     *
     * @return the next key, or {@code null} at the end, when {@code obj} is not an object, or when the cursor belongs
     * to another object
     */
    @Nullable
    public static String objNextKey(@Nullable JsonValue obj, JsonObject.KeyCursor cursor) {
        if (!(obj instanceof JsonObject o) || cursor.owner() != o) return null;
        return cursor.nextKey();
    }

    // ============================================================
    // Array operations
    // ============================================================

    /**
     * Append {@code value}, handing ownership to {@code arr}. Does nothing if {@code arr} is not an array or
     * {@code value} is {@code null}.
     */
    public static void arrayAppend(@Nullable JsonValue arr, @Nullable JsonValue value) {
        if (arr instanceof JsonArray a) a.append(value);
    }

    @Nullable
    public static JsonValue arrayGet(@Nullable JsonValue arr, int index) {
        return arr instanceof JsonArray a ? a.get(index) : null;
    }

    public static int arrayLength(@Nullable JsonValue arr) {
        return arr instanceof JsonArray a ? a.length() : 0;
    }

    public static boolean arrayIndexExists(@Nullable JsonValue arr, int index) {
        return arr instanceof JsonArray a && a.indexExists(index);
    }

    // ============================================================
    // Parser
    // ============================================================

    /**
     * Single-pass parser driven by an explicit container stack.
     *
     * <p> Instances are immutable and can be shared between threads.
     */
    public static final class Parser {

        private final int maxDepth;

        @Builder(toBuilder = true)
        private Parser(@Nullable Integer maxDepth) {
            int depth = maxDepth == null ? DEFAULT_MAX_DEPTH : maxDepth;
            if (depth < 1) throw new IllegalArgumentException("maxDepth must be positive, got " + depth);
            this.maxDepth = depth;
        }

        public int maxDepth() {
            return maxDepth;
        }

        public JsonValue parse(String json) {
            Objects.requireNonNull(json, "json");
            return new Automaton(json, maxDepth).run();
        }

        /**
         * @throws JsonException.ParseException also for malformed UTF-8, at the offset of the first bad byte
         */
        public JsonValue parse(byte[] utf8) {
            Objects.requireNonNull(utf8, "utf8");
            return parse(decode(utf8));
        }

        private static String decode(byte[] utf8) {
            CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            var in = ByteBuffer.wrap(utf8);
            // UTF-8 never yields more chars than bytes
            var out = CharBuffer.allocate(utf8.length);
            CoderResult result = decoder.decode(in, out, true);
            if (!result.isError()) result = decoder.flush(out);
            if (result.isError()) {
                int line = 1, lineStart = 0;
                for (int k = 0; k < out.position(); k++) {
                    if (out.get(k) == '\n') {
                        line++;
                        lineStart = k + 1;
                    }
                }
                var e = new JsonException.ParseException(
                        "Malformed UTF-8 input", in.position(), line, out.position() - lineStart + 1);
                LOG.fine(() -> "Parse failed: " + e.getMessage());
                throw e;
            }
            return out.flip().toString();
        }
    }

    /**
     * What the current nesting level accepts next.
     */
    enum Expect {
        /** right after '{' */
        KEY_OR_END,
        /** after ',' inside an object */
        KEY,
        COLON,
        VALUE,
        /** right after '[' */
        VALUE_OR_END,
        COMMA_OR_END
    }

    static final class Frame {
        final JsonContainer container;
        Expect expect;

        @Nullable
        String pendingKey;

        Frame(JsonContainer container, Expect expect) {
            this.container = container;
            this.expect = expect;
        }

        boolean isObject() {
            return container instanceof JsonObject;
        }

        boolean expectingKey() {
            return expect == Expect.KEY_OR_END || expect == Expect.KEY;
        }
    }

    static final class Automaton {
        private final String s;
        private final int maxDepth;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private int i = 0, line = 1, lineStart = 0;

        @Nullable
        private JsonValue root;

        Automaton(String s, int maxDepth) {
            this.s = s;
            this.maxDepth = maxDepth;
        }

        JsonValue run() {
            try {
                while (i < s.length()) {
                    char c = s.charAt(i);
                    switch (c) {
                        case ' ', '\t', '\r' -> i++;
                        case '\n' -> {
                            i++;
                            line++;
                            lineStart = i;
                        }
                        case '{' -> open(new JsonObject(), Expect.KEY_OR_END);
                        case '[' -> open(new JsonArray(), Expect.VALUE_OR_END);
                        case '}', ']' -> close(c);
                        case ':' -> colon();
                        case ',' -> comma();
                        case '"' -> string();
                        case 't' -> literal("true", JsonBoolean.TRUE);
                        case 'f' -> literal("false", JsonBoolean.FALSE);
                        case 'n' -> literal("null", JsonNull.of());
                        default -> {
                            if (c == '-' || isDigit(c)) number();
                            else throw error("Unexpected character: " + describe(c), i);
                        }
                    }
                }
                if (!stack.isEmpty()) {
                    throw error(stack.peek().isObject() ? "Unclosed object, expected '}'" : "Unclosed array, expected ']'", i);
                }
                if (root == null) throw error("Unexpected end of input while expecting a value", i);
                return root;
            } catch (JsonException.ParseException e) {
                discard();
                LOG.fine(() -> "Parse failed: " + e.getMessage());
                throw e;
            }
        }

        private void discard() {
            while (!stack.isEmpty()) JsonContainer.release((JsonValue) stack.pop().container);
            JsonContainer.release(root);
            root = null;
        }

        /**
         * Fail unless the current level accepts a value at this point.
         */
        private void beforeValue() {
            var top = stack.peek();
            if (top == null) {
                if (root != null) throw error("Trailing characters after top-level value", i);
                return;
            }
            switch (top.expect) {
                case VALUE, VALUE_OR_END -> {}
                case KEY, KEY_OR_END -> throw error("Expected string key in object", i);
                case COLON -> throw error("Expected ':' after object key", i);
                case COMMA_OR_END -> throw error(top.isObject() ? "Expected ',' or '}' in object" : "Expected ',' or ']' in array", i);
            }
        }

        private void attach(JsonValue value) {
            var top = stack.peek();
            if (top == null) {
                root = value;
                return;
            }
            if (top.container instanceof JsonObject o) {
                o.set(Objects.requireNonNull(top.pendingKey), value);
                top.pendingKey = null;
            } else {
                ((JsonArray) top.container).append(value);
            }
            top.expect = Expect.COMMA_OR_END;
        }

        private void open(JsonContainer container, Expect expect) {
            beforeValue();
            if (stack.size() >= maxDepth) throw error("Maximum nesting depth of " + maxDepth + " exceeded", i);
            stack.push(new Frame(container, expect));
            i++;
        }

        private void close(char c) {
            var top = stack.peek();
            if (top == null) throw error("Unexpected '" + c + "' without matching opening bracket", i);
            boolean object = c == '}';
            if (top.isObject() != object) {
                throw error("Mismatched '" + c + "', expected '" + (top.isObject() ? '}' : ']') + "'", i);
            }
            switch (top.expect) {
                case KEY_OR_END, VALUE_OR_END, COMMA_OR_END -> {}
                case KEY -> throw error("Trailing comma in object", i);
                case COLON -> throw error("Expected ':' after object key", i);
                case VALUE -> throw error(object ? "Expected value after ':'" : "Trailing comma in array", i);
            }
            stack.pop();
            i++;
            attach((JsonValue) top.container);
        }

        private void colon() {
            var top = stack.peek();
            if (top == null || top.expect != Expect.COLON) throw error("Unexpected ':'", i);
            top.expect = Expect.VALUE;
            i++;
        }

        private void comma() {
            var top = stack.peek();
            if (top == null) throw error("Trailing characters after top-level value", i);
            if (top.expect != Expect.COMMA_OR_END) throw error("Unexpected ','", i);
            top.expect = top.isObject() ? Expect.KEY : Expect.VALUE;
            i++;
        }

        private void string() {
            var top = stack.peek();
            if (top != null && top.isObject() && top.expectingKey()) {
                top.pendingKey = readString();
                top.expect = Expect.COLON;
                return;
            }
            beforeValue();
            attach(new JsonString(readString()));
        }

        private void literal(String word, JsonValue value) {
            beforeValue();
            if (!s.startsWith(word, i)) throw error("Invalid literal, expected '" + word + "'", i);
            i += word.length();
            attach(value);
        }

        private void number() {
            beforeValue();
            int start = i;
            if (peek() == '-') i++;
            if (eof()) throw error("Unexpected end of input while parsing number", i);
            if (peek() == '0') {
                i++;
                if (!eof() && isDigit(peek())) throw error("Leading zeros are not allowed in numbers", i);
            } else if (isDigit(peek())) {
                while (!eof() && isDigit(peek())) i++;
            } else throw error("Invalid number format (integer part)", i);
            if (!eof() && peek() == '.') {
                i++;
                if (eof() || !isDigit(peek())) throw error("Invalid number format (fractional part)", i);
                while (!eof() && isDigit(peek())) i++;
            }
            if (!eof() && (peek() == 'e' || peek() == 'E')) {
                i++;
                if (!eof() && (peek() == '+' || peek() == '-')) i++;
                if (eof() || !isDigit(peek())) throw error("Invalid number format (exponent part)", i);
                while (!eof() && isDigit(peek())) i++;
            }
            double d = Double.parseDouble(s.substring(start, i));
            if (Double.isInfinite(d)) throw error("Number out of range", start);
            attach(new JsonNumber(d));
        }

        private String readString() {
            i++; // opening "
            StringBuilder sb = new StringBuilder();
            while (!eof()) {
                char c = s.charAt(i);
                if (c == '"') {
                    i++;
                    return sb.toString();
                }
                if (c == '\\') {
                    i++;
                    if (eof()) break;
                    char e = s.charAt(i);
                    switch (e) {
                        case '"' -> sb.append('"');
                        case '\\' -> sb.append('\\');
                        case '/' -> sb.append('/');
                        case 'b' -> sb.append('\b');
                        case 'f' -> sb.append('\f');
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 't' -> sb.append('\t');
                        case 'u' -> {
                            int escapeStart = i - 1;
                            i++;
                            char cp = readHex4();
                            if (Character.isHighSurrogate(cp)) {
                                if (!s.startsWith("\\u", i)) {
                                    throw error("High surrogate not followed by low surrogate in unicode escape", escapeStart);
                                }
                                i += 2;
                                char low = readHex4();
                                if (!Character.isLowSurrogate(low)) {
                                    throw error("Invalid low surrogate in unicode escape", escapeStart);
                                }
                                sb.append(cp).append(low);
                            } else if (Character.isLowSurrogate(cp)) {
                                throw error("Unexpected low surrogate in unicode escape", escapeStart);
                            } else sb.append(cp);
                            continue;
                        }
                        default -> throw error("Invalid escape sequence: \\" + e, i - 1);
                    }
                    i++;
                } else {
                    if (c < 0x20) throw error("Unescaped control character in string (ASCII " + (int) c + ")", i);
                    sb.append(c);
                    i++;
                }
            }
            throw error("Unterminated string literal", i);
        }

        private char readHex4() {
            int cp = 0;
            for (int k = 0; k < 4; k++) {
                if (eof()) throw error("Unexpected end of input in \\u escape sequence", i);
                int v = hexVal(s.charAt(i));
                if (v < 0) throw error("Invalid hexadecimal digit in \\u escape sequence", i);
                cp = (cp << 4) | v;
                i++;
            }
            return (char) cp;
        }

        private static int hexVal(char c) {
            if (c >= '0' && c <= '9') return c - '0';
            if (c >= 'a' && c <= 'f') return 10 + (c - 'a');
            if (c >= 'A' && c <= 'F') return 10 + (c - 'A');
            return -1;
        }

        private boolean eof() {
            return i >= s.length();
        }

        private char peek() {
            return s.charAt(i);
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private static String describe(char c) {
            return c < 0x20 || c == 0x7f ? String.format("U+%04X", (int) c) : "'" + c + "'";
        }

        private JsonException.ParseException error(String msg, int at) {
            return new JsonException.ParseException(msg, utf8Offset(s, at), line, at - lineStart + 1);
        }

        /**
         * Number of UTF-8 bytes encoding {@code s[0, end)}.
         */
        static long utf8Offset(String s, int end) {
            long bytes = 0;
            for (int k = 0; k < end; k++) {
                char c = s.charAt(k);
                if (c < 0x80) bytes += 1;
                else if (c < 0x800) bytes += 2;
                else if (Character.isHighSurrogate(c) && k + 1 < end && Character.isLowSurrogate(s.charAt(k + 1))) {
                    bytes += 4;
                    k++;
                } else bytes += 3;
            }
            return bytes;
        }
    }

    // ============================================================
    // Writer
    // ============================================================

    /**
     * Renders trees as JSON text, compact by default.
     *
     * <p> Instances are immutable and can be shared between threads.
     */
    public static final class Writer {

        private final boolean pretty;
        private final int indent;
        private final int maxDepth;

        @Builder(toBuilder = true)
        private Writer(@Nullable Boolean pretty, @Nullable Integer indent, @Nullable Integer maxDepth) {
            this.pretty = pretty != null && pretty;
            this.indent = indent == null ? 2 : indent;
            if (this.indent < 0) throw new IllegalArgumentException("indent must not be negative, got " + this.indent);
            this.maxDepth = maxDepth == null ? DEFAULT_MAX_DEPTH : maxDepth;
            if (this.maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive, got " + this.maxDepth);
        }

        public boolean pretty() {
            return pretty;
        }

        public int indent() {
            return indent;
        }

        /**
         * Deepest container nesting this writer emits. Deeper trees fail with {@link JsonException.WriteException}
         * instead of producing text that a parser with the same limit rejects.
         */
        public int maxDepth() {
            return maxDepth;
        }

        public String write(@Nullable JsonValue value) {
            var sb = new StringBuilder();
            write(sb, value, 0);
            return sb.toString();
        }

        void write(StringBuilder out, @Nullable JsonValue v, int level) {
            if (v == null || v instanceof JsonNull) {
                out.append("null");
                return;
            }
            if (v instanceof JsonBoolean b) {
                out.append(b.value() ? "true" : "false");
                return;
            }
            if (v instanceof JsonNumber n) {
                writeNumber(out, n.value());
                return;
            }
            if (v instanceof JsonString s) {
                writeString(out, s.value());
                return;
            }
            // level counts the containers enclosing v
            if (level >= maxDepth)
                throw new JsonException.WriteException("Maximum nesting depth of " + maxDepth + " exceeded");
            if (v instanceof JsonArray a) {
                List<JsonValue> vs = a.asList();
                if (vs.isEmpty()) {
                    out.append("[]");
                    return;
                }
                out.append('[');
                for (int i = 0; i < vs.size(); i++) {
                    if (i > 0) out.append(',');
                    newline(out, level + 1);
                    write(out, vs.get(i), level + 1);
                }
                newline(out, level);
                out.append(']');
                return;
            }
            Map<String, JsonValue> members = ((JsonObject) v).asMap();
            if (members.isEmpty()) {
                out.append("{}");
                return;
            }
            out.append('{');
            boolean first = true;
            for (var en : members.entrySet()) {
                if (!first) out.append(',');
                first = false;
                newline(out, level + 1);
                writeString(out, en.getKey());
                out.append(pretty ? ": " : ":");
                write(out, en.getValue(), level + 1);
            }
            newline(out, level);
            out.append('}');
        }

        private void newline(StringBuilder out, int level) {
            if (!pretty) return;
            out.append('\n');
            out.append(" ".repeat(level * indent));
        }

        static void writeString(StringBuilder out, String s) {
            out.append('"');
            escapeTo(out, s);
            out.append('"');
        }

        /**
         * Integral values below 2^53 are written without a fraction, everything else with {@link Double#toString},
         * which reads back to the same double.
         */
        static void writeNumber(StringBuilder out, double d) {
            if (Double.isNaN(d) || Double.isInfinite(d))
                throw new JsonException.WriteException("Cannot serialize NaN or Infinity as JSON number: " + d);
            boolean negativeZero = d == 0 && Double.doubleToRawLongBits(d) != 0;
            if (d == Math.rint(d) && Math.abs(d) < 0x1p53 && !negativeZero) {
                out.append((long) d);
                return;
            }
            out.append(d);
        }

        static void escapeTo(StringBuilder out, String s) {
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                switch (c) {
                    case '"' -> out.append("\\\"");
                    case '\\' -> out.append("\\\\");
                    case '\b' -> out.append("\\b");
                    case '\f' -> out.append("\\f");
                    case '\n' -> out.append("\\n");
                    case '\r' -> out.append("\\r");
                    case '\t' -> out.append("\\t");
                    default -> {
                        if (c < 0x20) {
                            out.append("\\u");
                            String hex = Integer.toHexString(c);
                            for (int k = hex.length(); k < 4; k++) out.append('0');
                            out.append(hex);
                        } else {
                            out.append(c);
                        }
                    }
                }
            }
        }
    }
}
