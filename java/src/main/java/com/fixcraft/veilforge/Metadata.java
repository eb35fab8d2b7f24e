package com.fixcraft.veilforge;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, flat, string-keyed map serialized as a UTF-8 JSON object. Values are strings,
 * booleans or integers; keys this version does not know survive a parse/encode cycle untouched.
 */
public final class Metadata {
    private final Map<String, Object> entries = new LinkedHashMap<>();

    public Metadata put(String key, String value) {
        entries.put(requireKey(key), value == null ? "" : value);
        return this;
    }

    public Metadata putBoolean(String key, boolean value) {
        entries.put(requireKey(key), Boolean.valueOf(value));
        return this;
    }

    public Metadata putInt(String key, long value) {
        entries.put(requireKey(key), Long.valueOf(value));
        return this;
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public String get(String key) {
        Object value = entries.get(key);
        return value == null ? null : value.toString();
    }

    public String require(String key) {
        Object value = entries.get(key);
        if (!(value instanceof String)) {
            throw malformed(value == null ? "missing key: " + key : "key is not a string: " + key);
        }
        return (String) value;
    }

    public boolean requireBoolean(String key) {
        Object value = entries.get(key);
        if (!(value instanceof Boolean)) {
            throw malformed(value == null ? "missing key: " + key : "key is not a boolean: " + key);
        }
        return (Boolean) value;
    }

    public int requireInt(String key) {
        Object value = entries.get(key);
        if (!(value instanceof Long)) {
            throw malformed(value == null ? "missing key: " + key : "key is not an integer: " + key);
        }
        long raw = (Long) value;
        if (raw < Integer.MIN_VALUE || raw > Integer.MAX_VALUE) {
            throw malformed("integer out of range: " + key);
        }
        return (int) raw;
    }

    public int size() {
        return entries.size();
    }

    public byte[] encode() {
        StringBuilder out = new StringBuilder();
        out.append('{');
        boolean first = true;
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            if (!first) {
                out.append(',');
            }
            first = false;
            appendString(out, entry.getKey());
            out.append(':');
            Object value = entry.getValue();
            if (value instanceof String) {
                appendString(out, (String) value);
            } else {
                out.append(value);
            }
        }
        out.append('}');
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    public static Metadata decode(byte[] raw) {
        String json = new String(raw, StandardCharsets.UTF_8);
        return new Parser(json).parseObject();
    }

    private static String requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("metadata key must be non-empty");
        }
        return key;
    }

    private static void appendString(StringBuilder out, String value) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    out.append("\\\"");
                    break;
                case '\\':
                    out.append("\\\\");
                    break;
                case '\n':
                    out.append("\\n");
                    break;
                case '\r':
                    out.append("\\r");
                    break;
                case '\t':
                    out.append("\\t");
                    break;
                default:
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
            }
        }
        out.append('"');
    }

    private static StegoException malformed(String detail) {
        return new StegoException(StegoErrorKind.MALFORMED_METADATA, "Malformed metadata: " + detail);
    }

    @Override
    public String toString() {
        return new String(encode(), StandardCharsets.UTF_8);
    }

    private static final class Parser {
        private final String json;
        private int pos;

        Parser(String json) {
            this.json = json;
        }

        Metadata parseObject() {
            Metadata result = new Metadata();
            skipWhitespace();
            expect('{');
            skipWhitespace();
            if (peek() == '}') {
                pos++;
                return finish(result);
            }
            while (true) {
                skipWhitespace();
                String key = parseString();
                if (key.isEmpty()) {
                    throw malformed("empty key");
                }
                if (result.entries.containsKey(key)) {
                    throw malformed("duplicate key: " + key);
                }
                skipWhitespace();
                expect(':');
                skipWhitespace();
                result.entries.put(key, parseValue());
                skipWhitespace();
                char c = next();
                if (c == '}') {
                    return finish(result);
                }
                if (c != ',') {
                    throw malformed("expected ',' or '}' at " + (pos - 1));
                }
            }
        }

        private Metadata finish(Metadata result) {
            skipWhitespace();
            if (pos != json.length()) {
                throw malformed("trailing data after object");
            }
            return result;
        }

        private Object parseValue() {
            char c = peek();
            if (c == '"') {
                return parseString();
            }
            if (json.startsWith("true", pos)) {
                pos += 4;
                return Boolean.TRUE;
            }
            if (json.startsWith("false", pos)) {
                pos += 5;
                return Boolean.FALSE;
            }
            if (json.startsWith("null", pos)) {
                pos += 4;
                return "";
            }
            if (c == '-' || (c >= '0' && c <= '9')) {
                return parseInteger();
            }
            throw malformed("unsupported value at " + pos);
        }

        private Long parseInteger() {
            int start = pos;
            if (peek() == '-') {
                pos++;
            }
            while (pos < json.length() && Character.isDigit(json.charAt(pos))) {
                pos++;
            }
            if (pos < json.length() && (json.charAt(pos) == '.' || json.charAt(pos) == 'e' || json.charAt(pos) == 'E')) {
                throw malformed("fractional numbers are not supported");
            }
            try {
                return Long.valueOf(json.substring(start, pos));
            } catch (NumberFormatException exc) {
                throw malformed("bad integer at " + start);
            }
        }

        private String parseString() {
            expect('"');
            StringBuilder sb = new StringBuilder();
            while (true) {
                char c = next();
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    if (c < 0x20) {
                        throw malformed("control character in string");
                    }
                    sb.append(c);
                    continue;
                }
                char esc = next();
                switch (esc) {
                    case '"':
                    case '\\':
                    case '/':
                        sb.append(esc);
                        break;
                    case 'b':
                        sb.append('\b');
                        break;
                    case 'f':
                        sb.append('\f');
                        break;
                    case 'n':
                        sb.append('\n');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'u':
                        if (pos + 4 > json.length()) {
                            throw malformed("truncated unicode escape");
                        }
                        try {
                            sb.append((char) Integer.parseInt(json.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException exc) {
                            throw malformed("bad unicode escape");
                        }
                        pos += 4;
                        break;
                    default:
                        throw malformed("bad escape \\" + esc);
                }
            }
        }

        private void skipWhitespace() {
            while (pos < json.length()) {
                char c = json.charAt(pos);
                if (c != ' ' && c != '\n' && c != '\r' && c != '\t') {
                    return;
                }
                pos++;
            }
        }

        private void expect(char expected) {
            if (next() != expected) {
                throw malformed("expected '" + expected + "' at " + (pos - 1));
            }
        }

        private char peek() {
            if (pos >= json.length()) {
                throw malformed("unexpected end of metadata");
            }
            return json.charAt(pos);
        }

        private char next() {
            char c = peek();
            pos++;
            return c;
        }
    }
}
