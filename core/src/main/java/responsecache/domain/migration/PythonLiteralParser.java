package responsecache.domain.migration;

import org.jspecify.annotations.Nullable;
import responsecache.domain.exceptions.CacheValidationFailed;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the Python literals found in the parameters column of legacy cache files, e.g.
 * <code>{'temperature': 0.5, 'stop': ['\n'], 'logprobs': False}</code>.
 * <p>
 * Supports dicts, lists, tuples (returned as lists), single and double-quoted strings, ints, floats,
 * True, False and None. Anything else is rejected.
 */
public final class PythonLiteralParser {
    private final String source;
    private int position;

    private PythonLiteralParser(final String source) {
        this.source = source;
    }

    @Nullable
    public static Object parse(final String source) {
        if (source == null) {
            throw new CacheValidationFailed("Cannot parse a null literal");
        }

        final PythonLiteralParser parser = new PythonLiteralParser(source);
        final Object value = parser.parseValue();
        parser.skipWhitespace();
        if (parser.position != source.length()) {
            throw parser.error("Unexpected trailing characters");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseDict(final String source) {
        final Object value = parse(source);
        if (!(value instanceof Map<?, ?>)) {
            throw new CacheValidationFailed("Expected a dict literal but found " + source);
        }
        return (Map<String, Object>) value;
    }

    @Nullable
    private Object parseValue() {
        skipWhitespace();
        if (position >= source.length()) {
            throw error("Unexpected end of literal");
        }

        final char c = source.charAt(position);
        return switch (c) {
            case '{' -> parseDict();
            case '[' -> parseSequence('[', ']');
            case '(' -> parseSequence('(', ')');
            case '\'', '"' -> parseString();
            default -> c == '-' || c == '+' || c == '.' || Character.isDigit(c)
                    ? parseNumber()
                    : parseName();
        };
    }

    private Map<String, Object> parseDict() {
        expect('{');
        final Map<String, Object> map = new LinkedHashMap<>();
        skipWhitespace();
        if (consume('}')) {
            return map;
        }

        while (true) {
            skipWhitespace();
            final Object key = parseValue();
            if (!(key instanceof String)) {
                throw error("Only string keys are supported");
            }
            skipWhitespace();
            expect(':');
            map.put((String) key, parseValue());
            skipWhitespace();
            if (consume('}')) {
                return map;
            }
            expect(',');
            skipWhitespace();
            // Trailing comma
            if (consume('}')) {
                return map;
            }
        }
    }

    private List<Object> parseSequence(final char open, final char close) {
        expect(open);
        final List<Object> list = new ArrayList<>();
        skipWhitespace();
        if (consume(close)) {
            return list;
        }

        while (true) {
            list.add(parseValue());
            skipWhitespace();
            if (consume(close)) {
                return list;
            }
            expect(',');
            skipWhitespace();
            if (consume(close)) {
                return list;
            }
        }
    }

    private String parseString() {
        final char quote = source.charAt(position++);
        final StringBuilder builder = new StringBuilder();
        while (position < source.length()) {
            final char c = source.charAt(position++);
            if (c == quote) {
                return builder.toString();
            }
            if (c == '\\') {
                builder.append(parseEscape());
            } else {
                builder.append(c);
            }
        }
        throw error("Unterminated string");
    }

    private String parseEscape() {
        if (position >= source.length()) {
            throw error("Unterminated escape");
        }

        final char c = source.charAt(position++);
        return switch (c) {
            case 'n' -> "\n";
            case 't' -> "\t";
            case 'r' -> "\r";
            case 'b' -> "\b";
            case 'f' -> "\f";
            case '0' -> "\0";
            case '\\', '\'', '"' -> String.valueOf(c);
            case 'x' -> hexEscape(2);
            case 'u' -> hexEscape(4);
            case 'U' -> hexEscape(8);
            default -> "\\" + c;
        };
    }

    private String hexEscape(final int length) {
        if (position + length > source.length()) {
            throw error("Truncated hex escape");
        }
        final String hex = source.substring(position, position + length);
        position += length;
        try {
            return new String(Character.toChars(Integer.parseInt(hex, 16)));
        } catch (final IllegalArgumentException ex) {
            throw new CacheValidationFailed("Invalid hex escape \\" + hex + " in " + source, ex);
        }
    }

    private Object parseNumber() {
        final int start = position;
        while (position < source.length() && "+-.0123456789eEjJ_".indexOf(source.charAt(position)) >= 0) {
            position++;
        }

        final String text = source.substring(start, position).replace("_", "");
        try {
            if (text.contains(".") || text.contains("e") || text.contains("E")) {
                return Double.parseDouble(text);
            }

            final BigInteger value = new BigInteger(text.startsWith("+") ? text.substring(1) : text);
            if (value.bitLength() < Integer.SIZE) {
                return value.intValue();
            }
            if (value.bitLength() < Long.SIZE) {
                return value.longValue();
            }
            return value;
        } catch (final NumberFormatException ex) {
            throw new CacheValidationFailed("Invalid number '" + text + "' in " + source, ex);
        }
    }

    @Nullable
    private Object parseName() {
        final int start = position;
        while (position < source.length() && Character.isLetter(source.charAt(position))) {
            position++;
        }

        final String name = source.substring(start, position);
        return switch (name) {
            case "True" -> Boolean.TRUE;
            case "False" -> Boolean.FALSE;
            case "None" -> null;
            case "inf" -> Double.POSITIVE_INFINITY;
            case "nan" -> Double.NaN;
            default -> throw error("Unsupported literal '" + name + "'");
        };
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private boolean consume(final char c) {
        if (position < source.length() && source.charAt(position) == c) {
            position++;
            return true;
        }
        return false;
    }

    private void expect(final char c) {
        if (!consume(c)) {
            throw error("Expected '" + c + "'");
        }
    }

    private CacheValidationFailed error(final String message) {
        return new CacheValidationFailed(message + " at position " + position + " of " + source);
    }
}
