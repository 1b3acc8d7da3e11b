package io.github.sparkrew.cpgslice.udf_slicer;

import io.github.sparkrew.cpgslice.udf_slicer.model.DecodedAttributes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decodes the text between the brackets of a declaration into key/value pairs.
 * <p>
 * Pairs look like {@code key=value} and are separated by whitespace and/or commas. A value is either a double-quoted
 * string or a bare token that runs up to the next whitespace, comma or closing bracket. Fragments that do not fit
 * are skipped and reported back to the caller, never thrown.
 */
public class AttributeDecoder {

    /**
     * Decode every attribute.
     */
    public static Map<String, String> decodeAll(String attributeText) {
        return decode(attributeText, null).values();
    }

    /**
     * Decode attributes, keeping only the given keys.
     *
     * @param text       text between the brackets
     * @param wantedKeys keys to keep, or null to keep all of them
     * @return the decoded values (later duplicates win) and the skipped fragments
     */
    public static DecodedAttributes decode(String text, Set<String> wantedKeys) {
        Map<String, String> values = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        int n = text.length();
        int i = 0;
        while (i < n) {
            i = skipSeparators(text, i);
            if (i >= n) {
                break;
            }
            if (!isKeyStart(text.charAt(i))) {
                int end = skipFragment(text, i);
                skipped.add(text.substring(i, end));
                i = end;
                continue;
            }
            int keyEnd = i + 1;
            while (keyEnd < n && isKeyPart(text.charAt(keyEnd))) {
                keyEnd++;
            }
            String key = text.substring(i, keyEnd);
            int equals = skipWhitespace(text, keyEnd);
            if (equals >= n || text.charAt(equals) != '=') {
                // A key with no value, e.g. a stray word.
                skipped.add(key);
                i = keyEnd;
                continue;
            }
            int valueStart = skipWhitespace(text, equals + 1);
            String value;
            int next;
            if (valueStart < n && text.charAt(valueStart) == '"') {
                int close = closingQuote(text, valueStart);
                if (close < 0) {
                    skipped.add(text.substring(i));
                    break;
                }
                value = unescape(text, valueStart + 1, close);
                next = close + 1;
            } else {
                int end = valueStart;
                while (end < n && !isBareTerminator(text.charAt(end))) {
                    end++;
                }
                value = text.substring(valueStart, end);
                next = end;
            }
            if (wantedKeys == null || wantedKeys.contains(key)) {
                values.put(key, value);
            }
            i = next;
        }
        return new DecodedAttributes(values, skipped);
    }

    /**
     * Decode a quoted value body. {@code \"}, {@code \\}, {@code \n} and {@code \t} are translated, any other escape
     * is kept as written (backslash included).
     */
    static String unescape(String text, int from, int to) {
        StringBuilder sb = new StringBuilder(to - from);
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= to) {
                sb.append(c);
                continue;
            }
            char escaped = text.charAt(++i);
            switch (escaped) {
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                default -> sb.append('\\').append(escaped);
            }
        }
        return sb.toString();
    }

    private static int closingQuote(String text, int openQuote) {
        boolean escaped = false;
        for (int i = openQuote + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                return i;
            }
        }
        return -1;
    }

    // Skips one unrecognized token; always advances by at least one character.
    private static int skipFragment(String text, int from) {
        if (text.charAt(from) == '"') {
            int close = closingQuote(text, from);
            return close < 0 ? text.length() : close + 1;
        }
        int end = from + 1;
        while (end < text.length() && !isSeparator(text.charAt(end))) {
            end++;
        }
        return end;
    }

    private static int skipSeparators(String text, int from) {
        int i = from;
        while (i < text.length() && isSeparator(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isSeparator(char c) {
        return c == ',' || Character.isWhitespace(c);
    }

    private static boolean isBareTerminator(char c) {
        return c == ']' || isSeparator(c);
    }

    private static boolean isKeyStart(char c) {
        return c == '_' || (c < 128 && Character.isLetter(c));
    }

    private static boolean isKeyPart(char c) {
        return c == '_' || (c < 128 && Character.isLetterOrDigit(c));
    }
}
