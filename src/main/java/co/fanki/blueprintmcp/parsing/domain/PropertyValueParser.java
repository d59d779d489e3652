package co.fanki.blueprintmcp.parsing.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the right hand side of a {@code Key=Value} property line.
 *
 * <p>Scanning is quote aware: commas, equal signs and parentheses inside
 * double quoted text never split or nest. A value whose parentheses do
 * not balance is kept as a scalar holding the raw text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PropertyValueParser {

    /** Matches {@code Class'path'} object references. */
    private static final Pattern OBJECT_REFERENCE = Pattern.compile(
            "^([\\w./:]+)'(.*)'$", Pattern.DOTALL);

    /** Keys allowed on the left of a struct member. */
    private static final Pattern MEMBER_KEY = Pattern.compile(
            "^[\\w.\\[\\]()]+$");

    private PropertyValueParser() {
    }

    /**
     * Parses a raw value.
     *
     * @param raw the raw value text, may be null
     * @return the parsed value, never null
     */
    public static PropertyValue parse(final String raw) {
        final String source = raw == null ? "" : raw;
        final String trimmed = source.trim();

        if (trimmed.startsWith("(")
                && closingParenthesis(trimmed) == trimmed.length() - 1) {
            return parseGroup(source,
                    trimmed.substring(1, trimmed.length() - 1));
        }

        final Matcher reference = OBJECT_REFERENCE.matcher(trimmed);
        if (reference.matches()) {
            return new PropertyValue.ObjectReference(source,
                    reference.group(1), unquote(reference.group(2)));
        }

        return new PropertyValue.Scalar(source, unquote(trimmed));
    }

    /**
     * Returns the parenthesis depth left open at the end of the text.
     *
     * @param text the text to scan
     * @return the open depth, zero when balanced
     */
    public static int openDepth(final String text) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && depth > 0) {
                depth--;
            }
        }
        return depth;
    }

    /**
     * Removes surrounding double quotes and their escapes.
     *
     * @param text the text
     * @return the unquoted text
     */
    public static String unquote(final String text) {
        if (text.length() >= 2 && text.startsWith("\"")
                && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1)
                    .replace("\\\"", "\"")
                    .replace("\\\\", "\\");
        }
        return text;
    }

    private static PropertyValue parseGroup(final String raw,
            final String inner) {
        final List<String> items = new ArrayList<>();
        for (final String item : splitTopLevel(inner)) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }

        if (items.isEmpty()) {
            return new PropertyValue.ListValue(raw, List.of());
        }

        final Map<String, PropertyValue> members = asMembers(items);
        if (members != null) {
            return new PropertyValue.Struct(raw, members);
        }

        final List<PropertyValue> values = new ArrayList<>();
        for (final String item : items) {
            values.add(parse(item));
        }
        return new PropertyValue.ListValue(raw, values);
    }

    /** Returns the members when every item is {@code key=value}. */
    private static Map<String, PropertyValue> asMembers(
            final List<String> items) {
        final Map<String, PropertyValue> members = new LinkedHashMap<>();
        for (final String item : items) {
            final int equals = indexOfTopLevelEquals(item);
            if (equals <= 0) {
                return null;
            }
            final String key = item.substring(0, equals).trim();
            if (!MEMBER_KEY.matcher(key).matches()) {
                return null;
            }
            members.put(key, parse(item.substring(equals + 1)));
        }
        return members;
    }

    private static List<String> splitTopLevel(final String text) {
        final List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static int indexOfTopLevelEquals(final String text) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == '=' && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /** Index of the parenthesis closing the one at position zero. */
    private static int closingParenthesis(final String text) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

}
