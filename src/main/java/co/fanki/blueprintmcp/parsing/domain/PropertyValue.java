package co.fanki.blueprintmcp.parsing.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed property value of a {@link RawObject}.
 *
 * <p>Every variant keeps the raw text it was parsed from, so a value the
 * parser could only partially understand is never lost.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface PropertyValue {

    /**
     * Returns the value exactly as it appeared in the dump.
     *
     * @return the raw text, never null
     */
    String raw();

    /**
     * Returns the plain text of this value. Scalars are unquoted, object
     * references answer their object path, composites their raw text.
     *
     * @return the text, never null
     */
    String text();

    /**
     * Returns a struct member, if this value is a struct holding it.
     *
     * @param key the member key
     * @return the member value, or null
     */
    default PropertyValue member(final String key) {
        return null;
    }

    /**
     * Returns the text of a struct member.
     *
     * @param key the member key
     * @return the member text, or null when absent
     */
    default String memberText(final String key) {
        final PropertyValue value = member(key);
        return value == null ? null : value.text();
    }

    /**
     * Returns the items of a list value, or of a struct's members in
     * declaration order.
     *
     * @return the items, empty for scalars
     */
    default List<PropertyValue> items() {
        return List.of();
    }

    /** A single token or quoted string. */
    record Scalar(String raw, String text) implements PropertyValue {
    }

    /** A parenthesized group of {@code Key=Value} members. */
    record Struct(String raw, Map<String, PropertyValue> members)
            implements PropertyValue {

        public Struct {
            members = Collections.unmodifiableMap(
                    new LinkedHashMap<>(members));
        }

        @Override
        public String text() {
            return raw;
        }

        @Override
        public PropertyValue member(final String key) {
            return members.get(key);
        }

        @Override
        public List<PropertyValue> items() {
            return List.copyOf(members.values());
        }
    }

    /** A parenthesized, comma separated list of values. */
    record ListValue(String raw, List<PropertyValue> values)
            implements PropertyValue {

        public ListValue {
            values = List.copyOf(values);
        }

        @Override
        public String text() {
            return raw;
        }

        @Override
        public List<PropertyValue> items() {
            return values;
        }
    }

    /** A reference of the form {@code Class'path'}. */
    record ObjectReference(String raw, String classPath, String objectPath)
            implements PropertyValue {

        @Override
        public String text() {
            return objectPath;
        }
    }

}
