package co.fanki.blueprintmcp.parsing.domain;

import co.fanki.blueprintmcp.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A generic object block of the text dump: a class, a name, the
 * properties in declaration order and the nested blocks.
 *
 * <p>Instances are immutable. They are assembled through a
 * {@link Builder} while the parser walks the dump.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RawObject {

    /** Matches indexed property keys like {@code Slots(3)}. */
    private static final Pattern INDEXED_KEY = Pattern.compile(
            "^(.+)\\((\\d+)\\)$");

    private final String classType;
    private final String name;
    private final Map<String, PropertyValue> properties;
    private final List<RawObject> children;

    private RawObject(final String theClassType, final String theName,
            final Map<String, PropertyValue> theProperties,
            final List<RawObject> theChildren) {
        classType = theClassType;
        name = theName;
        properties = Collections.unmodifiableMap(
                new LinkedHashMap<>(theProperties));
        children = List.copyOf(theChildren);
    }

    /**
     * Returns the class path, empty for blocks declared without one.
     *
     * @return the class path, never null
     */
    public String classType() {
        return classType;
    }

    /**
     * Returns the class name without its package path.
     *
     * @return the short class name
     */
    public String shortClassName() {
        return ObjectPath.shortClassName(classType);
    }

    public String name() {
        return name;
    }

    public Map<String, PropertyValue> properties() {
        return properties;
    }

    public List<RawObject> children() {
        return children;
    }

    /**
     * Returns a property value.
     *
     * @param key the property key
     * @return the value, or null when absent
     */
    public PropertyValue property(final String key) {
        return properties.get(key);
    }

    /**
     * Returns the plain text of a property.
     *
     * @param key the property key
     * @return the text, or null when absent
     */
    public String text(final String key) {
        final PropertyValue value = properties.get(key);
        return value == null ? null : value.text();
    }

    /**
     * Collects indexed properties such as {@code Slots(0)},
     * {@code Slots(1)} in index order.
     *
     * @param baseKey the key without its index, e.g. {@code Slots}
     * @return the values ordered by index, empty when there are none
     */
    public List<PropertyValue> indexed(final String baseKey) {
        final TreeMap<Integer, PropertyValue> byIndex = new TreeMap<>();
        for (final Map.Entry<String, PropertyValue> entry
                : properties.entrySet()) {
            final Matcher matcher = INDEXED_KEY.matcher(entry.getKey());
            if (matcher.matches() && matcher.group(1).equals(baseKey)) {
                byIndex.put(Integer.parseInt(matcher.group(2)),
                        entry.getValue());
            }
        }
        return new ArrayList<>(byIndex.values());
    }

    /**
     * Returns this object followed by all its descendants, depth first.
     *
     * @return the flattened objects in text order
     */
    public List<RawObject> flatten() {
        final List<RawObject> all = new ArrayList<>();
        collect(this, all);
        return all;
    }

    /**
     * Flattens a forest of objects, depth first.
     *
     * @param roots the root objects
     * @return every object in text order
     */
    public static List<RawObject> flatten(final List<RawObject> roots) {
        final List<RawObject> all = new ArrayList<>();
        for (final RawObject root : roots) {
            collect(root, all);
        }
        return all;
    }

    private static void collect(final RawObject object,
            final List<RawObject> into) {
        into.add(object);
        for (final RawObject child : object.children) {
            collect(child, into);
        }
    }

    @Override
    public String toString() {
        return "RawObject[" + shortClassName() + " " + name + "]";
    }

    /**
     * Mutable assembly state of one object while the parser is inside
     * its block.
     */
    public static final class Builder {

        private final String classType;
        private final String name;
        private final Map<String, PropertyValue> properties =
                new LinkedHashMap<>();
        private final List<Builder> children = new ArrayList<>();

        /**
         * Creates a builder.
         *
         * @param theClassType the class path, may be empty
         * @param theName the object name
         */
        public Builder(final String theClassType, final String theName) {
            classType = theClassType == null ? "" : theClassType;
            name = Preconditions.requireNonNull(theName,
                    "The object name cannot be null");
        }

        public String name() {
            return name;
        }

        /**
         * Sets a property, replacing any earlier value of the same key.
         *
         * @param key the property key
         * @param value the parsed value
         * @return this builder
         */
        public Builder property(final String key, final PropertyValue value) {
            properties.put(key, value);
            return this;
        }

        /**
         * Appends a line of unparsed text to a property, one line per
         * appended value, keeping the lines added before.
         *
         * @param key the property key
         * @param line the text line
         * @return this builder
         */
        public Builder appendText(final String key, final String line) {
            final PropertyValue earlier = properties.get(key);
            final String text = earlier == null ? line
                    : earlier.raw() + "\n" + line;
            properties.put(key, new PropertyValue.Scalar(text, text));
            return this;
        }

        /**
         * Adds a nested object.
         *
         * @param child the child builder
         * @return this builder
         */
        public Builder child(final Builder child) {
            children.add(child);
            return this;
        }

        List<Builder> children() {
            return children;
        }

        /**
         * Builds the immutable object tree rooted at this builder.
         *
         * @return the object
         */
        public RawObject build() {
            final List<RawObject> built = new ArrayList<>();
            for (final Builder child : children) {
                built.add(child.build());
            }
            return new RawObject(classType, name, properties, built);
        }
    }

}
