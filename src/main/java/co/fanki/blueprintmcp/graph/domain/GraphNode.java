package co.fanki.blueprintmcp.graph.domain;

import co.fanki.blueprintmcp.parsing.domain.ObjectPath;
import co.fanki.blueprintmcp.parsing.domain.PropertyValue;
import co.fanki.blueprintmcp.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A typed node of a {@link BlueprintGraph}.
 *
 * <p>Immutable. Pins keep their declaration order, which drives the
 * order of arguments and callbacks in the produced tree.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphNode {

    private final String guid;
    private final String name;
    private final String classType;
    private final Map<String, PropertyValue> properties;
    private final List<GraphPin> pins;
    private final Map<String, GraphPin> pinsById;
    private final List<String> diagnostics;

    /**
     * Creates a node.
     *
     * @param theGuid the node guid, never blank
     * @param theName the node name from the dump
     * @param theClassType the class path
     * @param theProperties the node properties, pins excluded
     * @param thePins the pins in declaration order
     * @param theDiagnostics problems found while building the node
     */
    public GraphNode(final String theGuid, final String theName,
            final String theClassType,
            final Map<String, PropertyValue> theProperties,
            final List<GraphPin> thePins, final List<String> theDiagnostics) {
        guid = Preconditions.requireNonBlank(theGuid,
                "The node guid cannot be blank");
        name = Preconditions.requireNonNull(theName,
                "The node name cannot be null");
        classType = Preconditions.requireNonNull(theClassType,
                "The class type cannot be null");
        properties = Collections.unmodifiableMap(
                new LinkedHashMap<>(theProperties));
        pins = List.copyOf(thePins);
        final Map<String, GraphPin> index = new LinkedHashMap<>();
        for (final GraphPin pin : pins) {
            index.putIfAbsent(pin.pinId(), pin);
        }
        pinsById = Collections.unmodifiableMap(index);
        diagnostics = List.copyOf(theDiagnostics);
    }

    public String guid() {
        return guid;
    }

    public String name() {
        return name;
    }

    public String classType() {
        return classType;
    }

    /**
     * Returns the short class name used for dispatch.
     *
     * @return the kind, e.g. {@code K2Node_CallFunction}
     */
    public String kind() {
        return ObjectPath.shortClassName(classType);
    }

    public Map<String, PropertyValue> properties() {
        return properties;
    }

    public List<GraphPin> pins() {
        return pins;
    }

    public List<String> diagnostics() {
        return diagnostics;
    }

    /**
     * Finds a pin by id.
     *
     * @param pinId the pin id
     * @return the pin, if present
     */
    public Optional<GraphPin> pin(final String pinId) {
        return Optional.ofNullable(pinsById.get(pinId));
    }

    /**
     * Finds a pin by name, exact match first, then ignoring case.
     *
     * @param pinName the pin name
     * @param direction the side of the node
     * @return the pin, if present
     */
    public Optional<GraphPin> findPin(final String pinName,
            final PinDirection direction) {
        GraphPin relaxed = null;
        for (final GraphPin pin : pins) {
            if (pin.direction() != direction) {
                continue;
            }
            if (pin.pinName().equals(pinName)) {
                return Optional.of(pin);
            }
            if (relaxed == null && pin.pinName().equalsIgnoreCase(pinName)) {
                relaxed = pin;
            }
        }
        return Optional.ofNullable(relaxed);
    }

    public Optional<GraphPin> findInput(final String pinName) {
        return findPin(pinName, PinDirection.INPUT);
    }

    public Optional<GraphPin> findOutput(final String pinName) {
        return findPin(pinName, PinDirection.OUTPUT);
    }

    public List<GraphPin> execInputs() {
        return select(PinDirection.INPUT, true);
    }

    public List<GraphPin> execOutputs() {
        return select(PinDirection.OUTPUT, true);
    }

    /** Visible data inputs in declaration order. */
    public List<GraphPin> dataInputs() {
        return select(PinDirection.INPUT, false);
    }

    /** Visible data outputs in declaration order. */
    public List<GraphPin> dataOutputs() {
        return select(PinDirection.OUTPUT, false);
    }

    /**
     * Tells whether the node takes part in control flow. Nodes without
     * exec pins are pure and only run when a value is read.
     *
     * @return true when the node has an exec pin
     */
    public boolean impure() {
        for (final GraphPin pin : pins) {
            if (pin.exec()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a property value.
     *
     * @param key the property key
     * @return the value, or null
     */
    public PropertyValue property(final String key) {
        return properties.get(key);
    }

    /**
     * Returns a property as text.
     *
     * @param key the property key
     * @return the text, or null when absent
     */
    public String text(final String key) {
        final PropertyValue value = properties.get(key);
        return value == null ? null : value.text();
    }

    /**
     * Returns a member of a struct property, for instance the
     * {@code MemberName} of {@code FunctionReference}.
     *
     * @param key the property key
     * @param member the member key
     * @return the member text, or null when absent
     */
    public String memberText(final String key, final String member) {
        final PropertyValue value = properties.get(key);
        return value == null ? null : value.memberText(member);
    }

    private List<GraphPin> select(final PinDirection direction,
            final boolean exec) {
        final List<GraphPin> selected = new ArrayList<>();
        for (final GraphPin pin : pins) {
            if (pin.direction() == direction && pin.exec() == exec
                    && (exec || !pin.hidden())) {
                selected.add(pin);
            }
        }
        return selected;
    }

    @Override
    public String toString() {
        return kind() + "(" + name + ")";
    }

}
