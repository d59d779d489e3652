package co.fanki.blueprintmcp.graph.domain;

import java.util.List;

/**
 * One connection point of a {@link GraphNode}.
 *
 * <p>{@code linkedTo} only holds links that resolved to an existing pin.
 * When the pin declared links and none resolved, {@code danglingLinks} is
 * set so the analyzer can tell an unconnected pin from a broken one.</p>
 *
 * @param pinId the pin identifier, unique within its node
 * @param pinName the logical name, e.g. {@code then} or {@code Health}
 * @param friendlyName the editor display name, may be null
 * @param direction input or output
 * @param category the pin category, e.g. {@code exec}, {@code real}
 * @param subCategory the pin sub category, may be null
 * @param subCategoryObject the type object name, e.g. {@code Vector}
 * @param containerType {@code Array}, {@code Set}, {@code Map} or null
 * @param hidden whether the editor hides this pin
 * @param defaultValue the literal used when unconnected, may be null
 * @param linkedTo the resolved remote pins in declaration order
 * @param danglingLinks whether declared links all failed to resolve
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphPin(
        String pinId,
        String pinName,
        String friendlyName,
        PinDirection direction,
        String category,
        String subCategory,
        String subCategoryObject,
        String containerType,
        boolean hidden,
        String defaultValue,
        List<PinReference> linkedTo,
        boolean danglingLinks) {

    public GraphPin {
        linkedTo = List.copyOf(linkedTo);
    }

    /** Whether this pin carries control flow. */
    public boolean exec() {
        return "exec".equalsIgnoreCase(category);
    }

    public boolean input() {
        return direction == PinDirection.INPUT;
    }

    public boolean output() {
        return direction == PinDirection.OUTPUT;
    }

    public boolean linked() {
        return !linkedTo.isEmpty();
    }

    /**
     * Returns a readable type tag: the type object name when present,
     * else the category, wrapped by its container.
     *
     * @return the type, e.g. {@code float}, {@code Vector},
     *      {@code Array<Actor>}
     */
    public String typeName() {
        String type = subCategoryObject != null ? subCategoryObject
                : category == null ? "unknown" : category;
        if ("real".equals(type)) {
            type = subCategory != null ? subCategory : "float";
        }
        if (containerType != null && !"None".equals(containerType)) {
            return containerType + "<" + type + ">";
        }
        return type;
    }

    /**
     * Returns a copy with a different link list.
     *
     * @param links the new links
     * @param dangling the new dangling flag
     * @return the copy
     */
    public GraphPin withLinks(final List<PinReference> links,
            final boolean dangling) {
        return new GraphPin(pinId, pinName, friendlyName, direction,
                category, subCategory, subCategoryObject, containerType,
                hidden, defaultValue, links, dangling);
    }

}
