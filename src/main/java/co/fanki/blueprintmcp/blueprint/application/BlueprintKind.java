package co.fanki.blueprintmcp.blueprint.application;

import co.fanki.blueprintmcp.shared.DomainException;

import java.util.Locale;

/**
 * The kind of content a blueprint dump holds.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum BlueprintKind {

    /** Detect the kind from the parsed objects. */
    AUTO,

    /** Graph nodes, rendered as pseudocode per entry point. */
    EVENT_GRAPH,

    /** Widgets and slots, rendered as a hierarchy. */
    WIDGET_TREE;

    /**
     * Reads a kind name, ignoring case and accepting dashes.
     *
     * @param text the name, e.g. {@code event-graph}; null means AUTO
     * @return the kind
     * @throws DomainException when the name is not a kind
     */
    public static BlueprintKind fromText(final String text) {
        if (text == null || text.isBlank()) {
            return AUTO;
        }
        final String normalized = text.trim().replace('-', '_')
                .toUpperCase(Locale.ROOT);
        for (final BlueprintKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new DomainException("Unknown blueprint kind: " + text
                + ". Use auto, event_graph or widget_tree.",
                DomainException.UNKNOWN_BLUEPRINT_KIND);
    }

}
