package co.fanki.blueprintmcp.rendering.domain;

import co.fanki.blueprintmcp.shared.DomainException;

import java.util.Locale;

/**
 * How much detail the markdown output carries.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum RenderStyle {

    /** Two space indent, names only. */
    CONCISE("  ", false),

    /** Four space indent, types and source node references. */
    VERBOSE("    ", true);

    private final String indent;
    private final boolean detailed;

    RenderStyle(final String theIndent, final boolean isDetailed) {
        indent = theIndent;
        detailed = isDetailed;
    }

    public String indent() {
        return indent;
    }

    public boolean detailed() {
        return detailed;
    }

    /**
     * Reads a style name, ignoring case.
     *
     * @param text the name, e.g. {@code concise}
     * @return the style
     * @throws DomainException when the name is not a style
     */
    public static RenderStyle fromText(final String text) {
        if (text != null) {
            for (final RenderStyle style : values()) {
                if (style.name().equals(text.trim().toUpperCase(Locale.ROOT))) {
                    return style;
                }
            }
        }
        throw new DomainException("Unknown render style: " + text,
                DomainException.UNKNOWN_BLUEPRINT_KIND);
    }

}
