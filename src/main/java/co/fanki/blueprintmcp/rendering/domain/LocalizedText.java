package co.fanki.blueprintmcp.rendering.domain;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the display string of localized text values such as
 * {@code NSLOCTEXT("Namespace", "Key", "Play")}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class LocalizedText {

    private static final Pattern NSLOCTEXT = Pattern.compile(
            "^NSLOCTEXT\\(\\s*\"(?:[^\"\\\\]|\\\\.)*\"\\s*,\\s*"
                    + "\"(?:[^\"\\\\]|\\\\.)*\"\\s*,\\s*"
                    + "\"((?:[^\"\\\\]|\\\\.)*)\"\\s*\\)$", Pattern.DOTALL);

    private static final Pattern LOCTEXT = Pattern.compile(
            "^LOCTEXT\\(\\s*\"(?:[^\"\\\\]|\\\\.)*\"\\s*,\\s*"
                    + "\"((?:[^\"\\\\]|\\\\.)*)\"\\s*\\)$", Pattern.DOTALL);

    private static final Pattern INVTEXT = Pattern.compile(
            "^INVTEXT\\(\\s*\"((?:[^\"\\\\]|\\\\.)*)\"\\s*\\)$",
            Pattern.DOTALL);

    private LocalizedText() {
    }

    /**
     * Tells whether a value is written as localized text.
     *
     * @param value the value, may be null
     * @return true for {@code NSLOCTEXT}, {@code LOCTEXT} and
     *      {@code INVTEXT} values
     */
    static boolean isLocalized(final String value) {
        if (value == null) {
            return false;
        }
        final String trimmed = value.trim();
        return trimmed.startsWith("NSLOCTEXT(")
                || trimmed.startsWith("LOCTEXT(")
                || trimmed.startsWith("INVTEXT(");
    }

    /**
     * Returns the display string of a localized text value.
     *
     * @param value the value
     * @return the display string, or null when the value is not
     *      localized text or cannot be read
     */
    static String extract(final String value) {
        if (!isLocalized(value)) {
            return null;
        }
        final String trimmed = value.trim();
        for (final Pattern pattern : new Pattern[] {NSLOCTEXT, LOCTEXT,
                INVTEXT}) {
            final Matcher matcher = pattern.matcher(trimmed);
            if (matcher.matches()) {
                return matcher.group(1).replace("\\\"", "\"");
            }
        }
        return null;
    }

    /**
     * Returns the display string of a value, localized or not.
     *
     * @param value the value, may be null
     * @return the display string, the value itself when not localized
     */
    static String clean(final String value) {
        final String extracted = extract(value);
        return extracted != null ? extracted : value;
    }

}
