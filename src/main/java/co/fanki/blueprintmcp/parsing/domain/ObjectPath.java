package co.fanki.blueprintmcp.parsing.domain;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the object paths found in property values, such as
 * {@code /Script/UMG.Button'/Game/UI/WBP_Menu.WBP_Menu:WidgetTree.Play'}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ObjectPath {

    /** The quoted part of a {@code Class'path'} reference. */
    private static final Pattern QUOTED_PATH = Pattern.compile("'([^']*)'");

    private ObjectPath() {
    }

    /**
     * Removes a class wrapper and any quotes around a path.
     *
     * @param path the path, may be null
     * @return the bare path, or null when the input is null or None
     */
    public static String unwrap(final String path) {
        if (path == null) {
            return null;
        }
        String bare = path.trim();
        final Matcher quoted = QUOTED_PATH.matcher(bare);
        if (quoted.find()) {
            bare = quoted.group(1);
        }
        bare = PropertyValueParser.unquote(bare);
        if (bare.isEmpty() || "None".equals(bare)) {
            return null;
        }
        return bare;
    }

    /**
     * Returns the last segment of a path, after the last {@code :} or
     * {@code .}.
     *
     * @param path the path, may be wrapped in a class reference
     * @return the object name, or null when the path is empty or None
     */
    public static String objectName(final String path) {
        final String bare = unwrap(path);
        if (bare == null) {
            return null;
        }
        final int cut = Math.max(bare.lastIndexOf(':'),
                bare.lastIndexOf('.'));
        return cut >= 0 ? bare.substring(cut + 1) : bare;
    }

    /**
     * Returns the asset name of a path, dropping the generated class
     * suffix: {@code /Game/BP/BP_Door.BP_Door_C} becomes {@code BP_Door}.
     *
     * @param path the path
     * @return the asset name, or null when the path is empty or None
     */
    public static String assetName(final String path) {
        final String name = objectName(path);
        if (name != null && name.endsWith("_C") && name.length() > 2) {
            return name.substring(0, name.length() - 2);
        }
        return name;
    }

    /**
     * Returns the class name after the last {@code .} of a class path:
     * {@code /Script/BlueprintGraph.K2Node_Event} becomes
     * {@code K2Node_Event}.
     *
     * @param classPath the class path, may be null
     * @return the short class name, empty for a null path
     */
    public static String shortClassName(final String classPath) {
        if (classPath == null) {
            return "";
        }
        final int dot = classPath.lastIndexOf('.');
        return dot >= 0 ? classPath.substring(dot + 1) : classPath;
    }

}
