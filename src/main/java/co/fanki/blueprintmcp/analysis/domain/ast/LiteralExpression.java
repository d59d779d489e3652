package co.fanki.blueprintmcp.analysis.domain.ast;

import java.util.Locale;

/**
 * A constant value, typed after the pin it was read from.
 *
 * @param value the literal text as serialized, null for no value
 * @param literalType the value type
 * @param location the node owning the pin
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LiteralExpression(String value, LiteralType literalType,
        SourceLocation location) implements Expression {

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    /** Literal types, derived from pin categories. */
    public enum LiteralType {
        BOOL,
        INT,
        FLOAT,
        STRING,
        NAME,
        TEXT,
        ENUM,
        OBJECT,
        STRUCT,
        UNKNOWN;

        /**
         * Maps a pin category to a literal type.
         *
         * @param category the pin category, may be null
         * @param subCategoryObject the type object, marks enum bytes
         * @return the literal type
         */
        public static LiteralType fromPinCategory(final String category,
                final String subCategoryObject) {
            if (category == null) {
                return UNKNOWN;
            }
            return switch (category.toLowerCase(Locale.ROOT)) {
                case "bool" -> BOOL;
                case "byte" -> subCategoryObject != null ? ENUM : INT;
                case "int", "int64" -> INT;
                case "real", "float", "double" -> FLOAT;
                case "string" -> STRING;
                case "name" -> NAME;
                case "text" -> TEXT;
                case "enum" -> ENUM;
                case "object", "class", "softobject", "softclass",
                        "interface" -> OBJECT;
                case "struct" -> STRUCT;
                default -> UNKNOWN;
            };
        }
    }

}
