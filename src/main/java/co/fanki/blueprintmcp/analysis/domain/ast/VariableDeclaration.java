package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * Introduces a named value.
 *
 * @param name the variable name
 * @param typeName the value type, may be null
 * @param value the initial value, null when bound by the runtime (loop
 *      variables, callback payloads)
 * @param kind why the variable exists
 * @param location the originating node
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record VariableDeclaration(String name, String typeName,
        Expression value, Kind kind, SourceLocation location)
        implements Statement {

    @Override
    public <T> T accept(final AstVisitor<T> visitor) {
        return visitor.visitVariableDeclaration(this);
    }

    /** Where a variable comes from. */
    public enum Kind {
        /** A value read more than once, extracted to avoid repeating it. */
        TEMPORARY,
        /** The result of a successful cast. */
        CAST,
        /** An iteration variable. */
        LOOP,
        /** A value delivered by an async callback. */
        CALLBACK
    }

}
