package co.fanki.blueprintmcp.analysis.domain;

import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;
import co.fanki.blueprintmcp.graph.domain.PinDirection;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The single table normalizing exec pin names to the role they play.
 * {@code then} and {@code True} both continue, {@code else} and
 * {@code False} both take the other way.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PinAliases {

    /** Exec pin roles. */
    public enum Role {
        THEN(PinDirection.OUTPUT),
        ELSE(PinDirection.OUTPUT),
        EXECUTE(PinDirection.INPUT),
        LOOP_BODY(PinDirection.OUTPUT),
        COMPLETED(PinDirection.OUTPUT);

        private final PinDirection direction;

        Role(final PinDirection theDirection) {
            direction = theDirection;
        }

        public PinDirection direction() {
            return direction;
        }
    }

    private static final Map<String, Role> TABLE = Map.of(
            "then", Role.THEN,
            "true", Role.THEN,
            "else", Role.ELSE,
            "false", Role.ELSE,
            "execute", Role.EXECUTE,
            "exec", Role.EXECUTE,
            "loopbody", Role.LOOP_BODY,
            "completed", Role.COMPLETED);

    private PinAliases() {
    }

    /**
     * Returns the role of a pin name.
     *
     * @param pinName the pin name, may be null
     * @return the role, if the name is a known alias
     */
    public static Optional<Role> roleOf(final String pinName) {
        if (pinName == null) {
            return Optional.empty();
        }
        final String key = pinName.replace(" ", "")
                .toLowerCase(Locale.ROOT);
        return Optional.ofNullable(TABLE.get(key));
    }

    /**
     * Finds the exec pin playing a role on a node.
     *
     * @param node the node
     * @param role the role
     * @return the first exec pin of the right side with that role
     */
    public static Optional<GraphPin> find(final GraphNode node,
            final Role role) {
        for (final GraphPin pin : node.pins()) {
            if (pin.exec() && pin.direction() == role.direction()
                    && roleOf(pin.pinName()).orElse(null) == role) {
                return Optional.of(pin);
            }
        }
        return Optional.empty();
    }

    /**
     * Tells whether a pin plays a role.
     *
     * @param pin the pin
     * @param role the role
     * @return true when the pin name is an alias of the role
     */
    public static boolean is(final GraphPin pin, final Role role) {
        return roleOf(pin.pinName()).orElse(null) == role;
    }

}
