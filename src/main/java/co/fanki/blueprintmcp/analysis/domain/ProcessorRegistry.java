package co.fanki.blueprintmcp.analysis.domain;

import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.NodeKinds;
import co.fanki.blueprintmcp.parsing.domain.ObjectPath;
import co.fanki.blueprintmcp.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Picks the processor of a node, in strict precedence: a processor
 * registered for the node's exact kind, then the pattern matched
 * generic processor, then the fallback.
 *
 * <p>Macro instances are registered per macro, as
 * {@code K2Node_MacroInstance:ForEachLoop}; the bare kind catches the
 * other macros.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ProcessorRegistry {

    private final Map<String, NodeProcessor> specialized;
    private final PatternProcessor generic;
    private final NodeProcessor fallback;

    private ProcessorRegistry(final Map<String, NodeProcessor> theSpecialized,
            final PatternProcessor theGeneric,
            final NodeProcessor theFallback) {
        specialized = Collections.unmodifiableMap(
                new LinkedHashMap<>(theSpecialized));
        generic = theGeneric;
        fallback = theFallback;
    }

    /** The tier a node was dispatched to. */
    public enum Tier {
        SPECIALIZED,
        GENERIC,
        FALLBACK
    }

    /**
     * Returns the processor for a node.
     *
     * @param node the node
     * @return the processor, never null
     */
    public NodeProcessor resolve(final GraphNode node) {
        return switch (tierOf(node)) {
            case SPECIALIZED -> specialized(node);
            case GENERIC -> generic;
            case FALLBACK -> fallback;
        };
    }

    /**
     * Returns the tier a node is dispatched to.
     *
     * @param node the node
     * @return the tier
     */
    public Tier tierOf(final GraphNode node) {
        if (specialized(node) != null) {
            return Tier.SPECIALIZED;
        }
        if (generic != null && generic.matches(node)) {
            return Tier.GENERIC;
        }
        return Tier.FALLBACK;
    }

    public NodeProcessor fallback() {
        return fallback;
    }

    /**
     * Lists the dispatch keys with a specialized processor.
     *
     * @return the keys mapped to the processor class simple name
     */
    public Map<String, String> describe() {
        final Map<String, String> description = new LinkedHashMap<>();
        specialized.forEach((key, processor) ->
                description.put(key, processor.getClass().getSimpleName()));
        return description;
    }

    /**
     * Returns the key a node is looked up with: its kind, qualified by
     * the macro name for macro instances.
     *
     * @param node the node
     * @return the dispatch key
     */
    public static String dispatchKey(final GraphNode node) {
        if (NodeKinds.MACRO_INSTANCE.equals(node.kind())) {
            final String macro = macroName(node);
            if (macro != null) {
                return NodeKinds.MACRO_INSTANCE + ":" + macro;
            }
        }
        return node.kind();
    }

    /**
     * Returns the macro a macro instance expands, e.g.
     * {@code ForEachLoop}.
     *
     * @param node the node
     * @return the macro name, or null when not referenced
     */
    public static String macroName(final GraphNode node) {
        return ObjectPath.objectName(
                node.memberText("MacroGraphReference", "MacroGraph"));
    }

    private NodeProcessor specialized(final GraphNode node) {
        final NodeProcessor exact = specialized.get(dispatchKey(node));
        return exact != null ? exact : specialized.get(node.kind());
    }

    /**
     * Starts a registry.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Assembles a {@link ProcessorRegistry}. */
    public static final class Builder {

        private final Map<String, NodeProcessor> specialized =
                new LinkedHashMap<>();
        private PatternProcessor generic;
        private NodeProcessor fallback;

        private Builder() {
        }

        /**
         * Registers a processor for one or more dispatch keys.
         *
         * @param processor the processor
         * @param keys node kinds, or {@code K2Node_MacroInstance:<macro>}
         * @return this builder
         */
        public Builder register(final NodeProcessor processor,
                final String... keys) {
            Preconditions.requireNonNull(processor,
                    "The processor cannot be null");
            for (final String key : keys) {
                specialized.put(Preconditions.requireNonBlank(key,
                        "The dispatch key cannot be blank"), processor);
            }
            return this;
        }

        public Builder generic(final PatternProcessor processor) {
            generic = processor;
            return this;
        }

        public Builder fallback(final NodeProcessor processor) {
            fallback = processor;
            return this;
        }

        /**
         * Builds the registry.
         *
         * @return the registry
         * @throws IllegalArgumentException when no fallback was given
         */
        public ProcessorRegistry build() {
            Preconditions.requireNonNull(fallback,
                    "A fallback processor is required");
            return new ProcessorRegistry(specialized, generic, fallback);
        }
    }

}
