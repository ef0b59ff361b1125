package no.cantara.chaingraph.model;

import java.util.List;

/**
 * One parsed chain statement.
 *
 * <p>Immutable. The store derives updated copies through {@link #withVersion(String)} and
 * {@link #asDeprecated()} instead of mutating in place.
 */
public record ChainAST(
        String version,
        String framework,
        boolean deprecated,
        List<GlyphNode> nodes,
        List<Edge> edges,
        String raw
) {
    public static final String DEPRECATED_MARKER = "[deprecated]";

    public ChainAST {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        raw = raw != null ? raw : "";
    }

    public static ChainAST empty(String raw) {
        return new ChainAST(null, null, false, List.of(), List.of(), raw);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** The first glyph of the chain, or null for an empty chain. */
    public GlyphNode root() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    /** Assigns a version that was not written in the statement and prefixes the raw text with its tag. */
    public ChainAST withVersion(String newVersion) {
        return new ChainAST(newVersion, framework, deprecated, nodes, edges, "@" + newVersion + " " + raw);
    }

    /**
     * Marks the chain deprecated and writes the marker after its version tag.
     *
     * @throws IllegalStateException if the chain is unversioned, since the marker can only follow
     *                               a version tag
     */
    public ChainAST asDeprecated() {
        if (version == null) {
            throw new IllegalStateException("Only a versioned chain can be deprecated: '" + raw + "'");
        }
        String text = raw;
        String tag = "@" + version;
        if (!text.contains(DEPRECATED_MARKER) && text.startsWith(tag)) {
            text = tag + " " + DEPRECATED_MARKER + text.substring(tag.length());
        }
        return new ChainAST(version, framework, true, nodes, edges, text);
    }
}
