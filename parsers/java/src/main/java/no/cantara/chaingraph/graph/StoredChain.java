package no.cantara.chaingraph.graph;

import no.cantara.chaingraph.model.ChainAST;

/**
 * A chain held by a {@link KnowledgeGraph}.
 *
 * @param id         stable identifier assigned at insertion; never reused
 * @param ast        the parsed chain
 * @param lineNumber source line in the loaded document, or 0 for chains added programmatically
 * @param section    section label, or null for chains outside any section
 */
public record StoredChain(
        long id,
        ChainAST ast,
        int lineNumber,
        String section
) {
    /** Qualified name of the root glyph. Stored chains are never empty. */
    public String rootGlyph() {
        return ast.root().qualifiedName();
    }

    public String version() {
        return ast.version();
    }

    public boolean deprecated() {
        return ast.deprecated();
    }
}
