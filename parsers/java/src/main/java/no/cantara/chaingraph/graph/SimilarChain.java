package no.cantara.chaingraph.graph;

import java.util.List;

/**
 * A stored chain that overlaps a proposed statement.
 *
 * @param chain        the stored chain
 * @param score        Jaccard similarity in [0, 1]
 * @param sharedGlyphs qualified names present in both the proposal and the stored chain
 */
public record SimilarChain(
        StoredChain chain,
        double score,
        List<String> sharedGlyphs
) {
    public SimilarChain {
        sharedGlyphs = sharedGlyphs != null ? List.copyOf(sharedGlyphs) : List.of();
    }
}
