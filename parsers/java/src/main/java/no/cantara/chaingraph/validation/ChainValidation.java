package no.cantara.chaingraph.validation;

import no.cantara.chaingraph.graph.KnowledgeGraph;
import no.cantara.chaingraph.legend.GlyphLegend;
import no.cantara.chaingraph.model.ChainAST;

/**
 * Shorthand entry points for callers that do not manage validators themselves.
 */
public final class ChainValidation {

    private ChainValidation() {}

    /** Validates one chain against the bundled legend. */
    public static ValidationResult validateChain(ChainAST ast) {
        return new ChainValidator(GlyphLegend.defaults()).validate(ast);
    }

    /** Validates a graph against the legend it was created with. */
    public static ValidationResult validateGraph(KnowledgeGraph graph) {
        return new GraphValidator(graph.legend()).validate(graph);
    }
}
