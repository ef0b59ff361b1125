package no.cantara.chaingraph.validation;

import no.cantara.chaingraph.graph.KnowledgeGraph;
import no.cantara.chaingraph.graph.StoredChain;
import no.cantara.chaingraph.legend.GlyphLegend;
import no.cantara.chaingraph.model.ChainAST;
import no.cantara.chaingraph.model.Edge;
import no.cantara.chaingraph.model.GlyphNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates every chain of a {@link KnowledgeGraph} and adds the checks that need the whole graph:
 * duplicate versions per root glyph and error-path coverage of endpoints.
 */
public class GraphValidator {

    private final GlyphLegend legend;
    private final ChainValidator chainValidator;

    public GraphValidator(GlyphLegend legend) {
        this.legend = legend;
        this.chainValidator = new ChainValidator(legend);
    }

    public ValidationResult validate(KnowledgeGraph graph) {
        ValidationResult result = ValidationResult.ok();
        for (StoredChain stored : graph.chains()) {
            result = result.merge(chainValidator.validate(stored.ast()));
        }
        return result
                .merge(validateVersions(graph))
                .merge(validateErrorPaths(graph));
    }

    /**
     * The same root glyph with the same version in more than one chain is an error. Chains without
     * a version share the {@value KnowledgeGraph#UNVERSIONED} bucket.
     */
    public ValidationResult validateVersions(KnowledgeGraph graph) {
        List<ValidationIssue> errors = new ArrayList<>();
        Map<String, Set<String>> versionsByRoot = new HashMap<>();

        for (StoredChain stored : graph.chains()) {
            String root = stored.rootGlyph();
            String version = stored.version() != null ? stored.version() : KnowledgeGraph.UNVERSIONED;
            if (!versionsByRoot.computeIfAbsent(root, r -> new HashSet<>()).add(version)) {
                errors.add(new ValidationIssue(IssueCode.DUPLICATE_VERSION,
                        "Version " + version + " already exists for root " + root, root));
            }
        }
        return new ValidationResult(errors, List.of());
    }

    /**
     * Warns for every endpoint glyph that no chain connects to an error glyph with a control edge.
     * A missing error path never makes the graph invalid.
     */
    public ValidationResult validateErrorPaths(KnowledgeGraph graph) {
        Set<String> endpoints = new LinkedHashSet<>();
        Set<String> covered = new HashSet<>();

        for (StoredChain stored : graph.chains()) {
            ChainAST ast = stored.ast();
            for (GlyphNode node : ast.nodes()) {
                if (legend.endpointKind().equals(node.kind())) {
                    endpoints.add(node.qualifiedName());
                }
            }
            for (Edge edge : ast.edges()) {
                if (!legend.isControl(edge.operator()) || !inRange(edge, ast)) continue;
                GlyphNode source = ast.nodes().get(edge.source());
                GlyphNode target = ast.nodes().get(edge.target());
                if (legend.endpointKind().equals(source.kind()) && legend.errorKind().equals(target.kind())) {
                    covered.add(source.qualifiedName());
                }
            }
        }

        List<ValidationIssue> warnings = new ArrayList<>();
        for (String endpoint : endpoints) {
            if (!covered.contains(endpoint)) {
                warnings.add(new ValidationIssue(IssueCode.MISSING_ERROR_PATH,
                        "Endpoint " + endpoint + " has no error path defined", endpoint));
            }
        }
        return new ValidationResult(List.of(), warnings);
    }

    public ValidationResult validateBoundariesOnly(KnowledgeGraph graph) {
        ValidationResult result = ValidationResult.ok();
        for (StoredChain stored : graph.chains()) {
            result = result.merge(chainValidator.validateBoundaries(stored.ast()));
        }
        return result;
    }

    public ValidationResult validateCyclesOnly(KnowledgeGraph graph) {
        ValidationResult result = ValidationResult.ok();
        for (StoredChain stored : graph.chains()) {
            result = result.merge(chainValidator.validateCycles(stored.ast()));
        }
        return result;
    }

    private static boolean inRange(Edge edge, ChainAST ast) {
        int size = ast.nodes().size();
        return edge.source() >= 0 && edge.source() < size && edge.target() >= 0 && edge.target() < size;
    }
}
