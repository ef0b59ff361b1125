package no.cantara.chaingraph.validation;

import no.cantara.chaingraph.legend.BoundaryRule;
import no.cantara.chaingraph.legend.GlyphLegend;
import no.cantara.chaingraph.model.ChainAST;
import no.cantara.chaingraph.model.Edge;
import no.cantara.chaingraph.model.GlyphNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates a single {@link ChainAST} against a {@link GlyphLegend}.
 *
 * <p>Checks are pure: the same chain always yields the same errors and warnings in the same order.
 */
public class ChainValidator {

    private final GlyphLegend legend;

    public ChainValidator(GlyphLegend legend) {
        this.legend = Objects.requireNonNull(legend, "legend");
    }

    public GlyphLegend legend() {
        return legend;
    }

    /** Runs the structure, termination, cycle and boundary checks. Empty chains are valid. */
    public ValidationResult validate(ChainAST ast) {
        if (ast.isEmpty()) {
            return ValidationResult.ok();
        }
        return validateStructure(ast)
                .merge(validateTermination(ast))
                .merge(validateCycles(ast))
                .merge(validateBoundaries(ast));
    }

    /** Every kind and operator must be known to the legend, and every edge must point inside the chain. */
    public ValidationResult validateStructure(ChainAST ast) {
        List<ValidationIssue> errors = new ArrayList<>();
        int size = ast.nodes().size();

        for (GlyphNode node : ast.nodes()) {
            if (!legend.isKnownKind(node.kind())) {
                errors.add(new ValidationIssue(IssueCode.UNKNOWN_KIND,
                        "Unknown glyph kind: " + node.kind(), node.qualifiedName()));
            }
        }

        for (Edge edge : ast.edges()) {
            if (edge.source() < 0 || edge.source() >= size) {
                errors.add(ValidationIssue.of(IssueCode.EDGE_SOURCE_OUT_OF_RANGE,
                        "Edge source index " + edge.source() + " out of range"));
            }
            if (edge.target() < 0 || edge.target() >= size) {
                errors.add(ValidationIssue.of(IssueCode.EDGE_TARGET_OUT_OF_RANGE,
                        "Edge target index " + edge.target() + " out of range"));
            }
            if (!legend.isKnownOperator(edge.operator())) {
                errors.add(ValidationIssue.of(IssueCode.UNKNOWN_OPERATOR,
                        "Unknown operator: " + edge.operator()));
            }
        }
        return new ValidationResult(errors, List.of());
    }

    /**
     * At least one node without outgoing edges must be of a terminal kind. Chains made only of
     * containment edges are exempt.
     */
    public ValidationResult validateTermination(ChainAST ast) {
        if (ast.isEmpty() || isContainmentChain(ast)) {
            return ValidationResult.ok();
        }

        Set<Integer> hasOutgoing = new HashSet<>();
        ast.edges().forEach(e -> hasOutgoing.add(e.source()));

        for (int i = 0; i < ast.nodes().size(); i++) {
            if (!hasOutgoing.contains(i) && legend.terminalKinds().contains(ast.nodes().get(i).kind())) {
                return ValidationResult.ok();
            }
        }
        return ValidationResult.warning(ValidationIssue.of(IssueCode.NO_TERMINAL_OUTPUT,
                "Chain does not end with a " + String.join(" or ", legend.terminalKinds()) + " glyph"));
    }

    /**
     * Reports every edge that lies on a cycle and whose operator is outside the cycle-tolerant class.
     *
     * <p>Each distinct qualified glyph is one vertex, so {@code CMP:A => STO:B ~> CMP:A} closes a
     * cycle. An edge lies on a cycle when its source and target share a strongly connected
     * component, so edges leading into a cycle never count. Identical edges are reported once.
     */
    public ValidationResult validateCycles(ChainAST ast) {
        Map<String, List<Edge>> adjacency = new LinkedHashMap<>();
        Map<Integer, String> vertexOf = new LinkedHashMap<>();
        for (int i = 0; i < ast.nodes().size(); i++) {
            String vertex = ast.nodes().get(i).qualifiedName();
            vertexOf.put(i, vertex);
            adjacency.putIfAbsent(vertex, new ArrayList<>());
        }
        for (Edge edge : ast.edges()) {
            if (vertexOf.containsKey(edge.source()) && vertexOf.containsKey(edge.target())) {
                adjacency.get(vertexOf.get(edge.source())).add(edge);
            }
        }

        Map<String, Integer> component = new StronglyConnected(adjacency, vertexOf).components();

        List<ValidationIssue> errors = new ArrayList<>();
        Set<String> reported = new HashSet<>();
        for (Edge edge : ast.edges()) {
            String source = vertexOf.get(edge.source());
            String target = vertexOf.get(edge.target());
            if (source == null || target == null || legend.cyclesAllowed(edge.operator())) {
                continue;
            }
            if (!component.get(source).equals(component.get(target))) {
                continue;
            }
            if (!reported.add(source + '\u0000' + edge.operator() + '\u0000' + target)) {
                continue;
            }

            StringBuilder cycle = new StringBuilder(source).append(' ').append(edge.operator()).append(' ').append(target);
            for (String step : pathBack(target, source, adjacency, vertexOf, component)) {
                cycle.append(' ').append(step);
            }
            errors.add(new ValidationIssue(IssueCode.STRUCTURAL_CYCLE,
                    "Structural cycle detected through '" + edge.operator() + "' operator: " + cycle,
                    source));
        }
        return new ValidationResult(errors, List.of());
    }

    // Shortest path inside one component, rendered as "op vertex" steps; empty when from == to.
    private static List<String> pathBack(String from, String to, Map<String, List<Edge>> adjacency,
                                         Map<Integer, String> vertexOf, Map<String, Integer> component) {
        Map<String, Edge> reachedBy = new LinkedHashMap<>();
        ArrayDeque<String> queue = new ArrayDeque<>();
        queue.add(from);
        reachedBy.put(from, null);
        while (!queue.isEmpty() && !reachedBy.containsKey(to)) {
            String vertex = queue.poll();
            for (Edge edge : adjacency.get(vertex)) {
                String next = vertexOf.get(edge.target());
                if (component.get(next).equals(component.get(from)) && !reachedBy.containsKey(next)) {
                    reachedBy.put(next, edge);
                    queue.add(next);
                }
            }
        }

        List<String> steps = new ArrayList<>();
        for (String vertex = to; !vertex.equals(from); ) {
            Edge edge = reachedBy.get(vertex);
            steps.add(0, edge.operator() + " " + vertex);
            vertex = vertexOf.get(edge.source());
        }
        return steps;
    }

    /** Applies every forbidding rule of the legend to every edge. */
    public ValidationResult validateBoundaries(ChainAST ast) {
        List<ValidationIssue> errors = new ArrayList<>();
        int size = ast.nodes().size();

        for (Edge edge : ast.edges()) {
            if (edge.source() < 0 || edge.source() >= size || edge.target() < 0 || edge.target() >= size) {
                continue;
            }
            GlyphNode source = ast.nodes().get(edge.source());
            GlyphNode target = ast.nodes().get(edge.target());

            for (BoundaryRule rule : legend.boundaryRules()) {
                if (!rule.allowed() && rule.matches(source, edge.operator(), target)) {
                    errors.add(new ValidationIssue(IssueCode.BOUNDARY_VIOLATION,
                            rule.reason() + " (" + source.qualifiedName() + " " + edge.operator() + " "
                                    + target.qualifiedName() + ")",
                            source.qualifiedName()));
                }
            }
        }
        return new ValidationResult(errors, List.of());
    }

    /** True if the chain has edges and all of them are containment edges. */
    public boolean isContainmentChain(ChainAST ast) {
        return !ast.edges().isEmpty() && ast.edges().stream().allMatch(e -> legend.isContainment(e.operator()));
    }

    /** Tarjan's strongly connected components over the qualified-name graph of one chain. */
    private static final class StronglyConnected {
        private final Map<String, List<Edge>> adjacency;
        private final Map<Integer, String> vertexOf;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Map<String, Integer> component = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private int nextIndex;
        private int nextComponent;

        private StronglyConnected(Map<String, List<Edge>> adjacency, Map<Integer, String> vertexOf) {
            this.adjacency = adjacency;
            this.vertexOf = vertexOf;
        }

        private Map<String, Integer> components() {
            for (String vertex : adjacency.keySet()) {
                if (!index.containsKey(vertex)) {
                    connect(vertex);
                }
            }
            return component;
        }

        private void connect(String vertex) {
            index.put(vertex, nextIndex);
            lowLink.put(vertex, nextIndex);
            nextIndex++;
            stack.push(vertex);
            onStack.add(vertex);

            for (Edge edge : adjacency.get(vertex)) {
                String next = vertexOf.get(edge.target());
                if (!index.containsKey(next)) {
                    connect(next);
                    lowLink.put(vertex, Math.min(lowLink.get(vertex), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(vertex, Math.min(lowLink.get(vertex), index.get(next)));
                }
            }

            if (lowLink.get(vertex).equals(index.get(vertex))) {
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.put(member, nextComponent);
                } while (!member.equals(vertex));
                nextComponent++;
            }
        }
    }
}
