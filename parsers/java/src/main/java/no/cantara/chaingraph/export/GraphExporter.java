package no.cantara.chaingraph.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import no.cantara.chaingraph.graph.GraphStats;
import no.cantara.chaingraph.graph.KnowledgeGraph;
import no.cantara.chaingraph.graph.StoredChain;
import no.cantara.chaingraph.legend.GlyphLegend;
import no.cantara.chaingraph.legend.KindDefinition;
import no.cantara.chaingraph.model.Edge;
import no.cantara.chaingraph.model.GlyphNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Renders a {@link KnowledgeGraph} as Graphviz DOT, Mermaid or JSON.
 *
 * <p>Glyphs appearing in several chains become one node, keyed by qualified name. Node colours
 * and shapes come from the legend; edge styles follow the operator's edge class.
 */
public class GraphExporter {

    public static final String JSON_FORMAT = "chain-graph";
    public static final String JSON_FORMAT_VERSION = "1.0";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private record EdgeStyle(String dotStyle, String dotColor, String dotLabel, String arrowhead, String mermaidArrow) {}

    private static final EdgeStyle DEFAULT_STYLE = new EdgeStyle("solid", "#333333", null, null, "-->");

    private static final Map<String, EdgeStyle> STYLE_BY_CLASS = Map.of(
            "structural",  DEFAULT_STYLE,
            "control",     new EdgeStyle("solid", "#e91e63", null, "vee", "-.->"),
            "reactive",    new EdgeStyle("dashed", "#4caf50", "reactive", null, "-.->"),
            "side-effect", new EdgeStyle("dotted", "#ff9800", "side-effect", null, "-.-o"),
            "internal",    new EdgeStyle("solid", "#9e9e9e", "internal", null, "-->"),
            "containment", new EdgeStyle("dashed", "#5c6bc0", "contains", "none", "--o")
    );

    public enum Format { DOT, MERMAID, JSON }

    private record QualifiedEdge(String source, String target, String operator) {}

    private final GlyphLegend legend;

    public GraphExporter(GlyphLegend legend) {
        this.legend = legend;
    }

    public String export(KnowledgeGraph graph, Format format) {
        return switch (format) {
            case DOT -> toDot(graph);
            case MERMAID -> toMermaid(graph);
            case JSON -> toJsonString(graph);
        };
    }

    public void write(KnowledgeGraph graph, Format format, Path output) throws IOException {
        Files.writeString(output, export(graph, format));
    }

    // ── DOT ───────────────────────────────────────────────────────────────────────

    public String toDot(KnowledgeGraph graph) {
        List<String> lines = new ArrayList<>();
        lines.add("digraph ChainGraph {");
        lines.add("  rankdir=LR;");
        lines.add("  node [fontname=\"Helvetica\", fontsize=10];");
        lines.add("  edge [fontname=\"Helvetica\", fontsize=8];");
        lines.add("");
        lines.add("  // Nodes");

        for (GlyphNode node : collectNodes(graph).values()) {
            KindDefinition kind = legend.kind(node.kind());
            String label = escape(node.qualifiedName());
            if (!node.modifiers().isEmpty()) {
                label += "\\n[" + String.join(", ", node.modifiers().stream().sorted().toList()) + "]";
            }
            lines.add(String.format("  \"%s\" [label=\"%s\", shape=\"%s\", style=\"filled\", fillcolor=\"%s\", fontcolor=\"white\"];",
                    escape(node.qualifiedName()), label,
                    kind != null ? kind.shape() : "box",
                    kind != null ? kind.color() : "#999999"));
        }

        lines.add("");
        lines.add("  // Edges");
        for (QualifiedEdge edge : collectEdges(graph)) {
            EdgeStyle style = styleOf(edge.operator());
            List<String> attrs = new ArrayList<>();
            attrs.add("style=\"" + style.dotStyle() + "\"");
            attrs.add("color=\"" + style.dotColor() + "\"");
            if (style.dotLabel() != null) attrs.add("label=\"" + style.dotLabel() + "\"");
            if (style.arrowhead() != null) attrs.add("arrowhead=\"" + style.arrowhead() + "\"");
            lines.add(String.format("  \"%s\" -> \"%s\" [%s];",
                    escape(edge.source()), escape(edge.target()), String.join(", ", attrs)));
        }
        lines.add("}");
        return String.join("\n", lines) + "\n";
    }

    // ── Mermaid ───────────────────────────────────────────────────────────────────

    public String toMermaid(KnowledgeGraph graph) {
        List<String> lines = new ArrayList<>();
        lines.add("graph LR");

        Map<String, GlyphNode> nodes = collectNodes(graph);
        for (String name : nodes.keySet()) {
            lines.add("    " + mermaidId(name) + "[\"" + name.replace("\"", "'") + "\"]");
        }

        Set<String> seen = new LinkedHashSet<>();
        for (QualifiedEdge edge : collectEdges(graph)) {
            if (!seen.add(edge.source() + "\u0000" + edge.target())) continue;
            lines.add("    " + mermaidId(edge.source()) + " " + styleOf(edge.operator()).mermaidArrow()
                    + " " + mermaidId(edge.target()));
        }

        Map<String, List<String>> idsByKind = new TreeMap<>();
        for (GlyphNode node : nodes.values()) {
            idsByKind.computeIfAbsent(node.kind(), k -> new ArrayList<>()).add(mermaidId(node.qualifiedName()));
        }
        if (!idsByKind.isEmpty()) {
            lines.add("");
            lines.add("    %% Styling");
            idsByKind.forEach((kind, ids) -> {
                KindDefinition def = legend.kind(kind);
                String color = def != null ? def.color() : "#999999";
                lines.add("    style " + String.join(",", ids) + " fill:" + color + ",color:white");
            });
        }
        return String.join("\n", lines) + "\n";
    }

    static String mermaidId(String qualifiedName) {
        return qualifiedName.replaceAll("[^A-Za-z0-9_]", "_");
    }

    // ── JSON ──────────────────────────────────────────────────────────────────────

    public ObjectNode toJson(KnowledgeGraph graph) {
        ObjectNode root = MAPPER.createObjectNode();

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("format", JSON_FORMAT);
        metadata.put("version", JSON_FORMAT_VERSION);
        GraphStats stats = graph.stats();
        ObjectNode statsNode = metadata.putObject("stats");
        statsNode.put("total_chains", stats.totalChains());
        statsNode.put("total_glyphs", stats.totalGlyphs());
        ArrayNode sections = statsNode.putArray("sections");
        stats.sections().forEach(sections::add);
        statsNode.put("deprecated", stats.deprecated());

        ArrayNode nodes = root.putArray("nodes");
        Set<String> seen = new LinkedHashSet<>();
        ArrayNode edges = root.putArray("edges");
        ArrayNode chains = root.putArray("chains");

        for (StoredChain stored : graph.chains()) {
            List<GlyphNode> chainNodes = stored.ast().nodes();
            ArrayNode chainNodeNames = MAPPER.createArrayNode();

            for (GlyphNode node : chainNodes) {
                chainNodeNames.add(node.qualifiedName());
                if (!seen.add(node.qualifiedName())) continue;
                ObjectNode n = nodes.addObject();
                n.put("id", node.qualifiedName());
                n.put("kind", node.kind());
                n.put("name", node.name());
                ArrayNode modifiers = n.putArray("modifiers");
                node.modifiers().stream().sorted().forEach(modifiers::add);
                ArrayNode args = n.putArray("args");
                node.args().forEach(args::add);
                KindDefinition kind = legend.kind(node.kind());
                n.put("layer", kind != null ? kind.layer() : "unknown");
            }

            for (Edge edge : stored.ast().edges()) {
                if (!inRange(edge, chainNodes.size())) continue;
                ObjectNode e = edges.addObject();
                e.put("source", chainNodes.get(edge.source()).qualifiedName());
                e.put("target", chainNodes.get(edge.target()).qualifiedName());
                e.put("operator", edge.operator());
                e.put("type", legend.edgeClass(edge.operator()));
            }

            ObjectNode c = chains.addObject();
            c.put("id", stored.id());
            c.put("raw", stored.ast().raw());
            c.put("version", stored.version());
            c.put("framework", stored.ast().framework());
            c.put("deprecated", stored.deprecated());
            c.put("section", stored.section());
            c.put("line", stored.lineNumber());
            c.set("nodes", chainNodeNames);
        }
        return root;
    }

    public String toJsonString(KnowledgeGraph graph) {
        try {
            return MAPPER.writeValueAsString(toJson(graph));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────────

    private static Map<String, GlyphNode> collectNodes(KnowledgeGraph graph) {
        Map<String, GlyphNode> nodes = new TreeMap<>();
        for (StoredChain stored : graph.chains()) {
            for (GlyphNode node : stored.ast().nodes()) {
                nodes.put(node.qualifiedName(), node);
            }
        }
        return nodes;
    }

    private static List<QualifiedEdge> collectEdges(KnowledgeGraph graph) {
        Set<QualifiedEdge> edges = new LinkedHashSet<>();
        for (StoredChain stored : graph.chains()) {
            List<GlyphNode> nodes = stored.ast().nodes();
            for (Edge edge : stored.ast().edges()) {
                if (!inRange(edge, nodes.size())) continue;
                edges.add(new QualifiedEdge(
                        nodes.get(edge.source()).qualifiedName(),
                        nodes.get(edge.target()).qualifiedName(),
                        edge.operator()));
            }
        }
        return List.copyOf(edges);
    }

    private EdgeStyle styleOf(String operator) {
        return STYLE_BY_CLASS.getOrDefault(legend.edgeClass(operator), DEFAULT_STYLE);
    }

    private static boolean inRange(Edge edge, int size) {
        return edge.source() >= 0 && edge.source() < size && edge.target() >= 0 && edge.target() < size;
    }

    private static String escape(String s) {
        return s.replace("\"", "\\\"");
    }
}
