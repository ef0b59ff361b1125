package no.cantara.chaingraph.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema;
import no.cantara.chaingraph.graph.KnowledgeGraph;
import no.cantara.chaingraph.graph.StoredChain;
import no.cantara.chaingraph.model.ChainAST;
import no.cantara.chaingraph.model.Edge;
import no.cantara.chaingraph.model.GlyphNode;
import no.cantara.chaingraph.validation.ValidationIssue;
import no.cantara.chaingraph.validation.ValidationResult;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Pure mapping functions: chain graph → MCP schema types and JSON bodies.
 * No I/O.
 */
public final class ChainMapper {

    private ChainMapper() {}

    public static final String JSON_MIME = "application/json";
    public static final String DOT_MIME = "text/vnd.graphviz";
    public static final String MERMAID_MIME = "text/vnd.mermaid";

    static final double MANIFEST_PRIORITY = 1.0;
    static final double VALIDATION_PRIORITY = 0.9;
    static final double CHAIN_PRIORITY = 0.7;
    static final double RENDERING_PRIORITY = 0.5;
    static final double DEPRECATED_PRIORITY = 0.2;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final List<McpSchema.Role> BOTH = List.of(McpSchema.Role.ASSISTANT, McpSchema.Role.USER);

    // ── Slug ──────────────────────────────────────────────────────────────────────

    public static String slug(String name) {
        String s = name.toLowerCase();
        s = s.replaceAll("\\s+", "-");
        s = s.replaceAll("[^a-z0-9\\-]", "");
        return s.isEmpty() ? "graph" : s;
    }

    /** Slug of a document's file name without its extension. */
    public static String documentSlug(Path document) {
        String name = document.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return slug(dot > 0 ? name.substring(0, dot) : name);
    }

    // ── URIs ──────────────────────────────────────────────────────────────────────

    public static String manifestUri(String slug) {
        return "chain://" + slug + "/manifest";
    }

    public static String validationUri(String slug) {
        return "chain://" + slug + "/validation";
    }

    public static String dotUri(String slug) {
        return "chain://" + slug + "/graph.dot";
    }

    public static String mermaidUri(String slug) {
        return "chain://" + slug + "/graph.mmd";
    }

    public static String chainUri(String slug, long chainId) {
        return "chain://" + slug + "/chains/" + chainId;
    }

    // ── Resource building ─────────────────────────────────────────────────────────

    public static McpSchema.Resource buildManifestResource(String slug) {
        return new McpSchema.Resource(
            manifestUri(slug),
            "manifest",
            "Chain index: sections, chains and validation summary for this graph",
            JSON_MIME,
            new McpSchema.Annotations(BOTH, MANIFEST_PRIORITY)
        );
    }

    public static McpSchema.Resource buildValidationResource(String slug, ValidationResult result) {
        String summary = result.isValid() ? "Graph is valid" : "Graph has " + result.errors().size() + " error(s)";
        if (result.hasWarnings()) {
            summary += ", " + result.warnings().size() + " warning(s)";
        }
        return new McpSchema.Resource(
            validationUri(slug),
            "validation",
            summary,
            JSON_MIME,
            new McpSchema.Annotations(BOTH, VALIDATION_PRIORITY)
        );
    }

    public static McpSchema.Resource buildDotResource(String slug) {
        return new McpSchema.Resource(
            dotUri(slug),
            "graph.dot",
            "Whole graph as Graphviz DOT",
            DOT_MIME,
            new McpSchema.Annotations(List.of(McpSchema.Role.USER), RENDERING_PRIORITY)
        );
    }

    public static McpSchema.Resource buildMermaidResource(String slug) {
        return new McpSchema.Resource(
            mermaidUri(slug),
            "graph.mmd",
            "Whole graph as a Mermaid flowchart",
            MERMAID_MIME,
            new McpSchema.Annotations(List.of(McpSchema.Role.USER), RENDERING_PRIORITY)
        );
    }

    public static String chainName(StoredChain chain) {
        return chain.version() != null ? chain.rootGlyph() + "@" + chain.version() : chain.rootGlyph();
    }

    public static String buildDescription(StoredChain chain) {
        StringBuilder sb = new StringBuilder(chain.ast().raw());
        if (chain.section() != null) {
            sb.append("\nSection: ").append(chain.section());
        }
        if (chain.deprecated()) {
            sb.append("\nDeprecated");
        }
        return sb.toString();
    }

    public static McpSchema.Resource buildChainResource(String slug, StoredChain chain) {
        return new McpSchema.Resource(
            chainUri(slug, chain.id()),
            chainName(chain),
            buildDescription(chain),
            JSON_MIME,
            new McpSchema.Annotations(List.of(McpSchema.Role.ASSISTANT),
                chain.deprecated() ? DEPRECATED_PRIORITY : CHAIN_PRIORITY)
        );
    }

    // ── JSON bodies ───────────────────────────────────────────────────────────────

    public static String buildManifestJson(KnowledgeGraph graph, String slug, ValidationResult result,
                                           boolean includeDeprecated) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("graph", slug);
        root.put("chain_count", graph.size());
        root.put("glyph_count", graph.getAllGlyphs().size());
        ArrayNode sections = root.putArray("sections");
        graph.sections().forEach(sections::add);
        root.put("valid", result.isValid());
        root.put("error_count", result.errors().size());
        root.put("warning_count", result.warnings().size());

        ObjectNode resources = root.putObject("resources");
        resources.put("validation", validationUri(slug));
        resources.put("dot", dotUri(slug));
        resources.put("mermaid", mermaidUri(slug));

        ArrayNode chains = root.putArray("chains");
        for (StoredChain chain : graph.chains()) {
            if (chain.deprecated() && !includeDeprecated) continue;
            ObjectNode c = chains.addObject();
            c.put("id", chain.id());
            c.put("uri", chainUri(slug, chain.id()));
            c.put("root", chain.rootGlyph());
            c.put("version", chain.version());
            c.put("section", chain.section());
            c.put("deprecated", chain.deprecated());
            c.put("raw", chain.ast().raw());
        }
        return write(root);
    }

    public static String buildValidationJson(ValidationResult result) {
        return write(validationNode(result));
    }

    public static String buildChainJson(String slug, StoredChain chain, ValidationResult result) {
        ChainAST ast = chain.ast();
        List<GlyphNode> nodes = ast.nodes();

        ObjectNode root = MAPPER.createObjectNode();
        root.put("id", chain.id());
        root.put("uri", chainUri(slug, chain.id()));
        root.put("raw", ast.raw());
        root.put("root", chain.rootGlyph());
        root.put("version", chain.version());
        root.put("framework", ast.framework());
        root.put("deprecated", chain.deprecated());
        root.put("section", chain.section());
        root.put("line", chain.lineNumber());

        ArrayNode glyphs = root.putArray("nodes");
        nodes.forEach(n -> glyphs.add(n.qualifiedName()));

        ArrayNode edges = root.putArray("edges");
        for (Edge edge : ast.edges()) {
            ObjectNode e = edges.addObject();
            e.put("source", nodes.get(edge.source()).qualifiedName());
            e.put("target", nodes.get(edge.target()).qualifiedName());
            e.put("operator", edge.operator());
        }

        root.set("validation", validationNode(result));
        return write(root);
    }

    // ── helpers ───────────────────────────────────────────────────────────────────

    private static JsonNode validationNode(ValidationResult result) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("valid", result.isValid());
        ArrayNode errors = node.putArray("errors");
        result.errors().forEach(i -> errors.add(issueNode(i)));
        ArrayNode warnings = node.putArray("warnings");
        result.warnings().forEach(i -> warnings.add(issueNode(i)));
        return node;
    }

    private static ObjectNode issueNode(ValidationIssue issue) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("code", issue.code().name());
        node.put("message", issue.message());
        node.put("node", issue.node());
        return node;
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
