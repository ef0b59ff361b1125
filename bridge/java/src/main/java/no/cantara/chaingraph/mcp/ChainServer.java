package no.cantara.chaingraph.mcp;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import no.cantara.chaingraph.export.GraphExporter;
import no.cantara.chaingraph.graph.KnowledgeGraph;
import no.cantara.chaingraph.graph.StoredChain;
import no.cantara.chaingraph.validation.ChainValidator;
import no.cantara.chaingraph.validation.GraphValidator;
import no.cantara.chaingraph.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds and returns a configured MCP server for a chain document.
 */
public final class ChainServer {

    private static final Logger log = LoggerFactory.getLogger(ChainServer.class);

    static final String SERVER_VERSION = "0.1.0";

    private ChainServer() {}

    // ── Internal helpers (package-private for tests) ──────────────────────────────

    /**
     * The loaded graph, its validation, and the resource list with per-URI read handlers.
     * Package-private so tests can invoke handlers directly without a transport.
     */
    record ResourceSet(
        String slug,
        KnowledgeGraph graph,
        ValidationResult validation,
        List<McpSchema.Resource> resources,
        Map<String, ResourceHandler> handlers
    ) {}

    @FunctionalInterface
    interface ResourceHandler {
        McpSchema.ReadResourceResult handle(String uri);
    }

    /**
     * Loads the document and builds all resources and their read handlers.
     * Bodies are rendered once, so every read returns the graph as it was at startup.
     *
     * @throws NoSuchFileException if the document does not exist
     */
    static ResourceSet buildResources(Path document, boolean includeDeprecated) throws IOException {
        if (!Files.exists(document)) {
            throw new NoSuchFileException(document.toString());
        }
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.load(document);

        ValidationResult validation = new GraphValidator(graph.legend()).validate(graph);
        ChainValidator chainValidator = new ChainValidator(graph.legend());
        GraphExporter exporter = new GraphExporter(graph.legend());
        String slug = ChainMapper.documentSlug(document);

        List<McpSchema.Resource>     resources = new ArrayList<>();
        Map<String, ResourceHandler> handlers  = new LinkedHashMap<>();

        // ── graph-level resources ─────────────────────────────────────────────────
        add(resources, handlers, ChainMapper.buildManifestResource(slug),
            ChainMapper.buildManifestJson(graph, slug, validation, includeDeprecated));
        add(resources, handlers, ChainMapper.buildValidationResource(slug, validation),
            ChainMapper.buildValidationJson(validation));
        add(resources, handlers, ChainMapper.buildDotResource(slug), exporter.toDot(graph));
        add(resources, handlers, ChainMapper.buildMermaidResource(slug), exporter.toMermaid(graph));

        // ── chain resources ───────────────────────────────────────────────────────
        for (StoredChain chain : graph.chains()) {
            if (chain.deprecated() && !includeDeprecated) continue;
            add(resources, handlers, ChainMapper.buildChainResource(slug, chain),
                ChainMapper.buildChainJson(slug, chain, chainValidator.validate(chain.ast())));
        }

        log.debug("Built {} resource(s) for {}", resources.size(), document);
        return new ResourceSet(slug, graph, validation, resources, handlers);
    }

    private static void add(List<McpSchema.Resource> resources, Map<String, ResourceHandler> handlers,
                            McpSchema.Resource resource, String body) {
        resources.add(resource);
        String mime = resource.mimeType();
        handlers.put(resource.uri(), uri ->
            new McpSchema.ReadResourceResult(
                List.of(new McpSchema.TextResourceContents(uri, mime, body))
            )
        );
    }

    // ── Public factory ────────────────────────────────────────────────────────────

    /**
     * Loads the chain document at {@code document} and returns a configured
     * MCP sync server ready to accept connections.
     *
     * @param document          path to the chain document
     * @param transport         MCP transport provider (e.g. StdioServerTransportProvider)
     * @param includeDeprecated if true, expose deprecated chains as well
     * @param warnOnValidation  if true, print validation findings to stderr
     */
    public static McpSyncServer createServer(
            Path document,
            McpServerTransportProvider transport,
            boolean includeDeprecated,
            boolean warnOnValidation) throws IOException {

        ResourceSet rs = buildResources(document, includeDeprecated);

        if (warnOnValidation) {
            rs.validation().errors().forEach(e -> System.err.println("[chain-mcp] error: " + e));
            rs.validation().warnings().forEach(w -> System.err.println("[chain-mcp] warning: " + w));
        }

        String deprecatedNote = includeDeprecated ? " (including deprecated)" : "";
        System.err.printf("[chain-mcp] Serving '%s': %d chain(s) in %d section(s)%s%n",
            rs.slug(), rs.graph().size(), rs.graph().sections().size(), deprecatedNote);
        System.err.printf("[chain-mcp] Start with: %s%n", ChainMapper.manifestUri(rs.slug()));

        McpSyncServer server = McpServer.sync(transport)
            .serverInfo("chain-" + rs.slug(), SERVER_VERSION)
            .capabilities(McpSchema.ServerCapabilities.builder()
                .resources(false, false)
                .build())
            .build();

        for (McpSchema.Resource resource : rs.resources()) {
            ResourceHandler handler = rs.handlers().get(resource.uri());
            server.addResource(new McpServerFeatures.SyncResourceSpecification(
                resource,
                (exchange, request) -> handler.handle(request.uri())
            ));
        }

        return server;
    }
}
