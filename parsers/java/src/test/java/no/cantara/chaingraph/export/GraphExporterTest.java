package no.cantara.chaingraph.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import no.cantara.chaingraph.graph.KnowledgeGraph;
import no.cantara.chaingraph.legend.GlyphLegend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GraphExporterTest {

    private final GraphExporter exporter = new GraphExporter(GlyphLegend.defaults());
    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        graph = new KnowledgeGraph();
        graph.addChain("CMP:Form[stateful] => STO:Auth ~> CMP:Form[stateful]", "Auth");
        graph.addChain("V:Page @ CMP:Form[stateful]");
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) count++;
        return count;
    }

    // ── DOT ───────────────────────────────────────────────────────────────────────

    @Test
    void dotHasOneNodePerQualifiedName() {
        String dot = exporter.toDot(graph);
        assertTrue(dot.startsWith("digraph ChainGraph {"));
        assertTrue(dot.trim().endsWith("}"));
        assertEquals(1, occurrences(dot, "\"CMP:Form\" [label="));
        assertEquals(1, occurrences(dot, "\"STO:Auth\" [label="));
        assertEquals(1, occurrences(dot, "\"V:Page\" [label="));
    }

    @Test
    void dotUsesLegendColoursAndShapes() {
        String dot = exporter.toDot(graph);
        assertTrue(dot.contains("\"STO:Auth\" [label=\"STO:Auth\", shape=\"cylinder\", style=\"filled\", fillcolor=\"#4caf50\""));
        assertTrue(dot.contains("label=\"CMP:Form\\n[stateful]\""));
    }

    @Test
    void dotStylesEdgesByClass() {
        String dot = exporter.toDot(graph);
        assertTrue(dot.contains("\"CMP:Form\" -> \"STO:Auth\" [style=\"solid\", color=\"#333333\"];"));
        assertTrue(dot.contains("\"STO:Auth\" -> \"CMP:Form\" [style=\"dashed\", color=\"#4caf50\", label=\"reactive\"];"));
        assertTrue(dot.contains("\"V:Page\" -> \"CMP:Form\" [style=\"dashed\", color=\"#5c6bc0\", label=\"contains\", arrowhead=\"none\"];"));
    }

    @Test
    void dotForEmptyGraph() {
        String dot = exporter.toDot(new KnowledgeGraph());
        assertFalse(dot.contains("->"));
        assertTrue(dot.contains("digraph ChainGraph {"));
    }

    // ── Mermaid ───────────────────────────────────────────────────────────────────

    @Test
    void mermaidNodesEdgesAndStyles() {
        String mermaid = exporter.toMermaid(graph);
        assertTrue(mermaid.startsWith("graph LR\n"));
        assertTrue(mermaid.contains("    CMP_Form[\"CMP:Form\"]"));
        assertTrue(mermaid.contains("    CMP_Form --> STO_Auth"));
        assertTrue(mermaid.contains("    STO_Auth -.-> CMP_Form"));
        assertTrue(mermaid.contains("    V_Page --o CMP_Form"));
        assertTrue(mermaid.contains("    style CMP_Form fill:#00bcd4,color:white"));
    }

    @Test
    void mermaidIdsAreSafe() {
        assertEquals("API_POST__auth_login", GraphExporter.mermaidId("API:POST./auth/login"));
    }

    // ── JSON ──────────────────────────────────────────────────────────────────────

    @Test
    void jsonMetadata() {
        ObjectNode json = exporter.toJson(graph);
        JsonNode metadata = json.get("metadata");
        assertEquals(GraphExporter.JSON_FORMAT, metadata.get("format").asText());
        assertEquals(2, metadata.get("stats").get("total_chains").asInt());
        assertEquals(3, metadata.get("stats").get("total_glyphs").asInt());
        assertEquals("Auth", metadata.get("stats").get("sections").get(0).asText());
    }

    @Test
    void jsonNodesAndEdges() {
        ObjectNode json = exporter.toJson(graph);

        assertEquals(3, json.get("nodes").size());
        JsonNode form = json.get("nodes").get(0);
        assertEquals("CMP:Form", form.get("id").asText());
        assertEquals("CMP", form.get("kind").asText());
        assertEquals("frontend", form.get("layer").asText());
        assertEquals("stateful", form.get("modifiers").get(0).asText());

        assertEquals(3, json.get("edges").size());
        JsonNode reactive = json.get("edges").get(1);
        assertEquals("STO:Auth", reactive.get("source").asText());
        assertEquals("~>", reactive.get("operator").asText());
        assertEquals("reactive", reactive.get("type").asText());
    }

    @Test
    void jsonChains() {
        JsonNode chains = exporter.toJson(graph).get("chains");
        assertEquals(2, chains.size());
        assertEquals("Auth", chains.get(0).get("section").asText());
        assertTrue(chains.get(1).get("section").isNull());
        assertEquals("V:Page @ CMP:Form[stateful]", chains.get(1).get("raw").asText());
        assertEquals(2, chains.get(1).get("nodes").size());
    }

    @Test
    void jsonStringParses() throws IOException {
        JsonNode parsed = new ObjectMapper().readTree(exporter.toJsonString(graph));
        assertEquals("chain-graph", parsed.get("metadata").get("format").asText());
        assertEquals(3, parsed.get("nodes").size());
        assertEquals(1L, parsed.get("chains").get(0).get("id").asLong());
    }

    @Test
    void writesSelectedFormat(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("graph.mmd");
        exporter.write(graph, GraphExporter.Format.MERMAID, out);
        assertEquals(exporter.toMermaid(graph), Files.readString(out));
    }
}
