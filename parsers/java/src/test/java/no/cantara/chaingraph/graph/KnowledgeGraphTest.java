package no.cantara.chaingraph.graph;

import no.cantara.chaingraph.ChainParseException;
import no.cantara.chaingraph.model.GlyphNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeGraphTest {

    private static final String DOCUMENT = """
            # Knowledge graph

            CMP:Loose => OUT:x

            ## Auth
            @v1 NED:login => CMP:LoginForm => OUT:done
            API:POST/auth/login -> ERR:auth.invalid

            ## Layout
            V:Page @ CMP:Header, CMP:Footer
            """;

    // ── Loading ───────────────────────────────────────────────────────────────────

    @Test
    void loadDocumentTracksSections() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.loadDocument(DOCUMENT);

        assertEquals(4, graph.size());
        assertEquals(List.of("Auth", "Layout"), graph.sections());
        assertEquals(2, graph.findChainsBySection("Auth").size());
        assertEquals("V:Page", graph.findChainsBySection("Layout").get(0).rootGlyph());
        assertNull(graph.chains().get(0).section());
        assertTrue(graph.findChainsBySection("Nope").isEmpty());
    }

    @Test
    void loadDocumentRecordsLineNumbers() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.loadDocument(DOCUMENT);
        assertEquals(3, graph.chains().get(0).lineNumber());
        assertEquals(6, graph.chains().get(1).lineNumber());
    }

    @Test
    void loadDocumentSkipsMalformedLines() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.loadDocument("""
                CMP:a => => OUT:b
                CMP:ok => OUT:fine
                lowercase garbage
                """);
        assertEquals(1, graph.size());
        assertEquals("CMP:ok", graph.chains().get(0).rootGlyph());
    }

    @Test
    void loadDocumentReplacesPreviousContents() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("CMP:Old => OUT:x");
        graph.loadDocument("CMP:New => OUT:y");
        assertEquals(1, graph.size());
        assertTrue(graph.findChainsByGlyph("CMP:Old").isEmpty());
    }

    @Test
    void missingFileStartsEmpty(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("graph.chain");
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.load(file);

        assertEquals(0, graph.size());
        assertEquals(file, graph.path());

        graph.addChain("NED:x => OUT:y");
        graph.save();
        assertTrue(Files.readString(file).contains("NED:x => OUT:y"));
    }

    // ── Saving ────────────────────────────────────────────────────────────────────

    @Test
    void saveAfterLoadKeepsEveryStatement(@TempDir Path dir) throws IOException {
        Path source = dir.resolve("in.chain");
        Files.writeString(source, DOCUMENT);
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.load(source);

        Path target = dir.resolve("nested/out.chain");
        graph.save(target);

        List<String> written = Files.readAllLines(target);
        for (String line : DOCUMENT.split("\n")) {
            if (line.isBlank() || line.startsWith("#")) continue;
            assertTrue(written.contains(line), "missing: " + line);
        }

        KnowledgeGraph reloaded = new KnowledgeGraph();
        reloaded.load(target);
        assertEquals(graph.size(), reloaded.size());
        assertEquals(List.of("Auth", "Layout", KnowledgeGraph.UNSORTED_SECTION), reloaded.sections());
    }

    @Test
    void renderPutsUnsectionedChainsLast() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("CMP:A => OUT:a");
        graph.addChain("CMP:B => OUT:b", "Main");

        String text = graph.render();
        assertTrue(text.startsWith("# Knowledge graph\n"));
        assertTrue(text.indexOf("## Main") < text.indexOf("## Unsorted"));
        assertTrue(text.indexOf("CMP:B => OUT:b") < text.indexOf("CMP:A => OUT:a"));
    }

    @Test
    void unsectionedChainsJoinAnExistingUnsortedSection() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("CMP:A => OUT:a");
        graph.addChain("CMP:B => OUT:b", KnowledgeGraph.UNSORTED_SECTION);
        graph.addChain("CMP:C => OUT:c", "Main");

        String text = graph.render();
        assertEquals(text.indexOf("## Unsorted"), text.lastIndexOf("## Unsorted"));
        assertTrue(text.indexOf("CMP:A => OUT:a") < text.indexOf("## Main"));

        KnowledgeGraph reloaded = new KnowledgeGraph();
        reloaded.loadDocument(text);
        assertEquals(3, reloaded.size());
        assertEquals(List.of(KnowledgeGraph.UNSORTED_SECTION, "Main"), reloaded.sections());
    }

    @Test
    void saveWithoutPathFails() {
        assertThrows(IllegalStateException.class, () -> new KnowledgeGraph().save());
    }

    // ── Adding and versioning ─────────────────────────────────────────────────────

    @Test
    void autoAssignsNextVersion() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("@v1 NED:x => OUT:y");

        StoredChain second = graph.addChain("NED:x => OUT:z");
        assertEquals("v2", second.version());
        assertEquals("@v2 NED:x => OUT:z", second.ast().raw());
    }

    @Test
    void duplicateExplicitVersionFailsAndLeavesGraphUnchanged() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("@v1 NED:x => OUT:y");
        graph.addChain("NED:x => OUT:z");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> graph.addChain("@v1 NED:x => OUT:w"));
        assertTrue(e.getMessage().contains("v1"));
        assertEquals(2, graph.size());
        assertTrue(graph.findChainsByGlyph("OUT:w").isEmpty());
    }

    @Test
    void sameVersionOnDifferentRootsIsFine() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("@v1 NED:x => OUT:y");
        graph.addChain("@v1 NED:other => OUT:y");
        assertEquals(2, graph.size());
    }

    @Test
    void firstChainForRootStaysUnversioned() {
        StoredChain stored = new KnowledgeGraph().addChain("NED:x => OUT:y");
        assertNull(stored.version());
        assertEquals("NED:x => OUT:y", stored.ast().raw());
    }

    @Test
    void emptyStatementIsRejected() {
        KnowledgeGraph graph = new KnowledgeGraph();
        assertThrows(IllegalArgumentException.class, () -> graph.addChain("# comment"));
        assertThrows(IllegalArgumentException.class, () -> graph.addChain(""));
        assertEquals(0, graph.size());
    }

    @Test
    void malformedStatementPropagatesParseException() {
        assertThrows(ChainParseException.class, () -> new KnowledgeGraph().addChain("CMP:a =>"));
    }

    @Test
    void blankSectionMeansNoSection() {
        KnowledgeGraph graph = new KnowledgeGraph();
        assertNull(graph.addChain("CMP:A => OUT:a", "  ").section());
        assertEquals("Main", graph.addChain("CMP:B => OUT:b", " Main ").section());
    }

    // ── Removal and deprecation ───────────────────────────────────────────────────

    @Test
    void removeChainDropsItFromIndices() {
        KnowledgeGraph graph = new KnowledgeGraph();
        StoredChain first = graph.addChain("@v1 NED:x => OUT:y", "S");
        StoredChain second = graph.addChain("@v2 NED:x => OUT:z", "S");

        assertTrue(graph.removeChain("v1", "NED:x"));

        assertEquals(1, graph.size());
        assertTrue(graph.findById(first.id()).isEmpty());
        assertEquals(second, graph.findById(second.id()).orElseThrow());
        assertEquals(List.of(second), graph.findChainsBySection("S"));
        assertFalse(graph.getAllGlyphs().contains("OUT:y"));
        assertEquals(List.of(second), graph.findChainsByGlyph("NED:x"));
    }

    @Test
    void removeRequiresExactMatch() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("NED:x => OUT:y");
        assertFalse(graph.removeChain("v1", "NED:x"));
        assertFalse(graph.removeChain(null, "NED:other"));
        assertTrue(graph.removeChain(null, "NED:x"));
    }

    @Test
    void idsAreNeverReused() {
        KnowledgeGraph graph = new KnowledgeGraph();
        StoredChain a = graph.addChain("CMP:A => OUT:a");
        graph.removeChain(null, "CMP:A");
        StoredChain b = graph.addChain("CMP:A => OUT:a");
        assertNotEquals(a.id(), b.id());
    }

    @Test
    void deprecateChainMarksRawText() {
        KnowledgeGraph graph = new KnowledgeGraph();
        StoredChain stored = graph.addChain("@v2 NED:x => OUT:z");

        assertTrue(graph.deprecateChain("v2", "NED:x"));

        StoredChain updated = graph.findById(stored.id()).orElseThrow();
        assertTrue(updated.deprecated());
        assertEquals("@v2 [deprecated] NED:x => OUT:z", updated.ast().raw());
        assertEquals(1, graph.stats().deprecated());
        assertFalse(graph.deprecateChain("v9", "NED:x"));
    }

    @Test
    void deprecatedRawTextParsesBackAsDeprecated() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("@v1 NED:x => OUT:z");
        graph.deprecateChain("v1", "NED:x");

        KnowledgeGraph reloaded = new KnowledgeGraph();
        reloaded.loadDocument(graph.render());
        assertTrue(reloaded.chains().get(0).deprecated());
    }

    @Test
    void unversionedChainCannotBeDeprecated() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("NED:x => OUT:z");

        assertThrows(IllegalArgumentException.class, () -> graph.deprecateChain(null, "NED:x"));
        assertFalse(graph.chains().get(0).deprecated());
    }

    // ── Version queries ───────────────────────────────────────────────────────────

    @Test
    void chainsByVersion() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("NED:x => OUT:a");
        graph.addChain("NED:x => OUT:b");
        assertEquals(Set.of(KnowledgeGraph.UNVERSIONED, "v1"), graph.getChainsByVersion("NED:x").keySet());
    }

    @Test
    void latestPrefersHighestNumericVersion() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("@v1 NED:x => OUT:a");
        graph.addChain("@v10 NED:x => OUT:c");
        graph.addChain("@v2 NED:x => OUT:b");

        assertEquals("v10", graph.getLatestChain("NED:x").orElseThrow().version());
    }

    @Test
    void autoVersionGoesPastIntRange() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("@v2147483647 NED:x => OUT:y");
        StoredChain next = graph.addChain("NED:x => OUT:z");

        assertEquals("v2147483648", next.version());
        assertEquals("@v2147483648 NED:x => OUT:z", next.ast().raw());

        KnowledgeGraph reloaded = new KnowledgeGraph();
        reloaded.loadDocument(graph.render());
        assertEquals(2, reloaded.size());
    }

    @Test
    void latestHandlesVersionsBeyondLongRange() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.loadDocument("""
                @v99999999999 NED:x => OUT:a
                @v99999999999999999999 NED:x => OUT:b
                @v3 NED:x => OUT:c
                """);
        assertEquals("v99999999999999999999", graph.getLatestChain("NED:x").orElseThrow().version());
    }

    @Test
    void latestTagWins() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("@v5 NED:x => OUT:a");
        graph.addChain("@latest NED:x => OUT:b");
        assertEquals("latest", graph.getLatestChain("NED:x").orElseThrow().version());
    }

    @Test
    void latestFallsBackToAnyChain() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("NED:x => OUT:a");
        assertTrue(graph.getLatestChain("NED:x").isPresent());
        assertTrue(graph.getLatestChain("NED:none").isEmpty());
    }

    // ── Glyph queries ─────────────────────────────────────────────────────────────

    @Test
    void findChainsByGlyphMatchesAnyPosition() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("CMP:A => STO:B => OUT:c");
        graph.addChain("CMP:X => STO:B");
        graph.addChain("CMP:Y => OUT:d");
        assertEquals(2, graph.findChainsByGlyph("STO:B").size());
    }

    @Test
    void dependenciesAndDependentsAreDistinct() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("CMP:A => STO:B => OUT:c");
        graph.addChain("CMP:X => STO:B");
        graph.addChain("@v1 CMP:A => STO:B => OUT:c");

        assertEquals(List.of("CMP:A", "CMP:X"),
                graph.findDependencies("STO:B").stream().map(GlyphNode::qualifiedName).toList());
        assertEquals(List.of("OUT:c"),
                graph.findDependents("STO:B").stream().map(GlyphNode::qualifiedName).toList());
        assertTrue(graph.findDependencies("CMP:unknown").isEmpty());
    }

    @Test
    void allGlyphsUseQualifiedNames() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("API:GET/users => FNC:user.list => OUT:list");
        assertEquals(Set.of("API:GET./users", "FNC:user.list", "OUT:list"), graph.getAllGlyphs());
    }

    @Test
    void stats() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.loadDocument(DOCUMENT);
        GraphStats stats = graph.stats();
        assertEquals(4, stats.totalChains());
        assertEquals(10, stats.totalGlyphs());
        assertEquals(List.of("Auth", "Layout"), stats.sections());
        assertEquals(0, stats.deprecated());
    }

    // ── Resolutions ───────────────────────────────────────────────────────────────

    @Test
    void unresolvedGlyphsExcludeMetaAndStructuralKinds() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("NED:x => CMP:Form => API:GET/users => OUT:done");
        graph.addChain("V:Page @ CMP:Form");

        assertEquals(List.of("API:GET./users", "CMP:Form"), List.copyOf(graph.getUnresolvedGlyphs()));
    }

    @Test
    void markResolvedRemovesFromUnresolved() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("NED:x => CMP:Form => API:GET/users => OUT:done");

        graph.markResolved("CMP:Form", "src/Form.tsx", "test/Form.test.tsx");

        assertTrue(graph.isResolved("CMP:Form"));
        assertEquals(Set.of("API:GET./users"), graph.getUnresolvedGlyphs());
        Resolution resolution = graph.getResolution("CMP:Form").orElseThrow();
        assertEquals("src/Form.tsx", resolution.filePath());
        assertEquals("test/Form.test.tsx", resolution.testPath());
        assertNotNull(resolution.generatedAt());

        graph.clearResolution("CMP:Form");
        assertFalse(graph.isResolved("CMP:Form"));
        assertTrue(graph.resolutions().isEmpty());
    }

    @Test
    void resolutionsSurviveReload() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("CMP:Form => OUT:done");
        graph.markResolved("CMP:Form", "src/Form.tsx");
        graph.loadDocument("CMP:Form => OUT:done");
        assertTrue(graph.isResolved("CMP:Form"));
        assertNull(graph.getResolution("CMP:Form").orElseThrow().testPath());
    }

    // ── Similarity ────────────────────────────────────────────────────────────────

    @Test
    void identicalProposalScoresOne() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("CMP:A => OUT:b");
        List<SimilarChain> similar = graph.findSimilarChains("CMP:A => OUT:b", 0.5);
        assertEquals(1, similar.size());
        assertEquals(1.0, similar.get(0).score(), 1e-9);
        assertEquals(List.of("CMP:A", "OUT:b"), similar.get(0).sharedGlyphs());
    }

    @Test
    void similarityNormalizesCase() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("NED:login => CMP:LoginForm => OUT:done");

        List<SimilarChain> similar = graph.findSimilarChains("NED:login => CMP:loginform", 0.0);
        assertEquals(1, similar.size());
        assertEquals(0.5, similar.get(0).score(), 1e-9);
        assertEquals(List.of("NED:login"), similar.get(0).sharedGlyphs());
    }

    @Test
    void similarityIsSortedAndFiltered() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("CMP:A => OUT:unrelated");
        graph.addChain("CMP:A => STO:B => OUT:c");
        graph.addChain("NED:z => OUT:zz");

        List<SimilarChain> similar = graph.findSimilarChains("CMP:A => STO:B", 0.2);
        assertEquals(2, similar.size());
        assertTrue(similar.get(0).score() >= similar.get(1).score());
        assertEquals("@v1 CMP:A => STO:B => OUT:c", similar.get(0).chain().ast().raw());
    }

    @Test
    void similarityAcceptsLooseGlyphLists() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("CMP:A => STO:B => OUT:c");
        List<SimilarChain> similar = graph.findSimilarChains("CMP:A, STO:B", 0.1);
        assertEquals(1, similar.size());
        assertEquals(List.of("CMP:A", "STO:B"), similar.get(0).sharedGlyphs());
    }

    @Test
    void similaritySkipsDeprecatedChains() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addChain("@v1 CMP:A => OUT:b");
        graph.deprecateChain("v1", "CMP:A");
        assertTrue(graph.findSimilarChains("CMP:A => OUT:b", 0.0).isEmpty());
    }

    @Test
    void kindOfQualifiedName() {
        assertEquals("CMP", KnowledgeGraph.kindOf("CMP:Form"));
        assertEquals("plain", KnowledgeGraph.kindOf("plain"));
    }
}
