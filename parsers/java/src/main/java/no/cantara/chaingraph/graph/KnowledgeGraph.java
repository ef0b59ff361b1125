package no.cantara.chaingraph.graph;

import no.cantara.chaingraph.ChainParseException;
import no.cantara.chaingraph.ChainParser;
import no.cantara.chaingraph.legend.GlyphLegend;
import no.cantara.chaingraph.model.ChainAST;
import no.cantara.chaingraph.model.Edge;
import no.cantara.chaingraph.model.GlyphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory store of parsed chains, indexed by section and by qualified glyph name.
 *
 * <p>Every stored chain gets a stable id at insertion. Both indices hold ids rather than list
 * positions, so removing a chain only drops that id.
 *
 * <p>Not thread-safe. Callers that share a graph between threads must serialize access to the
 * whole instance.
 */
public class KnowledgeGraph {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraph.class);

    public static final String UNSORTED_SECTION = "Unsorted";
    public static final String UNVERSIONED = "unversioned";
    public static final String LATEST = "latest";

    private static final String SECTION_PREFIX = "## ";
    private static final Pattern NUMERIC_VERSION = Pattern.compile("v(\\d+)");
    private static final Pattern PROPOSAL_SEPARATOR = Pattern.compile("\\s+(?:=>|~>|!>|->|::|@)\\s+|,");

    private final GlyphLegend legend;
    private final ChainParser parser;

    private final Map<Long, StoredChain> chains = new LinkedHashMap<>();
    private final Map<String, Set<Long>> sectionIndex = new LinkedHashMap<>();
    private final Map<String, Set<Long>> glyphIndex = new LinkedHashMap<>();
    private final Map<String, Resolution> resolutions = new LinkedHashMap<>();

    private long nextId = 1;
    private Path path;

    public KnowledgeGraph() {
        this(GlyphLegend.defaults());
    }

    public KnowledgeGraph(GlyphLegend legend) {
        this.legend = Objects.requireNonNull(legend, "legend");
        this.parser = new ChainParser(legend.endpointKind());
    }

    public GlyphLegend legend() {
        return legend;
    }

    public ChainParser parser() {
        return parser;
    }

    // ── Document I/O ──────────────────────────────────────────────────────────────

    /**
     * Replaces the stored chains with the contents of a chain document. A missing file leaves an
     * empty graph so a new document can be bootstrapped.
     */
    public void load(Path path) throws IOException {
        this.path = path;
        if (!Files.exists(path)) {
            clear();
            log.info("Chain document {} does not exist; starting from an empty graph", path);
            return;
        }
        loadDocument(Files.readString(path));
        log.info("Loaded {} chain(s) in {} section(s) from {}", chains.size(), sectionIndex.size(), path);
    }

    /**
     * Replaces the stored chains with the statements of {@code text}. Lines starting with
     * {@code ## } open a section; other {@code #} lines and blank lines are ignored. Lines that fail
     * to parse are skipped. Resolutions are kept.
     */
    public void loadDocument(String text) {
        clear();
        String section = null;
        int lineNumber = 0;
        for (String line : text.split("\\R", -1)) {
            lineNumber++;
            String stripped = line.strip();

            if (stripped.startsWith(SECTION_PREFIX)) {
                section = stripped.substring(SECTION_PREFIX.length()).strip();
                sectionIndex.computeIfAbsent(section, s -> new LinkedHashSet<>());
                continue;
            }
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }

            try {
                ChainAST ast = parser.parse(stripped);
                if (!ast.isEmpty()) {
                    insert(ast, lineNumber, section);
                }
            } catch (ChainParseException e) {
                log.debug("Skipping line {}: {}", lineNumber, e.getMessage());
            }
        }
    }

    /** Writes {@link #render()} to {@code path} and remembers it for {@link #save()}. */
    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, render());
        this.path = path;
        log.info("Saved {} chain(s) to {}", chains.size(), path);
    }

    /** Saves to the path last loaded from or saved to. */
    public void save() throws IOException {
        if (path == null) {
            throw new IllegalStateException("No document path; load or save to a path first");
        }
        save(path);
    }

    /**
     * The document text {@link #save(Path)} writes: statements grouped by section in the order the
     * sections were first seen, followed by unsectioned statements under {@value #UNSORTED_SECTION}.
     * If the document already has a section of that name, unsectioned statements are appended to it
     * so the header appears once.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("# Knowledge graph\n\n");

        List<StoredChain> unsectioned = chains.values().stream()
                .filter(c -> c.section() == null)
                .toList();
        boolean hasUnsortedSection = sectionIndex.containsKey(UNSORTED_SECTION);

        for (Map.Entry<String, Set<Long>> section : sectionIndex.entrySet()) {
            sb.append(SECTION_PREFIX).append(section.getKey()).append('\n');
            for (Long id : section.getValue()) {
                sb.append(chains.get(id).ast().raw()).append('\n');
            }
            if (section.getKey().equals(UNSORTED_SECTION)) {
                unsectioned.forEach(c -> sb.append(c.ast().raw()).append('\n'));
            }
            sb.append('\n');
        }

        if (!hasUnsortedSection && !unsectioned.isEmpty()) {
            sb.append(SECTION_PREFIX).append(UNSORTED_SECTION).append('\n');
            unsectioned.forEach(c -> sb.append(c.ast().raw()).append('\n'));
        }
        return sb.toString();
    }

    public Path path() {
        return path;
    }

    // ── Mutation ──────────────────────────────────────────────────────────────────

    /**
     * Parses and stores a statement.
     *
     * <p>If the statement has no version and chains rooted at the same glyph already exist, the
     * next numeric version is assigned and written into the stored raw text.
     *
     * @param section section label, or null/blank for none
     * @throws ChainParseException      if the statement does not parse
     * @throws IllegalArgumentException if the statement is empty, or its explicit version already
     *                                  exists for the same root glyph
     */
    public StoredChain addChain(String statement, String section) {
        ChainAST ast = parser.parse(statement);
        if (ast.isEmpty()) {
            throw new IllegalArgumentException("Empty chain: '" + statement + "'");
        }

        String root = ast.root().qualifiedName();
        List<StoredChain> existing = chainsRootedAt(root);

        if (ast.version() != null) {
            for (StoredChain stored : existing) {
                if (ast.version().equals(stored.version())) {
                    throw new IllegalArgumentException("Version " + ast.version() + " already exists for " + root);
                }
            }
        } else if (!existing.isEmpty()) {
            ast = ast.withVersion("v" + maxNumericVersion(existing).add(BigInteger.ONE));
        }

        String label = section == null || section.isBlank() ? null : section.strip();
        return insert(ast, 0, label);
    }

    public StoredChain addChain(String statement) {
        return addChain(statement, null);
    }

    /** Removes the first chain whose version and root glyph match exactly. */
    public boolean removeChain(String version, String rootGlyph) {
        Optional<StoredChain> match = findExact(version, rootGlyph);
        match.ifPresent(this::unindex);
        return match.isPresent();
    }

    /**
     * Marks the first chain whose version and root glyph match exactly as deprecated.
     *
     * @throws IllegalArgumentException if {@code version} is null; the document form has no
     *                                  deprecated marker without a version tag
     */
    public boolean deprecateChain(String version, String rootGlyph) {
        if (version == null) {
            throw new IllegalArgumentException("Cannot deprecate an unversioned chain of " + rootGlyph);
        }
        Optional<StoredChain> match = findExact(version, rootGlyph);
        match.ifPresent(stored -> chains.put(stored.id(),
                new StoredChain(stored.id(), stored.ast().asDeprecated(), stored.lineNumber(), stored.section())));
        return match.isPresent();
    }

    public void clear() {
        chains.clear();
        sectionIndex.clear();
        glyphIndex.clear();
    }

    private StoredChain insert(ChainAST ast, int lineNumber, String section) {
        long id = nextId++;
        StoredChain stored = new StoredChain(id, ast, lineNumber, section);
        chains.put(id, stored);

        if (section != null) {
            sectionIndex.computeIfAbsent(section, s -> new LinkedHashSet<>()).add(id);
        }
        for (GlyphNode node : ast.nodes()) {
            glyphIndex.computeIfAbsent(node.qualifiedName(), g -> new LinkedHashSet<>()).add(id);
        }
        return stored;
    }

    private void unindex(StoredChain stored) {
        chains.remove(stored.id());
        if (stored.section() != null) {
            Set<Long> ids = sectionIndex.get(stored.section());
            if (ids != null) ids.remove(stored.id());
        }
        for (GlyphNode node : stored.ast().nodes()) {
            Set<Long> ids = glyphIndex.get(node.qualifiedName());
            if (ids != null) {
                ids.remove(stored.id());
                if (ids.isEmpty()) glyphIndex.remove(node.qualifiedName());
            }
        }
    }

    private Optional<StoredChain> findExact(String version, String rootGlyph) {
        return chains.values().stream()
                .filter(c -> Objects.equals(c.version(), version))
                .filter(c -> c.rootGlyph().equals(rootGlyph))
                .findFirst();
    }

    // Version numbers have no digit limit in the grammar
    private static BigInteger maxNumericVersion(List<StoredChain> chains) {
        BigInteger max = BigInteger.ZERO;
        for (StoredChain stored : chains) {
            BigInteger number = versionNumber(stored.version());
            if (number != null) {
                max = max.max(number);
            }
        }
        return max;
    }

    private static BigInteger versionNumber(String version) {
        if (version == null) {
            return null;
        }
        Matcher m = NUMERIC_VERSION.matcher(version);
        return m.matches() ? new BigInteger(m.group(1)) : null;
    }

    // ── Queries ───────────────────────────────────────────────────────────────────

    public List<StoredChain> chains() {
        return List.copyOf(chains.values());
    }

    public Optional<StoredChain> findById(long id) {
        return Optional.ofNullable(chains.get(id));
    }

    public int size() {
        return chains.size();
    }

    public List<String> sections() {
        return List.copyOf(sectionIndex.keySet());
    }

    public List<StoredChain> findChainsBySection(String section) {
        return resolve(sectionIndex.get(section));
    }

    /** Chains containing the glyph anywhere, in insertion order. */
    public List<StoredChain> findChainsByGlyph(String qualifiedName) {
        return resolve(glyphIndex.get(qualifiedName));
    }

    /** Distinct glyphs with an edge into {@code qualifiedName} in any chain. */
    public List<GlyphNode> findDependencies(String qualifiedName) {
        return neighbours(qualifiedName, true);
    }

    /** Distinct glyphs that {@code qualifiedName} has an edge to in any chain. */
    public List<GlyphNode> findDependents(String qualifiedName) {
        return neighbours(qualifiedName, false);
    }

    private List<GlyphNode> neighbours(String qualifiedName, boolean upstream) {
        Map<String, GlyphNode> found = new LinkedHashMap<>();
        for (StoredChain stored : findChainsByGlyph(qualifiedName)) {
            List<GlyphNode> nodes = stored.ast().nodes();
            for (Edge edge : stored.ast().edges()) {
                if (!inRange(edge, nodes.size())) continue;
                int self = upstream ? edge.target() : edge.source();
                int other = upstream ? edge.source() : edge.target();
                if (nodes.get(self).qualifiedName().equals(qualifiedName)) {
                    GlyphNode neighbour = nodes.get(other);
                    found.putIfAbsent(neighbour.qualifiedName(), neighbour);
                }
            }
        }
        return List.copyOf(found.values());
    }

    public Set<String> getAllGlyphs() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(glyphIndex.keySet()));
    }

    /**
     * Glyphs that still need a generated artifact: no resolution recorded, and a kind the legend
     * marks as generated (not meta, internal or structural). Sorted by name.
     */
    public Set<String> getUnresolvedGlyphs() {
        Set<String> unresolved = new TreeSet<>();
        for (String glyph : glyphIndex.keySet()) {
            if (resolutions.containsKey(glyph)) continue;
            if (legend.needsGeneration(kindOf(glyph))) {
                unresolved.add(glyph);
            }
        }
        return unresolved;
    }

    /** All chains rooted at {@code rootGlyph}, keyed by version ({@value #UNVERSIONED} when absent). */
    public Map<String, StoredChain> getChainsByVersion(String rootGlyph) {
        Map<String, StoredChain> versions = new LinkedHashMap<>();
        for (StoredChain stored : chainsRootedAt(rootGlyph)) {
            versions.put(stored.version() != null ? stored.version() : UNVERSIONED, stored);
        }
        return versions;
    }

    /**
     * The chain tagged {@code @latest} if there is one, else the highest numeric version, else any
     * chain rooted at the glyph.
     */
    public Optional<StoredChain> getLatestChain(String rootGlyph) {
        Map<String, StoredChain> versions = getChainsByVersion(rootGlyph);
        if (versions.isEmpty()) {
            return Optional.empty();
        }
        if (versions.containsKey(LATEST)) {
            return Optional.of(versions.get(LATEST));
        }

        BigInteger max = null;
        StoredChain latest = null;
        for (Map.Entry<String, StoredChain> entry : versions.entrySet()) {
            BigInteger number = versionNumber(entry.getKey());
            if (number != null && (max == null || number.compareTo(max) > 0)) {
                max = number;
                latest = entry.getValue();
            }
        }
        return Optional.of(latest != null ? latest : versions.values().iterator().next());
    }

    public GraphStats stats() {
        int deprecated = (int) chains.values().stream().filter(StoredChain::deprecated).count();
        return new GraphStats(chains.size(), glyphIndex.size(), sections(), deprecated);
    }

    /**
     * Ranks non-deprecated chains by Jaccard overlap with a proposed statement. Both sides are
     * compared on their qualified glyph names plus a kind-normalized form
     * ({@code KIND:lowercase-first-segment}), so {@code CMP:LoginForm} and {@code CMP:loginform}
     * count as overlapping.
     *
     * @param proposed  a statement, or any text containing glyphs separated by operators or commas
     * @param threshold minimum score to include
     * @return matches sorted by score, highest first
     */
    public List<SimilarChain> findSimilarChains(String proposed, double threshold) {
        Set<String> proposedGlyphs = new LinkedHashSet<>();
        for (GlyphNode node : glyphsOf(proposed)) {
            proposedGlyphs.add(node.qualifiedName());
            proposedGlyphs.add(normalized(node));
        }

        List<SimilarChain> similar = new ArrayList<>();
        for (StoredChain stored : chains.values()) {
            if (stored.deprecated()) continue;

            Set<String> qualified = new LinkedHashSet<>();
            Set<String> storedGlyphs = new LinkedHashSet<>();
            for (GlyphNode node : stored.ast().nodes()) {
                qualified.add(node.qualifiedName());
                storedGlyphs.add(node.qualifiedName());
                storedGlyphs.add(normalized(node));
            }

            Set<String> shared = new LinkedHashSet<>(proposedGlyphs);
            shared.retainAll(storedGlyphs);
            Set<String> union = new LinkedHashSet<>(proposedGlyphs);
            union.addAll(storedGlyphs);
            if (union.isEmpty()) continue;

            double score = (double) shared.size() / union.size();
            if (score >= threshold) {
                similar.add(new SimilarChain(stored, score,
                        shared.stream().filter(qualified::contains).toList()));
            }
        }
        similar.sort(Comparator.comparingDouble(SimilarChain::score).reversed());
        return similar;
    }

    private List<GlyphNode> glyphsOf(String proposed) {
        try {
            return parser.parse(proposed).nodes();
        } catch (ChainParseException e) {
            log.debug("Proposal is not a well-formed chain, matching glyph by glyph: {}", e.getMessage());
        }
        List<GlyphNode> nodes = new ArrayList<>();
        for (String part : PROPOSAL_SEPARATOR.split(proposed.strip())) {
            if (!part.contains(":")) continue;
            try {
                nodes.add(parser.parseGlyph(part));
            } catch (ChainParseException e) {
                log.trace("Ignoring '{}' in proposal", part);
            }
        }
        return nodes;
    }

    private static String normalized(GlyphNode node) {
        String name = node.name();
        int dot = name.indexOf('.');
        if (dot >= 0) name = name.substring(0, dot);
        return node.kind() + ":" + name.toLowerCase();
    }

    // ── Resolutions ───────────────────────────────────────────────────────────────

    public void markResolved(String glyph, String filePath) {
        markResolved(glyph, filePath, null);
    }

    public void markResolved(String glyph, String filePath, String testPath) {
        resolutions.put(glyph, new Resolution(glyph, filePath, testPath, Instant.now()));
    }

    public boolean isResolved(String glyph) {
        return resolutions.containsKey(glyph);
    }

    public Optional<Resolution> getResolution(String glyph) {
        return Optional.ofNullable(resolutions.get(glyph));
    }

    public void clearResolution(String glyph) {
        resolutions.remove(glyph);
    }

    public Map<String, Resolution> resolutions() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(resolutions));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────────

    private List<StoredChain> chainsRootedAt(String rootGlyph) {
        return findChainsByGlyph(rootGlyph).stream()
                .filter(c -> c.rootGlyph().equals(rootGlyph))
                .toList();
    }

    private List<StoredChain> resolve(Set<Long> ids) {
        if (ids == null) return List.of();
        return ids.stream().map(chains::get).filter(Objects::nonNull).toList();
    }

    private static boolean inRange(Edge edge, int size) {
        return edge.source() >= 0 && edge.source() < size && edge.target() >= 0 && edge.target() < size;
    }

    static String kindOf(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon >= 0 ? qualifiedName.substring(0, colon) : qualifiedName;
    }
}
