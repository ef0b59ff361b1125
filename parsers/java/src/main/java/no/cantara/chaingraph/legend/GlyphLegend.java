package no.cantara.chaingraph.legend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The vocabulary of the chain notation: glyph kinds, edge operators, boundary rules and the kinds
 * and edge classes that play a special role during validation.
 *
 * <p>The parser, store and validators receive a legend instead of importing constants, so the
 * vocabulary can change by editing {@code chain-legend.yaml} alone.
 */
public final class GlyphLegend {

    private static final Logger log = LoggerFactory.getLogger(GlyphLegend.class);

    public static final String DEFAULT_RESOURCE = "chain-legend.yaml";

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    private static volatile GlyphLegend defaults;

    private final Map<String, KindDefinition> kinds;
    private final Map<String, OperatorDefinition> operators;
    private final List<BoundaryRule> boundaryRules;
    private final String endpointKind;
    private final String errorKind;
    private final Set<String> terminalKinds;
    private final String containmentClass;
    private final String controlClass;

    public GlyphLegend(Map<String, KindDefinition> kinds,
                       Map<String, OperatorDefinition> operators,
                       List<BoundaryRule> boundaryRules,
                       String endpointKind,
                       String errorKind,
                       Set<String> terminalKinds,
                       String containmentClass,
                       String controlClass) {
        this.kinds = Collections.unmodifiableMap(new LinkedHashMap<>(kinds));
        this.operators = Collections.unmodifiableMap(new LinkedHashMap<>(operators));
        this.boundaryRules = List.copyOf(boundaryRules);
        this.endpointKind = endpointKind;
        this.errorKind = errorKind;
        this.terminalKinds = Collections.unmodifiableSet(new LinkedHashSet<>(terminalKinds));
        this.containmentClass = containmentClass;
        this.controlClass = controlClass;
    }

    /** The legend bundled on the classpath, loaded once. */
    public static GlyphLegend defaults() {
        GlyphLegend legend = defaults;
        if (legend == null) {
            synchronized (GlyphLegend.class) {
                legend = defaults;
                if (legend == null) {
                    legend = loadResource(DEFAULT_RESOURCE);
                    defaults = legend;
                }
            }
        }
        return legend;
    }

    public static GlyphLegend load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    public static GlyphLegend load(InputStream is) {
        Map<String, Object> data = YAML.load(is);
        if (data == null) {
            throw new IllegalArgumentException("legend: document is empty");
        }
        return fromMap(data);
    }

    private static GlyphLegend loadResource(String name) {
        try (InputStream is = GlyphLegend.class.getClassLoader().getResourceAsStream(name)) {
            if (is == null) {
                throw new IllegalStateException("legend resource not found on classpath: " + name);
            }
            GlyphLegend legend = load(is);
            log.debug("Loaded legend '{}' with {} kinds, {} operators and {} boundary rules",
                    name, legend.kinds.size(), legend.operators.size(), legend.boundaryRules.size());
            return legend;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @SuppressWarnings("unchecked")
    public static GlyphLegend fromMap(Map<String, Object> data) {
        Map<String, Object> roles = (Map<String, Object>) required(data, "roles");
        Map<String, Object> kindMaps = (Map<String, Object>) required(data, "kinds");
        Map<String, Object> operatorMaps = (Map<String, Object>) required(data, "operators");
        List<Map<String, Object>> ruleMaps =
                (List<Map<String, Object>>) data.getOrDefault("boundary_rules", List.of());

        Map<String, KindDefinition> kinds = new LinkedHashMap<>();
        kindMaps.forEach((tag, value) -> kinds.put(tag, parseKind(tag, (Map<String, Object>) value)));

        Map<String, OperatorDefinition> operators = new LinkedHashMap<>();
        operatorMaps.forEach((symbol, value) -> operators.put(symbol, parseOperator(symbol, (Map<String, Object>) value)));

        List<BoundaryRule> rules = new ArrayList<>();
        for (Map<String, Object> r : ruleMaps) {
            rules.add(parseRule(r));
        }

        return new GlyphLegend(
                kinds,
                operators,
                rules,
                (String) required(roles, "endpoint"),
                (String) required(roles, "error"),
                new LinkedHashSet<>((List<String>) required(roles, "terminal")),
                (String) required(roles, "containment_class"),
                (String) required(roles, "control_class")
        );
    }

    @SuppressWarnings("unchecked")
    private static KindDefinition parseKind(String tag, Map<String, Object> k) {
        if (k == null) k = Map.of();
        return new KindDefinition(
                tag,
                (String) k.getOrDefault("name", tag),
                (String) k.get("description"),
                (String) k.getOrDefault("layer", "shared"),
                (String) k.get("generator"),
                Boolean.TRUE.equals(k.get("structural")),
                (List<String>) k.getOrDefault("qualifiers", List.of()),
                (String) k.getOrDefault("color", "#999999"),
                (String) k.getOrDefault("shape", "box")
        );
    }

    private static OperatorDefinition parseOperator(String symbol, Map<String, Object> o) {
        if (o == null) {
            throw new IllegalArgumentException("operator '" + symbol + "': definition is empty");
        }
        return new OperatorDefinition(
                symbol,
                (String) required(o, "class"),
                (String) o.get("description"),
                Boolean.TRUE.equals(o.get("cycles_allowed"))
        );
    }

    private static BoundaryRule parseRule(Map<String, Object> r) {
        String from = (String) r.get("from");
        String qualifier = null;
        if (from != null && from.contains(":")) {
            int colon = from.indexOf(':');
            qualifier = from.substring(colon + 1);
            from = from.substring(0, colon);
        }
        return new BoundaryRule(
                from,
                qualifier,
                (String) r.get("operator"),
                (String) r.get("to"),
                Boolean.TRUE.equals(r.get("allowed")),
                (String) r.getOrDefault("reason", "Boundary rule violated")
        );
    }

    private static Object required(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            throw new IllegalArgumentException("legend: '" + key + "' is required");
        }
        return value;
    }

    // ── Kinds ─────────────────────────────────────────────────────────────────────

    public Map<String, KindDefinition> kinds() { return kinds; }

    /** The definition of a kind, or null if the kind is unknown. */
    public KindDefinition kind(String tag) { return kinds.get(tag); }

    public boolean isKnownKind(String tag) { return kinds.containsKey(tag); }

    /**
     * True if glyphs of this kind are expected to have a generated artifact: the kind is known,
     * has a generator and is neither a meta, internal nor structural kind.
     */
    public boolean needsGeneration(String tag) {
        KindDefinition def = kinds.get(tag);
        if (def == null) return false;
        if (def.isMeta() || def.isInternal() || def.structural()) return false;
        return def.hasGenerator();
    }

    /** Kinds that carry executable code, i.e. kinds with a generator. */
    public Set<String> executableKinds() {
        Set<String> result = new LinkedHashSet<>();
        kinds.values().stream().filter(KindDefinition::hasGenerator).forEach(k -> result.add(k.tag()));
        return result;
    }

    // ── Operators ─────────────────────────────────────────────────────────────────

    public Map<String, OperatorDefinition> operators() { return operators; }

    /** The definition of an operator, or null if the operator is unknown. */
    public OperatorDefinition operator(String symbol) { return operators.get(symbol); }

    public boolean isKnownOperator(String symbol) { return operators.containsKey(symbol); }

    /** Unknown operators are never cycle-tolerant. */
    public boolean cyclesAllowed(String symbol) {
        OperatorDefinition def = operators.get(symbol);
        return def != null && def.cyclesAllowed();
    }

    public String edgeClass(String symbol) {
        OperatorDefinition def = operators.get(symbol);
        return def == null ? "unknown" : def.edgeClass();
    }

    public boolean isContainment(String symbol) {
        return containmentClass.equals(edgeClass(symbol));
    }

    public boolean isControl(String symbol) {
        return controlClass.equals(edgeClass(symbol));
    }

    // ── Rules and roles ───────────────────────────────────────────────────────────

    public List<BoundaryRule> boundaryRules() { return boundaryRules; }

    /** The kind of endpoint glyphs, e.g. {@code API}. */
    public String endpointKind() { return endpointKind; }

    /** The kind of error glyphs, e.g. {@code ERR}. */
    public String errorKind() { return errorKind; }

    /** Kinds that close a chain, e.g. {@code OUT} and {@code ERR}. */
    public Set<String> terminalKinds() { return terminalKinds; }
}
