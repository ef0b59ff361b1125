package no.cantara.chaingraph;

import no.cantara.chaingraph.model.ChainAST;
import no.cantara.chaingraph.model.Edge;
import no.cantara.chaingraph.model.GlyphNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses one chain statement into a {@link ChainAST}.
 *
 * <p>Grammar, in order: an optional version tag ({@code @v<digits>} or {@code @latest}) optionally
 * followed by {@code [deprecated]}; an optional framework tag ({@code [react]}); then either a
 * containment statement ({@code V:Page @ CMP:A, CMP:B}) or a linear chain
 * ({@code NED:login => CMP:Form ~> STO:auth}).
 *
 * <p>Kinds are not checked here. Whether {@code XYZ:thing} names a known kind is a question for
 * the validator and its legend.
 */
public class ChainParser {

    public static final String DEFAULT_ENDPOINT_KIND = "API";
    public static final String CONTAINMENT_OPERATOR = "@";
    public static final List<String> OPERATORS = List.of("=>", "~>", "!>", "->", "::", CONTAINMENT_OPERATOR);

    private static final Pattern VERSION_PATTERN = Pattern.compile("@(v\\d+|latest)(\\s+\\[deprecated\\])?");
    private static final Pattern FRAMEWORK_PATTERN = Pattern.compile("\\[(\\w+)\\]");
    private static final Pattern OPERATOR_PATTERN = Pattern.compile("=>|~>|!>|->|::|@");
    // '-' is allowed inside names as long as it does not start the '->' operator
    private static final Pattern GLYPH_PATTERN = Pattern.compile(
            "([A-Z]+):((?:[a-zA-Z0-9_./]|-(?!>))+)((?:\\[[^\\]\\[,]+\\])*)(\\([^)]*\\))?");
    private static final Pattern MODIFIER_PATTERN = Pattern.compile("\\[([^\\]]+)\\]");
    private static final Pattern CONTAINMENT_PATTERN = Pattern.compile("([A-Z]+:[^\\s@]+)\\s*@\\s*(.+)");

    private final String endpointKind;

    public ChainParser() {
        this(DEFAULT_ENDPOINT_KIND);
    }

    /**
     * @param endpointKind the kind whose names are split into method and route on the first {@code /}
     */
    public ChainParser(String endpointKind) {
        this.endpointKind = endpointKind;
    }

    public String endpointKind() {
        return endpointKind;
    }

    /**
     * Parses a statement. Blank lines and {@code #} comments yield an empty chain rather than an error.
     *
     * @throws ChainParseException if part of the statement cannot be classified
     */
    public ChainAST parse(String statement) {
        String text = statement == null ? "" : statement.strip();
        if (text.isEmpty() || text.startsWith("#")) {
            return ChainAST.empty(text);
        }

        int pos = 0;
        String version = null;
        boolean deprecated = false;
        String framework = null;

        Matcher versionMatch = VERSION_PATTERN.matcher(text);
        if (versionMatch.lookingAt()) {
            version = versionMatch.group(1);
            deprecated = versionMatch.group(2) != null;
            pos = skipWhitespace(text, versionMatch.end());
        }

        Matcher frameworkMatch = FRAMEWORK_PATTERN.matcher(text).region(pos, text.length());
        if (frameworkMatch.lookingAt()) {
            framework = frameworkMatch.group(1);
            pos = skipWhitespace(text, frameworkMatch.end());
        }

        List<GlyphNode> nodes = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();

        Matcher containment = CONTAINMENT_PATTERN.matcher(text).region(pos, text.length());
        if (containment.matches()) {
            parseContainment(text, containment, nodes, edges);
        } else {
            parseLinear(text, pos, nodes, edges);
        }
        return new ChainAST(version, framework, deprecated, nodes, edges, text);
    }

    /**
     * Parses a single glyph token such as {@code CMP:LoginForm[stateful]}.
     *
     * @throws ChainParseException if the whole token is not one glyph
     */
    public GlyphNode parseGlyph(String token) {
        String text = token == null ? "" : token.strip();
        Matcher m = GLYPH_PATTERN.matcher(text);
        if (!m.matches()) {
            throw new ChainParseException("Invalid glyph '" + text + "'", 0);
        }
        return toNode(m);
    }

    // V:Page @ CMP:A, CMP:B -- every edge goes from the container to one child
    private void parseContainment(String text, Matcher containment, List<GlyphNode> nodes, List<Edge> edges) {
        nodes.add(glyphAt(text, containment.start(1), containment.end(1), "container"));

        int childStart = containment.start(2);
        for (int[] span : splitTopLevel(text, childStart, containment.end(2))) {
            if (span[0] == span[1]) {
                throw new ChainParseException("Empty child glyph in containment list", span[0]);
            }
            nodes.add(glyphAt(text, span[0], span[1], "child"));
            edges.add(new Edge(0, nodes.size() - 1, CONTAINMENT_OPERATOR));
        }
    }

    private void parseLinear(String text, int start, List<GlyphNode> nodes, List<Edge> edges) {
        String pendingOperator = null;
        int pos = skipWhitespace(text, start);

        while (pos < text.length()) {
            Matcher op = OPERATOR_PATTERN.matcher(text).region(pos, text.length());
            if (op.lookingAt()) {
                if (nodes.isEmpty()) {
                    throw new ChainParseException("Chain cannot start with operator '" + op.group() + "'", pos);
                }
                if (pendingOperator != null) {
                    throw new ChainParseException("Expected glyph after '" + pendingOperator + "'", pos);
                }
                pendingOperator = op.group();
                pos = skipWhitespace(text, op.end());
                continue;
            }

            Matcher glyph = GLYPH_PATTERN.matcher(text).region(pos, text.length());
            if (glyph.lookingAt()) {
                if (!nodes.isEmpty() && pendingOperator == null) {
                    throw new ChainParseException("Expected operator before '" + glyph.group() + "'", pos);
                }
                nodes.add(toNode(glyph));
                if (pendingOperator != null) {
                    edges.add(new Edge(nodes.size() - 2, nodes.size() - 1, pendingOperator));
                    pendingOperator = null;
                }
                pos = skipWhitespace(text, glyph.end());
                continue;
            }

            throw new ChainParseException("Cannot classify '" + preview(text, pos) + "'", pos);
        }

        if (pendingOperator != null) {
            throw new ChainParseException("Dangling operator '" + pendingOperator + "'", text.length());
        }
    }

    private GlyphNode glyphAt(String text, int start, int end, String role) {
        String token = text.substring(start, end).strip();
        Matcher m = GLYPH_PATTERN.matcher(token);
        if (!m.matches()) {
            throw new ChainParseException("Invalid " + role + " glyph '" + token + "'", start);
        }
        return toNode(m);
    }

    private GlyphNode toNode(Matcher m) {
        String kind = m.group(1);
        String name = m.group(2);
        String namespace = null;
        String action = null;

        int slash = name.indexOf('/');
        int dot = name.indexOf('.');
        if (kind.equals(endpointKind) && slash >= 0) {
            namespace = name.substring(0, slash);
            action = name.substring(slash);
        } else if (dot >= 0) {
            namespace = name.substring(0, dot);
            action = name.substring(dot + 1);
        }

        Set<String> modifiers = new LinkedHashSet<>();
        if (m.group(3) != null) {
            Matcher mod = MODIFIER_PATTERN.matcher(m.group(3));
            while (mod.find()) {
                modifiers.add(mod.group(1).strip());
            }
        }

        List<String> args = List.of();
        if (m.group(4) != null) {
            String inner = m.group(4).substring(1, m.group(4).length() - 1);
            args = splitArgs(inner);
        }

        return new GlyphNode(kind, name, namespace, action, modifiers, args, m.group());
    }

    /** Splits on commas that are outside quotes. Surrounding quotes are stripped and empty entries dropped. */
    static List<String> splitArgs(String inner) {
        List<String> args = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (char c : inner.toCharArray()) {
            if (quote != 0) {
                if (c == quote) quote = 0;
                current.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == ',') {
                addArg(args, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addArg(args, current);
        return args;
    }

    private static void addArg(List<String> args, StringBuilder raw) {
        String arg = raw.toString().strip();
        int from = 0;
        int to = arg.length();
        while (from < to && isQuote(arg.charAt(from))) from++;
        while (to > from && isQuote(arg.charAt(to - 1))) to--;
        arg = arg.substring(from, to);
        if (!arg.isBlank()) {
            args.add(arg);
        }
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    /**
     * Splits {@code text[start, end)} on commas that are not nested inside brackets, parentheses or quotes.
     * Returned spans are trimmed.
     */
    static List<int[]> splitTopLevel(String text, int start, int end) {
        List<int[]> spans = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int segment = start;
        for (int i = start; i < end; i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (isQuote(c)) {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                spans.add(trimmed(text, segment, i));
                segment = i + 1;
            }
        }
        spans.add(trimmed(text, segment, end));
        return spans;
    }

    private static int[] trimmed(String text, int from, int to) {
        while (from < to && Character.isWhitespace(text.charAt(from))) from++;
        while (to > from && Character.isWhitespace(text.charAt(to - 1))) to--;
        return new int[]{from, to};
    }

    private static int skipWhitespace(String text, int pos) {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
        return pos;
    }

    private static String preview(String text, int pos) {
        String rest = text.substring(pos);
        return rest.length() > 20 ? rest.substring(0, 20) + "..." : rest;
    }
}
