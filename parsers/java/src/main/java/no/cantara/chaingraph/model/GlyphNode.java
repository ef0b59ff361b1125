package no.cantara.chaingraph.model;

import java.util.List;
import java.util.Set;

/**
 * A single typed glyph reference such as {@code FNC:auth.validate[headless]} or {@code OUT:toast('Saved')}.
 *
 * @param kind      the classifying tag before the colon
 * @param name      the raw text after the colon, without modifiers or arguments
 * @param namespace first segment of a dotted name, or the method of an endpoint; may be null
 * @param action    remainder of a dotted name, or the route of an endpoint; may be null
 * @param modifiers bracketed tags; order is not significant
 * @param args      parenthesized literal arguments, quotes stripped
 * @param raw       the substring the glyph was parsed from
 */
public record GlyphNode(
        String kind,
        String name,
        String namespace,
        String action,
        Set<String> modifiers,
        List<String> args,
        String raw
) {
    public GlyphNode {
        modifiers = modifiers != null ? Set.copyOf(modifiers) : Set.of();
        args = args != null ? List.copyOf(args) : List.of();
    }

    public static GlyphNode of(String kind, String name) {
        return new GlyphNode(kind, name, null, null, Set.of(), List.of(), kind + ":" + name);
    }

    /**
     * Identity used by every index: {@code kind:namespace.action} when both parts exist,
     * otherwise {@code kind:name}.
     */
    public String qualifiedName() {
        if (namespace != null && action != null) {
            return kind + ":" + namespace + "." + action;
        }
        return kind + ":" + name;
    }

    public boolean hasModifier(String modifier) {
        return modifiers.contains(modifier);
    }
}
