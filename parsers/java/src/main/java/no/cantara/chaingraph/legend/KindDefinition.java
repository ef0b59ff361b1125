package no.cantara.chaingraph.legend;

import java.util.List;

/**
 * Metadata for one glyph kind.
 *
 * @param tag         the kind tag as written in statements, e.g. {@code CMP}
 * @param name        display name
 * @param description one-line description
 * @param layer       {@code meta}, {@code frontend}, {@code shared}, {@code backend} or {@code internal}
 * @param generator   name of the code generator responsible for this kind, or null when nothing is generated
 * @param structural  true for pure containers that never carry code
 * @param qualifiers  namespaces conventionally used with this kind
 * @param color       fill colour used by graph exports
 * @param shape       Graphviz node shape used by graph exports
 */
public record KindDefinition(
        String tag,
        String name,
        String description,
        String layer,
        String generator,
        boolean structural,
        List<String> qualifiers,
        String color,
        String shape
) {
    public static final String LAYER_META = "meta";
    public static final String LAYER_INTERNAL = "internal";

    public KindDefinition {
        qualifiers = qualifiers != null ? List.copyOf(qualifiers) : List.of();
    }

    public boolean isMeta() { return LAYER_META.equals(layer); }
    public boolean isInternal() { return LAYER_INTERNAL.equals(layer); }
    public boolean hasGenerator() { return generator != null && !generator.isBlank(); }
}
