package no.cantara.chaingraph.graph;

import java.util.List;

public record GraphStats(
        int totalChains,
        int totalGlyphs,
        List<String> sections,
        int deprecated
) {
    public GraphStats {
        sections = sections != null ? List.copyOf(sections) : List.of();
    }
}
