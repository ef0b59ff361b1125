package no.cantara.chaingraph.graph;

import java.time.Instant;

/**
 * Record of an artifact generated for a glyph by an external generator.
 */
public record Resolution(
        String glyph,
        String filePath,
        String testPath,
        Instant generatedAt
) {}
