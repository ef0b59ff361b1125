package no.cantara.chaingraph;

import no.cantara.chaingraph.graph.KnowledgeGraph;
import no.cantara.chaingraph.validation.ChainValidation;
import no.cantara.chaingraph.validation.ValidationResult;

import java.nio.file.Path;

/**
 * Command-line interface for chain document validation.
 * Usage: java -jar chaingraph-parser.jar &lt;path-to-document&gt;
 */
public class ChainCli {

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: java -jar chaingraph-parser.jar <path-to-document>");
            System.exit(1);
        }

        Path path = Path.of(args[0]);
        if (!path.toFile().exists()) {
            System.err.println("Error: file not found: " + path);
            System.exit(1);
        }

        KnowledgeGraph graph = new KnowledgeGraph();
        try {
            graph.load(path);
        } catch (Exception e) {
            System.err.println("Load error: " + e.getMessage());
            System.exit(1);
            return;
        }

        ValidationResult result = ChainValidation.validateGraph(graph);
        if (result.hasWarnings()) {
            result.warnings().forEach(w -> System.err.println("  ⚠ " + w));
        }
        if (!result.isValid()) {
            System.err.println("Validation failed: " + result.errors().size() + " error(s):");
            result.errors().forEach(e -> System.err.println("  • " + e));
            System.exit(1);
        }

        System.out.printf("✓ %s is valid: %d chain(s), %d glyph(s), %d section(s), %d warning(s)%n",
                path,
                graph.size(),
                graph.getAllGlyphs().size(),
                graph.sections().size(),
                result.warnings().size());
    }
}
