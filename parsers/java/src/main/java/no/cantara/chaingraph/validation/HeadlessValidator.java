package no.cantara.chaingraph.validation;

import no.cantara.chaingraph.legend.GlyphLegend;
import no.cantara.chaingraph.model.ChainAST;
import no.cantara.chaingraph.model.GlyphNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks that a chain can run without a UI: every executable glyph must be marked {@code [headless]}.
 */
public class HeadlessValidator {

    public static final String HEADLESS_MODIFIER = "headless";

    private final Set<String> executableKinds;

    public HeadlessValidator(GlyphLegend legend) {
        this.executableKinds = legend.executableKinds();
    }

    public ValidationResult validate(ChainAST ast) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        boolean hasExecutable = false;
        boolean hasHeadless = false;

        for (GlyphNode node : ast.nodes()) {
            if (!executableKinds.contains(node.kind())) continue;
            hasExecutable = true;
            if (node.hasModifier(HEADLESS_MODIFIER)) {
                hasHeadless = true;
            } else {
                errors.add(new ValidationIssue(IssueCode.HEADLESS_REQUIRED,
                        node.qualifiedName() + " is missing the [headless] modifier", node.qualifiedName()));
            }
        }

        if (hasExecutable && !hasHeadless) {
            warnings.add(ValidationIssue.of(IssueCode.HEADLESS_NO_ENTRY,
                    "No [headless] glyphs found; the chain cannot be executed headless"));
        }
        return new ValidationResult(errors, warnings);
    }
}
