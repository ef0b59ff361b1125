package no.cantara.chaingraph.validation;

/**
 * One validation finding.
 *
 * @param code    what was found
 * @param message human-readable description
 * @param node    qualified name of the glyph the finding is about, or null
 */
public record ValidationIssue(
        IssueCode code,
        String message,
        String node
) {
    public static ValidationIssue of(IssueCode code, String message) {
        return new ValidationIssue(code, message, null);
    }

    @Override
    public String toString() {
        return node == null ? code + ": " + message : code + " [" + node + "]: " + message;
    }
}
