package no.cantara.chaingraph.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable result of validating a chain or a whole graph.
 *
 * @param errors   findings that make the subject unsound
 * @param warnings advisory findings; never affect {@link #isValid()}
 */
public record ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {

    private static final ValidationResult OK = new ValidationResult(List.of(), List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult ok() { return OK; }

    public static ValidationResult error(ValidationIssue issue) {
        return new ValidationResult(List.of(issue), List.of());
    }

    public static ValidationResult warning(ValidationIssue issue) {
        return new ValidationResult(List.of(), List.of(issue));
    }

    public boolean isValid() { return errors.isEmpty(); }
    public boolean hasWarnings() { return !warnings.isEmpty(); }

    /** Concatenates both lists; the result is valid only if both inputs are. */
    public ValidationResult merge(ValidationResult other) {
        if (other.errors.isEmpty() && other.warnings.isEmpty()) return this;
        if (errors.isEmpty() && warnings.isEmpty()) return other;
        List<ValidationIssue> mergedErrors = new ArrayList<>(errors);
        mergedErrors.addAll(other.errors);
        List<ValidationIssue> mergedWarnings = new ArrayList<>(warnings);
        mergedWarnings.addAll(other.warnings);
        return new ValidationResult(mergedErrors, mergedWarnings);
    }

    public boolean hasError(IssueCode code) {
        return errors.stream().anyMatch(e -> e.code() == code);
    }

    public boolean hasWarning(IssueCode code) {
        return warnings.stream().anyMatch(w -> w.code() == code);
    }
}
