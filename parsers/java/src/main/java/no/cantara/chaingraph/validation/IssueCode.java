package no.cantara.chaingraph.validation;

/**
 * Machine-readable identifier for each kind of validation finding.
 */
public enum IssueCode {
    UNKNOWN_KIND,
    EDGE_SOURCE_OUT_OF_RANGE,
    EDGE_TARGET_OUT_OF_RANGE,
    UNKNOWN_OPERATOR,
    NO_TERMINAL_OUTPUT,
    STRUCTURAL_CYCLE,
    BOUNDARY_VIOLATION,
    MISSING_ERROR_PATH,
    DUPLICATE_VERSION,
    HEADLESS_REQUIRED,
    HEADLESS_NO_ENTRY
}
