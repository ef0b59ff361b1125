package no.cantara.chaingraph.legend;

import no.cantara.chaingraph.model.GlyphNode;

/**
 * A declarative connection rule between kinds.
 *
 * <p>A rule names a source kind, optionally narrowed by a namespace qualifier, and either an
 * operator or a target kind (or both). All constraints that are present must match.
 *
 * @param fromKind  source kind
 * @param qualifier required source namespace, or null for any
 * @param operator  operator the rule applies to, or null for any
 * @param toKind    target kind the rule applies to, or null for any
 * @param allowed   false for a forbidden connection
 * @param reason    human-readable explanation reported on violation
 */
public record BoundaryRule(
        String fromKind,
        String qualifier,
        String operator,
        String toKind,
        boolean allowed,
        String reason
) {
    public BoundaryRule {
        if (fromKind == null || fromKind.isBlank()) {
            throw new IllegalArgumentException("boundary rule: 'from' is required");
        }
        if (operator == null && toKind == null) {
            throw new IllegalArgumentException("boundary rule from '" + fromKind + "': 'operator' or 'to' is required");
        }
    }

    public static BoundaryRule forbidOperator(String fromKind, String operator, String reason) {
        return new BoundaryRule(fromKind, null, operator, null, false, reason);
    }

    public static BoundaryRule forbidTarget(String fromKind, String qualifier, String toKind, String reason) {
        return new BoundaryRule(fromKind, qualifier, null, toKind, false, reason);
    }

    public boolean matches(GlyphNode source, String edgeOperator, GlyphNode target) {
        if (!fromKind.equals(source.kind())) return false;
        if (qualifier != null && !qualifier.equals(source.namespace())) return false;
        if (operator != null && !operator.equals(edgeOperator)) return false;
        return toKind == null || toKind.equals(target.kind());
    }

    /** The source side as written in a legend document, e.g. {@code FNC:ui}. */
    public String fromLabel() {
        return qualifier == null ? fromKind : fromKind + ":" + qualifier;
    }
}
