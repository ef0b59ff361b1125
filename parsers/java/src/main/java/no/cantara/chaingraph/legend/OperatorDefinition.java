package no.cantara.chaingraph.legend;

/**
 * Metadata for one edge operator.
 *
 * @param symbol        the operator as written, e.g. {@code =>}
 * @param edgeClass     the edge class, e.g. {@code structural}, {@code reactive}, {@code control}
 * @param description   one-line description
 * @param cyclesAllowed true if the operator belongs to the cycle-tolerant class
 */
public record OperatorDefinition(
        String symbol,
        String edgeClass,
        String description,
        boolean cyclesAllowed
) {}
