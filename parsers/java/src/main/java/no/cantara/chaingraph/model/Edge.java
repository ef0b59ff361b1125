package no.cantara.chaingraph.model;

/**
 * A directed edge between two node positions of the owning chain.
 */
public record Edge(
        int source,
        int target,
        String operator
) {}
