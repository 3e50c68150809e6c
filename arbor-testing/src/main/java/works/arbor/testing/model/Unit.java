package works.arbor.testing.model;

/**
 * A unit of measure. Not a node: it's read by the observation visitor.
 */
public record Unit(String symbol) { }
