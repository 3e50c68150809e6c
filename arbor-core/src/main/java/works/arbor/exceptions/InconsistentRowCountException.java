package works.arbor.exceptions;

/**
 * Sibling subtrees produced different numbers of rows for the same column.
 * <p>
 * This points at a modeling inconsistency in the graph or the visitors;
 * the exporter won't pad or truncate columns to paper over it.
 */
public final class InconsistentRowCountException extends GraphStructureException {
	private final Object nodeType;
	private final String column;
	private final int expectedRows;
	private final int actualRows;

	public Object nodeType() {
		return nodeType;
	}

	public String column() {
		return column;
	}

	public int expectedRows() {
		return expectedRows;
	}

	public int actualRows() {
		return actualRows;
	}

	public InconsistentRowCountException(Object nodeType, String column, int expectedRows, int actualRows) {
		super("Children of " + nodeType + " have differing row counts: column \"" + column + "\" has " + actualRows + " rows, expected " + expectedRows);
		this.nodeType = nodeType;
		this.column = column;
		this.expectedRows = expectedRows;
		this.actualRows = actualRows;
	}
}
