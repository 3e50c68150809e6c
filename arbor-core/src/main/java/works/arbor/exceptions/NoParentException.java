package works.arbor.exceptions;

/**
 * A subtree export was requested for a node with no parent.
 * Use a full export for the root.
 */
public final class NoParentException extends GraphStructureException {
	private final Object nodeType;

	public Object nodeType() {
		return nodeType;
	}

	public NoParentException(Object nodeType) {
		super("Cannot export subtree for a root node of type " + nodeType);
		this.nodeType = nodeType;
	}
}
