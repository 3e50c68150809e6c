package works.arbor.exceptions;

public final class MissingVisitorException extends GraphStructureException {
	private final Object nodeType;

	public Object nodeType() {
		return nodeType;
	}

	public MissingVisitorException(Object nodeType) {
		super("No visitor registered for node type " + nodeType);
		this.nodeType = nodeType;
	}
}
