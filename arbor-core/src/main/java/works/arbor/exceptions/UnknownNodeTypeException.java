package works.arbor.exceptions;

public final class UnknownNodeTypeException extends GraphStructureException {
	private final Class<?> nodeClass;

	public Class<?> nodeClass() {
		return nodeClass;
	}

	public UnknownNodeTypeException(Class<?> nodeClass) {
		super("Node class " + nodeClass.getName() + " is not part of the graph spec");
		this.nodeClass = nodeClass;
	}
}
