package works.arbor.exceptions;

/**
 * A parent accessor yielded a collection instead of a single object.
 */
public final class AmbiguousParentException extends GraphStructureException {
	public AmbiguousParentException(Object nodeType, Object parentValue) {
		super("Parent accessor for node type " + nodeType + " must return a single object, not " + parentValue.getClass().getSimpleName());
	}
}
