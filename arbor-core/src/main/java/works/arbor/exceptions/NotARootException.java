package works.arbor.exceptions;

/**
 * The ancestor chain of a subtree node ends somewhere other than the exporter's root.
 */
public final class NotARootException extends GraphStructureException {
	public NotARootException(Object topmostAncestor) {
		super("Subtree doesn't belong to this exporter's root; its topmost ancestor is " + topmostAncestor);
	}
}
