package works.arbor;

import org.jetbrains.annotations.Nullable;

/**
 * Implemented by node classes whose instances can stand in for a relation that doesn't exist.
 * <p>
 * When a child accessor would yield nothing, but the export should still produce a row,
 * it can return a placeholder instead. The placeholder is dispatched like any other node of its class;
 * its visitor, and the visitors beneath it, use {@link #isMissing} or
 * {@link AncestorContext#isMissing} to tell it apart from a real node.
 *
 * <pre>{@code
 * Accessor.function(Visit.class, visit -> visit.forms().isEmpty()
 *     ? List.of(Form.placeholder(visit))
 *     : visit.forms())
 * }</pre>
 */
public interface MissingNode {
	/**
	 * @return true if this instance is a placeholder rather than a real node
	 */
	boolean missingForExport();

	/**
	 * @return true if {@code node} is a placeholder; false for null and for classes that don't implement this interface
	 */
	static boolean isMissing(@Nullable Object node) {
		return node instanceof MissingNode m && m.missingForExport();
	}
}
