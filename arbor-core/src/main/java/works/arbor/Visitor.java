package works.arbor;

import java.util.Map;

/**
 * Produces the columns contributed by one node.
 * <p>
 * Visitors must not modify the graph. They may consult {@code ancestors}
 * to find the nearest enclosing node of some other type.
 *
 * @param <K> the node type identifier
 * @param <N> the node class
 */
@FunctionalInterface
public interface Visitor<K extends Enum<K>, N> {
	/**
	 * @return a map from variable oid to raw value; values may be null
	 */
	Map<String, ?> visit(N node, AncestorContext<K> ancestors);
}
