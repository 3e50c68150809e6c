package works.arbor;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * The nearest node of each type on the path from the root to the node being visited.
 * <p>
 * Immutable: each step of a traversal derives a new context from its parent's,
 * so sibling subtrees never see each other's nodes, and any number of exports
 * can run at once over the same configured exporter.
 */
public final class AncestorContext<K extends Enum<K>> {
	private final PMap<K, Object> nodesByType;

	private AncestorContext(PMap<K, Object> nodesByType) {
		this.nodesByType = nodesByType;
	}

	public static <K extends Enum<K>> AncestorContext<K> empty() {
		return new AncestorContext<>(HashTreePMap.<K, Object>empty());
	}

	/**
	 * @return a context in which {@code node} is the nearest node of type {@code typeId}
	 */
	public AncestorContext<K> with(K typeId, Object node) {
		return new AncestorContext<>(nodesByType.plus(typeId, node));
	}

	@Nullable
	public Object get(K typeId) {
		return nodesByType.get(typeId);
	}

	public <N> Optional<N> nearest(K typeId, Class<N> nodeClass) {
		return Optional.ofNullable(nodesByType.get(typeId)).map(nodeClass::cast);
	}

	/**
	 * @throws IllegalStateException if no node of type {@code typeId} encloses the current one
	 */
	public <N> N require(K typeId, Class<N> nodeClass) {
		return nearest(typeId, nodeClass)
			.orElseThrow(() -> new IllegalStateException("No enclosing node of type " + typeId));
	}

	/**
	 * @return true if the nearest node of type {@code typeId} is a {@link MissingNode placeholder}
	 */
	public boolean isMissing(K typeId) {
		return MissingNode.isMissing(nodesByType.get(typeId));
	}

	public boolean contains(K typeId) {
		return nodesByType.containsKey(typeId);
	}

	@Override
	public String toString() {
		return "AncestorContext" + nodesByType.keySet();
	}
}
