package works.arbor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.exceptions.InconsistentRowCountException;
import works.arbor.exceptions.InvalidConfigurationException;
import works.arbor.exceptions.NoParentException;
import works.arbor.exceptions.NotARootException;

import static java.util.Collections.nCopies;
import static java.util.Objects.requireNonNull;

/**
 * Walks an object graph and flattens it into a {@link Table} with one row per leaf.
 * <p>
 * Each node's visitor output is merged over the columns inherited from its ancestors
 * and broadcast across all the rows produced beneath it.
 * Children's rows are concatenated in the order their accessor returns them.
 * <p>
 * The output is "raw": its columns are whatever the visitors produced, in no particular order.
 * {@link PostProcessor} turns it into a schema-conformant table.
 * <p>
 * Holds no per-export state, so one instance can serve concurrent exports.
 */
public final class TreeExporter<K extends Enum<K>> {
	private final NodeGraphSpec<K> graph;
	private final VisitorRegistry<K> visitors;
	private final Object root;

	public TreeExporter(NodeGraphSpec<K> graph, VisitorRegistry<K> visitors, Object root) {
		this.graph = requireNonNull(graph);
		this.visitors = requireNonNull(visitors);
		this.root = requireNonNull(root);
		visitors.checkCompatibleWith(graph);
		Class<?> rootClass = graph.rootSpec().nodeClass();
		if (root.getClass() != rootClass) {
			throw new InvalidConfigurationException("Root must be a " + rootClass.getSimpleName() + ", not " + root.getClass().getSimpleName());
		}
	}

	public NodeGraphSpec<K> graph() {
		return graph;
	}

	public Object root() {
		return root;
	}

	/**
	 * @return one row for each leaf reachable from the root
	 */
	public Table exportTree() {
		Table result = exportNode(root, Map.of(), AncestorContext.empty()).toTable();
		LOGGER.debug("Exported {} rows with {} columns from {}", result.rowCount(), result.columnNames().size(), graph.rootSpec().typeId());
		return result;
	}

	/**
	 * Exports only the rows beneath {@code node}, with the same inherited columns
	 * that a full export would have given them.
	 *
	 * @throws NoParentException if {@code node} is the root; use {@link #exportTree()} instead
	 * @throws NotARootException if {@code node} doesn't descend from this exporter's root
	 */
	public Table exportSubtree(Object node) {
		NodeTypeSpec<K> spec = graph.specFor(node);
		Object parent = spec.parent(node);
		if (parent == null) {
			throw new NoParentException(spec.typeId());
		}

		// Top of the tree first
		Deque<Object> ancestorChain = new ArrayDeque<>();
		Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		Object topmost = null;
		for (Object current = parent; current != null; current = graph.specFor(current).parent(current)) {
			if (!seen.add(current)) {
				throw new NotARootException(current);
			}
			ancestorChain.addFirst(current);
			topmost = current;
		}
		if (topmost != root) {
			throw new NotARootException(topmost);
		}

		// Replay the visitors the way a full export would reach this depth
		Map<String, Object> inherited = new LinkedHashMap<>();
		AncestorContext<K> ancestors = AncestorContext.empty();
		for (Object ancestor : ancestorChain) {
			K typeId = graph.specFor(ancestor).typeId();
			ancestors = ancestors.with(typeId, ancestor);
			inherited.putAll(visitors.visit(typeId, ancestor, ancestors));
		}

		Table result = exportNode(node, inherited, ancestors).toTable();
		LOGGER.debug("Exported {} rows from subtree at {} ({} ancestors)", result.rowCount(), spec.typeId(), ancestorChain.size());
		return result;
	}

	private Segment exportNode(Object node, Map<String, ?> inherited, AncestorContext<K> ancestors) {
		NodeTypeSpec<K> spec = graph.specFor(node);
		AncestorContext<K> context = ancestors.with(spec.typeId(), node);
		if (MissingNode.isMissing(node)) {
			LOGGER.trace("Visiting placeholder {}", spec.typeId());
		}

		// Columns a node declares itself shadow the ones it inherits
		Map<String, Object> effective = new LinkedHashMap<>(inherited);
		effective.putAll(visitors.visit(spec.typeId(), node, context));

		if (spec.isLeaf()) {
			return Segment.singleRow(effective);
		}

		List<Object> children = spec.children(node);
		if (children.isEmpty()) {
			// A branching node with nothing beneath it contributes no rows, and therefore none of its columns either
			LOGGER.trace("{} has no children; contributes no rows", spec.typeId());
			return new Segment();
		}

		Segment result = new Segment();
		for (Object child : children) {
			result.append(exportNode(child, effective, context));
		}
		result.checkRowCounts(spec.typeId());
		if (result.rowCount == 0) {
			return new Segment();
		}

		// Ancestor-declared values win over anything of the same name from below
		result.broadcast(effective);
		LOGGER.trace("{} contributes {} rows", spec.typeId(), result.rowCount);
		return result;
	}

	/**
	 * The partial table produced by one subtree.
	 * Columns may temporarily disagree on length while children are being appended.
	 */
	private static final class Segment {
		final LinkedHashMap<String, List<Object>> columns = new LinkedHashMap<>();
		int rowCount = 0;

		static Segment singleRow(Map<String, Object> values) {
			Segment result = new Segment();
			values.forEach((name, value) -> {
				List<Object> column = new ArrayList<>(1);
				column.add(value);
				result.columns.put(name, column);
			});
			result.rowCount = 1;
			return result;
		}

		void append(Segment child) {
			child.columns.forEach((name, values) -> columns.computeIfAbsent(name, _k -> new ArrayList<>()).addAll(values));
			rowCount += child.rowCount;
		}

		void checkRowCounts(Object nodeType) {
			columns.forEach((name, values) -> {
				if (values.size() != rowCount) {
					throw new InconsistentRowCountException(nodeType, name, rowCount, values.size());
				}
			});
		}

		void broadcast(Map<String, Object> values) {
			values.forEach((name, value) -> columns.put(name, new ArrayList<>(nCopies(rowCount, value))));
		}

		Table toTable() {
			return new Table(columns, rowCount);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeExporter.class);
}
