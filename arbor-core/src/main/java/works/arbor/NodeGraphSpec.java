package works.arbor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import works.arbor.exceptions.InvalidConfigurationException;
import works.arbor.exceptions.UnknownNodeTypeException;

import static java.util.Objects.requireNonNull;

/**
 * The static shape of the object graph: one {@link NodeTypeSpec} per node type.
 * <p>
 * Built once and immutable afterward. The builder checks that
 * there is exactly one root type, at least one leaf type,
 * and that every non-root type's parent chain leads to the root.
 *
 * <pre>{@code
 * NodeGraphSpec<NodeType> graph = NodeGraphSpec.builder(NodeType.class)
 *     .root(STUDY, Study.class, Accessor.attribute("participants"))
 *     .branch(PARTICIPANT, Participant.class, Accessor.attribute("observations"), STUDY, Accessor.attribute("study"))
 *     .leaf(OBSERVATION, Observation.class, PARTICIPANT, Accessor.attribute("participant"))
 *     .build();
 * }</pre>
 */
public final class NodeGraphSpec<K extends Enum<K>> {
	private final Class<K> typeClass;
	private final Map<K, NodeTypeSpec<K>> specsByType;
	private final Map<Class<?>, NodeTypeSpec<K>> specsByClass;
	private final NodeTypeSpec<K> rootSpec;

	private NodeGraphSpec(Class<K> typeClass, List<NodeTypeSpec<K>> specs) {
		this.typeClass = typeClass;
		Map<K, NodeTypeSpec<K>> byType = new EnumMap<>(typeClass);
		Map<Class<?>, NodeTypeSpec<K>> byClass = new HashMap<>();
		NodeTypeSpec<K> root = null;
		boolean anyLeaf = false;
		for (NodeTypeSpec<K> spec : specs) {
			if (byType.put(spec.typeId(), spec) != null) {
				throw new InvalidConfigurationException("Duplicate node type " + spec.typeId());
			}
			NodeTypeSpec<K> sameClass = byClass.put(spec.nodeClass(), spec);
			if (sameClass != null) {
				throw new InvalidConfigurationException("Node types " + sameClass.typeId() + " and " + spec.typeId() + " share the class " + spec.nodeClass().getSimpleName());
			}
			if (spec.isRoot()) {
				if (root != null) {
					throw new InvalidConfigurationException("Graph has more than one root type: " + root.typeId() + " and " + spec.typeId());
				}
				root = spec;
			}
			anyLeaf |= spec.isLeaf();
		}
		if (root == null) {
			throw new InvalidConfigurationException("Graph has no root type");
		}
		if (!anyLeaf) {
			throw new InvalidConfigurationException("Graph has no leaf type");
		}
		for (NodeTypeSpec<K> spec : specs) {
			checkReachesRoot(spec, byType);
		}
		this.specsByType = byType;
		this.specsByClass = byClass;
		this.rootSpec = root;
	}

	private static <K extends Enum<K>> void checkReachesRoot(NodeTypeSpec<K> spec, Map<K, NodeTypeSpec<K>> byType) {
		Set<K> visited = new HashSet<>();
		NodeTypeSpec<K> current = spec;
		while (!current.isRoot()) {
			if (!visited.add(current.typeId())) {
				throw new InvalidConfigurationException("Parent chain of " + spec.typeId() + " has a cycle through " + current.typeId());
			}
			K parentType = current.parentType().orElseThrow();
			NodeTypeSpec<K> parent = byType.get(parentType);
			if (parent == null) {
				throw new InvalidConfigurationException("Parent type " + parentType + " of " + current.typeId() + " is not declared");
			}
			if (parent.isLeaf()) {
				throw new InvalidConfigurationException("Parent type " + parentType + " of " + current.typeId() + " is a leaf");
			}
			current = parent;
		}
	}

	public static <K extends Enum<K>> Builder<K> builder(Class<K> typeClass) {
		return new Builder<>(typeClass);
	}

	public Class<K> typeClass() {
		return typeClass;
	}

	public NodeTypeSpec<K> rootSpec() {
		return rootSpec;
	}

	/**
	 * @return the node types in declaration order of the enum
	 */
	public List<NodeTypeSpec<K>> types() {
		return List.copyOf(specsByType.values());
	}

	public boolean contains(K typeId) {
		return specsByType.containsKey(typeId);
	}

	@NotNull
	public NodeTypeSpec<K> spec(K typeId) {
		NodeTypeSpec<K> result = specsByType.get(typeId);
		if (result == null) {
			throw new IllegalArgumentException("Node type " + typeId + " is not declared");
		}
		return result;
	}

	/**
	 * Resolves a node by its exact runtime class; subclasses are not matched.
	 *
	 * @throws UnknownNodeTypeException if the node's class was not declared
	 */
	@NotNull
	public NodeTypeSpec<K> specFor(Object node) {
		NodeTypeSpec<K> result = specsByClass.get(node.getClass());
		if (result == null) {
			throw new UnknownNodeTypeException(node.getClass());
		}
		return result;
	}

	@Override
	public String toString() {
		return "NodeGraphSpec" + specsByType.values();
	}

	public static final class Builder<K extends Enum<K>> {
		private final Class<K> typeClass;
		private final Map<K, NodeTypeSpec<K>> specs = new LinkedHashMap<>();

		Builder(Class<K> typeClass) {
			this.typeClass = requireNonNull(typeClass);
		}

		public Builder<K> root(K typeId, Class<?> nodeClass, Accessor children) {
			return add(new NodeTypeSpec<>(typeId, nodeClass, requireNonNull(children), null, null));
		}

		public Builder<K> branch(K typeId, Class<?> nodeClass, Accessor children, K parentType, Accessor parent) {
			return add(new NodeTypeSpec<>(typeId, nodeClass, requireNonNull(children), requireNonNull(parentType), requireNonNull(parent)));
		}

		public Builder<K> leaf(K typeId, Class<?> nodeClass, K parentType, Accessor parent) {
			return add(new NodeTypeSpec<>(typeId, nodeClass, null, requireNonNull(parentType), requireNonNull(parent)));
		}

		/**
		 * A graph consisting of a single node type that is both root and leaf.
		 */
		public Builder<K> single(K typeId, Class<?> nodeClass) {
			return add(new NodeTypeSpec<>(typeId, nodeClass, null, null, null));
		}

		private Builder<K> add(NodeTypeSpec<K> spec) {
			if (specs.putIfAbsent(spec.typeId(), spec) != null) {
				throw new InvalidConfigurationException("Duplicate node type " + spec.typeId());
			}
			return this;
		}

		public NodeGraphSpec<K> build() {
			return new NodeGraphSpec<>(typeClass, new ArrayList<>(specs.values()));
		}
	}
}
