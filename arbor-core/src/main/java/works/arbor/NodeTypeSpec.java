package works.arbor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.arbor.exceptions.AmbiguousParentException;
import works.arbor.exceptions.InvalidConfigurationException;

import static java.util.Collections.emptyList;
import static java.util.Objects.requireNonNull;

/**
 * Describes one type of node in the graph: its Java class, how to reach its children,
 * and how to reach its parent.
 * <p>
 * A type with no child accessor is a <em>leaf</em> and contributes one row per instance.
 * The single type with no parent is the <em>root</em>.
 */
public final class NodeTypeSpec<K extends Enum<K>> {
	private final K typeId;
	private final Class<?> nodeClass;
	private final Accessor childAccessor;
	private final K parentType;
	private final Accessor parentAccessor;
	private final Function<Object, Object> childReader;
	private final Function<Object, Object> parentReader;

	NodeTypeSpec(
		@NotNull K typeId,
		@NotNull Class<?> nodeClass,
		@Nullable Accessor childAccessor,
		@Nullable K parentType,
		@Nullable Accessor parentAccessor
	) {
		this.typeId = requireNonNull(typeId);
		this.nodeClass = requireNonNull(nodeClass);
		if ((parentType == null) != (parentAccessor == null)) {
			throw new InvalidConfigurationException("Node type " + typeId + " must declare both a parent type and a parent accessor, or neither");
		}
		this.childAccessor = childAccessor;
		this.parentType = parentType;
		this.parentAccessor = parentAccessor;
		this.childReader = bind(childAccessor, "child");
		this.parentReader = bind(parentAccessor, "parent");
	}

	private Function<Object, Object> bind(Accessor accessor, String role) {
		if (accessor == null) {
			return null;
		}
		try {
			return accessor.bind(nodeClass);
		} catch (IllegalArgumentException e) {
			throw new InvalidConfigurationException("Invalid " + role + " accessor for node type " + typeId + ": " + e.getMessage(), e);
		}
	}

	public K typeId() {
		return typeId;
	}

	public Class<?> nodeClass() {
		return nodeClass;
	}

	public Optional<Accessor> childAccessor() {
		return Optional.ofNullable(childAccessor);
	}

	public Optional<K> parentType() {
		return Optional.ofNullable(parentType);
	}

	public Optional<Accessor> parentAccessor() {
		return Optional.ofNullable(parentAccessor);
	}

	public boolean isLeaf() {
		return childAccessor == null;
	}

	public boolean isRoot() {
		return parentAccessor == null;
	}

	/**
	 * @return the children of {@code node} in accessor order; empty for a leaf
	 */
	public List<Object> children(Object node) {
		if (childReader == null) {
			return emptyList();
		}
		return asList(resolveLazy(childReader.apply(node)));
	}

	/**
	 * @return the parent of {@code node}, or null for the root
	 * @throws AmbiguousParentException if the accessor yields a collection
	 */
	@Nullable
	public Object parent(Object node) {
		if (parentReader == null) {
			return null;
		}
		Object value = resolveLazy(parentReader.apply(node));
		if (isCollectionLike(value)) {
			throw new AmbiguousParentException(typeId, value);
		}
		if (value instanceof Optional<?> o) {
			return o.orElse(null);
		}
		return value;
	}

	/**
	 * A {@link Supplier} stands for a relation that hasn't been loaded yet.
	 */
	private static Object resolveLazy(Object value) {
		while (value instanceof Supplier<?> s) {
			value = s.get();
		}
		return value;
	}

	private static boolean isCollectionLike(Object value) {
		return value instanceof Iterable<?>
			|| value instanceof Iterator<?>
			|| value instanceof Stream<?>
			|| (value != null && value.getClass().isArray());
	}

	private static List<Object> asList(Object value) {
		if (value == null) {
			return emptyList();
		} else if (value instanceof Collection<?> c) {
			return new ArrayList<>(c);
		} else if (value instanceof Iterable<?> i) {
			List<Object> result = new ArrayList<>();
			i.forEach(result::add);
			return result;
		} else if (value instanceof Iterator<?> i) {
			List<Object> result = new ArrayList<>();
			i.forEachRemaining(result::add);
			return result;
		} else if (value instanceof Stream<?> s) {
			try (s) {
				return new ArrayList<>(s.toList());
			}
		} else if (value instanceof Object[] array) {
			return new ArrayList<>(Arrays.asList(array));
		} else if (value instanceof Optional<?> o) {
			List<Object> result = new ArrayList<>();
			o.ifPresent(result::add);
			return result;
		} else {
			List<Object> result = new ArrayList<>();
			result.add(value);
			return result;
		}
	}

	@Override
	public String toString() {
		return "NodeTypeSpec{" + typeId
			+ ", " + nodeClass.getSimpleName()
			+ ", children=" + childAccessor
			+ ", parent=" + parentType + parentAccessor
			+ "}";
	}
}
