package works.arbor;

import java.util.function.Function;
import works.arbor.util.ReflectionHelpers;

import static java.util.Objects.requireNonNull;

/**
 * How to get from a node to its children or to its parent.
 * <p>
 * The configurer picks one of the two forms explicitly,
 * and it's bound to the node class once, when the {@link NodeGraphSpec} is built.
 */
public sealed interface Accessor permits Accessor.AttributePath, Accessor.Derived {

	/**
	 * @return a function that evaluates this accessor on instances of {@code nodeClass}
	 * @throws IllegalArgumentException if this accessor doesn't apply to {@code nodeClass}
	 */
	Function<Object, Object> bind(Class<?> nodeClass);

	static Accessor attribute(String name) {
		return new AttributePath(name);
	}

	@SuppressWarnings("unchecked")
	static <N> Accessor function(Class<N> nodeClass, Function<? super N, ?> function) {
		requireNonNull(nodeClass);
		requireNonNull(function);
		return new Derived(nodeClass, node -> ((Function<Object, Object>) function).apply(nodeClass.cast(node)));
	}

	/**
	 * Reads the named attribute of the node.
	 *
	 * @see ReflectionHelpers#attributeReader
	 */
	record AttributePath(String name) implements Accessor {
		public AttributePath {
			requireNonNull(name);
		}

		@Override
		public Function<Object, Object> bind(Class<?> nodeClass) {
			return ReflectionHelpers.attributeReader(nodeClass, name);
		}

		@Override
		public String toString() {
			return "." + name;
		}
	}

	/**
	 * Computes the result from the node with an arbitrary function.
	 */
	record Derived(Class<?> nodeClass, Function<Object, Object> function) implements Accessor {
		@Override
		public Function<Object, Object> bind(Class<?> boundClass) {
			if (!nodeClass.isAssignableFrom(boundClass)) {
				throw new IllegalArgumentException("Accessor for " + nodeClass.getSimpleName() + " can't be applied to " + boundClass.getSimpleName());
			}
			return function;
		}

		@Override
		public String toString() {
			return "Derived(" + nodeClass.getSimpleName() + ")";
		}
	}
}
