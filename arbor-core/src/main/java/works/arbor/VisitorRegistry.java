package works.arbor;

import java.util.EnumMap;
import java.util.Map;
import works.arbor.exceptions.InvalidConfigurationException;
import works.arbor.exceptions.MissingVisitorException;

import static java.util.Objects.requireNonNull;

/**
 * Dispatch table from node type to {@link Visitor}.
 */
public final class VisitorRegistry<K extends Enum<K>> {
	private final Map<K, Registration<K, ?>> registrations;

	private VisitorRegistry(Map<K, Registration<K, ?>> registrations) {
		this.registrations = registrations;
	}

	public static <K extends Enum<K>> Builder<K> builder(Class<K> typeClass) {
		return new Builder<>(typeClass);
	}

	public boolean hasVisitor(K typeId) {
		return registrations.containsKey(typeId);
	}

	/**
	 * @throws MissingVisitorException if nothing is registered for {@code typeId}
	 */
	public Map<String, ?> visit(K typeId, Object node, AncestorContext<K> ancestors) {
		Registration<K, ?> registration = registrations.get(typeId);
		if (registration == null) {
			throw new MissingVisitorException(typeId);
		}
		Map<String, ?> result = registration.visit(node, ancestors);
		return (result == null) ? Map.of() : result;
	}

	/**
	 * Checks that every registered visitor accepts the node class declared for its type.
	 */
	void checkCompatibleWith(NodeGraphSpec<K> graph) {
		registrations.forEach((typeId, registration) -> {
			if (!graph.contains(typeId)) {
				throw new InvalidConfigurationException("Visitor registered for undeclared node type " + typeId);
			}
			Class<?> declared = graph.spec(typeId).nodeClass();
			if (!registration.nodeClass().isAssignableFrom(declared)) {
				throw new InvalidConfigurationException("Visitor for " + typeId + " accepts " + registration.nodeClass().getSimpleName() + " but the node class is " + declared.getSimpleName());
			}
		});
	}

	private record Registration<K extends Enum<K>, N>(Class<N> nodeClass, Visitor<K, N> visitor) {
		Map<String, ?> visit(Object node, AncestorContext<K> ancestors) {
			return visitor.visit(nodeClass.cast(node), ancestors);
		}
	}

	public static final class Builder<K extends Enum<K>> {
		private final Map<K, Registration<K, ?>> registrations;

		Builder(Class<K> typeClass) {
			this.registrations = new EnumMap<>(typeClass);
		}

		public <N> Builder<K> register(K typeId, Class<N> nodeClass, Visitor<K, N> visitor) {
			requireNonNull(typeId);
			var old = registrations.put(typeId, new Registration<>(requireNonNull(nodeClass), requireNonNull(visitor)));
			if (old != null) {
				throw new InvalidConfigurationException("Visitor for " + typeId + " is already registered");
			}
			return this;
		}

		public VisitorRegistry<K> build() {
			return new VisitorRegistry<>(new EnumMap<>(registrations));
		}
	}
}
