package works.arbor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;

import static java.util.Arrays.asList;

/**
 * The ordered catalog of output columns.
 * <p>
 * The order here is the column order of every export.
 * It is never inferred from the order in which visitors happen to produce values.
 */
public final class VariableSchema {
	private final Map<String, Variable> variablesByOid;

	private VariableSchema(List<Variable> variables) {
		Map<String, Variable> map = new LinkedHashMap<>();
		for (Variable v : variables) {
			Variable existing = map.putIfAbsent(v.oid(), v);
			if (existing != null) {
				throw new IllegalArgumentException("Duplicate variable oid \"" + v.oid() + "\"");
			}
		}
		this.variablesByOid = Collections.unmodifiableMap(map);
	}

	public static VariableSchema of(Variable... variables) {
		return new VariableSchema(asList(variables));
	}

	public static VariableSchema of(List<Variable> variables) {
		return new VariableSchema(variables);
	}

	/**
	 * @return a schema containing one variable per constant of {@code enumClass}, in declaration order
	 */
	public static <E extends Enum<E> & Variable.Definition> VariableSchema fromEnum(Class<E> enumClass) {
		List<Variable> variables = new ArrayList<>();
		for (E e : enumClass.getEnumConstants()) {
			variables.add(new Variable(e.oid(), e.name(), e.label(), e.type(), e.length()));
		}
		return new VariableSchema(variables);
	}

	@NotNull
	public List<Variable> variables() {
		return List.copyOf(variablesByOid.values());
	}

	@NotNull
	public List<String> oids() {
		return List.copyOf(variablesByOid.keySet());
	}

	public int size() {
		return variablesByOid.size();
	}

	public boolean contains(String oid) {
		return variablesByOid.containsKey(oid);
	}

	public Optional<Variable> get(String oid) {
		return Optional.ofNullable(variablesByOid.get(oid));
	}

	/**
	 * Looks up a variable by {@link Variable#name() name} first, then by {@link Variable#oid() oid}.
	 */
	public Optional<Variable> find(String nameOrOid) {
		for (Variable v : variablesByOid.values()) {
			if (v.name().equals(nameOrOid)) {
				return Optional.of(v);
			}
		}
		return get(nameOrOid);
	}

	@Override
	public String toString() {
		return "VariableSchema" + variablesByOid.keySet();
	}
}
