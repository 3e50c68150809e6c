package works.arbor.document;

import org.jetbrains.annotations.Nullable;
import works.arbor.Variable;

import static java.util.Objects.requireNonNull;

/**
 * Metadata for one column of a {@link DatasetDocument}.
 *
 * @param oid the variable oid with the {@value #OID_PREFIX} prefix
 */
public record ItemDefinition(
	String oid,
	String name,
	String label,
	String type,
	@Nullable Integer length
) {
	public static final String OID_PREFIX = "IT.";

	public ItemDefinition {
		requireNonNull(oid);
		requireNonNull(name);
		requireNonNull(label);
		requireNonNull(type);
	}

	public static ItemDefinition of(Variable variable) {
		return new ItemDefinition(OID_PREFIX + variable.oid(), variable.name(), variable.label(), variable.type(), variable.length());
	}
}
