package works.arbor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One output column.
 *
 * @param oid stable machine identifier, used as the column key
 * @param name short display name
 * @param label human-readable description
 * @param type data type as it should appear in dataset metadata, such as {@code "Char"} or {@code "Num"}
 * @param length maximum length, if the catalog specifies one
 */
public record Variable(
	@NotNull String oid,
	@NotNull String name,
	@NotNull String label,
	@NotNull String type,
	@Nullable Integer length
) {
	public Variable {
		requireNonNull(oid);
		requireNonNull(name);
		requireNonNull(label);
		requireNonNull(type);
		if (oid.isEmpty()) {
			throw new IllegalArgumentException("Variable oid can't be empty");
		}
		if (length != null && length <= 0) {
			throw new IllegalArgumentException("Variable length must be positive: " + oid + " has " + length);
		}
	}

	public static Variable of(String oid, String label, String type, @Nullable Integer length) {
		return new Variable(oid, oid, label, type, length);
	}

	/**
	 * Lets an enum serve as a variable catalog.
	 * The constant's {@link Enum#name() name} becomes the variable's {@link Variable#name() name}.
	 *
	 * @see VariableSchema#fromEnum
	 */
	public interface Definition {
		String oid();
		String label();
		String type();

		@Nullable
		default Integer length() {
			return null;
		}
	}
}
