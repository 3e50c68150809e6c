package works.arbor.annotators;

import works.arbor.Table;
import works.arbor.VariableSchema;
import works.arbor.exceptions.InvalidConfigurationException;

/**
 * A row-enrichment stage that runs after the rows have been sorted.
 * Each annotator writes exactly one column, and may overwrite whatever was already there.
 */
public interface Annotator {
	/**
	 * @return the oid of the column this annotator writes
	 * @throws InvalidConfigurationException if {@code schema} has no suitable variable
	 */
	String targetColumn(VariableSchema schema);

	/**
	 * Called before any traversal happens.
	 *
	 * @throws InvalidConfigurationException if this annotator can't run with the given settings
	 */
	default void validate(AnnotationContext context) {
		targetColumn(context.schema());
	}

	/**
	 * Writes {@link #targetColumn} for every row of {@code table}, in place.
	 */
	void annotate(AnnotationContext context, Table table);
}
