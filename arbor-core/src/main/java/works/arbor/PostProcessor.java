package works.arbor;

import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.annotators.AnnotationContext;
import works.arbor.annotators.Annotator;
import works.arbor.exceptions.InvalidConfigurationException;
import works.arbor.util.CellComparator;

import static java.util.Objects.requireNonNull;

/**
 * Turns the raw output of a {@link TreeExporter} into a table whose columns are exactly the schema's, in schema order.
 * <p>
 * The steps always run in this order:
 * <ol>
 *     <li>write the domain into the domain variable of every row;</li>
 *     <li>write the constants, overriding traversal values of the same name;</li>
 *     <li>add every missing schema column, filled with empty strings;</li>
 *     <li>stable sort by the sort keys;</li>
 *     <li>run the annotators, which therefore see the final row order;</li>
 *     <li>reorder the columns to match the schema, dropping the rest.</li>
 * </ol>
 */
public final class PostProcessor {
	private final VariableSchema schema;
	private final ExportSettings settings;

	/**
	 * @throws InvalidConfigurationException if {@code settings} are not valid for {@code schema}
	 */
	public PostProcessor(VariableSchema schema, ExportSettings settings) {
		this.schema = requireNonNull(schema);
		this.settings = requireNonNull(settings);
		settings.validate(schema);
	}

	public VariableSchema schema() {
		return schema;
	}

	public ExportSettings settings() {
		return settings;
	}

	/**
	 * Modifies {@code table} in place.
	 *
	 * @return {@code table}
	 */
	public Table process(Table table) {
		table.fill(settings.domainVariable(), settings.domain());
		settings.constants().forEach(table::fill);
		addMissingColumns(table);
		sort(table);
		annotate(table);
		table.selectColumns(schema.oids());
		LOGGER.debug("Post-processed {} rows for domain {}", table.rowCount(), settings.domain());
		return table;
	}

	private void addMissingColumns(Table table) {
		for (String oid : schema.oids()) {
			if (!table.hasColumn(oid)) {
				LOGGER.trace("No values for {}; filling with empty strings", oid);
				table.fill(oid, "");
			}
		}
	}

	private void sort(Table table) {
		List<String> keys = settings.sortKeys();
		if (keys.isEmpty()) {
			return;
		}
		List<SortDirection> directions = settings.sortDirections();
		Comparator<Integer> comparator = null;
		for (int i = 0; i < keys.size(); i++) {
			Comparator<Integer> byKey = byColumn(table.column(keys.get(i)), directions.get(i));
			comparator = (comparator == null) ? byKey : comparator.thenComparing(byKey);
		}
		table.sortRows(comparator);
	}

	private static Comparator<Integer> byColumn(List<Object> values, SortDirection direction) {
		CellComparator cells = (direction == SortDirection.DESC) ? CellComparator.DESCENDING : CellComparator.ASCENDING;
		return (a, b) -> cells.compare(values.get(a), values.get(b));
	}

	private void annotate(Table table) {
		List<Annotator> annotators = settings.annotators();
		if (annotators.isEmpty()) {
			return;
		}
		AnnotationContext context = new AnnotationContext(schema, settings);
		for (Annotator annotator : annotators) {
			annotator.annotate(context, table);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PostProcessor.class);
}
