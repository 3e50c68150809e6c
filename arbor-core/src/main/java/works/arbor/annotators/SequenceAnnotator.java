package works.arbor.annotators;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.Table;
import works.arbor.Variable;
import works.arbor.VariableSchema;
import works.arbor.exceptions.InvalidConfigurationException;

import static java.util.Objects.requireNonNull;

/**
 * Numbers rows within groups, starting from 1, in the table's current row order.
 * Rows are grouped by the values of the {@link #groupBy} columns, which default to the sort keys.
 * <p>
 * For example, grouped by {@code SUBJECT_ID}:
 *
 * <pre>
 * SUBJECT_ID  VALUE  SEQUENCE_NUMBER
 * s001        10     1
 * s001        20     2
 * s002        10     1
 * </pre>
 *
 * The counters are written as strings.
 */
public final class SequenceAnnotator implements Annotator {
	public static final String DEFAULT_TARGET = "SEQUENCE_NUMBER";

	private final @Nullable List<String> groupBy;
	private final String target;

	private SequenceAnnotator(@Nullable List<String> groupBy, String target) {
		this.groupBy = (groupBy == null) ? null : List.copyOf(groupBy);
		this.target = requireNonNull(target);
	}

	/**
	 * Groups by the sort keys and writes to the variable named {@value #DEFAULT_TARGET}.
	 */
	public static SequenceAnnotator create() {
		return new SequenceAnnotator(null, DEFAULT_TARGET);
	}

	public SequenceAnnotator groupedBy(String... oids) {
		return new SequenceAnnotator(List.of(oids), target);
	}

	/**
	 * @param nameOrOid the variable to write, looked up by display name first, then by oid
	 */
	public SequenceAnnotator writingTo(String nameOrOid) {
		return new SequenceAnnotator(groupBy, nameOrOid);
	}

	@Override
	public String targetColumn(VariableSchema schema) {
		return schema.find(target)
			.map(Variable::oid)
			.orElseThrow(() -> new InvalidConfigurationException("Sequence target \"" + target + "\" is not in the schema"));
	}

	@Override
	public void validate(AnnotationContext context) {
		Annotator.super.validate(context);
		if (groupBy != null) {
			for (String oid : groupBy) {
				if (!context.schema().contains(oid)) {
					throw new InvalidConfigurationException("Sequence grouping column \"" + oid + "\" is not in the schema");
				}
			}
		}
	}

	@Override
	public void annotate(AnnotationContext context, Table table) {
		String column = targetColumn(context.schema());
		List<String> keys = (groupBy == null) ? context.settings().sortKeys() : groupBy;
		Map<List<Object>, Integer> counters = new HashMap<>();
		List<String> values = new ArrayList<>(table.rowCount());
		for (int row = 0; row < table.rowCount(); row++) {
			List<Object> group = new ArrayList<>(keys.size());
			for (String key : keys) {
				group.add(table.get(row, key));
			}
			values.add(counters.merge(group, 1, Integer::sum).toString());
		}
		table.putColumn(column, values);
		LOGGER.debug("Numbered {} rows in {} groups into {}", table.rowCount(), counters.size(), column);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SequenceAnnotator.class);
}
