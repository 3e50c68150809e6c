package works.arbor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Singular;
import lombok.Value;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.annotators.AnnotationContext;
import works.arbor.annotators.Annotator;
import works.arbor.exceptions.InvalidConfigurationException;

import static java.util.Collections.nCopies;

/**
 * Describes how a raw traversal table becomes a finished dataset.
 *
 * @see PostProcessor
 */
@Value
@Builder(toBuilder = true)
public class ExportSettings {
	/**
	 * Short dataset name written into every row, like {@code "AE"}. Required.
	 */
	String domain;

	/**
	 * The oid of the schema variable that receives {@link #domain}. Required.
	 */
	String domainVariable;

	/**
	 * Long dataset description, like {@code "Adverse Events"}.
	 * Only structured document export needs it.
	 */
	@Nullable String label;

	/**
	 * Values written to every row, overriding anything the visitors produced for the same oid.
	 */
	@Singular Map<String, Object> constants;

	/**
	 * Oids to sort by, most significant first. Empty means rows stay in traversal order.
	 */
	@Singular List<String> sortKeys;

	/**
	 * Either a single direction applied to every sort key,
	 * or one direction per entry of {@link #sortKeys}.
	 */
	@Default List<SortDirection> sortOrder = List.of(SortDirection.ASC);

	/**
	 * Run in order after sorting. Any annotator requires {@link #sortKeys}.
	 */
	@Singular List<Annotator> annotators;

	/**
	 * @return one direction for each sort key
	 */
	public List<SortDirection> sortDirections() {
		if (sortOrder.size() == 1) {
			return nCopies(sortKeys.size(), sortOrder.get(0));
		} else {
			return sortOrder;
		}
	}

	/**
	 * Checks these settings against {@code schema}.
	 * Runs before any traversal so that mistakes are reported without visiting a single node.
	 *
	 * @throws InvalidConfigurationException if the settings can't produce a valid export
	 */
	public void validate(VariableSchema schema) {
		if (domain == null || domain.isEmpty()) {
			throw new InvalidConfigurationException("Domain must be set");
		}
		if (domainVariable == null || domainVariable.isEmpty()) {
			throw new InvalidConfigurationException("Domain variable must be set");
		}
		if (!schema.contains(domainVariable)) {
			throw new InvalidConfigurationException("Domain variable \"" + domainVariable + "\" is not in the schema");
		}
		if (sortOrder.isEmpty()) {
			throw new InvalidConfigurationException("Sort order must have at least one direction");
		}
		if (sortOrder.size() != 1 && sortOrder.size() != sortKeys.size()) {
			throw new InvalidConfigurationException("Sort order has " + sortOrder.size() + " directions for " + sortKeys.size() + " sort keys");
		}
		if (sortOrder.stream().anyMatch(Objects::isNull)) {
			throw new InvalidConfigurationException("Sort order contains null");
		}
		List<String> unknownSortKeys = new ArrayList<>();
		for (String key : sortKeys) {
			if (!schema.contains(key)) {
				unknownSortKeys.add(key);
			}
		}
		if (!unknownSortKeys.isEmpty()) {
			throw new InvalidConfigurationException("Sort keys are not in the schema: " + unknownSortKeys);
		}
		if (!annotators.isEmpty() && sortKeys.isEmpty()) {
			throw new InvalidConfigurationException("Sort keys must be set when using annotators");
		}
		AnnotationContext context = new AnnotationContext(schema, this);
		for (Annotator annotator : annotators) {
			annotator.validate(context);
		}
		constants.keySet().forEach(oid -> {
			if (!schema.contains(oid)) {
				LOGGER.warn("Constant \"{}\" is not in the schema and will not be exported", oid);
			}
		});
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ExportSettings.class);
}
