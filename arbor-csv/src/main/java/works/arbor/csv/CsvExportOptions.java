package works.arbor.csv;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

@Value
@Builder(toBuilder = true)
public class CsvExportOptions {
	public static final String DEFAULT_DISCLAIMER = "These results are preliminary pending validation and "
		+ "database lock. Don’t use this data for any public facing materials or to "
		+ "make final assessments on the efficacy of the treatment being investigated.";

	/**
	 * Written alone on the first line. Null or empty means no disclaimer line at all.
	 */
	@Default @Nullable String disclaimer = DEFAULT_DISCLAIMER;

	/**
	 * Write a single-row export as one line per variable instead of one column per variable.
	 * Intended for subtree exports of one leaf.
	 */
	@Default boolean transpose = false;

	public static CsvExportOptions defaults() {
		return builder().build();
	}

	public boolean hasDisclaimer() {
		return disclaimer != null && !disclaimer.isEmpty();
	}
}
