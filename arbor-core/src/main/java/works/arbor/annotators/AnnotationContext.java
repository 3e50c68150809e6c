package works.arbor.annotators;

import works.arbor.ExportSettings;
import works.arbor.VariableSchema;

import static java.util.Objects.requireNonNull;

/**
 * What an {@link Annotator} may consult about the export it's taking part in.
 */
public record AnnotationContext(VariableSchema schema, ExportSettings settings) {
	public AnnotationContext {
		requireNonNull(schema);
		requireNonNull(settings);
	}
}
