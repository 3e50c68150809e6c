package works.arbor.exceptions;

/**
 * Root of the exceptions raised by an export.
 * <p>
 * None of these are retried: an export is pure computation over a caller-supplied graph,
 * so the caller must correct the configuration or the input and try again.
 */
public sealed abstract class ExportException extends RuntimeException permits InvalidConfigurationException, GraphStructureException {
	protected ExportException(String message) {
		super(message);
	}

	protected ExportException(String message, Throwable cause) {
		super(message, cause);
	}
}
