package works.arbor.exceptions;

/**
 * The exporter, its settings, or one of its annotators is misconfigured.
 * Always raised before any node is visited.
 */
public final class InvalidConfigurationException extends ExportException {
	public InvalidConfigurationException(String message) {
		super(message);
	}

	public InvalidConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
