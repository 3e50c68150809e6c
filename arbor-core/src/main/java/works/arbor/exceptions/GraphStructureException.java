package works.arbor.exceptions;

/**
 * The object graph handed to an exporter can't be traversed as configured.
 * Fatal to the export in progress.
 */
public sealed abstract class GraphStructureException extends ExportException permits
	AmbiguousParentException,
	InconsistentRowCountException,
	MissingVisitorException,
	NoParentException,
	NotARootException,
	UnknownNodeTypeException
{
	protected GraphStructureException(String message) {
		super(message);
	}
}
