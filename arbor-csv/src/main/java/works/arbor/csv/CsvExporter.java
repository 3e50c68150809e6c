package works.arbor.csv;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.supercsv.cellprocessor.ift.CellProcessor;
import org.supercsv.io.CsvListWriter;
import org.supercsv.io.ICsvListWriter;
import org.supercsv.prefs.CsvPreference;
import works.arbor.DatasetExporter;
import works.arbor.Table;
import works.arbor.Variable;
import works.arbor.VariableSchema;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Writes the output of a {@link DatasetExporter} as comma-separated values.
 * <p>
 * Lines end with CRLF, and cells are quoted only when they contain a comma, a quote, or a line break.
 * The whole table is computed before anything is written, so a failed export writes nothing.
 */
public final class CsvExporter {
	static final List<String> TRANSPOSED_HEADER = List.of("Name", "Value", "Description");

	private static final CsvPreference PREFERENCE = new CsvPreference.Builder('"', ',', "\r\n").build();

	private final DatasetExporter<?> exporter;
	private final CsvExportOptions options;

	public CsvExporter(DatasetExporter<?> exporter) {
		this(exporter, CsvExportOptions.defaults());
	}

	public CsvExporter(DatasetExporter<?> exporter, CsvExportOptions options) {
		this.exporter = requireNonNull(exporter);
		this.options = requireNonNull(options);
	}

	public CsvExportOptions options() {
		return options;
	}

	public void write(Writer out) throws IOException {
		write(out, null);
	}

	/**
	 * Flushes {@code out} but does not close it.
	 *
	 * @param subtree if not null, only rows beneath this node are written
	 * @throws IllegalArgumentException if transposing and the export doesn't have exactly one row
	 */
	public void write(Writer out, @Nullable Object subtree) throws IOException {
		requireNonNull(out);
		Table table = exportTable(subtree);
		ICsvListWriter csv = new CsvListWriter(out, PREFERENCE);
		try {
			render(csv, table);
		} finally {
			// Closing the CSV writer would close the caller's writer
			csv.flush();
		}
	}

	/**
	 * Creates or truncates {@code file}, writing it as UTF-8.
	 *
	 * @param subtree if not null, only rows beneath this node are written
	 */
	public void write(Path file, @Nullable Object subtree) throws IOException {
		Table table = exportTable(subtree);
		try (ICsvListWriter csv = new CsvListWriter(Files.newBufferedWriter(file, UTF_8), PREFERENCE)) {
			render(csv, table);
		}
		LOGGER.debug("Wrote {}", file);
	}

	public String writeToString(@Nullable Object subtree) throws IOException {
		StringWriter result = new StringWriter();
		write(result, subtree);
		return result.toString();
	}

	private Table exportTable(@Nullable Object subtree) {
		Table table = exporter.export(subtree);
		if (options.transpose() && table.rowCount() != 1) {
			throw new IllegalArgumentException("Can only transpose an export of exactly one row; got " + table.rowCount());
		}
		return table;
	}

	private void render(ICsvListWriter csv, Table table) throws IOException {
		if (options.hasDisclaimer()) {
			csv.write(options.disclaimer());
		}
		VariableSchema schema = exporter.schema();
		if (options.transpose()) {
			csv.writeHeader(TRANSPOSED_HEADER.toArray(new String[0]));
			for (Variable variable : schema.variables()) {
				csv.write(variable.oid(), CellFormatter.format(table.get(0, variable.oid())), variable.name());
			}
			LOGGER.debug("Wrote {} variables transposed", schema.size());
		} else {
			csv.writeHeader(schema.oids().toArray(new String[0]));
			CellProcessor[] processors = new CellProcessor[schema.size()];
			Arrays.fill(processors, new CellFormatter());
			for (int row = 0; row < table.rowCount(); row++) {
				csv.write(table.rowValues(row), processors);
			}
			LOGGER.debug("Wrote {} rows of {} columns", table.rowCount(), schema.size());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CsvExporter.class);
}
