package works.arbor.csv;

import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import org.supercsv.cellprocessor.CellProcessorAdaptor;
import org.supercsv.util.CsvContext;

import static java.time.format.DateTimeFormatter.ISO_INSTANT;
import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE;
import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE_TIME;
import static java.time.format.DateTimeFormatter.ISO_LOCAL_TIME;
import static java.time.format.DateTimeFormatter.ISO_OFFSET_DATE_TIME;

/**
 * Renders one table cell as text.
 * <ul>
 *     <li>{@code null} becomes the empty string;</li>
 *     <li>booleans, and the exact strings {@code "Yes"} and {@code "No"}, become {@code Y} and {@code N};</li>
 *     <li>dates and times become ISO-8601; JDBC dates, times and timestamps keep their local calendar fields;</li>
 *     <li>anything else uses {@link Object#toString()}.</li>
 * </ul>
 */
public class CellFormatter extends CellProcessorAdaptor {

	@Override
	public <T> T execute(Object value, CsvContext context) {
		return next.execute(format(value), context);
	}

	public static String format(Object value) {
		if (value == null) {
			return "";
		} else if (Boolean.TRUE.equals(value) || "Yes".equals(value)) {
			return "Y";
		} else if (Boolean.FALSE.equals(value) || "No".equals(value)) {
			return "N";
		} else if (value instanceof LocalDate d) {
			return ISO_LOCAL_DATE.format(d);
		} else if (value instanceof LocalDateTime d) {
			return ISO_LOCAL_DATE_TIME.format(d);
		} else if (value instanceof LocalTime t) {
			return ISO_LOCAL_TIME.format(t);
		} else if (value instanceof OffsetDateTime d) {
			return ISO_OFFSET_DATE_TIME.format(d);
		} else if (value instanceof ZonedDateTime d) {
			return ISO_OFFSET_DATE_TIME.format(d);
		} else if (value instanceof Instant i) {
			return ISO_INSTANT.format(i);
		} else if (value instanceof java.sql.Date d) {
			return ISO_LOCAL_DATE.format(d.toLocalDate());
		} else if (value instanceof Timestamp t) {
			return ISO_LOCAL_DATE_TIME.format(t.toLocalDateTime());
		} else if (value instanceof Time t) {
			return ISO_LOCAL_TIME.format(t.toLocalTime());
		} else if (value instanceof Date d) {
			return ISO_INSTANT.format(d.toInstant());
		} else {
			return value.toString();
		}
	}
}
