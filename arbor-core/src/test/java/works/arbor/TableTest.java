package works.arbor;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static java.util.Comparator.comparing;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableTest {

	static Table table(Object... namesAndColumns) {
		LinkedHashMap<String, List<?>> columns = new LinkedHashMap<>();
		for (int i = 0; i < namesAndColumns.length; i += 2) {
			columns.put((String) namesAndColumns[i], (List<?>) namesAndColumns[i + 1]);
		}
		return Table.of(columns);
	}

	@Test
	void rows_followColumnOrder() {
		Table table = table("B", List.of(1, 2), "A", List.of("x", "y"));

		assertEquals(2, table.rowCount());
		assertEquals(List.of("B", "A"), table.columnNames());
		assertEquals(List.of(2, "y"), table.rowValues(1));
		assertEquals(List.of("B", "A"), List.copyOf(table.row(0).keySet()));
		assertEquals(2, table.rows().size());
		assertEquals("x", table.rows().get(0).get("A"));
	}

	@Test
	void mismatchedColumns_throws() {
		assertThrows(IllegalArgumentException.class, () -> table("A", List.of(1), "B", List.of(1, 2)));
	}

	@Test
	void fill_replacesInPlaceOrAppends() {
		Table table = table("A", List.of(1, 2), "B", List.of(3, 4));

		table.fill("A", "a");
		table.fill("C", null);

		assertEquals(List.of("A", "B", "C"), table.columnNames());
		assertEquals(List.of("a", "a"), table.column("A"));
		assertEquals(Arrays.asList(null, null), table.column("C"));
	}

	@Test
	void putColumn_wrongSize_throws() {
		Table table = table("A", List.of(1, 2));
		assertThrows(IllegalArgumentException.class, () -> table.putColumn("B", List.of(1)));
	}

	@Test
	void sortRows_isStable() {
		Table table = table(
			"KEY", List.of(2, 1, 2, 1),
			"ORIGINAL_POSITION", List.of(0, 1, 2, 3));
		List<Object> keys = table.column("KEY");

		table.sortRows(comparing(i -> (Integer) keys.get(i)));

		assertEquals(List.of(1, 1, 2, 2), table.column("KEY"));
		assertEquals(List.of(1, 3, 0, 2), table.column("ORIGINAL_POSITION"));
	}

	@Test
	void selectColumns_reordersAndDrops() {
		Table table = table("A", List.of(1), "B", List.of(2), "C", List.of(3));

		table.selectColumns(List.of("C", "A"));

		assertEquals(List.of("C", "A"), table.columnNames());
		assertFalse(table.hasColumn("B"));
	}

	@Test
	void selectMissingColumn_throws() {
		Table table = table("A", List.of(1));
		assertThrows(IllegalStateException.class, () -> table.selectColumns(List.of("A", "Z")));
	}

	@Test
	void missingColumn_throws() {
		Table table = table("A", List.of(1));
		assertThrows(IllegalArgumentException.class, () -> table.column("Z"));
		assertThrows(IndexOutOfBoundsException.class, () -> table.get(1, "A"));
	}

	@Test
	void columnView_isReadOnly() {
		Table table = table("A", List.of(1));
		assertThrows(UnsupportedOperationException.class, () -> table.column("A").set(0, 2));
		assertThrows(UnsupportedOperationException.class, () -> table.row(0).put("A", 2));
	}

	@Test
	void equality_dependsOnColumnOrder() {
		assertEquals(table("A", List.of(1), "B", List.of(2)), table("A", List.of(1), "B", List.of(2)));
		assertFalse(table("A", List.of(1), "B", List.of(2)).equals(table("B", List.of(2), "A", List.of(1))));
		assertEquals(Table.empty(), Table.of(Map.of()));
	}
}
