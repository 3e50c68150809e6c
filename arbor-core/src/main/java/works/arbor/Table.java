package works.arbor;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.nCopies;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * An ordered set of named columns, all with the same number of rows.
 * <p>
 * Created by {@link TreeExporter}, modified in place by {@link PostProcessor},
 * and only read from then on. Cells may be null.
 * Not thread-safe.
 */
public final class Table {
	private final LinkedHashMap<String, List<Object>> columns;
	private final int rowCount;

	Table(LinkedHashMap<String, List<Object>> columns, int rowCount) {
		columns.forEach((name, values) -> {
			if (values.size() != rowCount) {
				throw new IllegalArgumentException("Column \"" + name + "\" has " + values.size() + " rows, expected " + rowCount);
			}
		});
		this.columns = columns;
		this.rowCount = rowCount;
	}

	public static Table empty() {
		return new Table(new LinkedHashMap<>(), 0);
	}

	/**
	 * @param columns column name to values; every list must have the same size
	 */
	public static Table of(Map<String, ? extends List<?>> columns) {
		LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<>();
		int rows = -1;
		for (var entry : columns.entrySet()) {
			copy.put(entry.getKey(), new ArrayList<>(entry.getValue()));
			if (rows == -1) {
				rows = entry.getValue().size();
			}
		}
		return new Table(copy, Math.max(rows, 0));
	}

	public int rowCount() {
		return rowCount;
	}

	public List<String> columnNames() {
		return List.copyOf(columns.keySet());
	}

	public boolean hasColumn(String name) {
		return columns.containsKey(name);
	}

	/**
	 * @return a read-only view of the column's values
	 * @throws IllegalArgumentException if there's no such column
	 */
	public List<Object> column(String name) {
		return unmodifiableList(requireColumn(name));
	}

	@Nullable
	public Object get(int row, String column) {
		return requireColumn(column).get(checkRow(row));
	}

	public void set(int row, String column, @Nullable Object value) {
		requireColumn(column).set(checkRow(row), value);
	}

	/**
	 * Sets every row of {@code column} to {@code value}, adding the column at the end if it's absent.
	 */
	public void fill(String column, @Nullable Object value) {
		columns.put(column, new ArrayList<>(nCopies(rowCount, value)));
	}

	/**
	 * Adds the column at the end, or replaces its values if it already exists.
	 */
	public void putColumn(String column, List<?> values) {
		if (values.size() != rowCount) {
			throw new IllegalArgumentException("Column \"" + column + "\" has " + values.size() + " rows, expected " + rowCount);
		}
		columns.put(column, new ArrayList<>(values));
	}

	public void removeColumn(String column) {
		columns.remove(column);
	}

	/**
	 * @return a read-only view of one row, keyed by column name in column order
	 */
	public Map<String, Object> row(int row) {
		checkRow(row);
		LinkedHashMap<String, Object> result = new LinkedHashMap<>();
		columns.forEach((name, values) -> result.put(name, values.get(row)));
		return unmodifiableMap(result);
	}

	public List<Map<String, Object>> rows() {
		return new AbstractList<>() {
			@Override
			public Map<String, Object> get(int index) {
				return row(index);
			}

			@Override
			public int size() {
				return rowCount;
			}
		};
	}

	/**
	 * @return the cells of one row in column order
	 */
	public List<Object> rowValues(int row) {
		checkRow(row);
		List<Object> result = new ArrayList<>(columns.size());
		columns.values().forEach(values -> result.add(values.get(row)));
		return result;
	}

	/**
	 * Reorders the rows. {@link List#sort} is stable, so rows the comparator considers equal keep their relative order.
	 *
	 * @param rowComparator compares row indexes
	 */
	public void sortRows(Comparator<Integer> rowComparator) {
		List<Integer> order = new ArrayList<>(IntStream.range(0, rowCount).boxed().toList());
		order.sort(rowComparator);
		columns.replaceAll((name, values) -> {
			List<Object> reordered = new ArrayList<>(rowCount);
			order.forEach(i -> reordered.add(values.get(i)));
			return reordered;
		});
	}

	/**
	 * Makes the columns exactly {@code names}, in that order, discarding all others.
	 *
	 * @throws IllegalStateException if one of {@code names} is not a column
	 */
	public void selectColumns(List<String> names) {
		LinkedHashMap<String, List<Object>> selected = new LinkedHashMap<>();
		for (String name : names) {
			List<Object> values = columns.get(name);
			if (values == null) {
				throw new IllegalStateException("Column \"" + name + "\" is missing");
			}
			selected.put(name, values);
		}
		columns.clear();
		columns.putAll(selected);
	}

	private List<Object> requireColumn(String name) {
		List<Object> values = columns.get(name);
		if (values == null) {
			throw new IllegalArgumentException("No such column: \"" + name + "\"");
		}
		return values;
	}

	private int checkRow(int row) {
		if (row < 0 || row >= rowCount) {
			throw new IndexOutOfBoundsException("Row " + row + " of " + rowCount);
		}
		return row;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Table that = (Table) o;
		return rowCount == that.rowCount
			&& List.copyOf(columns.keySet()).equals(List.copyOf(that.columns.keySet()))
			&& columns.equals(that.columns);
	}

	@Override
	public int hashCode() {
		return columns.hashCode() * 31 + rowCount;
	}

	@Override
	public String toString() {
		return "Table{" + rowCount + " rows, columns=" + columns.keySet() + "}";
	}
}
