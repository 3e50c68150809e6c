package works.arbor.document;

import java.util.ArrayList;
import java.util.List;
import works.arbor.Table;
import works.arbor.VariableSchema;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * A finished dataset in a nested, serialization-ready form:
 * column metadata plus row-major cell values, both in schema order.
 *
 * @param studyOid identifies the root of the exported graph
 * @param metaDataVersionOid currently always the same as {@code studyOid}
 * @param itemGroupOid {@value #ITEM_GROUP_PREFIX} followed by the domain
 * @param records the number of rows in {@code itemData}
 */
public record DatasetDocument(
	String studyOid,
	String metaDataVersionOid,
	String itemGroupOid,
	String name,
	String label,
	int records,
	List<ItemDefinition> items,
	List<List<Object>> itemData
) {
	public static final String ITEM_GROUP_PREFIX = "IG.";

	public DatasetDocument {
		requireNonNull(studyOid);
		requireNonNull(metaDataVersionOid);
		requireNonNull(itemGroupOid);
		requireNonNull(name);
		requireNonNull(label);
		items = List.copyOf(items);
		// Cells may be null, so List.copyOf won't do
		List<List<Object>> rows = new ArrayList<>(itemData.size());
		itemData.forEach(row -> rows.add(unmodifiableList(new ArrayList<>(row))));
		itemData = unmodifiableList(rows);
		if (records != itemData.size()) {
			throw new IllegalArgumentException("Document claims " + records + " records but has " + itemData.size());
		}
	}

	/**
	 * @param table must already have exactly the schema's columns, as {@link works.arbor.PostProcessor} leaves it
	 */
	public static DatasetDocument of(String studyOid, String domain, String label, VariableSchema schema, Table table) {
		if (!table.columnNames().equals(schema.oids())) {
			throw new IllegalArgumentException("Table columns " + table.columnNames() + " don't match schema " + schema.oids());
		}
		List<ItemDefinition> items = schema.variables().stream()
			.map(ItemDefinition::of)
			.toList();
		List<List<Object>> itemData = new ArrayList<>(table.rowCount());
		for (int row = 0; row < table.rowCount(); row++) {
			itemData.add(table.rowValues(row));
		}
		return new DatasetDocument(studyOid, studyOid, ITEM_GROUP_PREFIX + domain, domain, label, table.rowCount(), items, itemData);
	}
}
