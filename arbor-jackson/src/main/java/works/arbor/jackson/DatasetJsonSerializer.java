package works.arbor.jackson;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;
import works.arbor.document.DatasetDocument;
import works.arbor.document.ItemDefinition;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Renders a {@link DatasetDocument} in the Dataset-JSON layout:
 *
 * <pre>{@code
 * {"clinicalData": {
 *     "studyOID": ..., "metaDataVersionOID": ...,
 *     "itemGroupData": {"IG.<domain>": {
 *         "records": ..., "name": ..., "label": ...,
 *         "items": [{"OID": "IT.<oid>", "name": ..., "label": ..., "type": ..., "length": ...}, ...],
 *         "itemData": [[...], ...]
 *     }}
 * }}
 * }</pre>
 *
 * {@code length} is omitted for items that have none.
 * Cell values are written with the mapper's ordinary serialization,
 * so numbers stay numbers and strings stay strings.
 */
public final class DatasetJsonSerializer {
	private final ObjectMapper mapper;

	public DatasetJsonSerializer() {
		this(JsonMapper.builder().build());
	}

	public DatasetJsonSerializer(ObjectMapper mapper) {
		this.mapper = requireNonNull(mapper);
	}

	public ObjectMapper mapper() {
		return mapper;
	}

	public JsonNode toJsonNode(DatasetDocument document) {
		ObjectNode clinicalData = mapper.createObjectNode();
		clinicalData.put("studyOID", document.studyOid());
		clinicalData.put("metaDataVersionOID", document.metaDataVersionOid());

		ObjectNode itemGroup = clinicalData
			.putObject("itemGroupData")
			.putObject(document.itemGroupOid());
		itemGroup.put("records", document.records());
		itemGroup.put("name", document.name());
		itemGroup.put("label", document.label());

		ArrayNode items = itemGroup.putArray("items");
		for (ItemDefinition item : document.items()) {
			ObjectNode itemNode = items.addObject();
			itemNode.put("OID", item.oid());
			itemNode.put("name", item.name());
			itemNode.put("label", item.label());
			itemNode.put("type", item.type());
			if (item.length() != null) {
				itemNode.put("length", item.length().intValue());
			}
		}

		ArrayNode itemData = itemGroup.putArray("itemData");
		for (List<Object> row : document.itemData()) {
			ArrayNode rowNode = itemData.addArray();
			for (Object cell : row) {
				if (cell == null) {
					rowNode.addNull();
				} else {
					rowNode.add(mapper.<JsonNode>valueToTree(cell));
				}
			}
		}

		ObjectNode result = mapper.createObjectNode();
		result.set("clinicalData", clinicalData);
		LOGGER.debug("Rendered {} with {} records", document.itemGroupOid(), document.records());
		return result;
	}

	public String writeValueAsString(DatasetDocument document) {
		return mapper.writeValueAsString(toJsonNode(document));
	}

	/**
	 * Flushes {@code out} but does not close it.
	 */
	public void write(DatasetDocument document, Writer out) throws IOException {
		// Render fully before touching the writer, so a failure leaves it untouched
		String json = writeValueAsString(document);
		try {
			out.write(json);
		} finally {
			out.flush();
		}
	}

	/**
	 * Creates or truncates {@code file}, writing it as UTF-8.
	 */
	public void write(DatasetDocument document, Path file) throws IOException {
		String json = writeValueAsString(document);
		try (Writer out = Files.newBufferedWriter(file, UTF_8)) {
			out.write(json);
		}
		LOGGER.debug("Wrote {}", file);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DatasetJsonSerializer.class);
}
