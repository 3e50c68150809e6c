package works.arbor;

import java.util.function.Function;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.document.DatasetDocument;
import works.arbor.exceptions.InvalidConfigurationException;

import static java.util.Objects.requireNonNull;

/**
 * Exports one dataset from one object graph.
 * <p>
 * All configuration is checked when the exporter is {@link Builder#build() built},
 * except the {@link ExportSettings#label() label}, which only {@link #document} needs;
 * that one is checked before traversal begins.
 * <p>
 * Instances are immutable and may be shared between threads,
 * provided the graph itself isn't modified during an export.
 *
 * @param <K> the node type identifiers of the graph
 */
public final class DatasetExporter<K extends Enum<K>> {
	private final TreeExporter<K> treeExporter;
	private final PostProcessor postProcessor;
	private final @Nullable Supplier<String> rootIdentifier;

	private DatasetExporter(TreeExporter<K> treeExporter, PostProcessor postProcessor, @Nullable Supplier<String> rootIdentifier) {
		this.treeExporter = treeExporter;
		this.postProcessor = postProcessor;
		this.rootIdentifier = rootIdentifier;
	}

	public static <K extends Enum<K>> Builder<K> builder(NodeGraphSpec<K> graph) {
		return new Builder<>(graph);
	}

	public VariableSchema schema() {
		return postProcessor.schema();
	}

	public ExportSettings settings() {
		return postProcessor.settings();
	}

	public Object root() {
		return treeExporter.root();
	}

	/**
	 * @return every row beneath the root, post-processed
	 */
	public Table export() {
		return export(null);
	}

	/**
	 * @param subtree if not null, only rows beneath this node are exported
	 */
	public Table export(@Nullable Object subtree) {
		Table raw = (subtree == null) ? treeExporter.exportTree() : treeExporter.exportSubtree(subtree);
		return postProcessor.process(raw);
	}

	public DatasetDocument document() {
		return document(null);
	}

	/**
	 * @param subtree if not null, only rows beneath this node are exported
	 * @throws InvalidConfigurationException if there's no {@link ExportSettings#label() label}
	 * or no root identifier
	 */
	public DatasetDocument document(@Nullable Object subtree) {
		ExportSettings settings = settings();
		String label = settings.label();
		if (label == null || label.isEmpty()) {
			throw new InvalidConfigurationException("Label is required for a structured document");
		}
		if (rootIdentifier == null) {
			throw new InvalidConfigurationException("Root identifier is required for a structured document");
		}
		String studyOid = rootIdentifier.get();
		Table table = export(subtree);
		LOGGER.debug("Building document {} with {} records", studyOid, table.rowCount());
		return DatasetDocument.of(studyOid, settings.domain(), label, schema(), table);
	}

	public static final class Builder<K extends Enum<K>> {
		private final NodeGraphSpec<K> graph;
		private VisitorRegistry<K> visitors;
		private VariableSchema schema;
		private ExportSettings settings;
		private Object root;
		private Supplier<String> rootIdentifier;

		Builder(NodeGraphSpec<K> graph) {
			this.graph = requireNonNull(graph);
		}

		public Builder<K> visitors(VisitorRegistry<K> visitors) {
			this.visitors = requireNonNull(visitors);
			return this;
		}

		public Builder<K> schema(VariableSchema schema) {
			this.schema = requireNonNull(schema);
			return this;
		}

		public Builder<K> settings(ExportSettings settings) {
			this.settings = requireNonNull(settings);
			return this;
		}

		/**
		 * Sets a root without an identifier. Such an exporter can't produce a {@link DatasetDocument}.
		 */
		public Builder<K> root(Object root) {
			this.root = requireNonNull(root);
			this.rootIdentifier = null;
			return this;
		}

		/**
		 * @param rootIdentifier computes the document's study identifier from {@code root}
		 */
		public <R> Builder<K> root(R root, Function<? super R, ?> rootIdentifier) {
			requireNonNull(rootIdentifier);
			this.root = requireNonNull(root);
			this.rootIdentifier = () -> String.valueOf(requireNonNull(rootIdentifier.apply(root), "Root identifier"));
			return this;
		}

		/**
		 * @throws InvalidConfigurationException if anything is missing or inconsistent
		 */
		public DatasetExporter<K> build() {
			if (visitors == null) {
				throw new InvalidConfigurationException("Visitors must be set");
			}
			if (schema == null) {
				throw new InvalidConfigurationException("Schema must be set");
			}
			if (settings == null) {
				throw new InvalidConfigurationException("Settings must be set");
			}
			if (root == null) {
				throw new InvalidConfigurationException("Root must be set");
			}
			PostProcessor postProcessor = new PostProcessor(schema, settings);
			TreeExporter<K> treeExporter = new TreeExporter<>(graph, visitors, root);
			LOGGER.debug("Configured {} exporter over {} node types", settings.domain(), graph.types().size());
			return new DatasetExporter<>(treeExporter, postProcessor, rootIdentifier);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DatasetExporter.class);
}
