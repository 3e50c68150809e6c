package works.arbor.testing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import works.arbor.Accessor;
import works.arbor.DatasetExporter;
import works.arbor.ExportSettings;
import works.arbor.NodeGraphSpec;
import works.arbor.Variable;
import works.arbor.VariableSchema;
import works.arbor.VisitorRegistry;
import works.arbor.testing.model.Observation;
import works.arbor.testing.model.Participant;
import works.arbor.testing.model.Study;
import works.arbor.testing.model.Unit;

import static works.arbor.testing.FixtureNode.OBSERVATION;
import static works.arbor.testing.FixtureNode.PARTICIPANT;
import static works.arbor.testing.FixtureNode.STUDY;

/**
 * A small study/participant/observation graph and a matching exporter configuration.
 * <p>
 * The accessors reach relations through a getter ({@code participants}),
 * a function returning a lazy supplier (observations), and plain methods ({@code study}, {@code participant}).
 */
public final class Fixtures {
	public static final String STUDY_NAME = "Test Name";
	public static final String DOMAIN = "EXAMPLE";
	public static final String LABEL = "Example";
	public static final String SUBJECT_ID = "test-subject";
	public static final String DISCLAIMER = "Test disclaimer";
	public static final String CONSTANT_VALUE = "0";
	public static final Unit KILOGRAMS = new Unit("kg");

	private Fixtures() { }

	/**
	 * One participant with two observations: {@code "Yes"} with no unit, then {@code "10.0"} in kilograms.
	 */
	public static Study exampleStudy() {
		Study study = new Study(STUDY_NAME);
		Participant participant = study.addParticipant(SUBJECT_ID);
		participant.addObservation("Yes", null);
		participant.addObservation("10.0", KILOGRAMS);
		return study;
	}

	public static NodeGraphSpec<FixtureNode> graph() {
		return NodeGraphSpec.builder(FixtureNode.class)
			.root(STUDY, Study.class, Accessor.attribute("participants"))
			.branch(PARTICIPANT, Participant.class, Accessor.function(Participant.class, Participant::observations), STUDY, Accessor.attribute("study"))
			.leaf(OBSERVATION, Observation.class, PARTICIPANT, Accessor.attribute("participant"))
			.build();
	}

	public static VisitorRegistry<FixtureNode> visitors() {
		return VisitorRegistry.builder(FixtureNode.class)
			.register(STUDY, Study.class, (study, ancestors) -> Map.of(FixtureVariables.STUDY_NAME.oid(), study.getName()))
			.register(PARTICIPANT, Participant.class, (participant, ancestors) -> Map.of(FixtureVariables.SUBJECT_ID.oid(), participant.subjectId()))
			.register(OBSERVATION, Observation.class, (observation, ancestors) -> {
				Map<String, Object> result = new LinkedHashMap<>();
				result.put(FixtureVariables.VALUE.oid(), observation.value());
				result.put(FixtureVariables.UNIT.oid(), (observation.unit() == null) ? "" : observation.unit().symbol());
				return result;
			})
			.build();
	}

	/**
	 * Every fixture variable except {@link FixtureVariables#SEQUENCE_NUMBER}.
	 */
	public static VariableSchema schema() {
		List<Variable> variables = annotatedSchema().variables().stream()
			.filter(v -> !v.oid().equals(FixtureVariables.SEQUENCE_NUMBER.oid()))
			.toList();
		return VariableSchema.of(variables);
	}

	/**
	 * Every fixture variable, ending with {@link FixtureVariables#SEQUENCE_NUMBER}.
	 */
	public static VariableSchema annotatedSchema() {
		return VariableSchema.fromEnum(FixtureVariables.class);
	}

	public static ExportSettings.ExportSettingsBuilder settings() {
		return ExportSettings.builder()
			.domain(DOMAIN)
			.domainVariable(FixtureVariables.DOMAIN.oid())
			.label(LABEL)
			.constant(FixtureVariables.TEST_CONSTANT.oid(), CONSTANT_VALUE);
	}

	public static DatasetExporter.Builder<FixtureNode> exporterBuilder(Study study) {
		return DatasetExporter.builder(graph())
			.visitors(visitors())
			.schema(schema())
			.settings(settings().build())
			.root(study, Study::getName);
	}

	public static DatasetExporter<FixtureNode> exporter(Study study) {
		return exporterBuilder(study).build();
	}
}
