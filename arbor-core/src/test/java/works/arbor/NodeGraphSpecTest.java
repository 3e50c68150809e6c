package works.arbor;

import java.util.Map;
import org.junit.jupiter.api.Test;
import works.arbor.TreeFixture.Branch;
import works.arbor.TreeFixture.Leaf;
import works.arbor.TreeFixture.Root;
import works.arbor.TreeFixture.Type;
import works.arbor.exceptions.InvalidConfigurationException;
import works.arbor.exceptions.UnknownNodeTypeException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeGraphSpecTest {

	@Test
	void validGraph_resolvesTypes() {
		NodeGraphSpec<Type> graph = TreeFixture.graph();
		TreeFixture tree = new TreeFixture();

		assertEquals(Type.ROOT, graph.rootSpec().typeId());
		assertEquals(3, graph.types().size());
		assertSame(graph.spec(Type.BRANCH), graph.specFor(tree.a));
		assertTrue(graph.spec(Type.LEAF).isLeaf());
		assertFalse(graph.spec(Type.BRANCH).isLeaf());
		assertTrue(graph.spec(Type.ROOT).isRoot());
		assertEquals(Type.ROOT, graph.spec(Type.BRANCH).parentType().orElseThrow());
	}

	@Test
	void singleNodeType_isBothRootAndLeaf() {
		NodeGraphSpec<Type> graph = NodeGraphSpec.builder(Type.class)
			.single(Type.ROOT, Root.class)
			.build();
		VisitorRegistry<Type> visitors = VisitorRegistry.builder(Type.class)
			.register(Type.ROOT, Root.class, (root, ancestors) -> Map.of("ROOT", root.name))
			.build();

		Table table = new TreeExporter<>(graph, visitors, new Root("solo")).exportTree();

		assertEquals(1, table.rowCount());
		assertEquals("solo", table.get(0, "ROOT"));
	}

	@Test
	void noRoot_throws() {
		var builder = NodeGraphSpec.builder(Type.class)
			.leaf(Type.LEAF, Leaf.class, Type.BRANCH, Accessor.attribute("branch"));
		assertThrows(InvalidConfigurationException.class, builder::build);
	}

	@Test
	void twoRoots_throws() {
		var builder = NodeGraphSpec.builder(Type.class)
			.root(Type.ROOT, Root.class, Accessor.attribute("branches"))
			.root(Type.BRANCH, Branch.class, Accessor.attribute("leaves"))
			.leaf(Type.LEAF, Leaf.class, Type.BRANCH, Accessor.attribute("branch"));
		assertThrows(InvalidConfigurationException.class, builder::build);
	}

	@Test
	void noLeaf_throws() {
		var builder = NodeGraphSpec.builder(Type.class)
			.root(Type.ROOT, Root.class, Accessor.attribute("branches"))
			.branch(Type.BRANCH, Branch.class, Accessor.attribute("leaves"), Type.ROOT, Accessor.attribute("root"));
		assertThrows(InvalidConfigurationException.class, builder::build);
	}

	@Test
	void undeclaredParentType_throws() {
		var builder = NodeGraphSpec.builder(Type.class)
			.root(Type.ROOT, Root.class, Accessor.attribute("branches"))
			.leaf(Type.LEAF, Leaf.class, Type.BRANCH, Accessor.attribute("branch"));
		assertThrows(InvalidConfigurationException.class, builder::build);
	}

	@Test
	void parentChainCycle_throws() {
		var builder = NodeGraphSpec.builder(Type.class)
			.single(Type.ROOT, Root.class)
			.branch(Type.BRANCH, Branch.class, Accessor.attribute("leaves"), Type.LEAF, Accessor.attribute("root"))
			.branch(Type.LEAF, Leaf.class, Accessor.attribute("branch"), Type.BRANCH, Accessor.attribute("branch"));
		assertThrows(InvalidConfigurationException.class, builder::build);
	}

	@Test
	void leafAsParent_throws() {
		var builder = NodeGraphSpec.builder(Type.class)
			.root(Type.ROOT, Root.class, Accessor.attribute("branches"))
			.leaf(Type.BRANCH, Branch.class, Type.ROOT, Accessor.attribute("root"))
			.leaf(Type.LEAF, Leaf.class, Type.BRANCH, Accessor.attribute("branch"));
		assertThrows(InvalidConfigurationException.class, builder::build);
	}

	@Test
	void duplicateType_throws() {
		var builder = NodeGraphSpec.builder(Type.class)
			.root(Type.ROOT, Root.class, Accessor.attribute("branches"));
		assertThrows(InvalidConfigurationException.class, () -> builder.leaf(Type.ROOT, Leaf.class, Type.ROOT, Accessor.attribute("branch")));
	}

	@Test
	void sharedClass_throws() {
		var builder = NodeGraphSpec.builder(Type.class)
			.root(Type.ROOT, Root.class, Accessor.attribute("branches"))
			.leaf(Type.LEAF, Root.class, Type.ROOT, Accessor.attribute("name"));
		assertThrows(InvalidConfigurationException.class, builder::build);
	}

	@Test
	void unknownAttribute_throwsWhenDeclared() {
		assertThrows(InvalidConfigurationException.class, () -> NodeGraphSpec.builder(Type.class)
			.root(Type.ROOT, Root.class, Accessor.attribute("noSuchThing")));
	}

	@Test
	void functionForWrongClass_throwsWhenDeclared() {
		assertThrows(InvalidConfigurationException.class, () -> NodeGraphSpec.builder(Type.class)
			.root(Type.ROOT, Root.class, Accessor.function(Branch.class, branch -> branch.leaves)));
	}

	@Test
	void specForSubclass_throws() {
		NodeGraphSpec<Type> graph = NodeGraphSpec.builder(Type.class)
			.single(Type.ROOT, Object.class)
			.build();
		assertThrows(UnknownNodeTypeException.class, () -> graph.specFor("a string is an Object, but not exactly"));
	}
}
