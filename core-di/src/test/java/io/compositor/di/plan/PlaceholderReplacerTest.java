package io.compositor.di.plan;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public final class PlaceholderReplacerTest {
	public static final class Pair {
		private final String first;
		private final String second;

		public Pair(String first, String second) {
			this.first = first;
			this.second = second;
		}
	}

	@Test
	public void placeholdersAreEqualOnlyToThemselves() {
		NodePlaceholder first = Nodes.placeholder(String.class);
		NodePlaceholder second = Nodes.placeholder(String.class);

		assertEquals(first, first);
		assertNotEquals(first, second);
		assertNotEquals(first.getToken(), second.getToken());
	}

	@Test
	public void replacesOnlyTheMatchingPlaceholder() throws Exception {
		NodePlaceholder first = Nodes.placeholder(String.class);
		NodePlaceholder second = Nodes.placeholder(String.class);
		Node node = Nodes.construct(Pair.class.getConstructor(String.class, String.class), first, second);

		Node replaced = PlaceholderReplacer.replace(node, first, Nodes.constant("a", String.class));

		NodeConstructor constructor = (NodeConstructor) replaced;
		assertEquals(Nodes.constant("a", String.class), constructor.getArguments().get(0));
		assertSame(second, constructor.getArguments().get(1));
	}

	@Test
	public void unrelatedPlaceholderLeavesTreeUntouched() throws Exception {
		NodePlaceholder inTree = Nodes.placeholder(String.class);
		Node node = Nodes.apply(
				Nodes.construct(Pair.class.getConstructor(String.class, String.class), inTree, Nodes.constant("b", String.class)),
				Pair.class, pair -> pair, "identity");

		Node replaced = PlaceholderReplacer.replace(node, Nodes.placeholder(String.class), Nodes.constant("a", String.class));

		assertSame(node, replaced);
	}

	@Test
	public void replacesInsideNestedNodes() throws Exception {
		NodePlaceholder first = Nodes.placeholder(String.class);
		NodePlaceholder second = Nodes.placeholder(String.class);
		Node node = Nodes.apply(
				Nodes.construct(Pair.class.getConstructor(String.class, String.class), first, second),
				Pair.class, pair -> pair, "identity");

		Map<NodePlaceholder, Node> replacements = new HashMap<>();
		replacements.put(first, Nodes.constant("a", String.class));
		replacements.put(second, Nodes.constant("b", String.class));
		Node replaced = PlaceholderReplacer.replaceAll(node, replacements);

		Pair pair = FactoryCompiler.compile(replaced, Pair.class).create();
		assertEquals("a", pair.first);
		assertEquals("b", pair.second);
		assertEquals("identity", ((NodeApply) replaced).getName());
	}
}
