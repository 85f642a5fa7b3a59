package io.compositor.di.plan;

import java.util.Map;

import static java.util.Collections.singletonMap;

/**
 * Replaces placeholders in a node tree with their paired nodes.
 * Placeholders are matched by their token, never by structure.
 */
public final class PlaceholderReplacer extends NodeTransformer {
	private final Map<NodePlaceholder, Node> replacements;

	private PlaceholderReplacer(Map<NodePlaceholder, Node> replacements) {
		this.replacements = replacements;
	}

	public static Node replace(Node node, NodePlaceholder placeholder, Node replacement) {
		return replaceAll(node, singletonMap(placeholder, replacement));
	}

	public static Node replaceAll(Node node, Map<NodePlaceholder, Node> replacements) {
		if (replacements.isEmpty()) {
			return node;
		}
		return new PlaceholderReplacer(replacements).transform(node);
	}

	@Override
	public Node visitPlaceholder(NodePlaceholder node) {
		Node replacement = replacements.get(node);
		return replacement != null ? replacement : node;
	}
}
