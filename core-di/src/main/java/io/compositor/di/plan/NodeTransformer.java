package io.compositor.di.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a node tree bottom-up.
 * <p>
 * Subclasses override the visit methods of the nodes they want to replace;
 * branches in which nothing changed are returned as is.
 */
public abstract class NodeTransformer implements NodeVisitor<Node> {
	public final Node transform(Node node) {
		return node.accept(this);
	}

	@Override
	public Node visitConstant(NodeConstant node) {
		return node;
	}

	@Override
	public Node visitInvoke(NodeInvoke node) {
		return node;
	}

	@Override
	public Node visitConstructor(NodeConstructor node) {
		List<Node> arguments = node.getArguments();
		List<Node> transformed = new ArrayList<>(arguments.size());
		boolean changed = false;
		for (Node argument : arguments) {
			Node result = argument.accept(this);
			changed |= result != argument;
			transformed.add(result);
		}
		return changed ? node.withArguments(transformed) : node;
	}

	@Override
	public Node visitApply(NodeApply node) {
		Node inner = node.getNode();
		Node result = inner.accept(this);
		return result != inner ? node.withNode(result) : node;
	}

	@Override
	public Node visitPlaceholder(NodePlaceholder node) {
		return node;
	}
}
