package io.compositor.di.plan;

public interface NodeVisitor<R> {
	R visitConstant(NodeConstant node);

	R visitInvoke(NodeInvoke node);

	R visitConstructor(NodeConstructor node);

	R visitApply(NodeApply node);

	R visitPlaceholder(NodePlaceholder node);
}
