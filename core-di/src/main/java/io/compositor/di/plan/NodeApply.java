package io.compositor.di.plan;

import org.jetbrains.annotations.NotNull;

import java.util.function.Function;

/**
 * Passes the value of another node through a stored function.
 * Used for null guards, initializers and decorators added by interceptors.
 */
public final class NodeApply implements Node {
	@NotNull
	private final Node node;
	@NotNull
	private final Class<?> type;
	@NotNull
	private final Function<Object, ?> function;
	@NotNull
	private final String name;

	NodeApply(@NotNull Node node, @NotNull Class<?> type, @NotNull Function<Object, ?> function, @NotNull String name) {
		this.node = node;
		this.type = type;
		this.function = function;
		this.name = name;
	}

	@NotNull
	public Node getNode() {
		return node;
	}

	@NotNull
	public Function<Object, ?> getFunction() {
		return function;
	}

	@NotNull
	public String getName() {
		return name;
	}

	public NodeApply withNode(@NotNull Node node) {
		return new NodeApply(node, type, function, name);
	}

	@NotNull
	@Override
	public Class<?> getType() {
		return type;
	}

	@Override
	public <R> R accept(@NotNull NodeVisitor<R> visitor) {
		return visitor.visitApply(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		NodeApply that = (NodeApply) o;
		return node.equals(that.node) && type == that.type && function.equals(that.function) && name.equals(that.name);
	}

	@Override
	public int hashCode() {
		int result = node.hashCode();
		result = 31 * result + type.hashCode();
		result = 31 * result + function.hashCode();
		return result;
	}

	@Override
	public String toString() {
		return name + "(" + node + ")";
	}
}
