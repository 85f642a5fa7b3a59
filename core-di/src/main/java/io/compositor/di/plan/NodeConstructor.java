package io.compositor.di.plan;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Constructor;
import java.util.List;

import static io.compositor.di.util.Utils.getShortName;
import static java.util.Collections.unmodifiableList;
import static java.util.stream.Collectors.joining;

/**
 * Calls a constructor with the values of its argument nodes
 */
public final class NodeConstructor implements Node {
	@NotNull
	private final Constructor<?> constructor;
	@NotNull
	private final List<Node> arguments;

	NodeConstructor(@NotNull Constructor<?> constructor, @NotNull List<Node> arguments) {
		this.constructor = constructor;
		this.arguments = unmodifiableList(arguments);
	}

	@NotNull
	public Constructor<?> getConstructor() {
		return constructor;
	}

	@NotNull
	public List<Node> getArguments() {
		return arguments;
	}

	public NodeConstructor withArguments(@NotNull List<Node> arguments) {
		return new NodeConstructor(constructor, arguments);
	}

	@NotNull
	@Override
	public Class<?> getType() {
		return constructor.getDeclaringClass();
	}

	@Override
	public <R> R accept(@NotNull NodeVisitor<R> visitor) {
		return visitor.visitConstructor(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		NodeConstructor that = (NodeConstructor) o;
		return constructor.equals(that.constructor) && arguments.equals(that.arguments);
	}

	@Override
	public int hashCode() {
		return 31 * constructor.hashCode() + arguments.hashCode();
	}

	@Override
	public String toString() {
		return arguments.stream()
				.map(Object::toString)
				.collect(joining(", ", "new " + getShortName(getType()) + "(", ")"));
	}
}
