package io.compositor.di.plan;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

import static io.compositor.di.util.Utils.checkArgument;
import static io.compositor.di.util.Utils.checkNotNull;
import static io.compositor.di.util.Utils.isAssignable;
import static java.util.Arrays.asList;

/**
 * Factory methods for construction nodes
 */
public final class Nodes {
	private Nodes() {
	}

	/**
	 * Returns a node which always produces the given value
	 *
	 * @param value value to produce, may be {@code null}
	 * @param type  declared type of the value
	 */
	public static Node constant(@Nullable Object value, @NotNull Class<?> type) {
		checkNotNull(type, "type");
		checkArgument(value == null || isAssignable(type, value.getClass()),
				"Value %s is not an instance of %s", value, type.getName());
		return new NodeConstant(value, type);
	}

	public static Node constant(@NotNull Object value) {
		checkNotNull(value, "value");
		return new NodeConstant(value, value.getClass());
	}

	/**
	 * Returns a node which calls the supplier every time an instance is created
	 *
	 * @param supplier delegate to invoke
	 * @param type     declared type of the values returned by the supplier
	 */
	public static Node invoke(@NotNull Supplier<?> supplier, @NotNull Class<?> type) {
		return new NodeInvoke(checkNotNull(supplier, "supplier"), checkNotNull(type, "type"));
	}

	public static Node construct(@NotNull Constructor<?> constructor, @NotNull List<Node> arguments) {
		checkNotNull(constructor, "constructor");
		checkArgument(constructor.getParameterCount() == arguments.size(),
				"Constructor %s expects %d arguments, got %d", constructor, constructor.getParameterCount(), arguments.size());
		return new NodeConstructor(constructor, arguments);
	}

	public static Node construct(@NotNull Constructor<?> constructor, Node... arguments) {
		return construct(constructor, asList(arguments));
	}

	/**
	 * Returns a node which passes the value of {@code node} through {@code function}
	 *
	 * @param node     node whose value is passed to the function
	 * @param type     declared type of the function result
	 * @param function function to apply
	 * @param name     name used when the node is displayed
	 */
	public static Node apply(@NotNull Node node, @NotNull Class<?> type, @NotNull Function<Object, ?> function, @NotNull String name) {
		return new NodeApply(checkNotNull(node, "node"), checkNotNull(type, "type"),
				checkNotNull(function, "function"), checkNotNull(name, "name"));
	}

	public static NodePlaceholder placeholder(@NotNull Class<?> type) {
		return new NodePlaceholder(checkNotNull(type, "type"));
	}
}
