package io.compositor.di.util;

import io.compositor.di.Container;
import io.compositor.di.KnownRelationship;
import io.compositor.di.Registration;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static java.lang.String.format;

public final class Utils {
	private static final Map<Class<?>, Class<?>> PRIMITIVES_TO_WRAPPERS = new HashMap<>();

	static {
		PRIMITIVES_TO_WRAPPERS.put(boolean.class, Boolean.class);
		PRIMITIVES_TO_WRAPPERS.put(byte.class, Byte.class);
		PRIMITIVES_TO_WRAPPERS.put(char.class, Character.class);
		PRIMITIVES_TO_WRAPPERS.put(short.class, Short.class);
		PRIMITIVES_TO_WRAPPERS.put(int.class, Integer.class);
		PRIMITIVES_TO_WRAPPERS.put(long.class, Long.class);
		PRIMITIVES_TO_WRAPPERS.put(float.class, Float.class);
		PRIMITIVES_TO_WRAPPERS.put(double.class, Double.class);
		PRIMITIVES_TO_WRAPPERS.put(void.class, Void.class);
	}

	private Utils() {
	}

	public static <T> T checkNotNull(@Nullable T reference, String message) {
		if (reference == null) {
			throw new NullPointerException(message);
		}
		return reference;
	}

	public static void checkArgument(boolean condition, String template, Object... args) {
		if (!condition) {
			throw new IllegalArgumentException(format(template, args));
		}
	}

	public static void checkState(boolean condition, String template, Object... args) {
		if (!condition) {
			throw new IllegalStateException(format(template, args));
		}
	}

	@NotNull
	public static Class<?> wrap(@NotNull Class<?> type) {
		Class<?> wrapper = PRIMITIVES_TO_WRAPPERS.get(type);
		return wrapper != null ? wrapper : type;
	}

	/**
	 * Checks whether a value of type {@code from} can be passed where {@code to} is expected,
	 * treating primitive types and their wrappers as interchangeable.
	 */
	public static boolean isAssignable(@NotNull Class<?> to, @NotNull Class<?> from) {
		return wrap(to).isAssignableFrom(wrap(from));
	}

	public static String getShortName(Class<?> cls) {
		String name = cls.getName();
		return name.substring(name.lastIndexOf('.') + 1);
	}

	/**
	 * Renders the relationships captured by every registration of the container as a GraphViz digraph.
	 */
	public static String printGraphVizGraph(Container container) {
		StringBuilder sb = new StringBuilder();
		sb.append("digraph {\n");
		sb.append("\trankdir=BT;\n");
		Set<String> nodes = new TreeSet<>();
		Set<String> edges = new TreeSet<>();
		for (Registration registration : container.getRegistrations().values()) {
			String consumer = getShortName(registration.getImplementationType());
			nodes.add(format("\t\"%s\";\n", consumer));
			for (KnownRelationship relationship : registration.getRelationships()) {
				edges.add(format("\t\"%s\" -> \"%s\" [label=\"%s\"];\n",
						getShortName(relationship.getImplementationType()),
						getShortName(relationship.getDependency().getImplementationType()),
						relationship.getLifestyle().getName()));
			}
		}
		nodes.forEach(sb::append);
		edges.forEach(sb::append);
		sb.append("}\n");
		return sb.toString();
	}
}
