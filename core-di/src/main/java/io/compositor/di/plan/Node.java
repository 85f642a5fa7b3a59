package io.compositor.di.plan;

import org.jetbrains.annotations.NotNull;

/**
 * An immutable description of one step of instance creation.
 * <p>
 * Nodes compose into a tree whose root describes the fully built instance.
 * A tree is turned into an invokable {@link Factory} by the {@link FactoryCompiler}
 * and may be rewritten beforehand with a {@link NodeTransformer}.
 */
public interface Node {
	/**
	 * Static type of the value this node produces
	 */
	@NotNull
	Class<?> getType();

	<R> R accept(@NotNull NodeVisitor<R> visitor);
}
