package io.compositor.di;

import io.compositor.di.plan.Node;
import org.jetbrains.annotations.NotNull;

/**
 * Intercepts the construction plan of a registration before it is finalized.
 * <p>
 * The node passed in is resolvable but not yet wrapped with null checks or initializers,
 * and still holds placeholders instead of overridden parameters.
 * Returning the node unchanged is allowed; returning {@code null} is not.
 */
@FunctionalInterface
public interface ExpressionBuildingListener {
	@NotNull
	Node onExpressionBuilding(@NotNull Registration registration, @NotNull Class<?> serviceType,
			@NotNull Class<?> implementationType, @NotNull Node node);
}
