package io.compositor.di.resolve;

import io.compositor.di.ActivationException;
import io.compositor.di.plan.Node;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Parameter;

/**
 * Builds the node which supplies the value of a constructor parameter.
 * <p>
 * Implementations may be called speculatively, to find out whether a parameter can be resolved at all,
 * so they must not change the state of the container.
 */
public interface ParameterResolutionPolicy {
	/**
	 * @throws ActivationException if the parameter can not be resolved
	 */
	@NotNull
	Node buildParameterNode(@NotNull Parameter parameter);
}
