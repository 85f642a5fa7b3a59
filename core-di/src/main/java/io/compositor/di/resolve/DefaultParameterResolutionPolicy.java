package io.compositor.di.resolve;

import io.compositor.di.ActivationException;
import io.compositor.di.Container;
import io.compositor.di.Registration;
import io.compositor.di.plan.Node;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Parameter;

import static io.compositor.di.util.Utils.checkNotNull;
import static java.lang.String.format;

/**
 * Resolves a parameter by inlining the plan of the registration for its type.
 * Primitives and strings are never resolved, they have to be supplied as parameter overrides.
 */
public final class DefaultParameterResolutionPolicy implements ParameterResolutionPolicy {
	private final Container container;

	public DefaultParameterResolutionPolicy(@NotNull Container container) {
		this.container = checkNotNull(container, "container");
	}

	@NotNull
	@Override
	public Node buildParameterNode(@NotNull Parameter parameter) {
		Class<?> type = parameter.getType();
		if (type.isPrimitive() || type == String.class) {
			throw new ActivationException(format("Parameter '%s' of type %s of %s can not be injected. " +
							"Primitive and string parameters have to be overridden explicitly.",
					parameter.getName(), type.getName(), parameter.getDeclaringExecutable()));
		}
		Registration registration = container.getRegistrationEvenIfInvalid(type);
		if (registration == null) {
			throw new ActivationException(format("No registration for type %s could be found, " +
							"required by parameter '%s' of %s.",
					type.getName(), parameter.getName(), parameter.getDeclaringExecutable()));
		}
		return registration.buildExpression();
	}
}
