package io.compositor.di.resolve;

import io.compositor.di.ActivationException;
import io.compositor.di.Container;
import io.compositor.di.Registration;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Parameter;
import java.util.Arrays;
import java.util.Comparator;

import static io.compositor.di.util.Utils.checkNotNull;
import static java.lang.String.format;

/**
 * Selects the public constructor with the most parameters that can all be resolved.
 * <p>
 * While the container is still open for registrations, dependencies may not be registered yet,
 * so the constructor with the most parameters is returned unconditionally.
 * Once the container is locked, a parameter is resolvable if the registration of the service overrides it,
 * if its type is registered, or if the parameter resolution policy of the container can build a node for it.
 * Among constructors with the same number of parameters the first one wins.
 */
public final class MostResolvableParametersConstructorResolutionPolicy implements ConstructorResolutionPolicy {
	private static final Logger logger = LoggerFactory.getLogger(MostResolvableParametersConstructorResolutionPolicy.class);

	private final Container container;

	public MostResolvableParametersConstructorResolutionPolicy(@NotNull Container container) {
		this.container = checkNotNull(container, "container");
	}

	@NotNull
	@Override
	public Constructor<?> getConstructor(@NotNull Class<?> serviceType, @NotNull Class<?> implementationType) {
		Constructor<?> constructor = getConstructorOrNull(serviceType, implementationType);
		if (constructor != null) {
			return constructor;
		}
		throw new ActivationException(buildExceptionMessage(implementationType));
	}

	@Nullable
	private Constructor<?> getConstructorOrNull(Class<?> serviceType, Class<?> implementationType) {
		Constructor<?>[] constructors = implementationType.getConstructors();
		// stable sort, so the enumeration order decides between equally long constructors
		Arrays.sort(constructors, Comparator.comparingInt((Constructor<?> c) -> c.getParameterCount()).reversed());

		if (!container.isLocked()) {
			return constructors.length != 0 ? constructors[0] : null;
		}

		Registration registration = container.getRegistrationEvenIfInvalid(serviceType);
		for (Constructor<?> constructor : constructors) {
			if (canBeResolved(constructor, registration)) {
				return constructor;
			}
		}
		return null;
	}

	private boolean canBeResolved(Constructor<?> constructor, @Nullable Registration registration) {
		for (Parameter parameter : constructor.getParameters()) {
			if (registration != null && registration.hasParameterOverride(parameter)) {
				continue;
			}
			if (container.getRegistrationEvenIfInvalid(parameter.getType()) == null && !canBuildParameterNode(parameter)) {
				return false;
			}
		}
		return true;
	}

	private boolean canBuildParameterNode(Parameter parameter) {
		try {
			return container.getOptions().getParameterResolutionPolicy().buildParameterNode(parameter) != null;
		} catch (ActivationException e) {
			if (logger.isTraceEnabled()) logger.trace("Parameter '{}' of {} is not resolvable: {}",
					parameter.getName(), parameter.getDeclaringExecutable(), e.getMessage());
			return false;
		}
	}

	private static String buildExceptionMessage(Class<?> type) {
		if (type.getConstructors().length == 0) {
			return format("For the container to be able to create %s, it should contain at least one public constructor.",
					type.getName());
		}
		return format("For the container to be able to create %s, it should contain a public constructor " +
				"that only contains parameters that can be resolved.", type.getName());
	}
}
