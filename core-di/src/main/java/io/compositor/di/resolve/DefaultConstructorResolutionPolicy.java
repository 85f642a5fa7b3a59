package io.compositor.di.resolve;

import io.compositor.di.ActivationException;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;

import static java.lang.String.format;

/**
 * Accepts concrete types with exactly one public constructor
 */
public final class DefaultConstructorResolutionPolicy implements ConstructorResolutionPolicy {
	@NotNull
	@Override
	public Constructor<?> getConstructor(@NotNull Class<?> serviceType, @NotNull Class<?> implementationType) {
		if (implementationType.isInterface() || Modifier.isAbstract(implementationType.getModifiers())) {
			throw new ActivationException(format("The given type %s is not a concrete type. " +
					"Please make sure the type is a class that can be created.", implementationType.getName()));
		}
		Constructor<?>[] constructors = implementationType.getConstructors();
		if (constructors.length != 1) {
			throw new ActivationException(format("For the container to be able to create %s, it should contain " +
					"exactly one public constructor, but it has %d.", implementationType.getName(), constructors.length));
		}
		return constructors[0];
	}
}
