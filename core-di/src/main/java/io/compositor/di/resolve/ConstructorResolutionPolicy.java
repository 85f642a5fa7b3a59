package io.compositor.di.resolve;

import io.compositor.di.ActivationException;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Constructor;

/**
 * Selects the constructor used to create instances of an implementation type
 */
public interface ConstructorResolutionPolicy {
	/**
	 * @param serviceType        type the implementation is registered for
	 * @param implementationType type to be constructed
	 * @return exactly one constructor of {@code implementationType}
	 * @throws ActivationException if no constructor qualifies
	 */
	@NotNull
	Constructor<?> getConstructor(@NotNull Class<?> serviceType, @NotNull Class<?> implementationType);
}
