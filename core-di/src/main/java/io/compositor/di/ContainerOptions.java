package io.compositor.di;

import io.compositor.di.resolve.ConstructorResolutionPolicy;
import io.compositor.di.resolve.DefaultConstructorResolutionPolicy;
import io.compositor.di.resolve.DefaultParameterResolutionPolicy;
import io.compositor.di.resolve.ParameterResolutionPolicy;
import org.jetbrains.annotations.NotNull;

import static io.compositor.di.util.Utils.checkNotNull;
import static io.compositor.di.util.Utils.checkState;

/**
 * Resolution policies of a container. Can only be changed before the container is locked.
 */
public final class ContainerOptions {
	private final Container container;

	@NotNull
	private volatile ConstructorResolutionPolicy constructorResolutionPolicy;
	@NotNull
	private volatile ParameterResolutionPolicy parameterResolutionPolicy;

	ContainerOptions(Container container) {
		this.container = container;
		this.constructorResolutionPolicy = new DefaultConstructorResolutionPolicy();
		this.parameterResolutionPolicy = new DefaultParameterResolutionPolicy(container);
	}

	@NotNull
	public ConstructorResolutionPolicy getConstructorResolutionPolicy() {
		return constructorResolutionPolicy;
	}

	public ContainerOptions setConstructorResolutionPolicy(@NotNull ConstructorResolutionPolicy policy) {
		checkNotNull(policy, "policy");
		checkState(!container.isLocked(), "The constructor resolution policy can't be changed after the container has been locked");
		this.constructorResolutionPolicy = policy;
		return this;
	}

	@NotNull
	public ParameterResolutionPolicy getParameterResolutionPolicy() {
		return parameterResolutionPolicy;
	}

	public ContainerOptions setParameterResolutionPolicy(@NotNull ParameterResolutionPolicy policy) {
		checkNotNull(policy, "policy");
		checkState(!container.isLocked(), "The parameter resolution policy can't be changed after the container has been locked");
		this.parameterResolutionPolicy = policy;
		return this;
	}
}
