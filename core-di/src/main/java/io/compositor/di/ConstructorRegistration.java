package io.compositor.di;

import io.compositor.di.plan.Node;
import org.jetbrains.annotations.NotNull;

final class ConstructorRegistration extends Registration {
	private final Class<?> serviceType;
	private final Class<?> implementationType;

	ConstructorRegistration(Lifestyle lifestyle, Container container, Class<?> serviceType, Class<?> implementationType) {
		super(lifestyle, container);
		this.serviceType = serviceType;
		this.implementationType = implementationType;
	}

	@NotNull
	@Override
	public Class<?> getImplementationType() {
		return implementationType;
	}

	@NotNull
	@Override
	public Node buildExpression() {
		return buildTransientNode(serviceType, implementationType);
	}
}
