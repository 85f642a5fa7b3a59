package io.compositor.di;

import io.compositor.di.plan.Node;
import org.jetbrains.annotations.NotNull;

import java.util.function.Supplier;

final class DelegateRegistration extends Registration {
	private final Class<?> serviceType;
	private final Supplier<?> instanceCreator;

	DelegateRegistration(Lifestyle lifestyle, Container container, Class<?> serviceType, Supplier<?> instanceCreator) {
		super(lifestyle, container);
		this.serviceType = serviceType;
		this.instanceCreator = instanceCreator;
	}

	@NotNull
	@Override
	public Class<?> getImplementationType() {
		return serviceType;
	}

	@NotNull
	@Override
	public Node buildExpression() {
		return buildTransientNode(serviceType, instanceCreator);
	}
}
