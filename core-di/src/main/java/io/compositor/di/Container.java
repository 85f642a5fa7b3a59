package io.compositor.di;

import io.compositor.di.plan.FactoryCompiler;
import io.compositor.di.plan.Factory;
import io.compositor.di.plan.Node;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static io.compositor.di.util.Utils.checkArgument;
import static io.compositor.di.util.Utils.checkNotNull;
import static io.compositor.di.util.Utils.checkState;
import static io.compositor.di.util.Utils.isAssignable;
import static java.lang.String.format;
import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;

/**
 * Composition root which maps service types to registrations.
 * <p>
 * The container is open for registrations until it gets locked, which happens
 * on the first {@link #getInstance} or {@link #getRegistration} call, or explicitly with {@link #lock()}.
 */
public final class Container {
	private static final Logger logger = LoggerFactory.getLogger(Container.class);

	private final Map<Class<?>, Registration> registrations = new LinkedHashMap<>();
	private final List<ExpressionBuildingListener> expressionBuildingListeners = new CopyOnWriteArrayList<>();
	private final List<InitializerEntry> initializers = new CopyOnWriteArrayList<>();
	private final Map<Class<?>, Factory<?>> factories = new ConcurrentHashMap<>();
	private final ContainerOptions options = new ContainerOptions(this);

	private volatile boolean locked;

	@NotNull
	public ContainerOptions getOptions() {
		return options;
	}

	// region registration
	public <S, I extends S> Container register(@NotNull Class<S> serviceType, @NotNull Class<I> implementationType) {
		return register(serviceType, implementationType, Lifestyle.TRANSIENT);
	}

	public <S, I extends S> Container register(@NotNull Class<S> serviceType, @NotNull Class<I> implementationType,
			@NotNull Lifestyle lifestyle) {
		return register(serviceType, implementationType, lifestyle, emptyMap());
	}

	/**
	 * Registers {@code implementationType} as the implementation of {@code serviceType},
	 * with some of its constructor parameters overridden by explicit nodes.
	 */
	public <S, I extends S> Container register(@NotNull Class<S> serviceType, @NotNull Class<I> implementationType,
			@NotNull Lifestyle lifestyle, @NotNull Map<Parameter, ? extends Node> parameterOverrides) {
		checkNotNull(lifestyle, "lifestyle");
		checkNotNull(parameterOverrides, "parameterOverrides");
		checkState(!locked, "The container can't be changed after the first call to getInstance");
		// fail fast on implementations the policy can not construct
		options.getConstructorResolutionPolicy().getConstructor(serviceType, implementationType);
		Registration registration = lifestyle.createRegistration(serviceType, implementationType, this);
		if (!parameterOverrides.isEmpty()) {
			registration.setParameterOverrides(parameterOverrides);
		}
		return addRegistration(serviceType, registration);
	}

	public <S> Container register(@NotNull Class<S> serviceType, @NotNull Supplier<? extends S> instanceCreator) {
		return register(serviceType, instanceCreator, Lifestyle.TRANSIENT);
	}

	public <S> Container register(@NotNull Class<S> serviceType, @NotNull Supplier<? extends S> instanceCreator,
			@NotNull Lifestyle lifestyle) {
		checkNotNull(lifestyle, "lifestyle");
		return addRegistration(serviceType, lifestyle.createRegistration(serviceType, instanceCreator, this));
	}

	public Container addRegistration(@NotNull Class<?> serviceType, @NotNull Registration registration) {
		checkNotNull(serviceType, "serviceType");
		checkNotNull(registration, "registration");
		synchronized (this) {
			checkState(!locked, "The container can't be changed after the first call to getInstance");
			checkArgument(!registrations.containsKey(serviceType), "Type %s has already been registered", serviceType.getName());
			registrations.put(serviceType, registration);
		}
		logger.debug("Registered {} as {}", serviceType.getName(), registration);
		return this;
	}

	/**
	 * Registers an action which is called on every newly created instance of {@code type} or any of its subtypes.
	 * Initializers are applied in the order of registration.
	 * A runtime exception thrown by an initializer is rethrown as {@link ActivationException},
	 * an {@link Error} is rethrown as is.
	 */
	public <T> Container registerInitializer(@NotNull Class<T> type, @NotNull Consumer<? super T> initializer) {
		checkNotNull(type, "type");
		checkNotNull(initializer, "initializer");
		checkState(!locked, "The container can't be changed after the first call to getInstance");
		initializers.add(new InitializerEntry(type, initializer));
		return this;
	}

	public Container addExpressionBuildingListener(@NotNull ExpressionBuildingListener listener) {
		checkNotNull(listener, "listener");
		checkState(!locked, "The container can't be changed after the first call to getInstance");
		expressionBuildingListeners.add(listener);
		return this;
	}
	// endregion

	// region lookup
	@NotNull
	public <T> T getInstance(@NotNull Class<T> serviceType) {
		checkNotNull(serviceType, "serviceType");
		lock();
		@SuppressWarnings("unchecked")
		Factory<T> factory = (Factory<T>) factories.get(serviceType);
		if (factory == null) {
			factory = createFactory(serviceType);
			@SuppressWarnings("unchecked")
			Factory<T> existing = (Factory<T>) factories.putIfAbsent(serviceType, factory);
			if (existing != null) {
				factory = existing;
			}
		}
		return factory.create();
	}

	private <T> Factory<T> createFactory(Class<T> serviceType) {
		Registration registration = getRegistrationEvenIfInvalid(serviceType);
		if (registration == null) {
			throw new ActivationException(format("No registration for type %s could be found.", serviceType.getName()));
		}
		return FactoryCompiler.compile(registration.buildExpression(), serviceType);
	}

	/**
	 * Returns the registration of {@code serviceType}, locking the container
	 */
	@Nullable
	public Registration getRegistration(@NotNull Class<?> serviceType) {
		lock();
		return getRegistrationEvenIfInvalid(serviceType);
	}

	/**
	 * Returns the registration of {@code serviceType} without locking the container.
	 * The registration may not be buildable yet, as its dependencies might still be missing.
	 */
	@Nullable
	public synchronized Registration getRegistrationEvenIfInvalid(@NotNull Class<?> serviceType) {
		return registrations.get(serviceType);
	}

	public synchronized Map<Class<?>, Registration> getRegistrations() {
		return unmodifiableMap(new LinkedHashMap<>(registrations));
	}

	public void lock() {
		if (locked) {
			return;
		}
		synchronized (this) {
			if (!locked) {
				locked = true;
				logger.debug("Container locked with {} registrations", registrations.size());
			}
		}
	}

	public boolean isLocked() {
		return locked;
	}
	// endregion

	// region plan building callbacks
	/**
	 * Runs the expression building listeners in the order of registration, each one receiving the result of the previous one.
	 */
	@NotNull
	public Node onExpressionBuilding(@NotNull Registration registration, @NotNull Class<?> serviceType,
			@NotNull Class<?> implementationType, @NotNull Node node) {
		for (ExpressionBuildingListener listener : expressionBuildingListeners) {
			Node intercepted = listener.onExpressionBuilding(registration, serviceType, implementationType, node);
			if (intercepted == null) {
				throw new ActivationException(format("Expression building listener %s returned null for type %s",
						listener, serviceType.getName()));
			}
			if (!isAssignable(serviceType, intercepted.getType())) {
				throw new ActivationException(format("Expression building listener %s replaced the plan of %s with %s, " +
								"which produces the incompatible type %s",
						listener, serviceType.getName(), intercepted, intercepted.getType().getName()));
			}
			node = intercepted;
		}
		return node;
	}

	/**
	 * Returns the combination of all initializers applicable to {@code implementationType}, or {@code null} if there are none
	 */
	@SuppressWarnings("unchecked")
	@Nullable
	public Consumer<Object> getInitializer(@NotNull Class<?> implementationType) {
		List<Consumer<Object>> applicable = new ArrayList<>();
		for (InitializerEntry entry : initializers) {
			if (entry.type.isAssignableFrom(implementationType)) {
				applicable.add((Consumer<Object>) entry.initializer);
			}
		}
		if (applicable.isEmpty()) {
			return null;
		}
		if (applicable.size() == 1) {
			return applicable.get(0);
		}
		return instance -> applicable.forEach(initializer -> initializer.accept(instance));
	}
	// endregion

	private static final class InitializerEntry {
		final Class<?> type;
		final Consumer<?> initializer;

		InitializerEntry(Class<?> type, Consumer<?> initializer) {
			this.type = type;
			this.initializer = initializer;
		}
	}
}
