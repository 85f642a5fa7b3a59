package io.compositor.di;

import io.compositor.di.plan.Node;
import io.compositor.di.plan.NodePlaceholder;
import io.compositor.di.plan.Nodes;
import io.compositor.di.resolve.ParameterResolutionPolicy;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import static io.compositor.di.util.Utils.checkNotNull;
import static java.lang.String.format;

/**
 * Builds the construction plan of a single registered service.
 * <p>
 * A {@link Lifestyle} creates one registration per registered service. The plan returned by
 * {@link #buildExpression()} has been offered to every {@link ExpressionBuildingListener} of the container,
 * has the applicable initializers applied and all overridden parameters substituted.
 * While building, the registration records which other registrations it depends on,
 * see {@link #getRelationships()}.
 */
public abstract class Registration {
	private static final Logger logger = LoggerFactory.getLogger(Registration.class);

	@NotNull
	private final Lifestyle lifestyle;
	@NotNull
	private final Container container;

	private final RelationshipSet relationships = new RelationshipSet();

	@Nullable
	private volatile ParameterOverrides parameterOverrides;

	protected Registration(@NotNull Lifestyle lifestyle, @NotNull Container container) {
		this.lifestyle = checkNotNull(lifestyle, "lifestyle");
		this.container = checkNotNull(container, "container");
	}

	/**
	 * Type of the instances this registration creates
	 */
	@NotNull
	public abstract Class<?> getImplementationType();

	/**
	 * Builds a new construction plan with the caching of its lifestyle applied
	 */
	@NotNull
	public abstract Node buildExpression();

	@NotNull
	public Lifestyle getLifestyle() {
		return lifestyle;
	}

	public KnownRelationship[] getRelationships() {
		return relationships.toArray();
	}

	public void replaceRelationships(@NotNull Collection<KnownRelationship> relationships) {
		this.relationships.replace(relationships);
	}

	public void addRelationship(@NotNull KnownRelationship relationship) {
		relationships.add(relationship);
	}

	/**
	 * Replaces the overridden constructor parameters of this registration.
	 * Overrides for parameters that do not belong to the selected constructor have no effect.
	 * Not meant to be called concurrently with {@link #buildExpression()}.
	 */
	public void setParameterOverrides(@NotNull Map<Parameter, ? extends Node> overrides) {
		this.parameterOverrides = ParameterOverrides.of(overrides);
	}

	public boolean hasParameterOverride(@NotNull Parameter parameter) {
		ParameterOverrides overrides = this.parameterOverrides;
		return overrides != null && overrides.getPlaceholder(parameter) != null;
	}

	/**
	 * Builds a plan which creates instances by calling the given delegate.
	 * The plan is intercepted first, then guarded against {@code null} results,
	 * then wrapped with the initializers of {@code serviceType}.
	 */
	@NotNull
	protected final Node buildTransientNode(@NotNull Class<?> serviceType, @NotNull Supplier<?> instanceCreator) {
		checkNotNull(serviceType, "serviceType");
		checkNotNull(instanceCreator, "instanceCreator");

		Node node = Nodes.invoke(instanceCreator, serviceType);

		node = interceptInstanceCreation(serviceType, serviceType, node);

		// the null check goes after interception so that listeners see the bare delegate,
		// and before initializers so that they never receive null
		node = wrapWithNullChecker(serviceType, node);

		node = wrapWithInitializer(serviceType, node);

		if (logger.isTraceEnabled()) logger.trace("Built plan of {}: {}", serviceType.getName(), node);
		return node;
	}

	/**
	 * Builds a plan which creates instances by calling a constructor of {@code implementationType}
	 * chosen by the constructor resolution policy of the container.
	 */
	@NotNull
	protected final Node buildTransientNode(@NotNull Class<?> serviceType, @NotNull Class<?> implementationType) {
		checkNotNull(serviceType, "serviceType");
		checkNotNull(implementationType, "implementationType");

		ParameterOverrides overrides = this.parameterOverrides;

		Node node = buildConstructorNode(serviceType, implementationType, overrides);

		node = interceptInstanceCreation(serviceType, implementationType, node);

		node = wrapWithInitializer(implementationType, node);

		if (overrides != null) {
			node = overrides.replacePlaceholders(node);
		}

		if (logger.isTraceEnabled()) logger.trace("Built plan of {}: {}", serviceType.getName(), node);
		return node;
	}

	private Node buildConstructorNode(Class<?> serviceType, Class<?> implementationType, @Nullable ParameterOverrides overrides) {
		Constructor<?> constructor = container.getOptions().getConstructorResolutionPolicy()
				.getConstructor(serviceType, implementationType);

		replaceRelationships(collectRelationships(implementationType, constructor));

		Parameter[] parameters = constructor.getParameters();
		List<Node> arguments = new ArrayList<>(parameters.length);
		for (Parameter parameter : parameters) {
			NodePlaceholder placeholder = overrides != null ? overrides.getPlaceholder(parameter) : null;
			arguments.add(placeholder != null ? placeholder : buildParameterNode(parameter));
		}
		return Nodes.construct(constructor, arguments);
	}

	private List<KnownRelationship> collectRelationships(Class<?> implementationType, Constructor<?> constructor) {
		List<KnownRelationship> result = new ArrayList<>();
		for (Class<?> parameterType : constructor.getParameterTypes()) {
			Registration dependency = container.getRegistrationEvenIfInvalid(parameterType);
			if (dependency != null) {
				result.add(new KnownRelationship(implementationType, lifestyle, dependency));
			}
		}
		return result;
	}

	private Node buildParameterNode(Parameter parameter) {
		ParameterResolutionPolicy policy = container.getOptions().getParameterResolutionPolicy();
		Node node = policy.buildParameterNode(parameter);
		if (node == null) {
			throw new ActivationException(format("%s returned null for parameter '%s' of %s. " +
							"Implementations should throw an ActivationException when a parameter can not be resolved.",
					policy.getClass().getName(), parameter.getName(), parameter.getDeclaringExecutable()));
		}
		return node;
	}

	private Node interceptInstanceCreation(Class<?> serviceType, Class<?> implementationType, Node node) {
		return container.onExpressionBuilding(this, serviceType, implementationType, node);
	}

	private static Node wrapWithNullChecker(Class<?> serviceType, Node node) {
		return Nodes.apply(node, node.getType(), new NullChecker(serviceType), "checkNotNull");
	}

	private Node wrapWithInitializer(Class<?> implementationType, Node node) {
		Consumer<Object> initializer = container.getInitializer(implementationType);
		if (initializer == null) {
			return node;
		}
		return Nodes.apply(node, node.getType(), new InitializerInvoker(implementationType, initializer), "initialize");
	}

	private static final class NullChecker implements Function<Object, Object> {
		private final Class<?> serviceType;

		NullChecker(Class<?> serviceType) {
			this.serviceType = serviceType;
		}

		@Override
		public Object apply(Object instance) {
			if (instance == null) {
				throw new ActivationException(format("The registered delegate for type %s returned null.", serviceType.getName()));
			}
			return instance;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			return serviceType == ((NullChecker) o).serviceType;
		}

		@Override
		public int hashCode() {
			return serviceType.hashCode();
		}
	}

	/**
	 * Wraps runtime exceptions thrown by an initializer into {@link ActivationException}.
	 * Errors are not caught and propagate from the factory unwrapped.
	 */
	private static final class InitializerInvoker implements Function<Object, Object> {
		private final Class<?> implementationType;
		private final Consumer<Object> initializer;

		InitializerInvoker(Class<?> implementationType, Consumer<Object> initializer) {
			this.implementationType = implementationType;
			this.initializer = initializer;
		}

		@Override
		public Object apply(Object instance) {
			try {
				initializer.accept(instance);
			} catch (RuntimeException e) {
				throw new ActivationException(format("An initializer of type %s has thrown an exception: %s",
						implementationType.getName(), e.getMessage()), e);
			}
			return instance;
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" + getImplementationType().getName() + ", " + lifestyle + "}";
	}
}
