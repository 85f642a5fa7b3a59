package io.compositor.di.plan;

import io.compositor.di.ActivationException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

import static io.compositor.di.util.Utils.checkNotNull;
import static io.compositor.di.util.Utils.isAssignable;
import static java.lang.String.format;

/**
 * Compiles a node tree into a {@link Factory}.
 * <p>
 * The tree is walked once, all type checks and reflective lookups happen here,
 * and the result is a chain of closures which only run the creation steps.
 */
public final class FactoryCompiler implements NodeVisitor<Factory<?>> {
	private static final Logger logger = LoggerFactory.getLogger(FactoryCompiler.class);

	private FactoryCompiler() {
	}

	/**
	 * @param node       root of the tree to compile
	 * @param targetType type of the instances the factory must produce
	 * @throws ActivationException if the tree can not be compiled into a factory of {@code targetType}
	 */
	@SuppressWarnings("unchecked")
	@NotNull
	public static <T> Factory<T> compile(@NotNull Node node, @NotNull Class<T> targetType) {
		checkNotNull(node, "node");
		checkNotNull(targetType, "targetType");
		try {
			if (!isAssignable(targetType, node.getType())) {
				throw new ActivationException(format("%s is not assignable to %s",
						node.getType().getName(), targetType.getName()));
			}
			Factory<T> factory = (Factory<T>) node.accept(new FactoryCompiler());
			if (logger.isTraceEnabled()) logger.trace("Compiled factory of {} from {}", targetType.getName(), node);
			return factory;
		} catch (ActivationException e) {
			throw new ActivationException(format("Error occurred while trying to build a factory for type %s using node %s. %s",
					targetType.getName(), node, e.getMessage()), e);
		}
	}

	@Override
	public Factory<?> visitConstant(NodeConstant node) {
		Object value = node.getValue();
		return () -> value;
	}

	@Override
	public Factory<?> visitInvoke(NodeInvoke node) {
		Supplier<?> supplier = node.getSupplier();
		return supplier::get;
	}

	@Override
	public Factory<?> visitConstructor(NodeConstructor node) {
		Constructor<?> constructor = node.getConstructor();
		Class<?>[] parameterTypes = constructor.getParameterTypes();
		List<Node> arguments = node.getArguments();
		if (parameterTypes.length != arguments.size()) {
			throw new ActivationException(format("Constructor %s expects %d arguments, got %d",
					constructor, parameterTypes.length, arguments.size()));
		}

		Factory<?>[] argumentFactories = new Factory<?>[arguments.size()];
		for (int i = 0; i < argumentFactories.length; i++) {
			Node argument = arguments.get(i);
			if (!isAssignable(parameterTypes[i], argument.getType())) {
				throw new ActivationException(format("Argument %d of constructor %s expects %s, but %s produces %s",
						i, constructor, parameterTypes[i].getName(), argument, argument.getType().getName()));
			}
			argumentFactories[i] = argument.accept(this);
		}

		try {
			constructor.setAccessible(true);
		} catch (RuntimeException e) {
			throw new ActivationException(format("Constructor %s is not accessible", constructor), e);
		}

		return () -> {
			Object[] args = new Object[argumentFactories.length];
			for (int i = 0; i < args.length; i++) {
				args[i] = argumentFactories[i].create();
			}
			return newInstance(constructor, args);
		};
	}

	@Override
	public Factory<?> visitApply(NodeApply node) {
		Factory<?> factory = node.getNode().accept(this);
		Function<Object, ?> function = node.getFunction();
		return () -> function.apply(factory.create());
	}

	@Override
	public Factory<?> visitPlaceholder(NodePlaceholder node) {
		throw new ActivationException(format("%s has not been replaced", node));
	}

	private static Object newInstance(Constructor<?> constructor, Object[] args) {
		try {
			return constructor.newInstance(args);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof ActivationException) {
				throw (ActivationException) cause;
			}
			throw new ActivationException(format("Constructor %s has thrown an exception: %s", constructor, cause), cause);
		} catch (InstantiationException | IllegalAccessException | IllegalArgumentException e) {
			throw new ActivationException(format("Could not invoke constructor %s", constructor), e);
		}
	}
}
