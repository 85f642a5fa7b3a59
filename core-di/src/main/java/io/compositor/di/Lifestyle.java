package io.compositor.di;

import org.jetbrains.annotations.NotNull;

import java.util.function.Supplier;

import static io.compositor.di.util.Utils.checkArgument;
import static io.compositor.di.util.Utils.checkNotNull;

/**
 * Decides how instances created by a registration are cached.
 * <p>
 * A lifestyle creates the {@link Registration} of every service registered with it.
 * {@link #TRANSIENT} applies no caching at all, a new instance is created on every request.
 */
public abstract class Lifestyle {
	public static final Lifestyle TRANSIENT = new TransientLifestyle();

	@NotNull
	private final String name;

	protected Lifestyle(@NotNull String name) {
		this.name = checkNotNull(name, "name");
	}

	@NotNull
	public String getName() {
		return name;
	}

	@NotNull
	public final <S, I extends S> Registration createRegistration(@NotNull Class<S> serviceType,
			@NotNull Class<I> implementationType, @NotNull Container container) {
		checkNotNull(serviceType, "serviceType");
		checkNotNull(implementationType, "implementationType");
		checkNotNull(container, "container");
		checkArgument(serviceType.isAssignableFrom(implementationType),
				"%s does not implement %s", implementationType.getName(), serviceType.getName());
		return doCreateRegistration(serviceType, implementationType, container);
	}

	@NotNull
	public final <S> Registration createRegistration(@NotNull Class<S> serviceType,
			@NotNull Supplier<? extends S> instanceCreator, @NotNull Container container) {
		checkNotNull(serviceType, "serviceType");
		checkNotNull(instanceCreator, "instanceCreator");
		checkNotNull(container, "container");
		return doCreateRegistration(serviceType, instanceCreator, container);
	}

	protected abstract Registration doCreateRegistration(Class<?> serviceType, Class<?> implementationType, Container container);

	protected abstract Registration doCreateRegistration(Class<?> serviceType, Supplier<?> instanceCreator, Container container);

	@Override
	public String toString() {
		return name;
	}

	private static final class TransientLifestyle extends Lifestyle {
		TransientLifestyle() {
			super("Transient");
		}

		@Override
		protected Registration doCreateRegistration(Class<?> serviceType, Class<?> implementationType, Container container) {
			return new ConstructorRegistration(this, container, serviceType, implementationType);
		}

		@Override
		protected Registration doCreateRegistration(Class<?> serviceType, Supplier<?> instanceCreator, Container container) {
			return new DelegateRegistration(this, container, serviceType, instanceCreator);
		}
	}
}
