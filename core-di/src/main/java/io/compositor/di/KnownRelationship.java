package io.compositor.di;

import org.jetbrains.annotations.NotNull;

import static io.compositor.di.util.Utils.checkNotNull;
import static io.compositor.di.util.Utils.getShortName;

/**
 * A dependency of an implementation type, built under some lifestyle, on another registration
 */
public final class KnownRelationship {
	@NotNull
	private final Class<?> implementationType;
	@NotNull
	private final Lifestyle lifestyle;
	@NotNull
	private final Registration dependency;

	public KnownRelationship(@NotNull Class<?> implementationType, @NotNull Lifestyle lifestyle, @NotNull Registration dependency) {
		this.implementationType = checkNotNull(implementationType, "implementationType");
		this.lifestyle = checkNotNull(lifestyle, "lifestyle");
		this.dependency = checkNotNull(dependency, "dependency");
	}

	@NotNull
	public Class<?> getImplementationType() {
		return implementationType;
	}

	@NotNull
	public Lifestyle getLifestyle() {
		return lifestyle;
	}

	@NotNull
	public Registration getDependency() {
		return dependency;
	}

	public String getDisplayString() {
		return getShortName(implementationType) + " (" + lifestyle.getName() + ") -> " + getShortName(dependency.getImplementationType());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}

		KnownRelationship that = (KnownRelationship) o;

		return implementationType == that.implementationType &&
				lifestyle.equals(that.lifestyle) &&
				dependency.equals(that.dependency);
	}

	@Override
	public int hashCode() {
		int result = implementationType.hashCode();
		result = 31 * result + lifestyle.hashCode();
		result = 31 * result + dependency.hashCode();
		return result;
	}

	@Override
	public String toString() {
		return "{" + implementationType.getName() + ", " + lifestyle + " -> " + dependency + "}";
	}
}
