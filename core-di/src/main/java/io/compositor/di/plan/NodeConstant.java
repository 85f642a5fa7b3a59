package io.compositor.di.plan;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public final class NodeConstant implements Node {
	@Nullable
	private final Object value;
	@NotNull
	private final Class<?> type;

	NodeConstant(@Nullable Object value, @NotNull Class<?> type) {
		this.value = value;
		this.type = type;
	}

	@Nullable
	public Object getValue() {
		return value;
	}

	@NotNull
	@Override
	public Class<?> getType() {
		return type;
	}

	@Override
	public <R> R accept(@NotNull NodeVisitor<R> visitor) {
		return visitor.visitConstant(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		NodeConstant that = (NodeConstant) o;
		return Objects.equals(value, that.value) && type == that.type;
	}

	@Override
	public int hashCode() {
		return 31 * Objects.hashCode(value) + type.hashCode();
	}

	@Override
	public String toString() {
		return "constant(" + value + ")";
	}
}
