package io.compositor.di.plan;

import org.jetbrains.annotations.NotNull;

import java.util.function.Supplier;

import static io.compositor.di.util.Utils.getShortName;

/**
 * Invokes a stored zero-argument delegate
 */
public final class NodeInvoke implements Node {
	@NotNull
	private final Supplier<?> supplier;
	@NotNull
	private final Class<?> type;

	NodeInvoke(@NotNull Supplier<?> supplier, @NotNull Class<?> type) {
		this.supplier = supplier;
		this.type = type;
	}

	@NotNull
	public Supplier<?> getSupplier() {
		return supplier;
	}

	@NotNull
	@Override
	public Class<?> getType() {
		return type;
	}

	@Override
	public <R> R accept(@NotNull NodeVisitor<R> visitor) {
		return visitor.visitInvoke(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		NodeInvoke that = (NodeInvoke) o;
		return supplier.equals(that.supplier) && type == that.type;
	}

	@Override
	public int hashCode() {
		return 31 * supplier.hashCode() + type.hashCode();
	}

	@Override
	public String toString() {
		return "invoke<" + getShortName(type) + ">()";
	}
}
