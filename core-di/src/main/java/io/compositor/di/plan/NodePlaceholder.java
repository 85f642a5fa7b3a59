package io.compositor.di.plan;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicLong;

import static io.compositor.di.util.Utils.getShortName;

/**
 * A stand-in for a node that is substituted later by a {@link PlaceholderReplacer}.
 * <p>
 * Every placeholder carries a unique token and is equal only to itself,
 * so two placeholders of the same type never match each other.
 */
public final class NodePlaceholder implements Node {
	private static final AtomicLong TOKENS = new AtomicLong();

	private final long token;
	@NotNull
	private final Class<?> type;

	NodePlaceholder(@NotNull Class<?> type) {
		this.token = TOKENS.incrementAndGet();
		this.type = type;
	}

	public long getToken() {
		return token;
	}

	@NotNull
	@Override
	public Class<?> getType() {
		return type;
	}

	@Override
	public <R> R accept(@NotNull NodeVisitor<R> visitor) {
		return visitor.visitPlaceholder(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return token == ((NodePlaceholder) o).token;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(token);
	}

	@Override
	public String toString() {
		return "placeholder#" + token + "<" + getShortName(type) + ">";
	}
}
