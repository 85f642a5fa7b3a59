package io.compositor.di.plan;

@FunctionalInterface
public interface Factory<T> {
	T create();
}
