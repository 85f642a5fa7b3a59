package io.compositor.di;

/**
 * Thrown when a construction plan can not be built or compiled, or when an instance can not be created
 */
public class ActivationException extends RuntimeException {
	public ActivationException(String message) {
		super(message);
	}

	public ActivationException(String message, Throwable cause) {
		super(message, cause);
	}
}
