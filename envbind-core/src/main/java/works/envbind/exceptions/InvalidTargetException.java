package works.envbind.exceptions;

/**
 * The object handed to the binder can't receive bindings at all,
 * so no field was looked at.
 */
public final class InvalidTargetException extends EnvBindingException {
	public InvalidTargetException(String message) {
		super(message);
	}

	public InvalidTargetException(String message, Throwable cause) {
		super(message, cause);
	}
}
