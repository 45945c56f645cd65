package works.envbind.exceptions;

/**
 * Base class of everything {@link works.envbind.EnvBinder EnvBinder} throws.
 */
public sealed abstract class EnvBindingException extends Exception permits
	FieldBindingException,
	InvalidTargetException
{
	protected EnvBindingException(String message) {
		super(message);
	}

	protected EnvBindingException(String message, Throwable cause) {
		super(message, cause);
	}
}
