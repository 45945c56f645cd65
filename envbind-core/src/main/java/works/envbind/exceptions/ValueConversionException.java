package works.envbind.exceptions;

/**
 * A value was present but couldn't be parsed into the field's type.
 * The cause, when there is one, is the parser's own exception.
 */
public final class ValueConversionException extends Exception {
	public ValueConversionException(String message) {
		super(message);
	}

	public ValueConversionException(String message, Throwable cause) {
		super(message, cause);
	}
}
