package works.envbind.exceptions;

/**
 * A field marked {@code required} had no variable and no default.
 */
public final class MissingValueException extends Exception {
	public MissingValueException(String message) {
		super(message);
	}
}
