package works.envbind.exceptions;

import static java.util.Objects.requireNonNull;

/**
 * A single field could not be bound.
 * <p>
 * Created once, where the problem is detected, and then propagated unchanged
 * out of any enclosing nested objects. The {@link #getCause() cause} says what went wrong:
 * {@link MissingValueException}, {@link UnsupportedFieldTypeException},
 * {@link ValueConversionException}, or whatever an
 * {@link works.envbind.EnvUnmarshaler EnvUnmarshaler} threw.
 */
public final class FieldBindingException extends EnvBindingException {
	private final String fieldPath;
	private final String envVar;

	public FieldBindingException(String fieldPath, String envVar, Throwable cause) {
		super(fullMessage(fieldPath, envVar, cause), requireNonNull(cause));
		this.fieldPath = fieldPath;
		this.envVar = envVar;
	}

	/**
	 * @return the dotted path from the top-level object, like {@code auth.signingKey},
	 * or the record's simple name when a top-level record's constructor fails
	 */
	public String fieldPath() {
		return fieldPath;
	}

	/**
	 * @return the environment variable name the field resolved to.
	 * When a top-level record's constructor fails there is no single variable, so this is
	 * the prefix without its trailing underscore, or empty if there was no prefix.
	 */
	public String envVar() {
		return envVar;
	}

	private static String fullMessage(String fieldPath, String envVar, Throwable cause) {
		return "failed to set value of field " + fieldPath + ", mapping to env var " + envVar + ": " + cause.getMessage();
	}
}
