package works.envbind;

import java.util.Optional;
import works.envbind.exceptions.FieldBindingException;

/**
 * Where one field gets its value.
 *
 * @param fieldPath dotted path from the top-level object, like {@code auth.signingKey}
 * @param envVarName the variable the field reads, like {@code AUTH_SIGNING_KEY}
 * @param rawValue the text to bind, if any
 * @param source where {@code rawValue} came from
 */
record Binding(
	String fieldPath,
	String envVarName,
	Optional<String> rawValue,
	Source source
) {
	enum Source {
		ENVIRONMENT,
		DEFAULT,
		ABSENT
	}

	boolean hasValue() {
		return rawValue.isPresent();
	}

	String value() {
		return rawValue.orElseThrow();
	}

	FieldBindingException fail(Throwable cause) {
		return new FieldBindingException(fieldPath, envVarName, cause);
	}

	String nestedPathPrefix() {
		return fieldPath + ".";
	}

	String nestedEnvPrefix() {
		return envVarName + "_";
	}
}
