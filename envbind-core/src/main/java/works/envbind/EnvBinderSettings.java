package works.envbind;

import java.util.Map;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class EnvBinderSettings {
	/**
	 * Prepended to every derived top-level variable name when a call doesn't supply its own prefix.
	 * Explicit names in {@link Env} tags are never prefixed.
	 */
	@Default String defaultPrefix = "";

	/**
	 * Parsers for additional types, or replacements for the built-in ones.
	 * These take precedence over {@link ValueParsers#BUILT_IN} and over
	 * treating a class as a nested object.
	 */
	@Singular Map<Class<?>, ValueParser<?>> parsers;

	public static final EnvBinderSettings DEFAULT = EnvBinderSettings.builder().build();
}
