package works.envbind;

import java.util.Locale;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The parsed form of an {@link Env} tag.
 *
 * @param explicitName the variable name to use instead of the derived one; empty if none
 * @param defaultValue used when the variable is absent
 * @param required whether absence (with no default) is an error
 */
public record TagDirectives(
	@NotNull String explicitName,
	@NotNull Optional<String> defaultValue,
	boolean required
) {
	public static final String SKIP = "-";

	public static final TagDirectives NONE = new TagDirectives("", Optional.empty(), false);

	public TagDirectives {
		requireNonNull(explicitName);
		requireNonNull(defaultValue);
	}

	public static TagDirectives of(@Nullable Env annotation) {
		return (annotation == null) ? NONE : parse(annotation.value());
	}

	/**
	 * Forgiving: tokens that are neither {@code key=value} nor {@code required}
	 * are ignored, as are unrecognized keys.
	 */
	public static TagDirectives parse(String tag) {
		int comma = tag.indexOf(',');
		String name = ((comma < 0) ? tag : tag.substring(0, comma)).trim();
		if (comma < 0) {
			return new TagDirectives(name, Optional.empty(), false);
		}

		String defaultValue = null;
		boolean required = false;
		for (String token : tag.substring(comma + 1).split(" ")) {
			int equals = token.indexOf('=');
			if (equals < 0) {
				if (token.equalsIgnoreCase(REQUIRED)) {
					required = true;
				}
				continue;
			}
			String key = token.substring(0, equals).toLowerCase(Locale.ROOT);
			if (key.equals(DEFAULT)) {
				defaultValue = token.substring(equals + 1).replace(ESCAPED_SPACE, " ");
			}
		}
		return new TagDirectives(name, Optional.ofNullable(defaultValue), required);
	}

	public boolean isSkipped() {
		return SKIP.equals(explicitName);
	}

	public boolean hasExplicitName() {
		return !explicitName.isEmpty();
	}

	private static final String REQUIRED = "required";
	private static final String DEFAULT = "default";
	private static final String ESCAPED_SPACE = "\\s";
}
