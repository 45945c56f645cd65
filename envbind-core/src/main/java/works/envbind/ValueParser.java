package works.envbind;

/**
 * Converts the raw text of a variable into a field value.
 * <p>
 * Implementations signal bad input by throwing an unchecked exception,
 * typically {@link IllegalArgumentException} (which includes {@link NumberFormatException})
 * or {@link java.time.DateTimeException}, so that JDK parsing methods can be used directly:
 * {@code Duration::parse}, {@code Integer::valueOf}, and so on.
 */
@FunctionalInterface
public interface ValueParser<T> {
	T parse(String value);
}
