package works.envbind;

/**
 * Implemented by field types that know how to parse themselves.
 * <p>
 * When a field's type implements this, possibly wrapped in any number of
 * {@link java.util.Optional}s, {@link EnvBinder} hands the raw variable value to
 * {@link #unmarshalEnv} instead of using its built-in parsers or treating the
 * type as a nested object. If the field holds no instance, one is created
 * with the type's no-argument constructor, so implementations are typically
 * mutable and update themselves:
 *
 * <pre>
 *     public class IdList implements EnvUnmarshaler {
 *         final List&lt;String> ids = new ArrayList&lt;>();
 *
 *         &#64;Override
 *         public void unmarshalEnv(String value) {
 *             ids.addAll(List.of(value.split(":")));
 *         }
 *     }
 * </pre>
 *
 * Not called at all when the variable is absent and there's no default.
 */
public interface EnvUnmarshaler {
	/**
	 * @throws Exception if {@code value} is unacceptable; it becomes the cause of the
	 * resulting {@link works.envbind.exceptions.FieldBindingException FieldBindingException}
	 */
	void unmarshalEnv(String value) throws Exception;
}
