package works.envbind;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Tells {@link EnvBinder} how to bind a field.
 * <p>
 * The value has the form {@code name,directive directive...}:
 *
 * <ul>
 *     <li>
 *         {@code name} overrides the derived variable name.
 *         Leave it empty to keep the derived one, or use {@code -} to skip the field entirely.
 *     </li>
 *     <li>
 *         {@code required} makes a missing variable an error.
 *     </li>
 *     <li>
 *         {@code default=value} is used when the variable is missing.
 *         Directives are separated by spaces, so write {@code \s} for a space inside the value.
 *     </li>
 * </ul>
 *
 * For example:
 *
 * <pre>
 *     public class AppConfig {
 *         &#64;Env("-") Thread worker;
 *         &#64;Env(",required default=John\\sDoe") String name;
 *         &#64;Env("AUTH") Auth authentication;
 *     }
 * </pre>
 *
 * @see TagDirectives
 */
@Retention(RUNTIME)
@Target({ FIELD, RECORD_COMPONENT })
public @interface Env {
	String value();
}
