/**
 * Binds environment variables onto configuration objects.
 * <p>
 * Start with {@link works.envbind.EnvBinder}.
 * Fields are customized with the {@link works.envbind.Env} tag,
 * and types can parse themselves by implementing {@link works.envbind.EnvUnmarshaler}.
 */
package works.envbind;
