/**
 * Binds environment variables onto typed configuration objects.
 * <p>
 * Start with {@link works.envbind.EnvBinder}. Failures are reported with
 * the checked exceptions in {@link works.envbind.exceptions}.
 * <p>
 * Configuration classes are read and written reflectively, so a named module
 * holding them must open their packages to this one.
 */
module works.envbind.core {
	requires transitive org.jetbrains.annotations;
	requires transitive org.jooq.joou;
	requires org.slf4j;

	requires static lombok;

	exports works.envbind;
	exports works.envbind.exceptions;
}
