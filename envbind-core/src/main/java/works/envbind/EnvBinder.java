package works.envbind;

import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.envbind.exceptions.EnvBindingException;
import works.envbind.exceptions.FieldBindingException;
import works.envbind.exceptions.InvalidTargetException;

import static java.util.Objects.requireNonNull;
import static works.envbind.util.ReflectionHelpers.isConcrete;
import static works.envbind.util.ReflectionHelpers.isPlatformClass;
import static works.envbind.util.ReflectionHelpers.newInstance;

/**
 * Populates configuration objects from environment variables.
 * <p>
 * Typical use:
 *
 * <pre>
 *     AppConfig config = EnvBinder.standard().bind(System.getenv(), AppConfig.class);
 * </pre>
 *
 * or, to fill in an existing object:
 *
 * <pre>
 *     EnvBinder.standard().unmarshal(List.of("URL=https://example.com"), config);
 * </pre>
 *
 * Each field reads the variable named by its {@link Env} tag,
 * or else the one {@link EnvNames#deriveName derived} from its name,
 * so that {@code signingKey} reads {@code SIGNING_KEY}.
 * Fields holding nested objects are bound recursively, with the enclosing field's
 * variable name as a prefix: {@code auth.signingKey} reads {@code AUTH_SIGNING_KEY}.
 * <p>
 * The supported field types are:
 *
 * <ul>
 *     <li>
 *         anything implementing {@link EnvUnmarshaler};
 *     </li>
 *     <li>
 *         anything in {@link ValueParsers#BUILT_IN}, plus enums,
 *         plus whatever the {@link EnvBinderSettings#getParsers() settings} add;
 *     </li>
 *     <li>
 *         {@link java.util.Optional} of any of those;
 *     </li>
 *     <li>
 *         nested classes having a no-argument constructor, and nested records.
 *     </li>
 * </ul>
 *
 * Any other field type is an error, even if its variable is absent, unless the field is tagged {@code @Env("-")}.
 * Static, transient and synthetic fields are ignored.
 * <p>
 * Binding stops at the first error. Fields bound before it keep their new values.
 * <p>
 * Instances are immutable and may be shared between threads,
 * but a given target object must not be bound by two threads at once.
 */
public final class EnvBinder {
	private final EnvBinderSettings settings;
	private final ValueParsers parsers;

	private EnvBinder(EnvBinderSettings settings) {
		this.settings = settings;
		this.parsers = ValueParsers.BUILT_IN.with(settings.getParsers());
	}

	public static EnvBinder standard() {
		return STANDARD;
	}

	public static EnvBinder using(EnvBinderSettings settings) {
		return new EnvBinder(requireNonNull(settings));
	}

	public EnvBinderSettings settings() {
		return settings;
	}

	/**
	 * Binds {@code target} in place from {@code KEY=VALUE} strings.
	 *
	 * @throws InvalidTargetException if {@code target} is null, or of a type that can't be bound in place
	 * @throws FieldBindingException if any field fails
	 */
	public void unmarshal(Iterable<String> pairs, Object target) throws EnvBindingException {
		unmarshal(EnvPairs.parse(pairs), target, settings.getDefaultPrefix());
	}

	/**
	 * @param prefix prepended to every derived top-level variable name
	 * @see #unmarshal(Iterable, Object)
	 */
	public void unmarshal(Iterable<String> pairs, Object target, String prefix) throws EnvBindingException {
		unmarshal(EnvPairs.parse(pairs), target, prefix);
	}

	/**
	 * @param env variable values by name, like those from {@link System#getenv()}
	 * @see #unmarshal(Iterable, Object)
	 */
	public void unmarshal(Map<String, String> env, Object target) throws EnvBindingException {
		unmarshal(env, target, settings.getDefaultPrefix());
	}

	public void unmarshal(Map<String, String> env, Object target, String prefix) throws EnvBindingException {
		checkInPlaceTarget(target);
		requireNonNull(prefix);
		StructWalker walker = new StructWalker(parsers, env);
		try {
			walker.walkObject(target, "", prefix);
		} catch (FieldBindingException e) {
			LOGGER.debug("Unable to bind {}", target.getClass().getSimpleName(), e);
			throw e;
		}
		logSummary(walker, target.getClass());
	}

	/**
	 * Creates an instance of {@code type} and binds it.
	 * Unlike {@link #unmarshal(Iterable, Object) unmarshal}, this works with records.
	 *
	 * @throws InvalidTargetException if {@code type} can't be instantiated
	 * @throws FieldBindingException if any field fails
	 */
	public <T> T bind(Iterable<String> pairs, Class<T> type) throws EnvBindingException {
		return bind(EnvPairs.parse(pairs), type, settings.getDefaultPrefix());
	}

	public <T> T bind(Iterable<String> pairs, Class<T> type, String prefix) throws EnvBindingException {
		return bind(EnvPairs.parse(pairs), type, prefix);
	}

	public <T> T bind(Map<String, String> env, Class<T> type) throws EnvBindingException {
		return bind(env, type, settings.getDefaultPrefix());
	}

	public <T> T bind(Map<String, String> env, Class<T> type, String prefix) throws EnvBindingException {
		requireNonNull(prefix);
		if (type == null) {
			throw new InvalidTargetException("Target type must not be null");
		}
		StructWalker walker = new StructWalker(parsers, env);
		T result;
		try {
			if (type.isRecord()) {
				result = type.cast(walker.walkRecord(type, null, "", prefix, true));
			} else {
				checkInstantiable(type);
				result = instantiate(type);
				walker.walkObject(result, "", prefix);
			}
		} catch (FieldBindingException e) {
			LOGGER.debug("Unable to bind {}", type.getSimpleName(), e);
			throw e;
		}
		logSummary(walker, type);
		return result;
	}

	private static void checkInPlaceTarget(Object target) throws InvalidTargetException {
		if (target == null) {
			throw new InvalidTargetException("Target must be a non-null object");
		} else if (target instanceof Class<?> c) {
			throw new InvalidTargetException("Target must be an object, not a class; to create an instance of " + c.getSimpleName() + ", use bind()");
		}
		Class<?> type = target.getClass();
		if (type.isRecord()) {
			throw new InvalidTargetException("Record " + type.getSimpleName() + " can't be modified in place; use bind()");
		}
		checkInstantiable(type);
	}

	private static void checkInstantiable(Class<?> type) throws InvalidTargetException {
		if (!isConcrete(type) || isPlatformClass(type)) {
			throw new InvalidTargetException("Target must be a configuration object, not " + type.getName());
		}
	}

	private static <T> T instantiate(Class<T> type) throws InvalidTargetException {
		try {
			return newInstance(type);
		} catch (NoSuchMethodException | InstantiationException | IllegalArgumentException e) {
			throw new InvalidTargetException("Unable to instantiate " + type.getSimpleName() + "; it needs a no-argument constructor", e);
		} catch (InvocationTargetException e) {
			throw new InvalidTargetException("Constructor of " + type.getSimpleName() + " failed", e.getCause());
		}
	}

	private static void logSummary(StructWalker walker, Class<?> type) {
		int count = walker.assignedCount();
		LOGGER.debug("Assigned {} field{} of {}", count, (count == 1) ? "" : "s", type.getSimpleName());
	}

	private static final EnvBinder STANDARD = new EnvBinder(EnvBinderSettings.DEFAULT);
	private static final Logger LOGGER = LoggerFactory.getLogger(EnvBinder.class);
}
