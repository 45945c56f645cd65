package works.envbind;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.envbind.Binding.Source;
import works.envbind.exceptions.FieldBindingException;
import works.envbind.exceptions.MissingValueException;
import works.envbind.exceptions.UnsupportedFieldTypeException;
import works.envbind.exceptions.ValueConversionException;

import static works.envbind.util.ReflectionHelpers.componentValue;
import static works.envbind.util.ReflectionHelpers.defaultValue;
import static works.envbind.util.ReflectionHelpers.getBindableFields;
import static works.envbind.util.ReflectionHelpers.isBindable;
import static works.envbind.util.ReflectionHelpers.isConcrete;
import static works.envbind.util.ReflectionHelpers.isPlatformClass;
import static works.envbind.util.ReflectionHelpers.newInstance;
import static works.envbind.util.ReflectionHelpers.newRecord;
import static works.envbind.util.ReflectionHelpers.optionalContentType;
import static works.envbind.util.ReflectionHelpers.rawClass;

/**
 * Recursively binds the fields of one object graph from one environment.
 * <p>
 * Each field is handled in declaration order:
 *
 * <ol>
 *     <li>
 *         its {@link Env} tag is parsed, and a tag name of {@code -} skips the field;
 *     </li>
 *     <li>
 *         the variable name is the tag name if any, otherwise the prefix plus {@link EnvNames#deriveName};
 *     </li>
 *     <li>
 *         the value comes from the environment, else from the tag's default;
 *         if there's neither, a {@code required} field fails;
 *     </li>
 *     <li>
 *         then {@link EnvUnmarshaler}s get the value, {@link ValueParsers parseable} types are parsed,
 *         and nested objects are walked with the field's path and variable name as prefixes.
 *     </li>
 * </ol>
 *
 * A field with no value is left alone, except that nested objects are always walked,
 * since their own fields may have values. A null nested class is instantiated first;
 * a null nested record is only constructed if at least one of its components gets a value.
 * <p>
 * Not thread-safe; make one per call.
 */
final class StructWalker {
	private final ValueParsers parsers;
	private final Map<String, String> env;
	private final Deque<Class<?>> walking = new ArrayDeque<>();
	private int assignedCount = 0;
	private int valuesBound = 0;

	StructWalker(ValueParsers parsers, Map<String, String> env) {
		this.parsers = parsers;
		this.env = env;
	}

	/**
	 * @return the number of fields that have been given a value so far
	 */
	int assignedCount() {
		return assignedCount;
	}

	/**
	 * Binds the fields of a mutable object in place.
	 */
	void walkObject(Object target, String pathPrefix, String envPrefix) throws FieldBindingException {
		Class<?> targetClass = target.getClass();
		warnAboutIgnoredTags(targetClass);
		walking.push(targetClass);
		try {
			for (Field field : getBindableFields(targetClass)) {
				Binding binding = resolve(field.getName(), field.getAnnotation(Env.class), pathPrefix, envPrefix);
				if (binding == null) {
					continue;
				}
				Object current = getField(field, target);
				Object newValue = bindValue(binding, field.getGenericType(), current);
				if (newValue != current) {
					setField(binding, field, target, newValue);
				}
			}
		} finally {
			walking.pop();
		}
	}

	/**
	 * Records can't be changed in place, so this builds a new one from
	 * the components of {@code current} with the bindings applied.
	 * If {@code current} is null, unbound components get zero, null, or {@link Optional#empty()}.
	 *
	 * @param mustBuild if false, a null {@code current} stays null unless some component gets a value
	 * @return {@code current} if nothing changed
	 */
	@Nullable Object walkRecord(Class<?> recordClass, @Nullable Object current, String pathPrefix, String envPrefix, boolean mustBuild) throws FieldBindingException {
		RecordComponent[] components = recordClass.getRecordComponents();
		Object[] values = new Object[components.length];
		int valuesBefore = valuesBound;
		int assignedBefore = assignedCount;
		boolean changed = false;
		walking.push(recordClass);
		try {
			for (int i = 0; i < components.length; i++) {
				RecordComponent component = components[i];
				values[i] = (current == null) ? initialComponentValue(component.getType()) : getComponent(component, current, pathPrefix, envPrefix);
				Binding binding = resolve(component.getName(), component.getAnnotation(Env.class), pathPrefix, envPrefix);
				if (binding == null) {
					continue;
				}
				Object newValue = bindValue(binding, component.getGenericType(), values[i]);
				if (newValue != values[i]) {
					checkAssignable(binding, component.getType(), newValue);
					values[i] = newValue;
					changed = true;
					assignedCount++;
				}
			}
		} finally {
			walking.pop();
		}
		if (current == null && !mustBuild && valuesBound == valuesBefore) {
			LOGGER.trace("No variables for {}; leaving it null", recordClass.getSimpleName());
			assignedCount = assignedBefore;
			return null;
		}
		if (current != null && !changed) {
			return current;
		}
		try {
			return newRecord(recordClass, values);
		} catch (InvocationTargetException e) {
			throw constructionFailure(recordClass, pathPrefix, envPrefix, e.getCause());
		} catch (InstantiationException | IllegalArgumentException e) {
			throw constructionFailure(recordClass, pathPrefix, envPrefix,
				new UnsupportedFieldTypeException(recordClass, "unable to construct record " + recordClass.getName(), e));
		}
	}

	/**
	 * For a nested record, the path and variable are those of the field holding it.
	 * For a top-level record, the path is the record's simple name and the variable is the
	 * prefix without its trailing underscore, or empty if there's no prefix.
	 */
	private static FieldBindingException constructionFailure(Class<?> recordClass, String pathPrefix, String envPrefix, Throwable cause) {
		return new FieldBindingException(
			withoutSeparator(pathPrefix, '.', recordClass.getSimpleName()),
			withoutSeparator(envPrefix, '_', ""),
			cause);
	}

	/**
	 * @return null if the field is to be skipped
	 * @throws FieldBindingException if the field is required but has no value
	 */
	private @Nullable Binding resolve(String identifier, @Nullable Env tag, String pathPrefix, String envPrefix) throws FieldBindingException {
		TagDirectives directives = TagDirectives.of(tag);
		if (directives.isSkipped()) {
			LOGGER.trace("Skipping {}{}", pathPrefix, identifier);
			return null;
		}

		String fieldPath = pathPrefix + identifier;
		String envVarName = envVarName(identifier, directives, envPrefix);

		String fromEnv = env.get(envVarName);
		Binding result;
		if (fromEnv != null) {
			result = new Binding(fieldPath, envVarName, Optional.of(fromEnv), Source.ENVIRONMENT);
		} else if (directives.defaultValue().isPresent()) {
			result = new Binding(fieldPath, envVarName, directives.defaultValue(), Source.DEFAULT);
		} else if (directives.required()) {
			throw new FieldBindingException(fieldPath, envVarName, new MissingValueException("required environment variable " + envVarName + " is not set"));
		} else {
			result = new Binding(fieldPath, envVarName, Optional.empty(), Source.ABSENT);
		}
		LOGGER.debug("Field {} maps to {} ({})", fieldPath, envVarName, result.source());
		return result;
	}

	/**
	 * @return the value the field should have; {@code current} itself if it should be left alone
	 */
	private Object bindValue(Binding binding, Type fieldType, @Nullable Object current) throws FieldBindingException {
		if (UnmarshalerDispatch.handles(fieldType)) {
			if (!binding.hasValue()) {
				return current;
			}
			valuesBound++;
			return UnmarshalerDispatch.dispatch(binding, fieldType, current);
		}

		Class<?> fieldClass = rawClass(fieldType);
		ValueParser<?> parser = parsers.parserFor(fieldClass);
		if (parser != null) {
			return binding.hasValue()
				? parse(binding, parser, fieldClass)
				: current;
		}

		Type content = optionalContentType(fieldType);
		if (content != null) {
			// Only one level of Optional for parsed values
			Class<?> contentClass = rawClass(content);
			ValueParser<?> contentParser = parsers.parserFor(contentClass);
			if (contentParser == null) {
				throw binding.fail(new UnsupportedFieldTypeException(content));
			}
			return binding.hasValue()
				? Optional.ofNullable(parse(binding, contentParser, contentClass))
				: current;
		}

		if (isNestedObject(fieldClass)) {
			return walkNested(binding, fieldClass, current);
		}

		throw binding.fail(new UnsupportedFieldTypeException(fieldType));
	}

	private @Nullable Object parse(Binding binding, ValueParser<?> parser, Class<?> targetClass) throws FieldBindingException {
		String value = binding.value();
		valuesBound++;
		Object result;
		try {
			result = parser.parse(value);
		} catch (RuntimeException e) {
			throw binding.fail(new ValueConversionException("unable to parse \"" + value + "\" as " + targetClass.getSimpleName() + ": " + e.getMessage(), e));
		}
		if (result == null && targetClass.isPrimitive()) {
			throw binding.fail(new ValueConversionException("parser returned null for primitive " + targetClass.getSimpleName()));
		}
		return result;
	}

	private Object walkNested(Binding binding, Class<?> nestedClass, @Nullable Object current) throws FieldBindingException {
		if (walking.contains(nestedClass)) {
			throw binding.fail(new UnsupportedFieldTypeException(nestedClass, "nested type " + nestedClass.getName() + " contains itself"));
		}
		if (nestedClass.isRecord()) {
			return walkRecord(nestedClass, current, binding.nestedPathPrefix(), binding.nestedEnvPrefix(), false);
		}
		Object target = (current == null) ? instantiate(binding, nestedClass) : current;
		walkObject(target, binding.nestedPathPrefix(), binding.nestedEnvPrefix());
		return target;
	}

	private boolean isNestedObject(Class<?> type) {
		return isConcrete(type) && !isPlatformClass(type);
	}

	private static Object instantiate(Binding binding, Class<?> type) throws FieldBindingException {
		try {
			return newInstance(type);
		} catch (NoSuchMethodException | InstantiationException | IllegalArgumentException e) {
			throw binding.fail(new UnsupportedFieldTypeException(type, "nested type " + type.getName() + " needs a no-argument constructor", e));
		} catch (InvocationTargetException e) {
			throw binding.fail(e.getCause());
		}
	}

	private void setField(Binding binding, Field field, Object target, Object newValue) throws FieldBindingException {
		if (Modifier.isFinal(field.getModifiers())) {
			throw binding.fail(new UnsupportedFieldTypeException(field.getGenericType(), "cannot assign final field " + field.getName()));
		}
		checkAssignable(binding, field.getType(), newValue);
		try {
			field.set(target, newValue);
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException(e);
		}
		assignedCount++;
	}

	private void checkAssignable(Binding binding, Class<?> fieldClass, @Nullable Object newValue) throws FieldBindingException {
		if (newValue == null) {
			if (fieldClass.isPrimitive()) {
				throw binding.fail(new ValueConversionException("null can't be assigned to primitive " + fieldClass.getSimpleName()));
			}
			return;
		}
		Class<?> boxed = fieldClass.isPrimitive() ? defaultValue(fieldClass).getClass() : fieldClass;
		if (!boxed.isInstance(newValue)) {
			throw binding.fail(new ValueConversionException("value of type " + newValue.getClass().getName() + " can't be assigned to " + fieldClass.getName()));
		}
	}

	private static Object getField(Field field, Object target) {
		try {
			return field.get(target);
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException(e);
		}
	}

	private static String envVarName(String identifier, TagDirectives directives, String envPrefix) {
		return (directives.hasExplicitName() && !directives.isSkipped())
			? directives.explicitName()
			: envPrefix + EnvNames.deriveName(identifier);
	}

	private static Object getComponent(RecordComponent component, Object record, String pathPrefix, String envPrefix) throws FieldBindingException {
		try {
			return componentValue(component, record);
		} catch (InvocationTargetException e) {
			String name = component.getName();
			TagDirectives directives = TagDirectives.of(component.getAnnotation(Env.class));
			throw new FieldBindingException(pathPrefix + name, envVarName(name, directives, envPrefix), e.getCause());
		}
	}

	private static @Nullable Object initialComponentValue(Class<?> type) {
		return (type == Optional.class) ? Optional.empty() : defaultValue(type);
	}

	private static void warnAboutIgnoredTags(Class<?> type) {
		for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
			for (Field field : c.getDeclaredFields()) {
				if (!isBindable(field) && field.isAnnotationPresent(Env.class)) {
					LOGGER.warn("Field {}.{} has an @Env tag but will never be bound", c.getSimpleName(), field.getName());
				}
			}
		}
	}

	/**
	 * Turns a prefix like {@code auth.} back into the name it was made from.
	 */
	private static String withoutSeparator(String prefix, char separator, String ifEmpty) {
		if (prefix.isEmpty()) {
			return ifEmpty;
		} else if (prefix.charAt(prefix.length() - 1) == separator) {
			return prefix.substring(0, prefix.length() - 1);
		} else {
			return prefix;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(StructWalker.class);
}
