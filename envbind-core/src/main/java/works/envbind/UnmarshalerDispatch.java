package works.envbind;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Type;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import works.envbind.exceptions.FieldBindingException;
import works.envbind.exceptions.UnsupportedFieldTypeException;

import static works.envbind.util.ReflectionHelpers.newInstance;
import static works.envbind.util.ReflectionHelpers.optionalContentType;
import static works.envbind.util.ReflectionHelpers.rawClass;

/**
 * Hands values to fields whose type implements {@link EnvUnmarshaler},
 * looking through any number of {@link Optional} layers.
 */
final class UnmarshalerDispatch {
	private UnmarshalerDispatch() { }

	static boolean handles(Type fieldType) {
		Type type = fieldType;
		for (Type content = optionalContentType(type); content != null; content = optionalContentType(type)) {
			type = content;
		}
		return EnvUnmarshaler.class.isAssignableFrom(rawClass(type));
	}

	/**
	 * Creates whatever is missing between the field and the {@link EnvUnmarshaler}
	 * (enclosing {@link Optional}s and the unmarshaler itself),
	 * then passes it the binding's value.
	 * An unmarshaler already present in the field is reused.
	 *
	 * @return the new value for the field, which may be {@code current} itself
	 */
	static Object dispatch(Binding binding, Type fieldType, @Nullable Object current) throws FieldBindingException {
		Type content = optionalContentType(fieldType);
		if (content != null) {
			Object inner = (current instanceof Optional<?> o) ? o.orElse(null) : null;
			Object result = dispatch(binding, content, inner);
			return (result == inner && current != null) ? current : Optional.of(result);
		}

		EnvUnmarshaler unmarshaler = (current == null)
			? instantiate(binding, rawClass(fieldType))
			: (EnvUnmarshaler) current;
		try {
			unmarshaler.unmarshalEnv(binding.value());
		} catch (Exception e) {
			throw binding.fail(e);
		}
		return unmarshaler;
	}

	private static EnvUnmarshaler instantiate(Binding binding, Class<?> type) throws FieldBindingException {
		try {
			return (EnvUnmarshaler) newInstance(type);
		} catch (NoSuchMethodException | InstantiationException | IllegalArgumentException e) {
			throw binding.fail(new UnsupportedFieldTypeException(type, "unable to instantiate " + type.getName() + ": " + e.getMessage(), e));
		} catch (InvocationTargetException e) {
			throw binding.fail(e.getCause());
		}
	}
}
