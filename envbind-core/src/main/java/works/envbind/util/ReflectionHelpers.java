package works.envbind.util;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

import static java.lang.reflect.Modifier.isStatic;
import static java.lang.reflect.Modifier.isTransient;

public final class ReflectionHelpers {
	private ReflectionHelpers() { }

	/**
	 * Instance fields of {@code type} and its superclasses, superclass fields first,
	 * each class's fields in declaration order as reported by {@link Class#getDeclaredFields()}.
	 * Static, transient and synthetic fields are excluded.
	 * <p>
	 * Fields are made accessible.
	 *
	 * @throws IllegalArgumentException if a field can't be made accessible
	 */
	public static List<Field> getBindableFields(Class<?> type) {
		Deque<Class<?>> hierarchy = new ArrayDeque<>();
		for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
			hierarchy.addFirst(c);
		}
		List<Field> result = new ArrayList<>();
		for (Class<?> c : hierarchy) {
			for (Field field : c.getDeclaredFields()) {
				if (isBindable(field)) {
					makeAccessible(field);
					result.add(field);
				}
			}
		}
		return result;
	}

	public static boolean isBindable(Field field) {
		int modifiers = field.getModifiers();
		return !isStatic(modifiers) && !isTransient(modifiers) && !field.isSynthetic();
	}

	/**
	 * @return the type argument of {@code type} if it's a parameterized {@link Optional}, or null otherwise.
	 * A raw {@code Optional} gives null, since there's no telling what it holds.
	 */
	public static @Nullable Type optionalContentType(Type type) {
		if (type instanceof ParameterizedType p && p.getRawType() == Optional.class) {
			return p.getActualTypeArguments()[0];
		} else {
			return null;
		}
	}

	/**
	 * @return the class that values of {@code type} will have, as near as reflection can tell
	 */
	public static Class<?> rawClass(Type type) {
		if (type instanceof Class<?> c) {
			return c;
		} else if (type instanceof ParameterizedType p) {
			return rawClass(p.getRawType());
		} else if (type instanceof GenericArrayType a) {
			return Array.newInstance(rawClass(a.getGenericComponentType()), 0).getClass();
		} else if (type instanceof TypeVariable<?> v) {
			return rawClass(v.getBounds()[0]);
		} else if (type instanceof WildcardType w) {
			return rawClass(w.getUpperBounds()[0]);
		} else {
			throw new IllegalArgumentException("Unexpected type: " + type);
		}
	}

	/**
	 * Calls the no-argument constructor of {@code type}, even if it's not public.
	 *
	 * @throws NoSuchMethodException if there is no such constructor
	 * @throws InvocationTargetException if the constructor throws
	 */
	public static <T> T newInstance(Class<T> type) throws NoSuchMethodException, InvocationTargetException, InstantiationException {
		Constructor<T> constructor = type.getDeclaredConstructor();
		makeAccessible(constructor);
		try {
			return constructor.newInstance();
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException("Unable to access constructor of " + type.getSimpleName(), e);
		}
	}

	/**
	 * Calls the canonical constructor of the given record class.
	 *
	 * @throws InvocationTargetException if the constructor throws
	 */
	public static <R> R newRecord(Class<R> recordClass, Object[] componentValues) throws InvocationTargetException, InstantiationException {
		RecordComponent[] components = recordClass.getRecordComponents();
		Class<?>[] parameterTypes = new Class<?>[components.length];
		for (int i = 0; i < components.length; i++) {
			parameterTypes[i] = components[i].getType();
		}
		Constructor<R> constructor;
		try {
			constructor = recordClass.getDeclaredConstructor(parameterTypes);
		} catch (NoSuchMethodException e) {
			throw new IllegalStateException("Record " + recordClass.getSimpleName() + " has no canonical constructor", e);
		}
		makeAccessible(constructor);
		try {
			return constructor.newInstance(componentValues);
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException("Unable to access constructor of " + recordClass.getSimpleName(), e);
		}
	}

	/**
	 * @return the value of the given component of {@code record}
	 */
	public static Object componentValue(RecordComponent component, Object record) throws InvocationTargetException {
		var accessor = component.getAccessor();
		makeAccessible(accessor);
		try {
			return accessor.invoke(record);
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException("Unable to access component " + component.getName(), e);
		}
	}

	/**
	 * @return the value a field of the given type has before anything assigns it
	 */
	public static @Nullable Object defaultValue(Class<?> type) {
		if (type.isPrimitive()) {
			return Array.get(Array.newInstance(type, 1), 0);
		} else {
			return null;
		}
	}

	/**
	 * Classes from the JDK are never treated as nested objects,
	 * even if they look like plain classes.
	 */
	public static boolean isPlatformClass(Class<?> type) {
		String name = type.getName();
		return name.startsWith("java.")
			|| name.startsWith("javax.")
			|| name.startsWith("jdk.")
			|| name.startsWith("sun.")
			|| name.startsWith("com.sun.");
	}

	public static boolean isConcrete(Class<?> type) {
		return !type.isInterface()
			&& !type.isArray()
			&& !type.isPrimitive()
			&& !type.isEnum()
			&& !Modifier.isAbstract(type.getModifiers());
	}

	private static void makeAccessible(java.lang.reflect.AccessibleObject object) {
		try {
			object.setAccessible(true);
		} catch (RuntimeException e) {
			// InaccessibleObjectException or SecurityException
			throw new IllegalArgumentException("Unable to access " + object, e);
		}
	}
}
