package works.envbind.util;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReflectionHelpersTest {

	@Test
	void getBindableFields_superclassFirst() throws NoSuchFieldException {
		List<Field> actual = ReflectionHelpers.getBindableFields(Child.class);
		List<Field> expected = List.of(
			Parent.class.getDeclaredField("parentField"),
			Child.class.getDeclaredField("first"),
			Child.class.getDeclaredField("second")
		);
		assertEquals(expected, actual);
	}

	@Test
	void getBindableFields_skipsSyntheticOuterReference() {
		class Inner {
			String value;
		}
		List<String> names = ReflectionHelpers.getBindableFields(Inner.class).stream().map(Field::getName).toList();
		assertEquals(List.of("value"), names);
	}

	@Test
	void optionalContentType() throws NoSuchFieldException {
		assertEquals(String.class, ReflectionHelpers.optionalContentType(genericTypeOf("optionalString")));
		Type nested = ReflectionHelpers.optionalContentType(genericTypeOf("optionalOptional"));
		assertEquals(Optional.class, ReflectionHelpers.rawClass(nested));
		assertNull(ReflectionHelpers.optionalContentType(genericTypeOf("rawOptional")), "Raw Optional has no known content");
		assertNull(ReflectionHelpers.optionalContentType(String.class));
	}

	@Test
	void rawClass() throws NoSuchFieldException {
		assertEquals(String.class, ReflectionHelpers.rawClass(String.class));
		assertEquals(Optional.class, ReflectionHelpers.rawClass(genericTypeOf("optionalString")));
		assertEquals(List[].class, ReflectionHelpers.rawClass(genericTypeOf("arrayOfLists")));
		assertEquals(Number.class, ReflectionHelpers.rawClass(genericTypeOf("bounded")));
	}

	@Test
	void newInstance_usesPrivateConstructor() throws Exception {
		assertEquals("constructed", ReflectionHelpers.newInstance(PrivateConstructor.class).state);
	}

	@Test
	void newInstance_reportsConstructorFailure() {
		InvocationTargetException e = assertThrows(InvocationTargetException.class, () -> ReflectionHelpers.newInstance(FailingConstructor.class));
		assertEquals("nope", e.getCause().getMessage());
	}

	@Test
	void newInstance_requiresNoArgConstructor() {
		assertThrows(NoSuchMethodException.class, () -> ReflectionHelpers.newInstance(NoDefaultConstructor.class));
	}

	@Test
	void newRecord_andComponentValue() throws Exception {
		record Point(int x, String label) { }
		Point point = ReflectionHelpers.newRecord(Point.class, new Object[] { 3, "three" });
		assertEquals(new Point(3, "three"), point);
		assertEquals("three", ReflectionHelpers.componentValue(Point.class.getRecordComponents()[1], point));
	}

	@Test
	void defaultValue() {
		assertEquals(0, ReflectionHelpers.defaultValue(int.class));
		assertEquals(false, ReflectionHelpers.defaultValue(boolean.class));
		assertEquals('\0', ReflectionHelpers.defaultValue(char.class));
		assertNull(ReflectionHelpers.defaultValue(Integer.class));
	}

	@Test
	void isPlatformClass() {
		assertTrue(ReflectionHelpers.isPlatformClass(String.class));
		assertTrue(ReflectionHelpers.isPlatformClass(Thread.class));
		assertFalse(ReflectionHelpers.isPlatformClass(Child.class));
	}

	@Test
	void isConcrete() {
		assertTrue(ReflectionHelpers.isConcrete(Child.class));
		assertFalse(ReflectionHelpers.isConcrete(Parent.class));
		assertFalse(ReflectionHelpers.isConcrete(Runnable.class));
		assertFalse(ReflectionHelpers.isConcrete(int.class));
		assertFalse(ReflectionHelpers.isConcrete(int[].class));
		assertFalse(ReflectionHelpers.isConcrete(Thread.State.class));
	}

	private static Type genericTypeOf(String fieldName) throws NoSuchFieldException {
		return TypeHolder.class.getDeclaredField(fieldName).getGenericType();
	}

	@SuppressWarnings("unused")
	static abstract class Parent {
		static String ignoredStatic;
		String parentField;
	}

	@SuppressWarnings("unused")
	static class Child extends Parent {
		String first;
		transient String ignoredTransient;
		int second;
	}

	@SuppressWarnings({"unused", "rawtypes"})
	static class TypeHolder<N extends Number> {
		Optional<String> optionalString;
		Optional<Optional<String>> optionalOptional;
		Optional rawOptional;
		List<String>[] arrayOfLists;
		N bounded;
	}

	static class PrivateConstructor {
		final String state;

		private PrivateConstructor() {
			state = "constructed";
		}
	}

	static class FailingConstructor {
		FailingConstructor() {
			throw new IllegalStateException("nope");
		}
	}

	static class NoDefaultConstructor {
		NoDefaultConstructor(int ignored) { }
	}
}
