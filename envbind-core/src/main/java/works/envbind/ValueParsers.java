package works.envbind;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.joou.UByte;
import org.joou.UInteger;
import org.joou.ULong;
import org.joou.UShort;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableMap;

/**
 * An immutable lookup table from field class to {@link ValueParser}.
 * <p>
 * {@link #BUILT_IN} covers text, characters, booleans, every primitive number type
 * and its box, the unsigned types {@link UByte}, {@link UShort}, {@link UInteger} and {@link ULong},
 * {@link BigInteger}, {@link BigDecimal}, and the raw sequence types
 * {@code byte[]} (UTF-8), {@code char[]} (UTF-16 units) and {@code int[]} (code points).
 * Enums are parsed by exact constant name without needing an entry.
 * <p>
 * Numbers are parsed in base 10 and must fit the field's width;
 * nothing is truncated or wrapped.
 */
public final class ValueParsers {
	private final Map<Class<?>, ValueParser<?>> parsers;

	private ValueParsers(Map<Class<?>, ValueParser<?>> parsers) {
		this.parsers = unmodifiableMap(parsers);
	}

	public static final ValueParsers BUILT_IN = new ValueParsers(builtInParsers());

	/**
	 * @return a new table in which {@code additional} parsers take precedence over these
	 */
	public ValueParsers with(Map<Class<?>, ValueParser<?>> additional) {
		if (additional.isEmpty()) {
			return this;
		}
		Map<Class<?>, ValueParser<?>> combined = new LinkedHashMap<>(parsers);
		combined.putAll(additional);
		return new ValueParsers(combined);
	}

	/**
	 * @return the parser for values of the given class, or null if there isn't one
	 */
	public @Nullable ValueParser<?> parserFor(Class<?> type) {
		ValueParser<?> result = parsers.get(type);
		if (result == null && type.isEnum()) {
			return enumParser(type);
		}
		return result;
	}

	public boolean supports(Class<?> type) {
		return parserFor(type) != null;
	}

	public Set<Class<?>> registeredTypes() {
		return parsers.keySet();
	}

	private static Map<Class<?>, ValueParser<?>> builtInParsers() {
		Map<Class<?>, ValueParser<?>> result = new LinkedHashMap<>();
		register(result, String.class, value -> value);
		register(result, CharSequence.class, value -> value);

		register(result, Boolean.class, ValueParsers::parseBoolean);
		register(result, boolean.class, ValueParsers::parseBoolean);
		register(result, Character.class, ValueParsers::parseChar);
		register(result, char.class, ValueParsers::parseChar);

		register(result, Byte.class, value -> Byte.parseByte(value, 10));
		register(result, byte.class, value -> Byte.parseByte(value, 10));
		register(result, Short.class, value -> Short.parseShort(value, 10));
		register(result, short.class, value -> Short.parseShort(value, 10));
		register(result, Integer.class, value -> Integer.parseInt(value, 10));
		register(result, int.class, value -> Integer.parseInt(value, 10));
		register(result, Long.class, value -> Long.parseLong(value, 10));
		register(result, long.class, value -> Long.parseLong(value, 10));
		register(result, UByte.class, value -> UByte.valueOf(parseUnsigned(value, 8).intValue()));
		register(result, UShort.class, value -> UShort.valueOf(parseUnsigned(value, 16).intValue()));
		register(result, UInteger.class, value -> UInteger.valueOf(parseUnsigned(value, 32).longValue()));
		register(result, ULong.class, value -> ULong.valueOf(parseUnsigned(value, 64)));
		register(result, Float.class, ValueParsers::parseFloat);
		register(result, float.class, ValueParsers::parseFloat);
		register(result, Double.class, ValueParsers::parseDouble);
		register(result, double.class, ValueParsers::parseDouble);

		register(result, BigInteger.class, BigInteger::new);
		register(result, BigDecimal.class, BigDecimal::new);

		// Whole-value sequences, not delimited lists
		register(result, byte[].class, value -> value.getBytes(UTF_8));
		register(result, char[].class, String::toCharArray);
		register(result, int[].class, value -> value.codePoints().toArray());
		return result;
	}

	private static <T> void register(Map<Class<?>, ValueParser<?>> map, Class<T> type, ValueParser<T> parser) {
		map.put(type, parser);
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	private static ValueParser<?> enumParser(Class<?> enumClass) {
		return value -> Enum.valueOf((Class) enumClass, value);
	}

	static boolean parseBoolean(String value) {
		switch (value) {
			case "1", "t", "T", "TRUE", "true", "True":
				return true;
			case "0", "f", "F", "FALSE", "false", "False":
				return false;
			default:
				throw new IllegalArgumentException("invalid boolean: \"" + value + "\"");
		}
	}

	static char parseChar(String value) {
		if (value.length() != 1) {
			throw new IllegalArgumentException("expected a single character: \"" + value + "\"");
		}
		return value.charAt(0);
	}

	/**
	 * @throws NumberFormatException unless {@code value} is a base-10 integer that fits in {@code bits} unsigned bits
	 */
	static BigInteger parseUnsigned(String value, int bits) {
		BigInteger result = new BigInteger(value, 10);
		if (result.signum() < 0 || result.bitLength() > bits) {
			throw new NumberFormatException("value out of range for unsigned " + bits + "-bit integer: \"" + value + "\"");
		}
		return result;
	}

	static float parseFloat(String value) {
		checkDecimalSyntax(value);
		float result = Float.parseFloat(value);
		if (Float.isInfinite(result) && !isExplicitInfinity(value)) {
			throw new NumberFormatException("value out of range for float: \"" + value + "\"");
		}
		return result;
	}

	static double parseDouble(String value) {
		checkDecimalSyntax(value);
		double result = Double.parseDouble(value);
		if (Double.isInfinite(result) && !isExplicitInfinity(value)) {
			throw new NumberFormatException("value out of range for double: \"" + value + "\"");
		}
		return result;
	}

	/**
	 * The JDK accepts surrounding whitespace and type suffixes like {@code 1.5f};
	 * an environment variable shouldn't.
	 */
	private static void checkDecimalSyntax(String value) {
		if (value.isEmpty() || value.strip().length() != value.length()) {
			throw new NumberFormatException("invalid number: \"" + value + "\"");
		}
		switch (value.charAt(value.length() - 1)) {
			case 'f', 'F', 'd', 'D':
				throw new NumberFormatException("invalid number: \"" + value + "\"");
			default:
				break;
		}
	}

	private static boolean isExplicitInfinity(String value) {
		return value.endsWith("Infinity");
	}
}
