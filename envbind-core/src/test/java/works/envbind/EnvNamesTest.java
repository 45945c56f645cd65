package works.envbind;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class EnvNamesTest {

	@ParameterizedTest
	@MethodSource("identifiers")
	void deriveName_matchesExpected(String identifier, String expected) {
		assertEquals(expected, EnvNames.deriveName(identifier));
	}

	@ParameterizedTest
	@MethodSource("identifiers")
	void deriveName_isStableOnItsOwnOutput(String identifier, String expected) {
		assertEquals(expected, EnvNames.deriveName(EnvNames.deriveName(identifier)));
	}

	static Stream<Arguments> identifiers() {
		return Stream.of(
			arguments("JSONString", "JSON_STRING"),
			arguments("fooBar", "FOO_BAR"),
			arguments("fooJSON", "FOO_JSON"),
			arguments("MagicMike", "MAGIC_MIKE"),
			arguments("JSON1String", "JSON_1_STRING"),
			arguments("URL", "URL"),
			arguments("url", "URL"),
			arguments("signingKey", "SIGNING_KEY"),
			arguments("TTLSeconds", "TTL_SECONDS"),
			arguments("ttlSeconds", "TTL_SECONDS"),
			arguments("maxAge", "MAX_AGE"),
			arguments("deleteUser", "DELETE_USER"),
			arguments("http2Enabled", "HTTP_2_ENABLED"),
			arguments("port8080", "PORT_8080"),
			arguments("aB", "A_B"),
			arguments("x", "X"),
			arguments("X", "X")
		);
	}

	@Test
	void emptyIdentifier_givesEmptyName() {
		assertEquals("", EnvNames.deriveName(""));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"max_age",
		"max__age",
		"_maxAge",
		"max_Age",
	})
	void existingUnderscores_areNotDoubled(String identifier) {
		assertEquals("MAX_AGE", EnvNames.deriveName(identifier));
	}

	@Test
	void nonAsciiLetters_areUpperCased() {
		assertEquals("GRÖSSE_MAX", EnvNames.deriveName("grösseMax"));
	}
}
