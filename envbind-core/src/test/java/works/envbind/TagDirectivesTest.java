package works.envbind;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagDirectivesTest {

	@Test
	void nameOnly() {
		assertEquals(new TagDirectives("AUTH", Optional.empty(), false), TagDirectives.parse("AUTH"));
	}

	@Test
	void name_isTrimmed() {
		assertEquals("JWT_TTL", TagDirectives.parse("  JWT_TTL ,required").explicitName());
	}

	@Test
	void emptyName_meansNoOverride() {
		TagDirectives directives = TagDirectives.parse(" ,default=blue");
		assertFalse(directives.hasExplicitName());
		assertEquals(Optional.of("blue"), directives.defaultValue());
	}

	@Test
	void dash_meansSkip() {
		assertTrue(TagDirectives.parse("-").isSkipped());
		assertTrue(TagDirectives.parse("-,required default=x").isSkipped());
		assertFalse(TagDirectives.parse(",default=-").isSkipped());
	}

	@Test
	void requiredAndDefault() {
		TagDirectives directives = TagDirectives.parse(",required default=John\\sDoe");
		assertTrue(directives.required());
		assertEquals(Optional.of("John Doe"), directives.defaultValue());
	}

	@ParameterizedTest
	@ValueSource(strings = {
		",REQUIRED",
		",Required",
		",  required  ",
		",bogus required",
	})
	void required_isCaseInsensitiveAndToleratesNoise(String tag) {
		assertTrue(TagDirectives.parse(tag).required());
	}

	@Test
	void defaultKey_isCaseInsensitive() {
		assertEquals(Optional.of("x"), TagDirectives.parse(",DEFAULT=x").defaultValue());
	}

	@Test
	void defaultValue_mayContainEqualsAndCommas() {
		assertEquals(Optional.of("a=b,c"), TagDirectives.parse(",default=a=b,c").defaultValue());
	}

	@Test
	void emptyDefault_isPresent() {
		assertEquals(Optional.of(""), TagDirectives.parse(",default=").defaultValue());
	}

	@Test
	void laterDefault_wins() {
		assertEquals(Optional.of("second"), TagDirectives.parse(",default=first default=second").defaultValue());
	}

	@ParameterizedTest
	@ValueSource(strings = {
		",requiredd",
		",required=true",
		",optional",
		",colour=blue",
		",",
	})
	void malformedDirectives_areIgnored(String tag) {
		TagDirectives directives = TagDirectives.parse(tag);
		assertFalse(directives.required());
		assertEquals(Optional.empty(), directives.defaultValue());
	}

	@Test
	void missingAnnotation_meansNoDirectives() {
		assertSame(TagDirectives.NONE, TagDirectives.of(null));
	}
}
