package works.envbind.hello;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.joou.UInteger;
import org.junit.jupiter.api.Test;
import works.envbind.EnvBinder;
import works.envbind.exceptions.FieldBindingException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HelloConfigTest {
	final EnvBinder binder = EnvBinder.standard();

	@Test
	void defaultsAndTags() throws Exception {
		HelloConfig config = binder.bind(List.of(
			"URL=https://example.com",
			"AUTH_SIGNING_KEY=signing_key",
			"JWT_TTL=60",
			"WORKER=ignored"
		), HelloConfig.class);
		assertEquals("https://example.com", config.url);
		assertEquals("signing_key", config.authentication.signingKey);
		assertEquals(UInteger.valueOf(60), config.authentication.ttlSeconds);
		assertNull(config.authentication.maxAge);
		assertEquals("blue", config.favoriteColor);
		assertEquals("John Doe", config.name);
		assertEquals(Optional.empty(), config.deleteUser);
		assertNull(config.validIds);
		assertNull(config.worker);
	}

	@Test
	void jsonList() throws Exception {
		HelloConfig config = binder.bind(Map.of(
			"VALID_IDS", "[\"id1\", \"id2\"]",
			"PRIMARY_ID", "4321",
			"DELETE_USER", "true",
			"AUTH_MAX_AGE", "300"
		), HelloConfig.class);
		assertEquals(List.of("id1", "id2"), config.validIds.values());
		assertEquals("4321", config.primaryId);
		assertEquals(Optional.of(true), config.deleteUser);
		assertEquals(UInteger.valueOf(300), config.authentication.maxAge);
		HelloEnv.describe(config);
	}

	@Test
	void negativeTtl() {
		FieldBindingException e = assertThrows(FieldBindingException.class,
			() -> binder.bind(Map.of("JWT_TTL", "-1"), HelloConfig.class));
		assertEquals("authentication.ttlSeconds", e.fieldPath());
		assertEquals("JWT_TTL", e.envVar());
	}

	@Test
	void badJson() {
		FieldBindingException e = assertThrows(FieldBindingException.class,
			() -> binder.bind(Map.of("VALID_IDS", "id1,id2"), HelloConfig.class));
		assertEquals("validIds", e.fieldPath());
		assertEquals("VALID_IDS", e.envVar());
	}
}
