package works.envbind.hello;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.envbind.EnvBinder;
import works.envbind.exceptions.EnvBindingException;
import works.envbind.exceptions.FieldBindingException;

/**
 * Reads {@link HelloConfig} from the process environment and reports what it found.
 * <p>
 * Try {@code URL=https://example.com AUTH_SIGNING_KEY=k JWT_TTL=60 VALID_IDS='["id1","id2"]'}.
 */
public class HelloEnv {
	public static void main(String[] args) {
		HelloConfig config;
		try {
			config = EnvBinder.standard().bind(System.getenv(), HelloConfig.class);
		} catch (FieldBindingException e) {
			LOGGER.error("Field {} can't be set from ${}", e.fieldPath(), e.envVar(), e.getCause());
			System.exit(1);
			return;
		} catch (EnvBindingException e) {
			LOGGER.error("Unable to read configuration", e);
			System.exit(2);
			return;
		}
		describe(config);
	}

	static void describe(HelloConfig config) {
		LOGGER.info("Hello, {}", config.name);
		LOGGER.info("url = {}", config.url);
		LOGGER.info("favorite color = {}", config.favoriteColor);
		LOGGER.info("delete user = {}", config.deleteUser.map(Object::toString).orElse("(unset)"));
		LOGGER.info("signing key is {}", (config.authentication.signingKey == null) ? "missing" : "present");
		LOGGER.info("ttl seconds = {}, max age = {}", config.authentication.ttlSeconds, config.authentication.maxAge);
		LOGGER.info("valid ids = {}, primary id = {}", config.validIds, config.primaryId);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(HelloEnv.class);
}
