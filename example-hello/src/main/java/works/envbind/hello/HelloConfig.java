package works.envbind.hello;

import java.util.Optional;
import org.joou.UInteger;
import works.envbind.Env;

public class HelloConfig {
	String url;
	Optional<Boolean> deleteUser = Optional.empty();
	@Env(",required default=John\\sDoe") String name;
	@Env(",default=blue") String favoriteColor;
	@Env("AUTH") Authentication authentication = new Authentication();
	@Env("VALID_IDS") JsonStringList validIds;
	String primaryId;
	@Env("-") Thread worker;

	public static class Authentication {
		String signingKey;
		@Env("JWT_TTL") UInteger ttlSeconds;
		UInteger maxAge;
	}
}
