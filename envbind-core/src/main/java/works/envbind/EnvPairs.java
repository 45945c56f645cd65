package works.envbind;

import java.util.HashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

/**
 * Turns {@code KEY=VALUE} strings into a lookup table.
 */
public final class EnvPairs {
	private EnvPairs() { }

	/**
	 * Splits each entry at its first {@code =}.
	 * Entries with no {@code =} are ignored, and when a key appears more than once, the last one wins.
	 * Keys may be empty and values may contain further {@code =} characters.
	 *
	 * @return an unmodifiable map
	 */
	public static Map<String, String> parse(Iterable<String> pairs) {
		Map<String, String> result = new HashMap<>();
		for (String pair : pairs) {
			int equals = pair.indexOf('=');
			if (equals < 0) {
				continue;
			}
			result.put(pair.substring(0, equals), pair.substring(equals + 1));
		}
		return unmodifiableMap(result);
	}
}
