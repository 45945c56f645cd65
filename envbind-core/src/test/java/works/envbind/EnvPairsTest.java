package works.envbind;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EnvPairsTest {

	@Test
	void splitsAtFirstEquals() {
		assertEquals(
			Map.of("URL", "https://example.com/?a=b", "EMPTY", ""),
			EnvPairs.parse(List.of("URL=https://example.com/?a=b", "EMPTY=")));
	}

	@Test
	void entriesWithoutEquals_areIgnored() {
		assertEquals(Map.of("A", "1"), EnvPairs.parse(List.of("A=1", "JUNK", "")));
	}

	@Test
	void lastDuplicate_wins() {
		assertEquals(Map.of("A", "3"), EnvPairs.parse(List.of("A=1", "A=2", "A=3")));
	}

	@Test
	void result_isUnmodifiable() {
		Map<String, String> env = EnvPairs.parse(List.of("A=1"));
		assertThrows(UnsupportedOperationException.class, () -> env.put("B", "2"));
	}
}
