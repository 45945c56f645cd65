package works.envbind.hello;

import java.util.ArrayList;
import java.util.List;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.envbind.EnvUnmarshaler;

/**
 * A list of strings given as a JSON array, like {@code ["id1", "id2"]}.
 */
public class JsonStringList implements EnvUnmarshaler {
	private final List<String> values = new ArrayList<>();

	public List<String> values() {
		return List.copyOf(values);
	}

	@Override
	public void unmarshalEnv(String value) {
		List<String> parsed = MAPPER.readValue(value, STRING_LIST);
		values.clear();
		values.addAll(parsed);
	}

	@Override
	public String toString() {
		return values.toString();
	}

	private static final ObjectMapper MAPPER = JsonMapper.builder().build();
	private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };
}
