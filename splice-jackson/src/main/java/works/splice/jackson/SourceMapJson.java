package works.splice.jackson;

import java.io.InputStream;
import java.io.OutputStream;
import tools.jackson.databind.json.JsonMapper;
import works.splice.mapping.SourceMap;

/**
 * Convenience methods for converting {@link SourceMap}s to and from JSON text.
 * <p>
 * Problems are reported as unchecked Jackson exceptions,
 * {@link tools.jackson.core.exc.StreamReadException} for malformed documents.
 */
public final class SourceMapJson {
	private final JsonMapper mapper;

	public SourceMapJson() {
		this(JsonMapper.builder());
	}

	/**
	 * @param builder receives a {@link SourceMapJacksonModule} and is then built
	 */
	public SourceMapJson(JsonMapper.Builder builder) {
		this.mapper = builder
			.addModule(new SourceMapJacksonModule())
			.build();
	}

	public JsonMapper mapper() {
		return mapper;
	}

	public SourceMap read(String json) {
		return mapper.readValue(json, SourceMap.class);
	}

	public SourceMap read(InputStream in) {
		return mapper.readValue(in, SourceMap.class);
	}

	public String write(SourceMap map) {
		return mapper.writeValueAsString(map);
	}

	public void write(SourceMap map, OutputStream out) {
		mapper.writeValue(out, map);
	}
}
