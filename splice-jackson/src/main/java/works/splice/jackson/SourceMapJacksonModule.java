package works.splice.jackson;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.Version;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.module.SimpleDeserializers;
import tools.jackson.databind.module.SimpleSerializers;
import works.splice.mapping.SourceMap;

import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.END_OBJECT;
import static tools.jackson.core.JsonToken.START_ARRAY;
import static tools.jackson.core.JsonToken.START_OBJECT;
import static tools.jackson.core.JsonToken.VALUE_NULL;
import static tools.jackson.core.JsonToken.VALUE_NUMBER_INT;
import static tools.jackson.core.JsonToken.VALUE_STRING;

/**
 * Reads and writes {@link SourceMap} as a revision 3 source map document.
 * <p>
 * Members are written in the conventional order, and optional members that are absent are omitted.
 * When reading, {@code version}, {@code sources} and {@code mappings} are required;
 * unrecognized members are skipped.
 */
public class SourceMapJacksonModule extends JacksonModule {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		SimpleSerializers serializers = new SimpleSerializers();
		serializers.addSerializer(SourceMap.class, sourceMapSerializer());
		context.addSerializers(serializers);

		SimpleDeserializers deserializers = new SimpleDeserializers();
		deserializers.addDeserializer(SourceMap.class, sourceMapDeserializer());
		context.addDeserializers(deserializers);
	}

	private static ValueSerializer<SourceMap> sourceMapSerializer() {
		return new ValueSerializer<>() {
			@Override
			public void serialize(SourceMap value, JsonGenerator gen, SerializationContext serializers) {
				gen.writeStartObject();
				gen.writeName("version");
				gen.writeNumber(value.version());
				if (value.file() != null) {
					gen.writeName("file");
					gen.writeString(value.file());
				}
				if (value.sourceRoot() != null) {
					gen.writeName("sourceRoot");
					gen.writeString(value.sourceRoot());
				}
				gen.writeName("sources");
				writeStrings(value.sources(), gen);
				if (value.hasSourcesContent()) {
					gen.writeName("sourcesContent");
					writeStrings(value.sourcesContent(), gen);
				}
				gen.writeName("names");
				writeStrings(value.names(), gen);
				gen.writeName("mappings");
				gen.writeString(value.mappings());
				gen.writeEndObject();
			}
		};
	}

	/**
	 * Null elements are written as JSON nulls.
	 */
	private static void writeStrings(List<String> strings, JsonGenerator gen) {
		gen.writeStartArray();
		for (String s : strings) {
			if (s == null) {
				gen.writeNull();
			} else {
				gen.writeString(s);
			}
		}
		gen.writeEndArray();
	}

	private static ValueDeserializer<SourceMap> sourceMapDeserializer() {
		return new ValueDeserializer<>() {
			@Override
			public SourceMap deserialize(JsonParser p, DeserializationContext ctxt) {
				Integer version = null;
				String file = null;
				String sourceRoot = null;
				List<String> sources = null;
				List<String> sourcesContent = null;
				List<String> names = null;
				String mappings = null;

				expect(START_OBJECT, p);
				while (p.nextToken() != END_OBJECT) {
					String member = p.currentName();
					p.nextToken();
					switch (member) {
						case "version":
							expect(VALUE_NUMBER_INT, p);
							version = p.getIntValue();
							break;
						case "file":
							file = readNullableString(p);
							break;
						case "sourceRoot":
							sourceRoot = readNullableString(p);
							break;
						case "sources":
							sources = readStrings(p, false);
							break;
						case "sourcesContent":
							sourcesContent = readStrings(p, true);
							break;
						case "names":
							names = readStrings(p, false);
							break;
						case "mappings":
							expect(VALUE_STRING, p);
							mappings = p.getString();
							break;
						default:
							LOGGER.debug("Skipping unrecognized source map member \"{}\"", member);
							p.skipChildren();
					}
				}

				if (version == null) {
					throw new StreamReadException(p, "Missing 'version' member");
				} else if (version != SourceMap.VERSION) {
					throw new StreamReadException(p, "Unsupported source map version " + version + "; expected " + SourceMap.VERSION);
				}
				if (sources == null) {
					throw new StreamReadException(p, "Missing 'sources' member");
				}
				if (mappings == null) {
					throw new StreamReadException(p, "Missing 'mappings' member");
				}
				if (sourcesContent != null && sourcesContent.size() != sources.size()) {
					throw new StreamReadException(p, "'sourcesContent' has " + sourcesContent.size()
						+ " entries but there are " + sources.size() + " sources");
				}
				return new SourceMap(
					file,
					sourceRoot,
					sources,
					sourcesContent,
					(names == null) ? List.of() : names,
					mappings);
			}
		};
	}

	private static String readNullableString(JsonParser p) {
		if (p.currentToken() == VALUE_NULL) {
			return null;
		}
		expect(VALUE_STRING, p);
		return p.getString();
	}

	/**
	 * Leaves the parser sitting on the END_ARRAY token.
	 */
	private static List<String> readStrings(JsonParser p, boolean allowNulls) {
		expect(START_ARRAY, p);
		List<String> result = new ArrayList<>();
		while (p.nextToken() != END_ARRAY) {
			if (allowNulls && p.currentToken() == VALUE_NULL) {
				result.add(null);
			} else {
				expect(VALUE_STRING, p);
				result.add(p.getString());
			}
		}
		return result;
	}

	private static void expect(JsonToken expected, JsonParser p) {
		if (p.currentToken() != expected) {
			throw new StreamReadException(p, "Expected " + expected + "; found " + p.currentToken());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SourceMapJacksonModule.class);
}
