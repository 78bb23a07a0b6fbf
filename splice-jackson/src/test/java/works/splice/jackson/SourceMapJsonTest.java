package works.splice.jackson;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tools.jackson.core.exc.StreamReadException;
import works.splice.MapOptions;
import works.splice.Source;
import works.splice.mapping.SourceMap;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.splice.Sources.concat;
import static works.splice.Sources.original;
import static works.splice.Sources.raw;
import static works.splice.Sources.withMap;

class SourceMapJsonTest {
	final SourceMapJson json = new SourceMapJson();

	@Test
	void write_membersInOrder() {
		SourceMap map = new SourceMap(
			"out.js",
			"src/",
			List.of("a.js", "b.js"),
			Arrays.asList("A", null),
			List.of("x"),
			"AAAA,CCAAA");
		assertEquals(
			"{\"version\":3,\"file\":\"out.js\",\"sourceRoot\":\"src/\",\"sources\":[\"a.js\",\"b.js\"],"
				+ "\"sourcesContent\":[\"A\",null],\"names\":[\"x\"],\"mappings\":\"AAAA,CCAAA\"}",
			json.write(map));
	}

	@Test
	void write_omitsAbsentMembers() {
		SourceMap map = new SourceMap(List.of("a.js"), List.of(), List.of(), "AAAA");
		assertEquals(
			"{\"version\":3,\"sources\":[\"a.js\"],\"names\":[],\"mappings\":\"AAAA\"}",
			json.write(map));
	}

	@Test
	void read_minimal() {
		SourceMap map = json.read("{\"version\":3,\"sources\":[\"a.js\"],\"mappings\":\"AAAA\"}");
		assertEquals(List.of("a.js"), map.sources());
		assertEquals(List.of(), map.names());
		assertEquals(List.of(), map.sourcesContent());
		assertNull(map.file());
		assertNull(map.sourceRoot());
		assertEquals("AAAA", map.mappings());
	}

	@Test
	void read_ignoresUnknownMembers() {
		SourceMap map = json.read("{\"x_google_ignoreList\":[0],\"version\":3,\"sources\":[],"
			+ "\"extra\":{\"nested\":[1,2,{\"a\":null}]},\"names\":[],\"mappings\":\"\"}");
		assertEquals("", map.mappings());
	}

	@Test
	void read_nullContent() {
		SourceMap map = json.read("{\"version\":3,\"sources\":[\"a\",\"b\"],\"sourcesContent\":[null,\"B\"],\"names\":[],\"mappings\":\"\"}");
		assertNull(map.sourceContent(0));
		assertEquals("B", map.sourceContent(1));
	}

	@Test
	void composedMap_survivesStreams() {
		Source source = concat(
			raw("// header\n"),
			original("a;b\n", "a.js"),
			withMap("xyz", json.read("{\"version\":3,\"sources\":[\"c.ts\"],\"names\":[\"n\"],\"mappings\":\"AAAAA\"}")));
		SourceMap map = source.map(MapOptions.DEFAULT.withFile("bundle.js")).orElseThrow();

		ByteArrayOutputStream out = new ByteArrayOutputStream();
		json.write(map, out);
		SourceMap read = json.read(new ByteArrayInputStream(out.toByteArray()));
		assertEquals(map, read);
		assertEquals(json.write(map), new String(out.toByteArray(), UTF_8));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"{\"sources\":[],\"mappings\":\"\"}",
		"{\"version\":2,\"sources\":[],\"mappings\":\"\"}",
		"{\"version\":\"3\",\"sources\":[],\"mappings\":\"\"}",
		"{\"version\":3,\"mappings\":\"\"}",
		"{\"version\":3,\"sources\":[]}",
		"{\"version\":3,\"sources\":[null],\"mappings\":\"\"}",
		"{\"version\":3,\"sources\":[\"a\"],\"sourcesContent\":[],\"mappings\":\"\"}",
		"{\"version\":3,\"sources\":[],\"names\":[1],\"mappings\":\"\"}",
		"[]",
	})
	void read_invalid_throws(String text) {
		assertThrows(StreamReadException.class, () -> json.read(text));
	}
}
