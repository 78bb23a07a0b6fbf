package works.splice;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.splice.exceptions.InvalidSourceException;
import works.splice.exceptions.MapResolutionException;
import works.splice.exceptions.MappingsFormatException;
import works.splice.mapping.Mapping;
import works.splice.mapping.SourceMap;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.splice.Sources.withMap;

class MappedSourceTest {

	@Test
	void ownMap_isPassedThrough() {
		SourceMap own = new SourceMap(List.of("a.js"), List.of("content"), List.of("fn"), "AAAA,EAAEA;AACA");
		SourceMap map = withMap("xy\nz", own).map(MapOptions.DEFAULT).orElseThrow();
		assertEquals(own.mappings(), map.mappings());
		assertEquals(own.sources(), map.sources());
		assertEquals(own.sourcesContent(), map.sourcesContent());
		assertEquals(own.names(), map.names());
	}

	@Test
	void unsourcedMap_hasNoMap() {
		SourceMap own = new SourceMap(List.of(), List.of(), List.of(), "A;C");
		assertTrue(withMap("x\ny", own).map(MapOptions.DEFAULT).isEmpty());
	}

	@Test
	void upstreamMap_isFollowed() {
		SourceMap own = new SourceMap(List.of("b.js"), List.of(), List.of(), "AAAE");
		SourceMap upstream = new SourceMap(List.of("a.ts"), List.of("orig"), List.of("fn"), "AACAA");
		Source source = withMap("xyz", own, Map.of("b.js", upstream));
		SourceMap map = source.map(MapOptions.DEFAULT).orElseThrow();
		assertEquals(List.of("a.ts"), map.sources());
		assertEquals(List.of("orig"), map.sourcesContent());
		assertEquals(List.of("fn"), map.names());
		assertEquals(List.of(Mapping.named(0, 0, 0, 1, 2, 0)), map.mappingTable().entries());
	}

	@Test
	void upstreamChain_isFollowedToTheEnd() {
		SourceMap own = new SourceMap(List.of("c.js"), List.of(), List.of(), "AAAA");
		Source source = withMap("x", own, Map.of(
			"c.js", new SourceMap(List.of("b.js"), List.of(), List.of(), "AACA"),
			"b.js", new SourceMap(List.of("a.js"), List.of(), List.of(), ";AAEC"),
			"unused.js", new SourceMap(List.of("z.js"), List.of(), List.of(), "AAAA")));
		SourceMap map = source.map(MapOptions.DEFAULT).orElseThrow();
		assertEquals(List.of("a.js"), map.sources());
		assertEquals(List.of(Mapping.sourced(0, 0, 0, 2, 1)), map.mappingTable().entries());
	}

	@Test
	void gapInUpstreamMap_keepsLastPosition() {
		SourceMap own = new SourceMap(List.of("b.js"), List.of("b content"), List.of(), "AAAA");
		SourceMap upstream = new SourceMap(List.of("a.ts"), List.of(), List.of(), ";AACA");
		Source source = withMap("x", own, Map.of("b.js", upstream));
		SourceMap map = source.map(MapOptions.DEFAULT).orElseThrow();
		assertEquals(List.of("b.js"), map.sources());
		assertEquals(List.of("b content"), map.sourcesContent());
		assertEquals("AAAA", map.mappings());
	}

	@Test
	void cyclicUpstreamMaps_throw() {
		SourceMap own = new SourceMap(List.of("a.js"), List.of(), List.of(), "AAAA");
		Source source = withMap("x", own, Map.of(
			"a.js", new SourceMap(List.of("b.js"), List.of(), List.of(), "AAAA"),
			"b.js", new SourceMap(List.of("a.js"), List.of(), List.of(), "AAAA")));
		MapResolutionException e = assertThrows(MapResolutionException.class, () -> source.map(MapOptions.DEFAULT));
		assertEquals(33, e.sourceChain().size());
		assertEquals("a.js", e.sourceChain().get(0));
		assertEquals("b.js", e.sourceChain().get(1));
	}

	@Test
	void depthLimit_isConfigurable() {
		SourceMap own = new SourceMap(List.of("b.js"), List.of(), List.of(), "AAAA");
		Source source = withMap("x", own, Map.of("b.js", new SourceMap(List.of("a.js"), List.of(), List.of(), "AAAA")));
		assertEquals(List.of("a.js"), source.map(MapOptions.DEFAULT.withMaxResolutionDepth(1)).orElseThrow().sources());
		assertThrows(MapResolutionException.class, () -> source.map(MapOptions.DEFAULT.withMaxResolutionDepth(0)));
	}

	@Test
	void sourceIndexOutOfRange_throws() {
		SourceMap own = new SourceMap(List.of("a.js"), List.of(), List.of(), "ACAA");
		InvalidSourceException e = assertThrows(InvalidSourceException.class, () -> withMap("x", own));
		assertThat(e.getMessage(), containsString("source 1"));
	}

	@Test
	void nameIndexOutOfRange_throws() {
		SourceMap own = new SourceMap(List.of("a.js"), List.of(), List.of(), "AAAAA");
		assertThrows(InvalidSourceException.class, () -> withMap("x", own));
	}

	@Test
	void wrongSourcesContentLength_throws() {
		SourceMap own = new SourceMap(List.of("a.js", "b.js"), List.of("a"), List.of(), "AAAA");
		assertThrows(InvalidSourceException.class, () -> withMap("x", own));
	}

	@Test
	void malformedMappings_throw() {
		SourceMap own = new SourceMap(List.of("a.js"), List.of(), List.of(), "AA");
		MappingsFormatException e = assertThrows(MappingsFormatException.class, () -> withMap("x", own));
		assertThat(e.getMessage(), startsWith("Source map: "));
	}

	@Test
	void malformedUpstreamMap_throws() {
		SourceMap own = new SourceMap(List.of("a.js"), List.of(), List.of(), "AAAA");
		SourceMap bad = new SourceMap(List.of("z.js"), List.of(), List.of(), "AAAA,");
		MappingsFormatException e = assertThrows(MappingsFormatException.class,
			() -> withMap("x", own, Map.of("a.js", bad)));
		assertThat(e.getMessage(), containsString("a.js"));
	}
}
