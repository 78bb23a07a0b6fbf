package works.splice;

import java.util.List;
import java.util.Map;
import works.splice.mapping.SourceMap;

/**
 * Factory methods for every kind of {@link Source}.
 * <p>
 * Trees are built from the leaves up. For example:
 * <pre>{@code
 * Source bundle = Sources.concat(
 *     Sources.raw("// bundle\n"),
 *     Sources.cached(Sources.original(appText, "app.js")),
 *     Sources.withMap(minifiedText, minifiedMap));
 * String text = bundle.text();
 * Optional<SourceMap> map = bundle.map(MapOptions.DEFAULT);
 * }</pre>
 */
public final class Sources {
	private Sources() {
	}

	public static RawSource raw(String text) {
		return new RawSource(text);
	}

	/**
	 * @param bytes copied; later changes to the array don't affect the source
	 */
	public static RawSource raw(byte[] bytes) {
		return new RawSource(bytes);
	}

	public static OriginalSource original(String text, String name) {
		return new OriginalSource(text, name);
	}

	public static MappedSource withMap(String text, SourceMap sourceMap) {
		return new MappedSource(text, sourceMap);
	}

	/**
	 * @param upstreamMaps maps for those of {@code sourceMap}'s sources that were themselves generated, by source name
	 */
	public static MappedSource withMap(String text, SourceMap sourceMap, Map<String, SourceMap> upstreamMaps) {
		return new MappedSource(text, sourceMap, upstreamMaps);
	}

	public static ConcatSource concat(Source... children) {
		return new ConcatSource(List.of(children));
	}

	public static ConcatSource concat(List<? extends Source> children) {
		return new ConcatSource(List.copyOf(children));
	}

	public static ReplaceSource replace(Source base, List<Replacement> replacements) {
		return new ReplaceSource(base, replacements);
	}

	public static ReplaceSource.Builder replacing(Source base) {
		return ReplaceSource.builder(base);
	}

	/**
	 * @return {@code source} itself if it's already a {@link CachedSource}; otherwise a new one wrapping it
	 */
	public static CachedSource cached(Source source) {
		if (source instanceof CachedSource c) {
			return c;
		} else {
			return new CachedSource(source);
		}
	}
}
