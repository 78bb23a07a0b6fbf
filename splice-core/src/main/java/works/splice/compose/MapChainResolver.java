package works.splice.compose;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.splice.MappedSource;
import works.splice.exceptions.MapResolutionException;
import works.splice.mapping.Mapping;
import works.splice.mapping.SourceMap;

/**
 * Traces original positions of a {@link MappedSource} back through its upstream maps.
 * <p>
 * Each step looks up the current position in the upstream map of the current source.
 * The trace stops at a source with no upstream map, or at a gap in an upstream map,
 * in which case the last position found is the answer.
 */
final class MapChainResolver {
	private final int maxDepth;
	private int deepest = 0;

	MapChainResolver(int maxDepth) {
		if (maxDepth < 0) {
			throw new IllegalArgumentException("maxResolutionDepth must not be negative: " + maxDepth);
		}
		this.maxDepth = maxDepth;
	}

	/**
	 * @return the largest number of upstream maps consulted for any one position so far
	 */
	int deepest() {
		return deepest;
	}

	record Resolved(String source, @Nullable String content, int line, int column, @Nullable String name) { }

	/**
	 * @param entry a sourced entry from {@code node}'s own map
	 * @throws MapResolutionException if the trace is longer than the maximum depth
	 */
	Resolved resolve(MappedSource node, Mapping entry) {
		SourceMap map = node.sourceMap();
		String source = map.sources().get(entry.sourceIndex());
		String content = map.sourceContent(entry.sourceIndex());
		int line = entry.originalLine();
		int column = entry.originalColumn();
		String name = entry.hasName() ? map.names().get(entry.nameIndex()) : null;

		SourceMap upstream = node.upstreamMaps().get(source);
		if (upstream == null) {
			return new Resolved(source, content, line, column, name);
		}

		List<String> chain = new ArrayList<>();
		chain.add(source);
		while (upstream != null) {
			if (chain.size() > maxDepth) {
				throw new MapResolutionException("Upstream maps of " + node + " nest more than " + maxDepth + " deep:", chain);
			}
			deepest = Math.max(deepest, chain.size());
			Optional<Mapping> hit = upstream.mappingTable().find(line, column);
			if (hit.isEmpty() || !hit.get().hasSource()) {
				LOGGER.trace("No upstream mapping for {}:{}:{}; keeping that position", source, line, column);
				break;
			}
			Mapping h = hit.get();
			column = h.originalColumn() + (column - h.generatedColumn());
			line = h.originalLine();
			source = upstream.sources().get(h.sourceIndex());
			content = upstream.sourceContent(h.sourceIndex());
			if (h.hasName()) {
				name = upstream.names().get(h.nameIndex());
			}
			chain.add(source);
			upstream = node.upstreamMaps().get(source);
		}
		return new Resolved(source, content, line, column, name);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MapChainResolver.class);
}
