package works.splice;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import java.io.IOException;
import java.io.Writer;
import java.util.Map;
import java.util.TreeMap;
import works.splice.cache.Fingerprints;
import works.splice.exceptions.InvalidSourceException;
import works.splice.exceptions.MappingsFormatException;
import works.splice.exceptions.SpliceException;
import works.splice.mapping.Mapping;
import works.splice.mapping.MappingTable;
import works.splice.mapping.SourceMap;

import static java.util.Objects.requireNonNull;

/**
 * Generated text that arrived with its own source map,
 * typically the output of some earlier tool such as a transpiler or minifier.
 * <p>
 * If any of the map's sources were themselves generated,
 * their maps can be supplied as {@code upstreamMaps}, keyed by source name.
 * Positions are then traced through those maps, as many levels deep as needed,
 * so that composed maps point at the true originals.
 *
 * @param sourceMap maps {@code text} to its sources
 * @param upstreamMaps maps for any of those sources that were themselves generated
 */
public record MappedSource(
	String text,
	SourceMap sourceMap,
	Map<String, SourceMap> upstreamMaps
) implements Source {
	static final int FINGERPRINT_TAG = 3;

	/**
	 * @throws InvalidSourceException if a map refers to sources or names it doesn't have
	 * @throws MappingsFormatException if a map's mappings can't be decoded
	 */
	public MappedSource {
		requireNonNull(text);
		requireNonNull(sourceMap);
		upstreamMaps = Map.copyOf(upstreamMaps);
		validate(sourceMap, "Source map");
		upstreamMaps.forEach((name, map) -> validate(map, "Upstream map for \"" + name + "\""));
	}

	public MappedSource(String text, SourceMap sourceMap) {
		this(text, sourceMap, Map.of());
	}

	private static void validate(SourceMap map, String description) {
		if (map.hasSourcesContent() && map.sourcesContent().size() != map.sources().size()) {
			throw new InvalidSourceException(description + " has " + map.sources().size()
				+ " sources but " + map.sourcesContent().size() + " sourcesContent entries");
		}
		MappingTable table;
		try {
			table = map.mappingTable();
		} catch (MappingsFormatException e) {
			throw SpliceException.wrap(e, description);
		}
		for (Mapping entry : table) {
			if (entry.hasSource() && entry.sourceIndex() >= map.sources().size()) {
				throw new InvalidSourceException(description + " refers to source " + entry.sourceIndex()
					+ " but has only " + map.sources().size() + " sources: " + entry);
			}
			if (entry.hasName() && entry.nameIndex() >= map.names().size()) {
				throw new InvalidSourceException(description + " refers to name " + entry.nameIndex()
					+ " but has only " + map.names().size() + " names: " + entry);
			}
		}
	}

	@Override
	public void writeTo(Writer out) throws IOException {
		out.write(text);
	}

	@Override
	public HashCode fingerprint() {
		Hasher hasher = Fingerprints.newHasher().putInt(FINGERPRINT_TAG);
		Fingerprints.putString(hasher, text);
		putSourceMap(hasher, sourceMap);
		hasher.putInt(upstreamMaps.size());
		new TreeMap<>(upstreamMaps).forEach((name, map) -> {
			Fingerprints.putString(hasher, name);
			putSourceMap(hasher, map);
		});
		return hasher.hash();
	}

	private static void putSourceMap(Hasher hasher, SourceMap map) {
		hasher.putInt(map.sources().size());
		for (int i = 0; i < map.sources().size(); i++) {
			Fingerprints.putString(hasher, map.sources().get(i));
			Fingerprints.putNullableString(hasher, map.sourceContent(i));
		}
		hasher.putInt(map.names().size());
		map.names().forEach(name -> Fingerprints.putString(hasher, name));
		Fingerprints.putString(hasher, map.mappings());
	}

	@Override
	public String toString() {
		return "MappedSource[" + text.length() + " chars, sources=" + sourceMap.sources() + "]";
	}
}
