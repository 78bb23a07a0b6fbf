package works.splice.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.splice.cache.DecodeCache;
import works.splice.codec.MappingsCodec;

import static java.util.Objects.requireNonNull;

/**
 * The structural content of a revision 3 source map document.
 * <p>
 * The mapping table is held in its encoded form, exactly as it appears in the document,
 * and is decoded on demand through the {@link DecodeCache#shared() shared decode cache}.
 *
 * @param file name of the generated file this map describes, if known
 * @param sourceRoot carried through unchanged; it is not applied to {@code sources}
 * @param sourcesContent either empty, or parallel to {@code sources}, with null elements for unknown content
 */
public record SourceMap(
	@Nullable String file,
	@Nullable String sourceRoot,
	List<String> sources,
	List<String> sourcesContent,
	List<String> names,
	String mappings
) {
	public static final int VERSION = 3;

	public SourceMap {
		sources = List.copyOf(sources);
		sourcesContent = (sourcesContent == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(sourcesContent));
		names = List.copyOf(names);
		requireNonNull(mappings);
	}

	public SourceMap(List<String> sources, List<String> sourcesContent, List<String> names, String mappings) {
		this(null, null, sources, sourcesContent, names, mappings);
	}

	public static SourceMap of(MappingTable table, List<String> sources, List<String> sourcesContent, List<String> names) {
		return new SourceMap(sources, sourcesContent, names, MappingsCodec.encode(table));
	}

	public int version() {
		return VERSION;
	}

	/**
	 * @throws works.splice.exceptions.MappingsFormatException if {@link #mappings} is malformed
	 */
	public MappingTable mappingTable() {
		return DecodeCache.shared().decode(mappings);
	}

	/**
	 * @return the content of the source with the given index, or null if not known
	 */
	public @Nullable String sourceContent(int sourceIndex) {
		if (sourceIndex < sourcesContent.size()) {
			return sourcesContent.get(sourceIndex);
		} else {
			return null;
		}
	}

	public boolean hasSourcesContent() {
		return !sourcesContent.isEmpty();
	}

	public SourceMap withFile(@Nullable String newFile) {
		return new SourceMap(newFile, sourceRoot, sources, sourcesContent, names, mappings);
	}
}
