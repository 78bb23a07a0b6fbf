package works.splice.compose;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import works.splice.SourceAndMap;
import works.splice.codec.MappingsCodec;
import works.splice.mapping.Mapping;
import works.splice.mapping.MappingTable;
import works.splice.mapping.SourceMap;

import static java.util.Objects.requireNonNull;

/**
 * The complete result of composing a source:
 * its text, plus a mapping table in the text's own coordinates
 * along with the string tables the table refers to.
 *
 * @param sourcesContent parallel to {@code sources}; null elements mean the content is unknown
 * @param resolutionDepth the largest number of upstream maps any one position was traced through
 */
public record Composed(
	String text,
	MappingTable table,
	List<String> sources,
	List<String> sourcesContent,
	List<String> names,
	int resolutionDepth
) {
	public Composed {
		requireNonNull(text);
		requireNonNull(table);
		if (resolutionDepth < 0) {
			throw new IllegalArgumentException("Negative resolutionDepth: " + resolutionDepth);
		}
		sources = List.copyOf(sources);
		sourcesContent = Collections.unmodifiableList(new ArrayList<>(sourcesContent));
		names = List.copyOf(names);
		if (sources.size() != sourcesContent.size()) {
			throw new IllegalArgumentException("Mismatched sources and sourcesContent");
		}
	}

	/**
	 * @return true if any part of the text is traced to an original source
	 */
	public boolean isMapped() {
		return table.hasSourcedEntries();
	}

	/**
	 * @return the same result with only the first sourced entry of each line, moved to column zero, and no names
	 */
	public Composed linesOnly() {
		MappingTable.Builder builder = MappingTable.builder();
		int previousLine = -1;
		for (Mapping entry : table) {
			if (entry.hasSource() && entry.generatedLine() != previousLine) {
				builder.add(entry.atGenerated(entry.generatedLine(), 0).withoutName());
				previousLine = entry.generatedLine();
			}
		}
		return new Composed(text, builder.buildInOrder(), sources, sourcesContent, List.of(), resolutionDepth);
	}

	public SourceMap toSourceMap(@Nullable String file) {
		List<String> contents = sourcesContent.stream().allMatch(Objects::isNull) ? List.of() : sourcesContent;
		return new SourceMap(file, null, sources, contents, names, MappingsCodec.encode(table));
	}

	/**
	 * @return the text, along with a map if {@link #isMapped()}
	 */
	public SourceAndMap toSourceAndMap(@Nullable String file) {
		return new SourceAndMap(text, isMapped() ? toSourceMap(file) : null);
	}
}
