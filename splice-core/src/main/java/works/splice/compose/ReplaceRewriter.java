package works.splice.compose;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.splice.Replacement;
import works.splice.mapping.Mapping;
import works.splice.mapping.MappingTable;
import works.splice.mapping.StringTable;

/**
 * Applies {@link Replacement}s to an already-composed base,
 * producing the replaced text and a matching table.
 * <p>
 * Entries strictly inside a replaced range are dropped.
 * All others move by the total length change of the replacements before them.
 * Extra entries are added at each end of every piece of inserted text,
 * so that the attribution of the text on either side is unaffected by the insertion.
 */
final class ReplaceRewriter {
	private final Composed base;
	private final LineIndex baseLines;
	private final MappingTable table;
	private final int[] entryOffsets;
	private final StringTable names;

	/**
	 * Entries are collected by offset in the output text, in the order they take effect.
	 * Generated positions are filled in once the output text is complete.
	 */
	private final List<Candidate> candidates = new ArrayList<>();

	private record Candidate(int offset, Mapping entry) { }

	private ReplaceRewriter(Composed base) {
		this.base = base;
		this.baseLines = LineIndex.of(base.text());
		this.table = base.table();
		this.names = StringTable.of(base.names());
		this.entryOffsets = new int[table.size()];
		for (int i = 0; i < table.size(); i++) {
			Mapping entry = table.get(i);
			entryOffsets[i] = baseLines.offsetOf(entry.generatedLine(), entry.generatedColumn());
		}
	}

	static Composed rewrite(Composed base, List<Replacement> replacements) {
		if (replacements.isEmpty()) {
			return base;
		}
		return new ReplaceRewriter(base).rewrite(replacements);
	}

	private Composed rewrite(List<Replacement> replacements) {
		String baseText = base.text();
		StringBuilder out = new StringBuilder(baseText.length());
		int next = 0; // Index of the next base entry to consider
		int delta = 0; // Total length change of the replacements applied so far
		int copied = 0; // Base text up to here has been written to out

		for (Replacement r : replacements) {
			// Base entries before the replacement keep their attribution.
			// An entry right at the start of a removed range is kept too,
			// but an entry at an insertion point belongs after the inserted text.
			while (next < entryOffsets.length) {
				int offset = entryOffsets[next];
				if (offset < 0) {
					next++;
				} else if (offset < r.start() || (offset == r.start() && !r.isInsertion())) {
					candidates.add(new Candidate(offset + delta, table.get(next)));
					next++;
				} else {
					break;
				}
			}

			out.append(baseText, copied, r.start()).append(r.content());
			int newStart = r.start() + delta;
			int newEnd = newStart + r.content().length();

			Mapping atStart = governing(r.start());
			boolean startSourced = atStart != null && atStart.hasSource();
			boolean named = false;
			if (!r.content().isEmpty() && startSourced) {
				if (r.name() == null) {
					candidates.add(new Candidate(newStart, Mapping.generatedOnly(0, 0)));
				} else {
					candidates.add(new Candidate(newStart, advanced(atStart, r.start())
						.withNameIndex(names.intern(r.name()))));
					named = true;
				}
			}

			while (next < entryOffsets.length && entryOffsets[next] < r.end()) {
				next++;
			}

			boolean entryAtEnd = next < entryOffsets.length && entryOffsets[next] == r.end();
			boolean textFollows = r.end() < baseText.length() && baseText.charAt(r.end()) != '\n';
			if (!entryAtEnd && textFollows) {
				Mapping atEnd = governing(r.end());
				if (atEnd != null && atEnd.hasSource()) {
					candidates.add(new Candidate(newEnd, advanced(atEnd, r.end())));
				} else if (r.content().indexOf('\n') < 0 && (named || startSourced)) {
					candidates.add(new Candidate(newEnd, Mapping.generatedOnly(0, 0)));
				}
			}

			delta += r.lengthDelta();
			copied = r.end();
		}

		for (; next < entryOffsets.length; next++) {
			if (entryOffsets[next] >= 0) {
				candidates.add(new Candidate(entryOffsets[next] + delta, table.get(next)));
			}
		}
		out.append(baseText, copied, baseText.length());

		String text = out.toString();
		LineIndex lines = LineIndex.of(text);
		MappingTable.Builder builder = MappingTable.builder();
		for (Candidate c : candidates) {
			int line = lines.lineOf(c.offset());
			builder.add(c.entry().atGenerated(line, c.offset() - lines.lineStart(line)));
		}
		return new Composed(text, builder.buildLastWins(), base.sources(), base.sourcesContent(), names.toList(), base.resolutionDepth());
	}

	/**
	 * @return the base entry whose segment covers the given base offset, if any
	 */
	private @Nullable Mapping governing(int offset) {
		int line = baseLines.lineOf(offset);
		return table.find(line, offset - baseLines.lineStart(line)).orElse(null);
	}

	/**
	 * @return a nameless copy of {@code entry} whose original column is advanced to correspond to {@code offset}
	 */
	private Mapping advanced(Mapping entry, int offset) {
		int distance = baseLines.columnOf(offset) - entry.generatedColumn();
		return Mapping.sourced(0, 0, entry.sourceIndex(), entry.originalLine(), entry.originalColumn() + distance);
	}
}
