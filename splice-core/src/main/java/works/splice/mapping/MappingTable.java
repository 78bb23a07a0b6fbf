package works.splice.mapping;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static works.splice.mapping.Mapping.GENERATED_ORDER;

/**
 * An immutable sequence of {@link Mapping}s ordered by generated line, then generated column.
 * Entries with equal generated positions keep the order in which they were added.
 * <p>
 * Tables are shared freely between threads and between composed sources,
 * most notably through {@link works.splice.cache.DecodeCache DecodeCache}.
 */
public final class MappingTable implements Iterable<Mapping> {
	private static final MappingTable EMPTY = new MappingTable(List.of());

	private final List<Mapping> entries;

	/**
	 * {@code lineStarts[line]} is the index of the first entry whose generated line is at least {@code line}.
	 * Has one more element than the number of lines spanned by the entries.
	 */
	private final int[] lineStarts;

	private MappingTable(List<Mapping> entries) {
		this.entries = entries;
		int lineCount = entries.isEmpty() ? 0 : entries.get(entries.size() - 1).generatedLine() + 1;
		this.lineStarts = new int[lineCount + 1];
		int line = 0;
		for (int i = 0; i < entries.size(); i++) {
			int entryLine = entries.get(i).generatedLine();
			while (line <= entryLine) {
				lineStarts[line++] = i;
			}
		}
		while (line <= lineCount) {
			lineStarts[line++] = entries.size();
		}
	}

	public static MappingTable empty() {
		return EMPTY;
	}

	public static MappingTable of(Mapping... entries) {
		Builder builder = builder();
		for (Mapping entry : entries) {
			builder.add(entry);
		}
		return builder.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public Mapping get(int index) {
		return entries.get(index);
	}

	public List<Mapping> entries() {
		return entries;
	}

	/**
	 * @return one more than the highest generated line with an entry
	 */
	public int lineCount() {
		return lineStarts.length - 1;
	}

	public List<Mapping> entriesOnLine(int line) {
		if (line < 0 || line >= lineCount()) {
			return List.of();
		}
		return entries.subList(lineStarts[line], lineStarts[line + 1]);
	}

	/**
	 * Finds the entry that governs the given generated position:
	 * the last entry on {@code line} whose column is at most {@code column}.
	 * Segments never extend across lines.
	 *
	 * @return the governing entry, or empty if the position precedes every entry on its line
	 */
	public Optional<Mapping> find(int line, int column) {
		if (line < 0 || line >= lineCount()) {
			return Optional.empty();
		}
		int lo = lineStarts[line];
		int hi = lineStarts[line + 1] - 1;
		Mapping result = null;
		while (lo <= hi) {
			int mid = (lo + hi) >>> 1;
			Mapping candidate = entries.get(mid);
			if (candidate.generatedColumn() <= column) {
				result = candidate;
				lo = mid + 1;
			} else {
				hi = mid - 1;
			}
		}
		return Optional.ofNullable(result);
	}

	/**
	 * @return true if any entry refers to an original source
	 */
	public boolean hasSourcedEntries() {
		for (Mapping entry : entries) {
			if (entry.hasSource()) {
				return true;
			}
		}
		return false;
	}

	public Stream<Mapping> stream() {
		return entries.stream();
	}

	@Override
	public Iterator<Mapping> iterator() {
		return entries.iterator();
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return entries.equals(((MappingTable) o).entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return entries.toString();
	}

	/**
	 * Accumulates entries for a new {@link MappingTable}.
	 * Entries may be added in any order; {@link #build()} sorts them stably when needed.
	 */
	public static final class Builder {
		private final List<Mapping> entries = new ArrayList<>();
		private boolean sorted = true;

		private Builder() {
		}

		public Builder add(Mapping entry) {
			if (!entries.isEmpty() && GENERATED_ORDER.compare(entries.get(entries.size() - 1), entry) > 0) {
				sorted = false;
			}
			entries.add(entry);
			return this;
		}

		public Builder addAll(Iterable<Mapping> toAdd) {
			toAdd.forEach(this::add);
			return this;
		}

		public int size() {
			return entries.size();
		}

		/**
		 * @return true if every entry so far was added in generated order
		 */
		public boolean isSorted() {
			return sorted;
		}

		public MappingTable build() {
			if (entries.isEmpty()) {
				return EMPTY;
			}
			List<Mapping> result = new ArrayList<>(entries);
			if (!sorted) {
				// List.sort is stable
				result.sort(GENERATED_ORDER);
			}
			return new MappingTable(List.copyOf(result));
		}

		/**
		 * Like {@link #build()}, but for callers that promise to add entries in order.
		 *
		 * @throws IllegalStateException if any entry was added out of order
		 */
		public MappingTable buildInOrder() {
			if (!sorted) {
				throw new IllegalStateException("Entries were not added in generated order");
			}
			return build();
		}

		/**
		 * Like {@link #build()}, but where several entries share a generated position,
		 * only the last one added survives.
		 */
		public MappingTable buildLastWins() {
			if (entries.isEmpty()) {
				return EMPTY;
			}
			List<Mapping> ordered = new ArrayList<>(entries);
			if (!sorted) {
				ordered.sort(GENERATED_ORDER);
			}
			List<Mapping> result = new ArrayList<>(ordered.size());
			for (Mapping entry : ordered) {
				int last = result.size() - 1;
				if (last >= 0 && result.get(last).sameGeneratedPosition(entry)) {
					result.set(last, entry);
				} else {
					result.add(entry);
				}
			}
			return new MappingTable(List.copyOf(result));
		}
	}
}
