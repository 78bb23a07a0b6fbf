package works.splice.mapping;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Deduplicated, insertion-ordered strings, each with a stable index.
 * Used for the {@code sources} and {@code names} of a source map.
 * <p>
 * Not thread safe. Tables are only mutated while a single composition
 * is running; published results are copied with {@link #toList()}.
 */
public final class StringTable {
	private final List<String> strings = new ArrayList<>();
	private final Map<String, Integer> indexes = new HashMap<>();

	public StringTable() {
	}

	public static StringTable of(List<String> strings) {
		StringTable result = new StringTable();
		strings.forEach(result::intern);
		return result;
	}

	/**
	 * @return the index of {@code string}, adding it at the end if it's not already present
	 */
	public int intern(String string) {
		Integer existing = indexes.putIfAbsent(requireNonNull(string), strings.size());
		if (existing == null) {
			strings.add(string);
			return strings.size() - 1;
		} else {
			return existing;
		}
	}

	/**
	 * @return the index of {@code string}, or {@link Mapping#NONE} if absent
	 */
	public int indexOf(String string) {
		return indexes.getOrDefault(string, Mapping.NONE);
	}

	public String get(int index) {
		return strings.get(index);
	}

	public int size() {
		return strings.size();
	}

	public boolean isEmpty() {
		return strings.isEmpty();
	}

	public List<String> toList() {
		return List.copyOf(strings);
	}

	@Override
	public String toString() {
		return strings.toString();
	}
}
