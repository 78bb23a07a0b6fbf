package works.splice;

import org.jetbrains.annotations.Nullable;
import works.splice.exceptions.InvalidSourceException;

import static java.util.Objects.requireNonNull;

/**
 * Replaces the characters {@code [start, end)} of some base text with {@code content}.
 * When {@code start == end}, nothing is removed and {@code content} is inserted.
 * <p>
 * Offsets count UTF-16 code units, like {@link String#substring(int, int)}.
 *
 * @param name if given, the inserted text is mapped to the original position
 *             of the replaced text under this name
 */
public record Replacement(int start, int end, String content, @Nullable String name) {
	public Replacement {
		requireNonNull(content);
		if (start < 0) {
			throw new InvalidSourceException("Replacement start must not be negative: " + start);
		} else if (end < start) {
			throw new InvalidSourceException("Replacement end " + end + " precedes its start " + start);
		}
	}

	public Replacement(int start, int end, String content) {
		this(start, end, content, null);
	}

	public static Replacement insertion(int position, String content) {
		return new Replacement(position, position, content, null);
	}

	public boolean isInsertion() {
		return start == end;
	}

	/**
	 * @return the change in text length caused by this replacement
	 */
	public int lengthDelta() {
		return content.length() - (end - start);
	}
}
