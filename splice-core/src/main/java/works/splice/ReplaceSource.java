package works.splice;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.splice.cache.Fingerprints;
import works.splice.exceptions.InvalidSourceException;

import static java.util.Objects.requireNonNull;

/**
 * The text of a base source with some ranges replaced.
 * <p>
 * Replacement ranges are in the base's own coordinates, must be in order,
 * and must not overlap. Several insertions at the same position are allowed,
 * and appear in the order given.
 * <p>
 * Positions outside the replaced ranges keep the base's mappings.
 * Inserted text is unmapped, unless its {@link Replacement} has a name,
 * in which case it's mapped to where the replaced text came from.
 */
public record ReplaceSource(Source base, List<Replacement> replacements) implements Source {
	static final int FINGERPRINT_TAG = 5;

	/**
	 * @throws InvalidSourceException if the replacements overlap, are out of order,
	 * or extend past the end of the base text
	 */
	public ReplaceSource {
		requireNonNull(base);
		replacements = List.copyOf(replacements);
		int baseLength = base.text().length();
		Replacement previous = null;
		for (Replacement r : replacements) {
			if (r.end() > baseLength) {
				throw new InvalidSourceException("Replacement " + r + " extends past the end of the base text, which has length " + baseLength);
			}
			if (previous != null) {
				if (r.start() < previous.start()) {
					throw new InvalidSourceException("Replacement " + r + " starts before the preceding replacement " + previous);
				} else if (r.start() < previous.end()) {
					throw new InvalidSourceException("Replacement " + r + " overlaps the preceding replacement " + previous);
				}
			}
			previous = r;
		}
	}

	public static Builder builder(Source base) {
		return new Builder(base);
	}

	@Override
	public String text() {
		String baseText = base.text();
		StringBuilder sb = new StringBuilder(baseText.length());
		int pos = 0;
		for (Replacement r : replacements) {
			sb.append(baseText, pos, r.start()).append(r.content());
			pos = r.end();
		}
		return sb.append(baseText, pos, baseText.length()).toString();
	}

	@Override
	public void writeTo(Writer out) throws IOException {
		String baseText = base.text();
		int pos = 0;
		for (Replacement r : replacements) {
			out.write(baseText, pos, r.start() - pos);
			out.write(r.content());
			pos = r.end();
		}
		out.write(baseText, pos, baseText.length() - pos);
	}

	@Override
	public HashCode fingerprint() {
		Hasher hasher = Fingerprints.newHasher()
			.putInt(FINGERPRINT_TAG)
			.putBytes(base.fingerprint().asBytes())
			.putInt(replacements.size());
		for (Replacement r : replacements) {
			hasher.putInt(r.start()).putInt(r.end());
			Fingerprints.putString(hasher, r.content());
			Fingerprints.putNullableString(hasher, r.name());
		}
		return hasher.hash();
	}

	/**
	 * Collects replacements in order, then validates them all at once in {@link #build()}.
	 */
	public static final class Builder {
		private final Source base;
		private final List<Replacement> replacements = new ArrayList<>();

		private Builder(Source base) {
			this.base = requireNonNull(base);
		}

		public Builder replace(int start, int end, String content) {
			return add(new Replacement(start, end, content));
		}

		public Builder replace(int start, int end, String content, @Nullable String name) {
			return add(new Replacement(start, end, content, name));
		}

		public Builder insert(int position, String content) {
			return add(Replacement.insertion(position, content));
		}

		public Builder add(Replacement replacement) {
			replacements.add(requireNonNull(replacement));
			return this;
		}

		public ReplaceSource build() {
			return new ReplaceSource(base, replacements);
		}
	}
}
