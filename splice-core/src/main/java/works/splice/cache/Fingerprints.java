package works.splice.cache;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Content fingerprints used as cache keys.
 * <p>
 * Any stable hash would do; nothing outside this class knows which one is used.
 */
public final class Fingerprints {
	private static final HashFunction FUNCTION = Hashing.murmur3_128();

	private Fingerprints() {
	}

	public static HashCode of(String text) {
		return FUNCTION.hashString(text, UTF_8);
	}

	public static Hasher newHasher() {
		return FUNCTION.newHasher();
	}

	/**
	 * Adds a string to {@code hasher} in a way that can't be confused
	 * with a different split of the same characters between two strings.
	 */
	public static Hasher putString(Hasher hasher, String string) {
		return hasher
			.putInt(string.length())
			.putString(string, UTF_8);
	}

	/**
	 * Like {@link #putString}, with null distinguishable from every string.
	 */
	public static Hasher putNullableString(Hasher hasher, String string) {
		if (string == null) {
			return hasher.putInt(-1);
		} else {
			return putString(hasher, string);
		}
	}
}
