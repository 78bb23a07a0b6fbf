package works.splice;

import com.google.common.hash.HashCode;
import java.io.IOException;
import java.io.Writer;
import works.splice.cache.Fingerprints;

import static java.util.Objects.requireNonNull;

/**
 * The text of an original file, mapped position-for-position to itself.
 *
 * @param name the name under which the file appears in the {@code sources} of composed maps
 */
public record OriginalSource(String text, String name) implements Source {
	static final int FINGERPRINT_TAG = 2;

	public OriginalSource {
		requireNonNull(text);
		requireNonNull(name);
	}

	@Override
	public void writeTo(Writer out) throws IOException {
		out.write(text);
	}

	@Override
	public HashCode fingerprint() {
		var hasher = Fingerprints.newHasher().putInt(FINGERPRINT_TAG);
		Fingerprints.putString(hasher, name);
		return Fingerprints.putString(hasher, text).hash();
	}

	@Override
	public String toString() {
		return "OriginalSource[" + name + ", " + text.length() + " chars]";
	}
}
