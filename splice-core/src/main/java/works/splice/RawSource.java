package works.splice;

import com.google.common.hash.HashCode;
import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import works.splice.cache.Fingerprints;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Text or bytes with no known origin. Contributes no mappings.
 * <p>
 * A source built from bytes hands back exactly those bytes from {@link #buffer()},
 * even if they aren't valid UTF-8, so binary content passes through untouched.
 * Its {@link #text()} is the UTF-8 decoding of the bytes.
 */
public final class RawSource implements Source {
	static final int FINGERPRINT_TAG = 1;
	static final int BYTES_FINGERPRINT_TAG = 6;

	private final @Nullable String text;
	private final byte @Nullable [] bytes;

	public RawSource(String text) {
		this.text = requireNonNull(text);
		this.bytes = null;
	}

	public RawSource(byte[] bytes) {
		this.text = null;
		this.bytes = requireNonNull(bytes).clone();
	}

	@Override
	public String text() {
		if (text != null) {
			return text;
		} else {
			return new String(bytes, UTF_8);
		}
	}

	@Override
	public int size() {
		if (bytes != null) {
			return bytes.length;
		} else {
			return Source.super.size();
		}
	}

	@Override
	public byte[] buffer() {
		if (bytes != null) {
			return bytes.clone();
		} else {
			return Source.super.buffer();
		}
	}

	/**
	 * @return true if this was built from bytes rather than text
	 */
	public boolean isBinary() {
		return bytes != null;
	}

	@Override
	public void writeTo(Writer out) throws IOException {
		out.write(text());
	}

	@Override
	public HashCode fingerprint() {
		if (bytes != null) {
			return Fingerprints.newHasher()
				.putInt(BYTES_FINGERPRINT_TAG)
				.putInt(bytes.length)
				.putBytes(bytes)
				.hash();
		} else {
			return Fingerprints.putString(Fingerprints.newHasher().putInt(FINGERPRINT_TAG), text).hash();
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof RawSource other) {
			return Arrays.equals(bytes, other.bytes) && Objects.equals(text, other.text);
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		if (bytes != null) {
			return Arrays.hashCode(bytes);
		} else {
			return text.hashCode();
		}
	}

	@Override
	public String toString() {
		if (bytes != null) {
			return "RawSource[" + bytes.length + " bytes]";
		} else {
			return "RawSource[" + text.length() + " chars]";
		}
	}
}
