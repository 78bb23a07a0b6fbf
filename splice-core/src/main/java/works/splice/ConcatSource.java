package works.splice;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import com.google.common.primitives.Bytes;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import works.splice.cache.Fingerprints;

/**
 * The texts of several sources, one after another, with nothing in between.
 */
public record ConcatSource(List<Source> children) implements Source {
	static final int FINGERPRINT_TAG = 4;

	public ConcatSource {
		children = List.copyOf(children);
	}

	@Override
	public String text() {
		if (children.size() == 1) {
			return children.get(0).text();
		}
		StringBuilder sb = new StringBuilder();
		for (Source child : children) {
			sb.append(child.text());
		}
		return sb.toString();
	}

	@Override
	public int size() {
		if (joinsSurrogatePair()) {
			return Source.super.size();
		}
		int result = 0;
		for (Source child : children) {
			result += child.size();
		}
		return result;
	}

	@Override
	public byte[] buffer() {
		if (children.size() == 1) {
			return children.get(0).buffer();
		}
		if (joinsSurrogatePair()) {
			return Source.super.buffer();
		}
		byte[][] buffers = new byte[children.size()][];
		for (int i = 0; i < buffers.length; i++) {
			buffers[i] = children.get(i).buffer();
		}
		return Bytes.concat(buffers);
	}

	/**
	 * A surrogate pair split between two children encodes as four bytes once joined,
	 * not as two replacement characters, so sizes and buffers can't simply be added up.
	 */
	private boolean joinsSurrogatePair() {
		boolean highSurrogatePending = false;
		for (Source child : children) {
			String t = child.text();
			if (t.isEmpty()) {
				continue;
			}
			if (highSurrogatePending && Character.isLowSurrogate(t.charAt(0))) {
				return true;
			}
			highSurrogatePending = Character.isHighSurrogate(t.charAt(t.length() - 1));
		}
		return false;
	}

	@Override
	public void writeTo(Writer out) throws IOException {
		for (Source child : children) {
			child.writeTo(out);
		}
	}

	@Override
	public HashCode fingerprint() {
		Hasher hasher = Fingerprints.newHasher()
			.putInt(FINGERPRINT_TAG)
			.putInt(children.size());
		for (Source child : children) {
			hasher.putBytes(child.fingerprint().asBytes());
		}
		return hasher.hash();
	}
}
