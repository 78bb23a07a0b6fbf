package works.splice;

import com.google.common.base.Utf8;
import com.google.common.hash.HashCode;
import java.io.IOException;
import java.io.Writer;
import java.util.Optional;
import works.splice.compose.Composer;
import works.splice.mapping.SourceMap;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A piece of generated text that knows where it came from.
 * <p>
 * Sources form trees: {@link ConcatSource} and {@link ReplaceSource} are built from
 * other sources, and the same source may appear under any number of parents.
 * All sources are immutable once constructed, so sharing them,
 * including between threads, is always safe.
 * <p>
 * Use {@link Sources} to create them.
 */
public sealed interface Source permits
	RawSource,
	OriginalSource,
	MappedSource,
	ConcatSource,
	ReplaceSource,
	CachedSource
{
	/**
	 * @return the generated text
	 */
	String text();

	/**
	 * @return the length of {@link #buffer()}
	 */
	default int size() {
		String text = text();
		try {
			return Utf8.encodedLength(text);
		} catch (IllegalArgumentException e) {
			// Unpaired surrogate. String.getBytes replaces it, so count the way it does.
			return text.getBytes(UTF_8).length;
		}
	}

	/**
	 * @return the UTF-8 encoding of {@link #text()},
	 * except that the bytes of a binary {@link RawSource} are returned as they are
	 */
	default byte[] buffer() {
		return text().getBytes(UTF_8);
	}

	/**
	 * @return a source map from {@link #text()} back to the original sources,
	 * or empty if no part of the text can be traced to any original source.
	 */
	default Optional<SourceMap> map(MapOptions options) {
		return textAndMap(options).map();
	}

	/**
	 * Computes {@link #text()} and {@link #map} together,
	 * which is cheaper than calling both.
	 */
	default SourceAndMap textAndMap(MapOptions options) {
		return Composer.compose(this, options).toSourceAndMap(options.getFile());
	}

	/**
	 * Writes {@link #text()} to {@code out} without computing any mappings.
	 * Exceptions thrown by {@code out} are propagated unchanged.
	 */
	void writeTo(Writer out) throws IOException;

	/**
	 * @return a hash of everything that determines this source's text and mappings.
	 * Two sources with the same fingerprint produce the same results.
	 */
	HashCode fingerprint();
}
