package works.splice;

import com.google.common.hash.HashCode;
import java.io.IOException;
import java.io.Writer;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.splice.compose.Composed;
import works.splice.compose.Composer;

import static java.util.Objects.requireNonNull;

/**
 * Wraps another source and remembers everything computed from it.
 * <p>
 * Each result is computed the first time it's asked for and kept for the life of this object.
 * No invalidation is ever needed, because sources are immutable.
 * Wrap a source in one of these if it's used in several places,
 * or if its text or map will be requested more than once.
 * <p>
 * Threads racing to compute the same result may each compute it;
 * the first to finish publishes its result, and everyone uses that one from then on.
 * <p>
 * Once the text, buffer, fingerprint and a composition with columns are all known,
 * the wrapped source is released, since every other result can be derived from those.
 * A composition that traced positions through upstream maps depends on
 * {@link MapOptions#getMaxResolutionDepth()}, so in that case the wrapped source is kept.
 * <p>
 * Equality is identity.
 */
public final class CachedSource implements Source {
	private volatile @Nullable Source inner;
	private final AtomicReference<String> text = new AtomicReference<>();
	private final AtomicReference<byte[]> buffer = new AtomicReference<>();
	private final AtomicReference<HashCode> fingerprint = new AtomicReference<>();
	private final AtomicReference<Composed> depthIndependent = new AtomicReference<>();

	/**
	 * Keyed by options without a {@code file}, which doesn't affect composition.
	 */
	private final ConcurrentHashMap<MapOptions, Composed> composed = new ConcurrentHashMap<>();

	private final ConcurrentHashMap<MapOptions, SourceAndMap> results = new ConcurrentHashMap<>();

	public CachedSource(Source inner) {
		this.inner = requireNonNull(inner);
	}

	@Override
	public String text() {
		String result = memo(text, Source::text);
		trySeparate();
		return result;
	}

	@Override
	public int size() {
		return cachedBuffer().length;
	}

	@Override
	public byte[] buffer() {
		return cachedBuffer().clone();
	}

	private byte[] cachedBuffer() {
		byte[] result = memo(buffer, Source::buffer);
		trySeparate();
		return result;
	}

	@Override
	public SourceAndMap textAndMap(MapOptions options) {
		SourceAndMap result = results.get(options);
		if (result == null) {
			SourceAndMap computed = composed(options).toSourceAndMap(options.getFile());
			result = results.putIfAbsent(options, computed);
			if (result == null) {
				result = computed;
			}
		}
		return result;
	}

	/**
	 * @return the result of composing the wrapped source with the given options.
	 * The {@code file} of {@code options} is ignored.
	 */
	public Composed composed(MapOptions options) {
		MapOptions key = options.withFile(null);
		Composed result = composed.get(key);
		if (result == null) {
			Composed computed = compose(key);
			result = composed.putIfAbsent(key, computed);
			if (result == null) {
				result = computed;
			}
			text.compareAndSet(null, result.text());
			if (key.isColumns() && result.resolutionDepth() == 0) {
				depthIndependent.compareAndSet(null, result);
			}
			trySeparate();
		}
		return result;
	}

	private Composed compose(MapOptions key) {
		if (!key.isColumns()) {
			return composed(key.withColumns(true)).linesOnly();
		}
		Source source = inner;
		Composed known = depthIndependent.get();
		if (known != null) {
			if (key.getMaxResolutionDepth() < 0) {
				throw new IllegalArgumentException("maxResolutionDepth must not be negative: " + key.getMaxResolutionDepth());
			}
			return known;
		}
		return Composer.compose(requireNonNull(source), key);
	}

	@Override
	public void writeTo(Writer out) throws IOException {
		out.write(text());
	}

	/**
	 * The same as the fingerprint of the wrapped source,
	 * so wrapping a source doesn't change the identity of the results it produces.
	 */
	@Override
	public HashCode fingerprint() {
		HashCode result = memo(fingerprint, Source::fingerprint);
		trySeparate();
		return result;
	}

	/**
	 * @return true if a result for {@code options}, apart from its {@code file}, has already been computed
	 */
	public boolean isComposed(MapOptions options) {
		return composed.containsKey(options.withFile(null));
	}

	/**
	 * @return true if the wrapped source has been released
	 */
	boolean isSeparated() {
		return inner == null;
	}

	private void trySeparate() {
		if (inner != null
			&& text.get() != null
			&& buffer.get() != null
			&& fingerprint.get() != null
			&& depthIndependent.get() != null
		) {
			LOGGER.trace("Releasing {}", inner);
			inner = null;
		}
	}

	/**
	 * {@link #inner} is read before the cell. It's only released once every cell is filled,
	 * so if it's null, the cell can't be.
	 */
	private <T> T memo(AtomicReference<T> cell, Function<Source, T> function) {
		Source source = inner;
		T existing = cell.get();
		if (existing != null) {
			return existing;
		}
		T computed = requireNonNull(function.apply(requireNonNull(source)));
		if (cell.compareAndSet(null, computed)) {
			return computed;
		} else {
			return cell.get();
		}
	}

	@Override
	public String toString() {
		Source current = inner;
		return "CachedSource[" + (current == null ? "released" : current) + "]";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CachedSource.class);
}
