package works.splice.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.hash.HashCode;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.splice.codec.MappingsCodec;
import works.splice.mapping.MappingTable;

/**
 * Remembers the decoded form of {@code mappings} strings.
 * <p>
 * The same encoded map tends to be decoded over and over,
 * because the same original files are referenced from many composed outputs.
 * <p>
 * Concurrent misses on the same string each decode it, and whichever result is
 * inserted first is the one everybody gets from then on.
 * Decoding is a pure function, so the duplicate work is wasted but harmless,
 * and no caller ever waits for another.
 * <p>
 * The cache is bounded by the total length of the {@code mappings} strings it holds.
 * Beyond that, the least recently used entries are dropped.
 */
public final class DecodeCache {
	/**
	 * Total {@code mappings} characters kept by default.
	 */
	public static final long DEFAULT_MAX_WEIGHT = 64L * 1024 * 1024;

	private static final DecodeCache SHARED = new DecodeCache();

	private final Cache<HashCode, Entry> entries;
	private final LongAdder hits = new LongAdder();
	private final LongAdder misses = new LongAdder();

	private record Entry(String mappings, MappingTable table) { }

	public DecodeCache() {
		this(DEFAULT_MAX_WEIGHT);
	}

	/**
	 * @param maxWeight the total length of {@code mappings} strings to keep
	 */
	public DecodeCache(long maxWeight) {
		this.entries = CacheBuilder.newBuilder()
			.maximumWeight(maxWeight)
			.<HashCode, Entry>weigher((key, entry) -> Math.max(1, entry.mappings().length()))
			.build();
	}

	/**
	 * @return the process-wide instance
	 */
	public static DecodeCache shared() {
		return SHARED;
	}

	/**
	 * @return the decoded form of {@code mappings}
	 * @throws works.splice.exceptions.MappingsFormatException if {@code mappings} is malformed.
	 * Failures are not cached.
	 */
	public MappingTable decode(String mappings) {
		HashCode key = Fingerprints.of(mappings);
		Entry existing = entries.getIfPresent(key);
		if (existing != null) {
			if (existing.mappings().equals(mappings)) {
				hits.increment();
				return existing.table();
			} else {
				LOGGER.warn("Fingerprint collision on {}; decoding without caching", key);
				return MappingsCodec.decode(mappings);
			}
		}

		misses.increment();
		LOGGER.debug("Decoding {} chars of mappings for {}", mappings.length(), key);
		MappingTable table = MappingsCodec.decode(mappings);
		Entry winner = entries.asMap().putIfAbsent(key, new Entry(mappings, table));
		if (winner == null) {
			return table;
		} else if (winner.mappings().equals(mappings)) {
			return winner.table();
		} else {
			return table;
		}
	}

	public long hits() {
		return hits.sum();
	}

	public long misses() {
		return misses.sum();
	}

	public long size() {
		return entries.size();
	}

	public void clear() {
		entries.invalidateAll();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DecodeCache.class);
}
