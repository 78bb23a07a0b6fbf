/**
 * Caches that let composition skip work it has already done.
 * <p>
 * {@link works.splice.cache.DecodeCache} is shared process-wide and holds a bounded number of decoded mapping tables.
 * Per-source memoization lives in {@link works.splice.CachedSource}.
 */
package works.splice.cache;
