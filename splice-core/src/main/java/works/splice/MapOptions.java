package works.splice;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import lombok.With;
import org.jetbrains.annotations.Nullable;

/**
 * Settings for computing a source map.
 * Equal settings produce equal maps, so these also serve as cache keys.
 */
@Value
@With
@Builder(toBuilder = true)
public class MapOptions {
	public static final MapOptions DEFAULT = MapOptions.builder().build();
	public static final MapOptions LINES_ONLY = MapOptions.builder().columns(false).build();

	/**
	 * When false, each generated line is mapped by at most one segment, at column zero.
	 * The map is far smaller, but can only locate lines, not positions within them.
	 */
	@Default boolean columns = true;

	/**
	 * How many upstream maps a single position may be traced through
	 * before the chain is assumed to be cyclic.
	 *
	 * @see works.splice.exceptions.MapResolutionException
	 */
	@Default int maxResolutionDepth = 32;

	/**
	 * Written as the {@code file} of the resulting map.
	 */
	@Nullable String file;
}
