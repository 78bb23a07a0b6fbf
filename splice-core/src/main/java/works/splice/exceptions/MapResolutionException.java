package works.splice.exceptions;

import java.util.List;

/**
 * Resolving a position through a chain of upstream source maps
 * did not terminate within the configured depth.
 * This usually means the upstream maps refer to each other in a cycle.
 */
public final class MapResolutionException extends SpliceException {
	private final List<String> sourceChain;

	public MapResolutionException(String message, List<String> sourceChain) {
		super(message + " " + sourceChain);
		this.sourceChain = List.copyOf(sourceChain);
	}

	MapResolutionException(String message, List<String> sourceChain, Throwable cause) {
		super(message, cause);
		this.sourceChain = List.copyOf(sourceChain);
	}

	/**
	 * @return the source names visited, in order, before giving up
	 */
	public List<String> sourceChain() {
		return sourceChain;
	}
}
