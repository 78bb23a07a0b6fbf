package works.splice.exceptions;

/**
 * Base class of everything the library throws on bad input.
 * All subclasses are unchecked: the caller that built the offending
 * source or supplied the offending text is the one that can fix it.
 */
public sealed abstract class SpliceException extends RuntimeException permits
	InvalidSourceException,
	MappingsFormatException,
	MapResolutionException
{
	protected SpliceException(String message) {
		super(message);
	}

	protected SpliceException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same type as {@code exception}
	 * whose message is prefixed by {@code context}.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends SpliceException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof MappingsFormatException e) {
			return (T) new MappingsFormatException(newMessage, e.offset(), e);
		} else if (exception instanceof MapResolutionException e) {
			return (T) new MapResolutionException(newMessage, e.sourceChain(), e);
		} else if (exception instanceof InvalidSourceException e) {
			return (T) new InvalidSourceException(newMessage, e);
		} else {
			throw new AssertionError("Unexpected exception type: " + exception.getClass());
		}
	}
}
