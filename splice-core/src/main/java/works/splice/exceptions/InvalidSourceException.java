package works.splice.exceptions;

/**
 * A {@link works.splice.Source Source} could not be constructed
 * from the arguments given.
 * <p>
 * Thrown eagerly by constructors and factory methods,
 * never deferred until the source is composed.
 */
public final class InvalidSourceException extends SpliceException {
	public InvalidSourceException(String message) {
		super(message);
	}

	public InvalidSourceException(String message, Throwable cause) {
		super(message, cause);
	}
}
