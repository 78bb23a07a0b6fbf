package works.splice.exceptions;

/**
 * The encoded {@code mappings} text of a source map is malformed.
 */
public final class MappingsFormatException extends SpliceException {
	private final int offset;

	public MappingsFormatException(String message, int offset) {
		super(message + " at offset " + offset);
		this.offset = offset;
	}

	MappingsFormatException(String message, int offset, Throwable cause) {
		super(message, cause);
		this.offset = offset;
	}

	/**
	 * @return the character offset within the mappings text where the problem was detected
	 */
	public int offset() {
		return offset;
	}
}
