package works.splice.codec;

import java.util.Arrays;
import works.splice.exceptions.MappingsFormatException;

/**
 * Base64 variable-length quantities, as used by the {@code mappings} field of a source map.
 * <p>
 * A signed value is first turned into an unsigned one with the sign in the least significant bit.
 * That is then emitted five bits at a time, least significant group first,
 * with the sixth bit of each base64 digit set on every digit but the last.
 */
public final class Base64Vlq {
	static final String BASE64_DIGITS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

	private static final int BITS_PER_DIGIT = 5;
	private static final int DIGIT_MASK = (1 << BITS_PER_DIGIT) - 1;
	private static final int CONTINUATION = 1 << BITS_PER_DIGIT;

	/**
	 * A 32-bit value with its sign bit takes at most this many digits.
	 */
	private static final int MAX_DIGITS = 7;

	private static final byte[] DIGIT_VALUES = new byte[128];

	static {
		Arrays.fill(DIGIT_VALUES, (byte) -1);
		for (int i = 0; i < BASE64_DIGITS.length(); i++) {
			DIGIT_VALUES[BASE64_DIGITS.charAt(i)] = (byte) i;
		}
	}

	private Base64Vlq() {
	}

	public static void encode(StringBuilder out, int value) {
		// Work in long so that Integer.MIN_VALUE has a magnitude
		long magnitude = Math.abs((long) value);
		long vlq = (magnitude << 1) | (value < 0 ? 1 : 0);
		do {
			int digit = (int) (vlq & DIGIT_MASK);
			vlq >>>= BITS_PER_DIGIT;
			if (vlq != 0) {
				digit |= CONTINUATION;
			}
			out.append(BASE64_DIGITS.charAt(digit));
		} while (vlq != 0);
	}

	public static String encode(int value) {
		StringBuilder sb = new StringBuilder(MAX_DIGITS);
		encode(sb, value);
		return sb.toString();
	}

	/**
	 * @return the value of the single VLQ that makes up all of {@code text}
	 * @throws MappingsFormatException if {@code text} is not exactly one VLQ
	 */
	public static int decode(CharSequence text) {
		Cursor cursor = new Cursor(text, 0, text.length());
		int result = cursor.next();
		if (cursor.hasNext()) {
			throw new MappingsFormatException("Unexpected characters after VLQ", cursor.position());
		}
		return result;
	}

	/**
	 * @return true if {@code c} is a base64 digit
	 */
	public static boolean isDigit(char c) {
		return c < DIGIT_VALUES.length && DIGIT_VALUES[c] >= 0;
	}

	/**
	 * Reads consecutive VLQs out of a region of a larger text.
	 */
	public static final class Cursor {
		private final CharSequence text;
		private final int end;
		private int pos;

		/**
		 * @param start offset of the first character to read
		 * @param end offset just past the last character to read
		 */
		public Cursor(CharSequence text, int start, int end) {
			this.text = text;
			this.pos = start;
			this.end = end;
		}

		public boolean hasNext() {
			return pos < end;
		}

		public int position() {
			return pos;
		}

		/**
		 * @throws MappingsFormatException if the input holds an invalid digit,
		 * ends in the middle of a value, or the value doesn't fit in an {@code int}
		 */
		public int next() {
			int start = pos;
			long vlq = 0;
			int shift = 0;
			int digit;
			do {
				if (pos >= end) {
					throw new MappingsFormatException("Truncated VLQ", start);
				}
				char c = text.charAt(pos);
				if (!isDigit(c)) {
					throw new MappingsFormatException("Invalid base64 character '" + c + "'", pos);
				}
				if (pos - start >= MAX_DIGITS) {
					throw new MappingsFormatException("VLQ too long", start);
				}
				pos++;
				digit = DIGIT_VALUES[c];
				vlq |= (long) (digit & DIGIT_MASK) << shift;
				shift += BITS_PER_DIGIT;
			} while ((digit & CONTINUATION) != 0);

			long magnitude = vlq >>> 1;
			long value = ((vlq & 1) == 0) ? magnitude : -magnitude;
			if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
				throw new MappingsFormatException("VLQ value out of range: " + value, start);
			}
			return (int) value;
		}
	}
}
