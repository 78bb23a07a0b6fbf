package works.splice;

import java.io.IOException;
import java.io.Writer;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.splice.Sources.cached;
import static works.splice.Sources.concat;
import static works.splice.Sources.original;
import static works.splice.Sources.raw;
import static works.splice.Sources.replacing;

/**
 * A failing {@link Writer} must surface from {@link Source#writeTo} as the very same exception.
 */
class WriteToTest {

	static Stream<Arguments> sources() {
		Source base = original("let a = 1;\n", "a.js");
		return Stream.of(
			Arguments.of("raw", raw("text")),
			Arguments.of("binary raw", raw(new byte[]{'b'})),
			Arguments.of("original", base),
			Arguments.of("concat", concat(raw("x"), base)),
			Arguments.of("replace", replacing(base).replace(4, 5, "b").build()),
			Arguments.of("cached", cached(concat(base, raw("y")))),
			Arguments.of("cached after text", cachedWithText(base))
		);
	}

	private static Source cachedWithText(Source base) {
		CachedSource result = cached(base);
		result.text();
		return result;
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("sources")
	void writerException_propagatesUnchanged(String description, Source source) {
		IOException expected = new IOException("disk full");
		IOException actual = assertThrows(IOException.class, () -> source.writeTo(new FailingWriter(expected)));
		assertSame(expected, actual);
	}

	private static final class FailingWriter extends Writer {
		private final IOException exception;

		FailingWriter(IOException exception) {
			this.exception = exception;
		}

		@Override
		public void write(char[] cbuf, int off, int len) throws IOException {
			throw exception;
		}

		@Override
		public void flush() {
		}

		@Override
		public void close() {
		}
	}
}
