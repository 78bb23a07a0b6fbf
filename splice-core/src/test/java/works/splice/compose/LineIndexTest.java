package works.splice.compose;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LineIndexTest {
	final LineIndex index = LineIndex.of("ab\n\ncde\n");

	@Test
	void lines() {
		assertEquals(4, index.lineCount());
		assertEquals(0, index.lineStart(0));
		assertEquals(3, index.lineStart(1));
		assertEquals(4, index.lineStart(2));
		assertEquals(8, index.lineStart(3));
	}

	@Test
	void offsetOf() {
		assertEquals(1, index.offsetOf(0, 1));
		assertEquals(2, index.offsetOf(0, 2));
		assertEquals(-1, index.offsetOf(0, 3));
		assertEquals(3, index.offsetOf(1, 0));
		assertEquals(6, index.offsetOf(2, 2));
		assertEquals(8, index.offsetOf(3, 0));
		assertEquals(-1, index.offsetOf(3, 1));
		assertEquals(-1, index.offsetOf(4, 0));
	}

	@Test
	void lineAndColumnOf() {
		assertEquals(0, index.lineOf(2));
		assertEquals(1, index.lineOf(3));
		assertEquals(2, index.lineOf(7));
		assertEquals(3, index.lineOf(8));
		assertEquals(3, index.columnOf(7));
	}
}
