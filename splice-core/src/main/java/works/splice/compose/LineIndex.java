package works.splice.compose;

import java.util.Arrays;

/**
 * Converts between character offsets and line/column positions in a text.
 */
final class LineIndex {
	private final int[] lineStarts;
	private final int length;

	private LineIndex(int[] lineStarts, int length) {
		this.lineStarts = lineStarts;
		this.length = length;
	}

	static LineIndex of(String text) {
		int count = 1;
		for (int i = text.indexOf('\n'); i >= 0; i = text.indexOf('\n', i + 1)) {
			count++;
		}
		int[] starts = new int[count];
		int line = 1;
		for (int i = text.indexOf('\n'); i >= 0; i = text.indexOf('\n', i + 1)) {
			starts[line++] = i + 1;
		}
		return new LineIndex(starts, text.length());
	}

	int lineCount() {
		return lineStarts.length;
	}

	int lineStart(int line) {
		return lineStarts[line];
	}

	/**
	 * @return the offset of the given position, or -1 if there's no such position in the text.
	 * The position just past the end of a line, where its newline is, counts as part of the line.
	 */
	int offsetOf(int line, int column) {
		if (line >= lineStarts.length) {
			return -1;
		}
		int lineEnd = (line + 1 < lineStarts.length) ? lineStarts[line + 1] - 1 : length;
		int offset = lineStarts[line] + column;
		return (offset <= lineEnd) ? offset : -1;
	}

	int lineOf(int offset) {
		int index = Arrays.binarySearch(lineStarts, offset);
		return (index >= 0) ? index : -index - 2;
	}

	int columnOf(int offset) {
		return offset - lineStarts[lineOf(offset)];
	}
}
