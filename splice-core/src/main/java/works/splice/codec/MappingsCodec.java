package works.splice.codec;

import works.splice.exceptions.MappingsFormatException;
import works.splice.mapping.Mapping;
import works.splice.mapping.MappingTable;

import static works.splice.mapping.Mapping.NONE;

/**
 * Converts between a {@link MappingTable} and the {@code mappings} text of a revision 3 source map.
 * <p>
 * Each segment has 1, 4 or 5 fields.
 * The generated column is relative to the previous segment on the same line,
 * and restarts at zero on every line.
 * The source index, original line, original column and name index are relative
 * to the last segment that had that field, regardless of line.
 */
public final class MappingsCodec {
	private MappingsCodec() {
	}

	public static String encode(MappingTable table) {
		StringBuilder out = new StringBuilder(table.size() * 6);
		int currentLine = 0;
		int previousColumn = 0;
		int previousSource = 0;
		int previousOriginalLine = 0;
		int previousOriginalColumn = 0;
		int previousName = 0;
		boolean lineHasSegment = false;

		for (Mapping entry : table) {
			while (currentLine < entry.generatedLine()) {
				out.append(';');
				currentLine++;
				previousColumn = 0;
				lineHasSegment = false;
			}
			if (lineHasSegment) {
				out.append(',');
			}
			lineHasSegment = true;

			Base64Vlq.encode(out, entry.generatedColumn() - previousColumn);
			previousColumn = entry.generatedColumn();
			if (entry.hasSource()) {
				Base64Vlq.encode(out, entry.sourceIndex() - previousSource);
				previousSource = entry.sourceIndex();
				Base64Vlq.encode(out, entry.originalLine() - previousOriginalLine);
				previousOriginalLine = entry.originalLine();
				Base64Vlq.encode(out, entry.originalColumn() - previousOriginalColumn);
				previousOriginalColumn = entry.originalColumn();
				if (entry.hasName()) {
					Base64Vlq.encode(out, entry.nameIndex() - previousName);
					previousName = entry.nameIndex();
				}
			}
		}
		return out.toString();
	}

	/**
	 * @throws MappingsFormatException if {@code mappings} is malformed.
	 * Nothing is silently skipped.
	 */
	public static MappingTable decode(String mappings) {
		MappingTable.Builder builder = MappingTable.builder();
		int line = 0;
		int column = 0;
		int source = 0;
		int originalLine = 0;
		int originalColumn = 0;
		int name = 0;
		int[] fields = new int[5];

		int pos = 0;
		int length = mappings.length();
		while (pos <= length) {
			int segmentEnd = pos;
			while (segmentEnd < length) {
				char c = mappings.charAt(segmentEnd);
				if (c == ',' || c == ';') {
					break;
				}
				segmentEnd++;
			}

			if (segmentEnd > pos) {
				Base64Vlq.Cursor cursor = new Base64Vlq.Cursor(mappings, pos, segmentEnd);
				int fieldCount = 0;
				while (cursor.hasNext()) {
					if (fieldCount == fields.length) {
						throw new MappingsFormatException("Segment has more than 5 fields", pos);
					}
					fields[fieldCount++] = cursor.next();
				}
				if (fieldCount != 1 && fieldCount != 4 && fieldCount != 5) {
					throw new MappingsFormatException("Segment has " + fieldCount + " fields", pos);
				}

				column = checkedAdd(column, fields[0], "generated column", pos);
				if (fieldCount == 1) {
					builder.add(Mapping.generatedOnly(line, column));
				} else {
					source = checkedAdd(source, fields[1], "source index", pos);
					originalLine = checkedAdd(originalLine, fields[2], "original line", pos);
					originalColumn = checkedAdd(originalColumn, fields[3], "original column", pos);
					int nameIndex = NONE;
					if (fieldCount == 5) {
						name = checkedAdd(name, fields[4], "name index", pos);
						nameIndex = name;
					}
					builder.add(new Mapping(line, column, source, originalLine, originalColumn, nameIndex));
				}
			} else if ((segmentEnd < length && mappings.charAt(segmentEnd) == ',')
				|| (pos > 0 && mappings.charAt(pos - 1) == ',')) {
				throw new MappingsFormatException("Empty segment", pos);
			}

			if (segmentEnd < length && mappings.charAt(segmentEnd) == ';') {
				line++;
				column = 0;
			}
			pos = segmentEnd + 1;
		}
		return builder.build();
	}

	private static int checkedAdd(int previous, int delta, String field, int offset) {
		long result = (long) previous + delta;
		if (result < 0) {
			throw new MappingsFormatException("Negative " + field + " " + result, offset);
		} else if (result > Integer.MAX_VALUE) {
			throw new MappingsFormatException(field + " out of range: " + result, offset);
		}
		return (int) result;
	}
}
