package works.splice.mapping;

import java.util.Comparator;

/**
 * One segment of a mapping table: a position in the generated text,
 * optionally associated with a position in an original source
 * and optionally with a name.
 * <p>
 * All lines and columns are zero-based. Columns count UTF-16 code units.
 * Absent fields hold {@link #NONE}.
 *
 * @param sourceIndex index into the {@code sources} of the enclosing map, or {@link #NONE}
 * @param nameIndex index into the {@code names} of the enclosing map, or {@link #NONE}
 */
public record Mapping(
	int generatedLine,
	int generatedColumn,
	int sourceIndex,
	int originalLine,
	int originalColumn,
	int nameIndex
) {
	public static final int NONE = -1;

	public static final Comparator<Mapping> GENERATED_ORDER = Comparator
		.comparingInt(Mapping::generatedLine)
		.thenComparingInt(Mapping::generatedColumn);

	public Mapping {
		if (generatedLine < 0 || generatedColumn < 0) {
			throw new IllegalArgumentException("Negative generated position " + generatedLine + ":" + generatedColumn);
		}
		if (sourceIndex == NONE) {
			if (originalLine != NONE || originalColumn != NONE || nameIndex != NONE) {
				throw new IllegalArgumentException("Generated-only mapping can't have an original position or name");
			}
		} else if (sourceIndex < 0 || originalLine < 0 || originalColumn < 0) {
			throw new IllegalArgumentException("Invalid original position " + sourceIndex + "@" + originalLine + ":" + originalColumn);
		} else if (nameIndex < NONE) {
			throw new IllegalArgumentException("Invalid name index " + nameIndex);
		}
	}

	public static Mapping generatedOnly(int generatedLine, int generatedColumn) {
		return new Mapping(generatedLine, generatedColumn, NONE, NONE, NONE, NONE);
	}

	public static Mapping sourced(int generatedLine, int generatedColumn, int sourceIndex, int originalLine, int originalColumn) {
		return new Mapping(generatedLine, generatedColumn, sourceIndex, originalLine, originalColumn, NONE);
	}

	public static Mapping named(int generatedLine, int generatedColumn, int sourceIndex, int originalLine, int originalColumn, int nameIndex) {
		return new Mapping(generatedLine, generatedColumn, sourceIndex, originalLine, originalColumn, nameIndex);
	}

	public boolean hasSource() {
		return sourceIndex != NONE;
	}

	public boolean hasName() {
		return nameIndex != NONE;
	}

	/**
	 * @return true if this and {@code other} have the same generated position
	 */
	public boolean sameGeneratedPosition(Mapping other) {
		return generatedLine == other.generatedLine && generatedColumn == other.generatedColumn;
	}

	public Mapping atGenerated(int line, int column) {
		return new Mapping(line, column, sourceIndex, originalLine, originalColumn, nameIndex);
	}

	public Mapping withNameIndex(int newNameIndex) {
		return new Mapping(generatedLine, generatedColumn, sourceIndex, originalLine, originalColumn, newNameIndex);
	}

	public Mapping withoutName() {
		return new Mapping(generatedLine, generatedColumn, sourceIndex, originalLine, originalColumn, NONE);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder()
			.append(generatedLine).append(':').append(generatedColumn);
		if (hasSource()) {
			sb.append("->").append(sourceIndex).append('@').append(originalLine).append(':').append(originalColumn);
			if (hasName()) {
				sb.append('#').append(nameIndex);
			}
		}
		return sb.toString();
	}
}
