package works.splice.compose;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.splice.CachedSource;
import works.splice.ConcatSource;
import works.splice.MapOptions;
import works.splice.MappedSource;
import works.splice.OriginalSource;
import works.splice.RawSource;
import works.splice.ReplaceSource;
import works.splice.Source;
import works.splice.mapping.Mapping;
import works.splice.mapping.MappingTable;
import works.splice.mapping.StringTable;

import static works.splice.mapping.Mapping.NONE;

/**
 * Computes the text and merged mapping table of a {@link Source} tree
 * in a single depth-first traversal.
 * <p>
 * Leaves write their text and entries straight into the output,
 * shifted to wherever the output currently ends.
 * Sources that need to see a child's complete result first,
 * namely {@link ReplaceSource} and {@link CachedSource},
 * compose that child separately and then splice the result in.
 * <p>
 * The traversal itself always works with columns.
 * Without them, the finished table is reduced with {@link Composed#linesOnly()},
 * so a lines-only result never depends on which parts of the tree were cached.
 */
public final class Composer {
	private Composer() {
	}

	public static Composed compose(Source source, MapOptions options) {
		LOGGER.debug("Composing {} with {}", source, options);
		Session session = new Session(options, new MapChainResolver(options.getMaxResolutionDepth()));
		session.composeAny(source);
		Composed result = session.finish();
		return options.isColumns() ? result : result.linesOnly();
	}

	static final class Session {
		final MapOptions options;
		final MapChainResolver resolver;

		final StringBuilder text = new StringBuilder();
		final MappingTable.Builder entries = MappingTable.builder();
		final StringTable sources = new StringTable();
		final List<String> sourcesContent = new ArrayList<>();
		final StringTable names = new StringTable();

		/**
		 * Where the output text currently ends.
		 */
		int line = 0;
		int column = 0;

		int lastEntryLine = -1;
		boolean lastEntrySourced = false;

		/**
		 * Deepest upstream resolution among the results spliced in.
		 */
		int splicedDepth = 0;

		Session(MapOptions options, MapChainResolver resolver) {
			this.options = options;
			this.resolver = resolver;
		}

		void composeAny(Source source) {
			if (source instanceof RawSource s) {
				composeRaw(s);
			} else if (source instanceof OriginalSource s) {
				composeOriginal(s);
			} else if (source instanceof MappedSource s) {
				composeMapped(s);
			} else if (source instanceof ConcatSource s) {
				for (Source child : s.children()) {
					composeAny(child);
				}
			} else if (source instanceof ReplaceSource s) {
				composeReplace(s);
			} else if (source instanceof CachedSource s) {
				splice(s.composed(options.withColumns(true)));
			} else {
				throw new AssertionError("Unexpected source type: " + source.getClass());
			}
		}

		private void composeRaw(RawSource source) {
			closeOpenMapping(source.text(), false);
			appendText(source.text());
		}

		/**
		 * Maps the start of every non-empty line,
		 * and the start of each potential token on it,
		 * meaning the point after a run of {@code ; { }} and whitespace.
		 */
		private void composeOriginal(OriginalSource source) {
			String t = source.text();
			if (t.isEmpty()) {
				return;
			}
			int sourceIndex = internSource(source.name(), t);
			int localLine = 0;
			int lineStart = 0;
			while (lineStart < t.length()) {
				int lineEnd = t.indexOf('\n', lineStart);
				if (lineEnd < 0) {
					lineEnd = t.length();
				}
				if (lineEnd > lineStart) {
					emitShifted(Mapping.sourced(localLine, 0, sourceIndex, localLine, 0));
					int i = lineStart;
					while (i < lineEnd) {
						if (isTokenEnd(t.charAt(i))) {
							int j = i + 1;
							while (j < lineEnd && (isTokenEnd(t.charAt(j)) || isWhitespace(t.charAt(j)))) {
								j++;
							}
							if (j < lineEnd) {
								int col = j - lineStart;
								emitShifted(Mapping.sourced(localLine, col, sourceIndex, localLine, col));
							}
							i = j;
						} else {
							i++;
						}
					}
				}
				localLine++;
				lineStart = lineEnd + 1;
			}
			appendText(t);
		}

		private static boolean isTokenEnd(char c) {
			return c == ';' || c == '{' || c == '}';
		}

		private static boolean isWhitespace(char c) {
			return c == ' ' || c == '\t' || c == '\r';
		}

		private void composeMapped(MappedSource source) {
			String t = source.text();
			MappingTable table = source.sourceMap().mappingTable();
			closeOpenMapping(t, startsAtOrigin(table));
			for (Mapping entry : table) {
				if (entry.hasSource()) {
					var resolved = resolver.resolve(source, entry);
					int sourceIndex = internSource(resolved.source(), resolved.content());
					int nameIndex = (resolved.name() == null) ? NONE : names.intern(resolved.name());
					emitShifted(new Mapping(
						entry.generatedLine(), entry.generatedColumn(),
						sourceIndex, resolved.line(), resolved.column(),
						nameIndex));
				} else {
					emitShifted(entry);
				}
			}
			appendText(t);
		}

		private void composeReplace(ReplaceSource source) {
			Session baseSession = new Session(options, resolver);
			baseSession.composeAny(source.base());
			splice(ReplaceRewriter.rewrite(baseSession.finish(), source.replacements()));
		}

		/**
		 * Appends an already-composed result, translating its string table indexes into ours.
		 */
		void splice(Composed composed) {
			MappingTable table = composed.table();
			splicedDepth = Math.max(splicedDepth, composed.resolutionDepth());
			closeOpenMapping(composed.text(), startsAtOrigin(table));
			int[] sourceIndexes = new int[composed.sources().size()];
			for (int i = 0; i < sourceIndexes.length; i++) {
				sourceIndexes[i] = internSource(composed.sources().get(i), composed.sourcesContent().get(i));
			}
			int[] nameIndexes = new int[composed.names().size()];
			for (int i = 0; i < nameIndexes.length; i++) {
				nameIndexes[i] = names.intern(composed.names().get(i));
			}
			for (Mapping entry : table) {
				if (entry.hasSource()) {
					emitShifted(new Mapping(
						entry.generatedLine(), entry.generatedColumn(),
						sourceIndexes[entry.sourceIndex()], entry.originalLine(), entry.originalColumn(),
						entry.hasName() ? nameIndexes[entry.nameIndex()] : NONE));
				} else {
					emitShifted(entry);
				}
			}
			appendText(composed.text());
		}

		private static boolean startsAtOrigin(MappingTable table) {
			if (table.isEmpty()) {
				return false;
			}
			Mapping first = table.get(0);
			return first.generatedLine() == 0 && first.generatedColumn() == 0;
		}

		/**
		 * If a sourced segment is still open on the current line,
		 * ends it before unmapped text is appended, so that the text isn't attributed to it.
		 */
		private void closeOpenMapping(String upcoming, boolean upcomingStartsMapped) {
			if (!upcomingStartsMapped
				&& lastEntrySourced
				&& lastEntryLine == line
				&& !upcoming.isEmpty()
				&& upcoming.charAt(0) != '\n'
			) {
				emit(Mapping.generatedOnly(line, column));
			}
		}

		/**
		 * @param local an entry positioned relative to the text about to be appended
		 */
		private void emitShifted(Mapping local) {
			if (local.generatedLine() == 0) {
				emit(local.atGenerated(line, column + local.generatedColumn()));
			} else {
				emit(local.atGenerated(line + local.generatedLine(), local.generatedColumn()));
			}
		}

		private void emit(Mapping entry) {
			LOGGER.trace("emit {}", entry);
			entries.add(entry);
			lastEntryLine = entry.generatedLine();
			lastEntrySourced = entry.hasSource();
		}

		private void appendText(String t) {
			text.append(t);
			int lastNewline = t.lastIndexOf('\n');
			if (lastNewline < 0) {
				column += t.length();
			} else {
				for (int i = lastNewline; i >= 0; i = t.lastIndexOf('\n', i - 1)) {
					line++;
				}
				column = t.length() - lastNewline - 1;
			}
		}

		private int internSource(String name, @Nullable String content) {
			int index = sources.intern(name);
			if (index == sourcesContent.size()) {
				sourcesContent.add(content);
			} else if (content != null && sourcesContent.get(index) == null) {
				sourcesContent.set(index, content);
			}
			return index;
		}

		Composed finish() {
			int depth = Math.max(splicedDepth, resolver.deepest());
			return new Composed(text.toString(), entries.buildLastWins(), sources.toList(), sourcesContent, names.toList(), depth);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Composer.class);
}
