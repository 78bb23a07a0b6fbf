/**
 * The primary API: {@link works.splice.Source} and its variants,
 * created through {@link works.splice.Sources}.
 * <p>
 * A tree of sources describes how some generated text was assembled:
 * which parts are copied from original files, which came with maps of their own,
 * which were concatenated, and which had ranges replaced.
 * From that description, the library computes the generated text
 * and a single source map tracing it back to the original files.
 */
package works.splice;
