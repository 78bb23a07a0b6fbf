/**
 * JSON support for {@link works.splice.mapping.SourceMap} using Jackson.
 */
package works.splice.jackson;
