/**
 * The data model of source maps: {@link works.splice.mapping.Mapping mapping entries},
 * the {@link works.splice.mapping.MappingTable tables} they form,
 * the {@link works.splice.mapping.StringTable string tables} they refer to,
 * and the {@link works.splice.mapping.SourceMap document} that holds them all.
 */
package works.splice.mapping;
