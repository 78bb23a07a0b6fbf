/**
 * The text encoding of mapping tables.
 * {@link works.splice.codec.MappingsCodec} handles whole tables,
 * and {@link works.splice.codec.Base64Vlq} handles the individual integers they're made of.
 * <p>
 * Output is byte-for-byte what other revision 3 source map tools produce for the same table.
 */
package works.splice.codec;
