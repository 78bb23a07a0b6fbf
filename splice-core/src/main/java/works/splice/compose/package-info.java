/**
 * The composition engine.
 * <p>
 * {@link works.splice.compose.Composer} walks a {@link works.splice.Source} tree once,
 * producing a {@link works.splice.compose.Composed} result:
 * the output text, and one mapping table in the output's coordinates
 * whose entries point, through any number of intermediate maps, at the original sources.
 */
package works.splice.compose;
