/**
 * Exceptions thrown by the library. All are subclasses of
 * {@link works.splice.exceptions.SpliceException SpliceException}.
 */
package works.splice.exceptions;
