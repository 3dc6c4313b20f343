package org.waabox.crossfilter;

/**
 * Thrown when an index build is requested over zero rows.
 *
 * <p>No index is produced. The engine moves to
 * {@link EngineState#FAILED} and keeps it until the next dataset is
 * submitted.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EmptyDatasetException extends CrossFilterException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception for an empty row sequence. */
  public EmptyDatasetException() {
    super("Cannot build an index over an empty dataset");
  }
}
