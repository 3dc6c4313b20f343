package org.waabox.crossfilter;

/**
 * Thrown when the engine is queried, or its filters are changed, while no
 * index is installed.
 *
 * <p>This typically occurs while the first build is still running, or
 * after the last build failed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class IndexNotReadyException extends CrossFilterException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for the given engine state.
   *
   * @param state the state the engine was in, never null
   */
  public IndexNotReadyException(final EngineState state) {
    super("Index not ready, engine is " + state);
  }
}
