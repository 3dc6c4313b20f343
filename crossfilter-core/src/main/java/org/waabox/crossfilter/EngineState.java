package org.waabox.crossfilter;

/**
 * The lifecycle states of a {@link CrossFilterEngine}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum EngineState {

  /** No dataset has been submitted yet. */
  NO_INDEX,

  /** A build is running; queries and filter changes are rejected. */
  INDEXING,

  /** An index is installed and can be queried. */
  READY,

  /** The latest build failed; stays here until the next dataset. */
  FAILED
}
