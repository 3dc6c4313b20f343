package org.waabox.crossfilter;

/**
 * Base exception for all cross-filter errors.
 *
 * <p>This is an unchecked exception. Index build failures and rejected
 * queries are reported through its subclasses; none of them leaves the
 * active index or the filter state modified.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CrossFilterException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public CrossFilterException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public CrossFilterException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
