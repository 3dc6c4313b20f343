package org.waabox.crossfilter.csv;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Configuration holder for the CSV row feed.
 *
 * <p>Holds the name of the identifier column, the column separator and the
 * file encoding.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CsvFeedConfig {

  /** The default identifier column. */
  private static final String DEFAULT_ID_FIELD = "id";

  /** The default column separator. */
  private static final char DEFAULT_SEPARATOR = ',';

  /** The identifier column name. */
  private final String idField;

  /** The column separator. */
  private final char separator;

  /** The file encoding. */
  private final Charset charset;

  /** Private constructor; use the static factory methods instead. */
  private CsvFeedConfig(final String idField, final char separator,
      final Charset charset) {
    this.idField = idField;
    this.separator = separator;
    this.charset = charset;
  }

  /**
   * Creates a configuration for comma separated UTF-8 files whose
   * identifier column is {@value #DEFAULT_ID_FIELD}.
   *
   * @return a new {@link CsvFeedConfig} instance, never null
   */
  public static CsvFeedConfig create() {
    return new CsvFeedConfig(DEFAULT_ID_FIELD, DEFAULT_SEPARATOR,
        StandardCharsets.UTF_8);
  }

  /**
   * Creates a configuration with the given settings.
   *
   * @param idField   the identifier column name, never null or empty
   * @param separator the column separator
   * @param charset   the file encoding, never null
   * @return a new {@link CsvFeedConfig} instance, never null
   *
   * @throws IllegalArgumentException if idField is empty
   */
  public static CsvFeedConfig create(final String idField,
      final char separator, final Charset charset) {
    Objects.requireNonNull(idField, "idField must not be null");
    Objects.requireNonNull(charset, "charset must not be null");
    if (idField.isEmpty()) {
      throw new IllegalArgumentException("idField must not be empty");
    }
    return new CsvFeedConfig(idField, separator, charset);
  }

  /**
   * Returns the identifier column name.
   *
   * @return the identifier column, never null
   */
  public String idField() {
    return idField;
  }

  /**
   * Returns the column separator.
   *
   * @return the separator
   */
  public char separator() {
    return separator;
  }

  /**
   * Returns the file encoding.
   *
   * @return the charset, never null
   */
  public Charset charset() {
    return charset;
  }
}
