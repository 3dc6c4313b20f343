package org.waabox.crossfilter.csv;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.crossfilter.Row;
import org.waabox.crossfilter.RowLoader;

/**
 * A {@link RowLoader} that reads rows from a CSV file.
 *
 * <p>The first line is the header and names the fields. Empty lines are
 * skipped. Cells are typed by {@link CellParser}: numbers become numbers,
 * blank cells are left out of the row.
 *
 * <p>A row whose identifier cell is missing, blank, not numeric or not
 * integral gets its 1-based position among the data rows as identifier. A
 * leading byte order mark is ignored.
 *
 * <p>The file is read again on every {@link #load()}, so an engine
 * refresh picks up changes to it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CsvRowLoader implements RowLoader {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      CsvRowLoader.class);

  /** The byte order mark as decoded from UTF-8 or UTF-16. */
  private static final char BYTE_ORDER_MARK = '\uFEFF';

  /** The file to read. */
  private final Path file;

  /** The feed configuration. */
  private final CsvFeedConfig config;

  /** The Jackson CSV mapper. */
  private final CsvMapper mapper;

  /**
   * Creates a loader with the default configuration.
   *
   * @param file the CSV file, never null
   *
   * @throws NullPointerException if file is null
   */
  public CsvRowLoader(final Path file) {
    this(file, CsvFeedConfig.create());
  }

  /**
   * Creates a loader with the given configuration.
   *
   * @param file   the CSV file, never null
   * @param config the feed configuration, never null
   *
   * @throws NullPointerException if file or config is null
   */
  public CsvRowLoader(final Path file, final CsvFeedConfig config) {
    this.file = Objects.requireNonNull(file, "file must not be null");
    this.config = Objects.requireNonNull(config, "config must not be null");
    mapper = new CsvMapper();
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    mapper.enable(CsvParser.Feature.TRIM_SPACES);
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException if the file cannot be read or parsed
   */
  @Override
  public List<Row> load() {
    final CsvSchema schema = CsvSchema.emptySchema()
        .withHeader()
        .withColumnSeparator(config.separator());

    final List<Row> rows = new ArrayList<>();
    int withoutId = 0;

    try (Reader source = Files.newBufferedReader(file, config.charset());
         Reader reader = skipByteOrderMark(source);
         MappingIterator<Map<String, String>> cells = mapper
             .readerForMapOf(String.class)
             .with(schema)
             .readValues(reader)) {

      while (cells.hasNextValue()) {
        final Map<String, String> record = cells.nextValue();
        final long position = rows.size() + 1L;
        boolean positional = !record.containsKey(config.idField());
        final Map<String, Object> fields = new LinkedHashMap<>();
        for (final Map.Entry<String, String> cell : record.entrySet()) {
          Object value = CellParser.parse(cell.getValue());
          if (cell.getKey().equals(config.idField())
              && !Row.isIdentifier(value)) {
            value = position;
            positional = true;
          }
          if (value != null) {
            fields.put(cell.getKey(), value);
          }
        }
        if (positional) {
          withoutId++;
          fields.putIfAbsent(config.idField(), position);
        }
        rows.add(Row.of(fields, config.idField()));
      }
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to read CSV file: " + file, e);
    }

    if (withoutId > 0) {
      log.warn("{} row(s) of {} had no integral '{}', using row position",
          withoutId, file, config.idField());
    }
    log.debug("Read {} rows from {}", rows.size(), file);
    return Collections.unmodifiableList(rows);
  }

  /**
   * Drops a leading byte order mark, which the decoder leaves in the text
   * and would otherwise become part of the first header name.
   *
   * @param reader the reader positioned at the start of the file, never null
   *
   * @return a reader positioned after the mark, if any, never null
   *
   * @throws IOException if the first character cannot be read
   */
  private static Reader skipByteOrderMark(final Reader reader)
      throws IOException {
    final PushbackReader pushback = new PushbackReader(reader, 1);
    final int first = pushback.read();
    if (first != -1 && first != BYTE_ORDER_MARK) {
      pushback.unread(first);
    }
    return pushback;
  }

  /**
   * Returns the file this loader reads.
   *
   * @return the file path, never null
   */
  public Path file() {
    return file;
  }
}
