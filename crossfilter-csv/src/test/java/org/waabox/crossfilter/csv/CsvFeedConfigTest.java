package org.waabox.crossfilter.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CsvFeedConfig}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CsvFeedConfigTest {

  @Test
  void whenCreating_givenNoArguments_shouldUseDefaults() {
    final CsvFeedConfig config = CsvFeedConfig.create();

    assertEquals("id", config.idField());
    assertEquals(',', config.separator());
    assertEquals(StandardCharsets.UTF_8, config.charset());
  }

  @Test
  void whenCreating_givenCustomValues_shouldKeepThem() {
    final CsvFeedConfig config = CsvFeedConfig.create("code", ';',
        StandardCharsets.ISO_8859_1);

    assertEquals("code", config.idField());
    assertEquals(';', config.separator());
    assertEquals(StandardCharsets.ISO_8859_1, config.charset());
  }

  @Test
  void whenCreating_givenInvalidValues_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> CsvFeedConfig.create("", ',', StandardCharsets.UTF_8));
    assertThrows(NullPointerException.class,
        () -> CsvFeedConfig.create("id", ',', null));
  }
}
