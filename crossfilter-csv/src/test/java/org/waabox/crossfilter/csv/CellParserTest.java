package org.waabox.crossfilter.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CellParser}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CellParserTest {

  @Test
  void whenParsing_givenIntegers_shouldReturnLong() {
    assertEquals(42L, CellParser.parse("42"));
    assertEquals(-7L, CellParser.parse(" -7 "));
  }

  @Test
  void whenParsing_givenIntegerOverflowingLong_shouldReturnDouble() {
    assertEquals(1.0E20d, CellParser.parse("100000000000000000000"));
  }

  @Test
  void whenParsing_givenDecimals_shouldReturnDouble() {
    assertEquals(2.5d, CellParser.parse("2.5"));
    assertEquals(0.5d, CellParser.parse(".5"));
    assertEquals(1500.0d, CellParser.parse("1.5e3"));
    assertEquals(-3.0d, CellParser.parse("-3."));
  }

  @Test
  void whenParsing_givenBooleans_shouldReturnBoolean() {
    assertEquals(Boolean.TRUE, CellParser.parse("true"));
    assertEquals(Boolean.FALSE, CellParser.parse("FALSE"));
  }

  @Test
  void whenParsing_givenText_shouldKeepTrimmedString() {
    assertEquals("north", CellParser.parse(" north "));
    assertEquals("1,5", CellParser.parse("1,5"));
    assertEquals("12abc", CellParser.parse("12abc"));
  }

  @Test
  void whenParsing_givenBlankOrMissingCell_shouldReturnNull() {
    assertNull(CellParser.parse(null));
    assertNull(CellParser.parse(""));
    assertNull(CellParser.parse("   "));
  }
}
