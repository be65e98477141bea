package dev.coursecrawl.schedule;

import java.util.List;

/**
 * Ordered time-slot symbols of the catalog. {@code @} is the dedicated symbol of the slot written
 * {@code 10} in the source text.
 */
public final class TimeSlotAlphabet {

  /** Canonical symbol of the two-position "10" slot. */
  public static final String TEN = "@";

  /** Arranged-time marker, only valid in legacy schedules. */
  public static final String WILDCARD = "*";

  static final List<String> SYMBOLS =
      List.of("0", "1", "2", "3", "4", "5", "6", "7", "8", "9", TEN, "A", "B", "C", "D");

  private TimeSlotAlphabet() {
    // utility class
  }

  /** Position of the symbol in slot order, or -1 when it is not a slot symbol. */
  public static int position(String symbol) {
    return SYMBOLS.indexOf(symbol);
  }

  public static boolean isSymbol(char c) {
    return position(String.valueOf(c)) >= 0;
  }

  /**
   * Symbols strictly after {@code from} up to and including {@code to}.
   *
   * @throws IllegalArgumentException if either bound is not a slot symbol
   */
  static List<String> after(String from, String to) {
    int start = position(from);
    int end = position(to);
    if (start < 0 || end < 0) {
      throw new IllegalArgumentException("Not a slot symbol: " + (start < 0 ? from : to));
    }
    return SYMBOLS.subList(start + 1, end + 1);
  }
}
