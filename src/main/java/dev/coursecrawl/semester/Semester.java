package dev.coursecrawl.semester;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semester identifier of the catalog, written {@code <academic year>-<term>} (e.g. {@code 104-1}).
 *
 * <p>Years are counted in the catalog's own calendar, so only the ordering matters here. The
 * identifier is kept as written and sent to the listing service unchanged; ordering uses the
 * numeric parts, so {@code 099-1} and {@code 99-1} compare equal.
 *
 * @param year academic year, non-negative
 * @param term term within the year, 1 to 4
 * @param id identifier in the listing service's query format
 */
public record Semester(int year, int term, String id) implements Comparable<Semester> {

  private static final Pattern ID_PATTERN = Pattern.compile("(\\d{1,4})-(\\d)");

  public Semester {
    if (year < 0) {
      throw new IllegalArgumentException("Semester year must not be negative, got: " + year);
    }
    if (term < 1 || term > 4) {
      throw new IllegalArgumentException("Semester term must be in [1, 4], got: " + term);
    }
    id = id == null || id.isBlank() ? year + "-" + term : id;
  }

  public Semester(int year, int term) {
    this(year, term, null);
  }

  /**
   * Parses a semester identifier as used by the listing service.
   *
   * @param id identifier such as {@code 99-2}
   * @return the parsed semester, keeping {@code id} without surrounding whitespace
   * @throws IllegalArgumentException if the identifier is not in {@code year-term} form
   */
  public static Semester parse(String id) {
    if (id == null) {
      throw new IllegalArgumentException("Semester id must not be null");
    }
    String trimmed = id.trim();
    Matcher matcher = ID_PATTERN.matcher(trimmed);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Malformed semester id: " + id);
    }
    return new Semester(
        Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)), trimmed);
  }

  /** Policy regime of this semester. */
  public Era era() {
    return Era.forSemester(this);
  }

  @Override
  public int compareTo(Semester other) {
    int byYear = Integer.compare(year, other.year);
    return byYear != 0 ? byYear : Integer.compare(term, other.term);
  }

  @Override
  public String toString() {
    return id;
  }
}
