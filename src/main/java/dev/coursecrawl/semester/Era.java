package dev.coursecrawl.semester;

/**
 * Policy regime selected once from a semester: column layout of the listing table, schedule
 * grammar, credit representation and the sentinel used for empty integer cells.
 */
public enum Era {

  /** Semesters before {@link #MODERN_FROM}: unordered slot runs, dash ranges, integer credits. */
  LEGACY(0, false),

  /** Semesters from {@link #MODERN_FROM} on: comma-delimited slots, fractional credits. */
  MODERN(-1, true);

  /** First semester of the modern regime. */
  public static final Semester MODERN_FROM = new Semester(99, 1);

  private final int emptyIntegerSentinel;
  private final boolean fractionalCredits;

  Era(int emptyIntegerSentinel, boolean fractionalCredits) {
    this.emptyIntegerSentinel = emptyIntegerSentinel;
    this.fractionalCredits = fractionalCredits;
  }

  public static Era forSemester(Semester semester) {
    return semester.compareTo(MODERN_FROM) >= 0 ? MODERN : LEGACY;
  }

  /** Value stored for an integer field whose cell is empty. */
  public int emptyIntegerSentinel() {
    return emptyIntegerSentinel;
  }

  public boolean fractionalCredits() {
    return fractionalCredits;
  }
}
