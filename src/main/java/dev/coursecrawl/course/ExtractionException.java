package dev.coursecrawl.course;

import dev.coursecrawl.error.CatalogException;

/** A listing row violates an expected cell invariant. */
public class ExtractionException extends CatalogException {

  private final String row;

  public ExtractionException(String row, String message) {
    super(row + ": " + message);
    this.row = row;
  }

  public ExtractionException(String row, String message, Throwable cause) {
    super(row + ": " + message, cause);
    this.row = row;
  }

  /** Identity of the offending row (serial number and selection code). */
  public String getRow() {
    return row;
  }
}
