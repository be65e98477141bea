package dev.coursecrawl.course;

/** Placeholder for a position the listing service returned no row for. */
public record NotFoundRecord() implements CatalogRecord {

  public static final NotFoundRecord INSTANCE = new NotFoundRecord();

  @Override
  public boolean found() {
    return false;
  }
}
