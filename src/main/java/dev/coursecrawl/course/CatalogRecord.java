package dev.coursecrawl.course;

/** An entry of a listing page: either a course or a placeholder padding a short page. */
public sealed interface CatalogRecord permits CourseRecord, NotFoundRecord {

  /** Whether this entry carries course data. */
  boolean found();
}
