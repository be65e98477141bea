package dev.coursecrawl.course;

import java.util.List;

/** Read-only view of one listing row, as consumed by {@link CourseRecordExtractor}. */
public interface RowHandle {

  /** Cells in column order. */
  List<CellHandle> cells();

  /** {@code src} attributes of every image inside the row, in document order. */
  List<String> imageSources();
}
