package dev.coursecrawl.course;

import dev.coursecrawl.semester.Era;
import java.util.stream.IntStream;

/**
 * Zero-based cell indices of the listing table. Legacy listings have no course-number column, so
 * every column after the department name sits one position to the left.
 */
record ColumnLayout(
    int serialNumber,
    int departmentName,
    int classLabel,
    int title,
    int credits,
    int courseCode,
    int selectionCode,
    int instructor,
    int selectionMethod,
    int schedule,
    int generalMark,
    int comment,
    int platformLink) {

  static final ColumnLayout MODERN = new ColumnLayout(0, 1, 3, 4, 5, 6, 8, 9, 10, 11, 13, 14, 15);

  static final ColumnLayout LEGACY = new ColumnLayout(0, 1, 2, 3, 4, 5, 7, 8, 9, 10, 12, 13, 14);

  static ColumnLayout forEra(Era era) {
    return era == Era.MODERN ? MODERN : LEGACY;
  }

  /** Minimum number of cells a row must have. */
  int requiredCells() {
    return IntStream.of(
                serialNumber,
                departmentName,
                classLabel,
                title,
                credits,
                courseCode,
                selectionCode,
                instructor,
                selectionMethod,
                schedule,
                generalMark,
                comment,
                platformLink)
            .max()
            .orElse(0)
        + 1;
  }
}
