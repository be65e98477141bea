package dev.coursecrawl.course;

import dev.coursecrawl.schedule.ScheduleDecoder;
import dev.coursecrawl.schedule.ScheduleEntry;
import dev.coursecrawl.semester.Era;
import dev.coursecrawl.semester.Semester;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Maps one listing row to a {@link CourseRecord}.
 *
 * <p>The semester fixes the {@link Era} once: it selects the column layout, the schedule grammar,
 * whether credits are fractional and the value stored for empty integer cells. Cell content never
 * changes these choices.
 *
 * <p>Text fields lose surrounding whitespace and non-breaking spaces and are never null.
 * Cross-reference ids come from the query of the cell's leading link and are null when there is
 * no link. Marker images under {@code images/} set the change status; an unknown marker fails the
 * row.
 */
public class CourseRecordExtractor {

  private static final Logger log = LoggerFactory.getLogger(CourseRecordExtractor.class);

  static final String DEPARTMENT_ID_PARAM = "dpt_code";
  static final String INSTRUCTOR_ID_PARAM = "tea_code";

  private static final String MARKER_DIRECTORY = "images/";
  private static final Set<String> NEUTRAL_MARKERS = Set.of("images/space.gif");
  private static final char NBSP = '\u00a0';

  private final Semester semester;
  private final Era era;
  private final ColumnLayout layout;
  private final ScheduleDecoder scheduleDecoder;
  private final PlatformIdResolver platformIdResolver;

  public CourseRecordExtractor(Semester semester, PlatformIdResolver platformIdResolver) {
    this.semester = semester;
    this.era = semester.era();
    this.layout = ColumnLayout.forEra(era);
    this.scheduleDecoder = new ScheduleDecoder(era);
    this.platformIdResolver = platformIdResolver;
  }

  /**
   * Extracts a record from one row.
   *
   * @param row listing row
   * @return the extracted record
   * @throws ExtractionException if a cell violates its expected shape
   * @throws dev.coursecrawl.schedule.ScheduleDecodeException if the schedule cannot be decoded
   * @throws dev.coursecrawl.transport.TransportException if the platform redirect check fails
   */
  public CourseRecord extract(RowHandle row) {
    List<CellHandle> cells = row.cells();
    if (cells.size() < layout.requiredCells()) {
      String serial = cells.isEmpty() ? "?" : clean(cells.get(0).text());
      throw new ExtractionException(
          "row " + serial,
          "expected at least "
              + layout.requiredCells()
              + " cells for "
              + semester
              + ", found "
              + cells.size());
    }

    String serialNumber = clean(cells.get(layout.serialNumber()).text());
    String selectionCode = clean(cells.get(layout.selectionCode()).text());
    String rowId = "row " + serialNumber + " (" + selectionCode + ")";

    CellHandle title = cells.get(layout.title());
    CellHandle instructor = cells.get(layout.instructor());
    String scheduleText = clean(cells.get(layout.schedule()).text());
    List<ScheduleEntry> schedule = scheduleDecoder.decode(scheduleText);

    CourseRecord course =
        new CourseRecord(
            serialNumber,
            clean(cells.get(layout.departmentName()).text()),
            queryId(title, DEPARTMENT_ID_PARAM, rowId),
            clean(cells.get(layout.classLabel()).text()),
            clean(title.linkText()),
            credits(cells.get(layout.credits()), rowId),
            clean(cells.get(layout.courseCode()).text()),
            selectionCode,
            clean(instructor.linkText()),
            queryId(instructor, INSTRUCTOR_ID_PARAM, rowId),
            integer(cells.get(layout.selectionMethod()), "selection method", rowId),
            scheduleText,
            schedule,
            cells.get(layout.generalMark()).markup(),
            cells.get(layout.comment()).markup(),
            changeStatus(row, rowId),
            platformIdResolver.resolve(cells.get(layout.platformLink()).linkHref(), rowId));
    log.debug("Extracted {} with {} schedule entries", rowId, schedule.size());
    return course;
  }

  private Number credits(CellHandle cell, String rowId) {
    String text = clean(cell.text());
    if (!era.fractionalCredits()) {
      return integer(cell, "credits", rowId);
    }
    if (text.isEmpty()) {
      return (double) era.emptyIntegerSentinel();
    }
    try {
      return Double.valueOf(text);
    } catch (NumberFormatException e) {
      throw new ExtractionException(rowId, "credits is not a number: " + text, e);
    }
  }

  private int integer(CellHandle cell, String field, String rowId) {
    String text = clean(cell.text());
    if (text.isEmpty()) {
      return era.emptyIntegerSentinel();
    }
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw new ExtractionException(rowId, field + " is not an integer: " + text, e);
    }
  }

  private static @Nullable String queryId(CellHandle cell, String param, String rowId) {
    String href = cell.linkHref();
    if (href == null) {
      return null;
    }
    String id;
    try {
      id = UriComponentsBuilder.fromUriString(href).build().getQueryParams().getFirst(param);
    } catch (IllegalArgumentException e) {
      throw new ExtractionException(rowId, "malformed link " + href, e);
    }
    if (id == null || id.isEmpty()) {
      throw new ExtractionException(rowId, "link " + href + " has no " + param);
    }
    return id;
  }

  private static @Nullable ChangeStatus changeStatus(RowHandle row, String rowId) {
    ChangeStatus status = null;
    for (String source : row.imageSources()) {
      if (!source.startsWith(MARKER_DIRECTORY) || NEUTRAL_MARKERS.contains(source)) {
        continue;
      }
      ChangeStatus marked =
          ChangeStatus.fromMarker(source)
              .orElseThrow(() -> new ExtractionException(rowId, "unknown marker " + source));
      if (status != null && status != marked) {
        throw new ExtractionException(rowId, "conflicting markers " + status + " and " + marked);
      }
      status = marked;
    }
    return status;
  }

  /** Strips whitespace and non-breaking spaces from both ends; inner characters are kept. */
  static String clean(@Nullable String text) {
    if (text == null) {
      return "";
    }
    int start = 0;
    int end = text.length();
    while (start < end && isEdgeBlank(text.charAt(start))) {
      start++;
    }
    while (end > start && isEdgeBlank(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(start, end);
  }

  private static boolean isEdgeBlank(char c) {
    return c == NBSP || Character.isWhitespace(c);
  }
}
