package dev.coursecrawl.course;

import dev.coursecrawl.schedule.ScheduleEntry;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One course row of the listing, immutable once extracted.
 *
 * @param serialNumber listing serial number
 * @param departmentName offering department
 * @param departmentCode department cross-reference id, null when the title carries no link
 * @param classLabel class (section) label
 * @param title course title
 * @param credits {@link Integer} for legacy semesters, {@link Double} from the modern era on
 * @param courseCode catalog course code
 * @param selectionCode registration code
 * @param instructorName instructor as printed
 * @param instructorId instructor cross-reference id, null when the name carries no link
 * @param selectionMethod enrolment method number, or the era's empty sentinel
 * @param scheduleText visible text of the schedule cell
 * @param schedule decoded schedule
 * @param generalMarkup raw markup of the general-education mark cell
 * @param commentMarkup raw markup of the remarks cell
 * @param changeStatus change flag, null when the course is unchanged
 * @param platformId course-platform id, null when the course has no platform page
 */
public record CourseRecord(
    String serialNumber,
    String departmentName,
    @Nullable String departmentCode,
    String classLabel,
    String title,
    Number credits,
    String courseCode,
    String selectionCode,
    String instructorName,
    @Nullable String instructorId,
    int selectionMethod,
    String scheduleText,
    List<ScheduleEntry> schedule,
    String generalMarkup,
    String commentMarkup,
    @Nullable ChangeStatus changeStatus,
    @Nullable String platformId)
    implements CatalogRecord {

  public CourseRecord {
    schedule = schedule == null ? List.of() : List.copyOf(schedule);
  }

  @Override
  public boolean found() {
    return true;
  }
}
