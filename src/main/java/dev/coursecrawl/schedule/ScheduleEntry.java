package dev.coursecrawl.schedule;

import java.util.List;

/**
 * One decoded {@code (day, time slots, classroom)} tuple of a course schedule.
 *
 * @param day weekday symbol ({@code 一} to {@code 六}, {@code 日}), or empty when the source only
 *     carried classroom text
 * @param timeSlots slot symbols in source order, not deduplicated
 * @param classroom classroom text with inner parentheses kept verbatim
 */
public record ScheduleEntry(String day, List<String> timeSlots, String classroom) {

  static final String WEEKDAY_SYMBOLS = "一二三四五六日";

  public ScheduleEntry {
    day = day == null ? "" : day;
    timeSlots = timeSlots == null ? List.of() : List.copyOf(timeSlots);
    classroom = classroom == null ? "" : classroom;
  }

  ScheduleEntry withClassroom(String replacement) {
    return new ScheduleEntry(day, timeSlots, replacement);
  }
}
