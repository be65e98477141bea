package dev.coursecrawl.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScheduleEntryTest {

  @Test
  void nullsBecomeEmptyAndSlotsAreCopied() {
    List<String> slots = new ArrayList<>(List.of("1"));
    ScheduleEntry entry = new ScheduleEntry(null, slots, null);
    slots.add("2");

    assertThat(entry.day()).isEmpty();
    assertThat(entry.classroom()).isEmpty();
    assertThat(entry.timeSlots()).containsExactly("1");
  }
}
