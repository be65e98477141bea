package dev.coursecrawl.schedule;

import dev.coursecrawl.semester.Era;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes the free-text schedule cell of a catalog row into {@link ScheduleEntry} tuples.
 *
 * <p>The text is a run of entries written {@code <weekday><slots>(<classroom>)}, e.g. {@code
 * 二1-4(普101)三5@(普102)}. The slot grammar depends on the {@link Era}:
 *
 * <ul>
 *   <li>{@link Era#MODERN} - slots are separated by commas; {@code 10} is the only two-character
 *       slot and is rewritten to {@link TimeSlotAlphabet#TEN}.
 *   <li>{@link Era#LEGACY} - slots are written back to back and commas carry no meaning; {@code
 *       a-b} expands to every slot from {@code a} to {@code b}; {@code *} marks arranged time;
 *       {@code 10} is read as one slot only when it keeps the slot order ascending.
 * </ul>
 *
 * <p>A leading {@code 第…週} week-range prefix is dropped. Parenthetical text before the first
 * weekday is kept aside and replaces every classroom when all classrooms are {@value
 * #DEPARTMENT_OFFICE}. Whitespace is skipped everywhere.
 *
 * <p>Instances are stateless and may be shared; each call runs its own state machine.
 */
public final class ScheduleDecoder {

  private static final Logger log = LoggerFactory.getLogger(ScheduleDecoder.class);

  /** Classroom placeholder meaning "ask the department office". */
  public static final String DEPARTMENT_OFFICE = "請洽系所辦";

  private static final Pattern WEEK_RANGE_PREFIX = Pattern.compile("^\\s*第[0-9\\s,]*週");

  private final Era era;

  public ScheduleDecoder(Era era) {
    this.era = era;
  }

  /**
   * Decodes one schedule cell.
   *
   * @param text visible text of the schedule cell; {@code null} is treated as empty
   * @return entries in source order; empty for blank input
   * @throws ScheduleDecodeException if the text cannot be consumed into well-formed entries
   */
  public List<ScheduleEntry> decode(String text) {
    String original = text == null ? "" : text;
    Matcher prefix = WEEK_RANGE_PREFIX.matcher(original);
    int start = prefix.lookingAt() ? prefix.end() : 0;
    return new Machine(original, start).run();
  }

  private enum State {
    STRAY_PREFIX,
    DAY,
    TIME_LIST,
    CLASSROOM
  }

  /** Single-use state machine over one schedule string. */
  private final class Machine {

    private final String text;
    private int pos;
    private State state = State.STRAY_PREFIX;
    private int depth;

    private String day = "";
    private final List<String> slots = new ArrayList<>();
    private final StringBuilder pendingToken = new StringBuilder();
    private boolean rangeOpen;
    private final StringBuilder classroom = new StringBuilder();
    private final StringBuilder stray = new StringBuilder();

    private final List<ScheduleEntry> entries = new ArrayList<>();

    Machine(String text, int start) {
      this.text = text;
      this.pos = start;
    }

    List<ScheduleEntry> run() {
      while (pos < text.length()) {
        char c = text.charAt(pos);
        if (isBlank(c)) {
          pos++;
          continue;
        }
        switch (state) {
          case STRAY_PREFIX -> onStrayPrefix(c);
          case DAY -> onDay(c);
          case TIME_LIST -> onTimeList(c);
          case CLASSROOM -> onClassroom(c);
        }
      }
      return finish();
    }

    private void onStrayPrefix(char c) {
      if (depth == 0 && c != '(') {
        state = State.DAY;
        return;
      }
      pos++;
      if (c == '(') {
        if (depth > 0) {
          stray.append(c);
        }
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth > 0) {
          stray.append(c);
        }
      } else {
        stray.append(c);
      }
    }

    private void onDay(char c) {
      if (ScheduleEntry.WEEKDAY_SYMBOLS.indexOf(c) < 0) {
        throw fail("expected a weekday symbol but found '" + c + "'");
      }
      day = String.valueOf(c);
      state = State.TIME_LIST;
      pos++;
    }

    private void onTimeList(char c) {
      if (c == '(') {
        if (rangeOpen) {
          throw fail("slot range is not closed");
        }
        flushModernToken();
        state = State.CLASSROOM;
        depth = 1;
        pos++;
      } else if (era == Era.MODERN) {
        onModernSlot(c);
      } else {
        onLegacySlot(c);
      }
    }

    private void onModernSlot(char c) {
      if (c == ',') {
        flushModernToken();
        pos++;
        return;
      }
      if (!TimeSlotAlphabet.isSymbol(c)) {
        throw fail("invalid slot character '" + c + "'");
      }
      if (pendingToken.length() == 2) {
        throw fail("slot token '" + pendingToken + c + "' is longer than two characters");
      }
      pendingToken.append(c);
      pos++;
    }

    private void flushModernToken() {
      if (pendingToken.length() == 0) {
        return;
      }
      String token = pendingToken.toString();
      pendingToken.setLength(0);
      if (token.equals("10")) {
        slots.add(TimeSlotAlphabet.TEN);
      } else if (token.length() == 1) {
        slots.add(token);
      } else {
        throw fail("unknown two-character slot '" + token + "'");
      }
    }

    private void onLegacySlot(char c) {
      if (c == ',') {
        pos++;
        return;
      }
      if (c == '-') {
        if (rangeOpen || lastSlot() == null) {
          throw fail("range dash without a preceding slot");
        }
        rangeOpen = true;
        pos++;
        return;
      }
      if (c == '*') {
        if (rangeOpen) {
          throw fail("arranged-time marker cannot close a range");
        }
        slots.add(TimeSlotAlphabet.WILDCARD);
        pos++;
        return;
      }
      if (c == '1') {
        int next = nextNonBlank(pos + 1);
        if (next >= 0 && text.charAt(next) == '0') {
          String previous = lastSlot();
          if (previous != null
              && TimeSlotAlphabet.position(previous)
                  >= TimeSlotAlphabet.position(TimeSlotAlphabet.TEN)) {
            throw fail("'10' after slot " + previous + " is not a known slot");
          }
          pos = next + 1;
          appendLegacySlot(TimeSlotAlphabet.TEN);
          return;
        }
      }
      if (!TimeSlotAlphabet.isSymbol(c)) {
        throw fail("invalid slot character '" + c + "'");
      }
      pos++;
      appendLegacySlot(String.valueOf(c));
    }

    private void appendLegacySlot(String symbol) {
      if (!rangeOpen) {
        slots.add(symbol);
        return;
      }
      String from = lastSlot();
      if (TimeSlotAlphabet.position(symbol) <= TimeSlotAlphabet.position(from)) {
        throw fail("descending slot range " + from + "-" + symbol);
      }
      slots.addAll(TimeSlotAlphabet.after(from, symbol));
      rangeOpen = false;
    }

    /** Last slot symbol of the current entry, or null when there is none or it is a wildcard. */
    private String lastSlot() {
      if (slots.isEmpty()) {
        return null;
      }
      String last = slots.get(slots.size() - 1);
      return TimeSlotAlphabet.WILDCARD.equals(last) ? null : last;
    }

    private void onClassroom(char c) {
      pos++;
      if (c == '(') {
        depth++;
        classroom.append(c);
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          entries.add(new ScheduleEntry(day, slots, classroom.toString()));
          day = "";
          slots.clear();
          classroom.setLength(0);
          state = State.DAY;
        } else {
          classroom.append(c);
        }
      } else {
        classroom.append(c);
      }
    }

    private List<ScheduleEntry> finish() {
      if (state == State.CLASSROOM && depth > 0) {
        log.debug("Unbalanced classroom parenthesis in \"{}\", keeping partial entry", text);
        entries.add(new ScheduleEntry(day, slots, classroom.toString()));
        return List.copyOf(entries);
      }
      boolean cleared = day.isEmpty() && slots.isEmpty() && classroom.length() == 0;
      if (cleared && depth == 0 && entries.isEmpty() && stray.length() > 0) {
        return List.of(new ScheduleEntry("", List.of(), stray.toString()));
      }
      if (!cleared || depth != 0 || rangeOpen || pendingToken.length() > 0) {
        throw fail("input ended inside " + state);
      }
      if (stray.length() > 0) {
        if (entries.stream().allMatch(e -> DEPARTMENT_OFFICE.equals(e.classroom()))) {
          return entries.stream().map(e -> e.withClassroom(stray.toString())).toList();
        }
        log.debug("Discarding leading text \"{}\" of schedule \"{}\"", stray, text);
      }
      return List.copyOf(entries);
    }

    private int nextNonBlank(int from) {
      for (int i = from; i < text.length(); i++) {
        if (!isBlank(text.charAt(i))) {
          return i;
        }
      }
      return -1;
    }

    private ScheduleDecodeException fail(String reason) {
      return new ScheduleDecodeException(text, pos, reason);
    }
  }

  private static boolean isBlank(char c) {
    return Character.isWhitespace(c) || Character.isSpaceChar(c);
  }
}
