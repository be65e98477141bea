package dev.coursecrawl.schedule;

import dev.coursecrawl.error.CatalogException;

/** Raised when schedule text falls outside the decoder's grammar. */
public class ScheduleDecodeException extends CatalogException {

  private final String scheduleText;
  private final int position;

  public ScheduleDecodeException(String scheduleText, int position, String reason) {
    super("Cannot decode schedule \"" + scheduleText + "\" at " + position + ": " + reason);
    this.scheduleText = scheduleText;
    this.position = position;
  }

  /** The original, unstripped schedule text. */
  public String getScheduleText() {
    return scheduleText;
  }

  /** Character offset into {@link #getScheduleText()} where decoding stopped. */
  public int getPosition() {
    return position;
  }
}
