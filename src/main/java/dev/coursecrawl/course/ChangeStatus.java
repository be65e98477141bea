package dev.coursecrawl.course;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/** Change flag of a course, shown in the listing as a marker image. */
public enum ChangeStatus {
  CANCELLED("停開", "images/cancel.gif"),
  ADDED("加開", "images/add.gif"),
  MODIFIED("異動", "images/chg.gif");

  private final String label;
  private final String markerSource;

  ChangeStatus(String label, String markerSource) {
    this.label = label;
    this.markerSource = markerSource;
  }

  /** Label as printed by the catalog; also the serialized form. */
  @JsonValue
  public String label() {
    return label;
  }

  public String markerSource() {
    return markerSource;
  }

  static Optional<ChangeStatus> fromMarker(String source) {
    return Arrays.stream(values()).filter(s -> s.markerSource.equals(source)).findFirst();
  }
}
