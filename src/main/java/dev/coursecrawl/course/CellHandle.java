package dev.coursecrawl.course;

import org.jspecify.annotations.Nullable;

/** Read-only view of one table cell. */
public interface CellHandle {

  /** Visible text of the cell and its descendants. */
  String text();

  /** {@code href} of the cell's leading anchor, or null when the cell does not start with one. */
  @Nullable
  String linkHref();

  /** Text of the leading anchor, falling back to the cell text when there is no anchor. */
  String linkText();

  /** The cell's subtree rendered as markup. */
  String markup();
}
