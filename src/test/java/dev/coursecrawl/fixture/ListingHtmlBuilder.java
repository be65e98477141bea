package dev.coursecrawl.fixture;

import dev.coursecrawl.semester.Era;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Test builder for listing pages: the semester selector with its record counter, filler tables,
 * then the listing table with a header row followed by data rows.
 *
 * <pre>{@code
 * byte[] page = new ListingHtmlBuilder().rows(Era.MODERN, 12).big5();
 * }</pre>
 */
public final class ListingHtmlBuilder {

  private int tablesBefore = 3;
  private final Map<String, Boolean> semesters = new LinkedHashMap<>();
  private @Nullable String counter = "0";
  private final List<String> rows = new ArrayList<>();

  public ListingHtmlBuilder tablesBefore(int tablesBefore) {
    this.tablesBefore = tablesBefore;
    return this;
  }

  public ListingHtmlBuilder semester(String id, boolean selected) {
    semesters.put(id, selected);
    return this;
  }

  /** Text of the record counter; null drops the counter element. */
  public ListingHtmlBuilder counter(@Nullable String counter) {
    this.counter = counter;
    return this;
  }

  public ListingHtmlBuilder row(CourseRowBuilder row, Era era) {
    rows.add(row.html(era));
    return this;
  }

  /** Adds {@code count} default rows with serials 1 to {@code count}. */
  public ListingHtmlBuilder rows(Era era, int count) {
    for (int i = 1; i <= count; i++) {
      row(new CourseRowBuilder().serial(String.valueOf(i)).selectionCode("1000" + i), era);
    }
    return this;
  }

  public String html() {
    StringBuilder html = new StringBuilder("<html><head><title>課程查詢</title></head><body>");
    html.append("<form><select id=\"select_sem\" name=\"current_sem\">");
    semesters.forEach(
        (id, selected) ->
            html.append("<option value=\"")
                .append(id)
                .append(selected ? "\" selected>" : "\">")
                .append(id)
                .append("</option>"));
    html.append("</select>");
    if (counter != null) {
      html.append("<span><b>").append(counter).append("</b> 筆</span>");
    }
    html.append("</form>");
    for (int i = 0; i < tablesBefore; i++) {
      html.append("<table><tr><td>filler ").append(i).append("</td></tr></table>");
    }
    html.append("<table><tr><th>流水號</th><th>授課對象</th><th>課程名稱</th></tr>");
    rows.forEach(html::append);
    return html.append("</table></body></html>").toString();
  }

  /** The page encoded the way the service serves it. */
  public byte[] big5() {
    return html().getBytes(Charset.forName("Big5"));
  }
}
