package dev.coursecrawl.course;

import java.util.List;
import org.jsoup.nodes.Element;
import org.jspecify.annotations.Nullable;

/** {@link RowHandle} over a jsoup {@code <tr>} element. */
public final class JsoupRowHandle implements RowHandle {

  private final Element row;

  public JsoupRowHandle(Element row) {
    this.row = row;
  }

  @Override
  public List<CellHandle> cells() {
    return row.children().stream()
        .filter(cell -> cell.normalName().equals("td") || cell.normalName().equals("th"))
        .<CellHandle>map(JsoupCellHandle::new)
        .toList();
  }

  @Override
  public List<String> imageSources() {
    return row.select("img[src]").eachAttr("src");
  }

  private record JsoupCellHandle(Element cell) implements CellHandle {

    @Override
    public String text() {
      return cell.text();
    }

    @Override
    public @Nullable String linkHref() {
      Element anchor = leadingAnchor();
      return anchor == null ? null : anchor.attr("href");
    }

    @Override
    public String linkText() {
      Element anchor = leadingAnchor();
      return anchor == null ? cell.text() : anchor.text();
    }

    @Override
    public String markup() {
      return cell.outerHtml();
    }

    private @Nullable Element leadingAnchor() {
      Element first = cell.children().first();
      boolean anchor = first != null && first.normalName().equals("a") && first.hasAttr("href");
      return anchor ? first : null;
    }
  }
}
