package dev.coursecrawl.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.List;

import dev.coursecrawl.course.RowHandle;
import dev.coursecrawl.fixture.CourseRowBuilder;
import dev.coursecrawl.fixture.ListingHtmlBuilder;
import dev.coursecrawl.semester.Era;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

class ListingDocumentParserTest {

    private final ListingDocumentParser parser =
            new ListingDocumentParser("Big5", "https://nol.example.edu/search_result.php", 3);

    @Test
    void parseRowsSkipsHeaderAndKeepsDocumentOrder() {
        byte[] page = new ListingHtmlBuilder().rows(Era.MODERN, 3).big5();

        List<RowHandle> rows = parser.parseRows(page);

        assertThat(rows).hasSize(3);
        assertThat(rows).extracting(row -> row.cells().get(0).text())
                .containsExactly("1", "2", "3");
    }

    @Test
    void parseRowsDecodesBig5() {
        byte[] page = new ListingHtmlBuilder()
                .row(new CourseRowBuilder().title("微積分甲上"), Era.MODERN)
                .big5();

        RowHandle row = parser.parseRows(page).get(0);

        assertThat(row.cells().get(4).linkText()).isEqualTo("微積分甲上");
        assertThat(row.cells().get(1).text()).isEqualTo("資訊系");
    }

    @Test
    void headerOnlyTableHasNoRows() {
        assertThat(parser.parseRows(new ListingHtmlBuilder().big5())).isEmpty();
    }

    @Test
    void missingListingTableFails() {
        byte[] page = new ListingHtmlBuilder().tablesBefore(1).rows(Era.MODERN, 2).big5();

        assertThatThrownBy(() -> parser.parseRows(page))
                .isInstanceOf(PageShapeException.class)
                .hasMessageContaining("found 2 tables");
    }

    @Test
    void tablesNestedInCellsAreNotCounted() {
        String html = "<html><body>"
                + "<table><tr><td><table><tr><td>inner</td></tr></table></td></tr></table>"
                + "<table><tr><th>h</th></tr><tr><td>row</td></tr></table>"
                + "</body></html>";
        ListingDocumentParser secondTable = new ListingDocumentParser("UTF-8", "", 1);

        List<RowHandle> rows = secondTable.parseRows(html.getBytes(StandardCharsets.UTF_8));

        assertThat(rows).singleElement()
                .satisfies(row -> assertThat(row.cells().get(0).text()).isEqualTo("row"));
    }

    @Test
    void parseKeepsMarkupUnformatted() {
        Document document = parser.parse("<html><body><p>a<b>b</b></p></body></html>"
                .getBytes(StandardCharsets.US_ASCII));

        assertThat(document.body().html()).isEqualTo("<p>a<b>b</b></p>");
    }
}
