package dev.coursecrawl.crawl;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import dev.coursecrawl.course.JsoupRowHandle;
import dev.coursecrawl.course.RowHandle;
import dev.coursecrawl.transport.CatalogProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns listing responses into jsoup documents and listing rows.
 *
 * <p>The listing is the n-th {@code <table>} directly under {@code <body>} (configured by
 * {@code coursecrawl.catalog.listing-table-index}); its first row is the header.
 */
@Component
public class ListingDocumentParser {

    private static final Logger log = LoggerFactory.getLogger(ListingDocumentParser.class);

    private final String encoding;
    private final String baseUri;
    private final int tableIndex;

    @Autowired
    public ListingDocumentParser(CatalogProperties props) {
        this(props.documentEncoding(), props.baseUrl(), props.listingTableIndex());
    }

    ListingDocumentParser(String encoding, String baseUri, int tableIndex) {
        this.encoding = encoding;
        this.baseUri = baseUri;
        this.tableIndex = tableIndex;
    }

    /**
     * Parse a response body in the configured document encoding. Markup rendering of the result
     * is not pretty-printed so raw cell markup stays as served.
     */
    public Document parse(byte[] body) {
        try {
            Document document = Jsoup.parse(new ByteArrayInputStream(body), encoding, baseUri);
            document.outputSettings().prettyPrint(false);
            return document;
        } catch (IOException e) {
            throw new PageShapeException("Cannot read listing document: " + e.getMessage(), e);
        }
    }

    /**
     * Extract the data rows of the listing table.
     *
     * @param body raw listing response
     * @return data rows in document order, header excluded; possibly fewer than a full page
     * @throws PageShapeException if the document has no listing table
     */
    public List<RowHandle> parseRows(byte[] body) {
        Document document = parse(body);
        List<Element> tables = document.body().children().stream()
                .filter(child -> child.normalName().equals("table"))
                .toList();
        if (tables.size() <= tableIndex) {
            throw new PageShapeException("Expected listing table #" + (tableIndex + 1)
                    + " under <body>, found " + tables.size() + " tables");
        }
        List<Element> rows = directRows(tables.get(tableIndex));
        log.debug("Listing table has {} rows including header", rows.size());
        return rows.stream()
                .skip(1)
                .<RowHandle>map(JsoupRowHandle::new)
                .toList();
    }

    private static List<Element> directRows(Element table) {
        List<Element> rows = new ArrayList<>();
        for (Element child : table.children()) {
            String name = child.normalName();
            if (name.equals("tr")) {
                rows.add(child);
            } else if (name.equals("thead") || name.equals("tbody") || name.equals("tfoot")) {
                child.children().stream()
                        .filter(row -> row.normalName().equals("tr"))
                        .forEach(rows::add);
            }
        }
        return rows;
    }
}
