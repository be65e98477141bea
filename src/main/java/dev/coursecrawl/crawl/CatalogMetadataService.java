package dev.coursecrawl.crawl;

import java.util.List;
import java.util.Map;

import dev.coursecrawl.transport.CatalogTransport;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reads listing-wide metadata from the semester selector of the listing page: available
 * semesters, the service's default semester and a semester's record count.
 */
@Service
public class CatalogMetadataService {

    private static final Logger log = LoggerFactory.getLogger(CatalogMetadataService.class);

    private static final String SEMESTER_BOX = "select#select_sem";

    private final CatalogTransport transport;
    private final ListingDocumentParser parser;

    public CatalogMetadataService(CatalogTransport transport, ListingDocumentParser parser) {
        this.transport = transport;
        this.parser = parser;
    }

    /** Semester identifiers offered by the service, in page order. */
    public List<String> semesters() {
        Element box = semesterBox(parser.parse(transport.fetchListing(Map.of())));
        return box.select("option").eachAttr("value");
    }

    /** Semester selected by default on the listing page. */
    public String defaultSemester() {
        Element box = semesterBox(parser.parse(transport.fetchListing(Map.of())));
        Element selected = box.selectFirst("option[selected]");
        if (selected == null) {
            throw new PageShapeException("Semester selector has no selected option");
        }
        return selected.attr("value");
    }

    /**
     * Number of records listed for a semester; 0 for an unknown semester.
     *
     * <p>The count is the text of the first child of the element following the semester box.
     */
    public int courseCount(String semesterId) {
        Document document = parser.parse(transport.fetchListing(Map.of("current_sem", semesterId)));
        Element counter = semesterBox(document).nextElementSibling();
        if (counter == null || counter.children().isEmpty()) {
            throw new PageShapeException("No record counter after the semester selector");
        }
        String text = counter.child(0).text().strip();
        try {
            int count = Integer.parseInt(text);
            log.debug("Semester {} lists {} records", semesterId, count);
            return count;
        } catch (NumberFormatException e) {
            throw new PageShapeException("Record counter is not a number: " + text, e);
        }
    }

    private static Element semesterBox(Document document) {
        Element box = document.selectFirst(SEMESTER_BOX);
        if (box == null) {
            throw new PageShapeException("No semester selector in listing document");
        }
        return box;
    }
}
