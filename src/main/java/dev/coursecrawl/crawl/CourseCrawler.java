package dev.coursecrawl.crawl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import dev.coursecrawl.cache.PagedCache;
import dev.coursecrawl.course.CatalogRecord;
import dev.coursecrawl.course.CourseRecordExtractor;
import dev.coursecrawl.course.NotFoundRecord;
import dev.coursecrawl.course.RowHandle;
import dev.coursecrawl.semester.Semester;
import dev.coursecrawl.transport.CatalogTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads catalog records of one semester by index, fetching whole listing pages through a
 * direct-mapped {@link PagedCache}.
 *
 * <p>Record {@code i} lives on page {@code i / pageSize} at position {@code i % pageSize}. A page
 * is fetched once per cache miss, every row is extracted, and short pages are padded with
 * {@link NotFoundRecord}. Failures propagate and leave the cache untouched, so a caller can
 * simply ask again.
 *
 * <p>Not thread-safe: the cache and the transport are owned by this instance and calls must be
 * serialized by the caller.
 */
public class CourseCrawler {

    private static final Logger log = LoggerFactory.getLogger(CourseCrawler.class);

    private final Semester semester;
    private final CatalogTransport transport;
    private final ListingDocumentParser parser;
    private final CourseRecordExtractor extractor;
    private final int pageSize;
    private final PagedCache<List<CatalogRecord>> cache;

    public CourseCrawler(
            Semester semester,
            CatalogTransport transport,
            ListingDocumentParser parser,
            CourseRecordExtractor extractor,
            int pageSize,
            int cacheSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be at least 1, got: " + pageSize);
        }
        this.semester = semester;
        this.transport = transport;
        this.parser = parser;
        this.extractor = extractor;
        this.pageSize = pageSize;
        this.cache = new PagedCache<>(cacheSize);
    }

    /**
     * Return the record at a global listing index.
     *
     * @param index zero-based position in the semester's listing
     * @return the record or a {@link NotFoundRecord} placeholder; empty for a negative index
     * @throws dev.coursecrawl.error.CatalogException if the page cannot be fetched or extracted
     */
    public Optional<CatalogRecord> getRecord(int index) {
        if (index < 0) {
            return Optional.empty();
        }
        List<CatalogRecord> page = cache.load(pageAddress(index), this::loadPage);
        return Optional.of(page.get(index % pageSize));
    }

    /** Drop the cached page holding {@code index}, if it is cached. */
    public void invalidateRecord(int index) {
        if (index >= 0) {
            cache.invalidate(pageAddress(index));
        }
    }

    /** Drop every cached page. */
    public void invalidateAll() {
        cache.resetAll();
    }

    public int pageAddress(int index) {
        return index / pageSize;
    }

    public int pageSize() {
        return pageSize;
    }

    public Semester semester() {
        return semester;
    }

    private List<CatalogRecord> loadPage(int address) {
        int offset = address * pageSize;
        log.info("Fetching {} listing page {} (records {}-{})",
                semester, address, offset, offset + pageSize - 1);
        List<RowHandle> rows = parser.parseRows(transport.fetchPage(offset, semester.id()));

        if (rows.size() > pageSize) {
            log.warn("Page {} of {} returned {} rows, keeping the first {}",
                    address, semester, rows.size(), pageSize);
            rows = rows.subList(0, pageSize);
        }
        List<CatalogRecord> page = new ArrayList<>(pageSize);
        for (RowHandle row : rows) {
            page.add(extractor.extract(row));
        }
        if (page.size() < pageSize) {
            log.debug("Page {} of {} has {} rows, padding to {}",
                    address, semester, page.size(), pageSize);
            while (page.size() < pageSize) {
                page.add(NotFoundRecord.INSTANCE);
            }
        }
        return List.copyOf(page);
    }
}
