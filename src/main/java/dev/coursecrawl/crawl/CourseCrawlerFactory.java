package dev.coursecrawl.crawl;

import dev.coursecrawl.course.CourseRecordExtractor;
import dev.coursecrawl.course.PlatformIdResolver;
import dev.coursecrawl.semester.Semester;
import dev.coursecrawl.transport.CatalogProperties;
import dev.coursecrawl.transport.CatalogTransport;
import org.springframework.stereotype.Component;

/** Builds {@link CourseCrawler}s bound to one semester, sized from {@link CatalogProperties}. */
@Component
public class CourseCrawlerFactory {

    private final CatalogTransport transport;
    private final ListingDocumentParser parser;
    private final PlatformIdResolver platformIdResolver;
    private final CatalogProperties props;

    public CourseCrawlerFactory(
            CatalogTransport transport,
            ListingDocumentParser parser,
            PlatformIdResolver platformIdResolver,
            CatalogProperties props) {
        this.transport = transport;
        this.parser = parser;
        this.platformIdResolver = platformIdResolver;
        this.props = props;
    }

    /**
     * @param semesterId semester identifier such as {@code 104-1}
     * @return a crawler with an empty cache
     * @throws IllegalArgumentException if the identifier is malformed
     */
    public CourseCrawler create(String semesterId) {
        Semester semester = Semester.parse(semesterId);
        return new CourseCrawler(
                semester,
                transport,
                parser,
                new CourseRecordExtractor(semester, platformIdResolver),
                props.pageSize(),
                props.cacheSize());
    }
}
