package dev.coursecrawl.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.coursecrawl.course.CatalogRecord;
import dev.coursecrawl.crawl.CatalogMetadataService;
import dev.coursecrawl.crawl.CourseCrawler;
import dev.coursecrawl.crawl.CourseCrawlerFactory;
import dev.coursecrawl.error.CatalogException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Dumps a semester's catalog as JSON lines on stdout, one object per record with sorted keys and
 * the record's global {@code index}.
 *
 * <p>Options: {@code --semester=<id>} (defaults to the service's default semester),
 * {@code --start=<index>} (defaults to 0) and {@code --pretty} for indented output. Each record
 * is read under a {@link RetryTemplate}; the crawler itself never retries, and a failed page is
 * not cached, so a retry re-fetches it.
 */
@Component
@ConditionalOnProperty(prefix = "coursecrawl.dump", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class CatalogDumpRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CatalogDumpRunner.class);

    private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT =
            new TypeReference<>() {};

    private final CatalogMetadataService metadataService;
    private final CourseCrawlerFactory crawlerFactory;
    private final ObjectMapper objectMapper;
    private final RetryTemplate retryTemplate;
    private final PrintStream out;

    @Autowired
    public CatalogDumpRunner(
            CatalogMetadataService metadataService,
            CourseCrawlerFactory crawlerFactory,
            ObjectMapper objectMapper,
            DumpProperties props) {
        this(metadataService, crawlerFactory, objectMapper, props, System.out);
    }

    CatalogDumpRunner(
            CatalogMetadataService metadataService,
            CourseCrawlerFactory crawlerFactory,
            ObjectMapper objectMapper,
            DumpProperties props,
            PrintStream out) {
        this.metadataService = metadataService;
        this.crawlerFactory = crawlerFactory;
        this.objectMapper = objectMapper;
        this.out = out;
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(props.maxAttempts())
                .fixedBackoff(props.retryDelayMs())
                .retryOn(CatalogException.class)
                .build();
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        String semester = option(args, "semester");
        if (semester == null) {
            semester = metadataService.defaultSemester();
            log.info("No --semester given, using default semester {}", semester);
        }
        int start = parseStart(option(args, "start"));
        boolean pretty = args.containsOption("pretty");

        int count = metadataService.courseCount(semester);
        if (count == 0) {
            log.error("No such semester: {}", semester);
            throw new IllegalArgumentException("No such semester: " + semester);
        }
        int written = dump(crawlerFactory.create(semester), start, count, pretty);
        log.info("Wrote {} records of {} ({} listed)", written, semester, count);
    }

    /**
     * Write records {@code [start, count)} of the crawler's semester.
     *
     * @return number of records written
     */
    int dump(CourseCrawler crawler, int start, int count, boolean pretty) throws IOException {
        ObjectWriter writer = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        if (pretty) {
            writer = writer.withDefaultPrettyPrinter();
        }

        int written = 0;
        for (int index = start; index < count; index++) {
            if (index % crawler.pageSize() == 0) {
                logProgress(index, count);
            }
            CatalogRecord record = fetch(crawler, index);
            if (!record.found()) {
                log.warn("Index {} of {} has no row on its page, skipping", index, count);
                continue;
            }
            Map<String, Object> json = objectMapper.convertValue(record, JSON_OBJECT);
            json.put("index", index);
            out.println(writer.writeValueAsString(json));
            written++;
        }
        logProgress(count, count);
        return written;
    }

    private CatalogRecord fetch(CourseCrawler crawler, int index) {
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                Throwable last = context.getLastThrowable();
                log.warn("Error at {}: {} (attempt {})", index,
                        last == null ? "unknown" : last.getMessage(), context.getRetryCount() + 1);
            }
            return crawler.getRecord(index).orElseThrow();
        });
    }

    private static void logProgress(int done, int total) {
        log.info("({}/{}) {}%", done, total, String.format("%.2f", done * 100.0 / total));
    }

    private static @Nullable String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static int parseStart(@Nullable String value) {
        if (value == null) {
            return 0;
        }
        try {
            int start = Integer.parseInt(value.trim());
            if (start < 0) {
                throw new IllegalArgumentException("--start must not be negative, got: " + value);
            }
            return start;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--start must be an integer, got: " + value, e);
        }
    }
}
