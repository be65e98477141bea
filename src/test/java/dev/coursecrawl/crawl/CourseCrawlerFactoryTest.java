package dev.coursecrawl.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import dev.coursecrawl.course.PlatformIdResolver;
import dev.coursecrawl.fixture.ListingHtmlBuilder;
import dev.coursecrawl.semester.Era;
import dev.coursecrawl.transport.CatalogProperties;
import dev.coursecrawl.transport.CatalogTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CourseCrawlerFactoryTest {

    @Mock
    private CatalogTransport transport;

    @Mock
    private PlatformIdResolver platformIdResolver;

    private CourseCrawlerFactory factory;

    @BeforeEach
    void setUp() {
        var props = new CatalogProperties("https://nol.example.edu/search_result.php", "Big5",
                20, 3, 1000, 1000, 3, Map.of());
        factory = new CourseCrawlerFactory(transport, new ListingDocumentParser(props),
                platformIdResolver, props);
    }

    @Test
    void createBindsSemesterAndPageSize() {
        CourseCrawler crawler = factory.create("98-2");

        assertThat(crawler.semester().era()).isEqualTo(Era.LEGACY);
        assertThat(crawler.pageSize()).isEqualTo(20);
        assertThat(crawler.pageAddress(39)).isEqualTo(1);
    }

    @Test
    void createdCrawlerSendsSemesterIdAsWritten() {
        when(transport.fetchPage(0, "099-1"))
                .thenReturn(new ListingHtmlBuilder().rows(Era.MODERN, 1).big5());

        CourseCrawler crawler = factory.create("099-1");

        assertThat(crawler.getRecord(0).orElseThrow().found()).isTrue();
        verify(transport).fetchPage(0, "099-1");
    }

    @Test
    void createRejectsMalformedSemester() {
        assertThatThrownBy(() -> factory.create("spring"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("spring");
    }
}
