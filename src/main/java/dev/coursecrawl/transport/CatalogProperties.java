package dev.coursecrawl.transport;

import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the listing service and of the crawler's page cache, bound from
 * {@code coursecrawl.catalog.*}.
 *
 * @param baseUrl            listing endpoint, queried with {@code baseArgs} plus per-request args
 * @param documentEncoding   charset of the returned HTML (the service answers in Big5)
 * @param pageSize           records per listing page
 * @param cacheSize          number of direct-mapped page slots per crawler
 * @param connectTimeoutMs   TCP connect timeout
 * @param readTimeoutMs      response read timeout
 * @param listingTableIndex  zero-based index of the listing table among the body's tables
 * @param baseArgs           query arguments sent with every listing request
 */
@ConfigurationProperties(prefix = "coursecrawl.catalog")
public record CatalogProperties(
        String baseUrl,
        String documentEncoding,
        int pageSize,
        int cacheSize,
        int connectTimeoutMs,
        int readTimeoutMs,
        int listingTableIndex,
        Map<String, String> baseArgs
) {

    public CatalogProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("coursecrawl.catalog.base-url must be set");
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException(
                    "coursecrawl.catalog.page-size must be at least 1, got: " + pageSize);
        }
        if (cacheSize < 1) {
            throw new IllegalArgumentException(
                    "coursecrawl.catalog.cache-size must be at least 1, got: " + cacheSize);
        }
        if (listingTableIndex < 0) {
            throw new IllegalArgumentException(
                    "coursecrawl.catalog.listing-table-index must not be negative, got: "
                            + listingTableIndex);
        }
        documentEncoding = documentEncoding == null || documentEncoding.isBlank()
                ? "Big5" : documentEncoding;
        baseArgs = baseArgs == null ? Map.of() : Map.copyOf(baseArgs);
    }
}
