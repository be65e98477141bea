package dev.coursecrawl.transport;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * HTTP implementation of {@link CatalogTransport} on top of Spring's {@link RestClient}.
 *
 * <p>Statuses are inspected through {@code exchange} rather than the client's status handlers:
 * listing requests accept exactly 200, redirect checks accept any status and report it.
 */
@Component
public class NolHttpTransport implements CatalogTransport {

    private static final Logger log = LoggerFactory.getLogger(NolHttpTransport.class);

    private final RestClient listingClient;
    private final RestClient redirectClient;
    private final Map<String, String> baseArgs;

    public NolHttpTransport(
            @Qualifier("catalogRestClient") RestClient listingClient,
            @Qualifier("redirectCheckRestClient") RestClient redirectClient,
            CatalogProperties props) {
        this.listingClient = listingClient;
        this.redirectClient = redirectClient;
        this.baseArgs = props.baseArgs();
    }

    @Override
    public byte[] fetchPage(int offset, String semesterId) {
        Map<String, String> args = new LinkedHashMap<>();
        args.put("current_sem", semesterId);
        args.put("startrec", String.valueOf(offset));
        return fetchListing(args);
    }

    @Override
    public byte[] fetchListing(Map<String, String> args) {
        Map<String, String> query = new LinkedHashMap<>(baseArgs);
        query.putAll(args);
        log.debug("Fetching listing with {}", query);
        try {
            return listingClient.get()
                    .uri(builder -> {
                        query.forEach((name, value) -> builder.queryParam(name, value));
                        return builder.build();
                    })
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        if (status != HttpStatus.OK.value()) {
                            throw new TransportException(
                                    "HTTP status " + status + " (not 200) for " + request.getURI(),
                                    status);
                        }
                        return response.getBody().readAllBytes();
                    });
        } catch (RestClientException e) {
            throw new TransportException("Listing request failed: " + e.getMessage(), e);
        }
    }

    @Override
    public RedirectCheck checkRedirect(String url) {
        try {
            RedirectCheck check = redirectClient.get()
                    .uri(URI.create(url))
                    .exchange((request, response) -> new RedirectCheck(
                            response.getStatusCode().value(),
                            response.getHeaders().getFirst(HttpHeaders.LOCATION)));
            log.debug("Checked redirect {} -> {}", url, check);
            return check;
        } catch (RestClientException e) {
            throw new TransportException("Redirect check failed for " + url + ": " + e.getMessage(), e);
        }
    }
}
