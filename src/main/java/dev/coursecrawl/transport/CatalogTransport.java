package dev.coursecrawl.transport;

import java.util.Map;

/**
 * Network collaborator of the crawler. One instance is shared by a crawler across calls and is
 * not meant to be driven from several crawlers concurrently.
 */
public interface CatalogTransport {

    /**
     * Fetch one listing page.
     *
     * @param offset     index of the first record on the page
     * @param semesterId semester identifier, e.g. {@code 104-1}
     * @return raw response body, still in the document encoding
     * @throws TransportException on a non-200 status or an I/O failure
     */
    byte[] fetchPage(int offset, String semesterId);

    /**
     * Fetch the listing with arbitrary query arguments on top of the fixed base arguments.
     *
     * @throws TransportException on a non-200 status or an I/O failure
     */
    byte[] fetchListing(Map<String, String> args);

    /**
     * Request {@code url} without following redirects.
     *
     * @return status code and {@code Location} header of the response
     * @throws TransportException on an I/O failure
     */
    RedirectCheck checkRedirect(String url);
}
