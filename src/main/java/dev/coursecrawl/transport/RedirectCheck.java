package dev.coursecrawl.transport;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a request made without following redirects.
 *
 * @param status   HTTP status code
 * @param location {@code Location} header, or null when absent
 */
public record RedirectCheck(int status, @Nullable String location) {

    public boolean isRedirect() {
        return status >= 300 && status < 400;
    }
}
