package dev.coursecrawl.error;

/**
 * Root of the unchecked failures raised while fetching, parsing or decoding catalog data.
 *
 * <p>Subclasses mark which stage failed: transport, page shape, row extraction or schedule
 * decoding. None of them is retried inside the crawler; callers may re-request the same index.
 */
public abstract class CatalogException extends RuntimeException {

    protected CatalogException(String message) {
        super(message);
    }

    protected CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
