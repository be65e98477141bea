package dev.coursecrawl.crawl;

import dev.coursecrawl.error.CatalogException;

/** A fetched document lacks the structure the crawler expects (listing table, semester box). */
public class PageShapeException extends CatalogException {

    public PageShapeException(String message) {
        super(message);
    }

    public PageShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
