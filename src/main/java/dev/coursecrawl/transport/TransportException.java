package dev.coursecrawl.transport;

import dev.coursecrawl.error.CatalogException;

/** The listing service answered with an unexpected status or could not be reached. */
public class TransportException extends CatalogException {

    /** Status used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final int status;

    public TransportException(String message, int status) {
        super(message);
        this.status = status;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.status = NO_STATUS;
    }

    /** HTTP status of the failed response, or {@link #NO_STATUS}. */
    public int getStatus() {
        return status;
    }
}
