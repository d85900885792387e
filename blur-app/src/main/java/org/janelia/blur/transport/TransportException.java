package org.janelia.blur.transport;

/**
 * Failure reported by a {@link MessageTransport}.  Every transport failure is fatal to the run.
 */
public class TransportException
        extends Exception {

    /** A source or destination rank is outside of the transport's rank range. */
    public static final int ERR_RANK = 6;

    /** A received message did not have the expected length. */
    public static final int ERR_TRUNCATE = 15;

    /** The transport was aborted, typically because a rank failed. */
    public static final int ERR_ABORTED = 16;

    /** Expected messages did not arrive in time. */
    public static final int ERR_TIMEOUT = 17;

    private final int statusCode;

    public TransportException(final int statusCode,
                              final String message) {
        this(statusCode, message, null);
    }

    public TransportException(final int statusCode,
                              final String message,
                              final Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " (status " + statusCode + ")";
    }
}
