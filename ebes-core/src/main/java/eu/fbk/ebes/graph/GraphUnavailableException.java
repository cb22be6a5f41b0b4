package eu.fbk.ebes.graph;

import java.io.IOException;

/**
 * Signals that the graph backend cannot be reached or its data cannot be parsed.
 * <p>
 * This exception is fatal to the ranking computation in progress: callers must abort and report
 * it, rather than treating the affected entity as having no triples.
 * </p>
 */
public class GraphUnavailableException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance with the optional error message specified.
     *
     * @param message
     *            an optional error message
     */
    public GraphUnavailableException(final String message) {
        this(message, null);
    }

    /**
     * Creates a new instance with the optional error message and cause specified.
     *
     * @param message
     *            an optional message providing additional information
     * @param cause
     *            the optional cause of this exception
     */
    public GraphUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
