package eu.fbk.ebes;

/**
 * Signals a query with neither text terms nor example entities, for which there is nothing to
 * rank by.
 */
public class EmptyQueryException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public EmptyQueryException(final String message) {
        super(message);
    }

}
