package eu.fbk.ebes.graph;

import java.util.Set;

import com.google.common.base.Preconditions;

import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@code GraphAccess} wrapper that logs lookups performed on a wrapped {@code GraphAccess} and
 * their execution times.
 * <p>
 * Request information, number of returned statements and execution times are logged via SLF4J
 * (level DEBUG, logger named after this class); failures are logged at level WARN before being
 * propagated. The overhead introduced by this wrapper when logging is disabled is negligible.
 * </p>
 */
public final class LoggingGraphAccess extends ForwardingGraphAccess {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingGraphAccess.class);

    private final GraphAccess delegate;

    /**
     * Creates a new instance for the wrapped {@code GraphAccess} specified.
     *
     * @param delegate
     *            the wrapped {@code GraphAccess}
     */
    public LoggingGraphAccess(final GraphAccess delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
        LOGGER.debug("{} configured for {}", getClass().getSimpleName(), delegate);
    }

    @Override
    protected GraphAccess delegate() {
        return this.delegate;
    }

    @Override
    public Set<Statement> getTriples(final URI entity) throws GraphUnavailableException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            try {
                final Set<Statement> result = super.getTriples(entity);
                LOGGER.debug("{} - {} triples for <{}> obtained in {} ms", this, result.size(),
                        entity, System.currentTimeMillis() - ts);
                return result;
            } catch (final GraphUnavailableException ex) {
                LOGGER.warn("{} - lookup of <{}> failed after {} ms: {}", this, entity,
                        System.currentTimeMillis() - ts, ex.getMessage());
                throw ex;
            }
        } else {
            return super.getTriples(entity);
        }
    }

    @Override
    public void close() {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.close();
            LOGGER.debug("{} - closed in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.close();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.delegate + ")";
    }

}
