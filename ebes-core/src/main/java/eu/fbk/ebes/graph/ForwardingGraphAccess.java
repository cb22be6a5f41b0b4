package eu.fbk.ebes.graph;

import java.util.Set;

import com.google.common.collect.ForwardingObject;

import org.openrdf.model.Statement;
import org.openrdf.model.URI;

/**
 * A {@code GraphAccess} that forwards all its method calls to another {@code GraphAccess}.
 * <p>
 * This class provides a starting point for implementing the decorator pattern on top of the
 * {@code GraphAccess} interface. Subclasses must implement method {@link #delegate()} and override
 * the methods of {@code GraphAccess} they want to decorate.
 * </p>
 */
public abstract class ForwardingGraphAccess extends ForwardingObject implements GraphAccess {

    @Override
    protected abstract GraphAccess delegate();

    @Override
    public Set<Statement> getTriples(final URI entity) throws GraphUnavailableException {
        return delegate().getTriples(entity);
    }

    @Override
    public long getGeneration() {
        return delegate().getGeneration();
    }

    @Override
    public void close() {
        delegate().close();
    }

}
