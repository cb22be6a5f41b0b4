package eu.fbk.ebes.graph;

import java.io.Closeable;
import java.util.Set;

import org.openrdf.model.Statement;
import org.openrdf.model.URI;

/**
 * Read access to the triples of a knowledge graph, one entity at a time.
 * <p>
 * A <tt>GraphAccess</tt> abstracts the backend holding the graph (a set of parsed RDF files, a
 * remote SPARQL endpoint, ...) and exposes the single capability needed for ranking: retrieving
 * the statements in which a given entity appears either as subject (outlinks) or as object
 * (inlinks). Implementations are expected to return statements in a deterministic order for an
 * unchanged graph, so that rankings computed on top of them are reproducible.
 * </p>
 * <p>
 * Every implementation exposes a <i>generation</i> number, which must change every time the
 * triples visible through the <tt>GraphAccess</tt> change (e.g., because new files are loaded).
 * Aggregate statistics computed over the graph record the generation they were computed from,
 * and are considered stale as soon as the generation changes.
 * </p>
 * <p>
 * Failures to reach or parse the backend are reported via {@link GraphUnavailableException} and
 * must never be turned into an empty result, as that would silently corrupt scoring.
 * </p>
 */
public interface GraphAccess extends Closeable {

    /**
     * Returns all the statements having the entity specified as subject or object.
     *
     * @param entity
     *            the entity URI
     * @return an immutable set of statements, possibly empty if the entity is unknown
     * @throws GraphUnavailableException
     *             if the backend cannot be reached or its content cannot be parsed
     */
    Set<Statement> getTriples(URI entity) throws GraphUnavailableException;

    /**
     * Returns the current generation of the graph, which changes each time the set of triples
     * exposed by this object changes.
     *
     * @return the current generation number
     */
    long getGeneration();

    /**
     * Releases the resources associated to this object. Errors are logged and not propagated.
     */
    @Override
    void close();

}
