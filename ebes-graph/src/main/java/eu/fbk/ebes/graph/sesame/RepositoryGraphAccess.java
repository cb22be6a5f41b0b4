package eu.fbk.ebes.graph.sesame;

import java.io.File;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.query.QueryLanguage;
import org.openrdf.repository.Repository;
import org.openrdf.repository.RepositoryConnection;
import org.openrdf.repository.RepositoryException;
import org.openrdf.repository.RepositoryResult;
import org.openrdf.repository.sail.SailRepository;
import org.openrdf.repository.sparql.SPARQLRepository;
import org.openrdf.repository.util.RDFInserter;
import org.openrdf.sail.memory.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.graph.GraphAccess;
import eu.fbk.ebes.graph.GraphUnavailableException;

/**
 * A {@code GraphAccess} backed by a Sesame {@code Repository}.
 * <p>
 * Two flavours are provided: {@link #local()} creates an in-memory store that can be populated
 * with RDF files via {@link #load(File)}, while {@link #remote(String)} wraps a read-only SPARQL
 * endpoint. In both cases {@link #init()} must be called before use. The same triple stored in
 * several graphs is returned once, statements with a
 * blank node are dropped and literals are kept only if their language is one of the accepted
 * {@link #DEFAULT_LANGUAGES languages} (by default English, Polish or no language).
 * </p>
 * <p>
 * The generation of a local graph is incremented after every successful load; the generation of
 * a remote graph never changes.
 * </p>
 */
public final class RepositoryGraphAccess implements GraphAccess {

    private static final Logger LOGGER = LoggerFactory.getLogger(RepositoryGraphAccess.class);

    /** Accepted literal languages; the empty string stands for literals without language. */
    public static final ImmutableSet<String> DEFAULT_LANGUAGES = ImmutableSet.of("en", "pl", "");

    private final Repository repository;

    private final String description;

    private final boolean loadable;

    private final ImmutableSet<String> languages;

    private final AtomicLong generation;

    private boolean initialized;

    public RepositoryGraphAccess(final Repository repository, final String description,
            final boolean loadable, @Nullable final Iterable<String> languages) {
        this.repository = Preconditions.checkNotNull(repository);
        this.description = Preconditions.checkNotNull(description);
        this.loadable = loadable;
        this.languages = languages == null ? DEFAULT_LANGUAGES : ImmutableSet.copyOf(languages);
        this.generation = new AtomicLong(0L);
        this.initialized = false;
        LOGGER.info("{} configured, languages={}", this, this.languages);
    }

    /**
     * Creates a graph access over an empty in-memory store, to be populated via
     * {@link #load(File)}.
     *
     * @return the created object, still to be initialized
     */
    public static RepositoryGraphAccess local() {
        return new RepositoryGraphAccess(new SailRepository(new MemoryStore()), "memory", true,
                null);
    }

    /**
     * Creates a read-only graph access over a remote SPARQL endpoint.
     *
     * @param endpointURL
     *            the URL of the SPARQL endpoint
     * @return the created object, still to be initialized
     */
    public static RepositoryGraphAccess remote(final String endpointURL) {
        return new RepositoryGraphAccess(new SPARQLRepository(endpointURL), endpointURL, false,
                null);
    }

    /**
     * Initializes the repository. For remote endpoints, a trivial query is sent so that an
     * unreachable endpoint is reported immediately.
     *
     * @throws GraphUnavailableException
     *             if initialization fails
     */
    public synchronized void init() throws GraphUnavailableException {
        if (this.initialized) {
            return;
        }
        try {
            this.repository.initialize();
        } catch (final RepositoryException ex) {
            throw new GraphUnavailableException("Could not initialize repository " + this, ex);
        }
        this.initialized = true;
        if (!this.loadable) {
            RepositoryConnection connection = null;
            try {
                connection = this.repository.getConnection();
                connection.prepareBooleanQuery(QueryLanguage.SPARQL, "ASK { ?s ?p ?o }")
                        .evaluate();
            } catch (final Exception ex) {
                throw new GraphUnavailableException("SPARQL endpoint " + this.description
                        + " not reachable: " + ex.getMessage(), ex);
            } finally {
                closeQuietly(connection);
            }
        }
        LOGGER.info("{} initialized", this);
    }

    public boolean isLoadable() {
        return this.loadable;
    }

    /**
     * Returns the accepted literal languages, in order of preference.
     *
     * @return the accepted languages, the empty string denoting literals without language
     */
    public Set<String> getLanguages() {
        return this.languages;
    }

    /**
     * Loads an RDF file, or all the RDF files of a directory, into the repository, incrementing
     * the generation.
     *
     * @param location
     *            the file or directory to load
     * @return the number of loaded statements
     * @throws GraphUnavailableException
     *             if some file cannot be parsed or the repository cannot be written; statements
     *             of files loaded before the failing one are retained
     * @throws IllegalStateException
     *             if this graph access does not support loading (remote endpoint)
     */
    public synchronized long load(final File location) throws GraphUnavailableException {
        Preconditions.checkState(this.loadable, "Cannot load data into %s", this);
        init();
        long total = 0;
        for (final File file : RDFSources.list(location)) {
            final long ts = System.currentTimeMillis();
            final long before = size();
            RepositoryConnection connection = null;
            try {
                connection = this.repository.getConnection();
                connection.begin();
                RDFSources.read(file, new RDFInserter(connection));
                connection.commit();
            } catch (final RepositoryException ex) {
                throw new GraphUnavailableException("Could not store statements of " + file, ex);
            } finally {
                rollbackQuietly(connection);
                closeQuietly(connection);
            }
            final long loaded = size() - before;
            total += loaded;
            this.generation.incrementAndGet();
            LOGGER.info("{} statements loaded from {} in {} ms", loaded, file,
                    System.currentTimeMillis() - ts);
        }
        return total;
    }

    /**
     * Returns the number of statements in the repository.
     *
     * @return the number of statements
     * @throws GraphUnavailableException
     *             on failure
     */
    public long size() throws GraphUnavailableException {
        RepositoryConnection connection = null;
        try {
            connection = this.repository.getConnection();
            return connection.size();
        } catch (final RepositoryException ex) {
            throw new GraphUnavailableException("Could not count statements in " + this, ex);
        } finally {
            closeQuietly(connection);
        }
    }

    @Override
    public Set<Statement> getTriples(final URI entity) throws GraphUnavailableException {
        Preconditions.checkState(this.initialized, "%s not initialized", this);
        final Set<Statement> result = Sets.newLinkedHashSet();
        RepositoryConnection connection = null;
        try {
            connection = this.repository.getConnection();
            collect(connection.getStatements(entity, null, null, false), result);
            collect(connection.getStatements(null, null, entity, false), result);
        } catch (final RepositoryException ex) {
            throw new GraphUnavailableException("Could not retrieve statements of <" + entity
                    + "> from " + this + ": " + ex.getMessage(), ex);
        } finally {
            closeQuietly(connection);
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Returns the <tt>rdfs:label</tt> of a resource, preferring labels whose language comes
     * first in the accepted languages.
     *
     * @param resource
     *            the resource
     * @return the preferred label, null if the resource has no acceptable label
     * @throws GraphUnavailableException
     *             on failure
     */
    @Nullable
    public Literal getLabel(final URI resource) throws GraphUnavailableException {
        Preconditions.checkState(this.initialized, "%s not initialized", this);
        Literal result = null;
        int resultRank = Integer.MAX_VALUE;
        RepositoryConnection connection = null;
        try {
            connection = this.repository.getConnection();
            final RepositoryResult<Statement> statements = connection.getStatements(resource,
                    RDFS.LABEL, null, false);
            try {
                while (statements.hasNext()) {
                    final Value object = statements.next().getObject();
                    if (object instanceof Literal) {
                        final int rank = rank((Literal) object);
                        if (rank < resultRank) {
                            result = (Literal) object;
                            resultRank = rank;
                        }
                    }
                }
            } finally {
                statements.close();
            }
        } catch (final RepositoryException ex) {
            throw new GraphUnavailableException("Could not retrieve label of <" + resource
                    + "> from " + this + ": " + ex.getMessage(), ex);
        } finally {
            closeQuietly(connection);
        }
        return result;
    }

    private int rank(final Literal literal) {
        final String language = literal.getLanguage() == null ? "" : literal.getLanguage()
                .toLowerCase(Locale.ROOT);
        final int index = this.languages.asList().indexOf(language);
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    private void collect(final RepositoryResult<Statement> statements, final Set<Statement> result)
            throws RepositoryException {
        try {
            while (statements.hasNext()) {
                final Statement statement = statements.next();
                if (accept(statement)) {
                    result.add(statement);
                }
            }
        } finally {
            statements.close();
        }
    }

    private boolean accept(final Statement statement) {
        final Resource subject = statement.getSubject();
        final Value object = statement.getObject();
        if (subject instanceof BNode || object instanceof BNode) {
            return false;
        }
        if (object instanceof Literal) {
            return rank((Literal) object) != Integer.MAX_VALUE;
        }
        return true;
    }

    private static void rollbackQuietly(@Nullable final RepositoryConnection connection) {
        try {
            if (connection != null && connection.isActive()) {
                connection.rollback();
            }
        } catch (final RepositoryException ex) {
            LOGGER.error("Rollback failed", ex);
        }
    }

    private static void closeQuietly(@Nullable final RepositoryConnection connection) {
        if (connection != null) {
            try {
                connection.close();
            } catch (final RepositoryException ex) {
                LOGGER.error("Failed to close connection", ex);
            }
        }
    }

    @Override
    public long getGeneration() {
        return this.generation.get();
    }

    @Override
    public synchronized void close() {
        if (!this.initialized) {
            return;
        }
        try {
            this.repository.shutDown();
            this.initialized = false;
        } catch (final RepositoryException ex) {
            LOGGER.error("Failed to shutdown repository " + this, ex);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.description + ")";
    }

}
