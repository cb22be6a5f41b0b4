package eu.fbk.ebes.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.impl.URIImpl;
import org.openrdf.model.vocabulary.RDF;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.graph.GraphAccess;
import eu.fbk.ebes.graph.GraphUnavailableException;

/**
 * Builds {@link EntityRepresentation}s out of the triples returned by a {@link GraphAccess}.
 * <p>
 * Statements are classified as follows:
 * </p>
 * <ul>
 * <li>outgoing statement with a literal object: the literal is tokenized into
 * {@link Field#ATTRIBUTES};</li>
 * <li>outgoing statement with a type predicate (see {@link #DEFAULT_TYPE_PREDICATES}) and a URI
 * object: the local name of the object is tokenized into {@link Field#TYPES};</li>
 * <li>any other statement linking the entity to / from a URI: the local name of that URI is
 * tokenized into {@link Field#LINKS}, unless the predicate is a type predicate.</li>
 * </ul>
 * <p>
 * Every statement also produces a {@link StructuralTriple}. Statements with a blank node
 * endpoint are ignored altogether.
 * </p>
 */
public final class RepresentationBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(RepresentationBuilder.class);

    public static final URI SKOS_SUBJECT = new URIImpl(
            "http://www.w3.org/2004/02/skos/core#subject");

    public static final URI DC_SUBJECT = new URIImpl("http://purl.org/dc/elements/1.1/subject");

    public static final Set<URI> DEFAULT_TYPE_PREDICATES = ImmutableSet.of(RDF.TYPE,
            SKOS_SUBJECT, DC_SUBJECT);

    private final GraphAccess graph;

    private final Tokenizer tokenizer;

    private final Set<URI> typePredicates;

    public RepresentationBuilder(final GraphAccess graph, final Tokenizer tokenizer) {
        this(graph, tokenizer, DEFAULT_TYPE_PREDICATES);
    }

    public RepresentationBuilder(final GraphAccess graph, final Tokenizer tokenizer,
            final Iterable<URI> typePredicates) {
        this.graph = Preconditions.checkNotNull(graph);
        this.tokenizer = Preconditions.checkNotNull(tokenizer);
        this.typePredicates = ImmutableSet.copyOf(typePredicates);
    }

    public GraphAccess getGraph() {
        return this.graph;
    }

    public Tokenizer getTokenizer() {
        return this.tokenizer;
    }

    /**
     * Builds the representation of the entity specified.
     *
     * @param entity
     *            the entity URI
     * @return the built representation, empty if the entity has no triples
     * @throws GraphUnavailableException
     *             if the triples of the entity cannot be retrieved
     */
    public EntityRepresentation build(final URI entity) throws GraphUnavailableException {

        LOGGER.debug("Computing representation of {}", entity);

        final Map<Field, Multiset<String>> terms = Maps.newEnumMap(Field.class);
        for (final Field field : Field.values()) {
            terms.put(field, LinkedHashMultiset.<String>create());
        }
        final List<StructuralTriple> structuralTriples = Lists.newArrayList();

        int outlinks = 0;
        int inlinks = 0;
        int skipped = 0;
        for (final Statement statement : this.graph.getTriples(entity)) {
            final Resource subj = statement.getSubject();
            final URI pred = statement.getPredicate();
            final Value obj = statement.getObject();
            if (subj instanceof BNode || obj instanceof BNode) {
                ++skipped;
                continue;
            }
            final boolean type = this.typePredicates.contains(pred);
            if (entity.equals(subj)) {
                ++outlinks;
                if (obj instanceof Literal) {
                    add(terms.get(Field.ATTRIBUTES), ((Literal) obj).getLabel());
                } else {
                    add(terms.get(type ? Field.TYPES : Field.LINKS), ((URI) obj).getLocalName());
                }
                structuralTriples.add(StructuralTriple.outlink(entity, pred, obj));
            } else if (entity.equals(obj)) {
                ++inlinks;
                if (!type) {
                    add(terms.get(Field.LINKS), ((URI) subj).getLocalName());
                }
                structuralTriples.add(StructuralTriple.inlink(subj, pred, entity));
            }
        }

        final EntityRepresentation representation = EntityRepresentation.create(entity, terms,
                structuralTriples);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("    -> {} outlinks, {} inlinks, {} skipped (blank nodes)", outlinks,
                    inlinks, skipped);
            LOGGER.debug("    -> {}", representation);
        }
        return representation;
    }

    /**
     * Builds the representations of the entities specified, preserving their order.
     *
     * @param entities
     *            the entity URIs
     * @return a list with one representation per supplied entity
     * @throws GraphUnavailableException
     *             if the triples of some entity cannot be retrieved
     */
    public List<EntityRepresentation> build(final Iterable<URI> entities)
            throws GraphUnavailableException {
        final ImmutableList.Builder<EntityRepresentation> builder = ImmutableList.builder();
        for (final URI entity : entities) {
            builder.add(build(entity));
        }
        return builder.build();
    }

    private void add(final Multiset<String> bag, final String text) {
        bag.addAll(this.tokenizer.tokenize(text));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.graph + ", " + this.tokenizer + ")";
    }

}
