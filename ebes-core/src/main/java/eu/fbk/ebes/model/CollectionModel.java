package eu.fbk.ebes.model;

import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;

import org.openrdf.model.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.graph.GraphAccess;
import eu.fbk.ebes.graph.GraphUnavailableException;

/**
 * Aggregate term statistics over a set of entities, used as smoothing background.
 * <p>
 * A <tt>CollectionModel</tt> stores, for each {@link Field}, how many times each term occurs in
 * the representations of a set of distinct entities and how many term occurrences there are in
 * total, together with the number of entities (<tt>ni</tt>). It is an immutable value object,
 * meant to be built once per ranking session and shared by all the candidates and examples of
 * that session. The model records the {@link GraphAccess#getGeneration() generation} of the graph
 * it was computed from: when new triples are loaded the model becomes stale and has to be rebuilt
 * explicitly.
 * </p>
 */
public final class CollectionModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(CollectionModel.class);

    private final Map<Field, ImmutableMultiset<String>> termCounts;

    private final Map<Field, Long> totalTerms;

    private final int entityCount;

    private final long generation;

    private CollectionModel(final Map<Field, ImmutableMultiset<String>> termCounts,
            final Map<Field, Long> totalTerms, final int entityCount, final long generation) {
        this.termCounts = termCounts;
        this.totalTerms = totalTerms;
        this.entityCount = entityCount;
        this.generation = generation;
    }

    /**
     * Builds a collection model over the entities specified, retrieving their triples via the
     * builder supplied. Duplicate entities are considered once.
     *
     * @param entities
     *            the entities of the collection
     * @param builder
     *            the builder used to compute the representation of each entity
     * @return the built model, tagged with the current generation of the builder's graph
     * @throws GraphUnavailableException
     *             if the triples of some entity cannot be retrieved
     */
    public static CollectionModel build(final Iterable<URI> entities,
            final RepresentationBuilder builder) throws GraphUnavailableException {

        final long ts = System.currentTimeMillis();
        final long generation = builder.getGraph().getGeneration();
        final Set<URI> distinct = Sets.newLinkedHashSet(entities);
        LOGGER.info("Computing collection model over {} entities", distinct.size());

        final Accumulator accumulator = new Accumulator();
        for (final URI entity : distinct) {
            accumulator.add(builder.build(entity));
        }
        final CollectionModel model = accumulator.build(generation);
        LOGGER.info("{} computed in {} ms", model, System.currentTimeMillis() - ts);
        return model;
    }

    /**
     * Creates a collection model from already computed representations. Representations of the
     * same entity are considered once.
     *
     * @param representations
     *            the representations of the entities of the collection
     * @param generation
     *            the generation of the graph the representations were computed from
     * @return the created model
     */
    public static CollectionModel create(final Iterable<EntityRepresentation> representations,
            final long generation) {
        final Accumulator accumulator = new Accumulator();
        for (final EntityRepresentation representation : representations) {
            accumulator.add(representation);
        }
        return accumulator.build(generation);
    }

    public int getTermCount(final Field field, @Nullable final String term) {
        return term == null ? 0 : this.termCounts.get(field).count(term);
    }

    public long getTotalTerms(final Field field) {
        return this.totalTerms.get(field);
    }

    public int getEntityCount() {
        return this.entityCount;
    }

    public long getGeneration() {
        return this.generation;
    }

    /**
     * Checks whether this model was computed from the current content of the graph specified.
     *
     * @param graph
     *            the graph
     * @return true if the generation of the graph did not change since the model was built
     */
    public boolean isCurrent(final GraphAccess graph) {
        return graph.getGeneration() == this.generation;
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        builder.append("CollectionModel(").append(this.entityCount).append(" entities");
        for (final Field field : Field.values()) {
            builder.append(", ").append(this.totalTerms.get(field)).append(' ').append(field)
                    .append(" terms");
        }
        builder.append(", generation ").append(this.generation).append(')');
        return builder.toString();
    }

    private static final class Accumulator {

        private final Map<Field, Multiset<String>> counts = Maps.newEnumMap(Field.class);

        private final Set<URI> entities = Sets.newHashSet();

        Accumulator() {
            for (final Field field : Field.values()) {
                this.counts.put(field, HashMultiset.<String>create());
            }
        }

        void add(final EntityRepresentation representation) {
            if (this.entities.add(representation.getEntity())) {
                for (final Field field : Field.values()) {
                    this.counts.get(field).addAll(representation.getTerms(field));
                }
            }
        }

        CollectionModel build(final long generation) {
            final Map<Field, ImmutableMultiset<String>> termCounts = Maps.newEnumMap(Field.class);
            final Map<Field, Long> totalTerms = Maps.newEnumMap(Field.class);
            for (final Field field : Field.values()) {
                final Multiset<String> bag = this.counts.get(field);
                termCounts.put(field, ImmutableMultiset.copyOf(bag));
                totalTerms.put(field, (long) bag.size());
            }
            return new CollectionModel(termCounts, totalTerms, this.entities.size(), generation);
        }

    }

}
