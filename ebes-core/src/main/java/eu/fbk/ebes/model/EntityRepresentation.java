package eu.fbk.ebes.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;

import org.openrdf.model.URI;

/**
 * The representation of an entity used for scoring.
 * <p>
 * An <tt>EntityRepresentation</tt> holds, for a single entity, one bag of terms for each
 * {@link Field} (attributes, types, links) and the set of anonymized {@link StructuralTriple}s the
 * entity takes part in. Instances are immutable and meant to be rebuilt each time they are needed
 * via {@link RepresentationBuilder}; they are not persisted across rankings.
 * </p>
 */
public final class EntityRepresentation {

    private final URI entity;

    private final Map<Field, ImmutableMultiset<String>> terms;

    private final Map<Field, Integer> lengths;

    private final Set<StructuralTriple> structuralTriples;

    private EntityRepresentation(final URI entity,
            final Map<Field, ImmutableMultiset<String>> terms,
            final Set<StructuralTriple> structuralTriples) {
        this.entity = entity;
        this.terms = terms;
        this.lengths = Maps.newEnumMap(Field.class);
        for (final Field field : Field.values()) {
            this.lengths.put(field, terms.get(field).size());
        }
        this.structuralTriples = structuralTriples;
    }

    /**
     * Creates a new representation with the term bags and structural triples specified.
     *
     * @param entity
     *            the entity URI
     * @param terms
     *            a map from fields to term bags; missing fields are considered empty
     * @param structuralTriples
     *            the structural triples of the entity, in a deterministic order
     * @return the created representation
     */
    public static EntityRepresentation create(final URI entity,
            final Map<Field, ? extends Multiset<String>> terms,
            final Iterable<StructuralTriple> structuralTriples) {
        Preconditions.checkNotNull(entity);
        final Map<Field, ImmutableMultiset<String>> map = new EnumMap<Field, ImmutableMultiset<String>>(
                Field.class);
        for (final Field field : Field.values()) {
            final Multiset<String> bag = terms.get(field);
            map.put(field, bag == null ? ImmutableMultiset.<String>of() : ImmutableMultiset
                    .copyOf(bag));
        }
        return new EntityRepresentation(entity, map, ImmutableSet.copyOf(structuralTriples));
    }

    /**
     * Creates an empty representation, as obtained for an entity without triples.
     *
     * @param entity
     *            the entity URI
     * @return the created representation
     */
    public static EntityRepresentation empty(final URI entity) {
        return create(entity, Maps.<Field, Multiset<String>>newEnumMap(Field.class),
                ImmutableSet.<StructuralTriple>of());
    }

    public URI getEntity() {
        return this.entity;
    }

    public ImmutableMultiset<String> getTerms(final Field field) {
        return this.terms.get(field);
    }

    public int getTermCount(final Field field, @Nullable final String term) {
        return term == null ? 0 : this.terms.get(field).count(term);
    }

    /**
     * Returns the total number of term occurrences in the field specified (<tt>|e|_f</tt>).
     *
     * @param field
     *            the field
     * @return the number of term occurrences, duplicates included
     */
    public int getLength(final Field field) {
        return this.lengths.get(field);
    }

    public Set<StructuralTriple> getStructuralTriples() {
        return this.structuralTriples;
    }

    public boolean isEmpty() {
        for (final Field field : Field.values()) {
            if (this.lengths.get(field) > 0) {
                return false;
            }
        }
        return this.structuralTriples.isEmpty();
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof EntityRepresentation)) {
            return false;
        }
        final EntityRepresentation other = (EntityRepresentation) object;
        return this.entity.equals(other.entity) && this.terms.equals(other.terms)
                && this.structuralTriples.equals(other.structuralTriples);
    }

    @Override
    public int hashCode() {
        return this.entity.hashCode();
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        builder.append('<').append(this.entity).append('>');
        for (final Field field : Field.values()) {
            builder.append(", ").append(this.lengths.get(field)).append(" terms in ")
                    .append(field);
        }
        builder.append(", ").append(this.structuralTriples.size()).append(" structural triples");
        return builder.toString();
    }

}
