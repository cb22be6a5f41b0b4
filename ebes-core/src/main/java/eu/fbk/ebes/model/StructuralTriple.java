package eu.fbk.ebes.model;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

/**
 * An anonymized statement pattern used for example-based matching.
 * <p>
 * A <tt>StructuralTriple</tt> records a statement in which an entity takes part, together with
 * its {@link Direction}. The <i>far endpoint</i> (the object of an outlink or the subject of an
 * inlink, i.e., the endpoint that is not the entity) is kept only if it is a URI; literal far
 * endpoints are replaced by <tt>null</tt>, because literals almost never recur verbatim across
 * entities and keeping them would eliminate any overlap.
 * </p>
 * <p>
 * Two structural triples {@link #matches(StructuralTriple) match} if they have the same predicate
 * and direction and their far endpoints are equal, a <tt>null</tt> far endpoint on either side
 * matching any value. The near endpoint (the entity itself) is never compared, as it differs by
 * construction between the entities being compared.
 * </p>
 */
public final class StructuralTriple {

    @Nullable
    private final Resource subject;

    private final URI predicate;

    @Nullable
    private final Value object;

    private final Direction direction;

    private StructuralTriple(@Nullable final Resource subject, final URI predicate,
            @Nullable final Value object, final Direction direction) {
        this.subject = subject;
        this.predicate = Preconditions.checkNotNull(predicate);
        this.object = object;
        this.direction = Preconditions.checkNotNull(direction);
    }

    /**
     * Creates a structural triple for an outgoing statement of an entity.
     *
     * @param entity
     *            the entity, subject of the statement
     * @param predicate
     *            the predicate of the statement
     * @param object
     *            the object of the statement; nulled if a literal
     * @return the created structural triple
     */
    public static StructuralTriple outlink(final Resource entity, final URI predicate,
            @Nullable final Value object) {
        return new StructuralTriple(Preconditions.checkNotNull(entity), predicate,
                object instanceof Literal ? null : object, Direction.OUT);
    }

    /**
     * Creates a structural triple for an incoming statement of an entity.
     *
     * @param subject
     *            the subject of the statement
     * @param predicate
     *            the predicate of the statement
     * @param entity
     *            the entity, object of the statement
     * @return the created structural triple
     */
    public static StructuralTriple inlink(@Nullable final Resource subject, final URI predicate,
            final Resource entity) {
        return new StructuralTriple(subject, predicate, Preconditions.checkNotNull(entity),
                Direction.IN);
    }

    @Nullable
    public Resource getSubject() {
        return this.subject;
    }

    public URI getPredicate() {
        return this.predicate;
    }

    @Nullable
    public Value getObject() {
        return this.object;
    }

    public Direction getDirection() {
        return this.direction;
    }

    /**
     * Returns the endpoint that is not the entity the triple was collected for: the object of an
     * outlink or the subject of an inlink.
     *
     * @return the far endpoint, null if anonymized
     */
    @Nullable
    public Value getFarEndpoint() {
        return this.direction == Direction.OUT ? this.object : this.subject;
    }

    public boolean matches(final StructuralTriple other) {
        if (this.direction != other.direction || !this.predicate.equals(other.predicate)) {
            return false;
        }
        final Value thisEnd = getFarEndpoint();
        final Value otherEnd = other.getFarEndpoint();
        return thisEnd == null || otherEnd == null || thisEnd.equals(otherEnd);
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof StructuralTriple)) {
            return false;
        }
        final StructuralTriple other = (StructuralTriple) object;
        return this.direction == other.direction && this.predicate.equals(other.predicate)
                && Objects.equal(this.subject, other.subject)
                && Objects.equal(this.object, other.object);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.subject, this.predicate, this.object, this.direction);
    }

    @Override
    public String toString() {
        return "(" + (this.subject == null ? "*" : "<" + this.subject + ">") + " <"
                + this.predicate + "> " + (this.object == null ? "*" : "<" + this.object + ">")
                + ", " + this.direction + ")";
    }

}
