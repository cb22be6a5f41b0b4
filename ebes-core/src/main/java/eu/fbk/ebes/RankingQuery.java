package eu.fbk.ebes;

import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.openrdf.model.URI;

/**
 * An information need: a text relation, example entities and the candidates to rank, plus the
 * relevant entities when the query is used for evaluation.
 */
public final class RankingQuery {

    @Nullable
    private final String name;

    private final String topic;

    private final List<URI> examples;

    private final List<URI> candidates;

    private final Set<URI> relevant;

    private RankingQuery(final Builder builder) {
        this.name = builder.name;
        this.topic = Preconditions.checkNotNull(builder.topic);
        this.examples = ImmutableList.copyOf(MoreObjects.firstNonNull(builder.examples,
                ImmutableList.<URI>of()));
        this.candidates = ImmutableSet.copyOf(MoreObjects.firstNonNull(builder.candidates,
                ImmutableList.<URI>of())).asList();
        this.relevant = ImmutableSet.copyOf(MoreObjects.firstNonNull(builder.relevant,
                ImmutableSet.<URI>of()));
    }

    @Nullable
    public String getName() {
        return this.name;
    }

    public String getTopic() {
        return this.topic;
    }

    public List<URI> getExamples() {
        return this.examples;
    }

    /**
     * Returns the candidates to rank, in input order and without duplicates.
     *
     * @return an immutable list of candidates
     */
    public List<URI> getCandidates() {
        return this.candidates;
    }

    /**
     * Returns the ground truth relevant entities, empty if the query is not used for evaluation.
     *
     * @return an immutable set of relevant entities
     */
    public Set<URI> getRelevant() {
        return this.relevant;
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof RankingQuery)) {
            return false;
        }
        final RankingQuery other = (RankingQuery) object;
        return Objects.equal(this.name, other.name) && this.topic.equals(other.topic)
                && this.examples.equals(other.examples)
                && this.candidates.equals(other.candidates)
                && this.relevant.equals(other.relevant);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.name, this.topic, this.examples, this.candidates,
                this.relevant);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("name", this.name)
                .add("topic", this.topic).add("examples", this.examples.size())
                .add("candidates", this.candidates.size())
                .add("relevant", this.relevant.size()).toString();
    }

    public static Builder builder(final String topic) {
        return new Builder(topic);
    }

    public static class Builder {

        @Nullable
        String name;

        String topic;

        @Nullable
        Iterable<URI> examples;

        @Nullable
        Iterable<URI> candidates;

        @Nullable
        Iterable<URI> relevant;

        Builder(final String topic) {
            this.topic = Preconditions.checkNotNull(topic);
        }

        public Builder name(@Nullable final String name) {
            this.name = name;
            return this;
        }

        public Builder examples(@Nullable final Iterable<URI> examples) {
            this.examples = examples;
            return this;
        }

        public Builder candidates(@Nullable final Iterable<URI> candidates) {
            this.candidates = candidates;
            return this;
        }

        public Builder relevant(@Nullable final Iterable<URI> relevant) {
            this.relevant = relevant;
            return this;
        }

        public RankingQuery build() {
            return new RankingQuery(this);
        }

    }

}
