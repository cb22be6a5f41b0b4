package eu.fbk.ebes.scoring;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import org.openrdf.model.URI;

/**
 * The outcome of scoring a list of candidate entities with a given method.
 * <p>
 * A <tt>RankingResult</tt> keeps both the candidates in the order they were supplied, which is
 * needed to break ties deterministically when results are combined, and the list of
 * {@link Entry entries} sorted by descending score. Ties are kept in candidate order (the sort
 * is stable). Candidates supplied more than once are considered only at their first position.
 * </p>
 */
public final class RankingResult {

    private static final Comparator<Entry> DESCENDING_SCORE = new Comparator<Entry>() {

        @Override
        public int compare(final Entry first, final Entry second) {
            return second.getScore().compareTo(first.getScore());
        }

    };

    private final String method;

    private final List<URI> candidates;

    private final List<Entry> entries;

    private final Map<URI, BigDecimal> scores;

    private RankingResult(final String method, final List<URI> candidates,
            final List<Entry> entries, final Map<URI, BigDecimal> scores) {
        this.method = method;
        this.candidates = candidates;
        this.entries = entries;
        this.scores = scores;
    }

    /**
     * Creates a ranking result.
     *
     * @param method
     *            the name of the method that produced the scores
     * @param candidates
     *            the candidates, in input order
     * @param scores
     *            the score of each candidate; candidates without a score get zero
     * @return the created result
     */
    public static RankingResult create(final String method, final Iterable<URI> candidates,
            final Map<URI, BigDecimal> scores) {

        Preconditions.checkNotNull(method);
        final List<URI> candidateList = ImmutableSet.copyOf(candidates).asList();
        final ImmutableMap.Builder<URI, BigDecimal> scoreBuilder = ImmutableMap.builder();
        final List<Entry> entries = Lists.newArrayListWithCapacity(candidateList.size());
        for (final URI candidate : candidateList) {
            final BigDecimal score = scores.get(candidate);
            final Entry entry = new Entry(candidate, score == null ? BigDecimal.ZERO : score);
            scoreBuilder.put(candidate, entry.getScore());
            entries.add(entry);
        }
        Collections.sort(entries, DESCENDING_SCORE);

        return new RankingResult(method, candidateList, ImmutableList.copyOf(entries),
                scoreBuilder.build());
    }

    public String getMethod() {
        return this.method;
    }

    /**
     * Returns the candidates, in the order they were supplied.
     *
     * @return an immutable list of candidates, without duplicates
     */
    public List<URI> getCandidates() {
        return this.candidates;
    }

    /**
     * Returns the entries sorted by descending score, ties in candidate order.
     *
     * @return an immutable list of entries
     */
    public List<Entry> getEntries() {
        return this.entries;
    }

    /**
     * Returns the entities sorted by descending score, as for {@link #getEntries()}.
     *
     * @return an immutable list of entities
     */
    public List<URI> getRankedEntities() {
        final ImmutableList.Builder<URI> builder = ImmutableList.builder();
        for (final Entry entry : this.entries) {
            builder.add(entry.getEntity());
        }
        return builder.build();
    }

    /**
     * Returns the score of the candidate specified.
     *
     * @param entity
     *            the candidate
     * @return its score, null if the entity is not a candidate of this result
     */
    @Nullable
    public BigDecimal getScore(final URI entity) {
        return this.scores.get(entity);
    }

    public boolean contains(final URI entity) {
        return this.scores.containsKey(entity);
    }

    public int size() {
        return this.entries.size();
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof RankingResult)) {
            return false;
        }
        final RankingResult other = (RankingResult) object;
        return this.method.equals(other.method) && this.candidates.equals(other.candidates)
                && this.entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.method, this.entries);
    }

    @Override
    public String toString() {
        return this.method + this.entries;
    }

    /**
     * An entity with its score.
     */
    public static final class Entry {

        private final URI entity;

        private final BigDecimal score;

        public Entry(final URI entity, final BigDecimal score) {
            this.entity = Preconditions.checkNotNull(entity);
            this.score = Preconditions.checkNotNull(score);
        }

        public URI getEntity() {
            return this.entity;
        }

        public BigDecimal getScore() {
            return this.score;
        }

        @Override
        public boolean equals(@Nullable final Object object) {
            if (object == this) {
                return true;
            }
            if (!(object instanceof Entry)) {
                return false;
            }
            final Entry other = (Entry) object;
            return this.entity.equals(other.entity) && this.score.compareTo(other.score) == 0;
        }

        @Override
        public int hashCode() {
            return this.entity.hashCode();
        }

        @Override
        public String toString() {
            return "<" + this.entity + ">=" + this.score.toPlainString();
        }

    }

}
