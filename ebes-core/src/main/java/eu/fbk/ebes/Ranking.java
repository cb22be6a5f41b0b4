package eu.fbk.ebes;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import eu.fbk.ebes.scoring.RankingResult;

/**
 * The results of ranking a {@link RankingQuery} with the text-based, example-based and combined
 * methods.
 */
public final class Ranking {

    private final RankingQuery query;

    private final RankingResult textResult;

    private final RankingResult exampleResult;

    private final RankingResult combinedResult;

    public Ranking(final RankingQuery query, final RankingResult textResult,
            final RankingResult exampleResult, final RankingResult combinedResult) {
        this.query = Preconditions.checkNotNull(query);
        this.textResult = Preconditions.checkNotNull(textResult);
        this.exampleResult = Preconditions.checkNotNull(exampleResult);
        this.combinedResult = Preconditions.checkNotNull(combinedResult);
    }

    public RankingQuery getQuery() {
        return this.query;
    }

    public RankingResult getTextResult() {
        return this.textResult;
    }

    public RankingResult getExampleResult() {
        return this.exampleResult;
    }

    public RankingResult getCombinedResult() {
        return this.combinedResult;
    }

    /**
     * Returns the text-based, example-based and combined results, in this order.
     *
     * @return an immutable list of three results
     */
    public List<RankingResult> getResults() {
        return ImmutableList.of(this.textResult, this.exampleResult, this.combinedResult);
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Ranking)) {
            return false;
        }
        final Ranking other = (Ranking) object;
        return this.query.equals(other.query) && this.textResult.equals(other.textResult)
                && this.exampleResult.equals(other.exampleResult)
                && this.combinedResult.equals(other.combinedResult);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.query, this.textResult, this.exampleResult,
                this.combinedResult);
    }

    @Override
    public String toString() {
        return "Ranking(" + this.query + ")";
    }

}
