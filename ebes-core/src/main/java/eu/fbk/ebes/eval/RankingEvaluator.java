package eu.fbk.ebes.eval;

import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import org.openrdf.model.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.scoring.RankingResult;

/**
 * Computes retrieval metrics of a ranking against a set of relevant entities.
 * <p>
 * Precision is the fraction of relevant entities in the whole ranked list. R-precision is the
 * fraction of relevant entities among the first <tt>R</tt> ranked ones, <tt>R</tt> being the
 * number of relevant entities. Average precision is the sum, over the positions <tt>i</tt> of
 * relevant entities in the ranking, of the precision at <tt>i</tt>, divided by <tt>R</tt>.
 * Metrics are zero for an empty list or an empty relevant set.
 * </p>
 */
public final class RankingEvaluator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RankingEvaluator.class);

    public EvaluationReport evaluate(final RankingResult result, final Set<URI> relevant) {
        return evaluate(result.getRankedEntities(), relevant);
    }

    public EvaluationReport evaluate(final List<URI> ranking, final Set<URI> relevant) {

        final Set<URI> relevantSet = ImmutableSet.copyOf(relevant);
        final int r = relevantSet.size();

        int found = 0;
        int foundInTopR = 0;
        double precisionSum = 0.0;
        for (int i = 0; i < ranking.size(); ++i) {
            if (relevantSet.contains(ranking.get(i))) {
                ++found;
                if (i < r) {
                    ++foundInTopR;
                }
                precisionSum += (double) found / (i + 1);
            }
        }

        final double precision = ranking.isEmpty() ? 0.0 : (double) found / ranking.size();
        final double rPrecision = r == 0 ? 0.0 : (double) foundInTopR / r;
        final double averagePrecision = r == 0 ? 0.0 : Math.min(1.0, precisionSum / r);

        final EvaluationReport report = new EvaluationReport(precision, rPrecision,
                averagePrecision);
        LOGGER.debug("{} relevant out of {} (R = {}): {}", found, ranking.size(), r, report);
        return report;
    }

    /**
     * Returns the fraction of relevant entities among the first <tt>k</tt> ranked ones.
     *
     * @param result
     *            the ranking result
     * @param relevant
     *            the relevant entities
     * @param k
     *            the cut-off, positive; if larger than the ranking, the ranking length is used
     * @return the precision at <tt>k</tt>, zero for an empty ranking
     */
    public double precisionAt(final RankingResult result, final Set<URI> relevant, final int k) {
        Preconditions.checkArgument(k > 0, "Invalid cut-off %s", k);
        final List<URI> ranking = result.getRankedEntities();
        final int limit = Math.min(k, ranking.size());
        if (limit == 0) {
            return 0.0;
        }
        int found = 0;
        for (int i = 0; i < limit; ++i) {
            if (relevant.contains(ranking.get(i))) {
                ++found;
            }
        }
        return (double) found / limit;
    }

}
