package eu.fbk.ebes.scoring;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.openrdf.model.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes and linearly combines the results of the text-based and example-based methods.
 */
public final class ScoreCombiner {

    public static final String METHOD = "combined";

    private static final Logger LOGGER = LoggerFactory.getLogger(ScoreCombiner.class);

    private final MathContext mc;

    public ScoreCombiner(final MathContext mc) {
        this.mc = Preconditions.checkNotNull(mc);
    }

    public ScoreCombiner(final RankingConfig config) {
        this(config.getMathContext());
    }

    /**
     * Min-max normalizes a list of scores to the <tt>[0, 1]</tt> interval. If all the scores are
     * equal, they are all mapped to zero.
     *
     * @param scores
     *            the scores to normalize
     * @return a new list with the normalized scores, in the same order
     */
    public List<BigDecimal> normalize(final List<BigDecimal> scores) {
        if (scores.isEmpty()) {
            return ImmutableList.of();
        }
        BigDecimal min = scores.get(0);
        BigDecimal max = scores.get(0);
        for (final BigDecimal score : scores) {
            min = min.min(score);
            max = max.max(score);
        }
        final BigDecimal range = max.subtract(min, this.mc);
        final ImmutableList.Builder<BigDecimal> builder = ImmutableList.builder();
        for (final BigDecimal score : scores) {
            builder.add(range.signum() == 0 ? BigDecimal.ZERO : score.subtract(min, this.mc)
                    .divide(range, this.mc));
        }
        return builder.build();
    }

    /**
     * Combines a text-based and an example-based result as
     * <tt>alpha * text + (1 - alpha) * example</tt> after min-max normalization of both. Entities
     * missing from one of the results are given a zero raw score in it. The candidates of the
     * combined result are the candidates of the text result followed by the candidates found
     * only in the example result.
     *
     * @param text
     *            the text-based result
     * @param example
     *            the example-based result
     * @param alpha
     *            the weight of the text-based result, in <tt>[0, 1]</tt>
     * @return the combined result
     */
    public RankingResult combine(final RankingResult text, final RankingResult example,
            final double alpha) {

        Preconditions.checkArgument(alpha >= 0.0 && alpha <= 1.0, "Invalid alpha %s", alpha);

        final Set<URI> candidates = Sets.newLinkedHashSet(text.getCandidates());
        candidates.addAll(example.getCandidates());

        final List<BigDecimal> textScores = Lists.newArrayListWithCapacity(candidates.size());
        final List<BigDecimal> exampleScores = Lists.newArrayListWithCapacity(candidates.size());
        for (final URI candidate : candidates) {
            textScores.add(scoreOrZero(text, candidate));
            exampleScores.add(scoreOrZero(example, candidate));
        }
        final List<BigDecimal> textNorm = normalize(textScores);
        final List<BigDecimal> exampleNorm = normalize(exampleScores);

        final BigDecimal textWeight = BigDecimal.valueOf(alpha);
        final BigDecimal exampleWeight = BigDecimal.ONE.subtract(textWeight);
        final Map<URI, BigDecimal> scores = Maps.newHashMap();
        int index = 0;
        for (final URI candidate : candidates) {
            final BigDecimal score = textWeight.multiply(textNorm.get(index), this.mc).add(
                    exampleWeight.multiply(exampleNorm.get(index), this.mc), this.mc);
            scores.put(candidate, score);
            ++index;
        }

        LOGGER.debug("Combined {} candidates with alpha {}", candidates.size(), alpha);
        return RankingResult.create(METHOD, candidates, scores);
    }

    private static BigDecimal scoreOrZero(final RankingResult result, final URI entity) {
        final BigDecimal score = result.getScore(entity);
        return score == null ? BigDecimal.ZERO : score;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.mc + ")";
    }

}
