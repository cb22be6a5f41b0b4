package eu.fbk.ebes.scoring;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Strategy for aggregating the per-example scores of a candidate into a single score.
 */
public enum Aggregation {

    /** Sum of the per-example scores. */
    SUM {

        @Override
        BigDecimal aggregate(final List<BigDecimal> scores, final MathContext mc) {
            BigDecimal result = BigDecimal.ZERO;
            for (final BigDecimal score : scores) {
                result = result.add(score, mc);
            }
            return result;
        }

    },

    /** Maximum of the per-example scores. */
    MAX {

        @Override
        BigDecimal aggregate(final List<BigDecimal> scores, final MathContext mc) {
            BigDecimal result = BigDecimal.ZERO;
            for (final BigDecimal score : scores) {
                result = result.max(score);
            }
            return result;
        }

    },

    /** Arithmetic mean of the per-example scores. */
    MEAN {

        @Override
        BigDecimal aggregate(final List<BigDecimal> scores, final MathContext mc) {
            return scores.isEmpty() ? BigDecimal.ZERO : SUM.aggregate(scores, mc).divide(
                    BigDecimal.valueOf(scores.size()), mc);
        }

    };

    abstract BigDecimal aggregate(List<BigDecimal> scores, MathContext mc);

}
