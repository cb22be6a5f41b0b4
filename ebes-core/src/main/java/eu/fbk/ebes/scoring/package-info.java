/**
 * Scoring models and their combination.
 * <p>
 * {@link eu.fbk.ebes.scoring.TextScorer} implements the text-based model,
 * {@link eu.fbk.ebes.scoring.ExampleScorer} the example-based model and
 * {@link eu.fbk.ebes.scoring.ScoreCombiner} their normalization and linear interpolation. All
 * scores are {@link java.math.BigDecimal}s, computed with the precision set in
 * {@link eu.fbk.ebes.scoring.RankingConfig}.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.ebes.scoring;
