/**
 * Evaluation of rankings: {@link eu.fbk.ebes.eval.RankingEvaluator} and
 * {@link eu.fbk.ebes.eval.EvaluationReport}.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.ebes.eval;
