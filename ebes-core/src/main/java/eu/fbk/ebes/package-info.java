/**
 * Example-based entity search: ranking of knowledge graph entities against a text relation and
 * a set of example entities.
 * <p>
 * {@link eu.fbk.ebes.EntityRanker} is the facade of the engine; queries are described by
 * {@link eu.fbk.ebes.RankingQuery} and their results by {@link eu.fbk.ebes.Ranking}.
 * Sub-packages contain the graph access API ({@code graph}), entity representations and
 * collection statistics ({@code model}), the scoring models ({@code scoring}) and the evaluation
 * metrics ({@code eval}).
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.ebes;
