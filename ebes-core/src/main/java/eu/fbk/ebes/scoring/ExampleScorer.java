package eu.fbk.ebes.scoring;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.openrdf.model.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.model.EntityRepresentation;
import eu.fbk.ebes.model.StructuralTriple;

/**
 * Scores entities by the structural overlap with a set of example entities.
 * <p>
 * The raw score of a candidate against an example is the number of structural triples of the
 * example that are {@link StructuralTriple#matches(StructuralTriple) matched} by at least one
 * structural triple of the candidate; a candidate identical to the example thus reaches the
 * maximum, i.e., the number of structural triples of the example. If
 * {@link RankingConfig#isJaccard()} is set, the score becomes
 * <tt>intersection / (|candidate| + |example| - intersection)</tt>, where the intersection is the
 * size of a maximum one-to-one matching between candidate and example triples. The ratio is thus
 * bounded by 1, reached only by a candidate matching the example triple by triple. Per-example
 * scores are finally
 * aggregated according to {@link RankingConfig#getAggregation()}.
 * </p>
 */
public final class ExampleScorer {

    public static final String METHOD = "example";

    private static final Logger LOGGER = LoggerFactory.getLogger(ExampleScorer.class);

    private final RankingConfig config;

    private final MathContext mc;

    public ExampleScorer(final RankingConfig config) {
        this.config = Preconditions.checkNotNull(config);
        this.mc = config.getMathContext();
    }

    public RankingConfig getConfig() {
        return this.config;
    }

    /**
     * Ranks the candidates specified based on their similarity with the examples.
     *
     * @param examples
     *            the example representations; if empty, every candidate scores zero
     * @param candidates
     *            the candidate representations, in input order
     * @return the ranking result
     */
    public RankingResult rank(final List<EntityRepresentation> examples,
            final List<EntityRepresentation> candidates) {

        LOGGER.info("Example-based scoring of {} candidates against {} examples",
                candidates.size(), examples.size());
        final long ts = System.currentTimeMillis();

        final List<URI> entities = Lists.newArrayListWithCapacity(candidates.size());
        final Map<URI, BigDecimal> scores = Maps.newHashMap();
        final Progress progress = new Progress(LOGGER, "example-based", candidates.size());
        for (final EntityRepresentation candidate : candidates) {
            entities.add(candidate.getEntity());
            if (!scores.containsKey(candidate.getEntity())) {
                scores.put(candidate.getEntity(), score(candidate, examples));
            }
            progress.increment();
        }

        LOGGER.info("Example-based scoring completed in {} ms", System.currentTimeMillis() - ts);
        return RankingResult.create(METHOD, entities, scores);
    }

    /**
     * Computes the aggregated score of a candidate against all the examples.
     *
     * @param candidate
     *            the candidate representation
     * @param examples
     *            the example representations
     * @return the aggregated score, zero if there are no examples
     */
    public BigDecimal score(final EntityRepresentation candidate,
            final List<EntityRepresentation> examples) {
        final List<BigDecimal> scores = Lists.newArrayListWithCapacity(examples.size());
        for (final EntityRepresentation example : examples) {
            scores.add(pairScore(candidate, example));
        }
        final BigDecimal result = this.config.getAggregation().aggregate(scores, this.mc);
        LOGGER.debug("Example score of {}: {} {}", candidate.getEntity(), result, scores);
        return result;
    }

    /**
     * Computes the score of a candidate against a single example.
     *
     * @param candidate
     *            the candidate representation
     * @param example
     *            the example representation
     * @return the raw overlap, or the Jaccard ratio of the matched triples if enabled
     */
    public BigDecimal pairScore(final EntityRepresentation candidate,
            final EntityRepresentation example) {
        final Set<StructuralTriple> candidateTriples = candidate.getStructuralTriples();
        final Set<StructuralTriple> exampleTriples = example.getStructuralTriples();
        if (!this.config.isJaccard()) {
            return BigDecimal.valueOf(overlap(candidateTriples, exampleTriples));
        }
        final int intersection = intersection(candidateTriples, exampleTriples);
        final int union = candidateTriples.size() + exampleTriples.size() - intersection;
        return union == 0 ? BigDecimal.ZERO : BigDecimal.valueOf(intersection).divide(
                BigDecimal.valueOf(union), this.mc);
    }

    private static int overlap(final Set<StructuralTriple> candidateTriples,
            final Set<StructuralTriple> exampleTriples) {
        int overlap = 0;
        for (final StructuralTriple exampleTriple : exampleTriples) {
            if (candidateTriples.contains(exampleTriple)) {
                ++overlap;
                continue;
            }
            for (final StructuralTriple candidateTriple : candidateTriples) {
                if (candidateTriple.matches(exampleTriple)) {
                    ++overlap;
                    break;
                }
            }
        }
        return overlap;
    }

    private static int intersection(final Set<StructuralTriple> candidateTriples,
            final Set<StructuralTriple> exampleTriples) {
        final List<StructuralTriple> candidates = ImmutableList.copyOf(candidateTriples);
        final List<List<Integer>> edges = Lists.newArrayListWithCapacity(exampleTriples.size());
        for (final StructuralTriple exampleTriple : exampleTriples) {
            final List<Integer> matching = Lists.newArrayList();
            for (int i = 0; i < candidates.size(); ++i) {
                if (candidates.get(i).matches(exampleTriple)) {
                    matching.add(i);
                }
            }
            edges.add(matching);
        }
        // augmenting paths; matchedBy[i] is the example paired with candidate triple i, or -1
        final int[] matchedBy = new int[candidates.size()];
        Arrays.fill(matchedBy, -1);
        int size = 0;
        for (int e = 0; e < edges.size(); ++e) {
            if (augment(e, edges, matchedBy, new boolean[candidates.size()])) {
                ++size;
            }
        }
        return size;
    }

    private static boolean augment(final int example, final List<List<Integer>> edges,
            final int[] matchedBy, final boolean[] visited) {
        for (final int candidate : edges.get(example)) {
            if (!visited[candidate]) {
                visited[candidate] = true;
                if (matchedBy[candidate] < 0
                        || augment(matchedBy[candidate], edges, matchedBy, visited)) {
                    matchedBy[candidate] = example;
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.config + ")";
    }

}
