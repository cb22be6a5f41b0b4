package eu.fbk.ebes.scoring;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.URI;

import eu.fbk.ebes.graph.MemoryGraph;

public class ScoreCombinerTest {

    private static final URI X = MemoryGraph.uri("x");

    private static final URI Y = MemoryGraph.uri("y");

    private static final URI Z = MemoryGraph.uri("z");

    private static final ScoreCombiner COMBINER = new ScoreCombiner(MathContext.DECIMAL128);

    private static List<BigDecimal> decimals(final double... values) {
        final ImmutableList.Builder<BigDecimal> builder = ImmutableList.builder();
        for (final double value : values) {
            builder.add(BigDecimal.valueOf(value));
        }
        return builder.build();
    }

    private static void assertScores(final List<BigDecimal> expected,
            final List<BigDecimal> actual) {
        Assert.assertEquals(expected.size(), actual.size());
        for (int i = 0; i < expected.size(); ++i) {
            Assert.assertEquals("at " + i + ": " + actual, 0,
                    expected.get(i).compareTo(actual.get(i)));
        }
    }

    @Test
    public void testNormalize() {
        assertScores(decimals(0, 0, 0), COMBINER.normalize(decimals(5, 5, 5)));
        assertScores(decimals(0, 0.5, 1), COMBINER.normalize(decimals(1, 3, 5)));
        assertScores(decimals(1, 0, 0.25), COMBINER.normalize(decimals(-1, -9, -7)));
        assertScores(decimals(0), COMBINER.normalize(decimals(42)));
        Assert.assertTrue(COMBINER.normalize(ImmutableList.<BigDecimal>of()).isEmpty());
    }

    @Test
    public void testCombineTie() {
        final RankingResult text = RankingResult.create(TextScorer.METHOD,
                ImmutableList.of(X, Y), ImmutableMap.of(X, BigDecimal.ONE, Y, BigDecimal.ZERO));
        final RankingResult example = RankingResult.create(ExampleScorer.METHOD,
                ImmutableList.of(X, Y), ImmutableMap.of(X, BigDecimal.ZERO, Y, BigDecimal.ONE));
        final RankingResult combined = COMBINER.combine(text, example, 0.5);
        Assert.assertEquals(ScoreCombiner.METHOD, combined.getMethod());
        Assert.assertEquals(ImmutableList.of(X, Y), combined.getRankedEntities());
        Assert.assertEquals(0, new BigDecimal("0.5").compareTo(combined.getScore(X)));
        Assert.assertEquals(0, new BigDecimal("0.5").compareTo(combined.getScore(Y)));

        // the tie follows the order of the text candidates
        final RankingResult reversed = COMBINER.combine(RankingResult.create(TextScorer.METHOD,
                ImmutableList.of(Y, X), ImmutableMap.of(X, BigDecimal.ONE, Y, BigDecimal.ZERO)),
                example, 0.5);
        Assert.assertEquals(ImmutableList.of(Y, X), reversed.getRankedEntities());
    }

    @Test
    public void testCombineMissingEntities() {
        final Map<URI, BigDecimal> textScores = ImmutableMap.of(X, new BigDecimal("0.001"), Y,
                new BigDecimal("0.003"));
        final RankingResult text = RankingResult.create(TextScorer.METHOD,
                ImmutableList.of(X, Y), textScores);
        final RankingResult example = RankingResult.create(ExampleScorer.METHOD,
                ImmutableList.of(Z, X), ImmutableMap.of(Z, BigDecimal.valueOf(4), X,
                        BigDecimal.valueOf(2)));
        final RankingResult combined = COMBINER.combine(text, example, 0.25);

        Assert.assertEquals(ImmutableList.of(X, Y, Z), combined.getCandidates());
        // text norm: x 1/3, y 1, z 0; example norm: x 0.5, y 0, z 1
        Assert.assertEquals(0.25 / 3 + 0.75 * 0.5, combined.getScore(X).doubleValue(), 1e-12);
        Assert.assertEquals(0.25, combined.getScore(Y).doubleValue(), 1e-12);
        Assert.assertEquals(0.75, combined.getScore(Z).doubleValue(), 1e-12);
        Assert.assertEquals(ImmutableList.of(Z, X, Y), combined.getRankedEntities());
    }

    @Test
    public void testAlphaExtremes() {
        final RankingResult text = RankingResult.create(TextScorer.METHOD,
                ImmutableList.of(X, Y), ImmutableMap.of(X, BigDecimal.ONE, Y, BigDecimal.ZERO));
        final RankingResult example = RankingResult.create(ExampleScorer.METHOD,
                ImmutableList.of(X, Y), ImmutableMap.of(X, BigDecimal.ZERO, Y, BigDecimal.ONE));
        Assert.assertEquals(ImmutableList.of(X, Y), COMBINER.combine(text, example, 1.0)
                .getRankedEntities());
        Assert.assertEquals(ImmutableList.of(Y, X), COMBINER.combine(text, example, 0.0)
                .getRankedEntities());
        try {
            COMBINER.combine(text, example, 1.5);
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // expected
        }
    }

}
