package eu.fbk.ebes.scoring;

import java.math.BigDecimal;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.URI;

import eu.fbk.ebes.graph.MemoryGraph;

public class RankingResultTest {

    private static final URI A = MemoryGraph.uri("a");

    private static final URI B = MemoryGraph.uri("b");

    private static final URI C = MemoryGraph.uri("c");

    @Test
    public void testOrdering() {
        final RankingResult result = RankingResult.create("test", ImmutableList.of(C, A, B, A),
                ImmutableMap.of(A, new BigDecimal("0.50"), B, new BigDecimal("0.5")));
        Assert.assertEquals(ImmutableList.of(C, A, B), result.getCandidates());
        Assert.assertEquals(ImmutableList.of(A, B, C), result.getRankedEntities());
        Assert.assertEquals(3, result.size());
        Assert.assertEquals(0, result.getScore(C).signum());
        Assert.assertTrue(result.contains(B));
        Assert.assertFalse(result.contains(MemoryGraph.uri("d")));
        Assert.assertNull(result.getScore(MemoryGraph.uri("d")));
    }

    @Test
    public void testEquality() {
        final RankingResult first = RankingResult.create("test", ImmutableList.of(A, B),
                ImmutableMap.of(A, new BigDecimal("1.0"), B, BigDecimal.ZERO));
        final RankingResult second = RankingResult.create("test", ImmutableList.of(A, B),
                ImmutableMap.of(A, BigDecimal.ONE, B, BigDecimal.ZERO));
        Assert.assertEquals(first, second);
        Assert.assertNotEquals(first, RankingResult.create("other", ImmutableList.of(A, B),
                ImmutableMap.of(A, BigDecimal.ONE, B, BigDecimal.ZERO)));
    }

}
