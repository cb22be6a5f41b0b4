package eu.fbk.ebes.eval;

import java.math.BigDecimal;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.URI;

import eu.fbk.ebes.graph.MemoryGraph;
import eu.fbk.ebes.scoring.RankingResult;

public class RankingEvaluatorTest {

    private static final URI A = MemoryGraph.uri("a");

    private static final URI B = MemoryGraph.uri("b");

    private static final URI C = MemoryGraph.uri("c");

    private static final URI D = MemoryGraph.uri("d");

    private final RankingEvaluator evaluator = new RankingEvaluator();

    @Test
    public void testMetrics() {
        final EvaluationReport report = this.evaluator.evaluate(ImmutableList.of(A, B, C),
                ImmutableSet.of(A, C));
        Assert.assertEquals(2.0 / 3.0, report.getPrecision(), 1e-12);
        Assert.assertEquals(0.5, report.getRPrecision(), 1e-12);
        Assert.assertEquals((1.0 + 2.0 / 3.0) / 2.0, report.getAveragePrecision(), 1e-12);
        Assert.assertEquals(0.8333, report.getAveragePrecision(), 1e-4);
    }

    @Test
    public void testRelevantNotRetrieved() {
        final EvaluationReport report = this.evaluator.evaluate(ImmutableList.of(B, A),
                ImmutableSet.of(A, C, D));
        Assert.assertEquals(0.5, report.getPrecision(), 1e-12);
        Assert.assertEquals(1.0 / 3.0, report.getRPrecision(), 1e-12);
        Assert.assertEquals(0.5 / 3.0, report.getAveragePrecision(), 1e-12);
    }

    @Test
    public void testDegenerate() {
        final EvaluationReport empty = this.evaluator.evaluate(ImmutableList.<URI>of(),
                ImmutableSet.of(A));
        Assert.assertEquals(new EvaluationReport(0.0, 0.0, 0.0), empty);
        final EvaluationReport noRelevant = this.evaluator.evaluate(ImmutableList.of(A, B),
                ImmutableSet.<URI>of());
        Assert.assertEquals(new EvaluationReport(0.0, 0.0, 0.0), noRelevant);
    }

    @Test
    public void testResultAndPrecisionAt() {
        final RankingResult result = RankingResult.create("test", ImmutableList.of(A, B, C, D),
                ImmutableMap.of(A, BigDecimal.ONE, B, BigDecimal.ONE, C, BigDecimal.TEN, D,
                        BigDecimal.ZERO));
        // ranking: C, A, B, D
        final EvaluationReport report = this.evaluator.evaluate(result, ImmutableSet.of(C, B));
        Assert.assertEquals(0.5, report.getPrecision(), 1e-12);
        Assert.assertEquals(0.5, report.getRPrecision(), 1e-12);
        Assert.assertEquals((1.0 + 2.0 / 3.0) / 2.0, report.getAveragePrecision(), 1e-12);

        Assert.assertEquals(1.0, this.evaluator.precisionAt(result, ImmutableSet.of(C, B), 1),
                1e-12);
        Assert.assertEquals(0.5, this.evaluator.precisionAt(result, ImmutableSet.of(C, B), 2),
                1e-12);
        Assert.assertEquals(0.5, this.evaluator.precisionAt(result, ImmutableSet.of(C, B), 10),
                1e-12);
    }

    @Test
    public void testMean() {
        final List<EvaluationReport> reports = ImmutableList.of(new EvaluationReport(1.0, 0.5,
                0.25), new EvaluationReport(0.0, 0.5, 0.75));
        final EvaluationReport mean = EvaluationReport.mean(reports);
        Assert.assertEquals(0.5, mean.getPrecision(), 1e-12);
        Assert.assertEquals(0.5, mean.getRPrecision(), 1e-12);
        Assert.assertEquals(0.5, mean.getAveragePrecision(), 1e-12);
        Assert.assertEquals("P=0.5000 R-Prec=0.5000 AP=0.5000", mean.toString());
    }

}
