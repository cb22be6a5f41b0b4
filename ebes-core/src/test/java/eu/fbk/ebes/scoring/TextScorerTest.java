package eu.fbk.ebes.scoring;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.ebes.graph.MemoryGraph;
import eu.fbk.ebes.model.CollectionModel;
import eu.fbk.ebes.model.EntityRepresentation;
import eu.fbk.ebes.model.Field;
import eu.fbk.ebes.model.StructuralTriple;
import eu.fbk.ebes.model.Tokenizer;

public class TextScorerTest {

    private static EntityRepresentation newEntity(final String name, final String attributes,
            final String types, final String links) {
        final Map<Field, Multiset<String>> terms = Maps.newEnumMap(Field.class);
        terms.put(Field.ATTRIBUTES, HashMultiset.create(Tokenizer.DEFAULT.tokenize(attributes)));
        terms.put(Field.TYPES, HashMultiset.create(Tokenizer.DEFAULT.tokenize(types)));
        terms.put(Field.LINKS, HashMultiset.create(Tokenizer.DEFAULT.tokenize(links)));
        return EntityRepresentation.create(MemoryGraph.uri(name), terms,
                ImmutableSet.<StructuralTriple>of());
    }

    private static TextScorer newScorer(final RankingConfig config) {
        return new TextScorer(config, Tokenizer.DEFAULT);
    }

    @Test
    public void testFormula() {
        final EntityRepresentation e1 = newEntity("e1", "moon moon", "astronaut", "");
        final EntityRepresentation e2 = newEntity("e2", "", "wizard", "");
        final CollectionModel model = CollectionModel.create(ImmutableList.of(e1, e2), 0L);
        final TextScorer scorer = newScorer(RankingConfig.defaultConfig());

        // mu = ni = 2, Pc = 1/2
        Assert.assertEquals(0.75, scorer.fieldProbability("moon", Field.ATTRIBUTES, e1, model)
                .doubleValue(), 1e-15);
        Assert.assertEquals(1.0 / 3.0, scorer.fieldProbability("moon", Field.TYPES, e1, model)
                .doubleValue(), 1e-15);
        Assert.assertEquals(0.5, scorer.fieldProbability("moon", Field.LINKS, e1, model)
                .doubleValue(), 1e-15);
        final double expected = 0.4 * 0.75 + 0.4 / 3.0 + 0.2 * 0.5;
        Assert.assertEquals(expected, scorer.termProbability("moon", e1, model).doubleValue(),
                1e-15);
        Assert.assertEquals(expected * expected,
                scorer.score(ImmutableList.of("moon", "moon"), e1, model).doubleValue(), 1e-15);
    }

    @Test
    public void testConfiguredMu() {
        final EntityRepresentation e1 = newEntity("e1", "moon moon", "astronaut", "");
        final CollectionModel model = CollectionModel.create(ImmutableList.of(e1), 0L);
        final TextScorer scorer = newScorer(RankingConfig.builder().mu(3.0).build());
        // (2 + 3 * 1/1) / (2 + 3)
        Assert.assertEquals(1.0, scorer.fieldProbability("moon", Field.ATTRIBUTES, e1, model)
                .doubleValue(), 1e-15);
        Assert.assertEquals(0.75, scorer.fieldProbability("moon", Field.TYPES, e1, model)
                .doubleValue(), 1e-15);
    }

    @Test
    public void testCollectionBackground() {
        final EntityRepresentation e1 = newEntity("e1", "moon moon", "astronaut", "");
        final EntityRepresentation e2 = newEntity("e2", "moon sun", "wizard", "");
        final CollectionModel model = CollectionModel.create(ImmutableList.of(e1, e2), 0L);
        final TextScorer scorer = newScorer(RankingConfig.builder()
                .background(Background.COLLECTION).build());
        // Pc(moon|attributes) = 3/4, mu = 2
        Assert.assertEquals((0 + 1.5) / (2 + 2), scorer.fieldProbability("moon",
                Field.ATTRIBUTES, newEntity("e3", "sky sea", "", ""), model).doubleValue(), 1e-15);
        // unseen term: uniform fallback 1/2
        Assert.assertEquals((0 + 1.0) / (2 + 2), scorer.fieldProbability("mars",
                Field.ATTRIBUTES, e1, model).doubleValue(), 1e-15);
    }

    @Test
    public void testLargeMuConvergesToBackground() {
        final EntityRepresentation small = newEntity("small", "sun", "star", "");
        final EntityRepresentation large = newEntity("large", "sun sun sun sun sun sun sun sun",
                "star planet", "orbit orbit");
        final List<EntityRepresentation> entities = ImmutableList.of(small, large);
        final CollectionModel model = CollectionModel.create(entities, 0L);
        double previous = Double.MAX_VALUE;
        for (final double mu : new double[] { 1.0, 10.0, 1000.0, 1e6, 1e12 }) {
            final TextScorer scorer = newScorer(RankingConfig.builder().mu(mu).build());
            final double p = scorer.fieldProbability("sun", Field.ATTRIBUTES, large, model)
                    .doubleValue();
            Assert.assertTrue(p <= previous);
            previous = p;
            for (final EntityRepresentation entity : entities) {
                final double q = scorer.termProbability("moon", entity, model).doubleValue();
                if (mu == 1e12) {
                    Assert.assertEquals(0.5, q, 1e-9);
                }
            }
        }
        Assert.assertEquals(0.5, previous, 1e-9);
    }

    @Test
    public void testEmptyQuery() {
        final EntityRepresentation e1 = newEntity("e1", "moon", "", "");
        final CollectionModel model = CollectionModel.create(ImmutableList.of(e1), 0L);
        final RankingResult result = newScorer(RankingConfig.defaultConfig()).rank("  ...  ",
                ImmutableList.of(e1), model);
        Assert.assertEquals(0, BigDecimal.ONE.compareTo(result.getScore(e1.getEntity())));
    }

    @Test(expected = IllegalStateException.class)
    public void testEmptyCollection() {
        final EntityRepresentation e1 = newEntity("e1", "moon", "", "");
        final CollectionModel model = CollectionModel.create(
                ImmutableList.<EntityRepresentation>of(), 0L);
        newScorer(RankingConfig.defaultConfig()).rank("moon", ImmutableList.of(e1), model);
    }

    @Test
    public void testNoUnderflow() {
        final Map<Field, Multiset<String>> terms1 = Maps.newEnumMap(Field.class);
        final Map<Field, Multiset<String>> terms2 = Maps.newEnumMap(Field.class);
        terms1.put(Field.ATTRIBUTES, HashMultiset.<String>create());
        terms2.put(Field.ATTRIBUTES, HashMultiset.<String>create());
        terms1.get(Field.ATTRIBUTES).add("filler", 100000);
        terms2.get(Field.ATTRIBUTES).add("filler", 100001);
        final EntityRepresentation e1 = EntityRepresentation.create(MemoryGraph.uri("e1"),
                terms1, ImmutableSet.<StructuralTriple>of());
        final EntityRepresentation e2 = EntityRepresentation.create(MemoryGraph.uri("e2"),
                terms2, ImmutableSet.<StructuralTriple>of());
        final CollectionModel model = CollectionModel.create(ImmutableList.of(e1, e2), 0L);

        final List<String> query = ImmutableList.copyOf(java.util.Collections.nCopies(1000,
                "unseen"));
        final RankingResult result = newScorer(RankingConfig.defaultConfig()).rank(query,
                ImmutableList.of(e2, e1), model);

        final BigDecimal s1 = result.getScore(e1.getEntity());
        final BigDecimal s2 = result.getScore(e2.getEntity());
        Assert.assertEquals(1, s1.signum());
        Assert.assertEquals(1, s2.signum());
        Assert.assertEquals(0.0, s1.doubleValue(), 0.0);
        Assert.assertTrue(s1.compareTo(s2) > 0);
        Assert.assertEquals(e1.getEntity(), result.getEntries().get(0).getEntity());
    }

    @Test
    public void testRankOrder() {
        final EntityRepresentation e1 = newEntity("e1", "", "wizard", "");
        final EntityRepresentation e2 = newEntity("e2", "moon", "astronaut", "");
        final EntityRepresentation e3 = newEntity("e3", "", "wizard", "");
        final CollectionModel model = CollectionModel.create(ImmutableList.of(e1, e2, e3), 0L);
        final RankingResult result = newScorer(RankingConfig.defaultConfig()).rank(
                "moon astronaut", ImmutableList.of(e1, e2, e3), model);
        Assert.assertEquals(TextScorer.METHOD, result.getMethod());
        Assert.assertEquals(ImmutableList.of(e1.getEntity(), e2.getEntity(), e3.getEntity()),
                result.getCandidates());
        Assert.assertEquals(ImmutableList.of(e2.getEntity(), e1.getEntity(), e3.getEntity()),
                result.getRankedEntities());
    }

}
