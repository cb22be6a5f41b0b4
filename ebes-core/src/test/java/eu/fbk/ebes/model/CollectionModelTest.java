package eu.fbk.ebes.model;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.vocabulary.RDF;

import eu.fbk.ebes.graph.GraphUnavailableException;
import eu.fbk.ebes.graph.MemoryGraph;

public class CollectionModelTest {

    private static MemoryGraph newGraph() {
        final MemoryGraph graph = new MemoryGraph();
        graph.add(MemoryGraph.uri("e1"), RDF.TYPE, MemoryGraph.uri("Astronaut"));
        graph.addLiteral("e1", "note", "moon moon");
        graph.add(MemoryGraph.uri("e2"), RDF.TYPE, MemoryGraph.uri("Wizard"));
        graph.addLiteral("e2", "note", "moon");
        return graph;
    }

    @Test
    public void testBuild() throws Throwable {
        final MemoryGraph graph = newGraph();
        final RepresentationBuilder builder = new RepresentationBuilder(graph, Tokenizer.DEFAULT);
        final CollectionModel model = CollectionModel.build(ImmutableList.of(
                MemoryGraph.uri("e1"), MemoryGraph.uri("e2"), MemoryGraph.uri("e1")), builder);

        Assert.assertEquals(2, model.getEntityCount());
        Assert.assertEquals(3, model.getTermCount(Field.ATTRIBUTES, "moon"));
        Assert.assertEquals(3L, model.getTotalTerms(Field.ATTRIBUTES));
        Assert.assertEquals(1, model.getTermCount(Field.TYPES, "wizard"));
        Assert.assertEquals(2L, model.getTotalTerms(Field.TYPES));
        Assert.assertEquals(0L, model.getTotalTerms(Field.LINKS));
        Assert.assertEquals(0, model.getTermCount(Field.LINKS, "moon"));
        Assert.assertEquals(graph.getGeneration(), model.getGeneration());
        Assert.assertTrue(model.isCurrent(graph));

        graph.addLiteral("e3", "note", "new data");
        Assert.assertFalse(model.isCurrent(graph));
    }

    @Test
    public void testCreate() throws Throwable {
        final RepresentationBuilder builder = new RepresentationBuilder(newGraph(),
                Tokenizer.DEFAULT);
        final EntityRepresentation e1 = builder.build(MemoryGraph.uri("e1"));
        final CollectionModel model = CollectionModel.create(ImmutableList.of(e1, e1,
                EntityRepresentation.empty(MemoryGraph.uri("e9"))), 7L);
        Assert.assertEquals(2, model.getEntityCount());
        Assert.assertEquals(2, model.getTermCount(Field.ATTRIBUTES, "moon"));
        Assert.assertEquals(7L, model.getGeneration());
    }

    @Test
    public void testUnavailableGraph() {
        final MemoryGraph graph = newGraph();
        graph.setUnavailable(true);
        try {
            CollectionModel.build(ImmutableList.of(MemoryGraph.uri("e1")),
                    new RepresentationBuilder(graph, Tokenizer.DEFAULT));
            Assert.fail();
        } catch (final GraphUnavailableException ex) {
            // expected
        }
    }

}
