package eu.fbk.ebes.tool;

import java.io.File;
import java.util.List;
import java.util.Random;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.URI;
import org.openrdf.model.impl.URIImpl;

import eu.fbk.ebes.RankingQuery;

public class QueryFileTest {

    private static final URI ARMSTRONG = dbpedia("Neil_Armstrong");

    private static final URI ALDRIN = dbpedia("Buzz_Aldrin");

    private static final URI COLLINS = dbpedia("Michael_Collins");

    private static final URI GAGARIN = dbpedia("Yuri_Gagarin");

    private static final URI DAVIS = dbpedia("Miles_Davis");

    @Test
    public void testRead() throws Exception {
        final QueryFile file = QueryFile.read(resource("eval/apollo.yml"));
        Assert.assertEquals("apollo", file.getName());
        Assert.assertEquals("apollo astronaut", file.getTopic());
        Assert.assertEquals(Integer.valueOf(1), file.getExamples());
        Assert.assertEquals(ImmutableList.of(ARMSTRONG, ALDRIN, COLLINS), file.getRelevant());
        Assert.assertEquals(ImmutableList.of(GAGARIN, DAVIS), file.getNotRelevant());
    }

    @Test
    public void testFixedExamples() throws Exception {
        final RankingQuery query = QueryFile.read(resource("eval/apollo.yml")).toQuery(
                new Random(0));
        Assert.assertEquals("apollo", query.getName());
        Assert.assertEquals(ImmutableList.of(ARMSTRONG), query.getExamples());
        Assert.assertEquals(ImmutableList.of(ALDRIN, COLLINS, GAGARIN, DAVIS),
                query.getCandidates());
        Assert.assertEquals(ImmutableSet.of(ALDRIN, COLLINS), query.getRelevant());
    }

    @Test
    public void testRandomExamples() throws Exception {
        final QueryFile file = QueryFile.read(resource("random.yml"));
        Assert.assertNull(file.getExamples());

        final RankingQuery query = file.toQuery(new Random(42));
        Assert.assertEquals(QueryFile.DEFAULT_EXAMPLES, query.getExamples().size());
        Assert.assertEquals(2, query.getRelevant().size());
        Assert.assertEquals(3, query.getCandidates().size());
        Assert.assertTrue(file.getRelevant().containsAll(query.getExamples()));
        for (final URI example : query.getExamples()) {
            Assert.assertFalse(query.getCandidates().contains(example));
            Assert.assertFalse(query.getRelevant().contains(example));
        }
        Assert.assertTrue(query.getCandidates().contains(DAVIS));

        // same seed, same examples
        Assert.assertEquals(query.getExamples(), file.toQuery(new Random(42)).getExamples());
    }

    @Test
    public void testTooFewRelevant() throws Exception {
        final RankingQuery query = QueryFile.read(resource("too-few.yml"))
                .toQuery(new Random(0));
        Assert.assertEquals(ImmutableSet.of(ARMSTRONG, ALDRIN),
                ImmutableSet.copyOf(query.getExamples()));
        Assert.assertTrue(query.getRelevant().isEmpty());
        Assert.assertEquals(ImmutableList.of(DAVIS), query.getCandidates());
    }

    @Test
    public void testReadEntities() throws Exception {
        final List<URI> entities = QueryFile.readEntities(resource("eval/apollo.yml"),
                QueryFile.KEY_NOT_RELEVANT);
        Assert.assertEquals(ImmutableList.of(GAGARIN, DAVIS), entities);
        try {
            QueryFile.readEntities(resource("eval/apollo.yml"), "unknown");
            Assert.fail();
        } catch (final QueryFileException ex) {
            Assert.assertTrue(ex.getMessage().contains("unknown"));
        }
    }

    @Test
    public void testInvalidFiles() throws Exception {
        assertInvalid("missing-key.yml", QueryFile.KEY_NOT_RELEVANT);
        assertInvalid("bad-examples.yml", QueryFile.KEY_EXAMPLES);
        assertInvalid("empty-relevant.yml", QueryFile.KEY_RELEVANT);
        assertInvalid("not-a-map.yml", "map");
    }

    @Test
    public void testMissingFile() throws Exception {
        final File file = new File(resource("random.yml").getParentFile(), "missing.yml");
        try {
            QueryFile.read(file);
            Assert.fail();
        } catch (final QueryFileException ex) {
            Assert.assertEquals(file, ex.getFile());
        }
    }

    private static void assertInvalid(final String name, final String expectedInMessage)
            throws Exception {
        try {
            QueryFile.read(resource(name));
            Assert.fail("No exception for " + name);
        } catch (final QueryFileException ex) {
            Assert.assertTrue(ex.getMessage(), ex.getMessage().contains(expectedInMessage));
            Assert.assertTrue(ex.getMessage(), ex.getMessage().contains(name));
        }
    }

    static URI dbpedia(final String name) {
        return new URIImpl("http://dbpedia.org/resource/" + name);
    }

    static File resource(final String name) throws Exception {
        return new File(QueryFileTest.class.getResource(name).toURI());
    }

}
