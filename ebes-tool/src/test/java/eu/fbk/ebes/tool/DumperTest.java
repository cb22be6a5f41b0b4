package eu.fbk.ebes.tool;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.Statement;
import org.openrdf.model.impl.LiteralImpl;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.rio.helpers.StatementCollector;

import eu.fbk.ebes.graph.sesame.RepositoryGraphAccess;

public class DumperTest {

    private RepositoryGraphAccess graph;

    @Before
    public void setUp() throws Exception {
        this.graph = RepositoryGraphAccess.local();
        this.graph.init();
        this.graph.load(QueryFileTest.resource("eval/astronauts.nq"));
    }

    @After
    public void tearDown() {
        this.graph.close();
    }

    @Test
    public void testDump() throws Exception {
        final StatementCollector collector = new StatementCollector();
        final long count = Dumper.dump(this.graph, ImmutableList.of(
                QueryFileTest.dbpedia("Neil_Armstrong"), QueryFileTest.dbpedia("Miles_Davis")),
                collector);

        final List<Statement> statements = Lists.newArrayList(collector.getStatements());
        Assert.assertEquals(7L, count);
        Assert.assertEquals(7, statements.size());
        for (final Statement statement : statements) {
            Assert.assertEquals(Dumper.GRAPH, statement.getContext());
        }

        // label of the mission follows the outlink to it
        Assert.assertEquals(QueryFileTest.dbpedia("Apollo_11"), statements.get(1).getObject());
        Assert.assertEquals(QueryFileTest.dbpedia("Apollo_11"), statements.get(2).getSubject());
        Assert.assertEquals(RDFS.LABEL, statements.get(2).getPredicate());
        Assert.assertEquals(new LiteralImpl("Apollo 11", "en"), statements.get(2).getObject());
    }

    @Test
    public void testDumpInlinks() throws Exception {
        final StatementCollector collector = new StatementCollector();
        Dumper.dump(this.graph, ImmutableList.of(QueryFileTest.dbpedia("Trumpet")), collector);

        final List<Statement> statements = Lists.newArrayList(collector.getStatements());
        Assert.assertEquals(2, statements.size());
        for (final Statement statement : statements) {
            Assert.assertEquals(QueryFileTest.dbpedia("Trumpet"), statement.getObject());
        }
    }

}
