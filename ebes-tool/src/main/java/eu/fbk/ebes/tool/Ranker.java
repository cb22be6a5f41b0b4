package eu.fbk.ebes.tool;

import java.io.BufferedReader;
import java.io.File;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.Random;

import com.google.common.base.Charsets;
import com.google.common.collect.Iterables;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.EntityRanker;
import eu.fbk.ebes.Ranking;
import eu.fbk.ebes.RankingQuery;
import eu.fbk.ebes.graph.GraphUnavailableException;
import eu.fbk.ebes.graph.sesame.RepositoryGraphAccess;
import eu.fbk.ebes.internal.CommandLine;
import eu.fbk.ebes.scoring.RankingConfig;
import eu.fbk.ebes.scoring.RankingResult;

/**
 * The <tt>ebes-rank</tt> program: ranks the entities of a query file and/or runs an interactive
 * shell over a graph given as an RDF file, a directory of RDF files or a SPARQL endpoint URL.
 */
public final class Ranker {

    private static final Logger LOGGER = LoggerFactory.getLogger(Ranker.class);

    private Ranker() {
    }

    public static void main(final String... args) {
        try {
            final CommandLine cmd = Tools.withSeedOption(Tools
                    .withConfigOptions(
                            CommandLine
                                    .parser()
                                    .withName("ebes-rank")
                                    .withHeader(
                                            "Ranks entities based on a query made of a plain text "
                                                    + "relation and example entities. GRAPH is "
                                                    + "an RDF file, a directory of RDF files or "
                                                    + "the URL of a SPARQL endpoint."))
                    .withOption("s", "sample", "rank the entities of query FILE (YAML with "
                            + "keys topic, relevant, not_relevant)", "FILE",
                            CommandLine.Type.FILE_EXISTING, true, false, false)
                    .withOption(null, "shell", "run the interactive shell"))
                    .withFooter("Positional argument: GRAPH")
                    .withLogger(LoggerFactory.getLogger("eu.fbk.ebes")).parse(args);

            final String location = cmd.getArg(0, String.class);
            final File sampleFile = cmd.getOptionValue("sample", File.class);
            final boolean shell = cmd.hasOption("shell");
            final Random random = Tools.random(cmd);
            final RankingConfig config = Tools.config(cmd);

            RepositoryGraphAccess graph = Tools.openGraph(location);
            try {
                if (sampleFile != null) {
                    final RankingQuery query = QueryFile.read(sampleFile).toQuery(random);
                    rank(Tools.newRanker(graph, config), query, System.out);
                }
                if (shell) {
                    final RankerShell rankerShell = new RankerShell(new BufferedReader(
                            new InputStreamReader(System.in, Charsets.UTF_8)), System.out,
                            graph, config, random);
                    rankerShell.run();
                    graph = rankerShell.getGraph();
                }
            } finally {
                graph.close();
            }

        } catch (final Throwable ex) {
            CommandLine.fail(ex);
        }
    }

    /**
     * Ranks the candidates of a query, after building the collection model over candidates and
     * examples, and prints the text-based, example-based and combined rankings.
     */
    static Ranking rank(final EntityRanker ranker, final RankingQuery query,
            final PrintStream out) throws GraphUnavailableException {
        LOGGER.info("Ranking {}", query);
        ranker.rebuildCollectionModel(Iterables.concat(query.getCandidates(),
                query.getExamples()));
        final Ranking ranking = ranker.rank(query);
        for (final RankingResult result : ranking.getResults()) {
            Tools.printRanking(out, result, query.getRelevant());
        }
        return ranking;
    }

}
