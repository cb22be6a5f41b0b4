package eu.fbk.ebes.tool;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.Sets;

import org.openrdf.model.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.EntityRanker;
import eu.fbk.ebes.Ranking;
import eu.fbk.ebes.RankingQuery;
import eu.fbk.ebes.eval.EvaluationReport;
import eu.fbk.ebes.graph.GraphUnavailableException;
import eu.fbk.ebes.graph.sesame.RDFSources;
import eu.fbk.ebes.graph.sesame.RepositoryGraphAccess;
import eu.fbk.ebes.internal.CommandLine;
import eu.fbk.ebes.internal.Logging;
import eu.fbk.ebes.scoring.RankingConfig;
import eu.fbk.ebes.scoring.RankingResult;

/**
 * The <tt>ebes-evaluate</tt> program: ranks every query file of a directory against the graph
 * made of the N-Quads files of the same directory, reporting Precision, R-Precision and Average
 * Precision of each ranking method, per query and on average.
 * <p>
 * A single collection model is built over the union of the entities of all the queries, and
 * each query ranks all those entities except its own examples.
 * </p>
 */
public final class Evaluator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Evaluator.class);

    private Evaluator() {
    }

    public static void main(final String... args) {
        try {
            final CommandLine cmd = Tools.withSeedOption(Tools
                    .withConfigOptions(
                            CommandLine
                                    .parser()
                                    .withName("ebes-evaluate")
                                    .withHeader(
                                            "Evaluates the ranking methods over a directory "
                                                    + "containing triple files (.nq) and query "
                                                    + "files (.yml).")))
                    .withFooter("Positional argument: DIR")
                    .withLogger(LoggerFactory.getLogger("eu.fbk.ebes")).parse(args);

            final File dir = cmd.getArg(0, File.class);
            if (!dir.isDirectory()) {
                throw new CommandLine.Exception("Not a directory: " + dir);
            }
            final Random random = Tools.random(cmd);
            final RankingConfig config = Tools.config(cmd);

            final List<RankingQuery> queries = readQueries(dir, random);
            System.out.println("Loading graphs...");
            final RepositoryGraphAccess graph = loadGraph(dir);
            try {
                evaluate(Tools.newRanker(graph, config), queries, System.out);
            } finally {
                graph.close();
            }

        } catch (final Throwable ex) {
            CommandLine.fail(ex);
        }
    }

    static RepositoryGraphAccess loadGraph(final File dir) throws GraphUnavailableException {
        final RepositoryGraphAccess graph = RepositoryGraphAccess.local();
        try {
            graph.init();
            final List<File> files = RDFSources.list(dir, ImmutableSet.of("nq"));
            if (files.isEmpty()) {
                LOGGER.warn("No triple files (.nq) in {}", dir);
            }
            for (final File file : files) {
                graph.load(file);
            }
            return graph;
        } catch (final GraphUnavailableException ex) {
            graph.close();
            throw ex;
        }
    }

    static List<RankingQuery> readQueries(final File dir, final Random random)
            throws IOException {
        final List<RankingQuery> queries = Lists.newArrayList();
        for (final File file : RDFSources.list(dir, ImmutableSet.of("yml", "yaml"))) {
            queries.add(QueryFile.read(file).toQuery(random));
        }
        if (queries.isEmpty()) {
            throw new IOException("No query files (.yml) in " + dir);
        }
        return queries;
    }

    /**
     * Ranks and evaluates all the queries specified, printing per-query and mean results.
     *
     * @return the mean report of each ranking method, indexed by method name
     */
    static Map<String, EvaluationReport> evaluate(final EntityRanker ranker,
            final List<RankingQuery> queries, final PrintStream out)
            throws GraphUnavailableException {

        final Set<URI> entities = Sets.newLinkedHashSet();
        for (final RankingQuery query : queries) {
            entities.addAll(query.getExamples());
            entities.addAll(query.getCandidates());
        }
        ranker.rebuildCollectionModel(entities);

        final ListMultimap<String, EvaluationReport> reports = MultimapBuilder
                .linkedHashKeys().arrayListValues().build();
        for (final RankingQuery query : queries) {
            final String previousContext = Logging.setContext(query.getName());
            try {
                out.println("Stats for `" + query.getName() + "`:");
                final List<URI> candidates = Lists.newArrayList(entities);
                candidates.removeAll(query.getExamples());
                final Ranking ranking = ranker.rank(RankingQuery.builder(query.getTopic())
                        .name(query.getName()).examples(query.getExamples())
                        .candidates(candidates).relevant(query.getRelevant()).build());
                for (final RankingResult result : ranking.getResults()) {
                    final EvaluationReport report = ranker.evaluate(result, query.getRelevant());
                    out.println("  Ranking with `" + result.getMethod() + "` method: " + report);
                    reports.put(result.getMethod(), report);
                }
            } finally {
                Logging.setContext(previousContext);
            }
        }

        final Map<String, EvaluationReport> means = Maps.newLinkedHashMap();
        out.println("Mean stats:");
        for (final String method : reports.keySet()) {
            final EvaluationReport mean = EvaluationReport.mean(reports.get(method));
            out.println("  Ranking with `" + method + "` method: " + mean);
            means.put(method, mean);
        }
        return means;
    }

}
