package eu.fbk.ebes.tool;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

import org.openrdf.model.URI;
import org.openrdf.model.impl.URIImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.EntityRanker;
import eu.fbk.ebes.graph.GraphAccess;
import eu.fbk.ebes.graph.GraphUnavailableException;
import eu.fbk.ebes.graph.LoggingGraphAccess;
import eu.fbk.ebes.graph.sesame.RepositoryGraphAccess;
import eu.fbk.ebes.internal.CommandLine;
import eu.fbk.ebes.internal.Util;
import eu.fbk.ebes.scoring.Aggregation;
import eu.fbk.ebes.scoring.Background;
import eu.fbk.ebes.scoring.RankingConfig;
import eu.fbk.ebes.scoring.RankingResult;

/**
 * Helpers shared by the command line programs.
 */
final class Tools {

    private static final Logger LOGGER = LoggerFactory.getLogger(Tools.class);

    /** Prefix prepended to entity names that are not absolute URIs. */
    static final String ENTITY_PREFIX = "http://dbpedia.org/resource/";

    static final String DEFAULT_ENDPOINT = "http://dbpedia.org/sparql";

    private Tools() {
    }

    /**
     * Adds the options controlling the ranking configuration to a command line parser.
     */
    static CommandLine.Parser withConfigOptions(final CommandLine.Parser parser) {
        return parser
                .withOption("c", "config", "read configuration properties from FILE", "FILE",
                        CommandLine.Type.FILE_EXISTING, true, false, false)
                .withOption(null, "mu", "Dirichlet smoothing parameter (default: number of "
                        + "entities)", "NUM", CommandLine.Type.POSITIVE_FLOAT, true, false, false)
                .withOption(null, "weights", "field weights for attributes, types and links "
                        + "(default: 0.4,0.4,0.2)", "A,T,L", CommandLine.Type.STRING, true, false,
                        false)
                .withOption(null, "alpha", "weight of the text score in the combined ranking "
                        + "(default: 0.5)", "NUM", CommandLine.Type.NON_NEGATIVE_FLOAT, true,
                        false, false)
                .withOption(null, "jaccard", "use Jaccard similarity for examples")
                .withOption(null, "aggregation", "aggregation of example scores: sum, max or "
                        + "mean (default: sum)", "NAME", CommandLine.Type.STRING, true, false,
                        false)
                .withOption(null, "background", "background model: uniform or collection "
                        + "(default: uniform)", "NAME", CommandLine.Type.STRING, true, false,
                        false)
                .withOption(null, "precision", "decimal digits of score arithmetic (default: "
                        + "64)", "NUM", CommandLine.Type.POSITIVE_INTEGER, true, false, false)
                .withOption(null, "stopwords", "remove English stopwords from text");
    }

    static CommandLine.Parser withSeedOption(final CommandLine.Parser parser) {
        return parser.withOption(null, "seed", "seed for drawing random examples (default: 0)",
                "NUM", CommandLine.Type.INTEGER, true, false, false);
    }

    /**
     * Returns the random generator seeded with the <tt>--seed</tt> option, 0 if missing.
     */
    static Random random(final CommandLine cmd) {
        return new Random(cmd.getOptionValue("seed", Long.class, 0L));
    }

    /**
     * Builds the ranking configuration from the properties file and the options specified on
     * the command line, the latter taking precedence.
     *
     * @throws CommandLine.Exception
     *             if the resulting configuration is invalid
     */
    static RankingConfig config(final CommandLine cmd) throws IOException {

        final File file = cmd.getOptionValue("config", File.class);
        RankingConfig config = RankingConfig.defaultConfig();
        try {
            if (file != null) {
                config = RankingConfig.fromProperties(Util.loadProperties(file
                        .getAbsolutePath()));
            }

            final RankingConfig.Builder builder = config.toBuilder();
            if (cmd.hasOption("mu")) {
                builder.mu(cmd.getOptionValue("mu", Double.class));
            }
            if (cmd.hasOption("weights")) {
                final List<Double> weights = parseWeights(cmd.getOptionValue("weights",
                        String.class, ""));
                if (weights.size() != 3) {
                    throw new CommandLine.Exception("Expected three comma-separated weights");
                }
                builder.weights(weights.get(0), weights.get(1), weights.get(2));
            }
            if (cmd.hasOption("alpha")) {
                builder.alpha(cmd.getOptionValue("alpha", Double.class));
            }
            if (cmd.hasOption("jaccard")) {
                builder.jaccard(true);
            }
            if (cmd.hasOption("aggregation")) {
                builder.aggregation(cmd.getOptionValue("aggregation", Aggregation.class));
            }
            if (cmd.hasOption("background")) {
                builder.background(cmd.getOptionValue("background", Background.class));
            }
            if (cmd.hasOption("precision")) {
                builder.precision(cmd.getOptionValue("precision", Integer.class));
            }
            if (cmd.hasOption("stopwords")) {
                builder.stopwords(true);
            }
            config = builder.build();

        } catch (final IllegalArgumentException ex) {
            throw new CommandLine.Exception(ex.getMessage(), ex);
        }

        LOGGER.info("Using {}", config);
        return config;
    }

    private static List<Double> parseWeights(final String string) {
        final List<Double> weights = Lists.newArrayList();
        for (final String token : Splitter.on(',').trimResults().split(string)) {
            try {
                weights.add(Double.valueOf(token));
            } catch (final NumberFormatException ex) {
                throw new CommandLine.Exception("Invalid weight '" + token + "'", ex);
            }
        }
        return weights;
    }

    /**
     * Opens the graph denoted by a location: a SPARQL endpoint if the location is an HTTP(S) URL,
     * otherwise an RDF file or directory loaded in memory.
     */
    static RepositoryGraphAccess openGraph(final String location) throws IOException {
        final RepositoryGraphAccess graph;
        if (isEndpoint(location)) {
            LOGGER.info("Using remote graph from SPARQL endpoint {}", location);
            graph = RepositoryGraphAccess.remote(location);
            graph.init();
        } else {
            graph = RepositoryGraphAccess.local();
            try {
                graph.init();
                graph.load(new File(location));
            } catch (final GraphUnavailableException ex) {
                graph.close();
                throw ex;
            }
        }
        return graph;
    }

    /**
     * Creates a ranker over the graph specified, with entity lookups logged at DEBUG level.
     */
    static EntityRanker newRanker(final GraphAccess graph, final RankingConfig config) {
        return new EntityRanker(new LoggingGraphAccess(graph), config);
    }

    static boolean isEndpoint(final String location) {
        final String lower = location.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    /**
     * Parses an entity typed by the user: enclosing angle brackets are removed and names that
     * are not HTTP URIs are resolved against {@link #ENTITY_PREFIX}.
     */
    static URI parseEntity(final String string) {
        String name = string.trim();
        if (name.startsWith("<") && name.endsWith(">")) {
            name = name.substring(1, name.length() - 1);
            LOGGER.warn("Entity enclosed in <>, trimming to {}", name);
        }
        if (!name.startsWith("http")) {
            name = ENTITY_PREFIX + name;
            LOGGER.warn("Entity not an URI, prepending {}", ENTITY_PREFIX);
        }
        return new URIImpl(name);
    }

    /**
     * Prints a ranking, marking relevant entries with <tt>OK</tt> and the other ones with
     * <tt>NO</tt> if the relevant entities are known.
     */
    static void printRanking(final PrintStream out, final RankingResult result,
            @Nullable final Set<URI> relevant) {
        out.println("------------------------------");
        out.println("Ranking - " + result.getMethod() + ":");
        for (final RankingResult.Entry entry : result.getEntries()) {
            final String mark = relevant == null || relevant.isEmpty() ? "" : relevant
                    .contains(entry.getEntity()) ? " OK" : " NO";
            out.println(mark + " " + entry.getEntity() + " - " + entry.getScore().toPlainString());
        }
    }

}
