package eu.fbk.ebes.tool;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Random;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import org.openrdf.model.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.EmptyQueryException;
import eu.fbk.ebes.EntityRanker;
import eu.fbk.ebes.RankingQuery;
import eu.fbk.ebes.graph.GraphUnavailableException;
import eu.fbk.ebes.graph.sesame.RepositoryGraphAccess;
import eu.fbk.ebes.scoring.RankingConfig;

/**
 * Interactive shell of <tt>ebes-rank</tt>.
 * <p>
 * Commands are <tt>help</tt>, <tt>load</tt>, <tt>query</tt>, <tt>sample</tt> and <tt>exit</tt>
 * (or their first letter). Failures of single commands are logged and do not terminate the
 * shell; the end of the input does.
 * </p>
 */
final class RankerShell {

    private static final Logger LOGGER = LoggerFactory.getLogger(RankerShell.class);

    private final BufferedReader in;

    private final PrintStream out;

    private final RankingConfig config;

    private final Random random;

    private RepositoryGraphAccess graph;

    private EntityRanker ranker;

    RankerShell(final BufferedReader in, final PrintStream out,
            final RepositoryGraphAccess graph, final RankingConfig config, final Random random) {
        this.in = Preconditions.checkNotNull(in);
        this.out = Preconditions.checkNotNull(out);
        this.config = Preconditions.checkNotNull(config);
        this.random = Preconditions.checkNotNull(random);
        this.graph = Preconditions.checkNotNull(graph);
        this.ranker = Tools.newRanker(graph, config);
    }

    /**
     * Returns the graph currently queried, which changes if the user switches between a SPARQL
     * endpoint and local files.
     */
    RepositoryGraphAccess getGraph() {
        return this.graph;
    }

    void run() throws IOException {
        LOGGER.info("Starting interactive shell");
        printHelp();
        try {
            while (true) {
                final String choice = prompt("> ").toLowerCase(Locale.ROOT);
                if (choice.equals("h") || choice.equals("help")) {
                    printHelp();
                } else if (choice.equals("l") || choice.equals("load")) {
                    doLoad();
                } else if (choice.equals("q") || choice.equals("query")) {
                    doQuery();
                } else if (choice.equals("s") || choice.equals("sample")) {
                    doSample();
                } else if (choice.equals("e") || choice.equals("exit")) {
                    break;
                } else {
                    this.out.println("Wrong input");
                    printHelp();
                }
            }
        } catch (final EOFException ex) {
            LOGGER.debug("End of input reached");
        }
        LOGGER.info("Interactive shell terminated");
    }

    private void printHelp() {
        this.out.println("h/help - print this help");
        this.out.println("l/load - load more triples from local files or switch to an endpoint");
        this.out.println("q/query - make query");
        this.out.println("s/sample - make query from sample file");
        this.out.println("e/exit - exit shell");
    }

    private void doLoad() throws IOException {
        final String location = prompt("Path to triples file or SPARQL endpoint url: ");
        try {
            if (Tools.isEndpoint(location)) {
                final RepositoryGraphAccess remote = Tools.openGraph(location);
                LOGGER.warn("Switching backend to remote endpoint {}", location);
                switchGraph(remote);
            } else {
                if (!this.graph.isLoadable()) {
                    LOGGER.warn("Switching backend from remote endpoint to local files");
                    final RepositoryGraphAccess local = RepositoryGraphAccess.local();
                    local.init();
                    switchGraph(local);
                }
                this.graph.load(new File(location));
            }
        } catch (final GraphUnavailableException ex) {
            LOGGER.error("Error when loading data from {}: {}", location, ex.getMessage());
        }
    }

    private void switchGraph(final RepositoryGraphAccess graph) {
        this.graph.close();
        this.graph = graph;
        this.ranker = Tools.newRanker(graph, this.config);
    }

    private void doQuery() throws IOException {

        final String topic = prompt("Relation (R), as plain text: ");

        Integer amount = null;
        while (amount == null) {
            final String line = prompt("Number of examples (integer): ");
            try {
                amount = Integer.valueOf(line);
                if (amount < 0) {
                    amount = null;
                }
            } catch (final NumberFormatException ex) {
                LOGGER.debug("Not an integer: {}", line);
            }
            if (amount == null) {
                LOGGER.error("Bad integer! Try harder.");
            }
        }

        this.out.println("Examples (X), as URIs.");
        final List<URI> examples = Lists.newArrayList();
        while (examples.size() < amount) {
            final String line = prompt("   > ");
            if (!line.isEmpty()) {
                examples.add(Tools.parseEntity(line));
            }
        }

        this.out.println("Entities to rank, as URIs. Enter (blank line) to finish:");
        final List<URI> candidates = Lists.newArrayList();
        for (String line = prompt("   > "); !line.isEmpty(); line = prompt("   > ")) {
            candidates.add(Tools.parseEntity(line));
        }

        rank(RankingQuery.builder(topic).name("shell").examples(examples)
                .candidates(candidates).build());
    }

    private void doSample() throws IOException {
        final String file = prompt("Sample file to use: ");
        try {
            rank(QueryFile.read(new File(file)).toQuery(this.random));
        } catch (final QueryFileException ex) {
            LOGGER.error(ex.getMessage());
        }
    }

    private void rank(final RankingQuery query) {
        try {
            Ranker.rank(this.ranker, query, this.out);
        } catch (final GraphUnavailableException | EmptyQueryException ex) {
            LOGGER.error("Ranking failed: {}", ex.getMessage());
        }
    }

    private String prompt(final String message) throws IOException {
        this.out.print(message);
        this.out.flush();
        final String line = this.in.readLine();
        if (line == null) {
            throw new EOFException();
        }
        return line.trim();
    }

}
