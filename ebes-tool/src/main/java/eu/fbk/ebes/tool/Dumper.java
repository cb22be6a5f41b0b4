package eu.fbk.ebes.tool;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Set;

import com.google.common.collect.Sets;

import org.openrdf.model.Literal;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandler;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.Rio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.graph.GraphUnavailableException;
import eu.fbk.ebes.graph.sesame.RepositoryGraphAccess;
import eu.fbk.ebes.internal.CommandLine;

/**
 * The <tt>ebes-dump</tt> program: downloads from a SPARQL endpoint the triples of the entities
 * listed in a query file, appending them to an N-Quads file usable as a local graph.
 */
public final class Dumper {

    private static final Logger LOGGER = LoggerFactory.getLogger(Dumper.class);

    /** The named graph statements are written into. */
    public static final URI GRAPH = ValueFactoryImpl.getInstance().createURI(
            "http://dbpedia.org/");

    private Dumper() {
    }

    public static void main(final String... args) {
        try {
            final CommandLine cmd = CommandLine
                    .parser()
                    .withName("ebes-dump")
                    .withHeader("Captures the triples of the entities listed under KEY "
                            + "(default: relevant) in the query file from a remote SPARQL "
                            + "endpoint, appending them to OUTPUT in N-Quads format")
                    .withOption("e", "endpoint", "the SPARQL endpoint URL (default: "
                            + Tools.DEFAULT_ENDPOINT + ")", "URL", CommandLine.Type.STRING, true,
                            false, false)
                    .withFooter("Positional arguments: OUTPUT QUERY.yml [KEY]")
                    .withLogger(LoggerFactory.getLogger("eu.fbk.ebes")).parse(args);

            final File output = cmd.getArg(0, File.class);
            final File queryFile = cmd.getArg(1, File.class);
            final String key = cmd.getArg(2, String.class, QueryFile.KEY_RELEVANT);
            final String endpoint = cmd.getOptionValue("endpoint", String.class,
                    Tools.DEFAULT_ENDPOINT);

            if (output.exists()) {
                LOGGER.warn("File {} exists, will append to it", output);
            }
            final List<URI> entities = QueryFile.readEntities(queryFile, key);

            final RepositoryGraphAccess graph = RepositoryGraphAccess.remote(endpoint);
            try {
                graph.init();
                final OutputStream stream = new BufferedOutputStream(new FileOutputStream(output,
                        true));
                try {
                    final RDFHandler writer = Rio.createWriter(RDFFormat.NQUADS, stream);
                    writer.startRDF();
                    final long count = dump(graph, entities, writer);
                    writer.endRDF();
                    LOGGER.info("{} statements written to {}", count, output);
                } finally {
                    stream.close();
                }
            } finally {
                graph.close();
            }

        } catch (final Throwable ex) {
            CommandLine.fail(ex);
        }
    }

    /**
     * Emits, for every entity, its outlinks followed by the <tt>rdfs:label</tt> of each URI
     * object and then its inlinks, all in the {@link #GRAPH} named graph.
     *
     * @return the number of statements emitted
     */
    static long dump(final RepositoryGraphAccess graph, final List<URI> entities,
            final RDFHandler handler) throws GraphUnavailableException, RDFHandlerException {

        final ValueFactory factory = ValueFactoryImpl.getInstance();
        long count = 0;
        int index = 0;
        for (final URI entity : entities) {
            LOGGER.info("{} / {}: {}", ++index, entities.size(), entity);

            final Set<Statement> outlinks = Sets.newLinkedHashSet();
            final Set<Statement> inlinks = Sets.newLinkedHashSet();
            for (final Statement triple : graph.getTriples(entity)) {
                if (triple.getSubject().equals(entity)) {
                    outlinks.add(factory.createStatement(entity, triple.getPredicate(),
                            triple.getObject(), GRAPH));
                    if (triple.getObject() instanceof URI) {
                        final URI object = (URI) triple.getObject();
                        final Literal label = graph.getLabel(object);
                        if (label != null) {
                            outlinks.add(factory.createStatement(object, RDFS.LABEL, label,
                                    GRAPH));
                        }
                    }
                }
                if (triple.getObject().equals(entity)) {
                    inlinks.add(factory.createStatement(triple.getSubject(),
                            triple.getPredicate(), entity, GRAPH));
                }
            }

            LOGGER.debug("Saving {} triples", outlinks.size() + inlinks.size());
            for (final Statement statement : outlinks) {
                handler.handleStatement(statement);
            }
            for (final Statement statement : inlinks) {
                handler.handleStatement(statement);
            }
            count += outlinks.size() + inlinks.size();
        }
        return count;
    }

}
