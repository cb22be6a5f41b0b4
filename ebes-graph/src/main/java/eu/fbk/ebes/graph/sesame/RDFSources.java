package eu.fbk.ebes.graph.sesame;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.zip.GZIPInputStream;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import org.openrdf.rio.ParserConfig;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandler;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFParseException;
import org.openrdf.rio.RDFParser;
import org.openrdf.rio.Rio;
import org.openrdf.rio.helpers.BasicParserSettings;
import org.openrdf.rio.helpers.NTriplesParserSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.graph.GraphUnavailableException;
import eu.fbk.ebes.internal.Util;

/**
 * Discovery and parsing of RDF files.
 * <p>
 * The RDF format of a file is detected from its name, ignoring a trailing <tt>.gz</tt> extension
 * that denotes GZIP compression. When a directory is given, the files with one of the
 * {@link #DIRECTORY_EXTENSIONS} it directly contains are considered, sorted by name.
 * </p>
 */
public final class RDFSources {

    private static final Logger LOGGER = LoggerFactory.getLogger(RDFSources.class);

    /** Extensions of the files considered when loading a directory. */
    public static final Set<String> DIRECTORY_EXTENSIONS = ImmutableSet.of("nq", "rdf", "nt",
            "ttl", "trig");

    private static final String GZIP_EXTENSION = ".gz";

    private RDFSources() {
    }

    /**
     * Returns the RDF files denoted by a location: the file itself, or the RDF files of a
     * directory.
     *
     * @param location
     *            a file or a directory
     * @return the list of files, sorted by name in the case of a directory
     * @throws GraphUnavailableException
     *             if the location does not exist
     */
    public static List<File> list(final File location) throws GraphUnavailableException {
        if (location.isFile()) {
            return ImmutableList.of(location);
        } else if (!location.isDirectory()) {
            throw new GraphUnavailableException("No such file or directory: " + location);
        }
        return list(location, DIRECTORY_EXTENSIONS);
    }

    /**
     * Returns the files directly contained in a directory whose extension, ignoring a trailing
     * <tt>.gz</tt>, is one of the extensions specified.
     *
     * @param directory
     *            the directory to list
     * @param extensions
     *            lowercase extensions without leading dot, e.g. <tt>nq</tt>
     * @return the matching files, sorted by name
     * @throws GraphUnavailableException
     *             if the directory cannot be listed
     */
    public static List<File> list(final File directory, final Set<String> extensions)
            throws GraphUnavailableException {
        final File[] children = directory.listFiles();
        if (children == null) {
            throw new GraphUnavailableException("Cannot list directory " + directory);
        }
        Arrays.sort(children);
        final List<File> files = Lists.newArrayList();
        for (final File child : children) {
            if (child.isFile() && extensions.contains(extension(child))) {
                files.add(child);
            }
        }
        LOGGER.debug("{} files with extensions {} found in {}", files.size(), extensions,
                directory);
        return ImmutableList.copyOf(files);
    }

    /**
     * Detects the RDF format of a file based on its name.
     *
     * @param file
     *            the file
     * @return the detected format, null if unknown
     */
    @Nullable
    public static RDFFormat formatFor(final File file) {
        return RDFFormat.forFileName(stripCompression(file.getName()));
    }

    public static boolean isCompressed(final File file) {
        return file.getName().toLowerCase(Locale.ROOT).endsWith(GZIP_EXTENSION);
    }

    /**
     * Parses an RDF file, feeding its statements to the handler specified.
     *
     * @param file
     *            the file to parse
     * @param handler
     *            the handler receiving parsed statements
     * @throws GraphUnavailableException
     *             if the file cannot be read or parsed, or if the handler fails
     */
    public static void read(final File file, final RDFHandler handler)
            throws GraphUnavailableException {

        final RDFFormat format = formatFor(file);
        if (format == null) {
            throw new GraphUnavailableException("Cannot detect RDF format of " + file);
        }

        final long ts = System.currentTimeMillis();
        InputStream stream = null;
        try {
            stream = new BufferedInputStream(new FileInputStream(file));
            if (isCompressed(file)) {
                stream = new GZIPInputStream(stream);
            }
            newParser(format, handler).parse(stream, file.toURI().toString());
            LOGGER.debug("Parsed {} in {} ms", file, System.currentTimeMillis() - ts);

        } catch (final IOException | RDFParseException | RDFHandlerException ex) {
            throw new GraphUnavailableException("Parsing of " + file + " using format "
                    + format.getName() + (isCompressed(file) ? " (gzip)" : "") + " failed: "
                    + ex.getMessage(), ex);
        } finally {
            Util.closeQuietly(stream);
        }
    }

    private static RDFParser newParser(final RDFFormat format, final RDFHandler handler) {
        final RDFParser parser = Rio.createParser(format);
        final ParserConfig config = parser.getParserConfig();
        config.set(BasicParserSettings.FAIL_ON_UNKNOWN_DATATYPES, false);
        config.set(BasicParserSettings.FAIL_ON_UNKNOWN_LANGUAGES, false);
        config.set(BasicParserSettings.VERIFY_DATATYPE_VALUES, false);
        config.set(BasicParserSettings.VERIFY_LANGUAGE_TAGS, false);
        config.set(BasicParserSettings.NORMALIZE_LANGUAGE_TAGS, true);
        config.set(BasicParserSettings.PRESERVE_BNODE_IDS, false);
        if (format.equals(RDFFormat.NTRIPLES) || format.equals(RDFFormat.NQUADS)) {
            config.set(NTriplesParserSettings.FAIL_ON_NTRIPLES_INVALID_LINES, true);
        }
        parser.setRDFHandler(handler);
        return parser;
    }

    private static String stripCompression(final String name) {
        return name.toLowerCase(Locale.ROOT).endsWith(GZIP_EXTENSION) ? name.substring(0,
                name.length() - GZIP_EXTENSION.length()) : name;
    }

    private static String extension(final File file) {
        final String name = stripCompression(file.getName());
        final int index = name.lastIndexOf('.');
        return index < 0 ? "" : name.substring(index + 1).toLowerCase(Locale.ROOT);
    }

}
