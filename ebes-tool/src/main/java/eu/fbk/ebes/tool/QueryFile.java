package eu.fbk.ebes.tool;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.Set;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.google.common.io.Files;

import org.openrdf.model.URI;
import org.openrdf.model.impl.URIImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.RankingQuery;

/**
 * A query read from a YAML file.
 * <p>
 * A query file is a YAML map with the following keys:
 * </p>
 * <ul>
 * <li><tt>topic</tt> (required) - the query text;</li>
 * <li><tt>relevant</tt> (required, non-empty) - URIs of the entities relevant for the topic;</li>
 * <li><tt>not_relevant</tt> (required) - URIs of other entities to be ranked;</li>
 * <li><tt>examples</tt> (optional) - the number N of examples; if given, the first N relevant
 * entities are used as examples, otherwise {@link #DEFAULT_EXAMPLES} examples are drawn at random
 * among relevant entities.</li>
 * </ul>
 * <p>
 * Examples are removed from both the entities to rank and the relevant entities of the resulting
 * {@link RankingQuery}.
 * </p>
 */
public final class QueryFile {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryFile.class);

    public static final String KEY_TOPIC = "topic";

    public static final String KEY_RELEVANT = "relevant";

    public static final String KEY_NOT_RELEVANT = "not_relevant";

    public static final String KEY_EXAMPLES = "examples";

    public static final int DEFAULT_EXAMPLES = 4;

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());

    private final File file;

    private final String topic;

    private final List<URI> relevant;

    private final List<URI> notRelevant;

    @Nullable
    private final Integer examples;

    private QueryFile(final File file, final String topic, final List<URI> relevant,
            final List<URI> notRelevant, @Nullable final Integer examples) {
        this.file = file;
        this.topic = topic;
        this.relevant = relevant;
        this.notRelevant = notRelevant;
        this.examples = examples;
    }

    /**
     * Reads and validates a query file.
     *
     * @param file
     *            the YAML file
     * @return the parsed query file
     * @throws QueryFileException
     *             if the file cannot be read or some key is missing or invalid
     */
    public static QueryFile read(final File file) throws QueryFileException {

        final JsonNode root = parse(file);
        final JsonNode topicNode = root.path(KEY_TOPIC);
        if (!topicNode.isValueNode() || topicNode.isNull()) {
            throw new QueryFileException(file, "missing or invalid key '" + KEY_TOPIC + "'");
        }
        final String topic = topicNode.asText();

        final List<URI> relevant = getEntities(file, root, KEY_RELEVANT);
        final List<URI> notRelevant = getEntities(file, root, KEY_NOT_RELEVANT);
        if (relevant.isEmpty()) {
            throw new QueryFileException(file, "no entities under key '" + KEY_RELEVANT + "'");
        }

        Integer examples = null;
        final JsonNode examplesNode = root.get(KEY_EXAMPLES);
        if (examplesNode != null && !examplesNode.isNull()) {
            if (!examplesNode.isIntegralNumber() || !examplesNode.canConvertToInt()
                    || examplesNode.asInt() < 0) {
                throw new QueryFileException(file, "key '" + KEY_EXAMPLES
                        + "' must be a non-negative integer, got '" + examplesNode.asText() + "'");
            }
            examples = examplesNode.asInt();
        }

        LOGGER.debug("Read {}: {} relevant, {} not relevant, examples: {}", file,
                relevant.size(), notRelevant.size(), examples == null ? "random" : examples);
        return new QueryFile(file, topic, relevant, notRelevant, examples);
    }

    /**
     * Reads the list of entity URIs under an arbitrary key of a query file.
     *
     * @param file
     *            the YAML file
     * @param key
     *            the key, e.g., {@code relevant}
     * @return the entities listed under the key
     * @throws QueryFileException
     *             if the file cannot be read, or the key is missing or not a list of URIs
     */
    public static List<URI> readEntities(final File file, final String key)
            throws QueryFileException {
        return getEntities(file, parse(file), key);
    }

    private static JsonNode parse(final File file) throws QueryFileException {
        final JsonNode root;
        try {
            root = MAPPER.readTree(file);
        } catch (final IOException ex) {
            throw new QueryFileException(file, ex.getMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new QueryFileException(file, "query data must be a map");
        }
        return root;
    }

    private static List<URI> getEntities(final File file, final JsonNode root, final String key)
            throws QueryFileException {
        final JsonNode node = root.get(key);
        if (node == null) {
            throw new QueryFileException(file, "key '" + key + "' not found");
        } else if (node.isNull()) {
            return ImmutableList.of();
        } else if (!node.isArray()) {
            throw new QueryFileException(file, "key '" + key + "' must be a list of URIs");
        }
        final List<URI> entities = Lists.newArrayList();
        for (final Iterator<JsonNode> i = node.elements(); i.hasNext();) {
            final JsonNode element = i.next();
            try {
                Preconditions.checkArgument(element.isTextual());
                entities.add(new URIImpl(element.asText().trim()));
            } catch (final IllegalArgumentException ex) {
                throw new QueryFileException(file, "invalid URI '" + element.asText()
                        + "' under key '" + key + "'", ex);
            }
        }
        return ImmutableList.copyOf(entities);
    }

    public File getFile() {
        return this.file;
    }

    /**
     * Returns the name of the query, i.e., the file name without extension.
     *
     * @return the query name
     */
    public String getName() {
        return Files.getNameWithoutExtension(this.file.getName());
    }

    public String getTopic() {
        return this.topic;
    }

    public List<URI> getRelevant() {
        return this.relevant;
    }

    public List<URI> getNotRelevant() {
        return this.notRelevant;
    }

    @Nullable
    public Integer getExamples() {
        return this.examples;
    }

    /**
     * Creates the {@code RankingQuery} described by this file, selecting the examples among the
     * relevant entities.
     *
     * @param random
     *            the random generator used to draw examples, when their number is not given
     * @return the created query
     */
    public RankingQuery toQuery(final Random random) {

        final int amount = MoreObjects.firstNonNull(this.examples, DEFAULT_EXAMPLES);
        if (this.relevant.size() <= amount) {
            LOGGER.warn("Only {} relevant entities in {}, trimming the amount of examples",
                    this.relevant.size(), this.file);
        }

        final List<URI> pool = Lists.newArrayList(this.relevant);
        if (this.examples == null) {
            Collections.shuffle(pool, random);
        }
        final List<URI> examples = ImmutableList.copyOf(pool.subList(0,
                Math.min(amount, pool.size())));

        final Set<URI> excluded = Sets.newHashSet(examples);
        final List<URI> relevant = Lists.newArrayList();
        for (final URI entity : this.relevant) {
            if (!excluded.contains(entity)) {
                relevant.add(entity);
            }
        }
        final List<URI> candidates = Lists.newArrayList(relevant);
        for (final URI entity : this.notRelevant) {
            if (!excluded.contains(entity)) {
                candidates.add(entity);
            }
        }

        return RankingQuery.builder(this.topic).name(getName()).examples(examples)
                .candidates(candidates).relevant(relevant).build();
    }

    @Override
    public String toString() {
        return "QueryFile(" + this.file + ")";
    }

}
