package eu.fbk.ebes;

import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.openrdf.model.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.eval.EvaluationReport;
import eu.fbk.ebes.eval.RankingEvaluator;
import eu.fbk.ebes.graph.GraphAccess;
import eu.fbk.ebes.graph.GraphUnavailableException;
import eu.fbk.ebes.model.CollectionModel;
import eu.fbk.ebes.model.EntityRepresentation;
import eu.fbk.ebes.model.RepresentationBuilder;
import eu.fbk.ebes.model.Tokenizer;
import eu.fbk.ebes.scoring.ExampleScorer;
import eu.fbk.ebes.scoring.RankingConfig;
import eu.fbk.ebes.scoring.RankingResult;
import eu.fbk.ebes.scoring.ScoreCombiner;
import eu.fbk.ebes.scoring.TextScorer;

/**
 * Entry point of the ranking engine.
 * <p>
 * An <tt>EntityRanker</tt> wires together the components of the engine on top of a
 * {@link GraphAccess} and a {@link RankingConfig}. Besides exposing each component operation
 * individually, it keeps the current {@link CollectionModel}: the model is built or replaced
 * explicitly via {@link #rebuildCollectionModel(Iterable)} and swapped atomically, so that
 * concurrent callers always see a complete model. Rankings computed against a model whose
 * generation differs from the current generation of the graph are rejected with an
 * {@link IllegalStateException}: after loading new data, the model has to be rebuilt.
 * </p>
 * <p>
 * Each ranking is computed synchronously in the calling thread. Failures of the graph backend
 * are propagated as {@link GraphUnavailableException}s and abort the ranking in progress.
 * </p>
 */
public final class EntityRanker {

    private static final Logger LOGGER = LoggerFactory.getLogger(EntityRanker.class);

    private final GraphAccess graph;

    private final RankingConfig config;

    private final RepresentationBuilder builder;

    private final TextScorer textScorer;

    private final ExampleScorer exampleScorer;

    private final ScoreCombiner combiner;

    private final RankingEvaluator evaluator;

    @Nullable
    private volatile CollectionModel model;

    public EntityRanker(final GraphAccess graph, final RankingConfig config) {
        this.graph = Preconditions.checkNotNull(graph);
        this.config = Preconditions.checkNotNull(config);
        final Tokenizer tokenizer = config.isStopwords() ? Tokenizer
                .create(Tokenizer.ENGLISH_STOPWORDS) : Tokenizer.DEFAULT;
        this.builder = new RepresentationBuilder(graph, tokenizer);
        this.textScorer = new TextScorer(config, tokenizer);
        this.exampleScorer = new ExampleScorer(config);
        this.combiner = new ScoreCombiner(config);
        this.evaluator = new RankingEvaluator();
        this.model = null;
        LOGGER.debug("{} created", this);
    }

    public GraphAccess getGraph() {
        return this.graph;
    }

    public RankingConfig getConfig() {
        return this.config;
    }

    public EntityRepresentation buildRepresentation(final URI entity)
            throws GraphUnavailableException {
        return this.builder.build(entity);
    }

    /**
     * Computes a collection model over the entities specified, without installing it.
     *
     * @param entities
     *            the entities of the collection
     * @return the computed model
     * @throws GraphUnavailableException
     *             if the graph cannot be accessed
     */
    public CollectionModel buildCollectionModel(final Iterable<URI> entities)
            throws GraphUnavailableException {
        return CollectionModel.build(entities, this.builder);
    }

    /**
     * Computes a collection model over the entities specified and makes it the current model,
     * replacing the previous one.
     *
     * @param entities
     *            the entities of the collection
     * @return the new current model
     * @throws GraphUnavailableException
     *             if the graph cannot be accessed; the previous model is retained in this case
     */
    public CollectionModel rebuildCollectionModel(final Iterable<URI> entities)
            throws GraphUnavailableException {
        final CollectionModel model = buildCollectionModel(entities);
        this.model = model;
        LOGGER.info("Collection model replaced: {}", model);
        return model;
    }

    /**
     * Returns the current collection model.
     *
     * @return the current model, null if none has been built yet
     */
    @Nullable
    public CollectionModel getCollectionModel() {
        return this.model;
    }

    public RankingResult scoreText(final String text, final List<EntityRepresentation> candidates,
            final CollectionModel model) {
        checkCurrent(model);
        return this.textScorer.rank(text, candidates, model);
    }

    public RankingResult scoreExamples(final List<EntityRepresentation> examples,
            final List<EntityRepresentation> candidates) {
        return this.exampleScorer.rank(examples, candidates);
    }

    public RankingResult combine(final RankingResult text, final RankingResult example,
            final double alpha) {
        return this.combiner.combine(text, example, alpha);
    }

    public EvaluationReport evaluate(final RankingResult result, final Set<URI> relevant) {
        return this.evaluator.evaluate(result, relevant);
    }

    /**
     * Ranks the candidates of a query with the text-based, example-based and combined methods,
     * using the current collection model.
     *
     * @param query
     *            the query
     * @return the computed ranking
     * @throws GraphUnavailableException
     *             if the graph cannot be accessed
     * @throws EmptyQueryException
     *             if the query has neither text terms nor examples
     * @throws IllegalStateException
     *             if there is no current collection model or it is stale
     */
    public Ranking rank(final RankingQuery query) throws GraphUnavailableException {

        final List<String> terms = this.textScorer.getTokenizer().tokenize(query.getTopic());
        if (terms.isEmpty() && query.getExamples().isEmpty()) {
            throw new EmptyQueryException("No query terms and no examples in " + query);
        }

        final CollectionModel model = this.model;
        if (model == null) {
            throw new IllegalStateException("No collection model available: build it first");
        }
        checkCurrent(model);

        LOGGER.info("Ranking {} candidates for '{}' with {} examples",
                query.getCandidates().size(), query.getTopic(), query.getExamples().size());
        final long ts = System.currentTimeMillis();

        final List<EntityRepresentation> candidates = this.builder.build(query.getCandidates());
        final List<EntityRepresentation> examples = this.builder.build(query.getExamples());

        final RankingResult text = this.textScorer.rank(terms, candidates, model);
        final RankingResult example = this.exampleScorer.rank(examples, candidates);
        final RankingResult combined = this.combiner.combine(text, example,
                this.config.getAlpha());

        LOGGER.info("Ranking completed in {} ms", System.currentTimeMillis() - ts);
        return new Ranking(query, text, example, combined);
    }

    private void checkCurrent(final CollectionModel model) {
        final long generation = this.graph.getGeneration();
        if (model.getGeneration() != generation) {
            throw new IllegalStateException("Stale collection model (generation "
                    + model.getGeneration() + ", graph generation " + generation
                    + "): rebuild it after loading new data");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.graph + ", " + this.config + ")";
    }

}
