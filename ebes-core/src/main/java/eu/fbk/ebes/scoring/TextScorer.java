package eu.fbk.ebes.scoring;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.openrdf.model.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ebes.model.CollectionModel;
import eu.fbk.ebes.model.EntityRepresentation;
import eu.fbk.ebes.model.Field;
import eu.fbk.ebes.model.Tokenizer;

/**
 * Scores entities against a text relation using a mixture of Dirichlet-smoothed field language
 * models.
 * <p>
 * For a term <tt>t</tt> and a field <tt>f</tt> of entity <tt>e</tt>, the smoothed probability is
 * <tt>P(t|f,e) = (tf(t,f,e) + mu * Pc) / (|e|_f + mu)</tt>, where <tt>Pc</tt> is the background
 * probability selected by {@link RankingConfig#getBackground()} and <tt>mu</tt> defaults to the
 * number of entities <tt>ni</tt> of the collection model. The per-term probability is the
 * weighted sum of the field probabilities, and the score of the entity is the product of the
 * per-term probabilities over all the query terms (duplicates included). Computation is done with
 * {@link BigDecimal}s using the configured {@link MathContext}, as products over long queries
 * would otherwise underflow or collapse distinct entities onto the same value.
 * </p>
 * <p>
 * The uniform background <tt>1 / ni</tt> does not depend on the term: it is a deliberate
 * simplification that keeps scores comparable with those produced by earlier versions of the
 * engine.
 * </p>
 */
public final class TextScorer {

    public static final String METHOD = "text";

    private static final Logger LOGGER = LoggerFactory.getLogger(TextScorer.class);

    private final RankingConfig config;

    private final Tokenizer tokenizer;

    private final MathContext mc;

    private final Map<Field, BigDecimal> weights;

    public TextScorer(final RankingConfig config, final Tokenizer tokenizer) {
        this.config = Preconditions.checkNotNull(config);
        this.tokenizer = Preconditions.checkNotNull(tokenizer);
        this.mc = config.getMathContext();
        this.weights = Maps.newEnumMap(Field.class);
        this.weights.put(Field.ATTRIBUTES, BigDecimal.valueOf(config.getWeightAttributes()));
        this.weights.put(Field.TYPES, BigDecimal.valueOf(config.getWeightTypes()));
        this.weights.put(Field.LINKS, BigDecimal.valueOf(config.getWeightLinks()));
    }

    public RankingConfig getConfig() {
        return this.config;
    }

    public Tokenizer getTokenizer() {
        return this.tokenizer;
    }

    /**
     * Ranks the candidates specified against a text relation.
     *
     * @param text
     *            the text relation, tokenized with the tokenizer of this scorer
     * @param candidates
     *            the candidate representations, in input order
     * @param model
     *            the collection model
     * @return the ranking result
     * @throws IllegalStateException
     *             if the collection model contains no entities
     */
    public RankingResult rank(final String text, final List<EntityRepresentation> candidates,
            final CollectionModel model) {
        return rank(this.tokenizer.tokenize(text), candidates, model);
    }

    /**
     * Ranks the candidates specified against a list of already tokenized query terms.
     *
     * @param terms
     *            the query terms; an empty list gives score 1 to every candidate
     * @param candidates
     *            the candidate representations, in input order
     * @param model
     *            the collection model
     * @return the ranking result
     */
    public RankingResult rank(final List<String> terms,
            final List<EntityRepresentation> candidates, final CollectionModel model) {

        LOGGER.info("Text-based scoring of {} candidates for terms {}", candidates.size(), terms);
        final long ts = System.currentTimeMillis();

        final List<URI> entities = Lists.newArrayListWithCapacity(candidates.size());
        final Map<URI, BigDecimal> scores = Maps.newHashMap();
        final Progress progress = new Progress(LOGGER, "text-based", candidates.size());
        for (final EntityRepresentation candidate : candidates) {
            entities.add(candidate.getEntity());
            if (!scores.containsKey(candidate.getEntity())) {
                scores.put(candidate.getEntity(), score(terms, candidate, model));
            }
            progress.increment();
        }

        LOGGER.info("Text-based scoring completed in {} ms", System.currentTimeMillis() - ts);
        return RankingResult.create(METHOD, entities, scores);
    }

    /**
     * Computes the score of a single entity, i.e., the product of the mixture probabilities of
     * the query terms.
     *
     * @param terms
     *            the query terms
     * @param entity
     *            the entity representation
     * @param model
     *            the collection model
     * @return the score, in (0, 1]
     */
    public BigDecimal score(final List<String> terms, final EntityRepresentation entity,
            final CollectionModel model) {
        checkModel(model);
        BigDecimal score = BigDecimal.ONE;
        for (final String term : terms) {
            score = score.multiply(termProbability(term, entity, model), this.mc);
        }
        LOGGER.debug("Text score of {}: {}", entity.getEntity(), score);
        return score;
    }

    /**
     * Computes the mixture probability <tt>sum_f w_f * P(t|f,e)</tt> of a term.
     *
     * @param term
     *            the term
     * @param entity
     *            the entity representation
     * @param model
     *            the collection model
     * @return the mixture probability
     */
    public BigDecimal termProbability(final String term, final EntityRepresentation entity,
            final CollectionModel model) {
        checkModel(model);
        BigDecimal result = BigDecimal.ZERO;
        for (final Field field : Field.values()) {
            final BigDecimal probability = fieldProbability(term, field, entity, model);
            result = result.add(this.weights.get(field).multiply(probability, this.mc), this.mc);
        }
        LOGGER.debug("  P({}|{}) = {}", term, entity.getEntity(), result);
        return result;
    }

    /**
     * Computes the smoothed probability <tt>P(t|f,e)</tt> of a term in a field.
     *
     * @param term
     *            the term
     * @param field
     *            the field
     * @param entity
     *            the entity representation
     * @param model
     *            the collection model
     * @return the smoothed probability
     */
    public BigDecimal fieldProbability(final String term, final Field field,
            final EntityRepresentation entity, final CollectionModel model) {
        checkModel(model);
        final BigDecimal ni = BigDecimal.valueOf(model.getEntityCount());
        final BigDecimal mu = this.config.getMu() == null ? ni : BigDecimal.valueOf(this.config
                .getMu());

        // mu * Pc, computed as a single ratio to limit rounding
        BigDecimal smoothing = null;
        if (this.config.getBackground() == Background.COLLECTION) {
            final long count = model.getTermCount(field, term);
            final long total = model.getTotalTerms(field);
            if (count > 0 && total > 0) {
                smoothing = mu.multiply(BigDecimal.valueOf(count)).divide(
                        BigDecimal.valueOf(total), this.mc);
            }
        }
        if (smoothing == null) {
            smoothing = mu.divide(ni, this.mc);
        }

        final BigDecimal tf = BigDecimal.valueOf(entity.getTermCount(field, term));
        final BigDecimal length = BigDecimal.valueOf(entity.getLength(field));
        final BigDecimal probability = tf.add(smoothing).divide(length.add(mu), this.mc);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("    P({}|{},{}) = ({} + {}) / ({} + {}) = {}", term, field,
                    entity.getEntity(), tf, smoothing, length, mu, probability);
        }
        return probability;
    }

    private static void checkModel(final CollectionModel model) {
        if (model.getEntityCount() == 0) {
            throw new IllegalStateException("Collection model contains no entities");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.config + ")";
    }

}
