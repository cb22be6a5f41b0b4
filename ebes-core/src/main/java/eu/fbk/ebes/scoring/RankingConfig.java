package eu.fbk.ebes.scoring;

import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Properties;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Ranking parameters.
 * <p>
 * A <tt>RankingConfig</tt> groups the fixed parameters of the scoring models: the Dirichlet
 * smoothing parameter <tt>mu</tt> (null meaning the number of entities of the collection), the
 * field weights of the text mixture model, the interpolation weight <tt>alpha</tt> of the
 * combination, the options of the example-based model and the precision of decimal arithmetic.
 * Instances are immutable and are obtained either via {@link #builder()} or from a
 * {@link Properties} object via {@link #fromProperties(Properties)}; all values are validated at
 * creation time.
 * </p>
 */
public final class RankingConfig {

    public static final String PROPERTY_MU = "ebes.mu";

    public static final String PROPERTY_WEIGHT_ATTRIBUTES = "ebes.weight.attributes";

    public static final String PROPERTY_WEIGHT_TYPES = "ebes.weight.types";

    public static final String PROPERTY_WEIGHT_LINKS = "ebes.weight.links";

    public static final String PROPERTY_ALPHA = "ebes.alpha";

    public static final String PROPERTY_JACCARD = "ebes.jaccard";

    public static final String PROPERTY_AGGREGATION = "ebes.aggregation";

    public static final String PROPERTY_BACKGROUND = "ebes.background";

    public static final String PROPERTY_PRECISION = "ebes.precision";

    public static final String PROPERTY_STOPWORDS = "ebes.stopwords";

    public static final double DEFAULT_WEIGHT_ATTRIBUTES = 0.4;

    public static final double DEFAULT_WEIGHT_TYPES = 0.4;

    public static final double DEFAULT_WEIGHT_LINKS = 0.2;

    public static final double DEFAULT_ALPHA = 0.5;

    public static final boolean DEFAULT_JACCARD = false;

    public static final Aggregation DEFAULT_AGGREGATION = Aggregation.SUM;

    public static final Background DEFAULT_BACKGROUND = Background.UNIFORM;

    public static final int DEFAULT_PRECISION = 64;

    public static final boolean DEFAULT_STOPWORDS = false;

    private static final double WEIGHT_TOLERANCE = 1e-9;

    private static final RankingConfig DEFAULT = builder().build();

    @Nullable
    private final Double mu;

    private final double weightAttributes;

    private final double weightTypes;

    private final double weightLinks;

    private final double alpha;

    private final boolean jaccard;

    private final Aggregation aggregation;

    private final Background background;

    private final int precision;

    private final boolean stopwords;

    private RankingConfig(final Builder builder) {

        final double wa = MoreObjects.firstNonNull(builder.weightAttributes,
                DEFAULT_WEIGHT_ATTRIBUTES);
        final double wt = MoreObjects.firstNonNull(builder.weightTypes, DEFAULT_WEIGHT_TYPES);
        final double wl = MoreObjects.firstNonNull(builder.weightLinks, DEFAULT_WEIGHT_LINKS);
        Preconditions.checkArgument(wa >= 0 && wt >= 0 && wl >= 0,
                "Negative field weight: attributes %s, types %s, links %s", wa, wt, wl);
        Preconditions.checkArgument(Math.abs(wa + wt + wl - 1.0) <= WEIGHT_TOLERANCE,
                "Field weights must sum to 1: attributes %s, types %s, links %s", wa, wt, wl);

        final double alpha = MoreObjects.firstNonNull(builder.alpha, DEFAULT_ALPHA);
        Preconditions.checkArgument(alpha >= 0.0 && alpha <= 1.0, "Invalid alpha %s", alpha);

        final int precision = MoreObjects.firstNonNull(builder.precision, DEFAULT_PRECISION);
        Preconditions.checkArgument(precision > 0, "Invalid precision %s", precision);

        Preconditions.checkArgument(builder.mu == null || builder.mu > 0.0
                && !Double.isInfinite(builder.mu), "Invalid mu %s", builder.mu);

        this.mu = builder.mu;
        this.weightAttributes = wa;
        this.weightTypes = wt;
        this.weightLinks = wl;
        this.alpha = alpha;
        this.jaccard = MoreObjects.firstNonNull(builder.jaccard, DEFAULT_JACCARD);
        this.aggregation = MoreObjects.firstNonNull(builder.aggregation, DEFAULT_AGGREGATION);
        this.background = MoreObjects.firstNonNull(builder.background, DEFAULT_BACKGROUND);
        this.precision = precision;
        this.stopwords = MoreObjects.firstNonNull(builder.stopwords, DEFAULT_STOPWORDS);
    }

    public static RankingConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Creates a configuration out of the properties specified. Missing properties get their
     * default values.
     *
     * @param properties
     *            the properties, using the keys <tt>ebes.*</tt> defined by this class
     * @return the created configuration
     * @throws IllegalArgumentException
     *             if some property value cannot be parsed or is invalid
     */
    public static RankingConfig fromProperties(final Properties properties) {
        final Builder builder = builder();
        builder.mu(parse(properties, PROPERTY_MU, Double.class));
        builder.weightAttributes(parse(properties, PROPERTY_WEIGHT_ATTRIBUTES, Double.class));
        builder.weightTypes(parse(properties, PROPERTY_WEIGHT_TYPES, Double.class));
        builder.weightLinks(parse(properties, PROPERTY_WEIGHT_LINKS, Double.class));
        builder.alpha(parse(properties, PROPERTY_ALPHA, Double.class));
        builder.jaccard(parse(properties, PROPERTY_JACCARD, Boolean.class));
        builder.aggregation(parse(properties, PROPERTY_AGGREGATION, Aggregation.class));
        builder.background(parse(properties, PROPERTY_BACKGROUND, Background.class));
        builder.precision(parse(properties, PROPERTY_PRECISION, Integer.class));
        builder.stopwords(parse(properties, PROPERTY_STOPWORDS, Boolean.class));
        return builder.build();
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    @Nullable
    private static <T> T parse(final Properties properties, final String key, final Class<T> type) {
        final String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        final String trimmed = value.trim();
        try {
            if (type == Double.class) {
                return type.cast(Double.valueOf(trimmed));
            } else if (type == Integer.class) {
                return type.cast(Integer.valueOf(trimmed));
            } else if (type == Boolean.class) {
                Preconditions.checkArgument(trimmed.equalsIgnoreCase("true")
                        || trimmed.equalsIgnoreCase("false"));
                return type.cast(Boolean.valueOf(trimmed));
            } else if (type.isEnum()) {
                return type.cast(Enum.valueOf((Class<Enum>) type, trimmed.toUpperCase(Locale.ROOT)));
            }
        } catch (final IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid value '" + value + "' for property "
                    + key, ex);
        }
        throw new Error("Unexpected type " + type);
    }

    /**
     * Returns the smoothing parameter, or null if it defaults to the number of entities of the
     * collection model.
     *
     * @return the configured mu, null if not set
     */
    @Nullable
    public Double getMu() {
        return this.mu;
    }

    public double getWeightAttributes() {
        return this.weightAttributes;
    }

    public double getWeightTypes() {
        return this.weightTypes;
    }

    public double getWeightLinks() {
        return this.weightLinks;
    }

    public double getAlpha() {
        return this.alpha;
    }

    public boolean isJaccard() {
        return this.jaccard;
    }

    public Aggregation getAggregation() {
        return this.aggregation;
    }

    public Background getBackground() {
        return this.background;
    }

    public int getPrecision() {
        return this.precision;
    }

    public MathContext getMathContext() {
        return new MathContext(this.precision, RoundingMode.HALF_EVEN);
    }

    public boolean isStopwords() {
        return this.stopwords;
    }

    /**
     * Returns a builder initialized with the values of this configuration.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return builder().mu(this.mu).weightAttributes(this.weightAttributes)
                .weightTypes(this.weightTypes).weightLinks(this.weightLinks).alpha(this.alpha)
                .jaccard(this.jaccard).aggregation(this.aggregation)
                .background(this.background).precision(this.precision)
                .stopwords(this.stopwords);
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof RankingConfig)) {
            return false;
        }
        final RankingConfig other = (RankingConfig) object;
        return Objects.equal(this.mu, other.mu)
                && this.weightAttributes == other.weightAttributes
                && this.weightTypes == other.weightTypes
                && this.weightLinks == other.weightLinks && this.alpha == other.alpha
                && this.jaccard == other.jaccard && this.aggregation == other.aggregation
                && this.background == other.background && this.precision == other.precision
                && this.stopwords == other.stopwords;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.mu, this.weightAttributes, this.weightTypes,
                this.weightLinks, this.alpha, this.jaccard, this.aggregation, this.background,
                this.precision, this.stopwords);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("mu", this.mu == null ? "ni" : this.mu)
                .add("weights", this.weightAttributes + "/" + this.weightTypes + "/"
                        + this.weightLinks).add("alpha", this.alpha)
                .add("jaccard", this.jaccard).add("aggregation", this.aggregation)
                .add("background", this.background).add("precision", this.precision)
                .add("stopwords", this.stopwords).toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        @Nullable
        Double mu;

        @Nullable
        Double weightAttributes;

        @Nullable
        Double weightTypes;

        @Nullable
        Double weightLinks;

        @Nullable
        Double alpha;

        @Nullable
        Boolean jaccard;

        @Nullable
        Aggregation aggregation;

        @Nullable
        Background background;

        @Nullable
        Integer precision;

        @Nullable
        Boolean stopwords;

        Builder() {
        }

        public Builder mu(@Nullable final Double mu) {
            this.mu = mu;
            return this;
        }

        public Builder weights(final double attributes, final double types, final double links) {
            this.weightAttributes = attributes;
            this.weightTypes = types;
            this.weightLinks = links;
            return this;
        }

        public Builder weightAttributes(@Nullable final Double weightAttributes) {
            this.weightAttributes = weightAttributes;
            return this;
        }

        public Builder weightTypes(@Nullable final Double weightTypes) {
            this.weightTypes = weightTypes;
            return this;
        }

        public Builder weightLinks(@Nullable final Double weightLinks) {
            this.weightLinks = weightLinks;
            return this;
        }

        public Builder alpha(@Nullable final Double alpha) {
            this.alpha = alpha;
            return this;
        }

        public Builder jaccard(@Nullable final Boolean jaccard) {
            this.jaccard = jaccard;
            return this;
        }

        public Builder aggregation(@Nullable final Aggregation aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        public Builder background(@Nullable final Background background) {
            this.background = background;
            return this;
        }

        public Builder precision(@Nullable final Integer precision) {
            this.precision = precision;
            return this;
        }

        public Builder stopwords(@Nullable final Boolean stopwords) {
            this.stopwords = stopwords;
            return this;
        }

        public RankingConfig build() {
            return new RankingConfig(this);
        }

    }

}
