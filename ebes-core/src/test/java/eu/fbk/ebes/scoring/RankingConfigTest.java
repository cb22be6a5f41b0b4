package eu.fbk.ebes.scoring;

import java.math.MathContext;
import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;

public class RankingConfigTest {

    @Test
    public void testDefaults() {
        final RankingConfig config = RankingConfig.defaultConfig();
        Assert.assertNull(config.getMu());
        Assert.assertEquals(0.4, config.getWeightAttributes(), 0.0);
        Assert.assertEquals(0.4, config.getWeightTypes(), 0.0);
        Assert.assertEquals(0.2, config.getWeightLinks(), 0.0);
        Assert.assertEquals(0.5, config.getAlpha(), 0.0);
        Assert.assertFalse(config.isJaccard());
        Assert.assertEquals(Aggregation.SUM, config.getAggregation());
        Assert.assertEquals(Background.UNIFORM, config.getBackground());
        Assert.assertEquals(64, config.getMathContext().getPrecision());
        Assert.assertFalse(config.isStopwords());
        Assert.assertEquals(config, RankingConfig.builder().build());
        Assert.assertEquals(config, config.toBuilder().build());
    }

    @Test
    public void testValidation() {
        invalid(RankingConfig.builder().weights(0.5, 0.5, 0.5));
        invalid(RankingConfig.builder().weights(1.2, -0.1, -0.1));
        invalid(RankingConfig.builder().alpha(-0.1));
        invalid(RankingConfig.builder().alpha(1.1));
        invalid(RankingConfig.builder().mu(0.0));
        invalid(RankingConfig.builder().mu(Double.NaN));
        invalid(RankingConfig.builder().precision(0));
        invalid(RankingConfig.builder().weightLinks(0.3));

        // tolerance on weight sum
        final RankingConfig config = RankingConfig.builder().weights(0.1, 0.7, 0.2).build();
        Assert.assertEquals(0.7, config.getWeightTypes(), 0.0);
    }

    private static void invalid(final RankingConfig.Builder builder) {
        try {
            builder.build();
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // expected
        }
    }

    @Test
    public void testFromProperties() {
        final Properties properties = new Properties();
        properties.setProperty(RankingConfig.PROPERTY_MU, "100");
        properties.setProperty(RankingConfig.PROPERTY_WEIGHT_ATTRIBUTES, "0.2");
        properties.setProperty(RankingConfig.PROPERTY_WEIGHT_TYPES, "0.6");
        properties.setProperty(RankingConfig.PROPERTY_WEIGHT_LINKS, " 0.2 ");
        properties.setProperty(RankingConfig.PROPERTY_ALPHA, "0.7");
        properties.setProperty(RankingConfig.PROPERTY_JACCARD, "true");
        properties.setProperty(RankingConfig.PROPERTY_AGGREGATION, "max");
        properties.setProperty(RankingConfig.PROPERTY_BACKGROUND, "COLLECTION");
        properties.setProperty(RankingConfig.PROPERTY_PRECISION, "128");
        properties.setProperty(RankingConfig.PROPERTY_STOPWORDS, "TRUE");
        properties.setProperty("unrelated.key", "ignored");

        final RankingConfig config = RankingConfig.fromProperties(properties);
        Assert.assertEquals(100.0, config.getMu(), 0.0);
        Assert.assertEquals(0.6, config.getWeightTypes(), 0.0);
        Assert.assertEquals(0.7, config.getAlpha(), 0.0);
        Assert.assertTrue(config.isJaccard());
        Assert.assertEquals(Aggregation.MAX, config.getAggregation());
        Assert.assertEquals(Background.COLLECTION, config.getBackground());
        Assert.assertEquals(new MathContext(128).getPrecision(), config.getPrecision());
        Assert.assertTrue(config.isStopwords());

        Assert.assertEquals(RankingConfig.defaultConfig(),
                RankingConfig.fromProperties(new Properties()));
    }

    @Test
    public void testFromInvalidProperties() {
        final Properties properties = new Properties();
        properties.setProperty(RankingConfig.PROPERTY_JACCARD, "yes");
        try {
            RankingConfig.fromProperties(properties);
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            Assert.assertTrue(ex.getMessage().contains(RankingConfig.PROPERTY_JACCARD));
        }
        properties.clear();
        properties.setProperty(RankingConfig.PROPERTY_AGGREGATION, "median");
        try {
            RankingConfig.fromProperties(properties);
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            Assert.assertTrue(ex.getMessage().contains(RankingConfig.PROPERTY_AGGREGATION));
        }
    }

}
