package eu.fbk.ebes.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.junit.Assert;
import org.junit.Test;

public class TokenizerTest {

    @Test
    public void testTokenize() {
        Assert.assertEquals(ImmutableList.of("neil", "armstrong", "1930"),
                Tokenizer.DEFAULT.tokenize("Neil_Armstrong (1930)"));
        Assert.assertEquals(ImmutableList.of("astronauts", "who", "walked", "on", "the", "moon"),
                Tokenizer.DEFAULT.tokenize("  Astronauts who walked on the Moon!"));
        Assert.assertEquals(ImmutableList.of("moon", "moon"),
                Tokenizer.DEFAULT.tokenize("moon--moon"));
        Assert.assertTrue(Tokenizer.DEFAULT.tokenize("").isEmpty());
        Assert.assertTrue(Tokenizer.DEFAULT.tokenize(" ,;. ").isEmpty());
        Assert.assertTrue(Tokenizer.DEFAULT.tokenize(null).isEmpty());
    }

    @Test
    public void testStopwords() {
        final Tokenizer tokenizer = Tokenizer.create(Tokenizer.ENGLISH_STOPWORDS);
        Assert.assertEquals(ImmutableList.of("astronauts", "walked", "moon"),
                tokenizer.tokenize("Astronauts who walked on the Moon"));
        Assert.assertEquals(tokenizer, Tokenizer.create(ImmutableSet.copyOf(
                Tokenizer.ENGLISH_STOPWORDS)));
        Assert.assertSame(Tokenizer.DEFAULT, Tokenizer.create(null));
    }

}
