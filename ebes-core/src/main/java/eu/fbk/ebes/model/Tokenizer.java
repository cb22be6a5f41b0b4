package eu.fbk.ebes.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Objects;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Turns text into terms.
 * <p>
 * Text is lower-cased and split on every run of characters that are neither letters nor digits;
 * terms belonging to the configured stopword set are then discarded. The same
 * <tt>Tokenizer</tt> must be used for entity text and query text, otherwise term statistics of
 * the two sides are not comparable.
 * </p>
 */
public final class Tokenizer {

    public static final Set<String> ENGLISH_STOPWORDS = ImmutableSet.of("a", "an", "and", "are",
            "as", "at", "be", "but", "by", "for", "from", "has", "have", "if", "in", "into", "is",
            "it", "its", "no", "not", "of", "on", "or", "such", "that", "the", "their", "then",
            "there", "these", "they", "this", "to", "was", "were", "which", "who", "whom", "will",
            "with");

    public static final Tokenizer DEFAULT = new Tokenizer(ImmutableSet.<String>of());

    private static final Splitter SPLITTER = Splitter.on(
            CharMatcher.JAVA_LETTER_OR_DIGIT.negate()).omitEmptyStrings();

    private final Set<String> stopwords;

    private Tokenizer(final Set<String> stopwords) {
        this.stopwords = ImmutableSet.copyOf(stopwords);
    }

    public static Tokenizer create(@Nullable final Iterable<String> stopwords) {
        return stopwords == null ? DEFAULT : new Tokenizer(ImmutableSet.copyOf(stopwords));
    }

    public Set<String> getStopwords() {
        return this.stopwords;
    }

    public List<String> tokenize(@Nullable final String text) {
        if (text == null || text.isEmpty()) {
            return ImmutableList.of();
        }
        final ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (final String token : SPLITTER.split(text.toLowerCase(Locale.ROOT))) {
            if (!this.stopwords.contains(token)) {
                builder.add(token);
            }
        }
        return builder.build();
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Tokenizer)) {
            return false;
        }
        final Tokenizer other = (Tokenizer) object;
        return this.stopwords.equals(other.stopwords);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.stopwords);
    }

    @Override
    public String toString() {
        return "Tokenizer(" + this.stopwords.size() + " stopwords)";
    }

}
