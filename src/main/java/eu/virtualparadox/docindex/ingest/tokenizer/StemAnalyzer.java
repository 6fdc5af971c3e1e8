package eu.virtualparadox.docindex.ingest.tokenizer;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.core.TypeTokenFilter;
import org.apache.lucene.analysis.en.PorterStemFilter;
import org.apache.lucene.analysis.miscellaneous.ASCIIFoldingFilter;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

import java.util.Set;

/**
 * Analysis chain for the stemmed column:
 * <pre>
 *     StandardTokenizer → keep &lt;ALPHANUM&gt;/&lt;NUM&gt; → lowercase → ASCII folding → stopwords → Porter → length ≥ 2
 * </pre>
 * Ideographic, kana, Hangul and emoji tokens are dropped here; they belong to the segmented column.
 */
final class StemAnalyzer extends Analyzer {

    private static final Set<String> ALPHABETIC_TYPES = Set.of(
            StandardTokenizer.TOKEN_TYPES[StandardTokenizer.ALPHANUM],
            StandardTokenizer.TOKEN_TYPES[StandardTokenizer.NUM]
    );

    /**
     * Stopwords applied before stemming, or {@code null} to keep every token.
     */
    private final CharArraySet stopwords;

    StemAnalyzer(final CharArraySet stopwords) {
        this.stopwords = stopwords;
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final StandardTokenizer source = new StandardTokenizer();
        TokenStream ts = new TypeTokenFilter(source, ALPHABETIC_TYPES, true);
        ts = new LowerCaseFilter(ts);
        ts = new ASCIIFoldingFilter(ts);
        if (stopwords != null) {
            ts = new StopFilter(ts, stopwords);
        }
        ts = new PorterStemFilter(ts);
        ts = new LengthFilter(ts, Tokenizer.MIN_TOKEN_LENGTH, Integer.MAX_VALUE);
        return new TokenStreamComponents(source, ts);
    }
}
