package eu.virtualparadox.docindex.ingest.tokenizer;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.cn.smart.HMMChineseTokenizer;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Analysis chain for the segmented column.
 * <p>With segmentation enabled, CJK runs are split into dictionary words by the smartcn HMM segmenter;
 * otherwise the standard tokenizer emits one token per ideograph and {@link Tokenizer} turns those runs
 * into bigrams. Either way ASCII words come out lowercased and unstemmed.</p>
 */
final class SegmentAnalyzer extends Analyzer {

    private final boolean dictionarySegmentation;

    SegmentAnalyzer(final boolean dictionarySegmentation) {
        this.dictionarySegmentation = dictionarySegmentation;
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final org.apache.lucene.analysis.Tokenizer source = dictionarySegmentation
                ? new HMMChineseTokenizer()
                : new StandardTokenizer();
        final TokenStream ts = new LowerCaseFilter(source);
        return new TokenStreamComponents(source, ts);
    }
}
