package eu.virtualparadox.docindex.ingest.tokenizer;

import eu.virtualparadox.docindex.ingest.model.TokenizedText;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Projects text into two independent token streams.
 *
 * <h2>Stemmed stream</h2>
 * Alphabetic and numeric runs, lowercased, diacritics folded to ASCII, stopwords removed and
 * Porter-stemmed ({@code baselines → baselin}). See {@link StemAnalyzer}.
 *
 * <h2>Segmented stream</h2>
 * CJK runs segmented into dictionary words, ASCII words lowercased and passed through. Like a
 * search-mode segmenter, a CJK word longer than two characters additionally yields its bigrams, and runs
 * of adjacent single-character CJK tokens yield their bigrams, so {@code 营收增长} and {@code 营收增长率}
 * share tokens whatever the dictionary decides.
 *
 * <p>Both streams drop tokens shorter than {@link #MIN_TOKEN_LENGTH} characters and tokens in the
 * combined stopword set (when enabled). Both are computed for every chunk at insert time and for every
 * query; there is no language detection.</p>
 *
 * <p>Thread-safe: Lucene analyzers reuse per-thread token streams.</p>
 */
@Slf4j
@Component
public class Tokenizer {

    public static final int MIN_TOKEN_LENGTH = 2;

    private static final String FIELD = "tokens";

    private final CharArraySet stopwords;
    private final Analyzer stemAnalyzer;
    private final Analyzer segmentAnalyzer;

    /**
     * @param useCjkSegmentation dictionary segmentation of CJK runs; bigrams only when {@code false}
     * @param removeStopwords    filter the combined stopword set out of both streams
     * @param extraEnglish       comma-separated additional English stopwords
     * @param extraChinese       comma-separated additional Chinese stopwords
     */
    @Autowired
    public Tokenizer(@Value("${docindex.tokenizer.use-cjk-segmentation:true}") final boolean useCjkSegmentation,
                     @Value("${docindex.tokenizer.remove-stopwords:true}") final boolean removeStopwords,
                     @Value("${docindex.tokenizer.extra-stopwords.en:}") final String extraEnglish,
                     @Value("${docindex.tokenizer.extra-stopwords.zh:}") final String extraChinese) {
        this.stopwords = removeStopwords ? Stopwords.combined(extraEnglish, extraChinese) : null;
        this.stemAnalyzer = new StemAnalyzer(stopwords);
        this.segmentAnalyzer = new SegmentAnalyzer(useCjkSegmentation);
        log.info("Tokenizer ready (cjkSegmentation={}, stopwords={})", useCjkSegmentation, removeStopwords);
    }

    public Tokenizer(final boolean useCjkSegmentation, final boolean removeStopwords) {
        this(useCjkSegmentation, removeStopwords, "", "");
    }

    /**
     * Computes both token streams of {@code text}.
     *
     * @param text input text (null is treated as empty)
     * @return stemmed and segmented tokens, in text order, duplicates kept
     */
    public TokenizedText tokenize(final String text) {
        if (text == null || text.isBlank()) {
            return new TokenizedText(List.of(), List.of());
        }
        return new TokenizedText(stemTokens(text), segTokens(text));
    }

    private List<String> stemTokens(final String text) {
        final List<String> out = new ArrayList<>();
        try (TokenStream ts = stemAnalyzer.tokenStream(FIELD, text)) {
            final CharTermAttribute term = ts.addAttribute(CharTermAttribute.class);
            ts.reset();
            while (ts.incrementToken()) {
                out.add(term.toString());
            }
            ts.end();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to tokenize text", e);
        }
        return out;
    }

    private List<String> segTokens(final String text) {
        final List<String> out = new ArrayList<>();
        final StringBuilder run = new StringBuilder();
        int runEnd = -1;
        try (TokenStream ts = segmentAnalyzer.tokenStream(FIELD, text)) {
            final CharTermAttribute term = ts.addAttribute(CharTermAttribute.class);
            final OffsetAttribute offset = ts.addAttribute(OffsetAttribute.class);
            ts.reset();
            while (ts.incrementToken()) {
                final String token = term.toString();
                final boolean cjk = isCjk(token);
                if (cjk && token.codePointCount(0, token.length()) == 1) {
                    // contiguous single ideographs accumulate into one run
                    if (run.length() > 0 && offset.startOffset() != runEnd) {
                        flushRun(run, out);
                    }
                    run.append(token);
                    runEnd = offset.endOffset();
                    continue;
                }
                flushRun(run, out);
                emit(token, out);
                if (cjk && token.codePointCount(0, token.length()) > 2) {
                    emitBigrams(token, out);
                }
            }
            flushRun(run, out);
            ts.end();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to segment text", e);
        }
        return out;
    }

    private void flushRun(final StringBuilder run, final List<String> out) {
        if (run.length() > 0) {
            emitBigrams(run.toString(), out);
            run.setLength(0);
        }
    }

    private void emitBigrams(final String word, final List<String> out) {
        final int[] cps = word.codePoints().toArray();
        for (int i = 0; i + 1 < cps.length; i++) {
            emit(new String(cps, i, 2), out);
        }
    }

    private void emit(final String token, final List<String> out) {
        if (token.codePointCount(0, token.length()) < MIN_TOKEN_LENGTH) {
            return;
        }
        if (token.codePoints().noneMatch(Character::isLetterOrDigit)) {
            return;
        }
        if (stopwords != null && stopwords.contains(token)) {
            return;
        }
        out.add(token);
    }

    /**
     * True when every code point of {@code token} is Han, kana or Hangul.
     */
    static boolean isCjk(final String token) {
        if (token.isEmpty()) {
            return false;
        }
        return token.codePoints().allMatch(cp -> {
            final Character.UnicodeScript script = Character.UnicodeScript.of(cp);
            return script == Character.UnicodeScript.HAN
                    || script == Character.UnicodeScript.HIRAGANA
                    || script == Character.UnicodeScript.KATAKANA
                    || script == Character.UnicodeScript.HANGUL;
        });
    }

    @PreDestroy
    public void close() {
        stemAnalyzer.close();
        segmentAnalyzer.close();
    }
}
