package eu.virtualparadox.docindex.ingest.model;

import java.util.List;

/**
 * The two independent token projections of a piece of text.
 *
 * @param stemTokens lowercase, diacritic-free, Porter-stemmed tokens of alphabetic runs
 * @param segTokens  dictionary-segmented CJK words (plus search-mode bigrams) and case-folded ASCII words
 */
public record TokenizedText(List<String> stemTokens, List<String> segTokens) {

    public TokenizedText {
        stemTokens = List.copyOf(stemTokens);
        segTokens = List.copyOf(segTokens);
    }

    public boolean isEmpty() {
        return stemTokens.isEmpty() && segTokens.isEmpty();
    }
}
