package eu.virtualparadox.docindex.rag.retriever.service;

import eu.virtualparadox.docindex.rag.index.IndexStore;
import eu.virtualparadox.docindex.rag.retriever.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static eu.virtualparadox.docindex.util.ContentHashing.abbreviate;

/**
 * Regular-expression search over the full text of one document.
 * <p>
 * Matching is case-insensitive and multiline. Each match is returned with up to {@code contextChars}
 * characters on both sides, elided ends marked with {@code ...}. Regex hits carry no relevance:
 * the chunk id is the match ordinal, the unit label is empty and the score is {@value #MATCH_SCORE}.</p>
 */
@Slf4j
@Service
public class RegexRetrieverService implements RetrieverService {

    public static final float MATCH_SCORE = 100f;

    private static final String ELLIPSIS = "...";

    private final IndexStore indexStore;
    private final int defaultContextChars;

    public RegexRetrieverService(final IndexStore indexStore,
                                 @Value("${docindex.search.context-chars:100}") final int defaultContextChars) {
        this.indexStore = indexStore;
        this.defaultContextChars = Math.max(0, defaultContextChars);
    }

    /**
     * Same as {@link #grep(String, String, int, int)} with the configured context width.
     */
    @Override
    public List<SearchResult> search(final String fileHash, final String pattern, final int maxResults) {
        return grep(fileHash, pattern, maxResults, defaultContextChars);
    }

    /**
     * @param fileHash     document to search; regex search needs a single document
     * @param pattern      Java regular expression
     * @param maxResults   maximum number of matches, positive
     * @param contextChars characters of context on each side of a match
     * @return matches in text order; empty for an unknown document or an invalid pattern
     */
    public List<SearchResult> grep(final String fileHash, final String pattern, final int maxResults, final int contextChars) {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive");
        }
        if (fileHash == null || pattern == null || pattern.isEmpty()) {
            return List.of();
        }

        final Optional<String> fullText = indexStore.loadFullText(fileHash);
        if (fullText.isEmpty() || fullText.get().isEmpty()) {
            log.debug("No full text stored for {}", abbreviate(fileHash));
            return List.of();
        }

        final Pattern compiled;
        try {
            compiled = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE);
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regex pattern '{}': {}", pattern, e.getDescription());
            return List.of();
        }

        final String text = fullText.get();
        final int context = Math.max(0, contextChars);
        final List<SearchResult> results = new ArrayList<>();
        final Matcher matcher = compiled.matcher(text);
        int ordinal = 0;
        while (results.size() < maxResults && matcher.find()) {
            final int from = Math.max(0, matcher.start() - context);
            final int to = Math.min(text.length(), matcher.end() + context);

            final StringBuilder snippet = new StringBuilder();
            if (from > 0) {
                snippet.append(ELLIPSIS);
            }
            snippet.append(text, from, to);
            if (to < text.length()) {
                snippet.append(ELLIPSIS);
            }
            results.add(new SearchResult(fileHash, ordinal++, "", snippet.toString(), MATCH_SCORE));
        }
        return results;
    }
}
