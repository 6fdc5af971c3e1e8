package eu.virtualparadox.docindex.query;

import eu.virtualparadox.docindex.error.ConfigException;
import eu.virtualparadox.docindex.rag.retriever.model.SearchResult;
import eu.virtualparadox.docindex.rag.retriever.service.ContextExpander;
import eu.virtualparadox.docindex.rag.retriever.service.LexicalRetrieverService;
import eu.virtualparadox.docindex.rag.retriever.service.RegexRetrieverService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static eu.virtualparadox.docindex.util.ContentHashing.looksLikeHash;
import static eu.virtualparadox.docindex.util.ContentHashing.sha256;

/**
 * Public search API.
 * <p>
 * A document is addressed by its content hash or by a path to the file, whose bytes are hashed.
 * Plain queries are answered by BM25 over the token columns, queries written as regular expressions
 * by a regex scan over the document's full text. Unknown documents and queries without matches
 * yield an empty list, never an error.</p>
 */
@Slf4j
@Service
public class QueryManager {

    private static final List<Pattern> REGEX_SYNTAX = List.of(
            Pattern.compile("\\[.*?]"),          // character class [A-Z]
            Pattern.compile("\\{.*?}"),          // quantifier {5,10}
            Pattern.compile("\\("),              // group
            Pattern.compile("\\$"),              // end anchor
            Pattern.compile("\\^"),              // start anchor
            Pattern.compile("\\\\[dDwWsS]"),     // \d \w \s
            Pattern.compile("\\.[*+?]"),         // .* .+ .?
            Pattern.compile("(?<!\")\\|(?!\")")  // alternation outside quotes
    );

    private final LexicalRetrieverService lexicalRetriever;
    private final RegexRetrieverService regexRetriever;
    private final ContextExpander contextExpander;
    private final int defaultMaxResults;
    private final int defaultContextChars;

    public QueryManager(final LexicalRetrieverService lexicalRetriever,
                        final RegexRetrieverService regexRetriever,
                        final ContextExpander contextExpander,
                        @Value("${docindex.search.max-results-default:5}") final int defaultMaxResults,
                        @Value("${docindex.search.context-chars:100}") final int defaultContextChars) {
        if (defaultMaxResults <= 0) {
            throw new ConfigException("docindex.search.max-results-default must be positive, was " + defaultMaxResults);
        }
        if (defaultContextChars < 0) {
            throw new ConfigException("docindex.search.context-chars must not be negative, was " + defaultContextChars);
        }
        this.lexicalRetriever = lexicalRetriever;
        this.regexRetriever = regexRetriever;
        this.contextExpander = contextExpander;
        this.defaultMaxResults = defaultMaxResults;
        this.defaultContextChars = defaultContextChars;
    }

    public List<SearchResult> search(final String pathOrHash, final String query) {
        return search(pathOrHash, query, defaultMaxResults);
    }

    public List<SearchResult> search(final String pathOrHash, final String query, final int maxResults) {
        return search(pathOrHash, query, maxResults, defaultContextChars, false);
    }

    /**
     * Searches one document, or every document when {@code pathOrHash} is {@code null}.
     *
     * @param pathOrHash   content hash or file path of the document
     * @param query        keywords, or a regular expression
     * @param maxResults   maximum number of results, positive
     * @param contextChars minimum snippet length; shorter hits are padded from neighbouring chunks, 0 disables
     * @param useRegex     force regex search even without regex syntax in {@code query}
     * @return ranked results
     */
    public List<SearchResult> search(final String pathOrHash,
                                     final String query,
                                     final int maxResults,
                                     final int contextChars,
                                     final boolean useRegex) {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive");
        }
        if (query == null || query.isBlank()) {
            return List.of();
        }

        final String fileHash;
        if (pathOrHash == null) {
            fileHash = null;
        } else {
            final Optional<String> resolved = resolveHash(pathOrHash);
            if (resolved.isEmpty()) {
                log.debug("Nothing to search for {}", pathOrHash);
                return List.of();
            }
            fileHash = resolved.get();
        }

        if (useRegex || looksLikeRegex(query)) {
            return grep(fileHash, query, maxResults, contextChars);
        }
        final List<SearchResult> hits = lexicalRetriever.search(fileHash, query.trim(), maxResults);
        return contextExpander.expand(hits, contextChars);
    }

    /**
     * Regex search over the full text of one document.
     */
    public List<SearchResult> grep(final String fileHash, final String pattern, final int maxResults, final int contextChars) {
        if (fileHash == null) {
            log.debug("Regex search needs a single document, skipping '{}'", pattern);
            return List.of();
        }
        return regexRetriever.grep(fileHash, pattern, maxResults, contextChars);
    }

    /**
     * @return {@code true} if {@code query} uses syntax that only a regex scan can honour
     */
    public static boolean looksLikeRegex(final String query) {
        return REGEX_SYNTAX.stream().anyMatch(p -> p.matcher(query).find());
    }

    /**
     * A 64-char hex string is taken as a hash; anything else as a path, hashed if the file exists.
     */
    private static Optional<String> resolveHash(final String pathOrHash) {
        if (looksLikeHash(pathOrHash)) {
            return Optional.of(pathOrHash);
        }
        final Path path;
        try {
            path = Path.of(pathOrHash);
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(sha256(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to hash " + path, e);
        }
    }
}
