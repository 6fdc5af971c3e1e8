package eu.virtualparadox.docindex.rag.retriever.service;

import eu.virtualparadox.docindex.ingest.model.TokenizedText;
import eu.virtualparadox.docindex.ingest.tokenizer.Tokenizer;
import eu.virtualparadox.docindex.rag.index.ETokenColumn;
import eu.virtualparadox.docindex.rag.index.IndexStore;
import eu.virtualparadox.docindex.rag.index.ScoredChunk;
import eu.virtualparadox.docindex.rag.index.StoredChunk;
import eu.virtualparadox.docindex.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * BM25 keyword retriever over the two token columns.
 * <p>
 * Steps:
 * <ol>
 *   <li>Tokenize the query into stemmed and segmented tokens</li>
 *   <li>Search the stemmed column; only if it yields nothing, search the segmented column</li>
 *   <li>Deduplicate by (hash, chunk id), first hit wins</li>
 *   <li>Sort by descending score, ties by ascending chunk id</li>
 *   <li>Return top-k {@link SearchResult} with the stored chunk text</li>
 * </ol>
 */
@Slf4j
@Service
@Primary
@RequiredArgsConstructor
public class LexicalRetrieverService implements RetrieverService {

    private static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble((ScoredChunk c) -> c.rawScore())
            .reversed()
            .thenComparingInt(ScoredChunk::chunkId)
            .thenComparing(ScoredChunk::fileHash);

    private final Tokenizer tokenizer;
    private final IndexStore indexStore;

    @Override
    public List<SearchResult> search(final String fileHash, final String query, final int maxResults) {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive");
        }
        if (query == null || query.isBlank()) {
            return List.of();
        }

        final TokenizedText tokens = tokenizer.tokenize(query);
        // oversample so that ties at the cut are resolved by chunk id, not by index order
        final int limit = maxResults * 2;

        List<ScoredChunk> hits = query(tokens.stemTokens(), ETokenColumn.STEM, fileHash, limit);
        if (hits.isEmpty()) {
            hits = query(tokens.segTokens(), ETokenColumn.SEGMENTED, fileHash, limit);
        }
        log.debug("Query '{}' matched {} chunk(s)", query, hits.size());
        if (hits.isEmpty()) {
            return List.of();
        }

        final Map<String, ScoredChunk> unique = new LinkedHashMap<>();
        for (final ScoredChunk hit : hits) {
            unique.putIfAbsent(hit.fileHash() + '#' + hit.chunkId(), hit);
        }
        final List<ScoredChunk> ranked = unique.values().stream()
                .sorted(RANKING)
                .limit(maxResults)
                .toList();

        return toSearchResults(ranked);
    }

    private List<ScoredChunk> query(final List<String> tokens,
                                    final ETokenColumn column,
                                    final String fileHash,
                                    final int limit) {
        if (tokens.isEmpty()) {
            return List.of();
        }
        return indexStore.query(tokens, column, fileHash, limit);
    }

    /**
     * Loads stored text and unit labels, keeping the ranking order. Chunks deleted since the query
     * are skipped.
     */
    private List<SearchResult> toSearchResults(final List<ScoredChunk> ranked) {
        final Map<String, List<Integer>> idsByHash = new LinkedHashMap<>();
        for (final ScoredChunk hit : ranked) {
            idsByHash.computeIfAbsent(hit.fileHash(), h -> new ArrayList<>()).add(hit.chunkId());
        }
        final Map<String, Map<Integer, StoredChunk>> stored = new HashMap<>();
        idsByHash.forEach((hash, ids) -> stored.put(hash, indexStore.loadChunks(hash, ids)));

        final List<SearchResult> results = new ArrayList<>(ranked.size());
        for (final ScoredChunk hit : ranked) {
            final StoredChunk chunk = stored.get(hit.fileHash()).get(hit.chunkId());
            if (chunk == null) {
                continue;
            }
            results.add(new SearchResult(hit.fileHash(), hit.chunkId(), chunk.unitLabel(), chunk.text(), hit.rawScore()));
        }
        return results;
    }
}
