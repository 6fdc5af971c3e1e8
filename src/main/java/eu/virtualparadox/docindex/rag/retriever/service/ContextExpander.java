package eu.virtualparadox.docindex.rag.retriever.service;

import eu.virtualparadox.docindex.rag.index.IndexStore;
import eu.virtualparadox.docindex.rag.index.StoredChunk;
import eu.virtualparadox.docindex.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pads short hits with text of their neighbouring chunks.
 * <p>
 * A hit shorter than {@code contextChars} gets the tail of the previous chunk and the head of the next
 * chunk, each at most half of the missing characters. Cut neighbours are marked with {@code ...}.</p>
 */
@Component
@RequiredArgsConstructor
public class ContextExpander {

    private static final String ELLIPSIS = "...";

    private final IndexStore indexStore;

    public List<SearchResult> expand(final List<SearchResult> results, final int contextChars) {
        if (results.isEmpty() || contextChars <= 0) {
            return results;
        }

        final List<SearchResult> expanded = new ArrayList<>(results.size());
        for (final SearchResult result : results) {
            final String text = result.text();
            if (text.length() >= contextChars) {
                expanded.add(result);
                continue;
            }

            final int half = (contextChars - text.length()) / 2;
            final int id = result.chunkId();
            final Map<Integer, StoredChunk> neighbours = indexStore.loadChunks(result.fileHash(), List.of(id - 1, id + 1));

            String before = "";
            final StoredChunk previous = neighbours.get(id - 1);
            if (previous != null) {
                before = previous.text();
                if (before.length() > half) {
                    before = ELLIPSIS + before.substring(before.length() - half);
                }
            }

            String after = "";
            final StoredChunk next = neighbours.get(id + 1);
            if (next != null) {
                after = next.text();
                if (after.length() > half) {
                    after = after.substring(0, half) + ELLIPSIS;
                }
            }

            expanded.add(result.withText(before + text + after));
        }
        return expanded;
    }
}
