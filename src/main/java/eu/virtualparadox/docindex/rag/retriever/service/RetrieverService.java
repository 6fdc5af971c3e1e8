package eu.virtualparadox.docindex.rag.retriever.service;

import eu.virtualparadox.docindex.rag.retriever.model.SearchResult;

import java.util.List;

public interface RetrieverService {

    /**
     * @param fileHash   document to search, or {@code null} for all documents
     * @param query      user query
     * @param maxResults maximum number of results, positive
     * @return ranked results, empty if nothing matches or the document is not indexed
     */
    List<SearchResult> search(final String fileHash, final String query, final int maxResults);

}
