package eu.virtualparadox.docindex.application.config;

import eu.virtualparadox.docindex.error.ConfigException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.core.WhitespaceAnalyzer;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.SearcherFactory;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.search.similarities.Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates and manages Lucene resources (Directory, Analyzer, Similarity, IndexWriter, SearcherManager).
 * <p>Resources are opened against the on-disk index under {@code docindex.index}, or an in-memory
 * directory when no path is configured, and closed on shutdown.</p>
 * <p>Token columns are tokenized before they reach Lucene, so the index-side analyzer only splits
 * on whitespace.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private Analyzer analyzer;

    /**
     * Provides the Lucene directory bound to the configured index path.
     *
     * @param props system properties (resolved from application.properties)
     * @return opened {@link Directory}
     * @throws IOException if the path cannot be created or opened
     */
    @Bean
    public Directory luceneDirectory(final ApplicationConfig props) throws IOException {
        final Path indexPath = props.getIndex();
        if (indexPath == null) {
            log.info("No index path configured, using an in-memory Lucene directory");
            this.directory = new ByteBuffersDirectory();
        } else {
            Files.createDirectories(indexPath);
            this.directory = FSDirectory.open(indexPath);
        }
        return this.directory;
    }

    @Bean
    public Analyzer analyzer() {
        this.analyzer = new WhitespaceAnalyzer();
        return this.analyzer;
    }

    /**
     * BM25 with the configured saturation ({@code k1}) and length normalization ({@code b}).
     *
     * @throws ConfigException if {@code k1 < 0} or {@code b} is outside {@code [0, 1]}
     */
    @Bean
    public BM25Similarity similarity(@Value("${docindex.bm25.k1:1.2}") final float k1,
                                 @Value("${docindex.bm25.b:0.75}") final float b) {
        if (!Float.isFinite(k1) || k1 < 0) {
            throw new ConfigException("docindex.bm25.k1 must be a non-negative number, was " + k1);
        }
        if (Float.isNaN(b) || b < 0 || b > 1) {
            throw new ConfigException("docindex.bm25.b must be within [0, 1], was " + b);
        }
        return new BM25Similarity(k1, b);
    }

    /**
     * Provides the Lucene IndexWriter configured for create-or-append mode.
     *
     * @param dir        Lucene directory
     * @param analyzer   text analyzer
     * @param similarity ranking function, also used for norms at index time
     * @return {@link IndexWriter}
     * @throws IOException on writer creation error
     */
    @Bean
    public IndexWriter indexWriter(final Directory dir, final Analyzer analyzer, final Similarity similarity) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND)
                .setSimilarity(similarity);
        this.indexWriter = new IndexWriter(dir, cfg);
        return this.indexWriter;
    }

    /**
     * Provides a {@link SearcherManager} for near-real-time search with the configured similarity.
     *
     * @param writer     index writer
     * @param similarity ranking function
     * @return {@link SearcherManager}
     * @throws IOException on failure
     */
    @Bean
    public SearcherManager searcherManager(final IndexWriter writer, final Similarity similarity) throws IOException {
        this.searcherManager = new SearcherManager(writer, new SearcherFactory() {
            @Override
            public IndexSearcher newSearcher(final IndexReader reader, final IndexReader previousReader) {
                final IndexSearcher searcher = new IndexSearcher(reader);
                searcher.setSimilarity(similarity);
                return searcher;
            }
        });
        return this.searcherManager;
    }

    /**
     * Ensures Lucene resources are closed cleanly on shutdown.
     */
    @PreDestroy
    public void close() {
        try { if (searcherManager != null) searcherManager.close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager", e);
        }

        try { if (indexWriter != null) indexWriter.close(); } catch (Exception e) {
            log.error("Unable to close IndexWriter", e);
        }

        try { if (analyzer != null) analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer", e);
        }

        try { if (directory != null) directory.close(); } catch (Exception e) {
            log.error("Unable to close Directory", e);
        }
    }
}
