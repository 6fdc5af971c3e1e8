package eu.virtualparadox.docindex.query;

import eu.virtualparadox.docindex.error.ConfigException;
import eu.virtualparadox.docindex.ingest.lifecycle.IndexHandle;
import eu.virtualparadox.docindex.ingest.lifecycle.IndexLifecycleManager;
import eu.virtualparadox.docindex.rag.index.IndexStore;
import eu.virtualparadox.docindex.rag.retriever.model.SearchResult;
import eu.virtualparadox.docindex.rag.retriever.service.RegexRetrieverService;
import eu.virtualparadox.docindex.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(TestClockConfig.class)
class QueryManagerTest {

    @Autowired
    private QueryManager queryManager;

    @Autowired
    private IndexLifecycleManager lifecycleManager;

    @Autowired
    private IndexStore indexStore;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        indexStore.listDocuments().forEach(meta -> indexStore.deleteDocument(meta.fileHash()));
    }

    private IndexHandle index(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return lifecycleManager.ensureIndexed(file);
    }

    /**
     * A paragraph of roughly 300 characters that fits in one chunk, but not together with a neighbour.
     */
    private static String paragraph(String topic) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 7; i++) {
            sb.append("Filler sentence ").append(i).append(" mentions the ").append(topic).append(" topic. ");
        }
        return sb.toString().trim();
    }

    @Test
    @DisplayName("Singular query matches plural text through the stemmed column")
    void search_baseline_matchesBaselines() throws IOException {
        IndexHandle handle = index("methods.txt", "The baselines were established in 2020 after a long review.");

        List<SearchResult> results = queryManager.search(handle.fileHash(), "baseline");

        assertEquals(1, results.size());
        assertTrue(results.get(0).text().contains("baselines"));
        assertEquals("paragraph 1", results.get(0).unitLabel());
        assertTrue(results.get(0).score() > 0);
    }

    @Test
    @DisplayName("Chinese query matches a longer compound through the segmented column")
    void search_chineseCompound_matchesSegmentedColumn() throws IOException {
        IndexHandle handle = index("report-zh.txt", "公司今年的营收增长率达到百分之二十，利润也有所提高。");

        List<SearchResult> results = queryManager.search(handle.fileHash(), "营收增长");

        assertFalse(results.isEmpty());
        assertTrue(results.get(0).text().contains("营收增长率"));
    }

    @Test
    @DisplayName("Documents can be addressed by path")
    void search_byPath_resolvesHash() throws IOException {
        Path file = tempDir.resolve("methods.txt");
        Files.writeString(file, "The baselines were established in 2020 after a long review.");
        lifecycleManager.ensureIndexed(file);

        assertEquals(1, queryManager.search(file.toString(), "baseline").size());
        assertTrue(queryManager.search(tempDir.resolve("other.txt").toString(), "baseline").isEmpty());
    }

    @Test
    @DisplayName("Unindexed documents, blank queries and misses give empty results")
    void search_noIndexOrNoMatch_empty() throws IOException {
        IndexHandle handle = index("methods.txt", "The baselines were established in 2020 after a long review.");

        assertTrue(queryManager.search("f".repeat(64), "baseline").isEmpty());
        assertTrue(queryManager.search(handle.fileHash(), "   ").isEmpty());
        assertTrue(queryManager.search(handle.fileHash(), "volcano").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> queryManager.search(handle.fileHash(), "baseline", 0));
    }

    @Test
    @DisplayName("Results are ranked by score and truncated")
    void search_rankedAndTruncated() throws IOException {
        String text = String.join("\n\n",
                paragraph("budget"),
                paragraph("budget forecast"),
                paragraph("budget"),
                paragraph("weather"));
        IndexHandle handle = index("plan.txt", text);
        assertEquals(4, handle.totalChunks());

        List<SearchResult> results = queryManager.search(handle.fileHash(), "budget forecast", 2, 0, false);

        assertEquals(2, results.size());
        assertEquals(1, results.get(0).chunkId());
        assertThat(results.get(0).score()).isGreaterThanOrEqualTo(results.get(1).score());
        assertEquals(0, results.get(1).chunkId(), "equal scores are ordered by chunk id");
    }

    @Test
    @DisplayName("Search without a document spans all documents")
    void search_allDocuments() throws IOException {
        index("a.txt", "Quarterly budget for the marketing department.");
        index("b.txt", "Annual budget for the research department.");

        assertEquals(2, queryManager.search(null, "budget").size());
    }

    @Test
    @DisplayName("Short hits are padded with neighbouring chunks")
    void search_contextExpansion_padsFromNeighbours() throws IOException {
        String text = String.join("\n\n", paragraph("alpha"), paragraph("zebracorn"), paragraph("omega"));
        IndexHandle handle = index("context.txt", text);

        SearchResult plain = queryManager.search(handle.fileHash(), "zebracorn", 1, 0, false).get(0);
        SearchResult expanded = queryManager.search(handle.fileHash(), "zebracorn", 1, plain.text().length() + 100, false).get(0);

        assertEquals(1, plain.chunkId());
        assertTrue(expanded.text().contains(plain.text()));
        assertTrue(expanded.text().startsWith("..."));
        assertTrue(expanded.text().endsWith("..."));
        assertEquals(plain.text().length() + 2 * (50 + 3), expanded.text().length());
        assertTrue(expanded.text().contains("omega"));
    }

    @Test
    @DisplayName("Regex queries scan the full text")
    void search_regex_routesToGrep() throws IOException {
        IndexHandle handle = index("log.txt", "Order 1234 shipped.\nOrder 98 delayed.\nRefund 55 issued.");

        List<SearchResult> results = queryManager.search(handle.fileHash(), "order\\s+\\d+", 5, 5, false);

        assertEquals(2, results.size());
        assertEquals(0, results.get(0).chunkId());
        assertEquals(1, results.get(1).chunkId());
        assertEquals("", results.get(0).unitLabel());
        assertEquals(RegexRetrieverService.MATCH_SCORE, results.get(0).score());
        assertTrue(results.get(0).text().startsWith("Order 1234"));
        assertTrue(results.get(1).text().startsWith("..."));
    }

    @Test
    @DisplayName("Forced regex mode and invalid patterns")
    void search_forcedRegexAndInvalidPattern() throws IOException {
        IndexHandle handle = index("log.txt", "Order 1234 shipped.\nOrder 98 delayed.");

        assertEquals(1, queryManager.search(handle.fileHash(), "delayed", 5, 0, true).size());
        assertTrue(queryManager.search(handle.fileHash(), "order([", 5, 0, false).isEmpty());
    }

    @Test
    @DisplayName("Regex syntax detection")
    void looksLikeRegex_detectsSyntax() {
        assertTrue(QueryManager.looksLikeRegex("rev.*growth"));
        assertTrue(QueryManager.looksLikeRegex("[A-Z]{3}"));
        assertTrue(QueryManager.looksLikeRegex("^Chapter"));
        assertTrue(QueryManager.looksLikeRegex("\\d+ items"));
        assertTrue(QueryManager.looksLikeRegex("cat|dog"));
        assertFalse(QueryManager.looksLikeRegex("revenue growth 2024"));
        assertFalse(QueryManager.looksLikeRegex("section 4.1"));
    }

    @Test
    @DisplayName("Invalid search defaults fail at construction")
    void constructor_invalidDefaults_throwConfigException() {
        assertThrows(ConfigException.class, () -> new QueryManager(null, null, null, 0, 100));
        assertThrows(ConfigException.class, () -> new QueryManager(null, null, null, -3, 100));
        assertThrows(ConfigException.class, () -> new QueryManager(null, null, null, 5, -1));
    }
}
