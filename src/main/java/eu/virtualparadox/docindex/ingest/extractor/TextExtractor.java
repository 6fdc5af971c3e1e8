package eu.virtualparadox.docindex.ingest.extractor;

import eu.virtualparadox.docindex.ingest.model.TextUnit;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns a source file into ordered plain-text units. Implementations must be deterministic for
 * identical file bytes.
 */
public interface TextExtractor {

    /**
     * @param path file to read
     * @return ordered units (may be empty)
     * @throws eu.virtualparadox.docindex.error.ExtractionException on unsupported or corrupt input
     */
    List<TextUnit> extract(final Path path);

    /**
     * @param path candidate file
     * @return {@code true} if this extractor understands the file's format
     */
    boolean supports(final Path path);
}
