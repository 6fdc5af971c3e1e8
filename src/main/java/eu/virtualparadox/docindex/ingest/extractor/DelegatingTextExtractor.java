package eu.virtualparadox.docindex.ingest.extractor;

import eu.virtualparadox.docindex.error.ExtractionException;
import eu.virtualparadox.docindex.ingest.model.TextUnit;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Routes a file to the format-specific extractor that supports it.
 */
@Service
@Primary
@RequiredArgsConstructor
public final class DelegatingTextExtractor implements TextExtractor {

    private final PdfTextExtractor pdfTextExtractor;
    private final PlainTextExtractor plainTextExtractor;

    @Override
    public List<TextUnit> extract(final Path path) {
        if (pdfTextExtractor.supports(path)) {
            return pdfTextExtractor.extract(path);
        }
        if (plainTextExtractor.supports(path)) {
            return plainTextExtractor.extract(path);
        }
        throw new ExtractionException("Unsupported document format: " + path.getFileName());
    }

    @Override
    public boolean supports(final Path path) {
        return pdfTextExtractor.supports(path) || plainTextExtractor.supports(path);
    }
}
