package eu.virtualparadox.docindex.ingest.extractor;

import eu.virtualparadox.docindex.error.ExtractionException;
import eu.virtualparadox.docindex.ingest.model.EUnitKind;
import eu.virtualparadox.docindex.ingest.model.TextUnit;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * PDF extractor built on Apache PDFBox. Emits one {@link EUnitKind#PAGE} unit per page (1-based),
 * NFC-normalized, with paragraphs separated by blank lines so the chunker's paragraph tier applies.
 */
@Service
public final class PdfTextExtractor implements TextExtractor {

    @Override
    public List<TextUnit> extract(final Path path) {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();
            stripper.setLineSeparator("\n");
            stripper.setParagraphEnd("\n");

            final List<TextUnit> units = new ArrayList<>(pageCount);
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageTextRaw = stripper.getText(pdf);
                final String pageText = Normalizer.normalize(pageTextRaw, Normalizer.Form.NFC);
                units.add(new TextUnit(page, EUnitKind.PAGE, pageText));
            }
            return units;
        }
        catch (IOException e) {
            throw new ExtractionException("Failed to extract text from PDF " + path.getFileName(), e);
        }
    }

    @Override
    public boolean supports(final Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }
}
