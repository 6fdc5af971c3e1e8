package eu.virtualparadox.docindex.ingest.extractor;

import eu.virtualparadox.docindex.error.ExtractionException;
import eu.virtualparadox.docindex.ingest.model.EUnitKind;
import eu.virtualparadox.docindex.ingest.model.TextUnit;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * UTF-8 text and markdown extractor. A form feed ({@code \f}) separates units; each unit is a
 * {@link EUnitKind#PARAGRAPH} block numbered from 1.
 */
@Service
public final class PlainTextExtractor implements TextExtractor {

    private static final Set<String> EXTENSIONS = Set.of(".txt", ".text", ".md", ".markdown", ".log", ".csv");

    @Override
    public List<TextUnit> extract(final Path path) {
        final String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExtractionException("Failed to read text file " + path.getFileName(), e);
        }

        final String text = Normalizer.normalize(raw.replace("\r\n", "\n").replace('\r', '\n'), Normalizer.Form.NFC);
        final String[] blocks = text.split("\f", -1);
        final List<TextUnit> units = new ArrayList<>(blocks.length);
        for (int i = 0; i < blocks.length; i++) {
            units.add(new TextUnit(i + 1, EUnitKind.PARAGRAPH, blocks[i]));
        }
        return units;
    }

    @Override
    public boolean supports(final Path path) {
        final String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        final int dot = name.lastIndexOf('.');
        return dot >= 0 && EXTENSIONS.contains(name.substring(dot));
    }
}
