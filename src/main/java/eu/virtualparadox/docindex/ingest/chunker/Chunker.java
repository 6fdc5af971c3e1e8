package eu.virtualparadox.docindex.ingest.chunker;

import eu.virtualparadox.docindex.error.ConfigException;
import eu.virtualparadox.docindex.ingest.model.Chunk;
import eu.virtualparadox.docindex.ingest.model.TextUnit;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Content-aware text {@code Chunker} that turns extracted units into bounded, offset-tracked chunks.
 *
 * <h2>Tiers</h2>
 * <ol>
 *   <li><strong>Paragraph tier:</strong> unit text is split on blank lines. Consecutive paragraphs
 *       are packed greedily while the covered span stays within {@code maxChars}; a paragraph
 *       that fits on its own is never cut.</li>
 *   <li><strong>Sentence tier:</strong> an oversized paragraph is split after sentence terminators
 *       (Latin {@code . ! ?} followed by whitespace, CJK {@code 。！？} anywhere). Sentences are
 *       packed greedily up to {@code maxChars}. Common trailing abbreviations ({@code Dr.}, {@code e.g.},
 *       months) do not end a sentence.</li>
 *   <li><strong>Fixed-size tier:</strong> a single sentence longer than {@code maxChars} is cut into
 *       {@code maxChars} windows, consecutive windows sharing {@code overlapChars} characters.</li>
 *   <li><strong>Floor merge:</strong> a chunk shorter than {@code minChars} is merged into the chunk that
 *       follows it, or into its predecessor when it is the last chunk of the unit, unless it is the only
 *       chunk of the unit. The merged chunk may exceed {@code maxChars} by less than {@code minChars} plus
 *       the whitespace between the two.</li>
 * </ol>
 *
 * <h2>Text &amp; offsets</h2>
 * Every chunk is a verbatim slice {@code unit.text[start, end)} with leading and trailing whitespace
 * removed, and its offset is the index of the first kept character inside the unit. Chunks never cross
 * unit boundaries.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * This component is stateless after construction and thus thread-safe. For a given input and
 * configuration the produced boundaries are always identical.
 */
@Component
public class Chunker {

    /**
     * Upper bound on the chunk length (see floor merge for the single exception).
     */
    private final int maxChars;

    /**
     * Number of characters shared by consecutive fixed-size windows.
     */
    private final int overlapChars;

    /**
     * Chunks shorter than this are merged into a neighbour.
     */
    private final int minChars;

    /**
     * Characters that terminate a sentence.
     */
    private final String sentenceTerminators;

    /**
     * Paragraph divider: a line break, optional horizontal whitespace, another line break.
     */
    private static final Pattern BLANK_LINE = Pattern.compile("\\n[\\t\\x0B\\f\\r ]*\\n");

    /**
     * Closing quotes and brackets that stay attached to the sentence they end.
     */
    private static final String CLOSERS = "\"')]}»”’」』）";

    /**
     * Abbreviation guard: a candidate boundary is suppressed when the text just before it ends with
     * one of these tokens followed by a period.
     */
    private static final Pattern ABBREVIATION_PATTERN = Pattern.compile(
            "\\b(?:Dr|Mr|Mrs|Ms|Prof|Sr|Jr|Inc|Ltd|Corp|Co|St|Ave|Blvd|Rd|etc|vs|e\\.g|i\\.e|eg|ie|cf|ca|approx|Fig|Jan|Feb|Mar|Apr|Jun|Jul|Aug|Sep|Sept|Oct|Nov|Dec|U\\.S\\.A|U\\.S|U\\.K|U\\.N)\\.$"
    );

    /**
     * Constructs a {@code Chunker}.
     *
     * @param maxChars            upper bound on chunk length (must be {@code > 0})
     * @param overlapChars        overlap between fixed-size windows ({@code >= 0} and {@code < maxChars})
     * @param minChars            floor for trailing chunks ({@code >= 0} and {@code <= maxChars})
     * @param sentenceTerminators characters ending a sentence (non-empty)
     * @throws ConfigException if constraints are violated
     */
    @Autowired
    public Chunker(@Value("${docindex.chunk.max-size:400}") final int maxChars,
                   @Value("${docindex.chunk.overlap:80}") final int overlapChars,
                   @Value("${docindex.chunk.min-size:50}") final int minChars,
                   @Value("${docindex.chunk.sentence-terminators:.!?。！？}") final String sentenceTerminators) {
        if (maxChars <= 0) {
            throw new ConfigException("chunk max size must be positive, got " + maxChars);
        }
        if (overlapChars < 0 || overlapChars >= maxChars) {
            throw new ConfigException("chunk overlap must be non-negative and less than the max size, got " + overlapChars);
        }
        if (minChars < 0 || minChars > maxChars) {
            throw new ConfigException("chunk min size must be between 0 and the max size, got " + minChars);
        }
        if (sentenceTerminators == null || sentenceTerminators.isEmpty()) {
            throw new ConfigException("sentence terminators must not be empty");
        }
        this.maxChars = maxChars;
        this.overlapChars = overlapChars;
        this.minChars = minChars;
        this.sentenceTerminators = sentenceTerminators;
    }

    /**
     * Convenience constructor with the default sentence terminators.
     */
    public Chunker(final int maxChars, final int overlapChars, final int minChars) {
        this(maxChars, overlapChars, minChars, ".!?。！？");
    }

    /**
     * Chunks all units of a document, numbering chunks document-wide in unit order.
     *
     * @param units ordered units from the extractor (non-null)
     * @return ordered chunks; empty if every unit is blank
     * @throws IllegalArgumentException if {@code units} or one of its elements is null
     */
    public List<Chunk> contentAwareChunks(final List<TextUnit> units) {
        if (units == null) {
            throw new IllegalArgumentException("units cannot be null");
        }
        final List<Chunk> result = new ArrayList<>();
        int seq = 0;
        for (final TextUnit unit : units) {
            if (unit == null) {
                throw new IllegalArgumentException("units cannot contain null");
            }
            final String text = unit.text();
            for (final TextSpan span : splitUnit(text)) {
                result.add(new Chunk(seq++, unit.unitIndex(), unit.kind(), text.substring(span.start, span.end), span.start));
            }
        }
        return result;
    }

    /**
     * Splits a single unit of text into trimmed chunk strings.
     *
     * @param text unit text (non-null)
     * @return ordered chunk texts
     */
    public List<String> split(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        final List<String> out = new ArrayList<>();
        for (final TextSpan span : splitUnit(text)) {
            out.add(text.substring(span.start, span.end));
        }
        return out;
    }

    /**
     * Runs the three tiers plus the floor merge over one unit.
     */
    private List<TextSpan> splitUnit(final String text) {
        final List<TextSpan> chunks = new ArrayList<>();
        if (text.isBlank()) {
            return chunks;
        }

        TextSpan current = null;
        for (final TextSpan paragraph : splitParagraphs(text)) {
            if (paragraph.length() > maxChars) {
                if (current != null) {
                    chunks.add(current);
                    current = null;
                }
                splitParagraph(text, paragraph, chunks);
                continue;
            }
            if (current != null && paragraph.end - current.start > maxChars) {
                chunks.add(current);
                current = null;
            }
            current = current == null ? paragraph : current.union(paragraph);
        }
        if (current != null) {
            chunks.add(current);
        }

        mergeShortChunks(chunks);
        return chunks;
    }

    /**
     * Sentence tier for an oversized paragraph; falls through to fixed windows for oversized sentences.
     */
    private void splitParagraph(final String text, final TextSpan paragraph, final List<TextSpan> out) {
        TextSpan current = null;
        for (final TextSpan sentence : splitSentences(text, paragraph)) {
            if (sentence.length() > maxChars) {
                if (current != null) {
                    out.add(current);
                    current = null;
                }
                splitFixed(text, sentence, out);
                continue;
            }
            if (current != null && sentence.end - current.start > maxChars) {
                out.add(current);
                current = null;
            }
            current = current == null ? sentence : current.union(sentence);
        }
        if (current != null) {
            out.add(current);
        }
    }

    /**
     * Fixed-size windows with {@link #overlapChars} of overlap between neighbours.
     */
    private void splitFixed(final String text, final TextSpan sentence, final List<TextSpan> out) {
        int start = sentence.start;
        while (start < sentence.end) {
            final int end = Math.min(start + maxChars, sentence.end);
            final TextSpan window = trim(text, start, end);
            if (window != null) {
                out.add(window);
            }
            if (end >= sentence.end) {
                break;
            }
            start = end - overlapChars;
        }
    }

    /**
     * Merges every chunk shorter than {@link #minChars} into its successor, or the last one into its
     * predecessor, until only the sole chunk of a unit may stay short.
     * <p>Short chunks appear mid-unit when pending paragraphs or sentences are flushed ahead of an
     * oversized paragraph or sentence.</p>
     */
    private void mergeShortChunks(final List<TextSpan> chunks) {
        int i = 0;
        while (chunks.size() > 1 && i < chunks.size()) {
            final TextSpan chunk = chunks.get(i);
            if (chunk.length() >= minChars) {
                i++;
            } else if (i + 1 < chunks.size()) {
                chunks.set(i, chunk.union(chunks.remove(i + 1)));
            } else {
                chunks.set(i - 1, chunks.get(i - 1).union(chunks.remove(i)));
            }
        }
    }

    /**
     * Splits on blank lines and returns trimmed, non-empty paragraph spans.
     */
    private static List<TextSpan> splitParagraphs(final String text) {
        final List<TextSpan> paragraphs = new ArrayList<>();
        final Matcher matcher = BLANK_LINE.matcher(text);
        int lastEnd = 0;
        while (matcher.find()) {
            addTrimmed(text, lastEnd, matcher.start(), paragraphs);
            lastEnd = matcher.end();
        }
        addTrimmed(text, lastEnd, text.length(), paragraphs);
        return paragraphs;
    }

    /**
     * Splits a paragraph into sentence spans.
     *
     * <p>A boundary is placed after a run of terminators (and any closing quotes) when the terminator is
     * a full-width CJK mark, or when the run is followed by whitespace or the end of the paragraph. Latin
     * periods preceded by a known abbreviation are not boundaries.</p>
     */
    private List<TextSpan> splitSentences(final String text, final TextSpan paragraph) {
        final List<TextSpan> sentences = new ArrayList<>();
        int sentenceStart = paragraph.start;
        int i = paragraph.start;
        while (i < paragraph.end) {
            final char c = text.charAt(i);
            if (sentenceTerminators.indexOf(c) < 0) {
                i++;
                continue;
            }
            final int terminatorPos = i;
            int boundary = i + 1;
            while (boundary < paragraph.end
                    && (sentenceTerminators.indexOf(text.charAt(boundary)) >= 0 || CLOSERS.indexOf(text.charAt(boundary)) >= 0)) {
                boundary++;
            }
            final boolean fullWidth = c > 0x2FFF;
            final boolean followedBySpace = boundary >= paragraph.end || Character.isWhitespace(text.charAt(boundary));
            if ((fullWidth || followedBySpace) && !isAbbreviation(text, sentenceStart, terminatorPos)) {
                addTrimmed(text, sentenceStart, boundary, sentences);
                sentenceStart = boundary;
            }
            i = boundary;
        }
        addTrimmed(text, sentenceStart, paragraph.end, sentences);
        return sentences;
    }

    /**
     * Checks whether the period at {@code terminatorPos} closes a known abbreviation.
     */
    private static boolean isAbbreviation(final String text, final int sentenceStart, final int terminatorPos) {
        if (text.charAt(terminatorPos) != '.') {
            return false;
        }
        final String beforeSplit = text.substring(Math.max(sentenceStart, terminatorPos - 20), terminatorPos + 1).trim();
        return ABBREVIATION_PATTERN.matcher(beforeSplit).find();
    }

    private static void addTrimmed(final String text, final int start, final int end, final List<TextSpan> out) {
        final TextSpan span = trim(text, start, end);
        if (span != null) {
            out.add(span);
        }
    }

    /**
     * Shrinks {@code [start, end)} to exclude surrounding whitespace.
     *
     * @return trimmed span, or {@code null} if the range is blank
     */
    private static TextSpan trim(final String text, final int start, final int end) {
        int s = start;
        int e = end;
        while (s < e && Character.isWhitespace(text.charAt(s))) {
            s++;
        }
        while (e > s && Character.isWhitespace(text.charAt(e - 1))) {
            e--;
        }
        return s < e ? new TextSpan(s, e) : null;
    }
}
