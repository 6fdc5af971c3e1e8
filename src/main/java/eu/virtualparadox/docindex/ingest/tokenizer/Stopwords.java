package eu.virtualparadox.docindex.ingest.tokenizer;

import org.apache.commons.lang3.StringUtils;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.en.EnglishAnalyzer;

import java.util.Arrays;
import java.util.List;

/**
 * Language-partitioned stopword lists and their combination into one lookup set.
 */
public final class Stopwords {

    /**
     * Function words of modern written Chinese. Single characters are omitted because tokens shorter
     * than two characters are dropped anyway.
     */
    private static final List<String> CHINESE = List.of(
            "一个", "一些", "一种", "一样", "一般", "不是", "不过", "之后", "之前", "也是",
            "以及", "以后", "以前", "但是", "作为", "其中", "只是", "可以", "因为", "因此",
            "如果", "对于", "就是", "已经", "并且", "或者", "所以", "所有", "我们", "你们",
            "他们", "她们", "它们", "这个", "那个", "这些", "那些", "这样", "那样", "这里",
            "那里", "还是", "通过", "由于", "而且", "然后", "虽然", "什么", "怎么", "没有"
    );

    private Stopwords() {
        // prevent instantiation
    }

    /**
     * Lucene's English stop set.
     */
    public static CharArraySet english() {
        return CharArraySet.unmodifiableSet(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
    }

    /**
     * Built-in Chinese stop set.
     */
    public static CharArraySet chinese() {
        return CharArraySet.unmodifiableSet(new CharArraySet(CHINESE, false));
    }

    /**
     * Union of the English and Chinese lists plus user-supplied extras, case-insensitive.
     *
     * @param extraEnglish comma-separated additional English stopwords (may be blank)
     * @param extraChinese comma-separated additional Chinese stopwords (may be blank)
     * @return combined, unmodifiable set
     */
    public static CharArraySet combined(final String extraEnglish, final String extraChinese) {
        final CharArraySet set = new CharArraySet(256, true);
        set.addAll(english());
        set.addAll(chinese());
        set.addAll(parseList(extraEnglish));
        set.addAll(parseList(extraChinese));
        return CharArraySet.unmodifiableSet(set);
    }

    private static List<String> parseList(final String csv) {
        if (StringUtils.isBlank(csv)) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .toList();
    }
}
