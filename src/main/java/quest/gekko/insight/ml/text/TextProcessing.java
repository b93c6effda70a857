package quest.gekko.insight.ml.text;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Title tokenisation shared by clustering, cluster naming and similarity. */
public final class TextProcessing {

    static final Set<String> STOPWORDS = Set.of(
            // en
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "is", "are", "was", "were", "be", "been", "this", "that", "it", "i", "you", "he", "she",
            "we", "they", "video", "vlog", "how", "why", "what",
            // pl
            "w", "z", "o", "na", "do", "dla", "po", "jak", "co", "czy", "jest", "są", "był", "będzie",
            "tam", "ten", "ta", "te", "się", "nie", "ale", "lub", "albo", "film");

    private TextProcessing() {
    }

    /** Lower-cased letter-only tokens longer than two characters, stop words removed. */
    public static List<String> cleanText(String text) {
        if (text == null || text.isBlank()) return List.of();
        String lettersOnly = text.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\s]", "");
        return Arrays.stream(lettersOnly.split("\\s+"))
                .filter(w -> w.length() > 2 && !STOPWORDS.contains(w))
                .toList();
    }

    /** The {@code topN} most frequent tokens, comma separated. Ties keep first-seen order. */
    public static String topWords(List<String> texts, int topN) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String text : texts) {
            for (String word : cleanText(text)) {
                counts.merge(word, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(topN)
                .map(Map.Entry::getKey)
                .collect(Collectors.joining(", "));
    }

    /** Jaccard similarity of the cleaned token sets. */
    public static double similarity(String first, String second) {
        Set<String> a = new HashSet<>(cleanText(first));
        Set<String> b = new HashSet<>(cleanText(second));
        if (a.isEmpty() || b.isEmpty()) return 0;

        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }
}
