package quest.gekko.insight.ml.text;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * TF-IDF vectoriser plus seeded k-means. Not thread-safe: the vocabulary of the last
 * {@link #fitTransform(List)} call is kept on the instance.
 * <p>
 * IDF is {@code log(N / (1 + df))}, which goes to zero or below for terms present in most documents.
 */
public class TextClusterer {
    public static final long DEFAULT_SEED = 42L;
    public static final int DEFAULT_MAX_ITERATIONS = 20;

    private final long seed;
    private Map<String, Integer> vocabulary = Map.of();
    private double[] idf = new double[0];

    public TextClusterer() {
        this(DEFAULT_SEED);
    }

    public TextClusterer(long seed) {
        this.seed = seed;
    }

    public Map<String, Integer> vocabulary() {
        return Collections.unmodifiableMap(vocabulary);
    }

    public List<TermVector> fitTransform(List<TextDocument> documents) {
        List<List<String>> tokens = documents.stream().map(d -> TextProcessing.cleanText(d.text())).toList();

        Map<String, Integer> vocab = new LinkedHashMap<>();
        for (List<String> doc : tokens) {
            for (String t : doc) vocab.putIfAbsent(t, vocab.size());
        }
        vocabulary = vocab;

        double[] docCounts = new double[vocab.size()];
        for (List<String> doc : tokens) {
            for (String t : new HashSet<>(doc)) docCounts[vocab.get(t)]++;
        }
        idf = new double[vocab.size()];
        for (int i = 0; i < idf.length; i++) {
            idf[i] = Math.log(documents.size() / (1 + docCounts[i]));
        }

        List<TermVector> vectors = new ArrayList<>(documents.size());
        for (int d = 0; d < documents.size(); d++) {
            List<String> doc = tokens.get(d);
            double[] vec = new double[vocab.size()];
            Map<String, Integer> termCounts = new HashMap<>();
            for (String t : doc) termCounts.merge(t, 1, Integer::sum);
            for (Map.Entry<String, Integer> e : termCounts.entrySet()) {
                int idx = vocab.get(e.getKey());
                vec[idx] = (double) e.getValue() / doc.size() * idf[idx];
            }
            vectors.add(new TermVector(documents.get(d).id(), vec));
        }
        return vectors;
    }

    public List<ClusterAssignment> kMeans(List<TermVector> vectors, int k) {
        return kMeans(vectors, k, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Lloyd iterations from centroids chosen by a seeded shuffle. {@code k} is capped at the number
     * of vectors; an emptied cluster keeps its previous centroid.
     */
    public List<ClusterAssignment> kMeans(List<TermVector> vectors, int k, int maxIterations) {
        if (vectors.isEmpty() || k <= 0) return List.of();
        int clusters = Math.min(k, vectors.size());
        int dim = vectors.get(0).values().length;

        List<TermVector> shuffled = new ArrayList<>(vectors);
        Collections.shuffle(shuffled, new Random(seed));
        double[][] centroids = new double[clusters][];
        for (int c = 0; c < clusters; c++) {
            centroids[c] = shuffled.get(c).values().clone();
        }

        int[] assignments = new int[vectors.size()];
        Arrays.fill(assignments, -1);
        for (int iter = 0; iter < maxIterations; iter++) {
            boolean changed = false;
            for (int i = 0; i < vectors.size(); i++) {
                int nearest = nearest(vectors.get(i).values(), centroids);
                if (assignments[i] != nearest) {
                    assignments[i] = nearest;
                    changed = true;
                }
            }
            if (!changed) break;

            double[][] sums = new double[clusters][dim];
            int[] counts = new int[clusters];
            for (int i = 0; i < vectors.size(); i++) {
                int c = assignments[i];
                counts[c]++;
                double[] v = vectors.get(i).values();
                for (int j = 0; j < dim; j++) sums[c][j] += v[j];
            }
            for (int c = 0; c < clusters; c++) {
                if (counts[c] == 0) continue;
                for (int j = 0; j < dim; j++) sums[c][j] /= counts[c];
                centroids[c] = sums[c];
            }
        }

        List<ClusterAssignment> out = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            double[] v = vectors.get(i).values();
            out.add(new ClusterAssignment(vectors.get(i).id(), assignments[i], distance(v, centroids[assignments[i]])));
        }
        return out;
    }

    double[] idf() {
        return idf.clone();
    }

    private static int nearest(double[] v, double[][] centroids) {
        int best = 0;
        double bestDist = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.length; c++) {
            double d = distance(v, centroids[c]);
            if (d < bestDist) {
                bestDist = d;
                best = c;
            }
        }
        return best;
    }

    private static double distance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }
}
