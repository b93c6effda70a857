package quest.gekko.insight.ml.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextClustererTest {

    private static final List<TextDocument> DOCS = List.of(
            new TextDocument("g1", "Guitar chords for beginners"),
            new TextDocument("g2", "Easy guitar chords"),
            new TextDocument("b1", "Sourdough bread baking"),
            new TextDocument("b2", "Bread baking at home"),
            new TextDocument("m1", "Morning running routine"));

    @Test
    @DisplayName("idf is log(N / (1 + df)) over the first-seen vocabulary")
    void idfFormula() {
        TextClusterer clusterer = new TextClusterer();
        List<TermVector> vectors = clusterer.fitTransform(DOCS);

        Map<String, Integer> vocabulary = clusterer.vocabulary();
        assertThat(vocabulary.keySet()).startsWith("guitar", "chords", "beginners", "easy");
        assertThat(vectors).hasSize(5).extracting(TermVector::id).containsExactly("g1", "g2", "b1", "b2", "m1");

        double[] idf = clusterer.idf();
        assertThat(idf[vocabulary.get("guitar")]).isCloseTo(Math.log(5.0 / 3), within(1e-12));
        assertThat(idf[vocabulary.get("sourdough")]).isCloseTo(Math.log(5.0 / 2), within(1e-12));
    }

    @Test
    @DisplayName("term frequency is normalised by document length")
    void termFrequencyIsNormalisedByDocumentLength() {
        TextClusterer clusterer = new TextClusterer();
        List<TermVector> vectors = clusterer.fitTransform(DOCS);

        int guitar = clusterer.vocabulary().get("guitar");
        // "Easy guitar chords" has three tokens
        assertThat(vectors.get(1).values()[guitar]).isCloseTo(Math.log(5.0 / 3) / 3, within(1e-12));
        assertThat(vectors.get(2).values()[guitar]).isZero();
    }

    @Test
    @DisplayName("well separated groups end up in separate clusters")
    void separatesGroups() {
        List<TermVector> vectors = List.of(
                new TermVector("a1", new double[]{0}),
                new TermVector("a2", new double[]{0.1}),
                new TermVector("a3", new double[]{0.2}),
                new TermVector("b1", new double[]{100}),
                new TermVector("b2", new double[]{100.1}),
                new TermVector("b3", new double[]{100.2}));

        Map<String, Integer> byId = new TextClusterer().kMeans(vectors, 2).stream()
                .collect(Collectors.toMap(ClusterAssignment::documentId, ClusterAssignment::clusterId));

        assertThat(byId.get("a1")).isEqualTo(byId.get("a2")).isEqualTo(byId.get("a3"));
        assertThat(byId.get("b1")).isEqualTo(byId.get("b2")).isEqualTo(byId.get("b3"));
        assertThat(byId.get("a1")).isNotEqualTo(byId.get("b1"));
    }

    @Test
    @DisplayName("same seed, same assignment")
    void deterministic() {
        List<TermVector> vectors = new TextClusterer().fitTransform(DOCS);

        List<ClusterAssignment> first = new TextClusterer(7).kMeans(vectors, 3);
        List<ClusterAssignment> second = new TextClusterer(7).kMeans(vectors, 3);

        assertThat(first).extracting(ClusterAssignment::clusterId)
                .containsExactlyElementsOf(second.stream().map(ClusterAssignment::clusterId).toList());
        assertThat(first).allSatisfy(a -> {
            assertThat(a.clusterId()).isBetween(0, 2);
            assertThat(a.distance()).isGreaterThanOrEqualTo(0);
        });
    }

    @Test
    @DisplayName("cluster count is capped at the number of vectors")
    void clusterCountIsCappedAtVectorCount() {
        List<TermVector> vectors = List.of(
                new TermVector("x", new double[]{1, 0}),
                new TermVector("y", new double[]{0, 1}));

        List<ClusterAssignment> result = new TextClusterer().kMeans(vectors, 10);

        assertThat(result).extracting(ClusterAssignment::clusterId).containsExactlyInAnyOrder(0, 1);
        assertThat(result).allSatisfy(a -> assertThat(a.distance()).isZero());
        assertThat(new TextClusterer().kMeans(List.of(), 3)).isEmpty();
    }
}
