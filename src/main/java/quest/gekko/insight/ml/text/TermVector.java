package quest.gekko.insight.ml.text;

public record TermVector(String id, double[] values) {
}
